package com.boqregistry.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for classification_overrides. One document per (projectId, code).
 */
public interface ClassificationOverrideRepository extends MongoRepository<ClassificationOverride, String> {

    List<ClassificationOverride> findByProjectIdOrderByCodeAsc(String projectId);

    Optional<ClassificationOverride> findByProjectIdAndCode(String projectId, String code);

    long countByProjectId(String projectId);

    /** Bulk clear for one project; returns number of removed documents. */
    long deleteByProjectId(String projectId);
}
