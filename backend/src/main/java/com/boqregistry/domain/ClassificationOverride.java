package com.boqregistry.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * User-confirmed category for a catalog code within one project. Stored in classification_overrides;
 * takes precedence over rule scoring. Code is stored in normalized form (TextNormalizer.normalizeCode).
 */
@Document(collection = "classification_overrides")
@CompoundIndex(name = "project_code", def = "{'projectId': 1, 'code': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ClassificationOverride {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String projectId;
    private String code;
    private String category;
    private Instant createdAt;
    private Instant updatedAt;
}
