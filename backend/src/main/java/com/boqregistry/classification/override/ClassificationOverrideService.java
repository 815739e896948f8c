package com.boqregistry.classification.override;

import com.boqregistry.classification.ClassificationException;
import com.boqregistry.common.TextNormalizer;
import com.boqregistry.domain.ClassificationOverride;
import com.boqregistry.domain.ClassificationOverrideRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Project-scoped override memory. Overrides are persisted in classification_overrides and served from an in-process
 * {@link OverrideStore} per project (loaded lazily, kept in the overrideStoreCache). Learning is opt-in: an override
 * is only recorded when the caller passes the user's explicit confirmation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClassificationOverrideService {

    public static final String OVERRIDE_STORE_CACHE = "overrideStoreCache";

    private final ClassificationOverrideRepository overrideRepository;
    private final CacheManager cacheManager;

    /**
     * Live store of the project. Callers classifying a batch should take {@link OverrideStore#snapshot()}.
     */
    public OverrideStore storeFor(String projectId) {
        Cache cache = cacheManager.getCache(OVERRIDE_STORE_CACHE);
        if (cache == null) {
            return load(projectId);
        }
        return cache.get(projectId, () -> load(projectId));
    }

    /**
     * Remember {@code category} for {@code code} in the project.
     *
     * @param confirmed the user explicitly asked for this decision to be remembered
     * @throws ClassificationException CONSENT_REQUIRED when not confirmed; INVALID_OVERRIDE for blank code/category
     */
    public ClassificationOverride recordOverride(String projectId, String code, String category, boolean confirmed) {
        if (!confirmed) {
            throw new ClassificationException(ClassificationException.CONSENT_REQUIRED,
                    "Override for code " + code + " was not confirmed by the user");
        }
        String key = TextNormalizer.normalizeCode(code);
        if (key.isEmpty()) {
            throw new ClassificationException(ClassificationException.INVALID_OVERRIDE, "Override code must not be blank");
        }
        if (category == null || category.isBlank()) {
            throw new ClassificationException(ClassificationException.INVALID_OVERRIDE, "Override category must not be blank");
        }
        OverrideStore store = storeFor(projectId);

        Instant now = Instant.now();
        ClassificationOverride override = overrideRepository.findByProjectIdAndCode(projectId, key)
                .orElseGet(() -> {
                    ClassificationOverride created = new ClassificationOverride();
                    created.setProjectId(projectId);
                    created.setCode(key);
                    created.setCreatedAt(now);
                    return created;
                });
        String previous = override.getCategory();
        override.setCategory(category.strip());
        override.setUpdatedAt(now);
        ClassificationOverride saved = overrideRepository.save(override);

        store.record(key, saved.getCategory());
        log.info("Override recorded for project {}: code {} -> {} (was {})", projectId, key, saved.getCategory(), previous);
        return saved;
    }

    /**
     * Remove all overrides of the project.
     *
     * @return number of removed overrides
     */
    public long clearOverrides(String projectId) {
        long removed = overrideRepository.deleteByProjectId(projectId);
        storeFor(projectId).clear();
        log.info("Cleared {} overrides for project {}", removed, projectId);
        return removed;
    }

    public List<ClassificationOverride> listOverrides(String projectId) {
        return overrideRepository.findByProjectIdOrderByCodeAsc(projectId);
    }

    private OverrideStore load(String projectId) {
        Map<String, String> entries = new LinkedHashMap<>();
        for (ClassificationOverride o : overrideRepository.findByProjectIdOrderByCodeAsc(projectId)) {
            if (o.getCode() != null && o.getCategory() != null) {
                entries.put(o.getCode(), o.getCategory());
            }
        }
        log.debug("Loaded {} overrides for project {}", entries.size(), projectId);
        return OverrideStore.of(entries);
    }
}
