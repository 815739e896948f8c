package com.boqregistry.classification.engine;

import com.boqregistry.domain.ClassificationMode;
import com.boqregistry.domain.RowRole;

import java.util.Map;

/**
 * @param confirmed       user confirmed a destructive RECLASSIFY_ALL run
 * @param fallbackEnabled consult the AI fallback for rows rules cannot classify
 * @param minConfidence   rule and AI fallback answers below this confidence leave the row unclassified; overrides
 *                        always apply
 * @param roleCorrections user-corrected roles by item id, applied before roles are derived
 */
public record ClassificationOptions(
        ClassificationMode mode,
        boolean confirmed,
        boolean fallbackEnabled,
        int minConfidence,
        Map<String, RowRole> roleCorrections
) {

    public ClassificationOptions {
        mode = mode == null ? ClassificationMode.CLASSIFY_EMPTY : mode;
        roleCorrections = roleCorrections == null ? Map.of() : Map.copyOf(roleCorrections);
    }

    public ClassificationOptions(ClassificationMode mode, boolean confirmed, boolean fallbackEnabled) {
        this(mode, confirmed, fallbackEnabled, 0, Map.of());
    }

    public static ClassificationOptions classifyEmpty() {
        return new ClassificationOptions(ClassificationMode.CLASSIFY_EMPTY, false, false);
    }

    public static ClassificationOptions reclassifyAll(boolean confirmed) {
        return new ClassificationOptions(ClassificationMode.RECLASSIFY_ALL, confirmed, false);
    }

    public ClassificationOptions withFallback(boolean enabled) {
        return new ClassificationOptions(mode, confirmed, enabled, minConfidence, roleCorrections);
    }

    public ClassificationOptions withMinConfidence(int threshold) {
        return new ClassificationOptions(mode, confirmed, fallbackEnabled, threshold, roleCorrections);
    }

    public ClassificationOptions withRoleCorrections(Map<String, RowRole> corrections) {
        return new ClassificationOptions(mode, confirmed, fallbackEnabled, minConfidence, corrections);
    }
}
