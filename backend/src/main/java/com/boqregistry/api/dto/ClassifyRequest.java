package com.boqregistry.api.dto;

import com.boqregistry.classification.engine.ClassificationOptions;
import com.boqregistry.domain.ClassificationMode;
import com.boqregistry.domain.RowRole;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

/**
 * POST /projects/{projectId}/classification body. Mode defaults to CLASSIFY_EMPTY, minConfidence to 0.
 *
 * @param roleCorrections roles the user corrected, by item id; such roles are never recomputed
 */
public record ClassifyRequest(
        ClassificationMode mode,
        boolean confirmed,
        boolean aiFallback,
        @Min(value = 0, message = "INVALID_THRESHOLD") @Max(value = 100, message = "INVALID_THRESHOLD") Integer minConfidence,
        Map<String, RowRole> roleCorrections,
        @NotNull(message = "INVALID_ITEMS") List<@Valid BoqItemPayload> items
) {

    public ClassificationOptions toOptions() {
        return new ClassificationOptions(mode, confirmed, aiFallback, minConfidence == null ? 0 : minConfidence,
                roleCorrections);
    }
}
