package com.boqregistry.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Apply the category of {@code sourceItemId} to similar uncategorized rows. Thresholds default from configuration.
 */
public record SimilarRequest(
        @NotBlank(message = "INVALID_ITEM") String sourceItemId,
        @NotNull(message = "INVALID_ITEMS") List<@Valid BoqItemPayload> items,
        @Min(value = 0, message = "INVALID_THRESHOLD") @Max(value = 100, message = "INVALID_THRESHOLD") Integer minConfidence,
        @Min(value = 1, message = "INVALID_THRESHOLD") Integer maxResults
) {
}
