package com.boqregistry.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Suggest a category for {@code itemId} from the categorized rows that resemble it.
 */
public record SimilarSuggestionRequest(
        @NotBlank(message = "INVALID_ITEM") String itemId,
        @NotNull(message = "INVALID_ITEMS") List<@Valid BoqItemPayload> items,
        @Min(value = 0, message = "INVALID_THRESHOLD") @Max(value = 100, message = "INVALID_THRESHOLD") Integer minConfidence,
        @Min(value = 1, message = "INVALID_THRESHOLD") Integer maxResults
) {
}
