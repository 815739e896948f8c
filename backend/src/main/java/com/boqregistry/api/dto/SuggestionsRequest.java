package com.boqregistry.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Rule candidates for review. minConfidence defaults from configuration.
 */
public record SuggestionsRequest(
        @NotNull(message = "INVALID_ITEMS") List<@Valid BoqItemPayload> items,
        @Min(value = 0, message = "INVALID_THRESHOLD") @Max(value = 100, message = "INVALID_THRESHOLD") Integer minConfidence
) {
}
