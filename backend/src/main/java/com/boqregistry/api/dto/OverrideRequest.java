package com.boqregistry.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * PUT /projects/{projectId}/overrides body. {@code confirmed} must be true; the user explicitly asked to remember
 * this decision.
 */
public record OverrideRequest(
        @NotBlank(message = "INVALID_OVERRIDE") String code,
        @NotBlank(message = "INVALID_OVERRIDE") String category,
        boolean confirmed
) {
}
