package com.boqregistry.api.dto;

import com.boqregistry.domain.ClassificationOverride;

import java.time.Instant;

public record OverrideResponse(String code, String category, Instant createdAt, Instant updatedAt) {

    public static OverrideResponse from(ClassificationOverride override) {
        return new OverrideResponse(override.getCode(), override.getCategory(), override.getCreatedAt(),
                override.getUpdatedAt());
    }
}
