package com.boqregistry.api.dto;

public record ClearOverridesResponse(String projectId, long removed) {
}
