package com.boqregistry.api.dto;

import java.util.List;

public record OverrideListResponse(String projectId, int count, List<OverrideResponse> overrides) {
}
