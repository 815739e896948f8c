package com.boqregistry.api.dto;

import com.boqregistry.classification.engine.ItemClassification;
import com.boqregistry.classification.role.RowRoleStats;
import com.boqregistry.domain.ClassificationSource;

import java.util.List;
import java.util.Map;

public record ClassifyResponse(
        List<BoqItemPayload> items,
        List<ItemClassification> classifications,
        int changed,
        int unchanged,
        int classified,
        int unclassified,
        Map<ClassificationSource, Integer> bySource,
        Map<String, Integer> groupCounts,
        RowRoleStats roleStats
) {
}
