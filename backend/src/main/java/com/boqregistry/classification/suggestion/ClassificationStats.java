package com.boqregistry.classification.suggestion;

import java.util.List;

/**
 * Category coverage of a set of rows.
 *
 * @param classificationRate classified rows as a rounded percentage of all rows
 * @param groupDistribution  rows per category, largest group first
 */
public record ClassificationStats(
        int totalItems,
        int classified,
        int unclassified,
        int classificationRate,
        List<GroupShare> groupDistribution
) {

    public ClassificationStats {
        groupDistribution = List.copyOf(groupDistribution);
    }
}
