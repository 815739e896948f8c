package com.boqregistry.classification.engine;

import com.boqregistry.classification.role.RowRoleStats;
import com.boqregistry.domain.BoqItem;
import com.boqregistry.domain.ClassificationSource;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one classification run.
 *
 * @param items           all items in input order, with categories applied
 * @param classifications decisions for the items targeted by the run
 * @param changed         items whose category changed
 * @param unchanged       items whose category stayed the same (targeted or not)
 * @param classified      targeted items that ended with a category
 * @param unclassified    targeted items that ended without a category
 * @param bySource        targeted items per decision source
 * @param groupCounts     items per category after the run, all items, sorted by category
 * @param roleStats       rows per structural role
 */
public record BatchClassificationResult(
        List<BoqItem> items,
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
