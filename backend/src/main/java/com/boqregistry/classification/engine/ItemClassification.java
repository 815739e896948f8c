package com.boqregistry.classification.engine;

import com.boqregistry.domain.ClassificationSource;

import java.util.List;
import java.util.Objects;

/**
 * Decision for one item of a run. {@code category == null} means unclassified.
 *
 * @param confidence      0..100
 * @param workType        subtype within the work group, GENERAL when none matched, null when unclassified
 * @param cascadeSourceId row the category was inherited from (CASCADE only)
 */
public record ItemClassification(
        String itemId,
        String previousCategory,
        String category,
        ClassificationSource source,
        int confidence,
        List<String> evidence,
        String workType,
        String cascadeSourceId
) {

    public ItemClassification {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    public boolean isChanged() {
        return !Objects.equals(previousCategory, category);
    }

    public boolean isClassified() {
        return category != null;
    }
}
