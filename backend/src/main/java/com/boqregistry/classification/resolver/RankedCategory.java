package com.boqregistry.classification.resolver;

import java.math.BigDecimal;
import java.util.List;

/**
 * One positively scoring category of an item, as offered for manual review.
 *
 * @param confidence 0..100 from the adjusted score
 * @param evidence   up to {@link PriorityConflictResolver#MAX_EVIDENCE} matched keywords
 */
public record RankedCategory(
        String category,
        BigDecimal rawScore,
        BigDecimal adjustedScore,
        int confidence,
        List<String> evidence
) {

    public RankedCategory {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
