package com.boqregistry.classification.resolver;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of conflict resolution for one item. {@code category == null} means unclassified.
 *
 * @param rawScore      winner's score before priority bonuses
 * @param adjustedScore winner's score including priority bonuses
 * @param confidence    0..100, derived from adjustedScore
 * @param evidence      up to {@link PriorityConflictResolver#MAX_EVIDENCE} matched keywords of the winner
 */
public record Resolution(
        String category,
        BigDecimal rawScore,
        BigDecimal adjustedScore,
        int confidence,
        List<String> evidence
) {

    private static final Resolution UNCLASSIFIED = new Resolution(null, BigDecimal.ZERO, BigDecimal.ZERO, 0, List.of());

    public Resolution {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    public static Resolution unclassified() {
        return UNCLASSIFIED;
    }

    public boolean isClassified() {
        return category != null;
    }
}
