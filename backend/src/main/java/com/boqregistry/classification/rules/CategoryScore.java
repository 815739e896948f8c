package com.boqregistry.classification.rules;

import java.math.BigDecimal;
import java.util.List;

/**
 * Raw score of one rule against one item, with the include keywords (and code markers) that matched.
 */
public record CategoryScore(String category, BigDecimal score, List<String> evidence) {

    public CategoryScore {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    public boolean isPositive() {
        return score.signum() > 0;
    }
}
