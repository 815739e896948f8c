package com.boqregistry.classification.rules;

import com.boqregistry.common.TextNormalizer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Keyword scoring of an item against category rules.
 * <pre>
 *   +1.0 per include keyword found in the normalized text (keyword becomes evidence)
 *   -2.0 per exclude keyword found
 *   +0.5 when the unit is in unitBoost
 *   +0.5 once when a codeBoost marker appears in the raw text
 * </pre>
 * An exclude hit outweighs two include hits, which keeps mutually exclusive groups (monolithic vs precast concrete)
 * apart. Scores are exact decimals so ties compare reliably.
 */
@Component
public class RuleScoringEngine {

    public static final BigDecimal INCLUDE_WEIGHT = new BigDecimal("1.0");
    public static final BigDecimal EXCLUDE_PENALTY = new BigDecimal("2.0");
    public static final BigDecimal UNIT_BOOST = new BigDecimal("0.5");
    public static final BigDecimal CODE_BOOST = new BigDecimal("0.5");
    public static final String GENERAL_WORK_TYPE = "GENERAL";

    private static final BigDecimal FULL_CONFIDENCE_SCORE = new BigDecimal("2.0");
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    /**
     * Score one rule.
     *
     * @param normalizedText description text after {@link TextNormalizer#normalizeAll}
     * @param rawText        original text, used for case-sensitive code markers only (may be null)
     * @param unit           item unit (raw, normalized here; may be null)
     */
    public CategoryScore score(String normalizedText, String rawText, String unit, CategoryRule rule) {
        BigDecimal score = BigDecimal.ZERO;
        List<String> evidence = new ArrayList<>();
        String text = normalizedText == null ? "" : normalizedText;

        for (String keyword : rule.include()) {
            if (text.contains(keyword)) {
                score = score.add(INCLUDE_WEIGHT);
                evidence.add(keyword);
            }
        }
        for (String keyword : rule.exclude()) {
            if (text.contains(keyword)) {
                score = score.subtract(EXCLUDE_PENALTY);
            }
        }
        if (unit != null && !rule.unitBoost().isEmpty()
                && rule.unitBoost().contains(TextNormalizer.normalizeUnit(unit))) {
            score = score.add(UNIT_BOOST);
        }
        if (rawText != null) {
            for (String marker : rule.codeBoost()) {
                if (rawText.contains(marker)) {
                    score = score.add(CODE_BOOST);
                    evidence.add(marker);
                    break;
                }
            }
        }
        return new CategoryScore(rule.category(), score, evidence);
    }

    /**
     * Score every rule of the table, in declaration order.
     */
    public List<CategoryScore> scoreAll(String description, String fullDescription, String unit, RuleTable table) {
        String normalized = TextNormalizer.normalizeAll(description, fullDescription);
        String raw = joinRaw(description, fullDescription);
        List<CategoryScore> scores = new ArrayList<>(table.size());
        for (CategoryRule rule : table.rules()) {
            scores.add(score(normalized, raw, unit, rule));
        }
        return scores;
    }

    /**
     * Display confidence 0..100: score / 2.0 * 100, clamped and rounded half-up.
     */
    public static int confidence(BigDecimal score) {
        if (score == null || score.signum() <= 0) {
            return 0;
        }
        BigDecimal pct = score.multiply(HUNDRED).divide(FULL_CONFIDENCE_SCORE, 0, RoundingMode.HALF_UP);
        return pct.min(HUNDRED).intValue();
    }

    /**
     * Subtype of the rule with the most marker hits; GENERAL when the rule has no subtypes or none matched.
     * Ties keep the first declared subtype.
     */
    public String workType(String normalizedText, CategoryRule rule) {
        String best = GENERAL_WORK_TYPE;
        int bestHits = 0;
        String text = normalizedText == null ? "" : normalizedText;
        for (Map.Entry<String, List<String>> subtype : rule.subtypes().entrySet()) {
            int hits = 0;
            for (String keyword : subtype.getValue()) {
                if (text.contains(keyword)) {
                    hits++;
                }
            }
            if (hits > bestHits) {
                bestHits = hits;
                best = subtype.getKey();
            }
        }
        return best;
    }

    private static String joinRaw(String description, String fullDescription) {
        if (description == null) {
            return fullDescription;
        }
        return fullDescription == null ? description : description + " " + fullDescription;
    }
}
