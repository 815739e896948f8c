package com.boqregistry.classification.resolver;

import com.boqregistry.classification.rules.CategoryRule;
import com.boqregistry.classification.rules.CategoryScore;
import com.boqregistry.classification.rules.RuleScoringEngine;
import com.boqregistry.classification.rules.RuleTable;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the winning category among the rule scores of one item.
 * <ol>
 *   <li>scores &lt;= 0 are discarded;</li>
 *   <li>each surviving category gets +0.3 per priorityOver target that also survived;</li>
 *   <li>highest adjusted score wins, ties go to higher rule priority, then to earlier declaration.</li>
 * </ol>
 * Stateless across items; the result does not depend on the order of the input scores.
 */
@Component
public class PriorityConflictResolver {

    public static final BigDecimal PRIORITY_BONUS = new BigDecimal("0.3");
    public static final int MAX_EVIDENCE = 4;

    public Resolution resolve(List<CategoryScore> scores, RuleTable table) {
        List<RankedCategory> ranked = rank(scores, table);
        if (ranked.isEmpty()) {
            return Resolution.unclassified();
        }
        RankedCategory winner = ranked.get(0);
        return new Resolution(winner.category(), winner.rawScore(), winner.adjustedScore(), winner.confidence(),
                winner.evidence());
    }

    /**
     * Every positively scoring category with its priority bonus applied, best first in the same order that decides
     * the winner.
     */
    public List<RankedCategory> rank(List<CategoryScore> scores, RuleTable table) {
        Map<String, CategoryScore> positive = new LinkedHashMap<>();
        for (CategoryScore score : scores) {
            if (score.isPositive()) {
                positive.put(score.category(), score);
            }
        }
        if (positive.isEmpty()) {
            return List.of();
        }

        Map<String, BigDecimal> adjusted = new LinkedHashMap<>();
        for (CategoryScore score : positive.values()) {
            adjusted.put(score.category(), score.score().add(bonus(score.category(), positive, table)));
        }

        Comparator<String> ranking = Comparator
                .comparing((String c) -> adjusted.get(c))
                .thenComparingInt(c -> priority(c, table))
                .thenComparing(Comparator.<String>comparingInt(table::declarationIndex).reversed());
        List<RankedCategory> ranked = new ArrayList<>(positive.size());
        for (String category : adjusted.keySet().stream().sorted(ranking.reversed()).toList()) {
            CategoryScore raw = positive.get(category);
            BigDecimal finalScore = adjusted.get(category);
            List<String> evidence = raw.evidence().size() > MAX_EVIDENCE
                    ? raw.evidence().subList(0, MAX_EVIDENCE)
                    : raw.evidence();
            ranked.add(new RankedCategory(category, raw.score(), finalScore, RuleScoringEngine.confidence(finalScore),
                    evidence));
        }
        return ranked;
    }

    /**
     * +0.3 for every outranked category that also scored positively.
     */
    BigDecimal bonus(String category, Map<String, CategoryScore> positive, RuleTable table) {
        BigDecimal bonus = BigDecimal.ZERO;
        Optional<CategoryRule> rule = table.find(category);
        if (rule.isEmpty()) {
            return bonus;
        }
        for (String target : rule.get().priorityOver()) {
            if (positive.containsKey(target)) {
                bonus = bonus.add(PRIORITY_BONUS);
            }
        }
        return bonus;
    }

    private static int priority(String category, RuleTable table) {
        return table.find(category).map(CategoryRule::priority).orElse(0);
    }
}
