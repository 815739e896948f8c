package com.boqregistry.classification.suggestion;

import com.boqregistry.classification.resolver.PriorityConflictResolver;
import com.boqregistry.classification.resolver.RankedCategory;
import com.boqregistry.classification.rules.RuleScoringEngine;
import com.boqregistry.classification.rules.RuleTable;
import com.boqregistry.classification.similarity.SimilarItemMatch;
import com.boqregistry.classification.similarity.SimilarItemMatcher;
import com.boqregistry.domain.BoqItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only helpers for manual review. Nothing here writes a category.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClassificationSuggester {

    public static final int TOP_SIMILAR = 3;

    private final RuleScoringEngine ruleScoringEngine;
    private final PriorityConflictResolver priorityConflictResolver;
    private final SimilarItemMatcher similarItemMatcher;

    /**
     * Ranked rule candidates at or above {@code minConfidence} for every uncategorized row. Rows without such a
     * candidate are left out.
     */
    public List<ItemSuggestions> suggest(List<BoqItem> items, RuleTable rules, int minConfidence) {
        List<ItemSuggestions> suggestions = new ArrayList<>();
        for (BoqItem item : items) {
            if (item.hasCategory()) {
                continue;
            }
            List<RankedCategory> candidates = rank(item, rules).stream()
                    .filter(candidate -> candidate.confidence() >= minConfidence)
                    .toList();
            if (!candidates.isEmpty()) {
                suggestions.add(new ItemSuggestions(item.getId(), candidates));
            }
        }
        log.debug("Suggested categories for {} of {} rows at {}%", suggestions.size(), items.size(), minConfidence);
        return suggestions;
    }

    public List<RankedCategory> rank(BoqItem item, RuleTable rules) {
        return priorityConflictResolver.rank(
                ruleScoringEngine.scoreAll(item.getDescription(), item.getFullDescription(), item.getUnit(), rules),
                rules);
    }

    /**
     * Majority vote among categorized rows similar to {@code target}. On equal counts the category of the more
     * similar row wins.
     */
    public SimilarCategorySuggestion suggestFromSimilar(BoqItem target, List<BoqItem> items, int minConfidence,
                                                        int maxResults) {
        List<SimilarItemMatch> similar = similarItemMatcher.findSimilarClassified(target, items, minConfidence,
                maxResults);
        if (similar.isEmpty()) {
            return SimilarCategorySuggestion.none(target.getId());
        }
        Map<String, Integer> votes = new LinkedHashMap<>();
        for (SimilarItemMatch match : similar) {
            votes.merge(match.item().getCategory(), 1, Integer::sum);
        }
        String category = null;
        int best = 0;
        for (Map.Entry<String, Integer> vote : votes.entrySet()) {
            if (vote.getValue() > best) {
                best = vote.getValue();
                category = vote.getKey();
            }
        }
        int confidence = (int) Math.round((double) best / similar.size() * similar.get(0).similarity());
        return new SimilarCategorySuggestion(target.getId(), category, confidence, similar.size(),
                similar.subList(0, Math.min(TOP_SIMILAR, similar.size())));
    }

    public ClassificationStats stats(List<BoqItem> items) {
        int total = items.size();
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (BoqItem item : items) {
            if (item.hasCategory()) {
                counts.merge(item.getCategory(), 1, Integer::sum);
            }
        }
        int classified = counts.values().stream().mapToInt(Integer::intValue).sum();
        List<GroupShare> distribution = counts.entrySet().stream()
                .map(e -> new GroupShare(e.getKey(), e.getValue(), percentage(e.getValue(), total)))
                .sorted(Comparator.comparingInt(GroupShare::count).reversed()
                        .thenComparing(GroupShare::category))
                .toList();
        int rate = total == 0 ? 0 : (int) Math.round(classified * 100.0 / total);
        return new ClassificationStats(total, classified, total - classified, rate, distribution);
    }

    private static double percentage(int count, int total) {
        return Math.round(count * 1000.0 / total) / 10.0;
    }
}
