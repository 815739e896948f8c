package com.boqregistry.classification.similarity;

import com.boqregistry.common.TextNormalizer;
import com.boqregistry.domain.BoqItem;
import com.boqregistry.domain.RowRole;
import org.apache.commons.text.similarity.JaroWinklerSimilarity;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Finds MAIN/SECTION rows whose description resembles a source row. Similarity is Jaro-Winkler of the
 * normalized descriptions, scaled to 0..100.
 */
@Component
public class SimilarItemMatcher {

    private static final JaroWinklerSimilarity JARO_WINKLER = new JaroWinklerSimilarity();

    private static final Comparator<SimilarItemMatch> BEST_FIRST = Comparator
            .comparingInt(SimilarItemMatch::similarity).reversed()
            .thenComparingInt(m -> m.item().getRowPosition())
            .thenComparing(m -> m.item().getId(), Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * Uncategorized candidates at or above {@code minConfidence}, best first, at most {@code maxResults}.
     */
    public List<SimilarItemMatch> findSimilar(BoqItem source, Collection<BoqItem> items, int minConfidence, int maxResults) {
        return match(source, items, item -> !item.hasCategory(), minConfidence, maxResults);
    }

    /**
     * Already categorized rows resembling {@code source}; the voters for a category suggestion.
     */
    public List<SimilarItemMatch> findSimilarClassified(BoqItem source, Collection<BoqItem> items, int minConfidence,
                                                        int maxResults) {
        return match(source, items, BoqItem::hasCategory, minConfidence, maxResults);
    }

    private List<SimilarItemMatch> match(BoqItem source, Collection<BoqItem> items, Predicate<BoqItem> candidate,
                                         int minConfidence, int maxResults) {
        if (maxResults <= 0) {
            return List.of();
        }
        String sourceText = descriptionText(source);
        return items.stream()
                .filter(item -> item != source && !Objects.equals(item.getId(), source.getId()))
                .filter(candidate)
                .filter(item -> item.getRole() == RowRole.MAIN || item.getRole() == RowRole.SECTION)
                .map(item -> new SimilarItemMatch(item, similarity(sourceText, descriptionText(item))))
                .filter(match -> match.similarity() >= minConfidence)
                .sorted(BEST_FIRST)
                .limit(maxResults)
                .toList();
    }

    /**
     * 0 when either text is empty.
     */
    public int similarity(String normalizedA, String normalizedB) {
        if (normalizedA.isEmpty() || normalizedB.isEmpty()) {
            return 0;
        }
        return (int) Math.round(JARO_WINKLER.apply(normalizedA, normalizedB) * 100);
    }

    static String descriptionText(BoqItem item) {
        String description = TextNormalizer.isBlank(item.getDescription()) ? item.getFullDescription() : item.getDescription();
        return TextNormalizer.normalize(description);
    }
}
