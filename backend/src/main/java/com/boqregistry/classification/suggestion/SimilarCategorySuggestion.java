package com.boqregistry.classification.suggestion;

import com.boqregistry.classification.similarity.SimilarItemMatch;

import java.util.List;

/**
 * Category most common among categorized rows that resemble a target row.
 *
 * @param category     null when no categorized row is similar enough
 * @param confidence   share of the winning category among the similar rows times the best similarity, 0..100
 * @param similarCount categorized rows that took part in the vote
 * @param topSimilar   the best {@value ClassificationSuggester#TOP_SIMILAR} of them
 */
public record SimilarCategorySuggestion(
        String itemId,
        String category,
        int confidence,
        int similarCount,
        List<SimilarItemMatch> topSimilar
) {

    public SimilarCategorySuggestion {
        topSimilar = List.copyOf(topSimilar);
    }

    public static SimilarCategorySuggestion none(String itemId) {
        return new SimilarCategorySuggestion(itemId, null, 0, 0, List.of());
    }
}
