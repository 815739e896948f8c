package com.boqregistry.api.dto;

import com.boqregistry.classification.suggestion.SimilarCategorySuggestion;

import java.util.List;

/**
 * @param category null when no categorized row is similar enough
 */
public record SimilarSuggestionResponse(
        String itemId,
        String category,
        int confidence,
        int similarCount,
        List<SimilarRow> topSimilar
) {

    public record SimilarRow(String itemId, String category, int similarity) {
    }

    public static SimilarSuggestionResponse from(SimilarCategorySuggestion suggestion) {
        return new SimilarSuggestionResponse(suggestion.itemId(), suggestion.category(), suggestion.confidence(),
                suggestion.similarCount(), suggestion.topSimilar().stream()
                .map(m -> new SimilarRow(m.item().getId(), m.item().getCategory(), m.similarity()))
                .toList());
    }
}
