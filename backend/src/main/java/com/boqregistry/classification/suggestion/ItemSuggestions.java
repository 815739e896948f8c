package com.boqregistry.classification.suggestion;

import com.boqregistry.classification.resolver.RankedCategory;

import java.util.List;

/**
 * Candidate categories for one uncategorized row, best first.
 */
public record ItemSuggestions(String itemId, List<RankedCategory> candidates) {

    public ItemSuggestions {
        candidates = List.copyOf(candidates);
    }
}
