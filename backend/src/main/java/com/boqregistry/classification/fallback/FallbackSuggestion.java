package com.boqregistry.classification.fallback;

import java.util.List;

/**
 * Category proposed by the external AI classifier. Treated like a rule match for cascade; never recorded as override.
 *
 * @param confidence 0..100
 */
public record FallbackSuggestion(String category, int confidence, List<String> evidence) {

    public FallbackSuggestion {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
