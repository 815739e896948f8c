package com.boqregistry.classification.fallback;

import java.util.Optional;

/**
 * Used when boqregistry.classification.fallback.enabled=false (rules-only mode).
 */
public class DisabledFallbackClassifier implements FallbackClassifier {

    @Override
    public Optional<FallbackSuggestion> suggest(FallbackRequest request) {
        return Optional.empty();
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
