package com.boqregistry.classification.fallback;

import java.util.Optional;

/**
 * External classifier consulted only for rows that rule scoring leaves unclassified.
 */
public interface FallbackClassifier {

    /**
     * Ask for a category.
     *
     * @return suggestion, or empty when the service has no answer, fails or is unavailable
     */
    Optional<FallbackSuggestion> suggest(FallbackRequest request);

    /**
     * False when no service is configured; the engine then skips the fallback step entirely.
     */
    default boolean isAvailable() {
        return true;
    }
}
