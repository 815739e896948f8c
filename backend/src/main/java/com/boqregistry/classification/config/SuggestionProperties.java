package com.boqregistry.classification.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults for review suggestions.
 */
@ConfigurationProperties(prefix = "boqregistry.classification.suggestions")
@NoArgsConstructor
@Getter
@Setter
public class SuggestionProperties {

    /** Lowest rule confidence offered as a candidate, 0..100. Default 50. */
    private int minConfidence = 50;

    /** Categorized rows that vote on a similarity suggestion. Default 10. */
    private int similarMaxResults = 10;
}
