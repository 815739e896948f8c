package com.boqregistry.classification.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults for "apply to similar items".
 */
@ConfigurationProperties(prefix = "boqregistry.classification.similarity")
@NoArgsConstructor
@Getter
@Setter
public class SimilarityProperties {

    /** Minimum similarity 0..100. Default 70. */
    private int minConfidence = 70;

    /** Cap on items changed by one request. Default 50. */
    private int maxResults = 50;
}
