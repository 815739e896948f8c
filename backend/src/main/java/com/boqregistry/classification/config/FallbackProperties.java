package com.boqregistry.classification.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Optional AI fallback for rows left unclassified by rules. Disabled by default (rules-only mode).
 */
@ConfigurationProperties(prefix = "boqregistry.classification.fallback")
@NoArgsConstructor
@Getter
@Setter
public class FallbackProperties {

    private boolean enabled = false;

    /** Classification endpoint, e.g. https://concrete-agent.example/api/v1/classify. */
    private String url;

    /** Per-call timeout in ms. Default 10s. */
    private long timeoutMs = 10_000;

    /** Local throttle for outgoing calls. */
    private int maxRequestsPerSecond = 5;

    /** How long a call may wait for a rate-limiter permit before it is skipped. */
    private long limiterTimeoutMs = 2_000;
}
