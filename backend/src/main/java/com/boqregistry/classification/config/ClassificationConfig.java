package com.boqregistry.classification.config;

import com.boqregistry.classification.fallback.DisabledFallbackClassifier;
import com.boqregistry.classification.fallback.FallbackClassifier;
import com.boqregistry.classification.fallback.WebClientFallbackClassifier;
import com.boqregistry.classification.rules.RuleTable;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Rule table and AI fallback wiring. An invalid rule table fails application startup.
 */
@Configuration
@EnableConfigurationProperties({ ClassificationRulesProperties.class, FallbackProperties.class, SimilarityProperties.class,
        SuggestionProperties.class })
@Slf4j
public class ClassificationConfig {

    @Bean
    public RuleTable ruleTable(ClassificationRulesProperties properties) {
        RuleTable table = properties.toRuleTable();
        log.info("Loaded classification rule table with {} work groups", table.size());
        return table;
    }

    @Bean(name = "fallbackRateLimiter")
    public RateLimiter fallbackRateLimiter(FallbackProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("ai-fallback", config);
    }

    /** No-op classifier unless enabled with a URL. */
    @Bean
    public FallbackClassifier fallbackClassifier(FallbackProperties properties, WebClient.Builder webClientBuilder,
                                                 RateLimiter fallbackRateLimiter, ObjectMapper objectMapper) {
        if (!properties.isEnabled() || properties.getUrl() == null || properties.getUrl().isBlank()) {
            log.info("AI fallback disabled; rules-only classification");
            return new DisabledFallbackClassifier();
        }
        log.info("AI fallback enabled at {}", properties.getUrl());
        return new WebClientFallbackClassifier(webClientBuilder, properties.getUrl(),
                Duration.ofMillis(properties.getTimeoutMs()), fallbackRateLimiter, objectMapper);
    }
}
