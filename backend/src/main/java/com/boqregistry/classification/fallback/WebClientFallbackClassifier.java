package com.boqregistry.classification.fallback;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * HTTP client for the AI classification service. POST {description, unit, context} → {category, confidence, evidence}.
 * Calls are throttled by a Resilience4j rate limiter and bounded by a timeout; any failure degrades to "no answer".
 */
@Slf4j
public class WebClientFallbackClassifier implements FallbackClassifier {

    static final String UNKNOWN_CATEGORY = "unknown";

    private final WebClient webClient;
    private final String url;
    private final Duration timeout;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public WebClientFallbackClassifier(WebClient.Builder webClientBuilder, String url, Duration timeout,
                                       RateLimiter rateLimiter, ObjectMapper objectMapper) {
        this.webClient = webClientBuilder.build();
        this.url = url;
        this.timeout = timeout;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<FallbackSuggestion> suggest(FallbackRequest request) {
        if (!rateLimiter.acquirePermission()) {
            log.warn("AI fallback rate limit reached; skipping row '{}'", request.description());
            return Optional.empty();
        }
        try {
            String response = webClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(timeout);
            Optional<FallbackSuggestion> suggestion = parseSuggestion(response, objectMapper);
            log.debug("AI fallback for '{}' -> {}", request.description(), suggestion.map(FallbackSuggestion::category).orElse("none"));
            return suggestion;
        } catch (WebClientResponseException e) {
            log.warn("AI fallback failed with HTTP {} for '{}': {}", e.getStatusCode().value(), request.description(), e.getMessage());
            return Optional.empty();
        } catch (Exception e) {
            log.warn("AI fallback error for '{}'", request.description(), e);
            return Optional.empty();
        }
    }

    /**
     * Parse the service response. Blank or "unknown" categories mean no answer. Confidence is a percentage 0..100;
     * values below 1 and a decimal 1.0 are read as fractions. An integral 1 stays 1%. Returned as 0..100.
     */
    static Optional<FallbackSuggestion> parseSuggestion(String json, ObjectMapper mapper) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode root = mapper.readTree(json);
            String category = root.path("category").asText("").strip();
            if (category.isEmpty() || UNKNOWN_CATEGORY.equalsIgnoreCase(category)) {
                return Optional.empty();
            }
            JsonNode confidenceNode = root.path("confidence");
            double rawConfidence = confidenceNode.asDouble(0);
            boolean fraction = rawConfidence < 1.0 || (rawConfidence == 1.0 && confidenceNode.isFloatingPointNumber());
            int confidence = (int) Math.round(fraction ? rawConfidence * 100 : rawConfidence);
            confidence = Math.max(0, Math.min(100, confidence));
            List<String> evidence = new ArrayList<>();
            for (JsonNode e : root.path("evidence")) {
                if (e.isTextual()) {
                    evidence.add(e.asText());
                }
            }
            return Optional.of(new FallbackSuggestion(category, confidence, evidence));
        } catch (Exception e) {
            log.warn("Unparseable AI fallback response: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
