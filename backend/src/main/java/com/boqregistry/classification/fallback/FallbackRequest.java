package com.boqregistry.classification.fallback;

import java.util.List;

/**
 * Payload sent to the external AI classifier for one unresolved row.
 *
 * @param description description of the main row (full description when present)
 * @param unit        unit of measure, may be null
 * @param context     descriptions of the subordinate rows beneath it
 */
public record FallbackRequest(String description, String unit, List<String> context) {

    public FallbackRequest {
        context = context == null ? List.of() : List.copyOf(context);
    }
}
