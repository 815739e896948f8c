package com.boqregistry.api.dto;

import com.boqregistry.classification.rules.CategoryRule;

import java.util.List;

/**
 * Configured work groups in declaration order. Keywords are shown in normalized form.
 */
public record RuleTableResponse(int count, List<CategoryRule> rules) {
}
