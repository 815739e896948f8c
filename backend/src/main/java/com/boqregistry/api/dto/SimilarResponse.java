package com.boqregistry.api.dto;

import com.boqregistry.classification.engine.ItemClassification;

import java.util.List;

/**
 * @param applied rows that received the category, similar rows first, then their subordinates
 */
public record SimilarResponse(List<BoqItemPayload> items, List<ItemClassification> applied) {
}
