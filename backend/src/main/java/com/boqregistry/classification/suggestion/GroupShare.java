package com.boqregistry.classification.suggestion;

/**
 * @param percentage share of all rows, one decimal place
 */
public record GroupShare(String category, int count, double percentage) {
}
