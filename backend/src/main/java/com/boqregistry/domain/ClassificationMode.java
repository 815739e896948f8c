package com.boqregistry.domain;

/**
 * Batch entry points. RECLASSIFY_ALL discards prior manual work and needs explicit caller confirmation.
 */
public enum ClassificationMode {
    CLASSIFY_EMPTY,
    RECLASSIFY_ALL
}
