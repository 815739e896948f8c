package com.boqregistry.domain;

/**
 * Where the category of an item came from in one classification run.
 */
public enum ClassificationSource {
    OVERRIDE,
    RULE,
    AI_FALLBACK,
    CASCADE,
    SIMILARITY,
    NONE
}
