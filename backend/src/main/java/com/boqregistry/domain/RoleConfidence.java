package com.boqregistry.domain;

/**
 * How distinctive the signals behind a row role were.
 */
public enum RoleConfidence {
    HIGH,
    MEDIUM,
    LOW
}
