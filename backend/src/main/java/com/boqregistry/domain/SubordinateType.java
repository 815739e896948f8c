package com.boqregistry.domain;

/**
 * Kind of a SUBORDINATE row, derived from its code and description.
 * REPEAT: sub-index of the parent code (A195, B5).
 * NOTE: text without quantity or price.
 * CALCULATION: quantity breakdown or arithmetic (2*5, 15,200*0,030, celkem).
 * OTHER: explicit VV/PP/PSC markers and unrecognised code formats.
 */
public enum SubordinateType {
    REPEAT,
    NOTE,
    CALCULATION,
    OTHER
}
