package com.boqregistry.domain;

/**
 * Structural role of a BOQ row within its sheet.
 * MAIN: priced, coded work item; cascade source.
 * SUBORDINATE: note, sub-calculation or continuation line; inherits the category of the row above.
 * SECTION: heading/divider without price; cascade source and cascade boundary.
 * UNKNOWN: empty row; never scored.
 */
public enum RowRole {
    MAIN,
    SUBORDINATE,
    SECTION,
    UNKNOWN;

    /** MAIN and SECTION rows start a cascade run and terminate the previous one. */
    public boolean isCascadeSource() {
        return this == MAIN || this == SECTION;
    }
}
