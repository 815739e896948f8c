package com.boqregistry.classification.role;

/**
 * Row counts per role for a batch.
 *
 * @param maxBoqLineNumber highest MAIN row number of any sheet
 */
public record RowRoleStats(
        int totalItems,
        int mainItems,
        int subordinateItems,
        int sectionItems,
        int unknownItems,
        int maxBoqLineNumber
) {

    public static final RowRoleStats EMPTY = new RowRoleStats(0, 0, 0, 0, 0, 0);

    public RowRoleStats plus(RowRoleStats other) {
        return new RowRoleStats(
                totalItems + other.totalItems,
                mainItems + other.mainItems,
                subordinateItems + other.subordinateItems,
                sectionItems + other.sectionItems,
                unknownItems + other.unknownItems,
                Math.max(maxBoqLineNumber, other.maxBoqLineNumber));
    }
}
