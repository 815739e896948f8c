package com.boqregistry.classification.cascade;

import com.boqregistry.classification.ClassificationException;
import com.boqregistry.domain.BoqItem;
import com.boqregistry.domain.RowRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Row adjacency for category cascade. A category resolved on a MAIN or SECTION row extends to the SUBORDINATE rows
 * that directly follow it (by row position), up to the next MAIN or SECTION row. UNKNOWN rows inside a run are
 * skipped. Runs never cross sheets and never go backwards, so the runs of a sheet are disjoint.
 */
@Component
@Slf4j
public class CascadePropagator {

    private static final String DEFAULT_SHEET = "";

    /**
     * Split items by sheet (first-seen order) and order each sheet by row position.
     *
     * @throws ClassificationException DUPLICATE_ROW_POSITION if two rows of one sheet share a position
     */
    public Map<String, List<BoqItem>> orderSheets(Collection<BoqItem> items) {
        Map<String, List<BoqItem>> bySheet = new LinkedHashMap<>();
        for (BoqItem item : items) {
            String sheet = item.getSheetId() == null ? DEFAULT_SHEET : item.getSheetId();
            bySheet.computeIfAbsent(sheet, k -> new ArrayList<>()).add(item);
        }
        Map<String, List<BoqItem>> ordered = new LinkedHashMap<>();
        bySheet.forEach((sheet, sheetItems) -> ordered.put(sheet, orderSheet(sheet, sheetItems)));
        return ordered;
    }

    /**
     * Order one sheet by row position.
     *
     * @throws ClassificationException DUPLICATE_ROW_POSITION if two rows share a position
     */
    public List<BoqItem> orderSheet(String sheetId, Collection<BoqItem> sheetItems) {
        List<BoqItem> sorted = new ArrayList<>(sheetItems);
        sorted.sort(Comparator.comparingInt(BoqItem::getRowPosition));
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).getRowPosition() == sorted.get(i - 1).getRowPosition()) {
                throw new ClassificationException(ClassificationException.DUPLICATE_ROW_POSITION,
                        "Rows " + sorted.get(i - 1).getId() + " and " + sorted.get(i).getId()
                                + " share row position " + sorted.get(i).getRowPosition()
                                + (DEFAULT_SHEET.equals(sheetId) ? "" : " in sheet " + sheetId));
            }
        }
        return sorted;
    }

    /**
     * Indices of the rows that inherit the category of the row at {@code startIndex}. Empty when the start row is not
     * a cascade source. Depends only on roles and order, never on current categories.
     *
     * @param orderedSheet one sheet ordered by row position (see {@link #orderSheet})
     */
    public List<Integer> cascadeTargets(List<BoqItem> orderedSheet, int startIndex) {
        if (startIndex < 0 || startIndex >= orderedSheet.size()) {
            throw new IllegalArgumentException("startIndex out of range: " + startIndex);
        }
        RowRole sourceRole = orderedSheet.get(startIndex).getRole();
        if (sourceRole == null || !sourceRole.isCascadeSource()) {
            return List.of();
        }
        List<Integer> targets = new ArrayList<>();
        for (int i = startIndex + 1; i < orderedSheet.size(); i++) {
            RowRole role = orderedSheet.get(i).getRole();
            if (role != null && role.isCascadeSource()) {
                break;
            }
            if (role == RowRole.SUBORDINATE) {
                targets.add(i);
            }
        }
        log.debug("Cascade from row {} covers {} subordinate rows", orderedSheet.get(startIndex).getId(), targets.size());
        return targets;
    }
}
