package com.boqregistry.classification.role;

import com.boqregistry.domain.BoqItem;
import com.boqregistry.domain.RoleConfidence;
import com.boqregistry.domain.RowRole;
import com.boqregistry.domain.SubordinateType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Derives the structural role of a BOQ row from its code pattern and the presence of quantity/price.
 * Rules are applied in order, first match wins: SECTION, MAIN, SUBORDINATE, UNKNOWN.
 */
@Component
public class RowRoleClassifier {

    /** ÚRS: 6+ digits (231112). */
    private static final Pattern URS_CODE = Pattern.compile("^\\d{6,}$");
    /** ÚRS dotted: 23.11.12. */
    private static final Pattern URS_DOTTED = Pattern.compile("^\\d{2,3}\\.\\d{2,3}\\.\\d{2,3}$");
    /** OTSKP: letter + 5+ digits (A12345). */
    private static final Pattern OTSKP_CODE = Pattern.compile("^[A-Z]\\d{5,}$");
    /** RTS: 123-456. */
    private static final Pattern RTS_CODE = Pattern.compile("^\\d{3,4}-\\d{3,4}$");
    /** Anything starting with 3+ digits. */
    private static final Pattern GENERIC_CODE = Pattern.compile("^\\d{3,}");
    /** Section number: 1-2 digits. */
    private static final Pattern SECTION_CODE = Pattern.compile("^\\d{1,2}$");
    /** Sub-index repeating the parent code: A195, B5. */
    private static final Pattern SUB_INDEX = Pattern.compile("^[A-Z]\\d{1,3}$");
    /** Quantity statement markers (výkaz výměr). */
    private static final Pattern VV_MARKERS = Pattern.compile("^(VV|PP|PSC|VRN)$", Pattern.CASE_INSENSITIVE);
    /** 15,200*0,030 or 5.2*0.06 */
    private static final Pattern DECIMAL_MULTIPLICATION = Pattern.compile("\\d+[,.]\\d+\\s*\\*\\s*\\d+[,.]\\d+");
    private static final Pattern SUMMARY_KEYWORDS = Pattern.compile("celkov[éá]\\s+množstv[ií]",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final List<Pattern> CALC_INDICATORS = List.of(
            Pattern.compile("\\d+[*×x]\\d+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\d+\\s*[+-]\\s*\\d+"),
            Pattern.compile("\\(\\d+"),
            Pattern.compile("\\d+\\.\\d+\\s*\\*"),
            Pattern.compile("=\\s*\\d+"),
            Pattern.compile("celkem|mezisoučet|součet", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
    );

    private static final List<Pattern> SECTION_HEADINGS = List.of(
            Pattern.compile("^díl\\s*[:.]", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
            Pattern.compile("^oddíl\\s*[:.]", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
            Pattern.compile("^(HSV|PSV|MON|VRN|ON)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^práce\\s+(HSV|PSV)", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
            // "1. Zemní práce"
            Pattern.compile("^\\d{1,2}\\s*[.)]\\s+[A-ZÁČĎÉĚÍŇÓŘŠŤÚŮÝŽ]"),
            // "IV. Mostní objekty"
            Pattern.compile("^[IVX]+\\.\\s+")
    );

    /**
     * Role of a single row. Pure function of the row's own fields.
     */
    public RowRole classify(BoqItem item) {
        String code = trim(item.getCode());
        String description = trim(item.getDescription());
        boolean noNumbers = !item.hasQuantity() && !item.hasPrice();

        if (noNumbers && (SECTION_CODE.matcher(code).matches()
                || (code.isEmpty() && isSectionHeading(description)))) {
            return RowRole.SECTION;
        }
        if (isCatalogCode(code) && item.hasQuantity()) {
            return RowRole.MAIN;
        }
        if (!description.isEmpty() || !trim(item.getFullDescription()).isEmpty() || !code.isEmpty()) {
            return RowRole.SUBORDINATE;
        }
        return RowRole.UNKNOWN;
    }

    /**
     * Fill in roles for a batch. Missing roles are always derived; with {@code recompute} existing roles are
     * re-derived too unless a user corrected them.
     *
     * @return number of items whose role changed
     */
    public int assignRoles(Collection<BoqItem> items, boolean recompute) {
        int changed = 0;
        for (BoqItem item : items) {
            if (item.isRoleOverridden() && item.getRole() != null) {
                continue;
            }
            if (item.getRole() != null && !recompute) {
                continue;
            }
            RowRole role = classify(item);
            if (role != item.getRole()) {
                item.setRole(role);
                changed++;
            }
        }
        return changed;
    }

    /**
     * User correction of a row role. The role becomes authoritative and is never recomputed automatically.
     */
    public void overrideRole(BoqItem item, RowRole role) {
        item.setRole(role);
        item.setRoleOverridden(true);
    }

    /**
     * Structural pass over one sheet in row order, after roles are assigned. Links SUBORDINATE rows to the MAIN row
     * above them (a SECTION row breaks the link), numbers MAIN rows from 1, and records subordinate type, role
     * confidence and warnings on every row.
     */
    public RowRoleStats annotateSheet(List<BoqItem> orderedSheet) {
        String currentMainId = null;
        int lineNumber = 0;
        int main = 0;
        int subordinate = 0;
        int section = 0;
        int unknown = 0;
        for (BoqItem item : orderedSheet) {
            RowRole role = item.getRole() == null ? classify(item) : item.getRole();
            String code = trim(item.getCode());
            List<String> warnings = new ArrayList<>();
            item.setParentItemId(null);
            item.setBoqLineNumber(null);
            item.setSubordinateType(null);
            switch (role) {
                case MAIN -> {
                    lineNumber++;
                    item.setBoqLineNumber(lineNumber);
                    currentMainId = item.getId();
                    main++;
                }
                case SECTION -> {
                    currentMainId = null;
                    section++;
                }
                case SUBORDINATE -> {
                    item.setParentItemId(currentMainId);
                    item.setSubordinateType(subordinateType(item));
                    if (currentMainId == null) {
                        warnings.add(SUB_INDEX.matcher(code).matches()
                                ? "Sub-index row without preceding main item"
                                : "Subordinate row without preceding main item");
                    }
                    if (!code.isEmpty() && !VV_MARKERS.matcher(code).matches() && !SUB_INDEX.matcher(code).matches()
                            && !isCatalogCode(code)) {
                        warnings.add("Unrecognized code format: \"" + code + "\"");
                    }
                    subordinate++;
                }
                case UNKNOWN -> {
                    if (code.isEmpty() && text(item).isEmpty()) {
                        warnings.add("Empty row (no code and no description)");
                    }
                    unknown++;
                }
            }
            item.setRoleConfidence(roleConfidence(item, role));
            item.setRoleWarnings(List.copyOf(warnings));
        }
        return new RowRoleStats(orderedSheet.size(), main, subordinate, section, unknown, lineNumber);
    }

    /**
     * Kind of a SUBORDINATE row. Markers and sub-indices are decided by the code; code-less rows by their text and
     * numbers.
     */
    public SubordinateType subordinateType(BoqItem item) {
        String code = trim(item.getCode());
        String text = text(item);
        if (VV_MARKERS.matcher(code).matches()) {
            return SubordinateType.OTHER;
        }
        if (SUB_INDEX.matcher(code).matches()) {
            return SubordinateType.REPEAT;
        }
        if (!code.isEmpty()) {
            return SubordinateType.OTHER;
        }
        if (DECIMAL_MULTIPLICATION.matcher(text).find() || SUMMARY_KEYWORDS.matcher(text).find()) {
            return SubordinateType.CALCULATION;
        }
        if (!text.isEmpty() && (matchesAny(CALC_INDICATORS, text) || item.hasQuantity())) {
            return SubordinateType.CALCULATION;
        }
        if (!text.isEmpty() && !item.hasQuantity() && !item.hasPrice()) {
            return SubordinateType.NOTE;
        }
        return SubordinateType.OTHER;
    }

    RoleConfidence roleConfidence(BoqItem item, RowRole role) {
        String code = trim(item.getCode());
        String text = text(item);
        return switch (role) {
            case MAIN -> {
                if (URS_CODE.matcher(code).matches() || OTSKP_CODE.matcher(code).matches()
                        || RTS_CODE.matcher(code).matches()) {
                    yield RoleConfidence.HIGH;
                }
                yield isCatalogCode(code) ? RoleConfidence.MEDIUM : RoleConfidence.LOW;
            }
            case SECTION -> RoleConfidence.HIGH;
            case SUBORDINATE -> {
                boolean explicit = VV_MARKERS.matcher(code).matches()
                        || SUB_INDEX.matcher(code).matches()
                        || DECIMAL_MULTIPLICATION.matcher(text).find()
                        || SUMMARY_KEYWORDS.matcher(text).find()
                        || (!text.isEmpty() && !item.hasQuantity() && !item.hasPrice());
                yield explicit ? RoleConfidence.HIGH : RoleConfidence.MEDIUM;
            }
            case UNKNOWN -> RoleConfidence.LOW;
        };
    }

    /**
     * True for recognised catalog code formats (ÚRS, dotted ÚRS, OTSKP, RTS, generic 3+ digits).
     */
    public static boolean isCatalogCode(String code) {
        if (code == null || code.isBlank()) {
            return false;
        }
        String c = code.strip();
        return URS_CODE.matcher(c).matches()
                || URS_DOTTED.matcher(c).matches()
                || OTSKP_CODE.matcher(c).matches()
                || RTS_CODE.matcher(c).matches()
                || GENERIC_CODE.matcher(c).find();
    }

    private static boolean isSectionHeading(String description) {
        if (description.isEmpty()) {
            return false;
        }
        return SECTION_HEADINGS.stream().anyMatch(p -> p.matcher(description).find());
    }

    private static boolean matchesAny(List<Pattern> patterns, String text) {
        return patterns.stream().anyMatch(p -> p.matcher(text).find());
    }

    private static String text(BoqItem item) {
        String description = trim(item.getDescription());
        return description.isEmpty() ? trim(item.getFullDescription()) : description;
    }

    private static String trim(String s) {
        return s == null ? "" : s.strip();
    }
}
