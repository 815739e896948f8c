package com.boqregistry.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.List;

/**
 * One BOQ line as delivered by the import layer. Items are owned by the caller; the engine writes {@code category},
 * {@code role} when it is missing or not user-corrected, and the structural annotations derived from the role pass
 * ({@code parentItemId}, {@code boqLineNumber}, {@code subordinateType}, {@code roleConfidence}, {@code roleWarnings}).
 * Row positions are unique within a sheet.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class BoqItem {

    @EqualsAndHashCode.Include
    private String id;
    /** Null means the single default sheet. */
    private String sheetId;
    private String code;
    private String description;
    private String fullDescription;
    private String unit;
    private BigDecimal quantity;
    private BigDecimal unitPrice;
    private BigDecimal totalPrice;
    private int rowPosition;
    private RowRole role;
    /** True once a user corrected the role; such roles are never recomputed. */
    private boolean roleOverridden;
    private String category;
    /** Id of the MAIN row a SUBORDINATE row belongs to; null for other roles and for rows before any MAIN. */
    private String parentItemId;
    /** 1-based sequence of MAIN rows within the sheet. */
    private Integer boqLineNumber;
    private SubordinateType subordinateType;
    private RoleConfidence roleConfidence;
    private List<String> roleWarnings = List.of();

    public boolean hasCategory() {
        return category != null && !category.isBlank();
    }

    public boolean hasQuantity() {
        return isPresent(quantity);
    }

    public boolean hasPrice() {
        return isPresent(unitPrice) || isPresent(totalPrice);
    }

    /** Importers write 0 for empty numeric cells, so zero counts as absent. */
    private static boolean isPresent(BigDecimal value) {
        return value != null && value.signum() != 0;
    }
}
