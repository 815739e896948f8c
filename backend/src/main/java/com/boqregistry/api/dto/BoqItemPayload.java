package com.boqregistry.api.dto;

import com.boqregistry.domain.BoqItem;
import com.boqregistry.domain.RoleConfidence;
import com.boqregistry.domain.RowRole;
import com.boqregistry.domain.SubordinateType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.util.List;

/**
 * BOQ row as sent and returned by the classification endpoints. The structural fields from {@code parentItemId} on are
 * derived by the role pass; values sent by the client are ignored.
 */
public record BoqItemPayload(
        @NotBlank(message = "INVALID_ITEM") String id,
        String sheetId,
        String code,
        String description,
        String fullDescription,
        String unit,
        BigDecimal quantity,
        BigDecimal unitPrice,
        BigDecimal totalPrice,
        @NotNull(message = "INVALID_ITEM") Integer rowPosition,
        RowRole role,
        Boolean roleOverridden,
        String category,
        String parentItemId,
        Integer boqLineNumber,
        SubordinateType subordinateType,
        RoleConfidence roleConfidence,
        List<String> roleWarnings
) {

    public BoqItem toItem() {
        BoqItem item = new BoqItem();
        item.setId(id);
        item.setSheetId(sheetId);
        item.setCode(code);
        item.setDescription(description);
        item.setFullDescription(fullDescription);
        item.setUnit(unit);
        item.setQuantity(quantity);
        item.setUnitPrice(unitPrice);
        item.setTotalPrice(totalPrice);
        item.setRowPosition(rowPosition);
        item.setRole(role);
        item.setRoleOverridden(Boolean.TRUE.equals(roleOverridden));
        item.setCategory(category);
        return item;
    }

    public static BoqItemPayload from(BoqItem item) {
        return new BoqItemPayload(item.getId(), item.getSheetId(), item.getCode(), item.getDescription(),
                item.getFullDescription(), item.getUnit(), item.getQuantity(), item.getUnitPrice(),
                item.getTotalPrice(), item.getRowPosition(), item.getRole(), item.isRoleOverridden(),
                item.getCategory(), item.getParentItemId(), item.getBoqLineNumber(), item.getSubordinateType(),
                item.getRoleConfidence(), item.getRoleWarnings());
    }
}
