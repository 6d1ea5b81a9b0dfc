package lab.fieldservice.orchestration;

import lab.fieldservice.domain.inventory.InventoryStatus;

import java.math.BigDecimal;

public record InventoryRequest(
        String name,
        String sku,
        Integer quantity,
        Integer reorderLevel,
        BigDecimal unitCost,
        String location,
        InventoryStatus status,
        Boolean active
) {
}
