package lab.fieldservice.domain.inventory;

import jakarta.persistence.*;
import lab.fieldservice.domain.RowScoped;
import lab.fieldservice.orchestration.policy.RecordAttributes;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Entity
@Table(name = "inventory", indexes = {
        @Index(name = "idx_inventory_sku", columnList = "sku", unique = true)
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class InventoryItem implements RowScoped {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(nullable = false, length = 100)
    private String sku;

    @Column(nullable = false)
    private int quantity;

    @Column(nullable = false)
    private int reorderLevel;

    @Column(precision = 12, scale = 2)
    private BigDecimal unitCost;

    @Column(length = 255)
    private String location;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private InventoryStatus status;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public static InventoryItem stocked(String name, String sku, int quantity, int reorderLevel,
                                        BigDecimal unitCost, String location) {
        Instant now = Instant.now();
        return InventoryItem.builder()
                .name(name)
                .sku(sku)
                .quantity(quantity)
                .reorderLevel(reorderLevel)
                .unitCost(unitCost)
                .location(location)
                .status(statusFor(quantity, reorderLevel))
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void revise(String name, Integer quantity, Integer reorderLevel, BigDecimal unitCost,
                       String location, InventoryStatus status, Boolean active) {
        if (name != null) this.name = name;
        if (quantity != null) this.quantity = quantity;
        if (reorderLevel != null) this.reorderLevel = reorderLevel;
        if (unitCost != null) this.unitCost = unitCost;
        if (location != null) this.location = location;
        if (status != null) {
            this.status = status;
        } else if ((quantity != null || reorderLevel != null) && this.status != InventoryStatus.DISCONTINUED) {
            this.status = statusFor(this.quantity, this.reorderLevel);
        }
        if (active != null) this.active = active;
        this.updatedAt = Instant.now();
    }

    private static InventoryStatus statusFor(int quantity, int reorderLevel) {
        if (quantity <= 0) {
            return InventoryStatus.OUT_OF_STOCK;
        }
        return quantity <= reorderLevel ? InventoryStatus.LOW_STOCK : InventoryStatus.IN_STOCK;
    }

    @Override
    public RecordAttributes attributes() {
        Map<String, Object> values = new HashMap<>();
        values.put("id", id);
        values.put("sku", sku);
        values.put("status", status);
        values.put("active", active);
        return RecordAttributes.of(values);
    }
}
