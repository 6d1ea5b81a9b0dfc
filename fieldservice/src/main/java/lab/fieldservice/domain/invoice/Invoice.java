package lab.fieldservice.domain.invoice;

import jakarta.persistence.*;
import lab.fieldservice.domain.RowScoped;
import lab.fieldservice.orchestration.policy.RecordAttributes;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

@Entity
@Table(name = "invoices", indexes = {
        @Index(name = "idx_invoice_number", columnList = "invoiceNumber", unique = true),
        @Index(name = "idx_invoice_customer", columnList = "customerId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class Invoice implements RowScoped {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String invoiceNumber;

    private Long workOrderId;

    @Column(nullable = false)
    private Long customerId;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal tax;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal total;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private InvoiceStatus status;

    private LocalDate dueDate;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public static Invoice drafted(String invoiceNumber, Long customerId, Long workOrderId,
                                  BigDecimal amount, BigDecimal tax, LocalDate dueDate) {
        BigDecimal effectiveTax = tax == null ? BigDecimal.ZERO : tax;
        Instant now = Instant.now();
        return Invoice.builder()
                .invoiceNumber(invoiceNumber)
                .customerId(customerId)
                .workOrderId(workOrderId)
                .amount(amount)
                .tax(effectiveTax)
                .total(amount.add(effectiveTax))
                .status(InvoiceStatus.DRAFT)
                .dueDate(dueDate)
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void revise(Long customerId, Long workOrderId, BigDecimal amount, BigDecimal tax,
                       InvoiceStatus status, LocalDate dueDate, Boolean active) {
        if (customerId != null) this.customerId = customerId;
        if (workOrderId != null) this.workOrderId = workOrderId;
        if (amount != null) this.amount = amount;
        if (tax != null) this.tax = tax;
        if (amount != null || tax != null) this.total = this.amount.add(this.tax);
        if (status != null) this.status = status;
        if (dueDate != null) this.dueDate = dueDate;
        if (active != null) this.active = active;
        this.updatedAt = Instant.now();
    }

    @Override
    public RecordAttributes attributes() {
        Map<String, Object> values = new HashMap<>();
        values.put("id", id);
        values.put("invoiceNumber", invoiceNumber);
        values.put("customerId", customerId);
        values.put("workOrderId", workOrderId);
        values.put("status", status);
        values.put("active", active);
        return RecordAttributes.of(values);
    }
}
