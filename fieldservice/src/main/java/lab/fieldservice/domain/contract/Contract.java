package lab.fieldservice.domain.contract;

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
@Table(name = "contracts", indexes = {
        @Index(name = "idx_contract_number", columnList = "contractNumber", unique = true),
        @Index(name = "idx_contract_customer", columnList = "customerId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class Contract implements RowScoped {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String contractNumber;

    @Column(nullable = false)
    private Long customerId;

    @Column(nullable = false)
    private LocalDate startDate;

    private LocalDate endDate;

    @Column(precision = 12, scale = 2)
    private BigDecimal contractValue;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ContractStatus status;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public static Contract drafted(String contractNumber, Long customerId, LocalDate startDate,
                                   LocalDate endDate, BigDecimal contractValue) {
        if (endDate != null && endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("contract end date must not precede its start date");
        }
        Instant now = Instant.now();
        return Contract.builder()
                .contractNumber(contractNumber)
                .customerId(customerId)
                .startDate(startDate)
                .endDate(endDate)
                .contractValue(contractValue)
                .status(ContractStatus.DRAFT)
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void revise(Long customerId, LocalDate startDate, LocalDate endDate, BigDecimal contractValue,
                       ContractStatus status, Boolean active) {
        LocalDate nextStart = startDate != null ? startDate : this.startDate;
        LocalDate nextEnd = endDate != null ? endDate : this.endDate;
        if (nextEnd != null && nextEnd.isBefore(nextStart)) {
            throw new IllegalArgumentException("contract end date must not precede its start date");
        }
        if (customerId != null) this.customerId = customerId;
        this.startDate = nextStart;
        this.endDate = nextEnd;
        if (contractValue != null) this.contractValue = contractValue;
        if (status != null) this.status = status;
        if (active != null) this.active = active;
        this.updatedAt = Instant.now();
    }

    @Override
    public RecordAttributes attributes() {
        Map<String, Object> values = new HashMap<>();
        values.put("id", id);
        values.put("contractNumber", contractNumber);
        values.put("customerId", customerId);
        values.put("status", status);
        values.put("active", active);
        return RecordAttributes.of(values);
    }
}
