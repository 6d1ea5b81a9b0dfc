package lab.fieldservice.orchestration;

import lab.fieldservice.domain.contract.ContractStatus;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ContractRequest(
        String contractNumber,
        Long customerId,
        LocalDate startDate,
        LocalDate endDate,
        BigDecimal contractValue,
        ContractStatus status,
        Boolean active
) {
}
