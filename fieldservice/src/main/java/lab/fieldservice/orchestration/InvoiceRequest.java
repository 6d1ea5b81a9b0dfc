package lab.fieldservice.orchestration;

import lab.fieldservice.domain.invoice.InvoiceStatus;

import java.math.BigDecimal;
import java.time.LocalDate;

public record InvoiceRequest(
        String invoiceNumber,
        Long customerId,
        Long workOrderId,
        BigDecimal amount,
        BigDecimal tax,
        InvoiceStatus status,
        LocalDate dueDate,
        Boolean active
) {
}
