package lab.fieldservice.orchestration;

import lab.fieldservice.domain.technician.TechnicianStatus;

import java.math.BigDecimal;

public record TechnicianRequest(
        String licenseNumber,
        String firstName,
        String lastName,
        BigDecimal hourlyRate,
        TechnicianStatus status,
        Boolean active
) {
}
