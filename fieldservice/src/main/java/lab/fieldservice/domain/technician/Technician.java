package lab.fieldservice.domain.technician;

import jakarta.persistence.*;
import lab.fieldservice.domain.RowScoped;
import lab.fieldservice.orchestration.policy.RecordAttributes;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Entity
@Table(name = "technicians", indexes = {
        @Index(name = "idx_technician_license", columnList = "licenseNumber", unique = true)
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class Technician implements RowScoped {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String licenseNumber;

    @Column(length = 100)
    private String firstName;

    @Column(length = 100)
    private String lastName;

    @Column(precision = 10, scale = 2)
    private BigDecimal hourlyRate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private TechnicianStatus status;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public static Technician hired(String licenseNumber, String firstName, String lastName, BigDecimal hourlyRate) {
        Instant now = Instant.now();
        return Technician.builder()
                .licenseNumber(licenseNumber)
                .firstName(firstName)
                .lastName(lastName)
                .hourlyRate(hourlyRate)
                .status(TechnicianStatus.AVAILABLE)
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void revise(String licenseNumber, String firstName, String lastName, BigDecimal hourlyRate,
                       TechnicianStatus status, Boolean active) {
        if (licenseNumber != null) this.licenseNumber = licenseNumber;
        if (firstName != null) this.firstName = firstName;
        if (lastName != null) this.lastName = lastName;
        if (hourlyRate != null) this.hourlyRate = hourlyRate;
        if (status != null) this.status = status;
        if (active != null) this.active = active;
        this.updatedAt = Instant.now();
    }

    @Override
    public RecordAttributes attributes() {
        Map<String, Object> values = new HashMap<>();
        values.put("id", id);
        values.put("licenseNumber", licenseNumber);
        values.put("status", status);
        values.put("active", active);
        return RecordAttributes.of(values);
    }
}
