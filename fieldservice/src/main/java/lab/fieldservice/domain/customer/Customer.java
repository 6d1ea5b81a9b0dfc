package lab.fieldservice.domain.customer;

import jakarta.persistence.*;
import lab.fieldservice.domain.RowScoped;
import lab.fieldservice.orchestration.policy.RecordAttributes;
import lombok.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Entity
@Table(name = "customers", indexes = {
        @Index(name = "idx_customer_email", columnList = "email", unique = true)
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class Customer implements RowScoped {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String email;

    @Column(length = 100)
    private String firstName;

    @Column(length = 100)
    private String lastName;

    @Column(length = 50)
    private String phone;

    @Column(length = 255)
    private String companyName;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public static Customer registered(String email, String firstName, String lastName, String phone, String companyName) {
        Instant now = Instant.now();
        return Customer.builder()
                .email(email)
                .firstName(firstName)
                .lastName(lastName)
                .phone(phone)
                .companyName(companyName)
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void revise(String email, String firstName, String lastName, String phone, String companyName, Boolean active) {
        if (email != null) this.email = email;
        if (firstName != null) this.firstName = firstName;
        if (lastName != null) this.lastName = lastName;
        if (phone != null) this.phone = phone;
        if (companyName != null) this.companyName = companyName;
        if (active != null) this.active = active;
        this.updatedAt = Instant.now();
    }

    @Override
    public RecordAttributes attributes() {
        Map<String, Object> values = new HashMap<>();
        values.put("id", id);
        values.put("email", email);
        values.put("companyName", companyName);
        values.put("active", active);
        return RecordAttributes.of(values);
    }
}
