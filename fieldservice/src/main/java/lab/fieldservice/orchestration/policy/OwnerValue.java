package lab.fieldservice.orchestration.policy;

import java.util.Arrays;
import java.util.Locale;

/**
 * The requester identity that an owner field is compared against.
 * Customers own rows through their customer profile, technicians through their technician profile.
 */
public enum OwnerValue {
    USER_ID("user_id"),
    CUSTOMER_PROFILE_ID("customer_profile_id"),
    TECHNICIAN_PROFILE_ID("technician_profile_id");

    private final String id;

    OwnerValue(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static OwnerValue parse(String value) {
        if (value == null || value.isBlank()) {
            return USER_ID;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(v -> v.id.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new PolicyConfigurationException("unknown owner value: " + value));
    }
}
