package lab.fieldservice.orchestration.policy;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Known roles and their rank. A higher rank carries more authority; unknown roles rank 0.
 */
public enum Role {
    CUSTOMER("customer", 1),
    TECHNICIAN("technician", 2),
    DISPATCHER("dispatcher", 3),
    MANAGER("manager", 4),
    ADMIN("admin", 5);

    private final String id;
    private final int rank;

    Role(String id, int rank) {
        this.id = id;
        this.rank = rank;
    }

    public String id() {
        return id;
    }

    public int rank() {
        return rank;
    }

    public static Optional<Role> fromId(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(role -> role.id.equals(normalized))
                .findFirst();
    }

    public static int rankOf(String id) {
        return fromId(id).map(Role::rank).orElse(0);
    }

    public static Role require(String id) {
        return fromId(id)
                .orElseThrow(() -> new PolicyConfigurationException("unknown role: " + id));
    }
}
