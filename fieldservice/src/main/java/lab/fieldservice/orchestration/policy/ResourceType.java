package lab.fieldservice.orchestration.policy;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ResourceType {
    CONTRACTS("contracts"),
    INVOICES("invoices"),
    INVENTORY("inventory"),
    WORK_ORDERS("work_orders"),
    TECHNICIANS("technicians"),
    CUSTOMERS("customers"),
    AUDIT_LOGS("audit_logs");

    private final String id;

    ResourceType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<ResourceType> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.id.equals(normalized))
                .findFirst();
    }

    // Resource identifiers come from wiring, so an unknown one is a defect and never defaults.
    public static ResourceType require(String id) {
        return fromId(id)
                .orElseThrow(() -> new PolicyConfigurationException("unknown resource type: " + id));
    }
}
