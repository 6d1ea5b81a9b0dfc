package lab.fieldservice.orchestration.policy;

import java.util.Arrays;
import java.util.Locale;

public enum PolicyKind {
    DENY_ALL("deny_all"),
    ALL_RECORDS("all_records"),
    OWN_RECORDS_ONLY("own_records_only"),
    PUBLIC_RESOURCE("public_resource"),
    MINIMUM_ROLE("minimum_role");

    private final String id;

    PolicyKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static PolicyKind require(String id) {
        String normalized = id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.id.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new PolicyConfigurationException("unknown policy kind: " + id));
    }
}
