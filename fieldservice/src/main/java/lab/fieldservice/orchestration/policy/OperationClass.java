package lab.fieldservice.orchestration.policy;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum OperationClass {
    READ,
    WRITE;

    /**
     * Parses the {@code operations} value of a policy entry: {@code read}, {@code write} or
     * {@code all}. A missing value means {@code all}.
     */
    public static Set<OperationClass> parse(String value) {
        if (value == null || value.isBlank()) {
            return EnumSet.allOf(OperationClass.class);
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "all" -> EnumSet.allOf(OperationClass.class);
            case "read" -> EnumSet.of(READ);
            case "write" -> EnumSet.of(WRITE);
            default -> throw new PolicyConfigurationException("unknown operation class: " + value);
        };
    }
}
