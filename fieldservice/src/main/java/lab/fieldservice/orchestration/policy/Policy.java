package lab.fieldservice.orchestration.policy;

import java.util.Locale;

/**
 * Access rule for one (role, resource type, operation class) triple.
 *
 * @param registered false only for the fail-closed default handed out when nothing is configured
 */
public record Policy(
        String role,
        ResourceType resourceType,
        OperationClass operationClass,
        PolicyKind kind,
        String ownerField,
        OwnerValue ownerValue,
        Role minimumRole,
        boolean registered
) {
    public Policy {
        if (role == null || role.isBlank()) {
            throw new PolicyConfigurationException("policy role is required");
        }
        if (resourceType == null || operationClass == null || kind == null) {
            throw new PolicyConfigurationException("policy for role " + role + " is incomplete");
        }
        role = role.trim().toLowerCase(Locale.ROOT);
        if (kind == PolicyKind.OWN_RECORDS_ONLY && (ownerField == null || ownerField.isBlank())) {
            throw new PolicyConfigurationException(
                    "own_records_only requires an owner field: role=" + role + ", resource=" + resourceType.id());
        }
        if (kind == PolicyKind.MINIMUM_ROLE && minimumRole == null) {
            throw new PolicyConfigurationException(
                    "minimum_role requires a minimum role: role=" + role + ", resource=" + resourceType.id());
        }
        if (ownerValue == null) {
            ownerValue = OwnerValue.USER_ID;
        }
    }

    public static Policy of(String role, ResourceType resourceType, OperationClass operationClass, PolicyKind kind) {
        return new Policy(role, resourceType, operationClass, kind, null, null, null, true);
    }

    public static Policy ownRecords(String role, ResourceType resourceType, OperationClass operationClass,
                                    String ownerField, OwnerValue ownerValue) {
        return new Policy(role, resourceType, operationClass, PolicyKind.OWN_RECORDS_ONLY,
                ownerField, ownerValue, null, true);
    }

    public static Policy minimumRole(String role, ResourceType resourceType, OperationClass operationClass,
                                     Role minimumRole) {
        return new Policy(role, resourceType, operationClass, PolicyKind.MINIMUM_ROLE,
                null, null, minimumRole, true);
    }

    public static Policy defaultDeny(String role, ResourceType resourceType, OperationClass operationClass) {
        String effectiveRole = role == null || role.isBlank() ? "unknown" : role;
        return new Policy(effectiveRole, resourceType, operationClass, PolicyKind.DENY_ALL,
                null, null, null, false);
    }
}
