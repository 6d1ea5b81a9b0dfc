package lab.fieldservice.config;

import lab.fieldservice.orchestration.policy.OperationClass;
import lab.fieldservice.orchestration.policy.OwnerValue;
import lab.fieldservice.orchestration.policy.Policy;
import lab.fieldservice.orchestration.policy.PolicyConfigurationException;
import lab.fieldservice.orchestration.policy.PolicyKind;
import lab.fieldservice.orchestration.policy.ResourceType;
import lab.fieldservice.orchestration.policy.Role;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "rls")
public record RlsProperties(
        List<PolicyEntry> policies,
        AuditProperties audit,
        PaginationProperties pagination
) {
    public RlsProperties {
        if (policies == null) {
            policies = List.of();
        }
        if (audit == null) {
            audit = new AuditProperties(true, false);
        }
        if (pagination == null) {
            pagination = new PaginationProperties(50, 200);
        }
    }

    public List<Policy> toPolicies() {
        List<Policy> result = new ArrayList<>();
        for (PolicyEntry entry : policies) {
            result.addAll(entry.toPolicies());
        }
        return result;
    }

    /**
     * One configured rule. {@code roles} expands to one policy per role and {@code operations}
     * ({@code read}, {@code write}, {@code all}) to one policy per operation class.
     */
    public record PolicyEntry(
            List<String> roles,
            String resource,
            String operations,
            String kind,
            String ownerField,
            String ownerValue,
            String minimumRole
    ) {
        public List<Policy> toPolicies() {
            if (roles == null || roles.isEmpty()) {
                throw new PolicyConfigurationException("policy entry for resource " + resource + " has no roles");
            }
            ResourceType resourceType = ResourceType.require(resource);
            PolicyKind policyKind = PolicyKind.require(kind);
            OwnerValue owner = OwnerValue.parse(ownerValue);
            Role minimum = minimumRole == null || minimumRole.isBlank() ? null : Role.require(minimumRole);

            List<Policy> result = new ArrayList<>();
            for (String role : roles) {
                Role.require(role);
                for (OperationClass operationClass : OperationClass.parse(operations)) {
                    result.add(new Policy(role, resourceType, operationClass, policyKind,
                            ownerField, owner, minimum, true));
                }
            }
            return result;
        }
    }

    /**
     * @param enabled whether decisions are written to the audit table at all
     * @param reads   whether allowed reads are audited too; denials are always audited when enabled
     */
    public record AuditProperties(
            Boolean enabled,
            Boolean reads
    ) {
        public AuditProperties {
            if (enabled == null) {
                enabled = true;
            }
            if (reads == null) {
                reads = false;
            }
        }
    }

    public record PaginationProperties(
            int defaultLimit,
            int maxLimit
    ) {
        public PaginationProperties {
            if (defaultLimit <= 0) {
                defaultLimit = 50;
            }
            if (maxLimit <= 0) {
                maxLimit = 200;
            }
        }
    }
}
