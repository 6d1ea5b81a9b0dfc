package lab.fieldservice.orchestration.policy;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup table of policies. Building it fails when two policies claim the same
 * (role, resource type, operation class) triple.
 */
public final class PolicyTable {

    private final Map<Key, Policy> policies;
    private final long version;

    private PolicyTable(Map<Key, Policy> policies, long version) {
        this.policies = Map.copyOf(policies);
        this.version = version;
    }

    public static PolicyTable of(Collection<Policy> policies, long version) {
        Map<Key, Policy> byKey = new HashMap<>();
        for (Policy policy : policies) {
            Key key = new Key(policy.role(), policy.resourceType(), policy.operationClass());
            Policy previous = byKey.putIfAbsent(key, policy);
            if (previous != null) {
                throw new PolicyConfigurationException(
                        "ambiguous policies for role=" + key.role()
                                + ", resource=" + key.resourceType().id()
                                + ", operations=" + key.operationClass()
                                + ": " + previous.kind().id() + " and " + policy.kind().id());
            }
        }
        return new PolicyTable(byKey, version);
    }

    public Optional<Policy> find(String role, ResourceType resourceType, OperationClass operationClass) {
        if (role == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(policies.get(
                new Key(role.trim().toLowerCase(Locale.ROOT), resourceType, operationClass)));
    }

    public List<Policy> policies() {
        return List.copyOf(policies.values());
    }

    public int size() {
        return policies.size();
    }

    public long version() {
        return version;
    }

    private record Key(String role, ResourceType resourceType, OperationClass operationClass) {
    }
}
