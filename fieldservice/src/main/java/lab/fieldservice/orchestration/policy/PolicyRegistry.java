package lab.fieldservice.orchestration.policy;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Resolves the policy for a role and resource. Lookups read a single immutable snapshot;
 * {@link #reload(Collection)} validates the replacement completely before swapping it in.
 */
@Slf4j
public class PolicyRegistry {

    private final AtomicReference<PolicyTable> table;

    public PolicyRegistry(Collection<Policy> policies) {
        PolicyTable initial = PolicyTable.of(policies, 1L);
        this.table = new AtomicReference<>(initial);
        log.info("event=policy_registry.loaded version={} policies={}", initial.version(), initial.size());
    }

    public Policy resolve(String role, ResourceType resourceType, OperationClass operationClass) {
        return table.get()
                .find(role, resourceType, operationClass)
                .orElseGet(() -> Policy.defaultDeny(role, resourceType, operationClass));
    }

    public Policy resolve(String role, String resourceType, OperationClass operationClass) {
        return resolve(role, ResourceType.require(resourceType), operationClass);
    }

    public void reload(Collection<Policy> policies) {
        PolicyTable next = PolicyTable.of(policies, table.get().version() + 1);
        table.set(next);
        log.info("event=policy_registry.reloaded version={} policies={}", next.version(), next.size());
    }

    public PolicyTable snapshot() {
        return table.get();
    }
}
