package lab.fieldservice.config;

import lab.fieldservice.orchestration.policy.OperationClass;
import lab.fieldservice.orchestration.policy.Policy;
import lab.fieldservice.orchestration.policy.PolicyKind;
import lab.fieldservice.orchestration.policy.PolicyRegistry;
import lab.fieldservice.orchestration.policy.ResourceType;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyCoverageStartupGuardTest {

    private static PolicyCoverageStartupGuard guard(List<Policy> policies, boolean strict) {
        PolicyCoverageStartupGuard guard = new PolicyCoverageStartupGuard(new PolicyRegistry(policies));
        ReflectionTestUtils.setField(guard, "strict", strict);
        return guard;
    }

    @Test
    void strict_uncoveredResource_failsStartup() {
        List<Policy> contractsOnly = List.of(
                Policy.of("admin", ResourceType.CONTRACTS, OperationClass.READ, PolicyKind.ALL_RECORDS));

        assertThatThrownBy(() -> guard(contractsOnly, true).validate())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("invoices");
    }

    @Test
    void lenient_uncoveredResource_onlyWarns() {
        assertThatCode(() -> guard(List.of(), false).validate()).doesNotThrowAnyException();
    }

    @Test
    void strict_everyResourceCovered_passes() {
        List<Policy> all = Arrays.stream(ResourceType.values())
                .map(type -> Policy.of("admin", type, OperationClass.READ, PolicyKind.ALL_RECORDS))
                .toList();

        assertThatCode(() -> guard(all, true).validate()).doesNotThrowAnyException();
    }
}
