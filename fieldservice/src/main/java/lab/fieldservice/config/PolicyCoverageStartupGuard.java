package lab.fieldservice.config;

import jakarta.annotation.PostConstruct;
import lab.fieldservice.orchestration.policy.Policy;
import lab.fieldservice.orchestration.policy.PolicyRegistry;
import lab.fieldservice.orchestration.policy.ResourceType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reports resources that no policy mentions. Such resources are closed to everybody; in strict
 * mode that is treated as a misconfiguration and startup fails.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PolicyCoverageStartupGuard {

    private final PolicyRegistry policyRegistry;

    @Value("${rls.startup.strict:false}")
    private boolean strict;

    @PostConstruct
    void validate() {
        Set<ResourceType> covered = policyRegistry.snapshot().policies().stream()
                .map(Policy::resourceType)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(ResourceType.class)));
        List<String> uncovered = Arrays.stream(ResourceType.values())
                .filter(type -> !covered.contains(type))
                .map(ResourceType::id)
                .toList();

        if (uncovered.isEmpty()) {
            return;
        }
        if (strict) {
            throw new IllegalStateException("no RLS policy configured for resources " + uncovered);
        }
        log.warn("event=policy_coverage.uncovered resources={} effect=deny_all", uncovered);
    }
}
