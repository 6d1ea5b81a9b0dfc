package lab.fieldservice.orchestration;

import lab.fieldservice.orchestration.policy.AccessDecision;

/**
 * Outcome of a mediated operation. Denials are carried here instead of being thrown so the
 * HTTP layer decides how each one is rendered.
 */
public record AccessResult<T>(
        AccessStatus status,
        T body,
        boolean rlsApplied,
        String reason
) {
    public static <T> AccessResult<T> ok(T body, AccessDecision decision) {
        return new AccessResult<>(AccessStatus.OK, body, decision.policyApplied(), decision.reason());
    }

    public static <T> AccessResult<T> notFound(String reason) {
        return new AccessResult<>(AccessStatus.NOT_FOUND, null, false, reason);
    }

    public static <T> AccessResult<T> notFound(AccessDecision decision) {
        return new AccessResult<>(AccessStatus.NOT_FOUND, null, decision.policyApplied(), decision.reason());
    }

    public static <T> AccessResult<T> forbidden(AccessDecision decision) {
        return new AccessResult<>(AccessStatus.FORBIDDEN, null, decision.policyApplied(), decision.reason());
    }

    public boolean isOk() {
        return status == AccessStatus.OK;
    }
}
