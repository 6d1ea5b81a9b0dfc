package lab.fieldservice.orchestration.policy;

import java.util.Optional;

/**
 * Result of one evaluation. {@code filter} is set only for {@link AccessOutcome#ALLOW_FILTERED}.
 * {@code policyApplied} is surfaced to callers as {@code rlsApplied}.
 */
public record AccessDecision(
        AccessOutcome outcome,
        RowFilter filter,
        boolean policyApplied,
        PolicyKind policyKind,
        String reason
) {
    public static AccessDecision allowAll(PolicyKind kind, boolean policyApplied, String reason) {
        return new AccessDecision(AccessOutcome.ALLOW_ALL, null, policyApplied, kind, reason);
    }

    public static AccessDecision filtered(PolicyKind kind, RowFilter filter, String reason) {
        return new AccessDecision(AccessOutcome.ALLOW_FILTERED, filter, true, kind, reason);
    }

    public static AccessDecision deny(PolicyKind kind, String reason) {
        return new AccessDecision(AccessOutcome.DENY, null, true, kind, reason);
    }

    public Optional<RowFilter> filterPredicate() {
        return Optional.ofNullable(filter);
    }

    public boolean isDenied() {
        return outcome == AccessOutcome.DENY;
    }

    /**
     * Whether a single concrete record is visible under this decision.
     */
    public boolean admits(RecordAttributes record) {
        return switch (outcome) {
            case ALLOW_ALL -> true;
            case ALLOW_FILTERED -> filter.matches(record);
            case DENY -> false;
        };
    }
}
