package lab.fieldservice.orchestration.policy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns a policy and a request context into an {@link AccessDecision}.
 *
 * <p>Every outcome is a value. Reads under {@code deny_all} are narrowed to nothing rather than
 * rejected, so list endpoints keep one response shape; writes under {@code deny_all} are denied.
 * Missing ownership data always denies.
 */
@Component
@Slf4j
public class PolicyEvaluator {

    public AccessDecision evaluate(Policy policy, RequestContext context) {
        return switch (policy.kind()) {
            case DENY_ALL -> denyAll(policy, context);
            case ALL_RECORDS -> AccessDecision.allowAll(PolicyKind.ALL_RECORDS, true, "ALL_RECORDS");
            case OWN_RECORDS_ONLY -> ownRecordsOnly(policy, context);
            case PUBLIC_RESOURCE -> AccessDecision.allowAll(PolicyKind.PUBLIC_RESOURCE, false, "PUBLIC_RESOURCE");
            case MINIMUM_ROLE -> minimumRole(policy, context);
        };
    }

    private AccessDecision denyAll(Policy policy, RequestContext context) {
        String reason = policy.registered() ? "DENY_ALL" : "NO_POLICY_REGISTERED";
        if (context.operation().isRead()) {
            return AccessDecision.filtered(PolicyKind.DENY_ALL, RowFilter.matchNothing(), reason);
        }
        return AccessDecision.deny(PolicyKind.DENY_ALL, reason);
    }

    private AccessDecision ownRecordsOnly(Policy policy, RequestContext context) {
        String ownerField = policy.ownerField();
        Optional<Long> identity = context.requester() == null
                ? Optional.empty()
                : context.requester().identity(policy.ownerValue());

        if (identity.isEmpty()) {
            String reason = "REQUESTER_IDENTITY_MISSING: " + policy.ownerValue().id();
            log.debug(
                    "event=policy_evaluator.identity_missing role={} resource={} ownerValue={}",
                    context.requesterRole(),
                    context.resourceType().id(),
                    policy.ownerValue().id()
            );
            return context.operation().isRead()
                    ? AccessDecision.filtered(PolicyKind.OWN_RECORDS_ONLY, RowFilter.matchNothing(), reason)
                    : AccessDecision.deny(PolicyKind.OWN_RECORDS_ONLY, reason);
        }

        Optional<RecordAttributes> target = context.target();
        if (target.isEmpty()) {
            if (context.operation().isRead()) {
                return AccessDecision.filtered(
                        PolicyKind.OWN_RECORDS_ONLY,
                        RowFilter.fieldEquals(ownerField, identity.get()),
                        "OWNER_FILTER: " + ownerField
                );
            }
            return AccessDecision.deny(PolicyKind.OWN_RECORDS_ONLY, "TARGET_RECORD_MISSING");
        }

        RecordAttributes record = target.get();
        if (record.get(ownerField).isEmpty()) {
            log.warn(
                    "event=policy_evaluator.owner_field_missing resource={} ownerField={} operation={}",
                    context.resourceType().id(),
                    ownerField,
                    context.operation()
            );
            return AccessDecision.deny(PolicyKind.OWN_RECORDS_ONLY, "OWNER_FIELD_MISSING: " + ownerField);
        }
        if (record.holds(ownerField, identity.get())) {
            return AccessDecision.allowAll(PolicyKind.OWN_RECORDS_ONLY, true, "OWNER_MATCH: " + ownerField);
        }
        return AccessDecision.deny(PolicyKind.OWN_RECORDS_ONLY, "OWNER_MISMATCH: " + ownerField);
    }

    private AccessDecision minimumRole(Policy policy, RequestContext context) {
        int actual = Role.rankOf(context.requesterRole());
        if (actual >= policy.minimumRole().rank()) {
            return AccessDecision.allowAll(PolicyKind.MINIMUM_ROLE, true, "ROLE_RANK_SATISFIED");
        }
        return AccessDecision.deny(
                PolicyKind.MINIMUM_ROLE,
                "ROLE_RANK_BELOW_MINIMUM: required=" + policy.minimumRole().id() + ", actual=" + context.requesterRole()
        );
    }
}
