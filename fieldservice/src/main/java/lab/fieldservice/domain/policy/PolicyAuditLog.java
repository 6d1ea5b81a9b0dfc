package lab.fieldservice.domain.policy;

import jakarta.persistence.*;
import lab.fieldservice.domain.RowScoped;
import lab.fieldservice.orchestration.policy.AccessDecision;
import lab.fieldservice.orchestration.policy.RecordAttributes;
import lab.fieldservice.orchestration.policy.RequestContext;
import lab.fieldservice.orchestration.policy.Role;
import lombok.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Entity
@Table(name = "policy_audit_logs", indexes = {
        @Index(name = "idx_policy_audit_resource", columnList = "resourceType"),
        @Index(name = "idx_policy_audit_requester", columnList = "requesterId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class PolicyAuditLog implements RowScoped {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long requesterId;

    @Column(length = 32)
    private String role;

    @Column(nullable = false, length = 32)
    private String resourceType;

    @Column(nullable = false, length = 16)
    private String operation;

    private Long recordId;

    @Column(nullable = false, length = 16)
    private String outcome;

    @Column(nullable = false, length = 32)
    private String policyKind;

    @Column(nullable = false)
    private boolean policyApplied;

    @Column(nullable = false, length = 255)
    private String reason;

    @Column(length = 128)
    private String correlationId;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public static final String UNKNOWN_ROLE = "unknown";
    private static final int MAX_REASON_LENGTH = 255;

    public static PolicyAuditLog of(RequestContext context, Long recordId, AccessDecision decision, String correlationId) {
        return PolicyAuditLog.builder()
                .requesterId(context.requesterId())
                .role(storedRole(context.requesterRole()))
                .resourceType(context.resourceType().id())
                .operation(context.operation().name())
                .recordId(recordId)
                .outcome(decision.outcome().name())
                .policyKind(decision.policyKind().id())
                .policyApplied(decision.policyApplied())
                .reason(bounded(decision.reason()))
                .correlationId(correlationId)
                .createdAt(Instant.now())
                .build();
    }

    // Role and reason echo request headers; only known role ids are stored verbatim.
    private static String storedRole(String role) {
        if (role == null) {
            return null;
        }
        return Role.fromId(role).map(Role::id).orElse(UNKNOWN_ROLE);
    }

    private static String bounded(String reason) {
        if (reason == null || reason.length() <= MAX_REASON_LENGTH) {
            return reason;
        }
        return reason.substring(0, MAX_REASON_LENGTH);
    }

    @Override
    public RecordAttributes attributes() {
        Map<String, Object> values = new HashMap<>();
        values.put("id", id);
        values.put("requesterId", requesterId);
        values.put("resourceType", resourceType);
        values.put("outcome", outcome);
        return RecordAttributes.of(values);
    }
}
