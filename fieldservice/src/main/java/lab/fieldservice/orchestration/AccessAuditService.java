package lab.fieldservice.orchestration;

import lab.fieldservice.common.CorrelationIdFilter;
import lab.fieldservice.config.RlsProperties;
import lab.fieldservice.domain.policy.PolicyAuditLog;
import lab.fieldservice.domain.policy.PolicyAuditLogRepository;
import lab.fieldservice.orchestration.policy.AccessDecision;
import lab.fieldservice.orchestration.policy.RequestContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class AccessAuditService {

    private final PolicyAuditLogRepository policyAuditLogRepository;
    private final RlsProperties rlsProperties;

    // Denials are always kept; allowed reads only when rls.audit.reads is on.
    public void record(RequestContext context, Long recordId, AccessDecision decision) {
        RlsProperties.AuditProperties audit = rlsProperties.audit();
        if (!audit.enabled()) {
            return;
        }
        if (!decision.isDenied() && context.operation().isRead() && !audit.reads()) {
            return;
        }

        PolicyAuditLog entry = PolicyAuditLog.of(
                context,
                recordId,
                decision,
                MDC.get(CorrelationIdFilter.MDC_CORRELATION_ID_KEY)
        );
        policyAuditLogRepository.save(entry);
        log.debug(
                "event=access_audit.recorded resource={} operation={} outcome={} reason={}",
                entry.getResourceType(),
                entry.getOperation(),
                entry.getOutcome(),
                entry.getReason()
        );
    }
}
