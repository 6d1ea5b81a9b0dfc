package lab.fieldservice.orchestration;

import lab.fieldservice.common.CorrelationIdFilter;
import lab.fieldservice.config.RlsProperties;
import lab.fieldservice.domain.policy.PolicyAuditLog;
import lab.fieldservice.domain.policy.PolicyAuditLogRepository;
import lab.fieldservice.orchestration.policy.AccessDecision;
import lab.fieldservice.orchestration.policy.Operation;
import lab.fieldservice.orchestration.policy.PolicyKind;
import lab.fieldservice.orchestration.policy.RequestContext;
import lab.fieldservice.orchestration.policy.Requester;
import lab.fieldservice.orchestration.policy.ResourceType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AccessAuditServiceTest {

    @Mock PolicyAuditLogRepository policyAuditLogRepository;

    private static final RequestContext DELETE_INVOICE =
            RequestContext.of(Requester.of(9L, "technician"), ResourceType.INVOICES, Operation.DELETE);
    private static final RequestContext LIST_INVOICES =
            RequestContext.of(Requester.of(1L, "admin"), ResourceType.INVOICES, Operation.LIST);

    private AccessAuditService service(boolean enabled, boolean reads) {
        RlsProperties properties = new RlsProperties(null, new RlsProperties.AuditProperties(enabled, reads), null);
        return new AccessAuditService(policyAuditLogRepository, properties);
    }

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void denial_isRecordedWithCorrelationId() {
        MDC.put(CorrelationIdFilter.MDC_CORRELATION_ID_KEY, "corr-1");

        service(true, false).record(DELETE_INVOICE, 5L, AccessDecision.deny(PolicyKind.DENY_ALL, "NO_POLICY_REGISTERED"));

        ArgumentCaptor<PolicyAuditLog> saved = ArgumentCaptor.forClass(PolicyAuditLog.class);
        verify(policyAuditLogRepository).save(saved.capture());
        assertThat(saved.getValue().getOutcome()).isEqualTo("DENY");
        assertThat(saved.getValue().getRecordId()).isEqualTo(5L);
        assertThat(saved.getValue().getResourceType()).isEqualTo("invoices");
        assertThat(saved.getValue().getCorrelationId()).isEqualTo("corr-1");
    }

    @Test
    void allowedRead_isSkippedUnlessReadsAreAudited() {
        AccessDecision allowed = AccessDecision.allowAll(PolicyKind.ALL_RECORDS, true, "ALL_RECORDS");

        service(true, false).record(LIST_INVOICES, null, allowed);
        verify(policyAuditLogRepository, never()).save(any());

        service(true, true).record(LIST_INVOICES, null, allowed);
        verify(policyAuditLogRepository).save(any());
    }

    @Test
    void unknownRoleAndLongReason_areStoredWithinColumnLimits() {
        RequestContext overlongRole = RequestContext.of(
                Requester.of(11L, "regional_operations_supervisor_level_two"), ResourceType.CONTRACTS, Operation.CREATE);

        service(true, false).record(overlongRole, null, AccessDecision.deny(PolicyKind.DENY_ALL, "R".repeat(400)));

        ArgumentCaptor<PolicyAuditLog> saved = ArgumentCaptor.forClass(PolicyAuditLog.class);
        verify(policyAuditLogRepository).save(saved.capture());
        assertThat(saved.getValue().getRole()).isEqualTo(PolicyAuditLog.UNKNOWN_ROLE);
        assertThat(saved.getValue().getReason()).hasSize(255);
    }

    @Test
    void knownRole_isStoredAsItsId() {
        service(true, false).record(DELETE_INVOICE, 5L, AccessDecision.deny(PolicyKind.DENY_ALL, "DENY_ALL"));

        ArgumentCaptor<PolicyAuditLog> saved = ArgumentCaptor.forClass(PolicyAuditLog.class);
        verify(policyAuditLogRepository).save(saved.capture());
        assertThat(saved.getValue().getRole()).isEqualTo("technician");
    }

    @Test
    void disabled_recordsNothing() {
        service(false, true).record(DELETE_INVOICE, 5L, AccessDecision.deny(PolicyKind.DENY_ALL, "DENY_ALL"));

        verifyNoInteractions(policyAuditLogRepository);
    }
}
