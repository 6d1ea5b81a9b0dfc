package lab.fieldservice.orchestration;

import jakarta.servlet.http.HttpServletRequest;
import lab.fieldservice.adapter.EntityGateway;
import lab.fieldservice.adapter.EntityGateway.PageResult;
import lab.fieldservice.adapter.ListQuery;
import lab.fieldservice.common.ErrorResponse;
import lab.fieldservice.config.RlsProperties;
import lab.fieldservice.domain.policy.PolicyAuditLog;
import lab.fieldservice.orchestration.policy.Requester;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/admin/policy-audits")
@Slf4j
public class PolicyAuditController {

    private final RowLevelSecurityMediator mediator;
    private final EntityGateway<PolicyAuditLog> gateway;
    private final RequesterResolver requesterResolver;
    private final RlsProperties.PaginationProperties pagination;

    public PolicyAuditController(
            RowLevelSecurityMediator mediator,
            EntityGateway<PolicyAuditLog> gateway,
            RequesterResolver requesterResolver,
            RlsProperties rlsProperties
    ) {
        this.mediator = mediator;
        this.gateway = gateway;
        this.requesterResolver = requesterResolver;
        this.pagination = rlsProperties.pagination();
    }

    // Recorded RLS decisions, newest first. Access is governed by the audit_logs policies.
    @GetMapping
    public ResponseEntity<?> list(@RequestParam Map<String, String> params, HttpServletRequest request) {
        Requester requester = requesterResolver.resolve(request);
        ListQuery query = ListQuery.from(params, gateway.metadata(), pagination.defaultLimit(), pagination.maxLimit());
        log.info("event=policy_audit.list.request role={} filters={}", requester.role(), query.filters());

        AccessResult<PageResult<PolicyAuditLog>> result = mediator.list(requester, gateway, query);
        if (!result.isOk()) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ErrorResponse.of(
                    HttpStatus.FORBIDDEN.value(), "Forbidden", "Insufficient permissions to read policy audits"));
        }
        log.info("event=policy_audit.list.response count={}", result.body().data().size());
        return ResponseEntity.ok(ListResponse.of(result.body(), result.rlsApplied()));
    }
}
