package lab.fieldservice.orchestration;

import lab.fieldservice.adapter.EntityGateway;
import lab.fieldservice.adapter.EntityGateway.PageResult;
import lab.fieldservice.adapter.ListQuery;
import lab.fieldservice.domain.RowScoped;
import lab.fieldservice.orchestration.policy.AccessDecision;
import lab.fieldservice.orchestration.policy.Operation;
import lab.fieldservice.orchestration.policy.Policy;
import lab.fieldservice.orchestration.policy.PolicyEvaluator;
import lab.fieldservice.orchestration.policy.PolicyRegistry;
import lab.fieldservice.orchestration.policy.RecordAttributes;
import lab.fieldservice.orchestration.policy.RequestContext;
import lab.fieldservice.orchestration.policy.Requester;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Single entry point for every data operation. Each call resolves the requester's policy,
 * evaluates it, records the decision and only then touches the gateway.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RowLevelSecurityMediator {

    private final PolicyRegistry policyRegistry;
    private final PolicyEvaluator policyEvaluator;
    private final AccessAuditService accessAuditService;

    public <T extends RowScoped> AccessResult<PageResult<T>> list(
            Requester requester, EntityGateway<T> gateway, ListQuery query) {
        RequestContext context = RequestContext.of(requester, gateway.getResourceType(), Operation.LIST);
        AccessDecision decision = decide(context, null);
        if (decision.isDenied()) {
            return AccessResult.forbidden(decision);
        }

        PageResult<T> page = gateway.findAll(decision.filterPredicate().orElse(null), query);
        log.info(
                "event=rls.list resource={} role={} outcome={} rlsApplied={} count={}",
                context.resourceType().id(),
                context.requesterRole(),
                decision.outcome(),
                decision.policyApplied(),
                page.data().size()
        );
        return AccessResult.ok(page, decision);
    }

    // Records outside the requester's scope are reported as missing so their existence is not revealed.
    public <T extends RowScoped> AccessResult<T> get(Requester requester, EntityGateway<T> gateway, Long id) {
        RequestContext context = RequestContext.of(requester, gateway.getResourceType(), Operation.GET);
        Optional<T> found = gateway.findById(id);
        if (found.isEmpty()) {
            return AccessResult.notFound("RECORD_NOT_FOUND");
        }

        T record = found.get();
        RecordAttributes attributes = record.attributes();
        AccessDecision decision = decide(context.withTarget(attributes), id);
        if (!decision.admits(attributes)) {
            log.info(
                    "event=rls.get.hidden resource={} id={} role={} reason={}",
                    context.resourceType().id(),
                    id,
                    context.requesterRole(),
                    decision.reason()
            );
            return AccessResult.notFound(decision);
        }
        return AccessResult.ok(record, decision);
    }

    public <T extends RowScoped> AccessResult<T> create(Requester requester, EntityGateway<T> gateway, T candidate) {
        RequestContext context = RequestContext.of(requester, gateway.getResourceType(), Operation.CREATE);
        RecordAttributes attributes = candidate.attributes();
        AccessDecision decision = decide(context.withTarget(attributes), null);
        if (!decision.admits(attributes)) {
            logDenied(context, null, decision);
            return AccessResult.forbidden(decision);
        }

        T saved = gateway.save(candidate);
        log.info("event=rls.create resource={} id={} role={}", context.resourceType().id(), saved.getId(), context.requesterRole());
        return AccessResult.ok(saved, decision);
    }

    /**
     * Applies {@code changes} only when the record is in scope before and after the change, so a
     * requester cannot move a row out of their own scope.
     */
    public <T extends RowScoped> AccessResult<T> update(
            Requester requester, EntityGateway<T> gateway, Long id, Consumer<T> changes) {
        RequestContext context = RequestContext.of(requester, gateway.getResourceType(), Operation.UPDATE);
        Optional<T> found = gateway.findById(id);
        if (found.isEmpty()) {
            return AccessResult.notFound("RECORD_NOT_FOUND");
        }

        T record = found.get();
        RecordAttributes before = record.attributes();
        AccessDecision pre = decide(context.withTarget(before), id);
        if (!pre.admits(before)) {
            logDenied(context, id, pre);
            return AccessResult.forbidden(pre);
        }

        changes.accept(record);
        RecordAttributes after = record.attributes();
        AccessDecision post = decide(context.withTarget(after), id);
        if (!post.admits(after)) {
            logDenied(context, id, post);
            return AccessResult.forbidden(post);
        }

        T saved = gateway.save(record);
        log.info("event=rls.update resource={} id={} role={}", context.resourceType().id(), id, context.requesterRole());
        return AccessResult.ok(saved, post);
    }

    public <T extends RowScoped> AccessResult<T> delete(Requester requester, EntityGateway<T> gateway, Long id) {
        RequestContext context = RequestContext.of(requester, gateway.getResourceType(), Operation.DELETE);
        Optional<T> found = gateway.findById(id);
        if (found.isEmpty()) {
            return AccessResult.notFound("RECORD_NOT_FOUND");
        }

        T record = found.get();
        RecordAttributes attributes = record.attributes();
        AccessDecision decision = decide(context.withTarget(attributes), id);
        if (!decision.admits(attributes)) {
            logDenied(context, id, decision);
            return AccessResult.forbidden(decision);
        }

        gateway.delete(record);
        log.info("event=rls.delete resource={} id={} role={}", context.resourceType().id(), id, context.requesterRole());
        return AccessResult.ok(record, decision);
    }

    private AccessDecision decide(RequestContext context, Long recordId) {
        Policy policy = policyRegistry.resolve(
                context.requesterRole(),
                context.resourceType(),
                context.operation().operationClass()
        );
        AccessDecision decision = policyEvaluator.evaluate(policy, context);
        accessAuditService.record(context, recordId, decision);
        log.debug(
                "event=rls.decision resource={} operation={} role={} kind={} outcome={} reason={}",
                context.resourceType().id(),
                context.operation(),
                context.requesterRole(),
                decision.policyKind().id(),
                decision.outcome(),
                decision.reason()
        );
        return decision;
    }

    private void logDenied(RequestContext context, Long id, AccessDecision decision) {
        log.warn(
                "event=rls.denied resource={} operation={} id={} requesterId={} role={} reason={}",
                context.resourceType().id(),
                context.operation(),
                id,
                context.requesterId(),
                context.requesterRole(),
                decision.reason()
        );
    }
}
