package lab.fieldservice.orchestration.policy;

import java.util.Optional;

/**
 * Everything the evaluator may look at for one request. Built per call and never shared.
 */
public record RequestContext(
        Requester requester,
        ResourceType resourceType,
        Operation operation,
        RecordAttributes targetRecord
) {
    public static RequestContext of(Requester requester, ResourceType resourceType, Operation operation) {
        return new RequestContext(requester, resourceType, operation, null);
    }

    public RequestContext withTarget(RecordAttributes target) {
        return new RequestContext(requester, resourceType, operation, target);
    }

    public Optional<RecordAttributes> target() {
        return Optional.ofNullable(targetRecord);
    }

    public Long requesterId() {
        return requester == null ? null : requester.id();
    }

    public String requesterRole() {
        return requester == null ? null : requester.role();
    }
}
