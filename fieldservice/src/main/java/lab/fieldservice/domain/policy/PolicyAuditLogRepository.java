package lab.fieldservice.domain.policy;

import lab.fieldservice.domain.SecuredRepository;

import java.util.List;

public interface PolicyAuditLogRepository extends SecuredRepository<PolicyAuditLog> {
    List<PolicyAuditLog> findByResourceTypeOrderByCreatedAtAsc(String resourceType);
}
