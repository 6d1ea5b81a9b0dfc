package lab.fieldservice.domain.workorder;

import lab.fieldservice.domain.SecuredRepository;

public interface WorkOrderRepository extends SecuredRepository<WorkOrder> {
}
