package lab.fieldservice.orchestration;

import lab.fieldservice.domain.workorder.WorkOrderPriority;
import lab.fieldservice.domain.workorder.WorkOrderStatus;

public record WorkOrderRequest(
        String title,
        String description,
        WorkOrderPriority priority,
        WorkOrderStatus status,
        Long customerId,
        Long assignedTechnicianId,
        Boolean active
) {
}
