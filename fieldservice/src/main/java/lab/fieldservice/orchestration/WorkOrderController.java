package lab.fieldservice.orchestration;

import lab.fieldservice.adapter.EntityGateway;
import lab.fieldservice.config.RlsProperties;
import lab.fieldservice.domain.workorder.WorkOrder;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/work_orders")
public class WorkOrderController extends SecuredEntityController<WorkOrder, WorkOrderRequest> {

    public WorkOrderController(
            RowLevelSecurityMediator mediator,
            EntityGateway<WorkOrder> gateway,
            RequesterResolver requesterResolver,
            RlsProperties rlsProperties
    ) {
        super(mediator, gateway, requesterResolver, rlsProperties);
    }

    @Override
    protected String displayName() {
        return "Work order";
    }

    @Override
    protected WorkOrder toEntity(WorkOrderRequest request) {
        WorkOrder workOrder = WorkOrder.opened(
                required(request.title(), "title"),
                request.description(),
                request.priority(),
                required(request.customerId(), "customerId")
        );
        if (request.assignedTechnicianId() != null) {
            workOrder.assignTo(request.assignedTechnicianId());
        }
        return workOrder;
    }

    @Override
    protected void applyChanges(WorkOrder workOrder, WorkOrderRequest request) {
        workOrder.revise(request.title(), request.description(), request.priority(),
                request.status(), request.customerId(), request.active());
        if (request.assignedTechnicianId() != null) {
            workOrder.assignTo(request.assignedTechnicianId());
        }
    }
}
