package lab.fieldservice.domain.workorder;

public enum WorkOrderStatus {
    PENDING,
    ASSIGNED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED
}
