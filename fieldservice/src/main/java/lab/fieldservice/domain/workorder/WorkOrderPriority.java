package lab.fieldservice.domain.workorder;

public enum WorkOrderPriority {
    LOW,
    NORMAL,
    HIGH,
    URGENT
}
