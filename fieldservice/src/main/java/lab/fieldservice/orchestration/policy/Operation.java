package lab.fieldservice.orchestration.policy;

public enum Operation {
    LIST(OperationClass.READ),
    GET(OperationClass.READ),
    CREATE(OperationClass.WRITE),
    UPDATE(OperationClass.WRITE),
    DELETE(OperationClass.WRITE);

    private final OperationClass operationClass;

    Operation(OperationClass operationClass) {
        this.operationClass = operationClass;
    }

    public OperationClass operationClass() {
        return operationClass;
    }

    public boolean isRead() {
        return operationClass == OperationClass.READ;
    }
}
