package lab.fieldservice.orchestration;

public enum AccessStatus {
    OK,
    NOT_FOUND,
    FORBIDDEN
}
