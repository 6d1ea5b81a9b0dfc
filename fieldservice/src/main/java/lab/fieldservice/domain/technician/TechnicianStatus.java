package lab.fieldservice.domain.technician;

public enum TechnicianStatus {
    AVAILABLE,
    ON_JOB,
    OFF_DUTY,
    SUSPENDED
}
