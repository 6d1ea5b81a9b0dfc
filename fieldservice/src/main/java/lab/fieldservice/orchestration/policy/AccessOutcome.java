package lab.fieldservice.orchestration.policy;

public enum AccessOutcome {
    ALLOW_ALL,
    ALLOW_FILTERED,
    DENY
}
