package lab.fieldservice.domain.contract;

public enum ContractStatus {
    DRAFT,
    ACTIVE,
    EXPIRED,
    CANCELLED
}
