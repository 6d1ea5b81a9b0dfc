package lab.fieldservice.orchestration.policy;

import java.util.Locale;
import java.util.Optional;

/**
 * The principal behind a request. Profile ids are present only for users linked to a
 * customer or technician record.
 */
public record Requester(
        Long id,
        String role,
        Long customerProfileId,
        Long technicianProfileId
) {
    public Requester {
        role = role == null ? null : role.trim().toLowerCase(Locale.ROOT);
    }

    public static Requester of(Long id, String role) {
        return new Requester(id, role, null, null);
    }

    public Optional<Long> identity(OwnerValue ownerValue) {
        return Optional.ofNullable(switch (ownerValue) {
            case USER_ID -> id;
            case CUSTOMER_PROFILE_ID -> customerProfileId;
            case TECHNICIAN_PROFILE_ID -> technicianProfileId;
        });
    }
}
