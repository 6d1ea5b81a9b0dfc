package lab.fieldservice.orchestration;

import jakarta.servlet.http.HttpServletRequest;
import lab.fieldservice.common.InvalidRequestException;
import lab.fieldservice.common.RequesterHeaders;
import lab.fieldservice.orchestration.policy.Requester;
import org.springframework.stereotype.Component;

/**
 * Builds the {@link Requester} from the identity headers. Only the user id is mandatory; a
 * missing role resolves to no policy at all.
 */
@Component
public class RequesterResolver {

    public Requester resolve(HttpServletRequest request) {
        Long userId = parseId(request.getHeader(RequesterHeaders.USER_ID), RequesterHeaders.USER_ID);
        if (userId == null) {
            throw new InvalidRequestException("Missing required header: " + RequesterHeaders.USER_ID);
        }
        String role = request.getHeader(RequesterHeaders.ROLE);
        return new Requester(
                userId,
                role == null || role.isBlank() ? null : role,
                parseId(request.getHeader(RequesterHeaders.CUSTOMER_PROFILE_ID), RequesterHeaders.CUSTOMER_PROFILE_ID),
                parseId(request.getHeader(RequesterHeaders.TECHNICIAN_PROFILE_ID), RequesterHeaders.TECHNICIAN_PROFILE_ID)
        );
    }

    private Long parseId(String raw, String header) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidRequestException("Invalid " + header + " header: must be a numeric id");
        }
    }
}
