package lab.fieldservice.common;

/**
 * Identity headers set by the trusted gateway in front of this service.
 */
public final class RequesterHeaders {

    public static final String USER_ID = "X-User-Id";
    public static final String ROLE = "X-User-Role";
    public static final String CUSTOMER_PROFILE_ID = "X-Customer-Profile-Id";
    public static final String TECHNICIAN_PROFILE_ID = "X-Technician-Profile-Id";

    private RequesterHeaders() {
    }
}
