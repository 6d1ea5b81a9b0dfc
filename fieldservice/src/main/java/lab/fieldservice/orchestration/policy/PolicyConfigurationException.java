package lab.fieldservice.orchestration.policy;

/**
 * Raised when the policy table is wired incorrectly. Only thrown while loading or reloading
 * policies, never while evaluating a request.
 */
public class PolicyConfigurationException extends RuntimeException {

    public PolicyConfigurationException(String message) {
        super(message);
    }
}
