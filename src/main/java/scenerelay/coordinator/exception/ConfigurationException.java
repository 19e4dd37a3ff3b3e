package scenerelay.coordinator.exception;

/**
 * Invalid or conflicting run configuration. Raised before any job is dispatched.
 */
public class ConfigurationException extends CoordinatorException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
