package scenerelay.coordinator.exception;

/**
 * Base class for errors that abort a coordinator run.
 */
public class CoordinatorException extends RuntimeException {

    public CoordinatorException(String message) {
        super(message);
    }

    public CoordinatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
