package scenerelay.coordinator.transport;

import scenerelay.coordinator.exception.CoordinatorException;

/**
 * A message could not be delivered, encoded or decoded.
 */
public class TransportException extends CoordinatorException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
