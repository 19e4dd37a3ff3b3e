package scenerelay.coordinator.exception;

/**
 * The cross-job aggregation step failed.
 */
public class AggregationException extends CoordinatorException {

    public AggregationException(String message, Throwable cause) {
        super(message, cause);
    }
}
