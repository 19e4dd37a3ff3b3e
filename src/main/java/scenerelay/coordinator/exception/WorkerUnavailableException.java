package scenerelay.coordinator.exception;

/**
 * A worker stopped responding or the pool ran out of live workers.
 */
public class WorkerUnavailableException extends CoordinatorException {

    private final int rank;

    public WorkerUnavailableException(int rank, String message) {
        super(message);
        this.rank = rank;
    }

    /** Rank of the worker concerned, or 0 when the whole pool is gone. */
    public int rank() {
        return rank;
    }
}
