package scenerelay.coordinator.model;

import java.util.Objects;

/**
 * Typed failure reported for one job in one stage.
 *
 * @param stage     stage that failed
 * @param errorType exception class name, or {@link #TIMEOUT} / {@link #WORKER_LOST}
 * @param message   human readable description
 */
public record StageFailure(StageId stage, String errorType, String message) {

    public static final String TIMEOUT = "TIMEOUT";
    public static final String WORKER_LOST = "WORKER_LOST";
    public static final String IDENTITY = "IDENTITY";

    public StageFailure {
        Objects.requireNonNull(stage, "stage is required");
        Objects.requireNonNull(errorType, "errorType is required");
        message = message == null ? "" : message;
    }

    public static StageFailure of(StageId stage, Throwable t) {
        return new StageFailure(stage, t.getClass().getName(), t.getMessage());
    }

    public static StageFailure timeout(StageId stage, int rank) {
        return new StageFailure(stage, TIMEOUT, "No result from worker " + rank + " before the stage timeout");
    }

    public static StageFailure workerLost(StageId stage, int rank) {
        return new StageFailure(stage, WORKER_LOST, "Worker " + rank + " disconnected while holding the job");
    }

    @Override
    public String toString() {
        return stage + ": " + errorType + " - " + message;
    }
}
