package scenerelay.coordinator.exception;

import scenerelay.coordinator.model.StageFailure;
import scenerelay.coordinator.model.StageId;

/**
 * A stage function failed for one job.
 */
public class StageExecutionException extends CoordinatorException {

    private final StageId stage;
    private final int jobIndex;
    private final StageFailure failure;

    public StageExecutionException(int jobIndex, StageFailure failure) {
        super("Stage " + failure.stage().number() + " failed for job " + jobIndex + ": "
                + failure.errorType() + " - " + failure.message());
        this.stage = failure.stage();
        this.jobIndex = jobIndex;
        this.failure = failure;
    }

    public StageId stage() {
        return stage;
    }

    public int jobIndex() {
        return jobIndex;
    }

    public StageFailure failure() {
        return failure;
    }
}
