package scenerelay.coordinator.core;

import scenerelay.coordinator.model.StageFailure;
import scenerelay.coordinator.model.StageId;

/**
 * Observer of the dispatch protocol. Called on the coordinator thread, in
 * protocol order, so the calls form a trace of the run.
 */
public interface RoundListener {

    RoundListener NOOP = new RoundListener() {
    };

    default void onRoundStart(StageId stage, int jobs) {
    }

    default void onAssign(StageId stage, int rank, int jobIndex) {
    }

    default void onGather(StageId stage, int rank, int jobIndex) {
    }

    default void onJobFailed(StageId stage, int jobIndex, StageFailure failure) {
    }

    default void onRoundComplete(StageId stage) {
    }

    default void onStageSkipped(StageId stage) {
    }

    default void onAggregated(double value) {
    }

    default void onWorkerLost(int rank, String reason) {
    }

    default void onExit(int rank) {
    }
}
