package scenerelay.coordinator.model;

/**
 * Coordinator-side view of a worker within a run.
 */
public enum WorkerState {
    /** Announced READY, parked waiting for an instruction */
    IDLE,
    /** Holding exactly one job of the current round */
    BUSY,
    /** Not announced yet, or result returned and READY still pending */
    DONE,
    /** Timed out or disconnected; excluded for the rest of the run */
    DEAD,
    /** EXIT sent */
    EXITED
}
