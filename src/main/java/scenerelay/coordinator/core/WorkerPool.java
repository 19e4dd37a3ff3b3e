package scenerelay.coordinator.core;

import scenerelay.coordinator.model.WorkerState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Coordinator-only bookkeeping of the fixed worker pool (ranks 1..N).
 * Not thread-safe; owned by the coordinator thread.
 */
final class WorkerPool {

    private static final int NO_JOB = -1;

    private final int size;
    private final WorkerState[] states;
    private final int[] inFlight;
    private final long[] deadlines;
    private final int[] assignedThisRound;
    private final Deque<Integer> idle = new ArrayDeque<>();

    WorkerPool(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("worker pool size must be >= 1");
        }
        this.size = size;
        this.states = new WorkerState[size + 1];
        this.inFlight = new int[size + 1];
        this.deadlines = new long[size + 1];
        this.assignedThisRound = new int[size + 1];
        for (int rank = 1; rank <= size; rank++) {
            states[rank] = WorkerState.DONE;
            inFlight[rank] = NO_JOB;
        }
    }

    int size() {
        return size;
    }

    WorkerState state(int rank) {
        check(rank);
        return states[rank];
    }

    /** Clear per-round counters; parked workers stay parked. */
    void resetRound() {
        for (int rank = 1; rank <= size; rank++) {
            assignedThisRound[rank] = 0;
        }
    }

    /**
     * Worker announced READY.
     *
     * @return false if the worker is no longer part of the pool
     */
    boolean markReady(int rank) {
        check(rank);
        WorkerState s = states[rank];
        if (s == WorkerState.DEAD || s == WorkerState.EXITED || s == WorkerState.BUSY) {
            return false;
        }
        if (s != WorkerState.IDLE) {
            states[rank] = WorkerState.IDLE;
            idle.addLast(rank);
        }
        return true;
    }

    /** Next parked worker, in the order READY arrived. */
    Optional<Integer> nextIdle() {
        Integer rank = idle.pollFirst();
        return Optional.ofNullable(rank);
    }

    void markBusy(int rank, int slot, long deadlineNanos) {
        check(rank);
        if (states[rank] == WorkerState.IDLE) {
            idle.remove(rank);
        }
        states[rank] = WorkerState.BUSY;
        inFlight[rank] = slot;
        deadlines[rank] = deadlineNanos;
        assignedThisRound[rank]++;
    }

    /**
     * Result received from a busy worker.
     *
     * @return the slot it was holding
     */
    int markDone(int rank) {
        check(rank);
        if (states[rank] != WorkerState.BUSY) {
            throw new IllegalStateException("worker " + rank + " is " + states[rank] + ", not BUSY");
        }
        int slot = inFlight[rank];
        inFlight[rank] = NO_JOB;
        states[rank] = WorkerState.DONE;
        return slot;
    }

    /**
     * Exclude a worker for the rest of the run.
     *
     * @return the slot it was holding, or empty
     */
    Optional<Integer> markDead(int rank) {
        check(rank);
        int slot = inFlight[rank];
        inFlight[rank] = NO_JOB;
        idle.remove(rank);
        states[rank] = WorkerState.DEAD;
        return slot == NO_JOB ? Optional.empty() : Optional.of(slot);
    }

    /**
     * @return false if EXIT was already recorded for this worker
     */
    boolean markExited(int rank) {
        check(rank);
        if (states[rank] == WorkerState.EXITED) {
            return false;
        }
        idle.remove(rank);
        inFlight[rank] = NO_JOB;
        states[rank] = WorkerState.EXITED;
        return true;
    }

    boolean isBusy(int rank) {
        return state(rank) == WorkerState.BUSY;
    }

    boolean isLive(int rank) {
        WorkerState s = state(rank);
        return s != WorkerState.DEAD && s != WorkerState.EXITED;
    }

    int liveCount() {
        int n = 0;
        for (int rank = 1; rank <= size; rank++) {
            if (isLive(rank)) {
                n++;
            }
        }
        return n;
    }

    int busyCount() {
        return ranksIn(WorkerState.BUSY).size();
    }

    boolean hasIdle() {
        return !idle.isEmpty();
    }

    /** Busy workers whose deadline is at or before {@code nowNanos}. */
    List<Integer> expired(long nowNanos) {
        List<Integer> out = new ArrayList<>();
        for (int rank = 1; rank <= size; rank++) {
            if (states[rank] == WorkerState.BUSY && nowNanos - deadlines[rank] >= 0) {
                out.add(rank);
            }
        }
        return out;
    }

    List<Integer> ranksIn(WorkerState state) {
        List<Integer> out = new ArrayList<>();
        for (int rank = 1; rank <= size; rank++) {
            if (states[rank] == state) {
                out.add(rank);
            }
        }
        return out;
    }

    int assignedThisRound(int rank) {
        check(rank);
        return assignedThisRound[rank];
    }

    private void check(int rank) {
        if (rank < 1 || rank > size) {
            throw new IllegalArgumentException("No worker with rank " + rank);
        }
    }
}
