package scenerelay.coordinator.core;

import scenerelay.coordinator.model.StageId;

import java.time.Duration;
import java.util.BitSet;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rendezvous for one stage round.
 *
 * Opened with the number of job slots in the round; every slot arrives
 * exactly once when its result has been gathered (or the job has been
 * written off). The round is complete only when all slots have arrived, and
 * no work of the next stage may be dispatched before that.
 */
public final class StageBarrier {

    private final StageId stage;
    private final int expected;
    private final BitSet arrived;
    private int count;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition completed = lock.newCondition();

    public StageBarrier(StageId stage, int expected) {
        if (expected < 0) {
            throw new IllegalArgumentException("expected must not be negative");
        }
        this.stage = stage;
        this.expected = expected;
        this.arrived = new BitSet(expected);
    }

    public StageId stage() {
        return stage;
    }

    public int expected() {
        return expected;
    }

    /**
     * Record that {@code slot} has been gathered.
     *
     * @throws IllegalArgumentException if the slot is outside the round
     * @throws IllegalStateException    if the slot already arrived
     */
    public void arrive(int slot) {
        if (slot < 0 || slot >= expected) {
            throw new IllegalArgumentException("slot " + slot + " is not part of the " + stage + " round");
        }
        lock.lock();
        try {
            if (arrived.get(slot)) {
                throw new IllegalStateException("slot " + slot + " already gathered for " + stage);
            }
            arrived.set(slot);
            count++;
            if (count == expected) {
                completed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean hasArrived(int slot) {
        lock.lock();
        try {
            return arrived.get(slot);
        } finally {
            lock.unlock();
        }
    }

    public boolean isComplete() {
        lock.lock();
        try {
            return count == expected;
        } finally {
            lock.unlock();
        }
    }

    public int remaining() {
        lock.lock();
        try {
            return expected - count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait until every slot has arrived.
     *
     * @return true if complete, false if the timeout elapsed first
     */
    public boolean await(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (count < expected) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = completed.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws IllegalStateException unless every slot has arrived
     */
    public void ensureComplete() {
        lock.lock();
        try {
            if (count < expected) {
                throw new IllegalStateException(stage + " round incomplete: "
                        + count + " of " + expected + " jobs gathered");
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "StageBarrier{" + stage + ", " + (expected - remaining()) + "/" + expected + "}";
    }
}
