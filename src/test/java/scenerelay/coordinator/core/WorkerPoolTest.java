package scenerelay.coordinator.core;

import org.junit.jupiter.api.Test;
import scenerelay.coordinator.model.WorkerState;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPoolTest {

    @Test
    void workersStartUnannounced() {
        WorkerPool pool = new WorkerPool(3);

        assertEquals(3, pool.liveCount());
        assertFalse(pool.hasIdle());
        assertEquals(List.of(1, 2, 3), pool.ranksIn(WorkerState.DONE));
    }

    @Test
    void idleWorkersAreHandedOutInReadyOrder() {
        WorkerPool pool = new WorkerPool(3);
        pool.markReady(3);
        pool.markReady(1);
        pool.markReady(3); // duplicate READY keeps its place

        assertEquals(Optional.of(3), pool.nextIdle());
        assertEquals(Optional.of(1), pool.nextIdle());
        assertEquals(Optional.empty(), pool.nextIdle());
    }

    @Test
    void busyWorkerHoldsItsSlotUntilDone() {
        WorkerPool pool = new WorkerPool(2);
        pool.markReady(1);
        pool.nextIdle();
        pool.markBusy(1, 7, 1_000L);

        assertTrue(pool.isBusy(1));
        assertEquals(1, pool.busyCount());
        assertEquals(1, pool.assignedThisRound(1));
        assertFalse(pool.markReady(1), "READY while busy is ignored");

        assertEquals(7, pool.markDone(1));
        assertEquals(WorkerState.DONE, pool.state(1));
        assertThrows(IllegalStateException.class, () -> pool.markDone(1));
    }

    @Test
    void expiredDeadlines() {
        WorkerPool pool = new WorkerPool(2);
        pool.markBusy(1, 0, 100L);
        pool.markBusy(2, 1, 500L);

        assertEquals(List.of(1), pool.expired(200L));
        assertEquals(List.of(1, 2), pool.expired(500L));
    }

    @Test
    void deadWorkerReturnsItsSlotAndLeavesThePool() {
        WorkerPool pool = new WorkerPool(2);
        pool.markBusy(2, 4, 0L);

        assertEquals(Optional.of(4), pool.markDead(2));
        assertEquals(Optional.empty(), pool.markDead(2));
        assertFalse(pool.isLive(2));
        assertFalse(pool.markReady(2));
        assertEquals(1, pool.liveCount());
    }

    @Test
    void exitIsRecordedOnce() {
        WorkerPool pool = new WorkerPool(1);
        pool.markReady(1);

        assertTrue(pool.markExited(1));
        assertFalse(pool.markExited(1));
        assertFalse(pool.hasIdle());
        assertEquals(0, pool.liveCount());
    }

    @Test
    void resetRoundClearsCounters() {
        WorkerPool pool = new WorkerPool(1);
        pool.markBusy(1, 0, 0L);
        pool.markDone(1);
        pool.resetRound();
        assertEquals(0, pool.assignedThisRound(1));
    }

    @Test
    void rejectsUnknownRank() {
        WorkerPool pool = new WorkerPool(2);
        assertThrows(IllegalArgumentException.class, () -> pool.state(0));
        assertThrows(IllegalArgumentException.class, () -> pool.markReady(3));
    }
}
