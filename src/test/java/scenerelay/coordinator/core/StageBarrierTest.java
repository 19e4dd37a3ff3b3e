package scenerelay.coordinator.core;

import org.junit.jupiter.api.Test;
import scenerelay.coordinator.model.StageId;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class StageBarrierTest {

    @Test
    void completesWhenEverySlotArrives() {
        StageBarrier barrier = new StageBarrier(StageId.STAGE1, 3);

        barrier.arrive(2);
        barrier.arrive(0);
        assertFalse(barrier.isComplete());
        assertEquals(1, barrier.remaining());
        assertThrows(IllegalStateException.class, barrier::ensureComplete);

        barrier.arrive(1);
        assertTrue(barrier.isComplete());
        assertDoesNotThrow(barrier::ensureComplete);
    }

    @Test
    void emptyRoundIsComplete() {
        StageBarrier barrier = new StageBarrier(StageId.STAGE4, 0);
        assertTrue(barrier.isComplete());
    }

    @Test
    void slotArrivesOnlyOnce() {
        StageBarrier barrier = new StageBarrier(StageId.STAGE2, 2);
        barrier.arrive(1);

        assertTrue(barrier.hasArrived(1));
        assertThrows(IllegalStateException.class, () -> barrier.arrive(1));
        assertThrows(IllegalArgumentException.class, () -> barrier.arrive(2));
        assertThrows(IllegalArgumentException.class, () -> barrier.arrive(-1));
    }

    @Test
    void awaitReturnsFalseOnTimeout() throws InterruptedException {
        StageBarrier barrier = new StageBarrier(StageId.STAGE3, 1);
        assertFalse(barrier.await(Duration.ofMillis(20)));
    }

    @Test
    void awaitWakesOnLastArrival() throws Exception {
        StageBarrier barrier = new StageBarrier(StageId.STAGE1, 2);
        barrier.arrive(0);

        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return barrier.await(Duration.ofSeconds(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        });

        Thread.sleep(50);
        barrier.arrive(1);
        assertTrue(waiter.get(5, TimeUnit.SECONDS));
    }
}
