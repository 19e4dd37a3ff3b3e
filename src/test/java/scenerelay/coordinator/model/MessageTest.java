package scenerelay.coordinator.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MessageTest {

    private static final JobRecord JOB = JobRecord.builder().index(4).scene("scene-4").build();

    @Test
    void readyRequiresWorkerRank() {
        assertEquals(1, new Message.Ready(1).rank());
        assertThrows(IllegalArgumentException.class, () -> new Message.Ready(0));
    }

    @Test
    void assignRequiresStageAndJob() {
        assertThrows(NullPointerException.class, () -> new Message.Assign(null, JOB));
        assertThrows(NullPointerException.class, () -> new Message.Assign(StageId.STAGE1, null));
    }

    @Test
    void successResultCarriesJob() {
        Message.Result r = Message.Result.success(StageId.STAGE1, JOB);

        assertTrue(r.isSuccess());
        assertEquals(4, r.jobIndex());
        assertNull(r.failure());
    }

    @Test
    void failedResultCarriesFailure() {
        StageFailure failure = new StageFailure(StageId.STAGE3, "java.lang.IllegalStateException", "boom");
        Message.Result r = Message.Result.failed(StageId.STAGE3, 4, failure);

        assertFalse(r.isSuccess());
        assertNull(r.job());
        assertEquals(failure, r.failure());
    }

    @Test
    void resultMustCarryExactlyOneOutcome() {
        StageFailure failure = new StageFailure(StageId.STAGE1, "X", "y");

        assertThrows(IllegalArgumentException.class,
                () -> new Message.Result(StageId.STAGE1, 4, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new Message.Result(StageId.STAGE1, 4, JOB, failure));
    }

    @Test
    void resultIndexMustMatchJob() {
        assertThrows(IllegalArgumentException.class,
                () -> new Message.Result(StageId.STAGE1, 5, JOB, null));
    }

    @Test
    void failureFromExceptionKeepsTypeAndMessage() {
        StageFailure f = StageFailure.of(StageId.STAGE2, new java.io.IOException("no space"));

        assertEquals("java.io.IOException", f.errorType());
        assertEquals("no space", f.message());
        assertEquals("", StageFailure.of(StageId.STAGE2, new RuntimeException()).message());
    }
}
