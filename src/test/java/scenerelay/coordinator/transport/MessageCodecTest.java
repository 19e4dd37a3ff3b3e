package scenerelay.coordinator.transport;

import org.junit.jupiter.api.Test;
import scenerelay.coordinator.model.JobRecord;
import scenerelay.coordinator.model.Message;
import scenerelay.coordinator.model.StageFailure;
import scenerelay.coordinator.model.StageId;

import static org.junit.jupiter.api.Assertions.*;

class MessageCodecTest {

    private final MessageCodec codec = new MessageCodec();

    @Test
    void encodesTypeDiscriminator() {
        String json = codec.encode(new Message.Ready(2));

        assertTrue(json.contains("\"type\":\"READY\""), json);
        assertTrue(json.contains("\"rank\":2"), json);
        assertFalse(json.contains("\n"));
    }

    @Test
    void assignSurvivesWireForm() {
        JobRecord job = JobRecord.builder()
                .index(7)
                .scene("/data/scene7.mtl")
                .parameter("sensor", "LS8")
                .output("toa", "/out/toa7.kea")
                .aotValue(0.13)
                .completedStage(StageId.STAGE1)
                .build();

        Message decoded = codec.decode(codec.encode(new Message.Assign(StageId.STAGE2, job)));

        Message.Assign assign = assertInstanceOf(Message.Assign.class, decoded);
        assertEquals(StageId.STAGE2, assign.stage());
        assertEquals(job, assign.job());
    }

    @Test
    void failedResultSurvivesWireForm() {
        StageFailure failure = new StageFailure(StageId.STAGE4, "java.io.IOException", "disk full");
        Message decoded = codec.decode(codec.encode(Message.Result.failed(StageId.STAGE4, 3, failure)));

        Message.Result result = assertInstanceOf(Message.Result.class, decoded);
        assertFalse(result.isSuccess());
        assertEquals(3, result.jobIndex());
        assertEquals(failure, result.failure());
    }

    @Test
    void rejectsMalformedFrames() {
        assertThrows(TransportException.class, () -> codec.decode(""));
        assertThrows(TransportException.class, () -> codec.decode("{not json"));
        assertThrows(TransportException.class, () -> codec.decode("{\"type\":\"SHUTDOWN\"}"));
        assertThrows(TransportException.class, () -> codec.decode("{\"type\":\"READY\",\"rank\":1,\"extra\":true}"));
    }

    @Test
    void rejectsInvalidPayload() {
        // rank 0 is the coordinator
        assertThrows(TransportException.class, () -> codec.decode("{\"type\":\"READY\",\"rank\":0}"));
    }
}
