package scenerelay.coordinator.server;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import scenerelay.coordinator.config.CoordinatorConfig;
import scenerelay.coordinator.core.Coordinator;
import scenerelay.coordinator.core.PipelinePlan;
import scenerelay.coordinator.model.Envelope;
import scenerelay.coordinator.model.JobRecord;
import scenerelay.coordinator.model.Message;
import scenerelay.coordinator.model.StageId;
import scenerelay.coordinator.transport.TransportException;
import scenerelay.worker.StageFunctions;
import scenerelay.worker.Worker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Coordinator and workers talking over loopback TCP.
 */
class NettyTransportTest {

    private static final Duration WAIT = Duration.ofSeconds(10);
    private static final String HOST = "127.0.0.1";

    private NettyCoordinatorServer server;
    private int port;

    @BeforeEach
    void setUp() {
        server = new NettyCoordinatorServer(2);
        port = server.start(HOST, 0);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    @DisplayName("Full pipeline over TCP with two worker clients")
    void runsPipelineOverTcp() throws InterruptedException {
        assertTrue(port > 0);
        StageFunctions stages = StageFunctions.of(
                job -> job.withAotValue(0.2),
                job -> job.withOutput("sref", job.scene() + ".sref"),
                job -> job.withOutput("meta", job.scene() + ".json"),
                job -> job.withOutput("final", "ok"));

        List<Thread> threads = new ArrayList<>();
        List<Worker> workers = new ArrayList<>();
        for (int rank = 1; rank <= 2; rank++) {
            Worker worker = new Worker(NettyWorkerClient.connect(HOST, port, rank, WAIT), stages);
            workers.add(worker);
            Thread t = new Thread(worker);
            t.start();
            threads.add(t);
        }
        assertTrue(server.awaitWorkers(WAIT));

        List<JobRecord> jobs = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            jobs.add(JobRecord.builder().index(i).scene("scene-" + i).build());
        }

        CoordinatorConfig config = CoordinatorConfig.defaults().withPollInterval(Duration.ofMillis(20));
        List<JobRecord> done;
        try (Coordinator coordinator = new Coordinator(server, config, PipelinePlan.all())) {
            done = coordinator.run(jobs);
        }

        assertEquals(5, done.size());
        for (JobRecord job : done) {
            assertEquals(0.2, job.aotValue(), 1e-12);
            assertEquals(job.scene() + ".sref", job.outputs().get("sref"));
            assertEquals("ok", job.outputs().get("final"));
            assertEquals(4, job.completedStages().size());
        }

        for (Thread t : threads) {
            t.join(WAIT.toMillis());
            assertFalse(t.isAlive());
        }
        assertTrue(workers.stream().allMatch(Worker::hasExited));
        assertEquals(20, workers.stream().mapToInt(Worker::processed).sum());
    }

    @Test
    void firstReadyBindsConnectionToRank() throws InterruptedException {
        NettyWorkerClient client = NettyWorkerClient.connect(HOST, port, 2, WAIT);
        try {
            client.send(new Message.Ready(2));

            Envelope envelope = server.poll(WAIT).orElseThrow();
            assertEquals(2, envelope.source());
            assertTrue(server.isConnected(2));
            assertFalse(server.isConnected(1));

            server.send(2, new Message.Exit());
            assertInstanceOf(Message.Exit.class, client.receive());
        } finally {
            client.close();
        }
    }

    @Test
    void disconnectIsVisibleToCoordinator() throws InterruptedException {
        NettyWorkerClient client = NettyWorkerClient.connect(HOST, port, 1, WAIT);
        client.send(new Message.Ready(1));
        server.poll(WAIT).orElseThrow();
        assertTrue(server.isConnected(1));

        client.close();

        long deadline = System.currentTimeMillis() + WAIT.toMillis();
        while (server.isConnected(1) && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertFalse(server.isConnected(1));
        assertThrows(TransportException.class, () -> server.send(1, new Message.Exit()));
    }

    @Test
    void rankOutsidePoolIsRejected() throws InterruptedException {
        NettyWorkerClient client = NettyWorkerClient.connect(HOST, port, 3, WAIT);
        try {
            client.send(new Message.Ready(3));

            assertTrue(server.poll(Duration.ofMillis(300)).isEmpty());
            assertFalse(server.awaitWorkers(Duration.ofMillis(50)));
            // server closes the connection, which ends the worker's receive
            assertThrows(TransportException.class, client::receive);
        } finally {
            client.close();
        }
    }

    @Test
    void connectFailsWithoutServer() {
        server.close();
        assertThrows(TransportException.class,
                () -> NettyWorkerClient.connect(HOST, port, 1, Duration.ofSeconds(2)));
    }

    @Test
    void assignSurvivesTcpFraming() throws InterruptedException {
        NettyWorkerClient client = NettyWorkerClient.connect(HOST, port, 1, WAIT);
        try {
            client.send(new Message.Ready(1));
            server.poll(WAIT).orElseThrow();

            JobRecord job = JobRecord.builder().index(9).scene("line\nbreak scene").parameter("k", "v").build();
            server.send(1, new Message.Assign(StageId.STAGE3, job));

            Message.Assign received = assertInstanceOf(Message.Assign.class, client.receive());
            assertEquals(job, received.job());
        } finally {
            client.close();
        }
    }
}
