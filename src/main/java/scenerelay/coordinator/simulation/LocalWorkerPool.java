package scenerelay.coordinator.simulation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenerelay.coordinator.transport.InProcessTransport;
import scenerelay.worker.StageFunctions;
import scenerelay.worker.Worker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * N worker threads attached to an {@link InProcessTransport}.
 * Call start() to spawn the workers, close() to tear them down.
 */
public final class LocalWorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LocalWorkerPool.class);

    private final InProcessTransport transport;
    private final StageFunctions stages;
    private final List<Worker> workers = new ArrayList<>();

    private ExecutorService executor;
    private volatile boolean running;

    public LocalWorkerPool(InProcessTransport transport, StageFunctions stages) {
        this.transport = transport;
        this.stages = stages;
    }

    /**
     * Start one worker thread per rank of the transport.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Local worker pool already running");
            return;
        }

        int size = transport.workerCount();
        executor = Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            return t;
        });

        workers.clear();
        for (int rank = 1; rank <= size; rank++) {
            Worker worker = new Worker(transport.worker(rank), stages);
            workers.add(worker);
            executor.submit(worker);
        }
        executor.shutdown();

        running = true;
        log.info("Local worker pool started: {} workers", size);
    }

    /**
     * Wait for every worker loop to end, normally after EXIT.
     *
     * @return true if all workers stopped within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        if (executor == null) {
            return true;
        }
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Interrupt any worker still running. Workers that already received EXIT
     * are unaffected.
     */
    @Override
    public synchronized void close() {
        if (!running) {
            return;
        }
        running = false;

        if (executor != null) {
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Local worker pool did not stop within 5s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Local worker pool stopped");
    }

    public List<Worker> workers() {
        return Collections.unmodifiableList(workers);
    }

    public boolean isRunning() {
        return running;
    }
}
