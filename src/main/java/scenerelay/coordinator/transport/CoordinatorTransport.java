package scenerelay.coordinator.transport;

import scenerelay.coordinator.model.Envelope;
import scenerelay.coordinator.model.Message;

import java.time.Duration;
import java.util.Optional;

/**
 * Coordinator (rank 0) side of the message-passing boundary.
 * Workers are addressed by rank 1..{@link #workerCount()}.
 */
public interface CoordinatorTransport extends AutoCloseable {

    /** Fixed pool size for the run. */
    int workerCount();

    /**
     * Deliver a message to one worker.
     *
     * @throws TransportException if the worker cannot be reached
     */
    void send(int rank, Message message);

    /**
     * Wait up to {@code timeout} for the next message from any worker.
     *
     * @return the message with its sender, or empty on timeout
     */
    Optional<Envelope> poll(Duration timeout) throws InterruptedException;

    /**
     * Whether the worker's endpoint is still attached. A worker that
     * detached while holding a job will never answer.
     */
    boolean isConnected(int rank);

    @Override
    void close();
}
