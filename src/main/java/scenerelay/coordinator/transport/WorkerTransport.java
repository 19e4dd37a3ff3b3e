package scenerelay.coordinator.transport;

import scenerelay.coordinator.model.Message;

/**
 * Worker side of the message-passing boundary. Talks only to the coordinator.
 */
public interface WorkerTransport extends AutoCloseable {

    int rank();

    void send(Message message);

    /** Block until the coordinator sends the next instruction. */
    Message receive() throws InterruptedException;

    @Override
    void close();
}
