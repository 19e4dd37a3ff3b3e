package scenerelay.coordinator.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenerelay.coordinator.model.Envelope;
import scenerelay.coordinator.model.Message;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Queue-backed transport for workers running as threads in this JVM.
 *
 * Every message travels in its encoded form and is decoded by the receiver,
 * so the coordinator and the workers never hold the same object.
 */
public final class InProcessTransport implements CoordinatorTransport {

    private static final Logger log = LoggerFactory.getLogger(InProcessTransport.class);

    private final MessageCodec codec;
    private final int workerCount;
    private final BlockingQueue<Frame> inbox = new LinkedBlockingQueue<>();
    private final List<Endpoint> endpoints = new ArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public InProcessTransport(int workerCount) {
        this(workerCount, new MessageCodec());
    }

    public InProcessTransport(int workerCount, MessageCodec codec) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1");
        }
        this.workerCount = workerCount;
        this.codec = codec;
        for (int rank = 1; rank <= workerCount; rank++) {
            endpoints.add(new Endpoint(rank));
        }
    }

    /** Worker side endpoint for {@code rank}. */
    public WorkerTransport worker(int rank) {
        return endpoint(rank);
    }

    @Override
    public int workerCount() {
        return workerCount;
    }

    @Override
    public void send(int rank, Message message) {
        if (closed.get()) {
            throw new TransportException("Transport is closed");
        }
        Endpoint endpoint = endpoint(rank);
        if (!endpoint.attached.get()) {
            throw new TransportException("Worker " + rank + " is not attached");
        }
        endpoint.queue.add(codec.encode(message));
    }

    @Override
    public Optional<Envelope> poll(Duration timeout) throws InterruptedException {
        Frame frame = inbox.poll(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
        if (frame == null) {
            return Optional.empty();
        }
        return Optional.of(new Envelope(frame.source(), codec.decode(frame.payload())));
    }

    @Override
    public boolean isConnected(int rank) {
        return endpoint(rank).attached.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.debug("In-process transport closed ({} workers)", workerCount);
        }
    }

    private Endpoint endpoint(int rank) {
        if (rank < 1 || rank > workerCount) {
            throw new IllegalArgumentException("No worker with rank " + rank);
        }
        return endpoints.get(rank - 1);
    }

    private record Frame(int source, String payload) {
    }

    private final class Endpoint implements WorkerTransport {
        private final int rank;
        private final BlockingQueue<String> queue = new LinkedBlockingQueue<>();
        private final AtomicBoolean attached = new AtomicBoolean(true);

        private Endpoint(int rank) {
            this.rank = rank;
        }

        @Override
        public int rank() {
            return rank;
        }

        @Override
        public void send(Message message) {
            if (!attached.get()) {
                throw new TransportException("Worker " + rank + " endpoint is closed");
            }
            inbox.add(new Frame(rank, codec.encode(message)));
        }

        @Override
        public Message receive() throws InterruptedException {
            return codec.decode(queue.take());
        }

        @Override
        public void close() {
            attached.set(false);
        }
    }
}
