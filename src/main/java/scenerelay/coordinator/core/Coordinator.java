package scenerelay.coordinator.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenerelay.coordinator.aggregate.Aggregator;
import scenerelay.coordinator.aggregate.MeanAotAggregator;
import scenerelay.coordinator.config.CoordinatorConfig;
import scenerelay.coordinator.config.FailurePolicy;
import scenerelay.coordinator.exception.AggregationException;
import scenerelay.coordinator.exception.CoordinatorException;
import scenerelay.coordinator.exception.StageExecutionException;
import scenerelay.coordinator.exception.WorkerUnavailableException;
import scenerelay.coordinator.model.Envelope;
import scenerelay.coordinator.model.JobRecord;
import scenerelay.coordinator.model.Message;
import scenerelay.coordinator.model.StageFailure;
import scenerelay.coordinator.model.StageId;
import scenerelay.coordinator.model.WorkerState;
import scenerelay.coordinator.transport.CoordinatorTransport;
import scenerelay.coordinator.transport.TransportException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Master side of the scatter/gather protocol (rank 0).
 *
 * Runs the four stages over the whole job list, one round per stage. Within
 * a round every job goes to exactly one ready worker, at most one job per
 * worker at a time; the round ends when every job has been gathered. The AOT
 * aggregation runs between stage 1 and stage 2 while all workers are parked.
 *
 * Whatever happens, every worker is sent EXIT exactly once before
 * {@link #run(List)} returns or throws.
 *
 * Usage:
 *
 * <pre>
 * try (Coordinator coordinator = new Coordinator(transport, config, plan)) {
 *     List&lt;JobRecord&gt; done = coordinator.run(jobs);
 * }
 * </pre>
 */
public final class Coordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Coordinator.class);

    private final CoordinatorTransport transport;
    private final CoordinatorConfig config;
    private final PipelinePlan plan;
    private final Aggregator aggregator;
    private final RoundListener listener;
    private final WorkerPool pool;

    private StageBarrier barrier;
    private StageId lastStage;
    private boolean closed;

    public Coordinator(CoordinatorTransport transport, CoordinatorConfig config, PipelinePlan plan) {
        this(transport, config, plan, new MeanAotAggregator(config.defaultAot()), RoundListener.NOOP);
    }

    public Coordinator(CoordinatorTransport transport, CoordinatorConfig config, PipelinePlan plan,
            Aggregator aggregator, RoundListener listener) {
        this.transport = Objects.requireNonNull(transport, "transport is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.plan = Objects.requireNonNull(plan, "plan is required");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator is required");
        this.listener = listener == null ? RoundListener.NOOP : listener;
        this.pool = new WorkerPool(transport.workerCount());
    }

    /**
     * Drive all jobs through the pipeline, then release every worker.
     *
     * @return the processed jobs, in the order given
     * @throws CoordinatorException the first fatal error, after EXIT was broadcast
     */
    public List<JobRecord> run(List<JobRecord> jobs) {
        Objects.requireNonNull(jobs, "jobs is required");

        long start = System.nanoTime();
        log.info("Running {} jobs on {} workers: {}", jobs.size(), pool.size(), plan);
        try {
            checkIdentities(jobs);
            List<JobRecord> current = runStage(StageId.STAGE1, jobs);

            if (plan.aggregatesAot()) {
                current = aggregateAot(current);
            }

            for (StageId stage : List.of(StageId.STAGE2, StageId.STAGE3)) {
                if (plan.runs(stage)) {
                    current = runStage(stage, current);
                } else {
                    log.info("Stage {} ({}) not required, skipping", stage.number(), stage.description());
                    listener.onStageSkipped(stage);
                }
            }

            current = runStage(StageId.STAGE4, current);

            long failed = current.stream().filter(JobRecord::isFailed).count();
            log.info("Pipeline finished in {}ms: {} jobs, {} failed",
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), current.size(), failed);
            return current;
        } catch (CoordinatorException e) {
            log.error("Pipeline aborted: {}", e.getMessage());
            throw e;
        } finally {
            close();
        }
    }

    /**
     * One dispatch-and-gather round of {@code stage} over {@code jobs}.
     * Failed jobs are carried through without being dispatched.
     *
     * @return the updated jobs, same size and order as given
     */
    public List<JobRecord> runStage(StageId stage, List<JobRecord> jobs) {
        Objects.requireNonNull(stage, "stage is required");
        Objects.requireNonNull(jobs, "jobs is required");
        if (closed) {
            throw new IllegalStateException("Coordinator has released its workers");
        }
        if (barrier != null) {
            barrier.ensureComplete();
        }
        if (!stage.isAfter(lastStage)) {
            throw new IllegalStateException("Stage " + stage + " cannot run after " + lastStage);
        }

        List<JobRecord> results = new ArrayList<>(jobs);
        Deque<Integer> pending = new ArrayDeque<>();
        StageBarrier round = new StageBarrier(stage, results.size());
        for (int slot = 0; slot < results.size(); slot++) {
            if (results.get(slot).isFailed()) {
                round.arrive(slot);
            } else {
                pending.addLast(slot);
            }
        }
        barrier = round;
        pool.resetRound();

        log.info("Stage {} ({}) round started: {} jobs", stage.number(), stage.description(), pending.size());
        listener.onRoundStart(stage, pending.size());

        long lastProgress = System.nanoTime();
        try {
            while (!round.isComplete()) {
                dispatch(stage, results, pending);

                if (pool.liveCount() == 0) {
                    throw new WorkerUnavailableException(0, "No live workers left, " + round.remaining()
                            + " jobs of stage " + stage.number() + " outstanding");
                }

                Optional<Envelope> received = transport.poll(config.pollInterval());
                if (received.isPresent()) {
                    lastProgress = System.nanoTime();
                    handle(received.get(), stage, results, round);
                }

                long now = System.nanoTime();
                reapBusyWorkers(stage, results, round, now);
                if (!pending.isEmpty() && !pool.hasIdle() && pool.busyCount() == 0
                        && now - lastProgress >= config.readyTimeout().toNanos()) {
                    reapSilentWorkers(stage);
                    lastProgress = now;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CoordinatorException("Interrupted during stage " + stage.number(), e);
        }

        lastStage = stage;
        log.info("Stage {} round complete, assignments per worker: {}", stage.number(), assignmentCounts());
        listener.onRoundComplete(stage);
        return Collections.unmodifiableList(results);
    }

    /**
     * Send EXIT to every worker that has not been sent one yet. Best effort:
     * an unreachable worker is logged and skipped. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        int sent = 0;
        for (int rank = 1; rank <= pool.size(); rank++) {
            WorkerState before = pool.state(rank);
            if (!pool.markExited(rank)) {
                continue;
            }
            try {
                transport.send(rank, new Message.Exit());
                sent++;
                listener.onExit(rank);
            } catch (TransportException e) {
                log.warn("Could not send EXIT to worker {} ({}): {}", rank, before, e.getMessage());
            }
        }
        log.info("EXIT sent to {} of {} workers", sent, pool.size());
    }

    public boolean isClosed() {
        return closed;
    }

    /** Coordinator view of one worker, for monitoring and tests. */
    public WorkerState workerState(int rank) {
        return pool.state(rank);
    }

    private void dispatch(StageId stage, List<JobRecord> results, Deque<Integer> pending) {
        while (!pending.isEmpty()) {
            Optional<Integer> ready = pool.nextIdle();
            if (ready.isEmpty()) {
                return;
            }
            int rank = ready.get();
            int slot = pending.pollFirst();
            JobRecord job = results.get(slot);
            try {
                transport.send(rank, new Message.Assign(stage, job));
            } catch (TransportException e) {
                // never delivered, so the job can go to another worker
                pending.addFirst(slot);
                pool.markDead(rank);
                log.warn("Worker {} unreachable, excluded from the pool: {}", rank, e.getMessage());
                listener.onWorkerLost(rank, "unreachable");
                continue;
            }
            pool.markBusy(rank, slot, System.nanoTime() + config.stageTimeout().toNanos());
            log.debug("Stage {} job {} -> worker {}", stage.number(), job.index(), rank);
            listener.onAssign(stage, rank, job.index());
        }
    }

    private void handle(Envelope envelope, StageId stage, List<JobRecord> results, StageBarrier round) {
        int rank = envelope.source();
        Message message = envelope.message();

        if (message instanceof Message.Ready ready) {
            if (ready.rank() != rank) {
                log.warn("READY from worker {} claims rank {}", rank, ready.rank());
            }
            if (!pool.markReady(rank)) {
                log.warn("Ignoring READY from worker {} ({})", rank, pool.state(rank));
            }
        } else if (message instanceof Message.Result result) {
            if (!pool.isBusy(rank)) {
                log.warn("Discarding result for job {} from worker {} ({})",
                        result.jobIndex(), rank, pool.state(rank));
                return;
            }
            int slot = pool.markDone(rank);
            JobRecord sent = results.get(slot);

            if (result.stage() != stage || result.jobIndex() != sent.index()) {
                fail(round, results, slot, new StageFailure(stage, StageFailure.IDENTITY,
                        "worker " + rank + " answered " + result.stage() + "/job " + result.jobIndex()
                                + " for " + stage + "/job " + sent.index()));
            } else if (result.isSuccess()) {
                results.set(slot, result.job());
                round.arrive(slot);
                log.debug("Stage {} job {} <- worker {}", stage.number(), sent.index(), rank);
                listener.onGather(stage, rank, sent.index());
            } else {
                fail(round, results, slot, result.failure());
            }
        } else {
            log.warn("Unexpected {} from worker {}", message.getClass().getSimpleName(), rank);
        }
    }

    private void reapBusyWorkers(StageId stage, List<JobRecord> results, StageBarrier round, long now) {
        Set<Integer> lost = new HashSet<>(pool.expired(now));
        for (int rank : pool.ranksIn(WorkerState.BUSY)) {
            if (!transport.isConnected(rank)) {
                lost.add(rank);
            }
        }
        for (int rank : lost) {
            boolean timedOut = transport.isConnected(rank);
            Optional<Integer> slot = pool.markDead(rank);
            String reason = timedOut ? "stage timeout" : "disconnected";
            log.warn("Worker {} excluded from the pool: {}", rank, reason);
            listener.onWorkerLost(rank, reason);
            if (slot.isPresent()) {
                StageFailure failure = timedOut
                        ? StageFailure.timeout(stage, rank)
                        : StageFailure.workerLost(stage, rank);
                if (config.failurePolicy() == FailurePolicy.FAIL_FAST) {
                    throw new WorkerUnavailableException(rank,
                            "Job " + results.get(slot.get()).index() + ": " + failure.message());
                }
                fail(round, results, slot.get(), failure);
            }
        }
        for (int rank = 1; rank <= pool.size(); rank++) {
            if (pool.isLive(rank) && !pool.isBusy(rank) && !transport.isConnected(rank)) {
                pool.markDead(rank);
                log.warn("Worker {} disconnected, excluded from the pool", rank);
                listener.onWorkerLost(rank, "disconnected");
            }
        }
    }

    private void reapSilentWorkers(StageId stage) {
        for (int rank : pool.ranksIn(WorkerState.DONE)) {
            pool.markDead(rank);
            log.warn("Worker {} sent no READY within {}s, excluded from the pool",
                    rank, config.readyTimeout().toSeconds());
            listener.onWorkerLost(rank, "no READY");
        }
        log.warn("Stage {}: {} live workers after ready timeout", stage.number(), pool.liveCount());
    }

    private void fail(StageBarrier round, List<JobRecord> results, int slot, StageFailure failure) {
        JobRecord job = results.get(slot);
        listener.onJobFailed(failure.stage(), job.index(), failure);
        if (config.failurePolicy() == FailurePolicy.FAIL_FAST) {
            throw new StageExecutionException(job.index(), failure);
        }
        log.warn("Job {} failed in stage {} and is dropped from later stages: {}",
                job.index(), failure.stage().number(), failure.message());
        results.set(slot, job.withFailure(failure));
        round.arrive(slot);
    }

    private String assignmentCounts() {
        StringBuilder sb = new StringBuilder("{");
        for (int rank = 1; rank <= pool.size(); rank++) {
            if (rank > 1) {
                sb.append(", ");
            }
            sb.append(rank).append('=').append(pool.assignedThisRound(rank));
        }
        return sb.append('}').toString();
    }

    private List<JobRecord> aggregateAot(List<JobRecord> jobs) {
        double value;
        try {
            value = aggregator.aggregate(jobs);
        } catch (RuntimeException e) {
            throw new AggregationException("AOT aggregation failed: " + e.getMessage(), e);
        }
        log.info("Aggregated AOT {} written to all {} jobs", value, jobs.size());
        listener.onAggregated(value);

        List<JobRecord> out = new ArrayList<>(jobs.size());
        for (JobRecord job : jobs) {
            out.add(job.withAotValue(value));
        }
        return Collections.unmodifiableList(out);
    }

    private static void checkIdentities(List<JobRecord> jobs) {
        Set<Integer> seen = new HashSet<>();
        for (JobRecord job : jobs) {
            Objects.requireNonNull(job, "jobs must not contain null");
            if (!seen.add(job.index())) {
                throw new IllegalArgumentException("Duplicate job index " + job.index());
            }
        }
    }
}
