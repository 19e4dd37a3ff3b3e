package scenerelay.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenerelay.coordinator.model.JobRecord;
import scenerelay.coordinator.model.Message;
import scenerelay.coordinator.model.StageFailure;
import scenerelay.coordinator.model.StageId;
import scenerelay.coordinator.transport.TransportException;
import scenerelay.coordinator.transport.WorkerTransport;

import java.util.concurrent.TimeUnit;

/**
 * Long-lived worker loop.
 *
 * READY, then wait for an instruction: ASSIGN runs one stage function on one
 * job and answers with RESULT before announcing READY again; EXIT ends the
 * loop. A failing stage function is reported as a failed RESULT and never
 * stops the loop.
 */
public final class Worker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final WorkerTransport transport;
    private final StageFunctions stages;

    private volatile boolean exited;
    private volatile int processed;

    public Worker(WorkerTransport transport, StageFunctions stages) {
        this.transport = transport;
        this.stages = stages;
    }

    @Override
    public void run() {
        int rank = transport.rank();
        Thread.currentThread().setName("worker-" + rank);
        log.info("Worker {} started", rank);

        try {
            boolean announce = true;
            while (true) {
                if (announce) {
                    transport.send(new Message.Ready(rank));
                }
                Message instruction = transport.receive();

                if (instruction instanceof Message.Assign assign) {
                    transport.send(execute(assign));
                    processed++;
                    announce = true;
                } else if (instruction instanceof Message.Exit) {
                    exited = true;
                    break;
                } else {
                    log.warn("Worker {} ignoring unexpected {}", rank, instruction.getClass().getSimpleName());
                    announce = false;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Worker {} interrupted", rank);
        } catch (TransportException e) {
            log.error("Worker {} lost its connection to the coordinator", rank, e);
        } finally {
            transport.close();
        }

        log.info("Worker {} stopped after {} assignments", rank, processed);
    }

    Message.Result execute(Message.Assign assign) {
        StageId stage = assign.stage();
        JobRecord job = assign.job();
        int rank = transport.rank();
        long start = System.nanoTime();

        log.debug("Worker {} stage {} START job {}", rank, stage.number(), job.index());
        try {
            JobRecord updated = stages.forStage(stage).apply(job);
            if (updated == null || updated.index() != job.index()) {
                return Message.Result.failed(stage, job.index(), new StageFailure(stage, StageFailure.IDENTITY,
                        "stage function did not return job " + job.index()));
            }
            log.debug("Worker {} stage {} END job {} in {}ms", rank, stage.number(), job.index(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            return Message.Result.success(stage, updated.withCompletedStage(stage));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Message.Result.failed(stage, job.index(), StageFailure.of(stage, e));
        } catch (Throwable t) {
            // Errors from native bindings fail the job, not the loop
            log.warn("Worker {} stage {} failed for job {}: {}", rank, stage.number(), job.index(), t.toString());
            return Message.Result.failed(stage, job.index(), StageFailure.of(stage, t));
        }
    }

    public boolean hasExited() {
        return exited;
    }

    public int processed() {
        return processed;
    }
}
