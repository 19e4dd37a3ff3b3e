package scenerelay.worker;

import scenerelay.coordinator.model.JobRecord;

/**
 * One processing stage applied to a single job.
 *
 * Implementations return the updated record (same index) and may throw to
 * signal that the job failed in this stage.
 */
@FunctionalInterface
public interface StageFunction {

    JobRecord apply(JobRecord job) throws Exception;
}
