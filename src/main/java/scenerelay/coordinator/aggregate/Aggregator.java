package scenerelay.coordinator.aggregate;

import scenerelay.coordinator.model.JobRecord;

import java.util.List;

/**
 * Cross-job reduction run by the coordinator between stage 1 and stage 2.
 */
@FunctionalInterface
public interface Aggregator {

    /**
     * Reduce the jobs to one scalar. Must not fail when no job carries a
     * value; a fixed default is returned instead.
     */
    double aggregate(List<JobRecord> jobs);
}
