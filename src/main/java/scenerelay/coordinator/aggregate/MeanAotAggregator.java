package scenerelay.coordinator.aggregate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenerelay.coordinator.model.JobRecord;

import java.util.List;

/**
 * Arithmetic mean of the AOT values estimated per scene. Jobs without a
 * value, and failed jobs, do not count.
 */
public final class MeanAotAggregator implements Aggregator {

    private static final Logger log = LoggerFactory.getLogger(MeanAotAggregator.class);

    private final double defaultValue;

    public MeanAotAggregator(double defaultValue) {
        this.defaultValue = defaultValue;
    }

    @Override
    public double aggregate(List<JobRecord> jobs) {
        double sum = 0.0;
        int n = 0;
        for (JobRecord job : jobs) {
            if (!job.isFailed() && job.hasAotValue()) {
                sum += job.aotValue();
                n++;
            }
        }
        if (n == 0) {
            log.warn("No scene produced an AOT estimate, using default {}", defaultValue);
            return defaultValue;
        }
        double mean = sum / n;
        log.info("Mean AOT {} from {} of {} scenes", mean, n, jobs.size());
        return mean;
    }

    public double defaultValue() {
        return defaultValue;
    }
}
