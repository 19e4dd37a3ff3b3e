package scenerelay.coordinator.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenerelay.coordinator.config.RunSettings;
import scenerelay.coordinator.exception.ConfigurationException;
import scenerelay.coordinator.model.JobRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the job list from the input header list file: one scene header
 * per line, blank lines and {@code #} comments ignored.
 */
public final class JobListLoader {

    private static final Logger log = LoggerFactory.getLogger(JobListLoader.class);

    private JobListLoader() {
    }

    public static List<JobRecord> load(RunSettings settings) {
        return load(settings.inputHeaders(), settings.toParameters());
    }

    public static List<JobRecord> load(Path headerList, Map<String, String> parameters) {
        if (headerList == null || !Files.isRegularFile(headerList)) {
            throw new ConfigurationException("Input header list not found: " + headerList);
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(headerList);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read input header list " + headerList + ": " + e.getMessage(), e);
        }

        List<JobRecord> jobs = new ArrayList<>();
        for (String line : lines) {
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            jobs.add(JobRecord.builder()
                    .index(jobs.size())
                    .scene(line)
                    .parameters(parameters)
                    .build());
        }

        if (jobs.isEmpty()) {
            throw new ConfigurationException("Input header list " + headerList + " contains no scenes");
        }
        log.info("Loaded {} scenes from {}", jobs.size(), headerList);
        return jobs;
    }
}
