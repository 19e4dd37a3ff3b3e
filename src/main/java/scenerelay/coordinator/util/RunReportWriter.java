package scenerelay.coordinator.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenerelay.coordinator.model.JobRecord;
import scenerelay.coordinator.model.StageFailure;
import scenerelay.coordinator.model.StageId;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes {@value #FILE_NAME} to the run's output directory.
 */
public final class RunReportWriter {

    private static final Logger log = LoggerFactory.getLogger(RunReportWriter.class);

    public static final String FILE_NAME = "scenerelay-report.json";

    public enum Status { SUCCEEDED, FAILED }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Report(Instant finishedAt, Status status, long elapsedMs, String error, List<JobEntry> jobs) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record JobEntry(int index, String scene, Set<StageId> completedStages, Double aotValue,
                           Map<String, String> outputs, StageFailure failure) {

        static JobEntry of(JobRecord job) {
            return new JobEntry(job.index(), job.scene(), job.completedStages(), job.aotValue(),
                    job.outputs(), job.failure());
        }
    }

    private final ObjectMapper mapper;

    public RunReportWriter() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static Report report(Status status, long elapsedMs, String error, List<JobRecord> jobs) {
        return new Report(Instant.now(), status, elapsedMs, error,
                jobs == null ? List.of() : jobs.stream().map(JobEntry::of).toList());
    }

    /**
     * @return the written file
     * @throws IOException if the directory or file cannot be written
     */
    public Path write(Path outputDir, Report report) throws IOException {
        Files.createDirectories(outputDir);
        Path file = outputDir.resolve(FILE_NAME);
        mapper.writeValue(file.toFile(), report);
        log.info("Run report written to {}", file);
        return file;
    }

    public Report read(Path file) throws IOException {
        return mapper.readValue(file.toFile(), Report.class);
    }
}
