package scenerelay.coordinator.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import scenerelay.coordinator.model.JobRecord;
import scenerelay.coordinator.model.StageFailure;
import scenerelay.coordinator.model.StageId;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunReportWriterTest {

    @TempDir
    Path dir;

    @Test
    void writesReportIntoOutputDirectory() throws IOException {
        JobRecord ok = JobRecord.builder().index(0).scene("a").aotValue(0.2)
                .output("sref", "/out/a_sref.kea")
                .completedStage(StageId.STAGE1).completedStage(StageId.STAGE4)
                .build();
        JobRecord failed = JobRecord.builder().index(1).scene("b")
                .failure(new StageFailure(StageId.STAGE1, "java.io.IOException", "bad header"))
                .build();

        RunReportWriter writer = new RunReportWriter();
        Path file = writer.write(dir.resolve("out"),
                RunReportWriter.report(RunReportWriter.Status.SUCCEEDED, 1234, null, List.of(ok, failed)));

        assertEquals(RunReportWriter.FILE_NAME, file.getFileName().toString());
        String json = Files.readString(file);
        // ISO timestamp, not epoch numbers
        assertTrue(json.matches("(?s).*\"finishedAt\"\\s*:\\s*\"\\d{4}-\\d{2}-\\d{2}T.*"), json);
        assertFalse(json.contains("\"error\""));

        RunReportWriter.Report read = writer.read(file);
        assertEquals(RunReportWriter.Status.SUCCEEDED, read.status());
        assertEquals(1234, read.elapsedMs());
        assertEquals(2, read.jobs().size());
        assertEquals(0.2, read.jobs().get(0).aotValue());
        assertEquals("/out/a_sref.kea", read.jobs().get(0).outputs().get("sref"));
        assertTrue(read.jobs().get(0).completedStages().contains(StageId.STAGE4));
        assertEquals("bad header", read.jobs().get(1).failure().message());
    }
}
