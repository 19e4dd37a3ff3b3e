package scenerelay.coordinator.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import scenerelay.coordinator.exception.ConfigurationException;
import scenerelay.coordinator.model.Product;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IniLoaderTest {

    @TempDir
    Path dir;

    private Path write(String content) throws IOException {
        Path ini = dir.resolve("run.ini");
        Files.writeString(ini, content);
        return ini;
    }

    @Test
    void loadsAllSections() throws IOException {
        Path ini = write("""
                [RUN]
                input_headers = headers.txt
                sensor = ls8
                format = GTiff
                outpath = /data/out
                tmpath = /data/tmp
                products = TOA, SREF DOSAOTSGL

                [AOT]
                min_aot = 0.1
                max_aot = 0.4

                [ATMOSPHERE]
                ozone = 0.3
                water = 1.5
                dem = /data/dem.kea

                [STAGES]
                provider = com.example.Stages

                [COORDINATOR]
                mode = tcp
                workers = 6
                stage_timeout_s = 900
                ready_timeout_s = 60
                failure_policy = continue
                default_aot = 0.07
                port = 7500
                """);

        RunSettings s = IniLoader.load(ini, Map.of());

        assertEquals(dir.resolve("headers.txt"), s.inputHeaders());
        assertEquals("ls8", s.sensor());
        assertEquals("GTiff", s.format());
        assertEquals("/data/out", s.outputPath());
        assertEquals("/data/tmp", s.tmpPath());
        assertEquals(EnumSet.of(Product.TOA, Product.SREF, Product.DOSAOTSGL), s.products());
        assertEquals(0.1, s.minAot());
        assertEquals(0.4, s.maxAot());
        assertEquals(0.3, s.atmosOzone());
        assertEquals(1.5, s.atmosWater());
        assertEquals("/data/dem.kea", s.demPath());
        assertEquals("com.example.Stages", s.stageProvider());
        assertEquals(TransportMode.TCP, s.mode());

        CoordinatorConfig c = s.coordinator();
        assertEquals(6, c.workerCount());
        assertEquals(Duration.ofMinutes(15), c.stageTimeout());
        assertEquals(Duration.ofMinutes(1), c.readyTimeout());
        assertEquals(FailurePolicy.CONTINUE, c.failurePolicy());
        assertEquals(0.07, c.defaultAot());
        assertEquals(7500, c.serverPort());

        assertDoesNotThrow(s::validate);
    }

    @Test
    void environmentFillsUnsetValues() throws IOException {
        Path ini = write("""
                [RUN]
                input_headers = /abs/headers.txt
                sensor = ls8
                products = DOSAOTSGL
                """);

        RunSettings s = IniLoader.load(ini, Map.of(
                "SCENERELAY_OUTPUT_PATH", "/env/out",
                "SCENERELAY_DEM_PATH", "/env/dem.kea",
                "SCENERELAY_MIN_AOT", "0.02",
                "SCENERELAY_MAX_AOT", "0.3",
                "SCENERELAY_WORKERS", "3"));

        assertEquals(Path.of("/abs/headers.txt"), s.inputHeaders());
        assertEquals("/env/out", s.outputPath());
        assertEquals("/env/dem.kea", s.demPath());
        assertEquals(0.02, s.minAot());
        assertEquals(0.3, s.maxAot());
        assertEquals(3, s.coordinator().workerCount());
        assertEquals(TransportMode.LOCAL, s.mode());
    }

    @Test
    void fileValuesWinOverEnvironment() throws IOException {
        Path ini = write("""
                [RUN]
                sensor = ls8
                outpath = /file/out
                [COORDINATOR]
                workers = 4
                """);

        RunSettings s = IniLoader.load(ini, Map.of(
                "SCENERELAY_OUTPUT_PATH", "/env/out",
                "SCENERELAY_WORKERS", "9"));

        assertEquals("/file/out", s.outputPath());
        assertEquals(4, s.coordinator().workerCount());
    }

    @Test
    void defaultsWhenAotSectionMissing() throws IOException {
        RunSettings s = IniLoader.load(write("[RUN]\nsensor = ls8\n"), Map.of());

        assertEquals(RunSettings.DEFAULT_MIN_AOT, s.minAot());
        assertEquals(RunSettings.DEFAULT_MAX_AOT, s.maxAot());
        assertNull(s.aot());
        assertTrue(s.products().isEmpty());
    }

    @Test
    void reportsBadInput() throws IOException {
        assertThrows(ConfigurationException.class, () -> IniLoader.load(dir.resolve("missing.ini"), Map.of()));
        assertThrows(ConfigurationException.class, () -> IniLoader.load(write("[AOT]\naot = 0.1\n"), Map.of()));
        assertThrows(ConfigurationException.class,
                () -> IniLoader.load(write("[RUN]\nproducts = TOA, WATER\n"), Map.of()));
        assertThrows(ConfigurationException.class,
                () -> IniLoader.load(write("[RUN]\nsensor = ls8\n[AOT]\naot = low\n"), Map.of()));
        assertThrows(ConfigurationException.class,
                () -> IniLoader.load(write("[RUN]\nsensor = ls8\n[COORDINATOR]\nworkers = 0\n"), Map.of()));
        assertThrows(ConfigurationException.class,
                () -> IniLoader.load(write("[RUN]\nsensor = ls8\n[COORDINATOR]\nmode = mpi\n"), Map.of()));
        assertThrows(ConfigurationException.class,
                () -> IniLoader.load(write("[RUN]\nsensor = ls8\n"), Map.of("SCENERELAY_WORKERS", "0")));
        assertThrows(ConfigurationException.class,
                () -> IniLoader.load(write("[RUN]\nsensor = ls8\n"), Map.of("SCENERELAY_STAGE_TIMEOUT_SECONDS", "-5")));
    }
}
