package scenerelay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenerelay.coordinator.config.CoordinatorConfig;
import scenerelay.coordinator.config.IniLoader;
import scenerelay.coordinator.config.RunSettings;
import scenerelay.coordinator.config.TransportMode;
import scenerelay.coordinator.core.Coordinator;
import scenerelay.coordinator.core.PipelinePlan;
import scenerelay.coordinator.exception.ConfigurationException;
import scenerelay.coordinator.exception.CoordinatorException;
import scenerelay.coordinator.model.JobRecord;
import scenerelay.coordinator.server.NettyCoordinatorServer;
import scenerelay.coordinator.server.NettyWorkerClient;
import scenerelay.coordinator.simulation.LocalWorkerPool;
import scenerelay.coordinator.transport.InProcessTransport;
import scenerelay.coordinator.util.JobListLoader;
import scenerelay.coordinator.util.RunReportWriter;
import scenerelay.worker.StageFunctions;
import scenerelay.worker.Worker;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Command line entry point.
 *
 * <pre>
 * App coordinator &lt;run.ini&gt;
 * App worker &lt;host&gt; &lt;port&gt; &lt;rank&gt; &lt;run.ini&gt;
 * </pre>
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_CONFIG = 2;

    private App() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length == 2 && "coordinator".equals(args[0])) {
            return guarded(() -> coordinator(Path.of(args[1])));
        }
        if (args.length == 5 && "worker".equals(args[0])) {
            return guarded(() -> worker(args[1], parseInt(args[2], "port"), parseInt(args[3], "rank"),
                    Path.of(args[4])));
        }
        log.error("Usage: App coordinator <run.ini> | App worker <host> <port> <rank> <run.ini>");
        return EXIT_CONFIG;
    }

    private interface Mode {
        int run() throws Exception;
    }

    private static int guarded(Mode mode) {
        try {
            return mode.run();
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            return EXIT_CONFIG;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted");
            return EXIT_FAILED;
        } catch (Exception e) {
            log.error("Run failed", e);
            return EXIT_FAILED;
        }
    }

    static int coordinator(Path ini) throws InterruptedException {
        RunSettings settings = IniLoader.load(ini).validate();
        PipelinePlan plan = PipelinePlan.from(settings.products());
        List<JobRecord> jobs = JobListLoader.load(settings);
        CoordinatorConfig config = settings.coordinator();
        log.info("Loaded {}", settings);

        long start = System.nanoTime();
        List<JobRecord> done = null;
        String error = null;
        try {
            if (settings.mode() == TransportMode.TCP) {
                done = runTcp(config, plan, jobs);
            } else {
                done = runLocal(StageFunctions.load(settings.stageProvider()), config, plan, jobs);
            }
            return EXIT_OK;
        } catch (RuntimeException e) {
            error = errorText(e);
            throw e;
        } finally {
            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            log.info("Run took {} ms", elapsed);
            writeReport(settings, elapsed, error, done != null ? done : jobs, done != null);
        }
    }

    /** Text recorded in the run report for a failed run. */
    static String errorText(RuntimeException e) {
        if (e instanceof CoordinatorException && e.getMessage() != null) {
            return e.getMessage();
        }
        return e.toString();
    }

    private static List<JobRecord> runLocal(StageFunctions stages, CoordinatorConfig config, PipelinePlan plan,
            List<JobRecord> jobs) throws InterruptedException {
        InProcessTransport transport = new InProcessTransport(config.workerCount());
        try (LocalWorkerPool workers = new LocalWorkerPool(transport, stages);
             Coordinator coordinator = new Coordinator(transport, config, plan)) {
            workers.start();
            List<JobRecord> done = coordinator.run(jobs);
            if (!workers.awaitTermination(Duration.ofSeconds(30))) {
                log.warn("Some workers did not stop after EXIT");
            }
            return done;
        } finally {
            transport.close();
        }
    }

    private static List<JobRecord> runTcp(CoordinatorConfig config, PipelinePlan plan, List<JobRecord> jobs)
            throws InterruptedException {
        try (NettyCoordinatorServer server = new NettyCoordinatorServer(config.workerCount())) {
            server.start(config.serverHost(), config.serverPort());
            if (!server.awaitWorkers(config.connectTimeout())) {
                log.warn("Starting with the workers that joined; the rest are excluded");
            }
            try (Coordinator coordinator = new Coordinator(server, config, plan)) {
                return coordinator.run(jobs);
            }
        }
    }

    static int worker(String host, int port, int rank, Path ini) {
        RunSettings settings = IniLoader.load(ini);
        StageFunctions stages = StageFunctions.load(settings.stageProvider());
        Duration timeout = settings.coordinator().connectTimeout();

        Worker worker = new Worker(NettyWorkerClient.connect(host, port, rank, timeout), stages);
        worker.run();
        return worker.hasExited() ? EXIT_OK : EXIT_FAILED;
    }

    private static void writeReport(RunSettings settings, long elapsed, String error, List<JobRecord> jobs,
            boolean succeeded) {
        RunReportWriter.Status status = succeeded ? RunReportWriter.Status.SUCCEEDED : RunReportWriter.Status.FAILED;
        try {
            new RunReportWriter().write(Path.of(settings.outputPath()),
                    RunReportWriter.report(status, elapsed, error, jobs));
        } catch (IOException e) {
            log.warn("Could not write run report: {}", e.getMessage());
        }
    }

    private static int parseInt(String value, String what) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid " + what + ": " + value, e);
        }
    }
}
