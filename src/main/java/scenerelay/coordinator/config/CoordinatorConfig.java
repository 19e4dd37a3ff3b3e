package scenerelay.coordinator.config;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for Coordinator settings.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    /** AOT written into every job when no scene produced an estimate. */
    public static final double DEFAULT_AOT = 0.05;

    // Pool settings
    private int workerCount = 2;
    private Duration stageTimeout = Duration.ofHours(2);
    private Duration readyTimeout = Duration.ofMinutes(5);
    private Duration pollInterval = Duration.ofMillis(250);
    private FailurePolicy failurePolicy = FailurePolicy.FAIL_FAST;
    private double defaultAot = DEFAULT_AOT;

    // TCP transport settings
    private String serverHost = "0.0.0.0";
    private int serverPort = 7420;
    private Duration connectTimeout = Duration.ofMinutes(2);

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static CoordinatorConfig fromEnv(Map<String, String> env) {
        CoordinatorConfig config = new CoordinatorConfig();

        // Override from environment variables
        String workers = env.get("SCENERELAY_WORKERS");
        if (workers != null && !workers.isBlank()) {
            config.withWorkerCount(Integer.parseInt(workers.trim()));
        }

        String stageTimeout = env.get("SCENERELAY_STAGE_TIMEOUT_SECONDS");
        if (stageTimeout != null && !stageTimeout.isBlank()) {
            config.withStageTimeout(Duration.ofSeconds(Long.parseLong(stageTimeout.trim())));
        }

        String readyTimeout = env.get("SCENERELAY_READY_TIMEOUT_SECONDS");
        if (readyTimeout != null && !readyTimeout.isBlank()) {
            config.withReadyTimeout(Duration.ofSeconds(Long.parseLong(readyTimeout.trim())));
        }

        String policy = env.get("SCENERELAY_FAILURE_POLICY");
        if (policy != null && !policy.isBlank()) {
            config.failurePolicy = FailurePolicy.parse(policy);
        }

        String host = env.get("SCENERELAY_HOST");
        if (host != null && !host.isBlank()) {
            config.serverHost = host.trim();
        }

        String port = env.get("SCENERELAY_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        return config;
    }

    // Getters
    public int workerCount() {
        return workerCount;
    }

    public Duration stageTimeout() {
        return stageTimeout;
    }

    public Duration readyTimeout() {
        return readyTimeout;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public FailurePolicy failurePolicy() {
        return failurePolicy;
    }

    public double defaultAot() {
        return defaultAot;
    }

    public String serverHost() {
        return serverHost;
    }

    public int serverPort() {
        return serverPort;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withWorkerCount(int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1");
        }
        this.workerCount = workerCount;
        return this;
    }

    public CoordinatorConfig withStageTimeout(Duration timeout) {
        this.stageTimeout = requirePositive(timeout, "stageTimeout");
        return this;
    }

    public CoordinatorConfig withReadyTimeout(Duration timeout) {
        this.readyTimeout = requirePositive(timeout, "readyTimeout");
        return this;
    }

    public CoordinatorConfig withPollInterval(Duration interval) {
        this.pollInterval = requirePositive(interval, "pollInterval");
        return this;
    }

    public CoordinatorConfig withFailurePolicy(FailurePolicy policy) {
        this.failurePolicy = policy;
        return this;
    }

    public CoordinatorConfig withDefaultAot(double aot) {
        this.defaultAot = aot;
        return this;
    }

    public CoordinatorConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withConnectTimeout(Duration timeout) {
        this.connectTimeout = requirePositive(timeout, "connectTimeout");
        return this;
    }

    private static Duration requirePositive(Duration d, String name) {
        if (d == null || d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return d;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "workers=" + workerCount +
                ", stageTimeout=" + stageTimeout +
                ", readyTimeout=" + readyTimeout +
                ", failurePolicy=" + failurePolicy +
                ", serverPort=" + serverPort +
                '}';
    }
}
