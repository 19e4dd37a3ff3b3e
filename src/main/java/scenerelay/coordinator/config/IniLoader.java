package scenerelay.coordinator.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenerelay.coordinator.exception.ConfigurationException;
import scenerelay.coordinator.model.Product;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Loads {@link RunSettings} from an INI file.
 * Sections: [RUN], [AOT], [ATMOSPHERE], [STAGES], [COORDINATOR] (opt.).
 *
 * Values left out of the file are taken from {@code SCENERELAY_*}
 * environment variables where one exists.
 */
public final class IniLoader {

    private static final Logger log = LoggerFactory.getLogger(IniLoader.class);

    private IniLoader() {
    }

    public static RunSettings load(Path file) {
        return load(file, System.getenv());
    }

    public static RunSettings load(Path file, Map<String, String> env) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new ConfigurationException("Run configuration file not found: " + file);
        }

        Ini ini;
        try {
            ini = new Ini(file.toFile());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read run configuration " + file + ": " + e.getMessage(), e);
        }

        Profile.Section run = ini.get("RUN");
        Profile.Section aot = ini.get("AOT");
        Profile.Section atmos = ini.get("ATMOSPHERE");
        Profile.Section stages = ini.get("STAGES");
        Profile.Section coord = ini.get("COORDINATOR"); // optional

        if (run == null) {
            throw new ConfigurationException("Run configuration " + file + " has no [RUN] section");
        }

        RunSettings.Builder b = RunSettings.builder();

        // RUN
        String headers = opt(run, "input_headers");
        if (headers != null) {
            Path headersPath = Path.of(headers);
            Path base = file.toAbsolutePath().getParent();
            b.inputHeaders(headersPath.isAbsolute() || base == null ? headersPath : base.resolve(headersPath));
        }
        b.sensor(opt(run, "sensor"));
        b.format(opt(run, "format", "KEA"));
        b.outputPath(withEnv(opt(run, "outpath"), env, "SCENERELAY_OUTPUT_PATH", "output path"));
        b.tmpPath(withEnv(opt(run, "tmpath"), env, "SCENERELAY_TMP_PATH", "temp path"));
        b.outputWkt(withEnv(opt(run, "out_wkt"), env, "SCENERELAY_OUTPUT_WKT", "output WKT file"));
        b.projAbbv(withEnv(opt(run, "proj_abbv"), env, "SCENERELAY_PROJ_ABBV", "projection abbreviation"));

        String products = opt(run, "products");
        if (products != null) {
            for (String name : products.split("[,\\s]+")) {
                if (!name.isBlank()) {
                    try {
                        b.product(Product.parse(name));
                    } catch (IllegalArgumentException e) {
                        throw new ConfigurationException(e.getMessage(), e);
                    }
                }
            }
        }

        // AOT
        b.aot(number(aot, "AOT", "aot"));
        b.visibility(number(aot, "AOT", "vis"));
        b.aotFile(opt(aot, "aot_file"));
        b.minAot(numberWithEnv(aot, "AOT", "min_aot", env, "SCENERELAY_MIN_AOT", RunSettings.DEFAULT_MIN_AOT));
        b.maxAot(numberWithEnv(aot, "AOT", "max_aot", env, "SCENERELAY_MAX_AOT", RunSettings.DEFAULT_MAX_AOT));
        b.lowAot(numberWithEnv(aot, "AOT", "low_aot", env, "SCENERELAY_LOW_AOT", null));
        b.upAot(numberWithEnv(aot, "AOT", "up_aot", env, "SCENERELAY_UP_AOT", null));

        // ATMOSPHERE
        b.atmosOzone(number(atmos, "ATMOSPHERE", "ozone"));
        b.atmosWater(number(atmos, "ATMOSPHERE", "water"));
        b.demPath(withEnv(opt(atmos, "dem"), env, "SCENERELAY_DEM_PATH", "DEM path"));

        // STAGES
        b.stageProvider(opt(stages, "provider"));

        // COORDINATOR
        b.mode(parse(coord, "COORDINATOR", "mode", TransportMode::parse, TransportMode.LOCAL));
        b.coordinator(coordinatorConfig(coord, env));

        return b.build();
    }

    private static CoordinatorConfig coordinatorConfig(Profile.Section coord, Map<String, String> env) {
        CoordinatorConfig config;
        try {
            config = CoordinatorConfig.fromEnv(env);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid coordinator environment: " + e.getMessage(), e);
        }
        if (coord == null) {
            return config;
        }

        try {
            String workers = opt(coord, "workers");
            if (workers != null) {
                config.withWorkerCount(Integer.parseInt(workers));
            }
            String stageTimeout = opt(coord, "stage_timeout_s");
            if (stageTimeout != null) {
                config.withStageTimeout(Duration.ofSeconds(Long.parseLong(stageTimeout)));
            }
            String readyTimeout = opt(coord, "ready_timeout_s");
            if (readyTimeout != null) {
                config.withReadyTimeout(Duration.ofSeconds(Long.parseLong(readyTimeout)));
            }
            String policy = opt(coord, "failure_policy");
            if (policy != null) {
                config.withFailurePolicy(FailurePolicy.parse(policy));
            }
            String defaultAot = opt(coord, "default_aot");
            if (defaultAot != null) {
                config.withDefaultAot(Double.parseDouble(defaultAot));
            }
            String host = opt(coord, "host");
            if (host != null) {
                config.withServerHost(host);
            }
            String port = opt(coord, "port");
            if (port != null) {
                config.withServerPort(Integer.parseInt(port));
            }
            String connectTimeout = opt(coord, "connect_timeout_s");
            if (connectTimeout != null) {
                config.withConnectTimeout(Duration.ofSeconds(Long.parseLong(connectTimeout)));
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid [COORDINATOR] setting: " + e.getMessage(), e);
        }
        return config;
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        if (s == null) {
            return null;
        }
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = opt(s, key);
        return v == null ? def : v;
    }

    private static String withEnv(String value, Map<String, String> env, String var, String what) {
        if (value != null) {
            return value;
        }
        String fromEnv = env.get(var);
        if (fromEnv != null && !fromEnv.isBlank()) {
            log.info("Taking {} from environment variable {}", what, var);
            return fromEnv.trim();
        }
        return null;
    }

    private static Double number(Profile.Section s, String section, String key) {
        return parse(s, section, key, Double::valueOf, null);
    }

    private static Double numberWithEnv(Profile.Section s, String section, String key,
            Map<String, String> env, String var, Double def) {
        Double v = number(s, section, key);
        if (v != null) {
            return v;
        }
        String fromEnv = env.get(var);
        if (fromEnv != null && !fromEnv.isBlank()) {
            log.info("Taking [{}] {} from environment variable {}", section, key, var);
            try {
                return Double.valueOf(fromEnv.trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid value for " + var + ": " + fromEnv, e);
            }
        }
        return def;
    }

    private static <T> T parse(Profile.Section s, String section, String key,
            java.util.function.Function<String, T> parser, T def) {
        String v = opt(s, key);
        if (v == null) {
            return def;
        }
        try {
            return parser.apply(v);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid value for [" + section + "] " + key + ": " + v, e);
        }
    }
}
