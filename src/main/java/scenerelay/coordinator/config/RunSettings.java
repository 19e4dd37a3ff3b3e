package scenerelay.coordinator.config;

import scenerelay.coordinator.exception.ConfigurationException;
import scenerelay.coordinator.model.Product;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Settings of one multi-scene run: what to produce, where, and how the
 * worker pool is set up. Built by {@link IniLoader}.
 */
public final class RunSettings {

    public static final double DEFAULT_MIN_AOT = 0.05;
    public static final double DEFAULT_MAX_AOT = 0.5;

    private final Path inputHeaders;
    private final String sensor;
    private final String outputPath;
    private final String tmpPath;
    private final String format;
    private final Set<Product> products;
    private final Double aot;
    private final Double visibility;
    private final String aotFile;
    private final Double minAot;
    private final Double maxAot;
    private final Double lowAot;
    private final Double upAot;
    private final String demPath;
    private final String outputWkt;
    private final String projAbbv;
    private final Double atmosOzone;
    private final Double atmosWater;
    private final String stageProvider;
    private final TransportMode mode;
    private final CoordinatorConfig coordinator;

    private RunSettings(Builder b) {
        this.inputHeaders = b.inputHeaders;
        this.sensor = b.sensor;
        this.outputPath = b.outputPath;
        this.tmpPath = b.tmpPath;
        this.format = b.format;
        this.products = b.products.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(b.products));
        this.aot = b.aot;
        this.visibility = b.visibility;
        this.aotFile = b.aotFile;
        this.minAot = b.minAot;
        this.maxAot = b.maxAot;
        this.lowAot = b.lowAot;
        this.upAot = b.upAot;
        this.demPath = b.demPath;
        this.outputWkt = b.outputWkt;
        this.projAbbv = b.projAbbv;
        this.atmosOzone = b.atmosOzone;
        this.atmosWater = b.atmosWater;
        this.stageProvider = b.stageProvider;
        this.mode = Objects.requireNonNull(b.mode, "mode is required");
        this.coordinator = Objects.requireNonNull(b.coordinator, "coordinator config is required");
    }

    /**
     * Check the settings for missing or conflicting values.
     *
     * @throws ConfigurationException describing the first problem found
     */
    public RunSettings validate() {
        if (inputHeaders == null) {
            throw new ConfigurationException("No list of input header files has been provided");
        }
        if (isBlank(sensor)) {
            throw new ConfigurationException("No sensor has been provided");
        }
        if (isBlank(outputPath)) {
            throw new ConfigurationException("No output file path has been provided");
        }
        if (products.isEmpty()) {
            throw new ConfigurationException("No output products have been requested");
        }
        if (atmosOzone != null && atmosWater == null) {
            throw new ConfigurationException(
                    "If the atmospheric ozone is defined then the atmospheric water needs to be specified");
        }
        if (atmosWater != null && atmosOzone == null) {
            throw new ConfigurationException(
                    "If the atmospheric water is defined then the atmospheric ozone needs to be specified");
        }

        boolean estimatesAot = Product.anyOf(products, Product.AOT_ESTIMATING);
        if (products.contains(Product.SREF) && aot == null && visibility == null
                && isBlank(aotFile) && !estimatesAot) {
            throw new ConfigurationException(
                    "SREF requires an AOT value, a visibility, an AOT file or an AOT-estimating product");
        }
        if (estimatesAot) {
            if (minAot == null || maxAot == null) {
                throw new ConfigurationException("The min and max AOT values for the search should be specified");
            }
            if (minAot >= maxAot) {
                throw new ConfigurationException(
                        "The min AOT (" + minAot + ") must be smaller than the max AOT (" + maxAot + ")");
            }
        }
        return this;
    }

    /**
     * Run-wide parameters copied into every job record for the stage functions.
     */
    public Map<String, String> toParameters() {
        Map<String, String> p = new LinkedHashMap<>();
        put(p, "sensor", sensor);
        put(p, "products", products.stream().map(Enum::name).collect(Collectors.joining(",")));
        put(p, "outputPath", outputPath);
        put(p, "tmpPath", tmpPath);
        put(p, "format", format);
        put(p, "aot", aot);
        put(p, "visibility", visibility);
        put(p, "aotFile", aotFile);
        put(p, "minAot", minAot);
        put(p, "maxAot", maxAot);
        put(p, "lowAot", lowAot);
        put(p, "upAot", upAot);
        put(p, "dem", demPath);
        put(p, "outputWkt", outputWkt);
        put(p, "projAbbv", projAbbv);
        put(p, "atmosOzone", atmosOzone);
        put(p, "atmosWater", atmosWater);
        return p;
    }

    private static void put(Map<String, String> p, String key, Object value) {
        if (value != null && !value.toString().isBlank()) {
            p.put(key, value.toString());
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    // Getters
    public Path inputHeaders() {
        return inputHeaders;
    }

    public String sensor() {
        return sensor;
    }

    public String outputPath() {
        return outputPath;
    }

    public String tmpPath() {
        return tmpPath;
    }

    public String format() {
        return format;
    }

    public Set<Product> products() {
        return products;
    }

    public Double aot() {
        return aot;
    }

    public Double visibility() {
        return visibility;
    }

    public String aotFile() {
        return aotFile;
    }

    public Double minAot() {
        return minAot;
    }

    public Double maxAot() {
        return maxAot;
    }

    public Double lowAot() {
        return lowAot;
    }

    public Double upAot() {
        return upAot;
    }

    public String demPath() {
        return demPath;
    }

    public String outputWkt() {
        return outputWkt;
    }

    public String projAbbv() {
        return projAbbv;
    }

    public Double atmosOzone() {
        return atmosOzone;
    }

    public Double atmosWater() {
        return atmosWater;
    }

    public String stageProvider() {
        return stageProvider;
    }

    public TransportMode mode() {
        return mode;
    }

    public CoordinatorConfig coordinator() {
        return coordinator;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path inputHeaders;
        private String sensor;
        private String outputPath;
        private String tmpPath;
        private String format = "KEA";
        private final EnumSet<Product> products = EnumSet.noneOf(Product.class);
        private Double aot;
        private Double visibility;
        private String aotFile;
        private Double minAot = DEFAULT_MIN_AOT;
        private Double maxAot = DEFAULT_MAX_AOT;
        private Double lowAot;
        private Double upAot;
        private String demPath;
        private String outputWkt;
        private String projAbbv;
        private Double atmosOzone;
        private Double atmosWater;
        private String stageProvider;
        private TransportMode mode = TransportMode.LOCAL;
        private CoordinatorConfig coordinator = CoordinatorConfig.defaults();

        public Builder inputHeaders(Path inputHeaders) {
            this.inputHeaders = inputHeaders;
            return this;
        }

        public Builder sensor(String sensor) {
            this.sensor = sensor;
            return this;
        }

        public Builder outputPath(String outputPath) {
            this.outputPath = outputPath;
            return this;
        }

        public Builder tmpPath(String tmpPath) {
            this.tmpPath = tmpPath;
            return this;
        }

        public Builder format(String format) {
            this.format = format;
            return this;
        }

        public Builder product(Product product) {
            this.products.add(product);
            return this;
        }

        public Builder products(Set<Product> products) {
            this.products.clear();
            this.products.addAll(products);
            return this;
        }

        public Builder aot(Double aot) {
            this.aot = aot;
            return this;
        }

        public Builder visibility(Double visibility) {
            this.visibility = visibility;
            return this;
        }

        public Builder aotFile(String aotFile) {
            this.aotFile = aotFile;
            return this;
        }

        public Builder minAot(Double minAot) {
            this.minAot = minAot;
            return this;
        }

        public Builder maxAot(Double maxAot) {
            this.maxAot = maxAot;
            return this;
        }

        public Builder lowAot(Double lowAot) {
            this.lowAot = lowAot;
            return this;
        }

        public Builder upAot(Double upAot) {
            this.upAot = upAot;
            return this;
        }

        public Builder demPath(String demPath) {
            this.demPath = demPath;
            return this;
        }

        public Builder outputWkt(String outputWkt) {
            this.outputWkt = outputWkt;
            return this;
        }

        public Builder projAbbv(String projAbbv) {
            this.projAbbv = projAbbv;
            return this;
        }

        public Builder atmosOzone(Double atmosOzone) {
            this.atmosOzone = atmosOzone;
            return this;
        }

        public Builder atmosWater(Double atmosWater) {
            this.atmosWater = atmosWater;
            return this;
        }

        public Builder stageProvider(String stageProvider) {
            this.stageProvider = stageProvider;
            return this;
        }

        public Builder mode(TransportMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder coordinator(CoordinatorConfig coordinator) {
            this.coordinator = coordinator;
            return this;
        }

        public RunSettings build() {
            return new RunSettings(this);
        }
    }

    @Override
    public String toString() {
        return "RunSettings{sensor='" + sensor + "', products=" + products + ", outputPath='" + outputPath
                + "', mode=" + mode + ", " + coordinator + '}';
    }
}
