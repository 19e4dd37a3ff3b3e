package scenerelay.coordinator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable per-scene unit of work threaded through every stage.
 *
 * The coordinator only interprets {@link #index()}, {@link #aotValue()},
 * the completed stages and the failure marker. Parameters and outputs are
 * opaque to it and belong to the stage functions.
 *
 * Equality is field-for-field, so a record that crossed a process boundary
 * compares equal to the one that was sent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonDeserialize(builder = JobRecord.Builder.class)
public final class JobRecord {
    private final int index;
    private final String scene;
    private final Map<String, String> parameters;
    private final Map<String, String> outputs;
    private final Double aotValue;
    private final Set<StageId> completedStages;
    private final StageFailure failure;

    private JobRecord(Builder builder) {
        if (builder.index < 0) {
            throw new IllegalArgumentException("index must not be negative");
        }
        this.index = builder.index;
        this.scene = Objects.requireNonNull(builder.scene, "scene is required");
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.outputs));
        this.aotValue = builder.aotValue;
        this.completedStages = Collections.unmodifiableSet(EnumSet.copyOf(builder.completedStages));
        this.failure = builder.failure;
    }

    // Getters
    @JsonProperty("index")
    public int index() {
        return index;
    }

    @JsonProperty("scene")
    public String scene() {
        return scene;
    }

    @JsonProperty("parameters")
    public Map<String, String> parameters() {
        return parameters;
    }

    @JsonProperty("outputs")
    public Map<String, String> outputs() {
        return outputs;
    }

    @JsonProperty("aotValue")
    public Double aotValue() {
        return aotValue;
    }

    @JsonProperty("completedStages")
    public Set<StageId> completedStages() {
        return completedStages;
    }

    @JsonProperty("failure")
    public StageFailure failure() {
        return failure;
    }

    public String parameter(String key) {
        return parameters.get(key);
    }

    public boolean hasAotValue() {
        return aotValue != null && !aotValue.isNaN();
    }

    public boolean hasCompleted(StageId stage) {
        return completedStages.contains(stage);
    }

    @JsonIgnore
    public boolean isFailed() {
        return failure != null;
    }

    public JobRecord withAotValue(Double value) {
        return toBuilder().aotValue(value).build();
    }

    public JobRecord withOutput(String key, String value) {
        return toBuilder().output(key, value).build();
    }

    public JobRecord withCompletedStage(StageId stage) {
        return toBuilder().completedStage(stage).build();
    }

    public JobRecord withFailure(StageFailure failure) {
        return toBuilder().failure(failure).build();
    }

    /** Create a builder from this record (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .index(index)
                .scene(scene)
                .parameters(parameters)
                .outputs(outputs)
                .aotValue(aotValue)
                .completedStages(completedStages)
                .failure(failure);
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private int index;
        private String scene;
        private final Map<String, String> parameters = new LinkedHashMap<>();
        private final Map<String, String> outputs = new LinkedHashMap<>();
        private Double aotValue;
        private final EnumSet<StageId> completedStages = EnumSet.noneOf(StageId.class);
        private StageFailure failure;

        public Builder index(int index) {
            this.index = index;
            return this;
        }

        public Builder scene(String scene) {
            this.scene = scene;
            return this;
        }

        public Builder parameters(Map<String, String> parameters) {
            this.parameters.clear();
            if (parameters != null) {
                this.parameters.putAll(parameters);
            }
            return this;
        }

        public Builder parameter(String key, String value) {
            this.parameters.put(key, value);
            return this;
        }

        public Builder outputs(Map<String, String> outputs) {
            this.outputs.clear();
            if (outputs != null) {
                this.outputs.putAll(outputs);
            }
            return this;
        }

        public Builder output(String key, String value) {
            this.outputs.put(key, value);
            return this;
        }

        public Builder aotValue(Double aotValue) {
            this.aotValue = aotValue;
            return this;
        }

        public Builder completedStages(Collection<StageId> stages) {
            this.completedStages.clear();
            if (stages != null) {
                this.completedStages.addAll(stages);
            }
            return this;
        }

        public Builder completedStage(StageId stage) {
            this.completedStages.add(stage);
            return this;
        }

        public Builder failure(StageFailure failure) {
            this.failure = failure;
            return this;
        }

        public JobRecord build() {
            return new JobRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobRecord other))
            return false;
        return index == other.index
                && scene.equals(other.scene)
                && parameters.equals(other.parameters)
                && outputs.equals(other.outputs)
                && Objects.equals(aotValue, other.aotValue)
                && completedStages.equals(other.completedStages)
                && Objects.equals(failure, other.failure);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, scene, parameters, outputs, aotValue, completedStages, failure);
    }

    @Override
    public String toString() {
        return "JobRecord{index=" + index + ", scene='" + scene + "', completed=" + completedStages
                + (failure != null ? ", failure=" + failure : "") + "}";
    }
}
