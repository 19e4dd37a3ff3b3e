package scenerelay.coordinator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;

/**
 * Protocol messages exchanged between the coordinator (rank 0) and workers
 * (ranks 1..N). Each variant validates its payload at construction.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Message.Ready.class, name = "READY"),
        @JsonSubTypes.Type(value = Message.Assign.class, name = "ASSIGN"),
        @JsonSubTypes.Type(value = Message.Result.class, name = "RESULT"),
        @JsonSubTypes.Type(value = Message.Exit.class, name = "EXIT")
})
public sealed interface Message permits Message.Ready, Message.Assign, Message.Result, Message.Exit {

    /**
     * Worker is parked and waiting for its next instruction.
     */
    record Ready(int rank) implements Message {
        public Ready {
            if (rank < 1) {
                throw new IllegalArgumentException("worker rank must be >= 1, got " + rank);
            }
        }
    }

    /**
     * Run {@code stage} on {@code job}.
     */
    record Assign(StageId stage, JobRecord job) implements Message {
        public Assign {
            Objects.requireNonNull(stage, "stage is required");
            Objects.requireNonNull(job, "job is required");
        }
    }

    /**
     * Outcome of one assignment: either the updated job or a failure, never both.
     */
    record Result(StageId stage, int jobIndex, JobRecord job, StageFailure failure) implements Message {
        public Result {
            Objects.requireNonNull(stage, "stage is required");
            if ((job == null) == (failure == null)) {
                throw new IllegalArgumentException("result must carry exactly one of job or failure");
            }
            if (job != null && job.index() != jobIndex) {
                throw new IllegalArgumentException(
                        "result job index " + job.index() + " does not match " + jobIndex);
            }
        }

        public static Result success(StageId stage, JobRecord job) {
            return new Result(stage, job.index(), job, null);
        }

        public static Result failed(StageId stage, int jobIndex, StageFailure failure) {
            return new Result(stage, jobIndex, null, failure);
        }

        @JsonIgnore
        public boolean isSuccess() {
            return job != null;
        }
    }

    /**
     * Terminate the worker loop.
     */
    record Exit() implements Message {
    }
}
