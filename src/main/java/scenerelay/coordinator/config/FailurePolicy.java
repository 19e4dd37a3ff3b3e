package scenerelay.coordinator.config;

import java.util.Locale;

/**
 * What a failed job does to the rest of the run.
 */
public enum FailurePolicy {
    /** First failed job aborts the run after all workers were told to exit */
    FAIL_FAST,
    /** Failed job is marked and dropped from later stages; the others continue */
    CONTINUE;

    public static FailurePolicy parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown failure policy: " + value);
        }
    }
}
