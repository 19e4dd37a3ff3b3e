package scenerelay.coordinator.config;

import java.util.Locale;

/**
 * Where the workers of a run live.
 */
public enum TransportMode {
    /** Worker threads inside the coordinator JVM */
    LOCAL,
    /** Separate worker processes connected over TCP */
    TCP;

    public static TransportMode parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown transport mode: " + value);
        }
    }
}
