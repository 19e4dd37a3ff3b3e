package scenerelay.coordinator.model;

import java.util.Objects;

/**
 * A message as received by the coordinator, tagged with the sender's rank.
 */
public record Envelope(int source, Message message) {
    public Envelope {
        Objects.requireNonNull(message, "message is required");
    }
}
