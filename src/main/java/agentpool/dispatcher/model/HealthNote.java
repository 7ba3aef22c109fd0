package agentpool.dispatcher.model;

import java.time.Instant;

/**
 * A note attached to a health snapshot, either reported by the agent or
 * synthesized when a probe fails.
 */
public record HealthNote(Severity level, String message, Instant timestamp) {
}
