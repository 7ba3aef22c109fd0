package agentpool.dispatcher.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Last-known health of an agent instance.
 */
public record HealthSnapshot(
        HealthStatus status,
        long responseTimeMs,
        double errorRate24h,
        int currentLoad,
        int availableCapacity,
        List<HealthNote> notes,
        Instant checkedAt) {

    public HealthSnapshot {
        Objects.requireNonNull(status, "status is required");
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    /** Snapshot for an instance that has not been probed yet */
    public static HealthSnapshot unknown(Instant now) {
        return new HealthSnapshot(HealthStatus.UNKNOWN, 0, 0.0, 0, 100, List.of(), now);
    }

    /** Snapshot synthesized when a probe fails or times out */
    public static HealthSnapshot probeFailed(String reason, Instant now) {
        HealthNote note = new HealthNote(Severity.CRITICAL, "Health check failed: " + reason, now);
        return new HealthSnapshot(HealthStatus.ERROR, 0, 1.0, 0, 0, List.of(note), now);
    }

    public boolean isHealthy() {
        return status.isHealthy();
    }
}
