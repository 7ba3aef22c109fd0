package agentpool.dispatcher.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * An alert raised by a rule. Acknowledge and resolve produce new copies.
 */
public record Alert(
        String id,
        String ruleId,
        String agentType,
        Severity severity,
        String message,
        Instant createdAt,
        boolean acknowledged,
        Instant resolvedAt,
        Map<String, Object> metadata) {

    public Alert {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(ruleId, "ruleId is required");
        Objects.requireNonNull(severity, "severity is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean isResolved() {
        return resolvedAt != null;
    }

    /** Neither acknowledged nor resolved */
    public boolean isActive() {
        return !acknowledged && resolvedAt == null;
    }

    public Alert acknowledge() {
        return new Alert(id, ruleId, agentType, severity, message, createdAt, true, resolvedAt, metadata);
    }

    public Alert resolve(Instant at) {
        return new Alert(id, ruleId, agentType, severity, message, createdAt, acknowledged, at, metadata);
    }
}
