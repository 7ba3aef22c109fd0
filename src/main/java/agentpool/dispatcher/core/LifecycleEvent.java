package agentpool.dispatcher.core;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A lifecycle notification. Attributes carry the event-specific payload,
 * e.g. instanceId, agentType, alertId, error.
 */
public record LifecycleEvent(EventType type, Instant timestamp, Map<String, Object> attributes) {

    public LifecycleEvent {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static LifecycleEvent of(EventType type, Instant timestamp) {
        return new LifecycleEvent(type, timestamp, Map.of());
    }

    public static LifecycleEvent of(EventType type, Instant timestamp, Map<String, Object> attributes) {
        return new LifecycleEvent(type, timestamp, attributes);
    }

    public Object attribute(String key) {
        return attributes.get(key);
    }
}
