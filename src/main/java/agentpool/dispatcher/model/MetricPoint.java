package agentpool.dispatcher.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One immutable measurement.
 */
public record MetricPoint(Instant timestamp, String agentType, String metric, double value, Map<String, String> tags) {

    /** Agent type used for measurements that belong to the whole pool */
    public static final String SYSTEM = "system";

    public MetricPoint {
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(agentType, "agentType is required");
        Objects.requireNonNull(metric, "metric is required");
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public static MetricPoint of(Instant timestamp, String agentType, String metric, double value) {
        return new MetricPoint(timestamp, agentType, metric, value, Map.of());
    }
}
