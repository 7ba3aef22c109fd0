package agentpool.dispatcher.model;

import java.util.Locale;

/**
 * Health status reported by (or synthesized for) an agent instance.
 */
public enum HealthStatus {
    /** Instance answers its health endpoint and accepts work */
    ONLINE,
    /** Instance reports itself offline */
    OFFLINE,
    /** Instance is saturated */
    BUSY,
    /** Last probe failed or the instance reported an error */
    ERROR,
    /** Instance is deliberately out of rotation */
    MAINTENANCE,
    /** Never probed */
    UNKNOWN;

    public boolean isHealthy() {
        return this == ONLINE;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a status as reported by an agent's health endpoint.
     * Missing values mean the agent answered, so they map to ONLINE.
     */
    public static HealthStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            return ONLINE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
