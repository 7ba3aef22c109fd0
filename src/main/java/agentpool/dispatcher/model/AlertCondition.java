package agentpool.dispatcher.model;

import java.util.Locale;

/**
 * Conditions the alert engine knows how to evaluate.
 */
public enum AlertCondition {
    /** Average response_time over the lookback exceeds the threshold */
    HIGH_RESPONSE_TIME,
    /** 1 - success rate over the lookback exceeds the threshold */
    HIGH_ERROR_RATE,
    /** Success rate over the lookback is below the threshold */
    LOW_SUCCESS_RATE,
    /** Average queue_length over the lookback exceeds the threshold */
    HIGH_QUEUE_LENGTH,
    /** Some registered instance is not online */
    AGENT_UNHEALTHY;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AlertCondition fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("condition is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown alert condition: " + value);
        }
    }
}
