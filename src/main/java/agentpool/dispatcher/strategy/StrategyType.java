package agentpool.dispatcher.strategy;

import java.util.Locale;

/**
 * Selection strategies the dispatcher can be configured with.
 */
public enum StrategyType {
    ROUND_ROBIN,
    LEAST_CONNECTIONS,
    WEIGHTED_RESPONSE_TIME,
    ADAPTIVE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static StrategyType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("strategy is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown selection strategy: " + value);
        }
    }
}
