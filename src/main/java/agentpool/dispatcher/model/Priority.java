package agentpool.dispatcher.model;

import java.util.Locale;

/**
 * Request priority hint.
 */
public enum Priority {
    LOW,
    NORMAL,
    HIGH,
    URGENT;

    public static Priority fromWire(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown priority: " + value);
        }
    }
}
