package agentpool.dispatcher.model;

import java.util.Locale;

/**
 * Request complexity hint.
 */
public enum Complexity {
    SIMPLE,
    MODERATE,
    COMPLEX;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Complexity fromWire(String value) {
        if (value == null || value.isBlank()) {
            return MODERATE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown complexity: " + value);
        }
    }
}
