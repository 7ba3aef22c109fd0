package agentpool.dispatcher.model;

import java.util.Locale;

/**
 * Alert and health-note severity, ordered from least to most severe.
 */
public enum Severity {
    INFO(1),
    WARNING(2),
    ERROR(3),
    CRITICAL(4);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Severity fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("severity is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown severity: " + value);
        }
    }
}
