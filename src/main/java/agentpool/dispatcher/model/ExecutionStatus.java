package agentpool.dispatcher.model;

import java.util.Locale;

/**
 * Final status of a task executed on an agent instance.
 */
public enum ExecutionStatus {
    SUCCESS,
    PARTIAL_SUCCESS,
    FAILURE,
    TIMEOUT;

    /** Only a full success counts towards success rate and closes the circuit. */
    public boolean isSuccess() {
        return this == SUCCESS;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ExecutionStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown execution status: " + value);
        }
    }
}
