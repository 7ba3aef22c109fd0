package agentpool.dispatcher.model;

/**
 * Circuit breaker state.
 */
public enum CircuitState {
    /** Requests flow normally */
    CLOSED,
    /** Instance is excluded from selection */
    OPEN,
    /** Timeout elapsed, one trial request is allowed through */
    HALF_OPEN
}
