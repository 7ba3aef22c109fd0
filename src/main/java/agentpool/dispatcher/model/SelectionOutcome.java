package agentpool.dispatcher.model;

/**
 * Outcome of asking the dispatcher for an instance.
 */
public enum SelectionOutcome {
    /** An eligible instance was chosen */
    SELECTED,

    /** No instance was ever registered for the agent type */
    NO_INSTANCES_REGISTERED,

    /**
     * Instances exist but all are unhealthy, at capacity or circuit-open.
     * The caller should queue, retry or escalate.
     */
    NONE_AVAILABLE
}
