package agentpool.dispatcher.core;

/**
 * Lifecycle notifications published on the {@link EventBus}.
 */
public enum EventType {
    INSTANCE_REGISTERED,
    INSTANCE_DEREGISTERED,
    HEALTH_CHECK_COMPLETED,
    HEALTH_CHECK_FAILED,
    ALERT_CREATED,
    ALERT_ACKNOWLEDGED,
    ALERT_RESOLVED,
    ALERT_RULE_ADDED,
    EXECUTION_RECORDED,
    MONITORING_STARTED,
    MONITORING_STOPPED
}
