package agentpool.dispatcher.alert;

import agentpool.dispatcher.config.DispatcherConfig;
import agentpool.dispatcher.model.AlertCondition;
import agentpool.dispatcher.model.AlertRule;
import agentpool.dispatcher.model.Severity;

import java.util.List;

/**
 * Built-in rules installed on every engine.
 */
public final class AlertRules {

    public static final String HIGH_RESPONSE_TIME = "high_response_time";
    public static final String HIGH_ERROR_RATE = "high_error_rate";
    public static final String AGENT_UNHEALTHY = "agent_unhealthy";

    private AlertRules() {
    }

    public static List<AlertRule> defaults(DispatcherConfig config) {
        return List.of(
                new AlertRule(HIGH_RESPONSE_TIME, "High Response Time", AlertCondition.HIGH_RESPONSE_TIME,
                        config.responseTimeThresholdMs(), Severity.WARNING, true, config.responseTimeCooldown()),
                new AlertRule(HIGH_ERROR_RATE, "High Error Rate", AlertCondition.HIGH_ERROR_RATE,
                        config.errorRateThreshold(), Severity.ERROR, true, config.errorRateCooldown()),
                new AlertRule(AGENT_UNHEALTHY, "Agent Unhealthy", AlertCondition.AGENT_UNHEALTHY,
                        0, Severity.CRITICAL, true, config.unhealthyCooldown()));
    }

    /**
     * Configured threshold for a condition, used when a rule is added without one.
     */
    public static double defaultThreshold(AlertCondition condition, DispatcherConfig config) {
        switch (condition) {
            case HIGH_RESPONSE_TIME:
                return config.responseTimeThresholdMs();
            case HIGH_ERROR_RATE:
                return config.errorRateThreshold();
            case LOW_SUCCESS_RATE:
                return config.successRateThreshold();
            case HIGH_QUEUE_LENGTH:
                return config.queueLengthThreshold();
            default:
                return 0;
        }
    }
}
