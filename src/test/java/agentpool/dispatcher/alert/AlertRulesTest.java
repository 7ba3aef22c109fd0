package agentpool.dispatcher.alert;

import agentpool.dispatcher.config.DispatcherConfig;
import agentpool.dispatcher.model.AlertCondition;
import agentpool.dispatcher.model.AlertRule;
import agentpool.dispatcher.model.Severity;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AlertRulesTest {

    @Test
    void defaultsFollowConfig() {
        DispatcherConfig config = DispatcherConfig.defaults()
                .withResponseTimeThresholdMs(4_000)
                .withErrorRateThreshold(0.25)
                .withUnhealthyCooldown(Duration.ofMinutes(2));

        List<AlertRule> rules = AlertRules.defaults(config);

        assertEquals(List.of("high_response_time", "high_error_rate", "agent_unhealthy"),
                rules.stream().map(AlertRule::id).toList());
        assertEquals(4_000, rules.get(0).threshold());
        assertEquals(Severity.WARNING, rules.get(0).severity());
        assertEquals(0.25, rules.get(1).threshold());
        assertEquals(Duration.ofMinutes(5), rules.get(1).cooldown());
        assertEquals(Severity.CRITICAL, rules.get(2).severity());
        assertEquals(Duration.ofMinutes(2), rules.get(2).cooldown());
    }

    @Test
    void fallbackThresholdPerCondition() {
        DispatcherConfig config = DispatcherConfig.defaults()
                .withSuccessRateThreshold(0.95)
                .withQueueLengthThreshold(20);

        assertEquals(10_000, AlertRules.defaultThreshold(AlertCondition.HIGH_RESPONSE_TIME, config));
        assertEquals(0.1, AlertRules.defaultThreshold(AlertCondition.HIGH_ERROR_RATE, config));
        assertEquals(0.95, AlertRules.defaultThreshold(AlertCondition.LOW_SUCCESS_RATE, config));
        assertEquals(20, AlertRules.defaultThreshold(AlertCondition.HIGH_QUEUE_LENGTH, config));
        assertEquals(0, AlertRules.defaultThreshold(AlertCondition.AGENT_UNHEALTHY, config));
    }
}
