package agentpool.dispatcher.api.v1.dto;

import agentpool.dispatcher.model.AlertCondition;
import agentpool.dispatcher.model.AlertRule;
import agentpool.dispatcher.model.Severity;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Request DTO for adding or replacing an alert rule.
 * POST /api/v1/alert-rules
 */
public record CreateAlertRuleRequest(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("condition") String condition,
        @JsonProperty("threshold") Double threshold,
        @JsonProperty("severity") String severity,
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("cooldownMs") Long cooldownMs) {

    public void validate() {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id is required");
        }
        AlertCondition.fromWire(condition);
        Severity.fromWire(severity);
        if (cooldownMs != null && cooldownMs < 0) {
            throw new IllegalArgumentException("cooldownMs must be non-negative");
        }
    }

    /**
     * @param fallbackThreshold threshold used when the request carries none
     */
    public AlertRule toRule(double fallbackThreshold) {
        return new AlertRule(
                id.trim(),
                name,
                AlertCondition.fromWire(condition),
                threshold != null ? threshold : fallbackThreshold,
                Severity.fromWire(severity),
                enabled == null || enabled,
                Duration.ofMillis(cooldownMs != null ? cooldownMs : 0));
    }
}
