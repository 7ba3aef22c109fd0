package agentpool.dispatcher.api.v1.dto;

import agentpool.dispatcher.model.AlertRule;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for an alert rule.
 */
public record AlertRuleResponse(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("condition") String condition,
        @JsonProperty("threshold") double threshold,
        @JsonProperty("severity") String severity,
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("cooldownMs") long cooldownMs) {

    public static AlertRuleResponse from(AlertRule rule) {
        return new AlertRuleResponse(
                rule.id(),
                rule.name(),
                rule.condition().wireName(),
                rule.threshold(),
                rule.severity().wireName(),
                rule.enabled(),
                rule.cooldown().toMillis());
    }
}
