package agentpool.dispatcher.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Operator-configured alerting rule.
 *
 * @param cooldown minimum time between two unresolved alerts for this rule
 */
public record AlertRule(
        String id,
        String name,
        AlertCondition condition,
        double threshold,
        Severity severity,
        boolean enabled,
        Duration cooldown) {

    public AlertRule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("rule id is required");
        }
        Objects.requireNonNull(condition, "condition is required");
        Objects.requireNonNull(severity, "severity is required");
        name = name == null || name.isBlank() ? id : name;
        cooldown = cooldown == null ? Duration.ZERO : cooldown;
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative");
        }
    }

    public AlertRule withEnabled(boolean value) {
        return new AlertRule(id, name, condition, threshold, severity, value, cooldown);
    }
}
