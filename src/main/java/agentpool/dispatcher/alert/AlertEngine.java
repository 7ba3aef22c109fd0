package agentpool.dispatcher.alert;

import agentpool.dispatcher.core.EventBus;
import agentpool.dispatcher.core.EventType;
import agentpool.dispatcher.core.LifecycleEvent;
import agentpool.dispatcher.metrics.MetricNames;
import agentpool.dispatcher.metrics.MetricStatistics;
import agentpool.dispatcher.metrics.MetricsStore;
import agentpool.dispatcher.model.AgentInstance;
import agentpool.dispatcher.model.Alert;
import agentpool.dispatcher.model.AlertRule;
import agentpool.dispatcher.model.MetricPoint;
import agentpool.dispatcher.model.TimeRange;
import agentpool.dispatcher.registry.InstanceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Evaluates alert rules against recent metrics and instance health, keeps
 * the alert collection and notifies channels.
 *
 * A rule that fires while an unresolved alert for it is younger than the
 * rule's cooldown creates nothing. Channel failures are logged per channel.
 */
public class AlertEngine {

    private static final Logger log = LoggerFactory.getLogger(AlertEngine.class);

    /** Metrics window every condition is evaluated over */
    public static final Duration LOOKBACK = Duration.ofMinutes(5);

    private final InstanceRegistry registry;
    private final MetricsStore metrics;
    private final List<AlertChannel> channels;
    private final boolean deliveryEnabled;
    private final EventBus events;
    private final Clock clock;

    private final Map<String, AlertRule> rules = new LinkedHashMap<>();
    private final Map<String, Alert> alerts = new LinkedHashMap<>();

    public AlertEngine(InstanceRegistry registry, MetricsStore metrics, List<AlertChannel> channels,
            boolean deliveryEnabled, EventBus events, Clock clock) {
        this.registry = registry;
        this.metrics = metrics;
        this.channels = List.copyOf(channels);
        this.deliveryEnabled = deliveryEnabled;
        this.events = events;
        this.clock = clock;
    }

    /** Condition outcome plus the value that was compared */
    record Evaluation(boolean triggered, double observed, String detail) {
        static Evaluation quiet(double observed) {
            return new Evaluation(false, observed, null);
        }
    }

    /**
     * Run every enabled rule once.
     *
     * @return alerts created in this pass
     */
    public List<Alert> evaluate() {
        Instant now = clock.instant();
        List<MetricPoint> recent = metrics.queryAll(new TimeRange(now.minus(LOOKBACK), now));
        List<AgentInstance> instances = registry.all();

        List<Alert> created = new ArrayList<>();
        for (AlertRule rule : rules()) {
            if (!rule.enabled()) {
                continue;
            }
            try {
                Evaluation evaluation = evaluateCondition(rule, recent, instances);
                if (evaluation.triggered()) {
                    createUnlessDuplicate(rule, evaluation, now).ifPresent(created::add);
                }
            } catch (Exception e) {
                log.error("Error evaluating alert rule {}", rule.id(), e);
            }
        }

        for (Alert alert : created) {
            log.info("Alert {} created for rule {} ({})", alert.id(), alert.ruleId(), alert.severity().wireName());
            events.publish(LifecycleEvent.of(EventType.ALERT_CREATED, now,
                    Map.of("alertId", alert.id(), "ruleId", alert.ruleId(),
                            "severity", alert.severity().wireName())));
            if (deliveryEnabled) {
                deliver(alert);
            }
        }
        return created;
    }

    Evaluation evaluateCondition(AlertRule rule, List<MetricPoint> recent, List<AgentInstance> instances) {
        switch (rule.condition()) {
            case HIGH_RESPONSE_TIME: {
                double avg = MetricStatistics.averageOf(recent, MetricNames.RESPONSE_TIME);
                return new Evaluation(avg > rule.threshold(), avg, null);
            }
            case HIGH_ERROR_RATE: {
                double errorRate = MetricStatistics.errorRate(recent);
                return new Evaluation(errorRate > rule.threshold(), errorRate, null);
            }
            case LOW_SUCCESS_RATE: {
                if (MetricStatistics.valuesOf(recent, MetricNames.SUCCESS).isEmpty()) {
                    return Evaluation.quiet(0);
                }
                double successRate = MetricStatistics.successRate(recent);
                return new Evaluation(successRate < rule.threshold(), successRate, null);
            }
            case HIGH_QUEUE_LENGTH: {
                double queue = MetricStatistics.averageOf(recent, MetricNames.QUEUE_LENGTH);
                return new Evaluation(queue > rule.threshold(), queue, null);
            }
            case AGENT_UNHEALTHY: {
                List<String> unhealthy = new ArrayList<>();
                for (AgentInstance instance : instances) {
                    if (!instance.health().isHealthy()) {
                        unhealthy.add(instance.id());
                    }
                }
                return new Evaluation(!unhealthy.isEmpty(), unhealthy.size(),
                        unhealthy.isEmpty() ? null : String.join(",", unhealthy));
            }
            default:
                return Evaluation.quiet(0);
        }
    }

    private synchronized Optional<Alert> createUnlessDuplicate(AlertRule rule, Evaluation evaluation, Instant now) {
        if (hasRecentAlert(rule, now)) {
            log.debug("Rule {} still firing, suppressed by cooldown", rule.id());
            return Optional.empty();
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("rule", rule.name());
        metadata.put("condition", rule.condition().wireName());
        metadata.put("threshold", rule.threshold());
        metadata.put("observed", evaluation.observed());
        if (evaluation.detail() != null) {
            metadata.put("instances", evaluation.detail());
        }

        Alert alert = new Alert(
                UUID.randomUUID().toString(),
                rule.id(),
                MetricPoint.SYSTEM,
                rule.severity(),
                "Alert: " + rule.name(),
                now,
                false,
                null,
                metadata);
        alerts.put(alert.id(), alert);
        return Optional.of(alert);
    }

    private boolean hasRecentAlert(AlertRule rule, Instant now) {
        Instant cutoff = now.minus(rule.cooldown());
        for (Alert alert : alerts.values()) {
            if (alert.ruleId().equals(rule.id()) && !alert.isResolved() && alert.createdAt().isAfter(cutoff)) {
                return true;
            }
        }
        return false;
    }

    private void deliver(Alert alert) {
        for (AlertChannel channel : channels) {
            try {
                channel.send(alert);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Delivery of alert {} via {} interrupted", alert.id(), channel.name());
                return;
            } catch (Exception e) {
                log.warn("Delivery of alert {} via {} failed: {}", alert.id(), channel.name(), e.getMessage());
            }
        }
    }

    /** Alerts neither acknowledged nor resolved, most severe first */
    public synchronized List<Alert> getActiveAlerts() {
        return alerts.values().stream()
                .filter(Alert::isActive)
                .sorted(Comparator.comparingInt((Alert a) -> a.severity().rank()).reversed()
                        .thenComparing(Alert::createdAt))
                .toList();
    }

    public synchronized List<Alert> getAlerts() {
        return new ArrayList<>(alerts.values());
    }

    public synchronized Optional<Alert> findAlert(String alertId) {
        return Optional.ofNullable(alerts.get(alertId));
    }

    public boolean acknowledgeAlert(String alertId) {
        Alert updated;
        synchronized (this) {
            Alert alert = alerts.get(alertId);
            if (alert == null) {
                return false;
            }
            updated = alert.acknowledge();
            alerts.put(alertId, updated);
        }
        log.info("Alert {} acknowledged", alertId);
        events.publish(LifecycleEvent.of(EventType.ALERT_ACKNOWLEDGED, clock.instant(),
                Map.of("alertId", alertId, "ruleId", updated.ruleId())));
        return true;
    }

    public boolean resolveAlert(String alertId) {
        Alert updated;
        synchronized (this) {
            Alert alert = alerts.get(alertId);
            if (alert == null) {
                return false;
            }
            updated = alert.isResolved() ? alert : alert.resolve(clock.instant());
            alerts.put(alertId, updated);
        }
        log.info("Alert {} resolved", alertId);
        events.publish(LifecycleEvent.of(EventType.ALERT_RESOLVED, clock.instant(),
                Map.of("alertId", alertId, "ruleId", updated.ruleId())));
        return true;
    }

    /** Add or replace a rule by id */
    public void addAlertRule(AlertRule rule) {
        synchronized (this) {
            rules.put(rule.id(), rule);
        }
        log.info("Alert rule {} ({}) installed, threshold {}", rule.id(), rule.condition().wireName(),
                rule.threshold());
        events.publish(LifecycleEvent.of(EventType.ALERT_RULE_ADDED, clock.instant(),
                Map.of("ruleId", rule.id(), "condition", rule.condition().wireName())));
    }

    public synchronized List<AlertRule> rules() {
        return new ArrayList<>(rules.values());
    }

    /**
     * Purge resolved alerts whose resolution is older than the cutoff.
     *
     * @return number of alerts purged
     */
    public synchronized int cleanup(Instant cutoff) {
        int removed = 0;
        for (Iterator<Alert> it = alerts.values().iterator(); it.hasNext();) {
            Alert alert = it.next();
            if (alert.isResolved() && alert.resolvedAt().isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }
}
