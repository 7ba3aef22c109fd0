package agentpool.dispatcher.service;

import agentpool.dispatcher.alert.AlertEngine;
import agentpool.dispatcher.core.EventBus;
import agentpool.dispatcher.core.EventType;
import agentpool.dispatcher.core.LifecycleEvent;
import agentpool.dispatcher.metrics.MetricNames;
import agentpool.dispatcher.metrics.MetricStatistics;
import agentpool.dispatcher.metrics.MetricsStore;
import agentpool.dispatcher.model.AgentMetrics;
import agentpool.dispatcher.model.AgentMetrics.CostTrend;
import agentpool.dispatcher.model.Alert;
import agentpool.dispatcher.model.AlertRule;
import agentpool.dispatcher.model.ExecutionOutcome;
import agentpool.dispatcher.model.ExecutionStatus;
import agentpool.dispatcher.model.MetricPoint;
import agentpool.dispatcher.model.PerformanceMetrics;
import agentpool.dispatcher.model.SystemMetrics;
import agentpool.dispatcher.model.TimeRange;
import agentpool.dispatcher.registry.InstanceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service layer for execution outcomes, metric aggregation and retention.
 * Alert operations are delegated to the {@link AlertEngine}.
 */
public class MonitoringService {

    private static final Logger log = LoggerFactory.getLogger(MonitoringService.class);

    /** Relative change of mean cost that counts as a trend */
    static final double COST_TREND_BAND = 0.10;

    private static final Duration THROUGHPUT_WINDOW = Duration.ofMinutes(1);

    private final InstanceRegistry registry;
    private final Dispatcher dispatcher;
    private final MetricsStore metrics;
    private final AlertEngine alertEngine;
    private final EventBus events;
    private final Clock clock;
    private final double smoothing;
    private final Duration retention;

    public MonitoringService(InstanceRegistry registry, Dispatcher dispatcher, MetricsStore metrics,
            AlertEngine alertEngine, EventBus events, Clock clock, double smoothing, Duration retention) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.alertEngine = alertEngine;
        this.events = events;
        this.clock = clock;
        this.smoothing = smoothing;
        this.retention = retention;
    }

    /**
     * Record the result of one execution: metric points for the agent type,
     * breaker feedback and rolling performance for the instance.
     */
    public void recordExecution(ExecutionOutcome outcome) {
        Instant now = clock.instant();
        String agentType = outcome.agentType();
        String status = outcome.status().wireName();
        String taskType = outcome.taskType() != null ? outcome.taskType() : "unknown";

        metrics.addMetric(new MetricPoint(now, agentType, MetricNames.RESPONSE_TIME, outcome.executionTimeMs(),
                Map.of("task_type", taskType, "complexity", outcome.complexity().wireName(), "status", status)));
        metrics.addMetric(new MetricPoint(now, agentType, MetricNames.COST, outcome.costCents(),
                Map.of("task_type", taskType)));
        metrics.addMetric(new MetricPoint(now, agentType, MetricNames.SUCCESS, outcome.isSuccess() ? 1 : 0,
                Map.of("status", status)));

        String instanceId = outcome.instanceId();
        if (instanceId != null) {
            if (outcome.isSuccess()) {
                dispatcher.recordSuccess(instanceId);
            } else {
                dispatcher.recordFailure(instanceId);
            }
            double recent = countExecutions(agentType, now);
            registry.updatePerformance(instanceId, current -> fold(current, outcome, recent));
        }

        log.debug("Recorded {} execution for {} ({} ms, {} cents)",
                status, agentType, outcome.executionTimeMs(), outcome.costCents());

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("agentType", agentType);
        attributes.put("status", status);
        if (instanceId != null) {
            attributes.put("instanceId", instanceId);
        }
        events.publish(LifecycleEvent.of(EventType.EXECUTION_RECORDED, now, attributes));
    }

    /** Exponential moving average of response time and success rate. */
    PerformanceMetrics fold(PerformanceMetrics current, ExecutionOutcome outcome, double throughput) {
        double sample = outcome.executionTimeMs();
        double avg = current.averageResponseTimeMs() <= 0
                ? sample
                : smoothing * sample + (1 - smoothing) * current.averageResponseTimeMs();
        double success = smoothing * (outcome.isSuccess() ? 1 : 0) + (1 - smoothing) * current.successRate();
        return new PerformanceMetrics(avg, success, throughput, 1 - success, current.costEfficiency());
    }

    private double countExecutions(String agentType, Instant now) {
        return metrics.query(agentType, MetricNames.SUCCESS, TimeRange.lastOf(THROUGHPUT_WINDOW, now)).size();
    }

    public void addMetric(MetricPoint point) {
        metrics.addMetric(point);
    }

    public AgentMetrics getAgentMetrics(String agentType, TimeRange range) {
        List<MetricPoint> points = metrics.queryAgent(agentType, range);

        List<Double> responseTimes = MetricStatistics.valuesOf(points, MetricNames.RESPONSE_TIME);
        List<MetricPoint> successPoints = new ArrayList<>();
        for (MetricPoint point : points) {
            if (point.metric().equals(MetricNames.SUCCESS)) {
                successPoints.add(point);
            }
        }

        double successRate = MetricStatistics.successRate(points);
        long timeouts = successPoints.stream()
                .filter(p -> ExecutionStatus.TIMEOUT.wireName().equals(p.tags().get("status")))
                .count();
        double timeoutRate = successPoints.isEmpty() ? 0 : (double) timeouts / successPoints.size();

        double minutes = Math.max(range.length().toMillis() / 60_000.0, 1.0 / 60);
        double perMinute = successPoints.size() / minutes;

        List<MetricPoint> costPoints = metrics.query(agentType, MetricNames.COST, range);
        List<Double> costs = MetricStatistics.valuesOf(costPoints, MetricNames.COST);
        double totalCost = MetricStatistics.sum(costs);

        return new AgentMetrics(
                agentType,
                clock.instant(),
                new AgentMetrics.ResponseTime(
                        MetricStatistics.average(responseTimes),
                        MetricStatistics.percentile(responseTimes, 0.5),
                        MetricStatistics.percentile(responseTimes, 0.95),
                        MetricStatistics.percentile(responseTimes, 0.99)),
                new AgentMetrics.Throughput(perMinute, perMinute * 60),
                new AgentMetrics.Reliability(successRate, 1 - successRate, timeoutRate),
                MetricStatistics.averageOf(points, MetricNames.QUEUE_LENGTH),
                new AgentMetrics.Costs(totalCost, MetricStatistics.average(costs), costTrend(costs)));
    }

    /**
     * Compare the mean cost of the later half of the range with the earlier
     * half. Values are in insertion order, which is chronological.
     */
    static CostTrend costTrend(List<Double> costs) {
        if (costs.size() < 2) {
            return CostTrend.STABLE;
        }
        int middle = costs.size() / 2;
        double earlier = MetricStatistics.average(costs.subList(0, middle));
        double later = MetricStatistics.average(costs.subList(middle, costs.size()));
        if (earlier == 0) {
            return later > 0 ? CostTrend.UP : CostTrend.STABLE;
        }
        double change = (later - earlier) / earlier;
        if (change > COST_TREND_BAND) {
            return CostTrend.UP;
        }
        if (change < -COST_TREND_BAND) {
            return CostTrend.DOWN;
        }
        return CostTrend.STABLE;
    }

    public SystemMetrics getSystemMetrics(TimeRange range) {
        List<MetricPoint> points = metrics.queryAll(range);
        int total = registry.size();
        int healthy = registry.healthyCount();

        return new SystemMetrics(
                clock.instant(),
                MetricStatistics.valuesOf(points, MetricNames.SUCCESS).size(),
                total,
                healthy,
                MetricStatistics.averageOf(points, MetricNames.RESPONSE_TIME),
                MetricStatistics.successRate(points),
                MetricStatistics.sum(MetricStatistics.valuesOf(points, MetricNames.COST)),
                alertEngine.getActiveAlerts().size(),
                (double) healthy / Math.max(total, 1));
    }

    /**
     * Append the pool-wide gauges under the {@code system} agent type.
     */
    public void collectMetrics() {
        Instant now = clock.instant();
        Runtime runtime = Runtime.getRuntime();
        double usedMb = (runtime.totalMemory() - runtime.freeMemory()) / (1024.0 * 1024.0);

        metrics.addMetric(MetricPoint.of(now, MetricPoint.SYSTEM, MetricNames.TOTAL_INSTANCES, registry.size()));
        metrics.addMetric(MetricPoint.of(now, MetricPoint.SYSTEM, MetricNames.HEALTHY_INSTANCES,
                registry.healthyCount()));
        metrics.addMetric(MetricPoint.of(now, MetricPoint.SYSTEM, MetricNames.AVERAGE_LOAD, registry.averageLoad()));
        metrics.addMetric(MetricPoint.of(now, MetricPoint.SYSTEM, MetricNames.MEMORY_USAGE, usedMb));
    }

    /**
     * Drop metric points and resolved alerts older than the retention period.
     */
    public void cleanup() {
        Instant cutoff = clock.instant().minus(retention);
        int points = metrics.cleanup(cutoff);
        int alerts = alertEngine.cleanup(cutoff);
        if (points > 0 || alerts > 0) {
            log.info("Retention cleanup: {} metric points, {} resolved alerts removed", points, alerts);
        }
    }

    public List<Alert> getActiveAlerts() {
        return alertEngine.getActiveAlerts();
    }

    public List<Alert> getAlerts() {
        return alertEngine.getAlerts();
    }

    public boolean acknowledgeAlert(String alertId) {
        return alertEngine.acknowledgeAlert(alertId);
    }

    public boolean resolveAlert(String alertId) {
        return alertEngine.resolveAlert(alertId);
    }

    public void addAlertRule(AlertRule rule) {
        alertEngine.addAlertRule(rule);
    }
}
