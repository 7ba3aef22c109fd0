package agentpool.dispatcher.model;

import java.time.Instant;

/**
 * Aggregated view of one agent type over a time range.
 */
public record AgentMetrics(
        String agentType,
        Instant timestamp,
        ResponseTime responseTime,
        Throughput throughput,
        Reliability reliability,
        double queueLength,
        Costs costs) {

    public record ResponseTime(double avg, double p50, double p95, double p99) {
    }

    public record Throughput(double requestsPerMinute, double requestsPerHour) {
    }

    public record Reliability(double successRate, double errorRate, double timeoutRate) {
    }

    public record Costs(double totalCostCents, double avgCostPerRequest, CostTrend costTrend) {
    }

    public enum CostTrend {
        UP,
        DOWN,
        STABLE
    }
}
