package agentpool.dispatcher.model;

import java.time.Instant;

/**
 * Pool-wide aggregates over a time range.
 */
public record SystemMetrics(
        Instant timestamp,
        long totalRequests,
        int totalInstances,
        int healthyInstances,
        double averageResponseTime,
        double overallSuccessRate,
        double totalCostCents,
        int activeAlerts,
        double systemLoad) {
}
