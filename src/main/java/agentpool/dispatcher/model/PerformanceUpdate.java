package agentpool.dispatcher.model;

/**
 * Partial update of {@link PerformanceMetrics}; null fields are left untouched.
 */
public record PerformanceUpdate(
        Double averageResponseTimeMs,
        Double successRate,
        Double throughput,
        Double errorRate,
        Double costEfficiency) {

    public static PerformanceUpdate successRate(double successRate) {
        return new PerformanceUpdate(null, successRate, null, null, null);
    }

    public static PerformanceUpdate costEfficiency(double costEfficiency) {
        return new PerformanceUpdate(null, null, null, null, costEfficiency);
    }
}
