package agentpool.dispatcher.model;

/**
 * Rolling performance of an agent instance.
 *
 * @param averageResponseTimeMs moving average of execution time
 * @param successRate           fraction of successful executions, 0..1
 * @param throughput            executions completed during the last minute
 * @param errorRate             1 - successRate
 * @param costEfficiency        operator-supplied score, 0..1
 */
public record PerformanceMetrics(
        double averageResponseTimeMs,
        double successRate,
        double throughput,
        double errorRate,
        double costEfficiency) {

    public static PerformanceMetrics initial() {
        return new PerformanceMetrics(0, 1, 0, 0, 1);
    }

    /**
     * Overlay the non-null fields of a partial update.
     */
    public PerformanceMetrics merge(PerformanceUpdate update) {
        return new PerformanceMetrics(
                update.averageResponseTimeMs() != null ? update.averageResponseTimeMs() : averageResponseTimeMs,
                update.successRate() != null ? update.successRate() : successRate,
                update.throughput() != null ? update.throughput() : throughput,
                update.errorRate() != null ? update.errorRate() : errorRate,
                update.costEfficiency() != null ? update.costEfficiency() : costEfficiency);
    }
}
