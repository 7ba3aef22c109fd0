package agentpool.dispatcher.metrics;

/**
 * Metric names written by the dispatcher and read by the alert engine.
 */
public final class MetricNames {

    public static final String RESPONSE_TIME = "response_time";
    public static final String COST = "cost";
    public static final String SUCCESS = "success";
    public static final String QUEUE_LENGTH = "queue_length";

    public static final String HEALTH_CHECK = "health_check";
    public static final String RESPONSE_TIME_HEALTH = "response_time_health";

    public static final String TOTAL_INSTANCES = "total_instances";
    public static final String HEALTHY_INSTANCES = "healthy_instances";
    public static final String AVERAGE_LOAD = "average_load";
    public static final String MEMORY_USAGE = "memory_usage";

    private MetricNames() {
    }
}
