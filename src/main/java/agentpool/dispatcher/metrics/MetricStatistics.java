package agentpool.dispatcher.metrics;

import agentpool.dispatcher.model.MetricPoint;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Aggregations over metric values. Empty input yields 0, never an error.
 */
public final class MetricStatistics {

    private MetricStatistics() {
    }

    public static double average(Collection<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    public static double sum(Collection<Double> values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum;
    }

    /**
     * Nearest-rank percentile: sorted ascending, element {@code ceil(n * p) - 1}.
     *
     * @param p fraction in (0, 1]
     */
    public static double percentile(Collection<Double> values, double p) {
        if (values.isEmpty()) {
            return 0.0;
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int index = (int) Math.ceil(sorted.size() * p) - 1;
        index = Math.max(0, Math.min(index, sorted.size() - 1));
        return sorted.get(index);
    }

    /** Values of the points carrying the given metric name */
    public static List<Double> valuesOf(Collection<MetricPoint> points, String metric) {
        List<Double> values = new ArrayList<>();
        for (MetricPoint point : points) {
            if (point.metric().equals(metric)) {
                values.add(point.value());
            }
        }
        return values;
    }

    public static double averageOf(Collection<MetricPoint> points, String metric) {
        return average(valuesOf(points, metric));
    }

    /**
     * Mean of the {@code success} points (1 = success, 0 = failure); 0 when
     * there were no executions.
     */
    public static double successRate(Collection<MetricPoint> points) {
        return averageOf(points, MetricNames.SUCCESS);
    }

    public static double errorRate(Collection<MetricPoint> points) {
        return 1.0 - successRate(points);
    }
}
