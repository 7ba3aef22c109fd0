package agentpool.dispatcher.metrics;

import agentpool.dispatcher.model.MetricPoint;
import agentpool.dispatcher.model.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only in-memory log of metric points, bucketed by agent type and
 * metric name. Points are kept in insertion order within a bucket.
 */
public class MetricsStore {

    private static final Logger log = LoggerFactory.getLogger(MetricsStore.class);

    private record BucketKey(String agentType, String metric) {
    }

    private final Map<BucketKey, List<MetricPoint>> buckets = new LinkedHashMap<>();

    public synchronized void addMetric(MetricPoint point) {
        buckets.computeIfAbsent(new BucketKey(point.agentType(), point.metric()), k -> new ArrayList<>())
                .add(point);
    }

    /** Points of one metric for one agent type inside the range */
    public synchronized List<MetricPoint> query(String agentType, String metric, TimeRange range) {
        List<MetricPoint> bucket = buckets.get(new BucketKey(agentType, metric));
        if (bucket == null) {
            return List.of();
        }
        return filter(bucket, range, new ArrayList<>());
    }

    /** All points of one agent type inside the range */
    public synchronized List<MetricPoint> queryAgent(String agentType, TimeRange range) {
        List<MetricPoint> result = new ArrayList<>();
        buckets.forEach((key, bucket) -> {
            if (key.agentType().equals(agentType)) {
                filter(bucket, range, result);
            }
        });
        return result;
    }

    /** All points inside the range, whatever their agent type */
    public synchronized List<MetricPoint> queryAll(TimeRange range) {
        List<MetricPoint> result = new ArrayList<>();
        for (List<MetricPoint> bucket : buckets.values()) {
            filter(bucket, range, result);
        }
        return result;
    }

    /**
     * Drop every point older than the cutoff; empty buckets are removed.
     *
     * @return number of points removed
     */
    public synchronized int cleanup(Instant cutoff) {
        int removed = 0;
        for (Iterator<List<MetricPoint>> it = buckets.values().iterator(); it.hasNext();) {
            List<MetricPoint> bucket = it.next();
            int before = bucket.size();
            bucket.removeIf(point -> point.timestamp().isBefore(cutoff));
            removed += before - bucket.size();
            if (bucket.isEmpty()) {
                it.remove();
            }
        }
        if (removed > 0) {
            log.debug("Pruned {} metric points older than {}", removed, cutoff);
        }
        return removed;
    }

    public synchronized int size() {
        int total = 0;
        for (List<MetricPoint> bucket : buckets.values()) {
            total += bucket.size();
        }
        return total;
    }

    private static List<MetricPoint> filter(List<MetricPoint> bucket, TimeRange range, List<MetricPoint> into) {
        for (MetricPoint point : bucket) {
            if (range.contains(point.timestamp())) {
                into.add(point);
            }
        }
        return into;
    }
}
