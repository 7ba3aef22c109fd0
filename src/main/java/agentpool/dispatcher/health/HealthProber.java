package agentpool.dispatcher.health;

import agentpool.dispatcher.core.EventBus;
import agentpool.dispatcher.core.EventType;
import agentpool.dispatcher.core.LifecycleEvent;
import agentpool.dispatcher.metrics.MetricNames;
import agentpool.dispatcher.metrics.MetricsStore;
import agentpool.dispatcher.model.AgentInstance;
import agentpool.dispatcher.model.HealthNote;
import agentpool.dispatcher.model.HealthSnapshot;
import agentpool.dispatcher.model.HealthStatus;
import agentpool.dispatcher.model.MetricPoint;
import agentpool.dispatcher.model.Severity;
import agentpool.dispatcher.registry.InstanceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Probes every registered instance concurrently and writes the results
 * back into the registry.
 *
 * Each probe runs on its own pool thread with its own timeout. A slow or
 * failing probe only degrades that instance's snapshot; it never delays
 * past the timeout or fails the round. A timed-out probe thread is
 * interrupted. Circuit breakers are not touched.
 */
public class HealthProber implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthProber.class);

    private final InstanceRegistry registry;
    private final HealthProbe probe;
    private final MetricsStore metrics;
    private final EventBus events;
    private final Clock clock;
    private final Duration timeout;
    private final ExecutorService executor;

    public HealthProber(InstanceRegistry registry, HealthProbe probe, MetricsStore metrics, EventBus events,
            Clock clock, Duration timeout) {
        this.registry = registry;
        this.probe = probe;
        this.metrics = metrics;
        this.events = events;
        this.clock = clock;
        this.timeout = timeout;
        AtomicInteger threadCounter = new AtomicInteger();
        // unbounded so a queue of slow probes cannot eat into the next probe's timeout
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "agentpool-probe-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Probe all instances and wait for the round to finish. Returns once every
     * probe has either answered or timed out.
     */
    public ProbeRound probeAll() {
        List<AgentInstance> targets = registry.all();
        if (targets.isEmpty()) {
            return ProbeRound.empty();
        }

        AtomicInteger healthy = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        List<CompletableFuture<Void>> probes = new ArrayList<>(targets.size());

        for (AgentInstance instance : targets) {
            probes.add(probeOne(instance).thenAccept(ok -> {
                if (ok) {
                    healthy.incrementAndGet();
                } else {
                    failed.incrementAndGet();
                }
            }));
        }

        CompletableFuture.allOf(probes.toArray(new CompletableFuture[0])).join();

        ProbeRound round = new ProbeRound(targets.size(), healthy.get(), failed.get());
        log.info("Health round: {} probed, {} answered, {} failed", round.probed(), round.healthy(),
                round.failed());
        return round;
    }

    /**
     * @return future completing with true if the probe answered, false if it
     *         failed; never completes exceptionally
     */
    CompletableFuture<Boolean> probeOne(AgentInstance instance) {
        Instant started = clock.instant();
        long startNanos = System.nanoTime();

        CompletableFuture<HealthReport> call = new CompletableFuture<>();
        Future<?> task = executor.submit(() -> {
            try {
                call.complete(probe.check(instance));
            } catch (Exception e) {
                call.completeExceptionally(e);
            }
        });

        return call
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((report, error) -> {
                    if (error instanceof TimeoutException) {
                        task.cancel(true);
                    }
                })
                .handle((report, error) -> {
                    try {
                        if (error == null && report != null) {
                            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
                            onSuccess(instance, report, elapsedMs);
                            return true;
                        }
                        onFailure(instance, describe(error), started);
                        return false;
                    } catch (Exception e) {
                        log.error("Failed to record probe result for {}", instance.id(), e);
                        return false;
                    }
                });
    }

    private void onSuccess(AgentInstance instance, HealthReport report, long responseTimeMs) {
        Instant now = clock.instant();
        HealthStatus status = HealthStatus.fromWire(report.status());
        List<HealthNote> notes = new ArrayList<>();
        for (HealthReport.ReportedAlert alert : report.alertsOrEmpty()) {
            notes.add(toNote(alert, now));
        }

        HealthSnapshot snapshot = new HealthSnapshot(
                status,
                responseTimeMs,
                report.errorRateOrDefault(),
                report.currentLoadOrDefault(),
                report.availableCapacityOrDefault(),
                notes,
                now);

        if (registry.applyHealth(instance.id(), snapshot).isEmpty()) {
            log.debug("Instance {} deregistered during probe", instance.id());
            return;
        }

        metrics.addMetric(new MetricPoint(now, instance.agentType(), MetricNames.HEALTH_CHECK,
                status.isHealthy() ? 1 : 0, Map.of("status", status.wireName(), "instance", instance.id())));
        metrics.addMetric(new MetricPoint(now, instance.agentType(), MetricNames.RESPONSE_TIME_HEALTH,
                responseTimeMs, Map.of("instance", instance.id())));

        log.debug("Probe {} ok: status={}, load={}, {}ms", instance.id(), status.wireName(),
                snapshot.currentLoad(), responseTimeMs);
        events.publish(LifecycleEvent.of(EventType.HEALTH_CHECK_COMPLETED, now,
                Map.of("instanceId", instance.id(), "agentType", instance.agentType(),
                        "status", status.wireName())));
    }

    private void onFailure(AgentInstance instance, String reason, Instant started) {
        Instant now = clock.instant();
        if (registry.applyHealth(instance.id(), HealthSnapshot.probeFailed(reason, now)).isEmpty()) {
            return;
        }

        metrics.addMetric(new MetricPoint(now, instance.agentType(), MetricNames.HEALTH_CHECK, 0,
                Map.of("status", HealthStatus.ERROR.wireName(), "instance", instance.id())));

        log.warn("Probe {} failed after {}ms: {}", instance.id(),
                Duration.between(started, now).toMillis(), reason);
        events.publish(LifecycleEvent.of(EventType.HEALTH_CHECK_FAILED, now,
                Map.of("instanceId", instance.id(), "agentType", instance.agentType(), "error", reason)));
    }

    private String describe(Throwable error) {
        if (error == null) {
            return "empty health response";
        }
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof TimeoutException) {
            return "timed out after " + timeout.toMillis() + "ms";
        }
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }

    private static HealthNote toNote(HealthReport.ReportedAlert alert, Instant fallback) {
        Severity level;
        try {
            level = Severity.fromWire(alert.level());
        } catch (IllegalArgumentException e) {
            level = Severity.INFO;
        }
        Instant at = fallback;
        if (alert.timestamp() != null) {
            try {
                at = Instant.parse(alert.timestamp());
            } catch (DateTimeParseException e) {
                log.debug("Unparseable alert timestamp '{}', using probe time", alert.timestamp());
            }
        }
        return new HealthNote(level, alert.message(), at);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
