package agentpool.dispatcher.scheduler;

import agentpool.dispatcher.core.EventBus;
import agentpool.dispatcher.core.EventType;
import agentpool.dispatcher.core.LifecycleEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives the periodic monitoring tick.
 *
 * Uses a single-threaded executor, so ticks never run in parallel; the tick
 * itself skips a run that overlaps the previous one.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final Runnable tick;
    private final Duration interval;
    private final EventBus events;
    private final Clock clock;

    private volatile boolean running = false;

    /**
     * @param tick     monitoring pass, typically a {@link MonitoringTick}
     * @param interval delay between tick starts
     */
    public Scheduler(Runnable tick, Duration interval, EventBus events, Clock clock) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agentpool-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.tick = tick;
        this.interval = interval;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Start ticking. The first tick runs immediately.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }
        running = true;

        long intervalMs = interval.toMillis();
        executor.scheduleAtFixedRate(wrapRunnable("monitoring-tick", tick), 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Monitoring tick scheduled every {}ms", intervalMs);

        events.publish(LifecycleEvent.of(EventType.MONITORING_STARTED, clock.instant(),
                Map.of("intervalMs", intervalMs)));
    }

    /**
     * Stop the scheduler gracefully.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        events.publish(LifecycleEvent.of(EventType.MONITORING_STOPPED, clock.instant()));
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Wrap a runnable with error handling so a failure never cancels the
     * periodic schedule.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
