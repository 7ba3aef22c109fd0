package agentpool.dispatcher.scheduler;

import agentpool.dispatcher.alert.AlertEngine;
import agentpool.dispatcher.health.HealthProber;
import agentpool.dispatcher.health.ProbeRound;
import agentpool.dispatcher.service.MonitoringService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One monitoring pass:
 * 1. probe every registered instance (waits for the whole batch)
 * 2. collect system gauges
 * 3. evaluate alert rules
 * 4. drop data past retention
 *
 * Each phase is isolated: a failing phase is logged and the next one runs.
 * A run that starts while the previous one is still in progress is skipped.
 */
public class MonitoringTick implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MonitoringTick.class);

    private final HealthProber prober;
    private final MonitoringService monitoring;
    private final AlertEngine alertEngine;

    private final AtomicBoolean inProgress = new AtomicBoolean(false);

    public MonitoringTick(HealthProber prober, MonitoringService monitoring, AlertEngine alertEngine) {
        this.prober = prober;
        this.monitoring = monitoring;
        this.alertEngine = alertEngine;
    }

    @Override
    public void run() {
        if (!inProgress.compareAndSet(false, true)) {
            log.warn("Previous monitoring tick still running, skipping");
            return;
        }
        try {
            runPhase("probe", () -> {
                ProbeRound round = prober.probeAll();
                log.debug("Probe round: {} probed, {} healthy, {} failed",
                        round.probed(), round.healthy(), round.failed());
            });
            runPhase("collect", monitoring::collectMetrics);
            runPhase("evaluate", alertEngine::evaluate);
            runPhase("cleanup", monitoring::cleanup);
        } finally {
            inProgress.set(false);
        }
    }

    /**
     * @return true while a tick is executing
     */
    public boolean isRunning() {
        return inProgress.get();
    }

    private void runPhase(String name, Runnable phase) {
        try {
            phase.run();
        } catch (Exception e) {
            log.error("Monitoring phase {} failed", name, e);
        }
    }
}
