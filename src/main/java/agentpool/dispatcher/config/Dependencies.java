package agentpool.dispatcher.config;

import agentpool.dispatcher.alert.AlertChannels;
import agentpool.dispatcher.alert.AlertEngine;
import agentpool.dispatcher.alert.AlertRules;
import agentpool.dispatcher.api.internal.v1.OutcomeController;
import agentpool.dispatcher.api.internal.v1.PerformanceController;
import agentpool.dispatcher.api.v1.AlertController;
import agentpool.dispatcher.api.v1.DispatchController;
import agentpool.dispatcher.api.v1.HealthController;
import agentpool.dispatcher.api.v1.InstanceController;
import agentpool.dispatcher.api.v1.MetricsController;
import agentpool.dispatcher.api.v1.StatisticsController;
import agentpool.dispatcher.core.EventBus;
import agentpool.dispatcher.health.HealthProbe;
import agentpool.dispatcher.health.HealthProber;
import agentpool.dispatcher.health.HttpHealthProbe;
import agentpool.dispatcher.metrics.MetricsStore;
import agentpool.dispatcher.model.AlertRule;
import agentpool.dispatcher.registry.InstanceRegistry;
import agentpool.dispatcher.scheduler.MonitoringTick;
import agentpool.dispatcher.scheduler.Scheduler;
import agentpool.dispatcher.server.RouterHandler;
import agentpool.dispatcher.service.Dispatcher;
import agentpool.dispatcher.service.MonitoringService;
import agentpool.dispatcher.strategy.SelectionStrategies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(DispatcherConfig.fromEnv());
 * deps.startScheduler(); // start monitoring ticks
 * Dispatcher dispatcher = deps.dispatcher();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final DispatcherConfig config;
    private final Clock clock;
    private final EventBus eventBus;
    private final InstanceRegistry registry;
    private final MetricsStore metricsStore;
    private final Dispatcher dispatcher;
    private final HealthProber healthProber;
    private final AlertEngine alertEngine;
    private final MonitoringService monitoringService;
    private final MonitoringTick monitoringTick;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(DispatcherConfig config, Clock clock, HealthProbe probe) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Core
        this.eventBus = new EventBus();
        this.registry = new InstanceRegistry(config.circuitBreakerThreshold(), config.circuitBreakerTimeout(), clock);
        this.metricsStore = new MetricsStore();

        // Services
        this.dispatcher = new Dispatcher(registry, SelectionStrategies.create(config.strategy()), eventBus, clock);
        this.healthProber = new HealthProber(registry, probe, metricsStore, eventBus, clock, config.probeTimeout());
        this.alertEngine = new AlertEngine(registry, metricsStore, AlertChannels.fromConfig(config),
                config.alertsEnabled(), eventBus, clock);
        for (AlertRule rule : AlertRules.defaults(config)) {
            alertEngine.addAlertRule(rule);
        }
        this.monitoringService = new MonitoringService(registry, dispatcher, metricsStore, alertEngine, eventBus,
                clock, config.performanceSmoothing(), config.retentionPeriod());
        this.monitoringTick = new MonitoringTick(healthProber, monitoringService, alertEngine);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config, the system clock and HTTP probes.
     */
    public static Dependencies create(DispatcherConfig config) {
        return new Dependencies(config, Clock.systemUTC(), new HttpHealthProbe(config.probeTimeout()));
    }

    /**
     * Create dependencies with a custom clock and probe.
     */
    public static Dependencies create(DispatcherConfig config, Clock clock, HealthProbe probe) {
        return new Dependencies(config, clock, probe);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(DispatcherConfig.fromEnv());
    }

    // Getters
    public DispatcherConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public InstanceRegistry registry() {
        return registry;
    }

    public MetricsStore metricsStore() {
        return metricsStore;
    }

    public Dispatcher dispatcher() {
        return dispatcher;
    }

    public HealthProber healthProber() {
        return healthProber;
    }

    public AlertEngine alertEngine() {
        return alertEngine;
    }

    public MonitoringService monitoringService() {
        return monitoringService;
    }

    public MonitoringTick monitoringTick() {
        return monitoringTick;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(new HealthController(dispatcher, monitoringService,
                            config.failoverThreshold()))
                    .registerController(new InstanceController(dispatcher, clock))
                    .registerController(new DispatchController(dispatcher))
                    .registerController(new StatisticsController(dispatcher))
                    .registerController(new MetricsController(monitoringService, clock))
                    .registerController(new AlertController(monitoringService, config))
                    .registerController(new OutcomeController(monitoringService))
                    .registerController(new PerformanceController(dispatcher));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(monitoringTick, config.healthCheckInterval(), eventBus, clock);
        }
        return scheduler;
    }

    /**
     * Start the periodic monitoring tick.
     * Should be called after server startup.
     */
    public void startScheduler() {
        scheduler().start();
    }

    public void stopScheduler() {
        Scheduler current;
        synchronized (this) {
            current = scheduler;
        }
        if (current != null) {
            current.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first
        try {
            stopScheduler();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        healthProber.close();

        log.info("Dependencies closed");
    }
}
