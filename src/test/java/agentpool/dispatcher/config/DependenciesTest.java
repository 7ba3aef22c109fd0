package agentpool.dispatcher.config;

import agentpool.dispatcher.MutableClock;
import agentpool.dispatcher.TestInstances;
import agentpool.dispatcher.health.HealthReport;
import agentpool.dispatcher.model.CircuitState;
import agentpool.dispatcher.model.HealthStatus;
import agentpool.dispatcher.strategy.StrategyType;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DependenciesTest {

    private final MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");

    @Test
    void wiresConfiguredComponents() {
        DispatcherConfig config = DispatcherConfig.defaults()
                .withServerPort(0)
                .withStrategy(StrategyType.LEAST_CONNECTIONS)
                .withCircuitBreakerThreshold(1)
                .withCircuitBreakerTimeout(Duration.ofSeconds(5))
                .withAlertsEnabled(false)
                .withMaxRetries(1);

        try (Dependencies deps = Dependencies.create(config, clock, instance -> HealthReport.online(0))) {
            assertEquals(StrategyType.LEAST_CONNECTIONS, deps.dispatcher().strategy().type());
            assertEquals(3, deps.alertEngine().rules().size());
            assertEquals(8, deps.routerHandler().controllerCount());
            assertSame(deps.routerHandler(), deps.routerHandler());

            deps.dispatcher().register(TestInstances.online("nina-1", "nina", 0, 2, clock.instant()));
            deps.dispatcher().recordFailure("nina-1");
            assertEquals(CircuitState.OPEN, deps.dispatcher().circuitState("nina-1").orElseThrow());
        }
    }

    @Test
    void schedulerDrivesMonitoringTick() throws Exception {
        DispatcherConfig config = DispatcherConfig.defaults()
                .withHealthCheckInterval(Duration.ofMillis(50))
                .withRetentionPeriod(Duration.ofHours(1))
                .withFailoverThreshold(0.5);

        try (Dependencies deps = Dependencies.create(config, clock, instance -> HealthReport.online(1))) {
            deps.dispatcher().register(TestInstances.withStatus("nina-1", "nina", HealthStatus.UNKNOWN, 0, 2,
                    clock.instant()));

            deps.startScheduler();
            assertTrue(deps.scheduler().isRunning());

            long deadline = System.currentTimeMillis() + 5_000;
            while (deps.registry().healthyCount() == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertEquals(1, deps.registry().healthyCount());

            deps.stopScheduler();
            assertFalse(deps.scheduler().isRunning());
        }
    }
}
