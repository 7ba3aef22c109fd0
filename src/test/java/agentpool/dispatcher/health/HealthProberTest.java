package agentpool.dispatcher.health;

import agentpool.dispatcher.MutableClock;
import agentpool.dispatcher.core.EventBus;
import agentpool.dispatcher.core.EventType;
import agentpool.dispatcher.core.LifecycleEvent;
import agentpool.dispatcher.metrics.MetricNames;
import agentpool.dispatcher.metrics.MetricsStore;
import agentpool.dispatcher.model.AgentInstance;
import agentpool.dispatcher.model.HealthStatus;
import agentpool.dispatcher.model.Severity;
import agentpool.dispatcher.model.TimeRange;
import agentpool.dispatcher.registry.InstanceRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HealthProberTest {

    private MutableClock clock;
    private InstanceRegistry registry;
    private MetricsStore metrics;
    private EventBus events;
    private List<LifecycleEvent> published;
    private Map<String, ScriptedAnswer> answers;
    private HealthProber prober;

    /** What the stub probe does for one instance */
    private interface ScriptedAnswer {
        HealthReport answer() throws Exception;
    }

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T10:00:00Z");
        registry = new InstanceRegistry(5, Duration.ofSeconds(60), clock);
        metrics = new MetricsStore();
        events = new EventBus();
        published = new CopyOnWriteArrayList<>();
        events.subscribe(published::add);
        answers = new ConcurrentHashMap<>();

        HealthProbe probe = instance -> answers.get(instance.id()).answer();
        prober = new HealthProber(registry, probe, metrics, events, clock, Duration.ofMillis(300));
    }

    @AfterEach
    void tearDown() {
        prober.close();
    }

    private void register(String id, int capacity) {
        registry.register(AgentInstance.builder()
                .id(id).agentType("nina").endpoint("http://" + id + ".local").capacity(capacity).build());
    }

    @Test
    @DisplayName("Successful probe stores status, load and notes")
    void successfulProbe() {
        register("nina-1", 10);
        answers.put("nina-1", () -> new HealthReport("online", 0.02, 3, 40,
                List.of(new HealthReport.ReportedAlert("warning", "disk 80%", "2024-05-01T09:59:00Z"))));

        ProbeRound round = prober.probeAll();

        assertEquals(new ProbeRound(1, 1, 0), round);
        AgentInstance stored = registry.find("nina-1").orElseThrow();
        assertEquals(HealthStatus.ONLINE, stored.status());
        assertEquals(3, stored.currentLoad());
        assertEquals(0.02, stored.health().errorRate24h(), 1e-9);
        assertEquals(40, stored.health().availableCapacity());
        assertEquals(Severity.WARNING, stored.health().notes().get(0).level());
        assertEquals(clock.instant(), stored.lastHealthCheck());
    }

    @Test
    void reportedLoadIsClampedToCapacity() {
        register("nina-1", 4);
        answers.put("nina-1", () -> new HealthReport("busy", null, 12, null, null));

        prober.probeAll();

        AgentInstance stored = registry.find("nina-1").orElseThrow();
        assertEquals(4, stored.currentLoad());
        assertEquals(HealthStatus.BUSY, stored.status());
    }

    @Test
    @DisplayName("Failing probe marks the instance ERROR with a critical note")
    void failingProbe() {
        register("nina-1", 5);
        answers.put("nina-1", () -> {
            throw new IOException("connection refused");
        });

        ProbeRound round = prober.probeAll();

        assertEquals(new ProbeRound(1, 0, 1), round);
        AgentInstance stored = registry.find("nina-1").orElseThrow();
        assertEquals(HealthStatus.ERROR, stored.status());
        assertEquals(1.0, stored.health().errorRate24h(), 1e-9);
        assertEquals(Severity.CRITICAL, stored.health().notes().get(0).level());
        assertTrue(stored.health().notes().get(0).message().contains("connection refused"));
    }

    @Test
    @DisplayName("A hung probe times out without holding back the others")
    void slowProbeTimesOut() {
        register("nina-1", 5);
        register("nina-2", 5);
        answers.put("nina-1", () -> {
            Thread.sleep(5_000);
            return HealthReport.online(0);
        });
        answers.put("nina-2", () -> HealthReport.online(1));

        long started = System.nanoTime();
        ProbeRound round = prober.probeAll();
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        assertEquals(new ProbeRound(2, 1, 1), round);
        assertTrue(elapsedMs < 3_000, "round took " + elapsedMs + "ms");
        assertEquals(HealthStatus.ERROR, registry.find("nina-1").orElseThrow().status());
        assertTrue(registry.find("nina-1").orElseThrow().health().notes().get(0).message().contains("timed out"));
        assertEquals(HealthStatus.ONLINE, registry.find("nina-2").orElseThrow().status());
    }

    @Test
    @DisplayName("A timed-out probe thread is interrupted instead of left blocked")
    void timedOutProbeIsInterrupted() throws Exception {
        register("nina-1", 5);
        CountDownLatch interrupted = new CountDownLatch(1);
        answers.put("nina-1", () -> {
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return HealthReport.online(0);
        });

        ProbeRound round = prober.probeAll();

        assertEquals(new ProbeRound(1, 0, 1), round);
        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
    }

    @Test
    void probeDoesNotTouchCircuitBreaker() {
        register("nina-1", 5);
        answers.put("nina-1", () -> {
            throw new IOException("down");
        });

        for (int i = 0; i < 10; i++) {
            prober.probeAll();
        }

        assertEquals(0, registry.breaker("nina-1").orElseThrow().failureCount());
    }

    @Test
    void recordsMetricsAndEvents() {
        register("nina-1", 5);
        register("nina-2", 5);
        answers.put("nina-1", () -> HealthReport.online(0));
        answers.put("nina-2", () -> {
            throw new IOException("down");
        });

        prober.probeAll();

        TimeRange range = new TimeRange(clock.instant().minusSeconds(1), clock.instant().plusSeconds(1));
        assertEquals(2, metrics.query("nina", MetricNames.HEALTH_CHECK, range).size());
        assertEquals(1, metrics.query("nina", MetricNames.RESPONSE_TIME_HEALTH, range).size());
        assertEquals(1, published.stream().filter(e -> e.type() == EventType.HEALTH_CHECK_COMPLETED).count());
        assertEquals(1, published.stream().filter(e -> e.type() == EventType.HEALTH_CHECK_FAILED).count());
    }

    @Test
    void emptyRegistryIsNoop() {
        assertEquals(ProbeRound.empty(), prober.probeAll());
        assertTrue(published.isEmpty());
    }
}
