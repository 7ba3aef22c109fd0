package agentpool.dispatcher.alert;

import agentpool.dispatcher.MutableClock;
import agentpool.dispatcher.TestInstances;
import agentpool.dispatcher.config.DispatcherConfig;
import agentpool.dispatcher.core.EventBus;
import agentpool.dispatcher.core.EventType;
import agentpool.dispatcher.core.LifecycleEvent;
import agentpool.dispatcher.metrics.MetricNames;
import agentpool.dispatcher.metrics.MetricsStore;
import agentpool.dispatcher.model.Alert;
import agentpool.dispatcher.model.AlertCondition;
import agentpool.dispatcher.model.AlertRule;
import agentpool.dispatcher.model.HealthStatus;
import agentpool.dispatcher.model.MetricPoint;
import agentpool.dispatcher.model.Severity;
import agentpool.dispatcher.registry.InstanceRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class AlertEngineTest {

    private MutableClock clock;
    private InstanceRegistry registry;
    private MetricsStore metrics;
    private EventBus events;
    private List<LifecycleEvent> received;
    private RecordingChannel recording;

    /** Keeps every alert it is asked to deliver */
    static class RecordingChannel implements AlertChannel {
        final List<Alert> delivered = new CopyOnWriteArrayList<>();

        @Override
        public String name() {
            return "recording";
        }

        @Override
        public void send(Alert alert) {
            delivered.add(alert);
        }
    }

    /** Fails every delivery */
    static class BrokenChannel implements AlertChannel {
        int attempts;

        @Override
        public String name() {
            return "broken";
        }

        @Override
        public void send(Alert alert) throws IOException {
            attempts++;
            throw new IOException("connection refused");
        }
    }

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T10:00:00Z");
        registry = new InstanceRegistry(5, Duration.ofSeconds(60), clock);
        metrics = new MetricsStore();
        events = new EventBus();
        received = new ArrayList<>();
        events.subscribe(received::add);
        recording = new RecordingChannel();
    }

    private AlertEngine engine(List<AlertChannel> channels, boolean deliveryEnabled) {
        AlertEngine engine = new AlertEngine(registry, metrics, channels, deliveryEnabled, events, clock);
        for (AlertRule rule : AlertRules.defaults(DispatcherConfig.defaults())) {
            engine.addAlertRule(rule);
        }
        return engine;
    }

    private AlertEngine engine() {
        return engine(List.of(recording), true);
    }

    private void record(String metric, double value) {
        metrics.addMetric(MetricPoint.of(clock.instant().minusSeconds(30), "nina", metric, value));
    }

    private void healthyTraffic(int successes) {
        for (int i = 0; i < successes; i++) {
            record(MetricNames.SUCCESS, 1);
        }
    }

    @Test
    void quietSystemWithTrafficRaisesNothing() {
        AlertEngine engine = engine();
        healthyTraffic(5);
        record(MetricNames.RESPONSE_TIME, 800);

        assertTrue(engine.evaluate().isEmpty());
        assertTrue(recording.delivered.isEmpty());
    }

    @Test
    void highResponseTimeRaisesWarning() {
        AlertEngine engine = engine();
        healthyTraffic(3);
        record(MetricNames.RESPONSE_TIME, 12_000);
        record(MetricNames.RESPONSE_TIME, 9_000);

        List<Alert> created = engine.evaluate();

        assertEquals(1, created.size());
        Alert alert = created.get(0);
        assertEquals(AlertRules.HIGH_RESPONSE_TIME, alert.ruleId());
        assertEquals(Severity.WARNING, alert.severity());
        assertEquals(10_500.0, (Double) alert.metadata().get("observed"), 1e-9);
        assertEquals(10_000.0, (Double) alert.metadata().get("threshold"), 1e-9);
        assertEquals(List.of(alert), recording.delivered);
    }

    @Test
    void pointsOutsideLookbackAreIgnored() {
        AlertEngine engine = engine();
        metrics.addMetric(MetricPoint.of(clock.instant().minus(Duration.ofMinutes(6)), "nina",
                MetricNames.RESPONSE_TIME, 50_000));
        healthyTraffic(2);

        assertTrue(engine.evaluate().isEmpty());
    }

    @Test
    @DisplayName("No executions in the window counts as full error rate")
    void noTrafficRaisesErrorRateAlert() {
        AlertEngine engine = engine();

        List<Alert> created = engine.evaluate();

        assertEquals(1, created.size());
        assertEquals(AlertRules.HIGH_ERROR_RATE, created.get(0).ruleId());
        assertEquals(Severity.ERROR, created.get(0).severity());
    }

    @Test
    void unhealthyInstanceRaisesCriticalAlert() {
        AlertEngine engine = engine();
        healthyTraffic(1);
        registry.register(TestInstances.online("ok", "nina", 0, 2, clock.instant()));
        registry.register(TestInstances.withStatus("bad", "nina", HealthStatus.ERROR, 0, 2, clock.instant()));

        List<Alert> created = engine.evaluate();

        assertEquals(1, created.size());
        Alert alert = created.get(0);
        assertEquals(AlertRules.AGENT_UNHEALTHY, alert.ruleId());
        assertEquals(Severity.CRITICAL, alert.severity());
        assertEquals("bad", alert.metadata().get("instances"));
    }

    @Test
    void suppressesDuplicateWithinCooldown() {
        AlertEngine engine = engine();
        healthyTraffic(1);
        record(MetricNames.RESPONSE_TIME, 20_000);

        assertEquals(1, engine.evaluate().size());
        clock.advance(Duration.ofMinutes(1));
        assertTrue(engine.evaluate().isEmpty());

        clock.advance(Duration.ofMinutes(5));
        healthyTraffic(1);
        record(MetricNames.RESPONSE_TIME, 20_000);
        assertEquals(1, engine.evaluate().size());
        assertEquals(2, engine.getAlerts().size());
    }

    @Test
    void acknowledgedAlertStillSuppressesDuplicates() {
        AlertEngine engine = engine();
        healthyTraffic(1);
        record(MetricNames.RESPONSE_TIME, 20_000);
        Alert first = engine.evaluate().get(0);

        assertTrue(engine.acknowledgeAlert(first.id()));

        assertTrue(engine.evaluate().isEmpty());
        assertTrue(engine.getActiveAlerts().isEmpty());
    }

    @Test
    void resolvedAlertDoesNotSuppress() {
        AlertEngine engine = engine();
        healthyTraffic(1);
        record(MetricNames.RESPONSE_TIME, 20_000);
        Alert first = engine.evaluate().get(0);

        assertTrue(engine.resolveAlert(first.id()));

        assertEquals(1, engine.evaluate().size());
    }

    @Test
    void failingChannelDoesNotBlockOthers() {
        BrokenChannel broken = new BrokenChannel();
        AlertEngine engine = engine(List.of(broken, recording), true);

        List<Alert> created = engine.evaluate();

        assertEquals(1, created.size());
        assertEquals(1, broken.attempts);
        assertEquals(created, recording.delivered);
    }

    @Test
    void disabledDeliveryStillStoresAlerts() {
        AlertEngine engine = engine(List.of(recording), false);

        assertEquals(1, engine.evaluate().size());
        assertTrue(recording.delivered.isEmpty());
        assertEquals(1, engine.getActiveAlerts().size());
    }

    @Test
    void disabledRuleIsSkipped() {
        AlertEngine engine = engine();
        engine.addAlertRule(engine.rules().stream()
                .filter(r -> r.id().equals(AlertRules.HIGH_ERROR_RATE))
                .findFirst().orElseThrow()
                .withEnabled(false));

        assertTrue(engine.evaluate().isEmpty());
        assertEquals(3, engine.rules().size());
    }

    @Test
    void lowSuccessRateAndQueueLengthRules() {
        AlertEngine engine = engine();
        engine.addAlertRule(new AlertRule("low-success", "Low success", AlertCondition.LOW_SUCCESS_RATE, 0.9,
                Severity.WARNING, true, Duration.ofMinutes(5)));
        engine.addAlertRule(new AlertRule("queue", "Queue backlog", AlertCondition.HIGH_QUEUE_LENGTH, 50,
                Severity.INFO, true, Duration.ofMinutes(5)));
        healthyTraffic(19);
        record(MetricNames.SUCCESS, 0);
        record(MetricNames.QUEUE_LENGTH, 80);
        record(MetricNames.QUEUE_LENGTH, 40);

        List<String> fired = engine.evaluate().stream().map(Alert::ruleId).toList();

        // success rate 0.95 is fine, average queue 60 is not
        assertEquals(List.of("queue"), fired);
    }

    @Test
    void activeAlertsAreOrderedBySeverity() {
        AlertEngine engine = engine();
        registry.register(TestInstances.withStatus("bad", "nina", HealthStatus.OFFLINE, 0, 2, clock.instant()));
        record(MetricNames.RESPONSE_TIME, 20_000);

        engine.evaluate();

        List<Severity> order = engine.getActiveAlerts().stream().map(Alert::severity).toList();
        assertEquals(List.of(Severity.CRITICAL, Severity.ERROR, Severity.WARNING), order);
    }

    @Test
    void acknowledgeAndResolveAreIndependent() {
        AlertEngine engine = engine();
        Alert alert = engine.evaluate().get(0);

        assertTrue(engine.acknowledgeAlert(alert.id()));
        Alert acknowledged = engine.findAlert(alert.id()).orElseThrow();
        assertTrue(acknowledged.acknowledged());
        assertFalse(acknowledged.isResolved());

        clock.advance(Duration.ofMinutes(2));
        assertTrue(engine.resolveAlert(alert.id()));
        Alert resolved = engine.findAlert(alert.id()).orElseThrow();
        assertTrue(resolved.acknowledged());
        assertEquals(clock.instant(), resolved.resolvedAt());

        assertFalse(engine.acknowledgeAlert("missing"));
        assertFalse(engine.resolveAlert("missing"));
    }

    @Test
    void cleanupPurgesOnlyOldResolvedAlerts() {
        AlertEngine engine = engine();
        Alert old = engine.evaluate().get(0);
        engine.resolveAlert(old.id());

        clock.advance(Duration.ofHours(1));
        engine.addAlertRule(new AlertRule("queue", "Queue backlog", AlertCondition.HIGH_QUEUE_LENGTH, 1,
                Severity.INFO, true, Duration.ZERO));
        record(MetricNames.QUEUE_LENGTH, 5);
        record(MetricNames.SUCCESS, 1);
        Alert open = engine.evaluate().get(0);

        int removed = engine.cleanup(clock.instant().minus(Duration.ofMinutes(30)));

        assertEquals(1, removed);
        assertTrue(engine.findAlert(old.id()).isEmpty());
        assertTrue(engine.findAlert(open.id()).isPresent());
    }

    @Test
    void publishesAlertLifecycleEvents() {
        AlertEngine engine = engine();
        received.clear();

        Alert alert = engine.evaluate().get(0);
        engine.acknowledgeAlert(alert.id());
        engine.resolveAlert(alert.id());

        List<EventType> types = received.stream().map(LifecycleEvent::type).toList();
        assertEquals(List.of(EventType.ALERT_CREATED, EventType.ALERT_ACKNOWLEDGED, EventType.ALERT_RESOLVED),
                types);
        assertEquals(alert.id(), received.get(0).attribute("alertId"));
    }
}
