package agentpool.dispatcher.api.v1;

import agentpool.dispatcher.MutableClock;
import agentpool.dispatcher.model.TimeRange;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class MetricsControllerTest {

    private final MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");
    private final MetricsController controller = new MetricsController(null, clock);

    @Test
    void defaultsToLastHour() {
        TimeRange range = controller.range("/api/v1/metrics/system");

        assertEquals(clock.instant(), range.to());
        assertEquals(Duration.ofHours(1), range.length());
    }

    @Test
    void explicitBounds() {
        TimeRange range = controller.range(
                "/api/v1/metrics/agents/nina?from=2024-05-01T06:00:00Z&to=2024-05-01T07:00:00Z");

        assertEquals(Instant.parse("2024-05-01T06:00:00Z"), range.from());
        assertEquals(Instant.parse("2024-05-01T07:00:00Z"), range.to());
    }

    @Test
    void onlyToGivenCountsBackOneHour() {
        TimeRange range = controller.range("/api/v1/metrics/system?to=2024-05-01T07:00:00Z");

        assertEquals(Instant.parse("2024-05-01T06:00:00Z"), range.from());
    }

    @Test
    void invertedRangeRejected() {
        assertThrows(IllegalArgumentException.class, () -> controller.range(
                "/api/v1/metrics/system?from=2024-05-01T08:00:00Z&to=2024-05-01T07:00:00Z"));
    }
}
