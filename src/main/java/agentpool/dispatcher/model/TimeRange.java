package agentpool.dispatcher.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Inclusive time range for metric queries.
 */
public record TimeRange(Instant from, Instant to) {

    public TimeRange {
        Objects.requireNonNull(from, "from is required");
        Objects.requireNonNull(to, "to is required");
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("range end is before range start");
        }
    }

    public static TimeRange lastOf(Duration duration, Instant now) {
        return new TimeRange(now.minus(duration), now);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(from) && !instant.isAfter(to);
    }

    public Duration length() {
        return Duration.between(from, to);
    }
}
