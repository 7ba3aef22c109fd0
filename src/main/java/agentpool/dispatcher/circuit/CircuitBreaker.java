package agentpool.dispatcher.circuit;

import agentpool.dispatcher.model.CircuitState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-instance failure gate.
 *
 * CLOSED opens after {@code threshold} consecutive failures. OPEN stays open
 * until more than {@code timeout} has passed since the last failure; the next
 * {@link #isOpen()} then moves to HALF_OPEN and lets exactly one trial through.
 * While that trial is outstanding further checks report open, unless the
 * trial itself is older than {@code timeout}, in which case another one is
 * granted. Any success closes the circuit; a failure while HALF_OPEN reopens it.
 */
public final class CircuitBreaker {

    private final int threshold;
    private final Duration timeout;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureTime;
    private Instant trialGrantedAt;

    public CircuitBreaker(int threshold, Duration timeout, Clock clock) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive");
        }
        this.threshold = threshold;
        this.timeout = timeout;
        this.clock = clock;
    }

    /**
     * Whether the instance must be excluded from selection. May transition
     * OPEN to HALF_OPEN as a side effect; a {@code false} answer hands out the trial.
     */
    public synchronized boolean isOpen() {
        Instant now = clock.instant();
        if (!admits(now)) {
            return true;
        }
        if (state != CircuitState.CLOSED) {
            state = CircuitState.HALF_OPEN;
            trialGrantedAt = now;
        }
        return false;
    }

    /**
     * Same answer {@link #isOpen()} would give right now, without moving to
     * HALF_OPEN or handing out the trial.
     */
    public synchronized boolean permitsTrial() {
        return admits(clock.instant());
    }

    private boolean admits(Instant now) {
        switch (state) {
            case OPEN:
                return Duration.between(lastFailureTime, now).compareTo(timeout) > 0;
            case HALF_OPEN:
                return trialGrantedAt == null || Duration.between(trialGrantedAt, now).compareTo(timeout) > 0;
            default:
                return true;
        }
    }

    public synchronized void recordSuccess() {
        failureCount = 0;
        state = CircuitState.CLOSED;
        trialGrantedAt = null;
    }

    public synchronized void recordFailure() {
        failureCount++;
        lastFailureTime = clock.instant();
        trialGrantedAt = null;
        if (state == CircuitState.HALF_OPEN || failureCount >= threshold) {
            state = CircuitState.OPEN;
        }
    }

    public synchronized CircuitState state() {
        return state;
    }

    public synchronized int failureCount() {
        return failureCount;
    }

    public synchronized Instant lastFailureTime() {
        return lastFailureTime;
    }

    public int threshold() {
        return threshold;
    }

    @Override
    public synchronized String toString() {
        return "CircuitBreaker{state=" + state + ", failures=" + failureCount + "/" + threshold + "}";
    }
}
