package com.adapterhost.ipc.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Consecutive-failure circuit breaker. Only transport failures count; a call that reached the adapter
 * is a success here even when the adapter returned an error.
 * <p>
 * CLOSED → OPEN after {@code failureThreshold} consecutive failures; OPEN → HALF_OPEN when the cooldown
 * has elapsed and a call asks for permission; HALF_OPEN lets that single call through and closes on its
 * success or reopens on its failure.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final int failureThreshold;
    private final long cooldownMillis;
    private final LongSupplier clock;
    private final Consumer<CircuitState> transitionListener;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private long openedAt;
    private boolean trialInFlight;

    public CircuitBreaker(int failureThreshold, Duration cooldown) {
        this(failureThreshold, cooldown, System::currentTimeMillis, s -> { });
    }

    /**
     * @param clock              millisecond time source
     * @param transitionListener called with the new state on every transition, under the breaker's lock
     */
    public CircuitBreaker(int failureThreshold, Duration cooldown, LongSupplier clock, Consumer<CircuitState> transitionListener) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
        this.failureThreshold = failureThreshold;
        this.cooldownMillis = cooldown.toMillis();
        this.clock = clock;
        this.transitionListener = transitionListener;
    }

    /**
     * @throws CircuitOpenException when the circuit is open and cooling down, or half-open with the
     *                              trial call already in flight
     */
    public synchronized void acquirePermission() {
        switch (state) {
            case CLOSED:
                return;
            case OPEN:
                long waited = clock.getAsLong() - openedAt;
                if (waited < cooldownMillis) {
                    throw new CircuitOpenException(Duration.ofMillis(cooldownMillis - waited));
                }
                transition(CircuitState.HALF_OPEN);
                trialInFlight = true;
                return;
            case HALF_OPEN:
                if (trialInFlight) {
                    throw new CircuitOpenException(Duration.ZERO);
                }
                trialInFlight = true;
                return;
            default:
                throw new IllegalStateException("Unknown state " + state);
        }
    }

    public synchronized void recordSuccess() {
        consecutiveFailures = 0;
        trialInFlight = false;
        if (state != CircuitState.CLOSED) {
            transition(CircuitState.CLOSED);
        }
    }

    public synchronized void recordFailure() {
        trialInFlight = false;
        if (state == CircuitState.HALF_OPEN) {
            open();
            return;
        }
        consecutiveFailures++;
        if (state == CircuitState.CLOSED && consecutiveFailures >= failureThreshold) {
            open();
        }
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    private void open() {
        openedAt = clock.getAsLong();
        transition(CircuitState.OPEN);
        log.warn("Circuit opened after {} consecutive transport failure(s); cooling down {}ms", consecutiveFailures, cooldownMillis);
    }

    private void transition(CircuitState next) {
        state = next;
        try {
            transitionListener.accept(next);
        } catch (RuntimeException e) {
            log.debug("Circuit transition listener failed", e);
        }
    }
}
