package com.adapterhost.ipc.transport;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CircuitBreakerTest {

    private final AtomicLong now = new AtomicLong(1_000);
    private final List<CircuitState> transitions = new ArrayList<>();
    private final CircuitBreaker breaker = new CircuitBreaker(3, Duration.ofSeconds(30), now::get, transitions::add);

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            breaker.acquirePermission();
            breaker.recordFailure();
        }
    }

    @Test
    void opensAfterThresholdConsecutiveFailures() {
        fail(2);
        assertEquals(CircuitState.CLOSED, breaker.getState());

        fail(1);

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertEquals(List.of(CircuitState.OPEN), transitions);
    }

    @Test
    void successResetsFailureCount() {
        fail(2);
        breaker.recordSuccess();
        fail(2);

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(2, breaker.getConsecutiveFailures());
    }

    @Test
    void openCircuitRejectsUntilCooldownElapses() {
        fail(3);
        now.addAndGet(10_000);

        CircuitOpenException e = assertThrows(CircuitOpenException.class, breaker::acquirePermission);
        assertEquals(Duration.ofSeconds(20), e.getRetryAfter());
    }

    @Test
    void halfOpenAllowsSingleTrial() {
        fail(3);
        now.addAndGet(30_000);

        assertDoesNotThrow(breaker::acquirePermission);
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertThrows(CircuitOpenException.class, breaker::acquirePermission);
    }

    @Test
    void trialSuccessClosesCircuit() {
        fail(3);
        now.addAndGet(30_000);
        breaker.acquirePermission();

        breaker.recordSuccess();

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(List.of(CircuitState.OPEN, CircuitState.HALF_OPEN, CircuitState.CLOSED), transitions);
        assertDoesNotThrow(breaker::acquirePermission);
    }

    @Test
    void trialFailureReopensWithFreshCooldown() {
        fail(3);
        now.addAndGet(30_000);
        breaker.acquirePermission();

        breaker.recordFailure();

        assertEquals(CircuitState.OPEN, breaker.getState());
        now.addAndGet(29_000);
        assertThrows(CircuitOpenException.class, breaker::acquirePermission);
        now.addAndGet(1_000);
        assertDoesNotThrow(breaker::acquirePermission);
    }

    @Test
    void constructor_rejectsNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreaker(0, Duration.ofSeconds(1)));
    }
}
