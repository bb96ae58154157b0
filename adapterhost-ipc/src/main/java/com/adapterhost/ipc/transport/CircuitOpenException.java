package com.adapterhost.ipc.transport;

import java.time.Duration;

/** The circuit breaker rejected the call without contacting the host. */
public final class CircuitOpenException extends TransportException {

    private final Duration retryAfter;

    public CircuitOpenException(Duration retryAfter) {
        super("Circuit open; host unavailable, retry after " + retryAfter.toMillis() + "ms");
        this.retryAfter = retryAfter;
    }

    /** Time until the breaker lets a trial call through; zero while a trial is in flight. */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
