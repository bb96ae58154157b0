package com.adapterhost.ipc.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for adapter RPC. Tags are adapter token, method and outcome; both are
 * bounded by the configured adapter set, so cardinality stays small.
 */
public final class IpcMetrics {

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_ERROR = "error";
    public static final String OUTCOME_TIMEOUT = "timeout";
    public static final String OUTCOME_TRANSPORT_ERROR = "transport_error";
    public static final String OUTCOME_CIRCUIT_OPEN = "circuit_open";

    private final MeterRegistry registry;

    public IpcMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** Metrics kept in a private in-memory registry. */
    public static IpcMetrics simple() {
        return new IpcMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public void clientCall(String adapter, String method, String outcome, long durationNanos) {
        registry.counter("adapterhost.ipc.client.calls",
                "adapter", adapter,
                "method", method,
                "outcome", outcome
        ).increment();
        if (durationNanos >= 0) {
            Timer.builder("adapterhost.ipc.client.duration")
                    .tag("adapter", adapter)
                    .tag("method", method)
                    .register(registry)
                    .record(durationNanos, TimeUnit.NANOSECONDS);
        }
    }

    public void orphanedResponse() {
        registry.counter("adapterhost.ipc.client.orphaned_responses").increment();
    }

    public void circuitTransition(String state) {
        registry.counter("adapterhost.ipc.client.circuit_transitions", "state", state).increment();
    }

    public void serverCall(String adapter, String method, String outcome, long durationNanos) {
        registry.counter("adapterhost.ipc.server.calls",
                "adapter", adapter,
                "method", method,
                "outcome", outcome
        ).increment();
        Timer.builder("adapterhost.ipc.server.duration")
                .tag("adapter", adapter)
                .tag("method", method)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void malformedFrame() {
        registry.counter("adapterhost.ipc.server.malformed_frames").increment();
    }

    /** Sum over every counter named {@code name} carrying {@code tags}. */
    public double count(String name, String... tags) {
        double total = 0d;
        for (Counter counter : registry.find(name).tags(tags).counters()) {
            total += counter.count();
        }
        return total;
    }
}
