package com.adapterhost.ipc.transport;

import com.adapterhost.codec.WireCodec;
import com.adapterhost.ipc.bulk.BulkTransfer;
import com.adapterhost.ipc.dispatch.AdapterDispatcher;
import com.adapterhost.ipc.dispatch.AdapterEndpoint;
import com.adapterhost.ipc.dispatch.MapCache;
import com.adapterhost.ipc.dispatch.StandardEndpoints;
import com.adapterhost.ipc.metrics.IpcMetrics;
import com.adapterhost.ipc.protocol.AdapterResponse;
import com.adapterhost.ipc.server.AdapterRpcServer;
import com.adapterhost.ipc.server.RpcServerOptions;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UnixSocketTransportTest {

    private final WireCodec codec = new WireCodec();
    private final MapCache cache = new MapCache();
    private final CountDownLatch release = new CountDownLatch(1);
    private final IpcMetrics metrics = IpcMetrics.simple();

    @TempDir
    Path dir;

    private Path socketPath;
    private AdapterRpcServer server;
    private UnixSocketTransport transport;

    @BeforeEach
    void setUp() throws IOException {
        socketPath = dir.resolve("host.sock");
        server = newServer();
        server.start();
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        if (transport != null) transport.close();
        server.close();
    }

    private AdapterRpcServer newServer() {
        AdapterDispatcher dispatcher = AdapterDispatcher.builder(codec, new BulkTransfer(dir, 1024, codec.mapper()))
                .expose("cache", StandardEndpoints.cache(cache))
                .expose("slow", AdapterEndpoint.builder()
                        .method("wait", a -> release.await(5, TimeUnit.SECONDS))
                        .build())
                .build();
        return new AdapterRpcServer(dispatcher, codec, RpcServerOptions.of(socketPath), null, IpcMetrics.simple());
    }

    private UnixSocketTransport transport(TransportOptions.Builder builder) {
        transport = new UnixSocketTransport(builder.metrics(metrics).bulkDirectory(dir).build());
        return transport;
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) throw new AssertionError("condition not met within 5s");
            Thread.sleep(10);
        }
    }

    private static Throwable failureOf(java.util.concurrent.CompletableFuture<?> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return e.getCause();
    }

    @Test
    void send_roundTripsThroughServer() throws Exception {
        UnixSocketTransport t = transport(TransportOptions.builder(socketPath));

        t.send("cache", "set", List.of(TextNode.valueOf("k"), TextNode.valueOf("v"))).get(5, TimeUnit.SECONDS);
        AdapterResponse response = t.send("cache", "get", List.of(TextNode.valueOf("k"))).get(5, TimeUnit.SECONDS);

        assertFalse(response.hasError());
        assertEquals("v", response.result().asText());
        assertTrue(t.pendingRequestIds().isEmpty());
        assertEquals(2.0, metrics.count("adapterhost.ipc.client.calls", "outcome", "success"));
    }

    @Test
    void send_adapterErrorIsResponseNotFailure() throws Exception {
        UnixSocketTransport t = transport(TransportOptions.builder(socketPath).failureThreshold(1));

        AdapterResponse response = t.send("cache", "nope", List.of()).get(5, TimeUnit.SECONDS);

        assertTrue(response.hasError());
        assertEquals("METHOD_NOT_FOUND", response.error().get("code").asText());
        assertEquals(CircuitState.CLOSED, t.getCircuitState());
    }

    @Test
    void send_timeoutFailsCallAndForgetsIt() throws Exception {
        UnixSocketTransport t = transport(TransportOptions.builder(socketPath));

        Throwable failure = failureOf(t.send("slow", "wait", List.of(), CallOptions.timeout(Duration.ofMillis(200))));

        assertInstanceOf(CallTimeoutException.class, failure);
        assertTrue(t.pendingRequestIds().isEmpty());

        release.countDown();
        await(() -> metrics.count("adapterhost.ipc.client.orphaned_responses") == 1.0);
    }

    @Test
    void send_transportWideTimeoutOverridesTable() throws Exception {
        UnixSocketTransport t = transport(TransportOptions.builder(socketPath).callTimeout(Duration.ofMillis(150)));

        Throwable failure = failureOf(t.send("slow", "wait", List.of()));

        CallTimeoutException timeout = assertInstanceOf(CallTimeoutException.class, failure);
        assertEquals(Duration.ofMillis(150), timeout.getTimeout());
    }

    @Test
    void send_connectFailuresOpenCircuit() throws Exception {
        server.close();
        UnixSocketTransport t = transport(TransportOptions.builder(socketPath).failureThreshold(2));

        assertInstanceOf(TransportException.class, failureOf(t.send("cache", "get", List.of(TextNode.valueOf("k")))));
        assertInstanceOf(TransportException.class, failureOf(t.send("cache", "get", List.of(TextNode.valueOf("k")))));
        Throwable rejected = failureOf(t.send("cache", "get", List.of(TextNode.valueOf("k"))));

        assertInstanceOf(CircuitOpenException.class, rejected);
        assertEquals(CircuitState.OPEN, t.getCircuitState());
        assertTrue(Retryability.isRetryable(rejected));
    }

    @Test
    void send_halfOpenTrialClosesCircuitWhenHostReturns() throws Exception {
        server.close();
        long[] now = {0};
        UnixSocketTransport t = transport(TransportOptions.builder(socketPath)
                .failureThreshold(1)
                .cooldown(Duration.ofSeconds(30))
                .clock(() -> now[0]));
        failureOf(t.send("cache", "get", List.of(TextNode.valueOf("k"))));
        assertEquals(CircuitState.OPEN, t.getCircuitState());

        server = newServer();
        server.start();
        now[0] = 30_000;
        AdapterResponse response = t.send("cache", "get", List.of(TextNode.valueOf("k"))).get(5, TimeUnit.SECONDS);

        assertFalse(response.hasError());
        assertEquals(CircuitState.CLOSED, t.getCircuitState());
    }

    @Test
    void send_reconnectsAfterServerRestart() throws Exception {
        UnixSocketTransport t = transport(TransportOptions.builder(socketPath));
        t.send("cache", "set", List.of(TextNode.valueOf("k"), TextNode.valueOf("v"))).get(5, TimeUnit.SECONDS);

        server.close();
        await(() -> !t.isConnected());
        server = newServer();
        server.start();
        AdapterResponse response = t.send("cache", "get", List.of(TextNode.valueOf("k"))).get(5, TimeUnit.SECONDS);

        assertEquals("v", response.result().asText());
    }

    @Test
    void serverShutdown_failsOutstandingCalls() throws Exception {
        UnixSocketTransport t = transport(TransportOptions.builder(socketPath));
        java.util.concurrent.CompletableFuture<AdapterResponse> pending = t.send("slow", "wait", List.of());
        await(() -> t.pendingRequestIds().size() == 1);

        server.close();

        TransportException failure = assertInstanceOf(TransportException.class, failureOf(pending));
        assertEquals("Connection closed", failure.getMessage());
        assertTrue(t.pendingRequestIds().isEmpty());
    }

    @Test
    void serverShutdown_countsOneBreakerFailureForAllDroppedCalls() throws Exception {
        UnixSocketTransport t = transport(TransportOptions.builder(socketPath).failureThreshold(2));
        List<java.util.concurrent.CompletableFuture<AdapterResponse>> calls = List.of(
                t.send("slow", "wait", List.of()),
                t.send("slow", "wait", List.of()),
                t.send("slow", "wait", List.of()));
        await(() -> t.pendingRequestIds().size() == 3);

        server.close();

        for (java.util.concurrent.CompletableFuture<AdapterResponse> call : calls) {
            assertEquals("Connection closed", failureOf(call).getMessage());
        }
        assertEquals(CircuitState.CLOSED, t.getCircuitState());
    }

    @Test
    void send_failsCleanlyWhenTimerAlreadyShutDown() throws Exception {
        ScheduledThreadPoolExecutor stopped = new ScheduledThreadPoolExecutor(1);
        stopped.shutdownNow();
        transport = new UnixSocketTransport(TransportOptions.builder(socketPath)
                .metrics(metrics).bulkDirectory(dir).bulkThresholdBytes(1024).build(), stopped);
        StringBuilder big = new StringBuilder();
        for (int i = 0; i < 5000; i++) big.append('z');

        Throwable failure = failureOf(transport.send("cache", "set",
                List.of(TextNode.valueOf("big"), TextNode.valueOf(big.toString()))));

        TransportException closed = assertInstanceOf(TransportException.class, failure);
        assertEquals("Transport closed", closed.getMessage());
        assertTrue(transport.pendingRequestIds().isEmpty());
        assertEquals(CircuitState.CLOSED, transport.getCircuitState());
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(0, files.filter(p -> p.getFileName().toString().startsWith("adapterhost-bulk-")).count());
        }
    }

    @Test
    void close_failsPendingCallsAndRejectsNewOnes() throws Exception {
        UnixSocketTransport t = transport(TransportOptions.builder(socketPath));
        java.util.concurrent.CompletableFuture<AdapterResponse> pending = t.send("slow", "wait", List.of());
        await(() -> t.pendingRequestIds().size() == 1);

        t.close();
        t.close();

        assertEquals("Transport closed", failureOf(pending).getMessage());
        assertTrue(t.isClosed());
        assertEquals("Transport closed", failureOf(t.send("cache", "get", List.of())).getMessage());
        assertEquals(CircuitState.CLOSED, t.getCircuitState());
    }

    @Test
    void send_largeArgumentAndResultTravelThroughBulkFiles() throws Exception {
        UnixSocketTransport t = transport(TransportOptions.builder(socketPath).bulkThresholdBytes(1024));
        StringBuilder big = new StringBuilder();
        for (int i = 0; i < 5000; i++) big.append('z');

        t.send("cache", "set", List.of(TextNode.valueOf("big"), TextNode.valueOf(big.toString()))).get(5, TimeUnit.SECONDS);
        AdapterResponse response = t.send("cache", "get", List.of(TextNode.valueOf("big"))).get(5, TimeUnit.SECONDS);

        assertEquals(big.toString(), cache.get("big"));
        JsonNode result = response.result();
        assertFalse(BulkTransfer.isReference(result));
        assertEquals(big.toString(), result.asText());
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(0, files.filter(p -> p.getFileName().toString().startsWith("adapterhost-bulk-")).count());
        }
    }
}
