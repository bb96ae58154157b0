package com.adapterhost.ipc.transport;

import com.adapterhost.ipc.bulk.BulkTransfer;
import com.adapterhost.ipc.channel.EventLoop;
import com.adapterhost.ipc.channel.FramedConnection;
import com.adapterhost.ipc.metrics.IpcMetrics;
import com.adapterhost.ipc.protocol.AdapterCall;
import com.adapterhost.ipc.protocol.AdapterResponse;
import com.adapterhost.ipc.protocol.CallContext;
import com.adapterhost.ipc.protocol.EnvelopeCodec;
import com.adapterhost.ipc.protocol.FrameDecoder;
import com.adapterhost.ipc.protocol.ProtocolException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sandbox-side transport over a Unix domain socket.
 * <ul>
 *   <li>Connects lazily on the first call and again after the connection drops.</li>
 *   <li>Correlates responses to calls by request id; a response for an unknown id is dropped.</li>
 *   <li>Each call gets a timeout from {@link OperationTimeouts}; a timed-out call is forgotten.</li>
 *   <li>Transport failures feed a {@link CircuitBreaker}; while open, calls fail without I/O.</li>
 *   <li>Large arguments and results go through {@link BulkTransfer} files.</li>
 * </ul>
 */
public final class UnixSocketTransport implements AdapterTransport {

    private static final Logger log = LoggerFactory.getLogger(UnixSocketTransport.class);
    private static final long CONNECT_REGISTRATION_TIMEOUT_MS = 5_000;
    private static final AtomicInteger INSTANCES = new AtomicInteger();

    private final TransportOptions options;
    private final EnvelopeCodec envelopes;
    private final BulkTransfer bulk;
    private final CircuitBreaker breaker;
    private final IpcMetrics metrics;
    private final Map<String, PendingCall> pending = new ConcurrentHashMap<>();
    private final ScheduledThreadPoolExecutor timer;
    private final String name;
    private final Object connectLock = new Object();

    private EventLoop loop;
    private volatile FramedConnection connection;
    private volatile boolean closed;

    public UnixSocketTransport(TransportOptions options) {
        this(options, null);
    }

    UnixSocketTransport(TransportOptions options, ScheduledThreadPoolExecutor timer) {
        this.options = options;
        this.envelopes = new EnvelopeCodec(options.getCodec().mapper());
        this.bulk = new BulkTransfer(options.getBulkDirectory(), options.getBulkThresholdBytes(), options.getCodec().mapper());
        this.metrics = options.getMetrics();
        this.breaker = new CircuitBreaker(options.getFailureThreshold(), options.getCooldown(), options.getClock(),
                state -> metrics.circuitTransition(state.name().toLowerCase()));
        this.name = "adapterhost-transport-" + INSTANCES.incrementAndGet();
        this.timer = timer != null ? timer : newTimer(name);
        this.timer.setRemoveOnCancelPolicy(true);
    }

    private static ScheduledThreadPoolExecutor newTimer(String name) {
        return new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, name + "-timer");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletableFuture<AdapterResponse> send(String adapter, String method, List<JsonNode> args, CallOptions callOptions) {
        if (closed) {
            return CompletableFuture.failedFuture(new TransportException("Transport closed"));
        }
        CallOptions opts = callOptions != null ? callOptions : CallOptions.defaults();
        Duration timeout = options.getOperationTimeouts().resolve(adapter, method, opts.timeout(), options.getCallTimeout());
        CallContext context = opts.context() != null ? opts.context() : options.getDefaultContext();

        String requestId = nextRequestId();
        List<JsonNode> wireArgs;
        byte[] frame;
        try {
            wireArgs = bulk.offloadAll(args != null ? args : List.of());
            frame = envelopes.encode(AdapterCall.create(requestId, adapter, method, wireArgs, context));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        try {
            breaker.acquirePermission();
        } catch (CircuitOpenException e) {
            bulk.discard(wireArgs);
            metrics.clientCall(adapter, method, IpcMetrics.OUTCOME_CIRCUIT_OPEN, -1);
            return CompletableFuture.failedFuture(e);
        }

        FramedConnection conn;
        try {
            conn = ensureConnected();
        } catch (TransportException e) {
            bulk.discard(wireArgs);
            breaker.recordFailure();
            metrics.clientCall(adapter, method, IpcMetrics.OUTCOME_TRANSPORT_ERROR, -1);
            return CompletableFuture.failedFuture(e);
        }

        PendingCall call = new PendingCall(requestId, adapter, method, timeout, wireArgs, System.nanoTime());
        pending.put(requestId, call);
        try {
            call.timeoutTask = timer.schedule(() -> expire(call), timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // close() shut the timer down after our closed check
            fail(call, new TransportException("Transport closed", e), false);
            return call.future;
        }
        if (closed) {
            fail(call, new TransportException("Transport closed"), false);
            return call.future;
        }

        conn.send(frame).whenComplete((v, e) -> {
            if (e != null) {
                fail(call, new TransportException("Failed to write call " + adapter + "." + method + ": " + e.getMessage(), e), true);
            }
        });
        return call.future;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    public CircuitState getCircuitState() {
        return breaker.getState();
    }

    public boolean isConnected() {
        FramedConnection conn = connection;
        return conn != null && conn.isOpen();
    }

    /** Request ids still awaiting a response. */
    public Set<String> pendingRequestIds() {
        return Set.copyOf(pending.keySet());
    }

    @Override
    public void close() {
        FramedConnection conn;
        EventLoop l;
        synchronized (connectLock) {
            if (closed) return;
            closed = true;
            conn = connection;
            connection = null;
            l = loop;
            loop = null;
        }
        for (PendingCall call : new ArrayList<>(pending.values())) {
            fail(call, new TransportException("Transport closed"), false);
        }
        if (conn != null) conn.close();
        if (l != null) l.close();
        timer.shutdownNow();
        bulk.cleanup();
        log.debug("Transport {} closed", name);
    }

    private String nextRequestId() {
        String id;
        do {
            id = UUID.randomUUID().toString();
        } while (pending.containsKey(id));
        return id;
    }

    private FramedConnection ensureConnected() {
        FramedConnection current = connection;
        if (current != null && current.isOpen()) return current;
        synchronized (connectLock) {
            if (closed) throw new TransportException("Transport closed");
            current = connection;
            if (current != null && current.isOpen()) return current;
            try {
                if (loop == null || !loop.isRunning()) {
                    loop = new EventLoop(name + "-io");
                }
                SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX);
                try {
                    channel.connect(UnixDomainSocketAddress.of(options.getSocketPath()));
                    channel.configureBlocking(false);
                } catch (IOException | RuntimeException e) {
                    channel.close();
                    throw e;
                }
                FramedConnection conn = new FramedConnection(name, channel, loop,
                        new FrameDecoder(options.getMaxFrameBytes()), new ResponseListener());
                conn.start().get(CONNECT_REGISTRATION_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                connection = conn;
                log.info("Connected to adapter host at {}", options.getSocketPath());
                return conn;
            } catch (IOException | ExecutionException | TimeoutException | RuntimeException e) {
                throw new TransportException("Cannot connect to adapter host at " + options.getSocketPath() + ": " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException("Interrupted while connecting to adapter host", e);
            }
        }
    }

    private void expire(PendingCall call) {
        if (!pending.remove(call.requestId, call)) return;
        bulk.discard(call.wireArgs);
        breaker.recordFailure();
        metrics.clientCall(call.adapter, call.method, IpcMetrics.OUTCOME_TIMEOUT, System.nanoTime() - call.startNanos);
        log.warn("Adapter call {}.{} ({}) timed out after {}ms", call.adapter, call.method, call.requestId, call.timeout.toMillis());
        call.future.completeExceptionally(new CallTimeoutException(call.adapter, call.method, call.timeout));
    }

    private void fail(PendingCall call, TransportException error, boolean countFailure) {
        if (!pending.remove(call.requestId, call)) return;
        call.cancelTimeout();
        bulk.discard(call.wireArgs);
        if (countFailure) {
            breaker.recordFailure();
        }
        metrics.clientCall(call.adapter, call.method, IpcMetrics.OUTCOME_TRANSPORT_ERROR, System.nanoTime() - call.startNanos);
        call.future.completeExceptionally(error);
    }

    private void complete(PendingCall call, AdapterResponse response) {
        call.cancelTimeout();
        bulk.discard(call.wireArgs);
        breaker.recordSuccess();
        metrics.clientCall(call.adapter, call.method,
                response.hasError() ? IpcMetrics.OUTCOME_ERROR : IpcMetrics.OUTCOME_SUCCESS,
                System.nanoTime() - call.startNanos);
        options.getCallbackExecutor().execute(() -> {
            try {
                call.future.complete(response.withResult(bulk.resolve(response.result())));
            } catch (RuntimeException e) {
                call.future.completeExceptionally(e);
            }
        });
    }

    private final class ResponseListener implements FramedConnection.Listener {

        @Override
        public void onFrame(FramedConnection conn, byte[] frame) {
            AdapterResponse response;
            try {
                response = envelopes.decodeResponse(frame);
            } catch (ProtocolException e) {
                log.warn("Dropping malformed response frame: {}", e.getMessage());
                return;
            }
            PendingCall call = pending.remove(response.requestId());
            if (call == null) {
                log.debug("Dropping response for unknown request {}", response.requestId());
                metrics.orphanedResponse();
                bulk.discard(response.result());
                return;
            }
            complete(call, response);
        }

        @Override
        public void onClosed(FramedConnection conn, Throwable cause) {
            synchronized (connectLock) {
                if (connection == conn) connection = null;
            }
            if (closed) return;
            if (cause != null) {
                log.warn("Connection to adapter host lost: {}", cause.getMessage());
            } else {
                log.info("Adapter host closed the connection");
            }
            List<PendingCall> dropped = new ArrayList<>(pending.values());
            if (!dropped.isEmpty()) {
                // one lost connection is one failure, however many calls were in flight
                breaker.recordFailure();
            }
            for (PendingCall call : dropped) {
                fail(call, new TransportException("Connection closed", cause), false);
            }
        }
    }

    private static final class PendingCall {
        final String requestId;
        final String adapter;
        final String method;
        final Duration timeout;
        final List<JsonNode> wireArgs;
        final long startNanos;
        final CompletableFuture<AdapterResponse> future = new CompletableFuture<>();
        volatile ScheduledFuture<?> timeoutTask;

        PendingCall(String requestId, String adapter, String method, Duration timeout, List<JsonNode> wireArgs, long startNanos) {
            this.requestId = requestId;
            this.adapter = adapter;
            this.method = method;
            this.timeout = timeout;
            this.wireArgs = wireArgs;
            this.startNanos = startNanos;
        }

        void cancelTimeout() {
            ScheduledFuture<?> task = timeoutTask;
            if (task != null) task.cancel(false);
        }
    }
}
