package com.adapterhost.ipc.server;

import com.adapterhost.codec.WireCodec;
import com.adapterhost.ipc.channel.ChannelHandler;
import com.adapterhost.ipc.channel.EventLoop;
import com.adapterhost.ipc.channel.FramedConnection;
import com.adapterhost.ipc.dispatch.AdapterDispatcher;
import com.adapterhost.ipc.metrics.IpcMetrics;
import com.adapterhost.ipc.protocol.AdapterCall;
import com.adapterhost.ipc.protocol.AdapterResponse;
import com.adapterhost.ipc.protocol.EnvelopeCodec;
import com.adapterhost.ipc.protocol.FrameDecoder;
import com.adapterhost.ipc.protocol.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.SelectionKey;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Host side of the adapter channel: listens on a Unix domain socket and answers call envelopes.
 * <ul>
 *   <li>Each accepted connection has its own frame buffer; responses go back on the connection the
 *   call arrived on.</li>
 *   <li>Calls are dispatched on a worker pool, so a slow adapter method does not hold up other calls
 *   on the same connection.</li>
 *   <li>A frame that is not a valid call is skipped; the connection stays open.</li>
 * </ul>
 */
public final class AdapterRpcServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdapterRpcServer.class);
    private static final long REGISTRATION_TIMEOUT_MS = 5_000;

    private final AdapterDispatcher dispatcher;
    private final RpcServerOptions options;
    private final RpcServerListener listener;
    private final IpcMetrics metrics;
    private final EnvelopeCodec envelopes;
    private final Map<String, FramedConnection> connections = new ConcurrentHashMap<>();
    private final AtomicInteger connectionIds = new AtomicInteger();

    private EventLoop loop;
    private ServerSocketChannel serverChannel;
    private volatile ExecutorService workers;
    private volatile boolean started;

    public AdapterRpcServer(AdapterDispatcher dispatcher, WireCodec codec, RpcServerOptions options,
                            RpcServerListener listener, IpcMetrics metrics) {
        this.dispatcher = dispatcher;
        this.options = options;
        this.listener = listener != null ? listener : RpcServerListener.NOOP;
        this.metrics = metrics != null ? metrics : IpcMetrics.simple();
        this.envelopes = new EnvelopeCodec(codec.mapper());
    }

    /**
     * Binds the socket, replacing a stale socket file left by an earlier process.
     *
     * @throws IllegalStateException if already started
     * @throws IOException           if the socket cannot be bound
     */
    public synchronized void start() throws IOException {
        if (started) {
            throw new IllegalStateException("Server already started on " + options.socketPath());
        }
        Path socketPath = options.socketPath();
        if (socketPath.getParent() != null) {
            Files.createDirectories(socketPath.getParent());
        }
        if (Files.deleteIfExists(socketPath)) {
            log.info("Removed stale socket file {}", socketPath);
        }
        AtomicInteger workerIds = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(options.dispatchThreads(), r -> {
            Thread t = new Thread(r, "adapterhost-rpc-worker-" + workerIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        ServerSocketChannel channel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        EventLoop eventLoop = null;
        try {
            channel.bind(UnixDomainSocketAddress.of(socketPath));
            channel.configureBlocking(false);
            eventLoop = new EventLoop("adapterhost-rpc-io");
            eventLoop.register(channel, SelectionKey.OP_ACCEPT, new Acceptor(channel, eventLoop))
                    .get(REGISTRATION_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (IOException | RuntimeException e) {
            abortStart(channel, eventLoop);
            throw e;
        } catch (ExecutionException | TimeoutException e) {
            abortStart(channel, eventLoop);
            throw new IOException("Cannot register server socket " + socketPath + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abortStart(channel, eventLoop);
            throw new IOException("Interrupted while starting server on " + socketPath, e);
        }
        this.serverChannel = channel;
        this.loop = eventLoop;
        this.started = true;
        log.info("Adapter RPC server listening on {} ({} adapter(s): {})",
                socketPath, dispatcher.exposedAdapters().size(), dispatcher.exposedAdapters());
    }

    public boolean isStarted() {
        return started;
    }

    public Path getSocketPath() {
        return options.socketPath();
    }

    public int connectionCount() {
        return connections.size();
    }

    /** Closes the listener and every connection and removes the socket file. Idempotent. */
    @Override
    public synchronized void close() {
        if (!started) return;
        started = false;
        try {
            serverChannel.close();
        } catch (IOException e) {
            log.debug("Error closing server socket", e);
        }
        for (FramedConnection connection : new ArrayList<>(connections.values())) {
            connection.close();
        }
        connections.clear();
        loop.close();
        workers.shutdownNow();
        try {
            Files.deleteIfExists(options.socketPath());
        } catch (IOException e) {
            log.warn("Cannot remove socket file {}: {}", options.socketPath(), e.getMessage());
        }
        log.info("Adapter RPC server on {} stopped", options.socketPath());
    }

    private void abortStart(ServerSocketChannel channel, EventLoop eventLoop) {
        workers.shutdownNow();
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Error closing server socket after failed start", e);
        }
        if (eventLoop != null) eventLoop.close();
        try {
            Files.deleteIfExists(options.socketPath());
        } catch (IOException e) {
            log.debug("Cannot remove socket file after failed start", e);
        }
    }

    private void handleFrame(FramedConnection connection, byte[] frame) {
        AdapterCall call;
        try {
            call = envelopes.decodeCall(frame);
        } catch (ProtocolException e) {
            metrics.malformedFrame();
            notifyListener(() -> listener.onMalformedFrame(connection.getId(), e));
            return;
        }
        if (call.version() != EnvelopeCodec.PROTOCOL_VERSION) {
            notifyListener(() -> listener.onProtocolVersionMismatch(call.version(), EnvelopeCodec.PROTOCOL_VERSION, call));
        }
        try {
            workers.execute(() -> respond(connection, call));
        } catch (RejectedExecutionException e) {
            log.debug("Dropping call {} ({}): server stopping", call.operation(), call.requestId());
        }
    }

    private void respond(FramedConnection connection, AdapterCall call) {
        long start = System.nanoTime();
        AdapterResponse response = dispatcher.dispatch(call);
        metrics.serverCall(call.adapter(), call.method(),
                response.hasError() ? IpcMetrics.OUTCOME_ERROR : IpcMetrics.OUTCOME_SUCCESS,
                System.nanoTime() - start);
        if (response.hasError()) {
            notifyListener(() -> listener.onCallFailed(call, response));
        }
        byte[] frame;
        try {
            frame = envelopes.encode(response);
        } catch (ProtocolException e) {
            log.warn("Cannot encode response for {} ({}): {}", call.operation(), call.requestId(), e.getMessage());
            return;
        }
        connection.send(frame).whenComplete((v, e) -> {
            if (e != null) {
                log.debug("Response for {} ({}) not delivered: {}", call.operation(), call.requestId(), e.toString());
            }
        });
    }

    private void notifyListener(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            log.warn("Server listener failed", e);
        }
    }

    private final class Acceptor implements ChannelHandler {
        private final ServerSocketChannel channel;
        private final EventLoop eventLoop;

        Acceptor(ServerSocketChannel channel, EventLoop eventLoop) {
            this.channel = channel;
            this.eventLoop = eventLoop;
        }

        @Override
        public void onReady(SelectionKey key) throws IOException {
            SocketChannel accepted;
            while ((accepted = channel.accept()) != null) {
                accepted.configureBlocking(false);
                String id = "conn-" + connectionIds.incrementAndGet();
                FramedConnection connection = new FramedConnection(id, accepted, eventLoop,
                        new FrameDecoder(options.maxFrameBytes()), new ConnectionListener());
                connections.put(id, connection);
                connection.start();
                log.debug("Accepted sandbox connection {}", id);
            }
        }

        @Override
        public void onFailure(Throwable cause) {
            if (started) {
                log.error("Accept failed on {}: {}", options.socketPath(), cause.getMessage(), cause);
            }
        }
    }

    private final class ConnectionListener implements FramedConnection.Listener {

        @Override
        public void onFrame(FramedConnection connection, byte[] frame) {
            handleFrame(connection, frame);
        }

        @Override
        public void onClosed(FramedConnection connection, Throwable cause) {
            connections.remove(connection.getId());
            if (cause != null) {
                log.debug("Connection {} closed: {}", connection.getId(), cause.getMessage());
            } else {
                log.debug("Connection {} closed by peer", connection.getId());
            }
        }
    }
}
