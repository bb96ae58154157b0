package com.adapterhost.ipc.transport;

import com.adapterhost.codec.WireCodec;
import com.adapterhost.ipc.bulk.BulkTransfer;
import com.adapterhost.ipc.dispatch.AdapterDispatcher;
import com.adapterhost.ipc.protocol.AdapterCall;
import com.adapterhost.ipc.protocol.AdapterResponse;
import com.adapterhost.ipc.protocol.CallContext;
import com.adapterhost.ipc.protocol.EnvelopeCodec;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Transport that hands calls straight to a dispatcher in the same JVM. Envelopes still go through
 * their byte encoding, so callers see exactly what a socket peer would send.
 */
public final class InProcessTransport implements AdapterTransport {

    private final AdapterDispatcher dispatcher;
    private final EnvelopeCodec envelopes;
    private final BulkTransfer bulk;
    private final Executor executor;
    private volatile boolean closed;

    public InProcessTransport(AdapterDispatcher dispatcher, WireCodec codec, BulkTransfer bulk, Executor executor) {
        this.dispatcher = dispatcher;
        this.envelopes = new EnvelopeCodec(codec.mapper());
        this.bulk = bulk;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<AdapterResponse> send(String adapter, String method, List<JsonNode> args, CallOptions options) {
        if (closed) {
            return CompletableFuture.failedFuture(new TransportException("Transport closed"));
        }
        CallContext context = options != null ? options.context() : null;
        AdapterCall call = AdapterCall.create(UUID.randomUUID().toString(), adapter, method, args, context);
        return CompletableFuture.supplyAsync(() -> {
            AdapterCall received = envelopes.decodeCall(envelopes.encode(call));
            AdapterResponse response = dispatcher.dispatch(received);
            AdapterResponse delivered = envelopes.decodeResponse(envelopes.encode(response));
            return delivered.withResult(bulk.resolve(delivered.result()));
        }, executor);
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }
}
