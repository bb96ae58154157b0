package com.adapterhost.ipc.transport;

import com.adapterhost.ipc.protocol.AdapterResponse;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Caller side of the adapter channel. Arguments are wire-form values; the returned response has any
 * bulk reference in {@code result} already replaced by its payload.
 * <p>
 * The future fails with {@link TransportException} (or a subclass) when the call never produced a
 * response. An adapter error arrives as a normal response with {@link AdapterResponse#hasError()}.
 */
public interface AdapterTransport extends AutoCloseable {

    CompletableFuture<AdapterResponse> send(String adapter, String method, List<JsonNode> args, CallOptions options);

    default CompletableFuture<AdapterResponse> send(String adapter, String method, List<JsonNode> args) {
        return send(adapter, method, args, CallOptions.defaults());
    }

    boolean isClosed();

    /** Fails every outstanding call and releases the connection. Idempotent. */
    @Override
    void close();
}
