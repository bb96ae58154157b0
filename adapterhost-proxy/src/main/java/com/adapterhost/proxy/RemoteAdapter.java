package com.adapterhost.proxy;

import com.adapterhost.codec.WireCodec;
import com.adapterhost.ipc.protocol.AdapterResponse;
import com.adapterhost.ipc.transport.AdapterTransport;
import com.adapterhost.ipc.transport.CallOptions;
import com.adapterhost.ipc.transport.Retryability;
import com.adapterhost.ipc.transport.TransportException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;

/**
 * Base of the proxy stubs. A call serializes its arguments, sends them under this proxy's token,
 * waits for the response and either decodes the result or throws the adapter's error as a
 * {@link com.adapterhost.codec.RemoteAdapterException}. Transport failures surface as
 * {@link TransportException} or one of its subclasses.
 */
public abstract class RemoteAdapter {

    private final String token;
    private final AdapterTransport transport;
    private final WireCodec codec;
    private final CallOptions callOptions;

    protected RemoteAdapter(String token, AdapterTransport transport, WireCodec codec, CallOptions callOptions) {
        this.token = Objects.requireNonNull(token, "token");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.callOptions = callOptions != null ? callOptions : CallOptions.defaults();
    }

    /** Runtime token of the host adapter this proxy talks to. */
    public String getToken() {
        return token;
    }

    protected <T> T call(Class<T> resultType, String method, Object... args) {
        return decode(send(method, args), codec.constructType(resultType));
    }

    protected <T> T call(TypeReference<T> resultType, String method, Object... args) {
        return decode(send(method, args), codec.constructType(resultType));
    }

    protected void invoke(String method, Object... args) {
        send(method, args);
    }

    private <T> T decode(JsonNode result, JavaType type) {
        return codec.deserialize(result, type);
    }

    private JsonNode send(String method, Object[] args) {
        List<JsonNode> wireArgs = new ArrayList<>(args.length);
        for (Object arg : args) {
            wireArgs.add(codec.serialize(arg));
        }
        AdapterResponse response;
        try {
            response = transport.send(token, method, wireArgs, callOptions).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted waiting for " + token + "." + method, e);
        } catch (ExecutionException e) {
            Throwable cause = Retryability.unwrap(e);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new TransportException("Call " + token + "." + method + " failed: " + cause.getMessage(), cause);
        }
        if (response.hasError()) {
            throw codec.deserializeError(response.error());
        }
        return response.result();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{token=" + token + "}";
    }
}
