package com.adapterhost.ipc.dispatch;

import com.adapterhost.codec.WireCodec;
import com.adapterhost.ipc.bulk.BulkTransfer;
import com.adapterhost.ipc.protocol.AdapterCall;
import com.adapterhost.ipc.protocol.AdapterResponse;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Routes a decoded call to the named adapter's method and turns the outcome into a response with the
 * same request id. Failures of any kind (unknown adapter or method, bad arguments, adapter exceptions,
 * unserializable results) become error responses; {@link #dispatch} itself never throws.
 */
public final class AdapterDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AdapterDispatcher.class);

    private final WireCodec codec;
    private final BulkTransfer bulk;
    private final Map<String, AdapterEndpoint> endpoints;

    private AdapterDispatcher(WireCodec codec, BulkTransfer bulk, Map<String, AdapterEndpoint> endpoints) {
        this.codec = codec;
        this.bulk = bulk;
        this.endpoints = Collections.unmodifiableMap(new LinkedHashMap<>(endpoints));
    }

    public static Builder builder(WireCodec codec, BulkTransfer bulk) {
        return new Builder(codec, bulk);
    }

    /**
     * Exposes every instance that one of {@code binders} recognizes, under its token. Instances with no
     * matching binder are not reachable over the channel.
     */
    public static AdapterDispatcher fromInstances(WireCodec codec, BulkTransfer bulk, Map<String, Object> instances,
                                                  List<EndpointBinder<?>> binders) {
        Builder builder = builder(codec, bulk);
        for (Map.Entry<String, Object> entry : instances.entrySet()) {
            Optional<AdapterEndpoint> endpoint = Optional.empty();
            for (EndpointBinder<?> binder : binders) {
                endpoint = binder.bind(entry.getValue());
                if (endpoint.isPresent()) break;
            }
            if (endpoint.isPresent()) {
                builder.expose(entry.getKey(), endpoint.get());
            } else {
                log.debug("Adapter {} ({}) has no remote endpoint", entry.getKey(), entry.getValue().getClass().getName());
            }
        }
        return builder.build();
    }

    public Set<String> exposedAdapters() {
        return endpoints.keySet();
    }

    public AdapterResponse dispatch(AdapterCall call) {
        AdapterEndpoint endpoint = endpoints.get(call.adapter());
        if (endpoint == null) {
            return failure(call, new AdapterNotFoundException(call.adapter()));
        }
        MethodHandler handler = endpoint.method(call.method());
        if (handler == null) {
            return failure(call, new MethodNotFoundException(call.adapter(), call.method()));
        }
        Object result;
        try {
            List<JsonNode> args = bulk.resolveAll(call.args());
            result = handler.invoke(new CallArguments(args, codec));
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.debug("Adapter call {} ({}) failed: {}", call.operation(), call.requestId(), e.toString());
            return failure(call, e);
        }
        try {
            return AdapterResponse.success(call.requestId(), bulk.offload(codec.serialize(result)));
        } catch (RuntimeException e) {
            log.warn("Cannot serialize result of {} ({}): {}", call.operation(), call.requestId(), e.getMessage());
            return failure(call, e);
        }
    }

    private AdapterResponse failure(AdapterCall call, Throwable error) {
        return AdapterResponse.failure(call.requestId(), codec.serializeError(error));
    }

    public static final class Builder {
        private final WireCodec codec;
        private final BulkTransfer bulk;
        private final Map<String, AdapterEndpoint> endpoints = new LinkedHashMap<>();

        private Builder(WireCodec codec, BulkTransfer bulk) {
            this.codec = Objects.requireNonNull(codec, "codec");
            this.bulk = Objects.requireNonNull(bulk, "bulk");
        }

        public Builder expose(String token, AdapterEndpoint endpoint) {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(endpoint, "endpoint");
            if (endpoints.putIfAbsent(token, endpoint) != null) {
                throw new IllegalArgumentException("Adapter already exposed: " + token);
            }
            return this;
        }

        public AdapterDispatcher build() {
            return new AdapterDispatcher(codec, bulk, endpoints);
        }
    }
}
