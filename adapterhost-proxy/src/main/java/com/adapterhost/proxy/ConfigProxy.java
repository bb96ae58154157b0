package com.adapterhost.proxy;

import com.adapterhost.adapters.AdapterTokens;
import com.adapterhost.adapters.config.ConfigProvider;
import com.adapterhost.codec.WireCodec;
import com.adapterhost.ipc.transport.AdapterTransport;
import com.adapterhost.ipc.transport.CallOptions;
import com.fasterxml.jackson.core.type.TypeReference;

import java.util.Map;

public final class ConfigProxy extends RemoteAdapter implements ConfigProvider {

    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() { };

    public ConfigProxy(AdapterTransport transport, WireCodec codec) {
        this(AdapterTokens.CONFIG, transport, codec, null);
    }

    public ConfigProxy(String token, AdapterTransport transport, WireCodec codec, CallOptions callOptions) {
        super(token, transport, codec, callOptions);
    }

    @Override
    public Object getConfig(String productId, String profileId) {
        return call(Object.class, "getConfig", productId, profileId);
    }

    @Override
    public Map<String, Object> getRawConfig() {
        return call(DOCUMENT, "getRawConfig");
    }
}
