package com.adapterhost.proxy;

import com.adapterhost.adapters.AdapterTokens;
import com.adapterhost.adapters.cache.Cache;
import com.adapterhost.codec.WireCodec;
import com.adapterhost.ipc.transport.AdapterTransport;
import com.adapterhost.ipc.transport.CallOptions;

public final class CacheProxy extends RemoteAdapter implements Cache {

    public CacheProxy(AdapterTransport transport, WireCodec codec) {
        this(AdapterTokens.CACHE, transport, codec, null);
    }

    public CacheProxy(String token, AdapterTransport transport, WireCodec codec, CallOptions callOptions) {
        super(token, transport, codec, callOptions);
    }

    @Override
    public Object get(String key) {
        return call(Object.class, "get", key);
    }

    @Override
    public void set(String key, Object value, Long ttlMillis) {
        invoke("set", key, value, ttlMillis);
    }

    @Override
    public void delete(String key) {
        invoke("delete", key);
    }

    @Override
    public void clear(String pattern) {
        invoke("clear", pattern);
    }
}
