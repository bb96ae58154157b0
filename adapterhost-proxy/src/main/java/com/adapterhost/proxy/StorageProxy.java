package com.adapterhost.proxy;

import com.adapterhost.adapters.AdapterTokens;
import com.adapterhost.adapters.storage.Storage;
import com.adapterhost.codec.WireCodec;
import com.adapterhost.ipc.transport.AdapterTransport;
import com.adapterhost.ipc.transport.CallOptions;
import com.fasterxml.jackson.core.type.TypeReference;

import java.util.List;

public final class StorageProxy extends RemoteAdapter implements Storage {

    private static final TypeReference<List<String>> PATHS = new TypeReference<>() { };

    public StorageProxy(AdapterTransport transport, WireCodec codec) {
        this(AdapterTokens.STORAGE, transport, codec, null);
    }

    public StorageProxy(String token, AdapterTransport transport, WireCodec codec, CallOptions callOptions) {
        super(token, transport, codec, callOptions);
    }

    @Override
    public byte[] read(String path) {
        return call(byte[].class, "read", path);
    }

    @Override
    public void write(String path, byte[] data) {
        invoke("write", path, data);
    }

    @Override
    public void delete(String path) {
        invoke("delete", path);
    }

    @Override
    public boolean exists(String path) {
        return Boolean.TRUE.equals(call(Boolean.class, "exists", path));
    }

    @Override
    public List<String> list(String prefix) {
        List<String> paths = call(PATHS, "list", prefix);
        return paths != null ? paths : List.of();
    }
}
