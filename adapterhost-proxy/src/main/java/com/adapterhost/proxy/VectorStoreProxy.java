package com.adapterhost.proxy;

import com.adapterhost.adapters.AdapterTokens;
import com.adapterhost.adapters.vector.VectorFilter;
import com.adapterhost.adapters.vector.VectorRecord;
import com.adapterhost.adapters.vector.VectorSearchResult;
import com.adapterhost.adapters.vector.VectorStore;
import com.adapterhost.codec.WireCodec;
import com.adapterhost.ipc.transport.AdapterTransport;
import com.adapterhost.ipc.transport.CallOptions;
import com.fasterxml.jackson.core.type.TypeReference;

import java.util.List;

public final class VectorStoreProxy extends RemoteAdapter implements VectorStore {

    private static final TypeReference<List<VectorSearchResult>> RESULTS = new TypeReference<>() { };
    private static final TypeReference<List<VectorRecord>> RECORDS = new TypeReference<>() { };

    public VectorStoreProxy(AdapterTransport transport, WireCodec codec) {
        this(AdapterTokens.VECTOR_STORE, transport, codec, null);
    }

    public VectorStoreProxy(String token, AdapterTransport transport, WireCodec codec, CallOptions callOptions) {
        super(token, transport, codec, callOptions);
    }

    @Override
    public List<VectorSearchResult> search(float[] query, int limit, VectorFilter filter) {
        return call(RESULTS, "search", query, limit, filter);
    }

    @Override
    public void upsert(List<VectorRecord> records) {
        invoke("upsert", records);
    }

    @Override
    public void delete(List<String> ids) {
        invoke("delete", ids);
    }

    @Override
    public long count() {
        Long count = call(Long.class, "count");
        return count != null ? count : 0L;
    }

    @Override
    public List<VectorRecord> get(List<String> ids) {
        return call(RECORDS, "get", ids);
    }

    @Override
    public void clear() {
        invoke("clear");
    }
}
