package com.adapterhost.proxy;

import com.adapterhost.adapters.AdapterTokens;
import com.adapterhost.adapters.db.Document;
import com.adapterhost.adapters.db.DocumentDatabase;
import com.adapterhost.adapters.db.FindOptions;
import com.adapterhost.codec.WireCodec;
import com.adapterhost.ipc.transport.AdapterTransport;
import com.adapterhost.ipc.transport.CallOptions;
import com.fasterxml.jackson.core.type.TypeReference;

import java.util.List;
import java.util.Map;

public final class DocumentDatabaseProxy extends RemoteAdapter implements DocumentDatabase {

    private static final TypeReference<List<Document>> DOCUMENTS = new TypeReference<>() { };

    public DocumentDatabaseProxy(AdapterTransport transport, WireCodec codec) {
        this(AdapterTokens.DOCUMENT_DATABASE, transport, codec, null);
    }

    public DocumentDatabaseProxy(String token, AdapterTransport transport, WireCodec codec, CallOptions callOptions) {
        super(token, transport, codec, callOptions);
    }

    @Override
    public List<Document> find(String collection, Map<String, Object> filter, FindOptions options) {
        return call(DOCUMENTS, "find", collection, filter, options);
    }

    @Override
    public Document findById(String collection, String id) {
        return call(Document.class, "findById", collection, id);
    }

    @Override
    public Document insertOne(String collection, Map<String, Object> fields) {
        return call(Document.class, "insertOne", collection, fields);
    }

    @Override
    public long updateMany(String collection, Map<String, Object> filter, Map<String, Object> update) {
        return orZero(call(Long.class, "updateMany", collection, filter, update));
    }

    @Override
    public Document updateById(String collection, String id, Map<String, Object> update) {
        return call(Document.class, "updateById", collection, id, update);
    }

    @Override
    public long deleteMany(String collection, Map<String, Object> filter) {
        return orZero(call(Long.class, "deleteMany", collection, filter));
    }

    @Override
    public boolean deleteById(String collection, String id) {
        return Boolean.TRUE.equals(call(Boolean.class, "deleteById", collection, id));
    }

    @Override
    public long count(String collection, Map<String, Object> filter) {
        return orZero(call(Long.class, "count", collection, filter));
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }
}
