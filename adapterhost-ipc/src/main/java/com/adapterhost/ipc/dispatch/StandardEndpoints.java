package com.adapterhost.ipc.dispatch;

import com.adapterhost.adapters.cache.Cache;
import com.adapterhost.adapters.config.ConfigProvider;
import com.adapterhost.adapters.db.DocumentDatabase;
import com.adapterhost.adapters.db.FindOptions;
import com.adapterhost.adapters.embeddings.Embeddings;
import com.adapterhost.adapters.llm.Llm;
import com.adapterhost.adapters.llm.LlmOptions;
import com.adapterhost.adapters.logging.AdapterLogger;
import com.adapterhost.adapters.logging.LogLevel;
import com.adapterhost.adapters.sql.SqlDatabase;
import com.adapterhost.adapters.sql.SqlTransaction;
import com.adapterhost.adapters.storage.Storage;
import com.adapterhost.adapters.vector.VectorFilter;
import com.adapterhost.adapters.vector.VectorRecord;
import com.adapterhost.adapters.vector.VectorStore;
import com.fasterxml.jackson.core.type.TypeReference;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Method tables for the built-in capability interfaces. Argument positions match the proxies in the
 * sandbox.
 */
public final class StandardEndpoints {

    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() { };
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() { };
    private static final TypeReference<List<VectorRecord>> RECORDS = new TypeReference<>() { };
    private static final TypeReference<List<Object>> PARAMS = new TypeReference<>() { };

    private StandardEndpoints() {
    }

    /** Binders for every capability below, most specific first. */
    public static List<EndpointBinder<?>> binders() {
        return List.of(
                EndpointBinder.of(Cache.class, StandardEndpoints::cache),
                EndpointBinder.of(DocumentDatabase.class, StandardEndpoints::documentDatabase),
                EndpointBinder.of(VectorStore.class, StandardEndpoints::vectorStore),
                EndpointBinder.of(Embeddings.class, StandardEndpoints::embeddings),
                EndpointBinder.of(Storage.class, StandardEndpoints::storage),
                EndpointBinder.of(AdapterLogger.class, StandardEndpoints::logger),
                EndpointBinder.of(Llm.class, StandardEndpoints::llm),
                EndpointBinder.of(SqlDatabase.class, StandardEndpoints::sqlDatabase),
                EndpointBinder.of(ConfigProvider.class, StandardEndpoints::config)
        );
    }

    public static AdapterEndpoint cache(Cache cache) {
        return AdapterEndpoint.builder()
                .method("get", a -> cache.get(a.requireString(0)))
                .method("set", a -> {
                    cache.set(a.requireString(0), a.value(1), a.optionalLong(2));
                    return null;
                })
                .method("delete", a -> {
                    cache.delete(a.requireString(0));
                    return null;
                })
                .method("clear", a -> {
                    cache.clear(a.string(0));
                    return null;
                })
                .build();
    }

    public static AdapterEndpoint documentDatabase(DocumentDatabase db) {
        return AdapterEndpoint.builder()
                .method("find", a -> db.find(a.requireString(0), a.get(1, FIELDS), a.get(2, FindOptions.class)))
                .method("findById", a -> db.findById(a.requireString(0), a.requireString(1)))
                .method("insertOne", a -> db.insertOne(a.requireString(0), a.get(1, FIELDS)))
                .method("updateMany", a -> db.updateMany(a.requireString(0), a.get(1, FIELDS), a.get(2, FIELDS)))
                .method("updateById", a -> db.updateById(a.requireString(0), a.requireString(1), a.get(2, FIELDS)))
                .method("deleteMany", a -> db.deleteMany(a.requireString(0), a.get(1, FIELDS)))
                .method("deleteById", a -> db.deleteById(a.requireString(0), a.requireString(1)))
                .method("count", a -> db.count(a.requireString(0), a.get(1, FIELDS)))
                .build();
    }

    public static AdapterEndpoint vectorStore(VectorStore store) {
        return AdapterEndpoint.builder()
                .method("search", a -> store.search(a.get(0, float[].class), a.intOr(1, 10), a.get(2, VectorFilter.class)))
                .method("upsert", a -> {
                    store.upsert(a.get(0, RECORDS));
                    return null;
                })
                .method("delete", a -> {
                    store.delete(a.get(0, STRINGS));
                    return null;
                })
                .method("count", a -> store.count())
                .method("get", a -> store.get(a.get(0, STRINGS)))
                .method("clear", a -> {
                    store.clear();
                    return null;
                })
                .build();
    }

    public static AdapterEndpoint embeddings(Embeddings embeddings) {
        return AdapterEndpoint.builder()
                .method("embed", a -> embeddings.embed(a.requireString(0)))
                .method("embedBatch", a -> embeddings.embedBatch(a.get(0, STRINGS)))
                .method("getDimensions", a -> embeddings.getDimensions())
                .build();
    }

    public static AdapterEndpoint storage(Storage storage) {
        return AdapterEndpoint.builder()
                .method("read", a -> storage.read(a.requireString(0)))
                .method("write", a -> {
                    storage.write(a.requireString(0), a.get(1, byte[].class));
                    return null;
                })
                .method("delete", a -> {
                    storage.delete(a.requireString(0));
                    return null;
                })
                .method("exists", a -> storage.exists(a.requireString(0)))
                .method("list", a -> storage.list(a.string(0)))
                .build();
    }

    public static AdapterEndpoint logger(AdapterLogger logger) {
        AdapterEndpoint.Builder builder = AdapterEndpoint.builder()
                .method("log", a -> {
                    LogLevel level = a.get(0, LogLevel.class);
                    logger.log(level != null ? level : LogLevel.INFO, a.string(1), a.get(2, FIELDS));
                    return null;
                });
        for (LogLevel level : LogLevel.values()) {
            builder.method(level.name().toLowerCase(Locale.ROOT), a -> {
                logger.log(level, a.string(0), a.get(1, FIELDS));
                return null;
            });
        }
        return builder.build();
    }

    public static AdapterEndpoint llm(Llm llm) {
        return AdapterEndpoint.builder()
                .method("complete", a -> llm.complete(a.requireString(0), a.get(1, LlmOptions.class)))
                .build();
    }

    /**
     * A transaction cannot cross the channel as an object, so {@code transaction} returns an id the
     * caller passes back to {@code transaction.query}, {@code transaction.commit} and
     * {@code transaction.rollback}. Finishing a transaction forgets its id; {@code close} rolls back
     * any still open.
     */
    public static AdapterEndpoint sqlDatabase(SqlDatabase db) {
        Map<String, SqlTransaction> open = new ConcurrentHashMap<>();
        return AdapterEndpoint.builder()
                .method("query", a -> db.query(a.requireString(0), a.get(1, PARAMS)))
                .method("transaction", a -> {
                    String id = UUID.randomUUID().toString();
                    open.put(id, db.transaction());
                    return id;
                })
                .method("transaction.query", a -> openTransaction(open, a.requireString(0))
                        .query(a.requireString(1), a.get(2, PARAMS)))
                .method("transaction.commit", a -> {
                    finishTransaction(open, a.requireString(0)).commit();
                    return null;
                })
                .method("transaction.rollback", a -> {
                    finishTransaction(open, a.requireString(0)).rollback();
                    return null;
                })
                .method("close", a -> {
                    for (String id : List.copyOf(open.keySet())) {
                        SqlTransaction tx = open.remove(id);
                        if (tx != null) tx.rollback();
                    }
                    db.close();
                    return null;
                })
                .build();
    }

    public static AdapterEndpoint config(ConfigProvider config) {
        return AdapterEndpoint.builder()
                .method("getConfig", a -> config.getConfig(a.requireString(0), a.string(1)))
                .method("getRawConfig", a -> config.getRawConfig())
                .build();
    }

    private static SqlTransaction openTransaction(Map<String, SqlTransaction> open, String id) {
        SqlTransaction tx = open.get(id);
        if (tx == null) {
            throw new IllegalStateException("No open transaction " + id);
        }
        return tx;
    }

    private static SqlTransaction finishTransaction(Map<String, SqlTransaction> open, String id) {
        SqlTransaction tx = open.remove(id);
        if (tx == null) {
            throw new IllegalStateException("No open transaction " + id);
        }
        return tx;
    }
}
