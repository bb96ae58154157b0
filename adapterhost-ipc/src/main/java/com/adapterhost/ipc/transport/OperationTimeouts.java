package com.adapterhost.ipc.transport;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-operation timeout table. Lookup tries {@code adapter.method}, then {@code adapter.*}, then
 * {@code *}. An explicit per-call timeout beats a transport-wide override, which beats the table.
 */
public final class OperationTimeouts {

    public static final String WILDCARD = "*";
    public static final Duration GLOBAL_DEFAULT = Duration.ofSeconds(30);

    private static final OperationTimeouts DEFAULTS = new OperationTimeouts(defaultTable());

    private final Map<String, Duration> table;

    private OperationTimeouts(Map<String, Duration> table) {
        this.table = Collections.unmodifiableMap(new LinkedHashMap<>(table));
    }

    public static OperationTimeouts defaults() {
        return DEFAULTS;
    }

    /** Table with only the entries given (plus the global fallback). */
    public static OperationTimeouts of(Map<String, Duration> entries) {
        return new OperationTimeouts(entries);
    }

    /** Copy with one entry added or replaced; {@code key} is {@code adapter.method}, {@code adapter.*} or {@code *}. */
    public OperationTimeouts with(String key, Duration timeout) {
        Map<String, Duration> next = new LinkedHashMap<>(table);
        next.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(timeout, "timeout"));
        return new OperationTimeouts(next);
    }

    public Duration lookup(String adapter, String method) {
        Duration exact = table.get(adapter + "." + method);
        if (exact != null) return exact;
        Duration adapterWide = table.get(adapter + "." + WILDCARD);
        if (adapterWide != null) return adapterWide;
        return table.getOrDefault(WILDCARD, GLOBAL_DEFAULT);
    }

    /**
     * @param explicit   per-call timeout, or null
     * @param configured transport-wide override, or null
     */
    public Duration resolve(String adapter, String method, Duration explicit, Duration configured) {
        if (explicit != null) return explicit;
        if (configured != null) return configured;
        return lookup(adapter, method);
    }

    public Map<String, Duration> asMap() {
        return table;
    }

    private static Map<String, Duration> defaultTable() {
        Map<String, Duration> t = new LinkedHashMap<>();
        t.put("vectorStore.upsert", Duration.ofSeconds(120));
        t.put("vectorStore.get", Duration.ofSeconds(120));
        t.put("vectorStore.query", Duration.ofSeconds(120));
        t.put("vectorStore.search", Duration.ofSeconds(30));
        t.put("vectorStore.*", Duration.ofSeconds(60));

        t.put("embeddings.embed", Duration.ofSeconds(30));
        t.put("embeddings.embedBatch", Duration.ofSeconds(120));
        t.put("embeddings.getDimensions", Duration.ofSeconds(5));
        t.put("embeddings.*", Duration.ofSeconds(60));

        t.put("llm.complete", Duration.ofSeconds(90));
        t.put("llm.*", Duration.ofSeconds(90));

        t.put("cache.get", Duration.ofSeconds(5));
        t.put("cache.set", Duration.ofSeconds(5));
        t.put("cache.delete", Duration.ofSeconds(5));
        t.put("cache.clear", Duration.ofSeconds(10));
        t.put("cache.*", Duration.ofSeconds(10));

        t.put("storage.read", Duration.ofSeconds(15));
        t.put("storage.write", Duration.ofSeconds(30));
        t.put("storage.delete", Duration.ofSeconds(10));
        t.put("storage.exists", Duration.ofSeconds(5));
        t.put("storage.list", Duration.ofSeconds(20));
        t.put("storage.*", Duration.ofSeconds(30));

        t.put("database.document.*", Duration.ofSeconds(30));
        t.put("database.sql.close", Duration.ofSeconds(10));
        t.put("database.sql.*", Duration.ofSeconds(30));

        t.put("config.*", Duration.ofSeconds(5));

        t.put(WILDCARD, GLOBAL_DEFAULT);
        return t;
    }
}
