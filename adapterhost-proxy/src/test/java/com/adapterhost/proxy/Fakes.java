package com.adapterhost.proxy;

import com.adapterhost.adapters.cache.Cache;
import com.adapterhost.adapters.config.ConfigProvider;
import com.adapterhost.adapters.db.Document;
import com.adapterhost.adapters.db.DocumentDatabase;
import com.adapterhost.adapters.db.FindOptions;
import com.adapterhost.adapters.embeddings.Embeddings;
import com.adapterhost.adapters.llm.Llm;
import com.adapterhost.adapters.llm.LlmOptions;
import com.adapterhost.adapters.llm.LlmResponse;
import com.adapterhost.adapters.llm.LlmUsage;
import com.adapterhost.adapters.logging.AdapterLogger;
import com.adapterhost.adapters.logging.LogLevel;
import com.adapterhost.adapters.logging.LogRecord;
import com.adapterhost.adapters.sql.SqlDatabase;
import com.adapterhost.adapters.sql.SqlField;
import com.adapterhost.adapters.sql.SqlQueryResult;
import com.adapterhost.adapters.sql.SqlTransaction;
import com.adapterhost.adapters.storage.Storage;
import com.adapterhost.adapters.vector.VectorFilter;
import com.adapterhost.adapters.vector.VectorRecord;
import com.adapterhost.adapters.vector.VectorSearchResult;
import com.adapterhost.adapters.vector.VectorStore;
import com.adapterhost.codec.CodedError;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class Fakes {

    private Fakes() {
    }

    static final class QuotaExceeded extends RuntimeException implements CodedError {
        QuotaExceeded(String message) {
            super(message);
        }

        @Override
        public String getCode() {
            return "QUOTA_EXCEEDED";
        }
    }

    static final class MemoryCache implements Cache {
        final Map<String, Object> values = new LinkedHashMap<>();
        final Map<String, Long> ttls = new LinkedHashMap<>();
        String lastPattern = "unset";

        @Override
        public Object get(String key) {
            if (key.equals("forbidden")) throw new QuotaExceeded("over quota for " + key);
            return values.get(key);
        }

        @Override
        public void set(String key, Object value, Long ttlMillis) {
            values.put(key, value);
            ttls.put(key, ttlMillis);
        }

        @Override
        public void delete(String key) {
            values.remove(key);
        }

        @Override
        public void clear(String pattern) {
            lastPattern = pattern;
            values.clear();
        }
    }

    static final class FixedDatabase implements DocumentDatabase {
        final List<Object[]> calls = new ArrayList<>();

        @Override
        public List<Document> find(String collection, Map<String, Object> filter, FindOptions options) {
            calls.add(new Object[]{"find", collection, filter, options});
            return List.of(new Document("d1", 1L, 2L, Map.of("title", "first")));
        }

        @Override
        public Document findById(String collection, String id) {
            return id.equals("d1") ? new Document("d1", 1L, 2L, Map.of("title", "first")) : null;
        }

        @Override
        public Document insertOne(String collection, Map<String, Object> fields) {
            return new Document("new", 10L, 10L, fields);
        }

        @Override
        public long updateMany(String collection, Map<String, Object> filter, Map<String, Object> update) {
            return 3;
        }

        @Override
        public Document updateById(String collection, String id, Map<String, Object> update) {
            return null;
        }

        @Override
        public long deleteMany(String collection, Map<String, Object> filter) {
            return 2;
        }

        @Override
        public boolean deleteById(String collection, String id) {
            return id.equals("d1");
        }

        @Override
        public long count(String collection, Map<String, Object> filter) {
            return 42;
        }
    }

    static final class ListVectorStore implements VectorStore {
        final Map<String, VectorRecord> records = new LinkedHashMap<>();
        VectorFilter lastFilter;

        @Override
        public List<VectorSearchResult> search(float[] query, int limit, VectorFilter filter) {
            lastFilter = filter;
            List<VectorSearchResult> out = new ArrayList<>();
            for (VectorRecord r : records.values()) {
                if (out.size() == limit) break;
                out.add(new VectorSearchResult(r.id(), 0.5, r.metadata()));
            }
            return out;
        }

        @Override
        public void upsert(List<VectorRecord> batch) {
            for (VectorRecord r : batch) records.put(r.id(), r);
        }

        @Override
        public void delete(List<String> ids) {
            ids.forEach(records::remove);
        }

        @Override
        public long count() {
            return records.size();
        }

        @Override
        public List<VectorRecord> get(List<String> ids) {
            List<VectorRecord> out = new ArrayList<>();
            for (String id : ids) {
                if (records.containsKey(id)) out.add(records.get(id));
            }
            return out;
        }

        @Override
        public void clear() {
            records.clear();
        }
    }

    static final class LengthEmbeddings implements Embeddings {
        @Override
        public float[] embed(String text) {
            return new float[]{text.length(), 0.5f, -1f};
        }

        @Override
        public List<float[]> embedBatch(List<String> texts) {
            List<float[]> out = new ArrayList<>();
            for (String t : texts) out.add(embed(t));
            return out;
        }

        @Override
        public int getDimensions() {
            return 3;
        }
    }

    static final class MapStorage implements Storage {
        final Map<String, byte[]> files = new LinkedHashMap<>();

        @Override
        public byte[] read(String path) {
            return files.get(path);
        }

        @Override
        public void write(String path, byte[] data) {
            files.put(path, data);
        }

        @Override
        public void delete(String path) {
            files.remove(path);
        }

        @Override
        public boolean exists(String path) {
            return files.containsKey(path);
        }

        @Override
        public List<String> list(String prefix) {
            List<String> out = new ArrayList<>();
            for (String p : files.keySet()) {
                if (prefix == null || p.startsWith(prefix)) out.add(p);
            }
            return out;
        }
    }

    static final class CollectingLogger implements AdapterLogger {
        final List<LogRecord> records = new ArrayList<>();

        @Override
        public void log(LogLevel level, String message, Map<String, Object> fields) {
            records.add(new LogRecord(0L, level, message, fields, "test"));
        }
    }

    static final class UpperCaseLlm implements Llm {
        LlmOptions lastOptions;

        @Override
        public LlmResponse complete(String prompt, LlmOptions options) {
            lastOptions = options;
            String model = options != null && options.model() != null ? options.model() : "upper";
            return new LlmResponse(prompt.toUpperCase(), new LlmUsage(prompt.length(), prompt.length()), model);
        }
    }

    /** Records statements; a transaction's statements land in {@code committed} only on commit. */
    static final class RecordingSqlDatabase implements SqlDatabase {
        final List<String> committed = new ArrayList<>();
        final List<String> rolledBack = new ArrayList<>();
        int transactionsStarted;
        boolean closed;

        @Override
        public SqlQueryResult query(String sql, List<Object> params) {
            if (sql.startsWith("SELECT")) {
                return new SqlQueryResult(List.of(Map.of("id", params.get(0), "name", "ada")), 1,
                        List.of(new SqlField("id", "INTEGER"), new SqlField("name", "VARCHAR")));
            }
            committed.add(sql);
            return SqlQueryResult.updated(1);
        }

        @Override
        public SqlTransaction transaction() {
            transactionsStarted++;
            List<String> pending = new ArrayList<>();
            return new SqlTransaction() {
                @Override
                public SqlQueryResult query(String sql, List<Object> params) {
                    pending.add(sql);
                    return SqlQueryResult.updated(2);
                }

                @Override
                public void commit() {
                    committed.addAll(pending);
                }

                @Override
                public void rollback() {
                    rolledBack.addAll(pending);
                }
            };
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    static final class FixedConfig implements ConfigProvider {
        @Override
        public Object getConfig(String productId, String profileId) {
            if (!productId.equals("search")) return null;
            return Map.of("profile", profileId == null ? "default" : profileId, "limit", 10);
        }

        @Override
        public Map<String, Object> getRawConfig() {
            return Map.of("search", Map.of("limit", 10));
        }
    }
}
