package com.adapterhost.proxy;

import com.adapterhost.adapters.AdapterTokens;
import com.adapterhost.adapters.cache.Cache;
import com.adapterhost.adapters.config.ConfigProvider;
import com.adapterhost.adapters.db.DocumentDatabase;
import com.adapterhost.adapters.embeddings.Embeddings;
import com.adapterhost.adapters.llm.Llm;
import com.adapterhost.adapters.logging.AdapterLogger;
import com.adapterhost.adapters.sql.SqlDatabase;
import com.adapterhost.adapters.storage.Storage;
import com.adapterhost.adapters.vector.VectorStore;
import com.adapterhost.codec.WireCodec;
import com.adapterhost.ipc.transport.AdapterTransport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Proxies for every RPC-exposed capability, sharing one transport. Tokens default to the canonical
 * ones in {@link AdapterTokens}; a host that registered a capability under another token maps it
 * with {@link Builder#token(String, String)}.
 */
public final class ProxyAdapters {

    private final Cache cache;
    private final DocumentDatabase documentDatabase;
    private final VectorStore vectorStore;
    private final Embeddings embeddings;
    private final Storage storage;
    private final AdapterLogger logger;
    private final Llm llm;
    private final SqlDatabase sqlDatabase;
    private final ConfigProvider config;
    private final Map<String, RemoteAdapter> byToken;

    private ProxyAdapters(Builder b) {
        CacheProxy cacheProxy = new CacheProxy(b.tokenFor(AdapterTokens.CACHE), b.transport, b.codec, null);
        DocumentDatabaseProxy dbProxy = new DocumentDatabaseProxy(b.tokenFor(AdapterTokens.DOCUMENT_DATABASE), b.transport, b.codec, null);
        VectorStoreProxy vectorProxy = new VectorStoreProxy(b.tokenFor(AdapterTokens.VECTOR_STORE), b.transport, b.codec, null);
        EmbeddingsProxy embeddingsProxy = new EmbeddingsProxy(b.tokenFor(AdapterTokens.EMBEDDINGS), b.transport, b.codec, null);
        StorageProxy storageProxy = new StorageProxy(b.tokenFor(AdapterTokens.STORAGE), b.transport, b.codec, null);
        LoggerProxy loggerProxy = new LoggerProxy(b.tokenFor(AdapterTokens.LOGGER), b.transport, b.codec, null);
        LlmProxy llmProxy = new LlmProxy(b.tokenFor(AdapterTokens.LLM), b.transport, b.codec, null);
        SqlDatabaseProxy sqlProxy = new SqlDatabaseProxy(b.tokenFor(AdapterTokens.SQL_DATABASE), b.transport, b.codec, null);
        ConfigProxy configProxy = new ConfigProxy(b.tokenFor(AdapterTokens.CONFIG), b.transport, b.codec, null);

        Map<String, RemoteAdapter> all = new LinkedHashMap<>();
        for (RemoteAdapter proxy : new RemoteAdapter[]{cacheProxy, dbProxy, vectorProxy, embeddingsProxy, storageProxy,
                loggerProxy, llmProxy, sqlProxy, configProxy}) {
            all.put(proxy.getToken(), proxy);
        }
        this.cache = cacheProxy;
        this.documentDatabase = dbProxy;
        this.vectorStore = vectorProxy;
        this.embeddings = embeddingsProxy;
        this.storage = storageProxy;
        this.logger = loggerProxy;
        this.llm = llmProxy;
        this.sqlDatabase = sqlProxy;
        this.config = configProxy;
        this.byToken = Collections.unmodifiableMap(all);
    }

    public static ProxyAdapters create(AdapterTransport transport, WireCodec codec) {
        return builder(transport, codec).build();
    }

    public static Builder builder(AdapterTransport transport, WireCodec codec) {
        return new Builder(transport, codec);
    }

    public Cache cache() {
        return cache;
    }

    public DocumentDatabase documentDatabase() {
        return documentDatabase;
    }

    public VectorStore vectorStore() {
        return vectorStore;
    }

    public Embeddings embeddings() {
        return embeddings;
    }

    public Storage storage() {
        return storage;
    }

    public AdapterLogger logger() {
        return logger;
    }

    public Llm llm() {
        return llm;
    }

    public SqlDatabase sqlDatabase() {
        return sqlDatabase;
    }

    public ConfigProvider config() {
        return config;
    }

    /** Proxy registered under {@code token}, or null. */
    public RemoteAdapter get(String token) {
        return byToken.get(token);
    }

    public Map<String, RemoteAdapter> asMap() {
        return byToken;
    }

    public static final class Builder {
        private final AdapterTransport transport;
        private final WireCodec codec;
        private final Map<String, String> tokens = new LinkedHashMap<>();

        private Builder(AdapterTransport transport, WireCodec codec) {
            this.transport = Objects.requireNonNull(transport, "transport");
            this.codec = Objects.requireNonNull(codec, "codec");
        }

        /** Sends calls for {@code canonicalToken} to the host adapter registered as {@code hostToken}. */
        public Builder token(String canonicalToken, String hostToken) {
            tokens.put(canonicalToken, hostToken);
            return this;
        }

        public ProxyAdapters build() {
            return new ProxyAdapters(this);
        }

        private String tokenFor(String canonical) {
            return tokens.getOrDefault(canonical, canonical);
        }
    }
}
