package com.adapterhost.adapters;

/**
 * Canonical adapter tokens. Operators may configure adapters under any token; proxies and the
 * built-in modules default to these.
 */
public final class AdapterTokens {

    public static final String CACHE = "cache";
    public static final String DOCUMENT_DATABASE = "database.document";
    public static final String VECTOR_STORE = "vectorStore";
    public static final String EMBEDDINGS = "embeddings";
    public static final String STORAGE = "storage";
    public static final String LOGGER = "logger";
    public static final String LOG_BUFFER = "logRingBuffer";
    public static final String LOG_PERSISTENCE = "logPersistence";
    public static final String LLM = "llm";
    public static final String SQL_DATABASE = "database.sql";
    public static final String CONFIG = "config";

    private AdapterTokens() {
    }
}
