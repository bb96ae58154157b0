package com.adapterhost.internal.adapters.logging;

import com.adapterhost.adapters.AdapterTokens;
import com.adapterhost.adapters.db.DocumentDatabase;
import com.adapterhost.adapters.logging.AdapterLogger;
import com.adapterhost.adapters.logging.LogLevel;
import com.adapterhost.adapters.manifest.AdapterManifest;
import com.adapterhost.loader.AdapterDependencies;
import com.adapterhost.loader.AdapterModule;
import com.adapterhost.loader.AdapterSettings;

import java.util.Locale;

/**
 * Requires a document database under alias {@code db}. Settings: {@code collection} (default
 * {@code logs}) and {@code minLevel} (default {@code trace}).
 */
public final class LogPersistenceModule implements AdapterModule {

    public static final String ID = "log-persistence";
    public static final String DB_ALIAS = "db";

    private static final AdapterManifest MANIFEST = AdapterManifest.builder(ID, AdapterTokens.LOG_PERSISTENCE)
            .name("Log persistence")
            .version("1.0.0")
            .description("Stores log records in a document collection")
            .requires(AdapterTokens.DOCUMENT_DATABASE, DB_ALIAS)
            .extendsHook(AdapterTokens.LOGGER, AdapterLogger.ON_LOG, LogPersistence.WRITE, 5)
            .build();

    @Override
    public AdapterManifest manifest() {
        return MANIFEST;
    }

    @Override
    public Object create(AdapterSettings settings, AdapterDependencies dependencies) {
        DocumentDatabase db = dependencies.get(DB_ALIAS, DocumentDatabase.class);
        LogLevel minLevel = LogLevel.valueOf(settings.getString("minLevel", "trace").toUpperCase(Locale.ROOT));
        return new LogPersistence(db, settings.getString("collection", LogPersistence.DEFAULT_COLLECTION), minLevel);
    }
}
