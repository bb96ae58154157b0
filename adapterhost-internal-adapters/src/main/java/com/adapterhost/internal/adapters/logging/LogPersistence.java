package com.adapterhost.internal.adapters.logging;

import com.adapterhost.adapters.db.DocumentDatabase;
import com.adapterhost.adapters.extension.ExtensionAdapter;
import com.adapterhost.adapters.logging.LogLevel;
import com.adapterhost.adapters.logging.LogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Writes log records at or above a minimum level into a document collection. Attaches to the
 * logger's {@code onLog} hook through its {@code write} method.
 */
public final class LogPersistence implements ExtensionAdapter {

    private static final Logger log = LoggerFactory.getLogger(LogPersistence.class);

    public static final String WRITE = "write";
    public static final String DEFAULT_COLLECTION = "logs";

    private final DocumentDatabase database;
    private final String collection;
    private final LogLevel minLevel;

    public LogPersistence(DocumentDatabase database, String collection, LogLevel minLevel) {
        this.database = database;
        this.collection = collection;
        this.minLevel = minLevel != null ? minLevel : LogLevel.TRACE;
    }

    public void write(LogRecord record) {
        if (!record.level().isAtLeast(minLevel)) return;
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("timestamp", record.timestamp());
        doc.put("level", record.level().name().toLowerCase(Locale.ROOT));
        doc.put("message", record.message());
        if (record.source() != null) doc.put("source", record.source());
        if (!record.fields().isEmpty()) doc.put("fields", record.fields());
        try {
            database.insertOne(collection, doc);
        } catch (RuntimeException e) {
            // Not through the adapter logger: that would re-enter this hook.
            log.warn("Cannot persist log record to {}: {}", collection, e.getMessage());
        }
    }

    public String getCollection() {
        return collection;
    }

    @Override
    public Optional<Consumer<Object>> extensionMethod(String methodName) {
        if (!WRITE.equals(methodName)) return Optional.empty();
        return Optional.of(value -> {
            if (value instanceof LogRecord) write((LogRecord) value);
        });
    }
}
