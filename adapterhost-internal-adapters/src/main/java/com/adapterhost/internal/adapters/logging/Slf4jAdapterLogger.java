package com.adapterhost.internal.adapters.logging;

import com.adapterhost.adapters.extension.Hookable;
import com.adapterhost.adapters.logging.AdapterLogger;
import com.adapterhost.adapters.logging.LogLevel;
import com.adapterhost.adapters.logging.LogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Logger adapter writing to SLF4J with fields as key/value pairs. Every record, whatever its level,
 * is also handed to the {@value AdapterLogger#ON_LOG} hook listeners in registration order; a failing
 * listener is logged and does not stop the others.
 */
public final class Slf4jAdapterLogger implements AdapterLogger, Hookable {

    private static final Logger log = LoggerFactory.getLogger(Slf4jAdapterLogger.class);

    private final Logger target;
    private final String source;
    private final LongSupplier clock;
    private final List<Consumer<Object>> listeners = new CopyOnWriteArrayList<>();

    public Slf4jAdapterLogger(String loggerName) {
        this(loggerName, System::currentTimeMillis);
    }

    public Slf4jAdapterLogger(String loggerName, LongSupplier clock) {
        this.source = Objects.requireNonNull(loggerName, "loggerName");
        this.target = LoggerFactory.getLogger(loggerName);
        this.clock = clock;
    }

    @Override
    public void log(LogLevel level, String message, Map<String, Object> fields) {
        LogRecord record = new LogRecord(clock.getAsLong(), level != null ? level : LogLevel.INFO, message, fields, source);
        LoggingEventBuilder event = target.atLevel(toSlf4j(record.level()));
        for (Map.Entry<String, Object> field : record.fields().entrySet()) {
            event = event.addKeyValue(field.getKey(), field.getValue());
        }
        event.log(record.message());
        for (Consumer<Object> listener : listeners) {
            try {
                listener.accept(record);
            } catch (RuntimeException e) {
                log.warn("onLog listener failed: {}", e.getMessage(), e);
            }
        }
    }

    @Override
    public Set<String> hookNames() {
        return Set.of(ON_LOG);
    }

    @Override
    public void registerHook(String hookName, Consumer<Object> listener) {
        if (!ON_LOG.equals(hookName)) {
            throw new IllegalArgumentException("Unknown hook '" + hookName + "'; logger exposes " + ON_LOG);
        }
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    int listenerCount() {
        return listeners.size();
    }

    static Level toSlf4j(LogLevel level) {
        switch (level) {
            case TRACE:
                return Level.TRACE;
            case DEBUG:
                return Level.DEBUG;
            case WARN:
                return Level.WARN;
            case ERROR:
                return Level.ERROR;
            default:
                return Level.INFO;
        }
    }
}
