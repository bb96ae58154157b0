package com.adapterhost.adapters.logging;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One log event as delivered to {@code onLog} hook listeners.
 *
 * @param timestamp epoch millis
 * @param source    token or name of the component that logged it, may be null
 */
public record LogRecord(long timestamp, LogLevel level, String message, Map<String, Object> fields, String source) {

    public LogRecord {
        Objects.requireNonNull(level, "level");
        message = message != null ? message : "";
        fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
    }
}
