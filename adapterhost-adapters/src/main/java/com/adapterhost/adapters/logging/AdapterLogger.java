package com.adapterhost.adapters.logging;

import java.util.Map;

/**
 * Structured logger capability. Implementations usually also implement
 * {@link com.adapterhost.adapters.extension.Hookable} with hook {@value #ON_LOG} so extensions can
 * receive every {@link LogRecord}.
 */
public interface AdapterLogger {

    String ON_LOG = "onLog";

    void log(LogLevel level, String message, Map<String, Object> fields);

    default void trace(String message, Map<String, Object> fields) {
        log(LogLevel.TRACE, message, fields);
    }

    default void debug(String message, Map<String, Object> fields) {
        log(LogLevel.DEBUG, message, fields);
    }

    default void info(String message, Map<String, Object> fields) {
        log(LogLevel.INFO, message, fields);
    }

    default void warn(String message, Map<String, Object> fields) {
        log(LogLevel.WARN, message, fields);
    }

    default void error(String message, Map<String, Object> fields) {
        log(LogLevel.ERROR, message, fields);
    }
}
