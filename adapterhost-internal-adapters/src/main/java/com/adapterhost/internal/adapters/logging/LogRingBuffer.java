package com.adapterhost.internal.adapters.logging;

import com.adapterhost.adapters.ResourceCleanup;
import com.adapterhost.adapters.extension.ExtensionAdapter;
import com.adapterhost.adapters.logging.LogRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Keeps the most recent log records in memory. Attaches to the logger's {@code onLog} hook through
 * its {@code append} method; anything that is not a {@link LogRecord} is ignored.
 */
public final class LogRingBuffer implements ExtensionAdapter, ResourceCleanup {

    public static final String APPEND = "append";

    private final int capacity;
    private final Deque<LogRecord> records = new ArrayDeque<>();

    public LogRingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    public synchronized void append(LogRecord record) {
        if (records.size() == capacity) {
            records.removeFirst();
        }
        records.addLast(record);
    }

    /** Oldest first. */
    public synchronized List<LogRecord> snapshot() {
        return new ArrayList<>(records);
    }

    public int getCapacity() {
        return capacity;
    }

    @Override
    public Optional<Consumer<Object>> extensionMethod(String methodName) {
        if (!APPEND.equals(methodName)) return Optional.empty();
        return Optional.of(value -> {
            if (value instanceof LogRecord) append((LogRecord) value);
        });
    }

    @Override
    public synchronized void onExit() {
        records.clear();
    }
}
