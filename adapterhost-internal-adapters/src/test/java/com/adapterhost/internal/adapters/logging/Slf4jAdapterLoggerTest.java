package com.adapterhost.internal.adapters.logging;

import com.adapterhost.adapters.logging.LogLevel;
import com.adapterhost.adapters.logging.LogRecord;
import com.adapterhost.internal.adapters.db.InMemoryDocumentDatabase;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Slf4jAdapterLoggerTest {

    private final Slf4jAdapterLogger logger = new Slf4jAdapterLogger("adapters.test", () -> 42L);

    @Test
    void log_firesRecordToHookListenersInOrder() {
        List<String> seen = new ArrayList<>();
        logger.registerHook("onLog", r -> seen.add("first:" + ((LogRecord) r).message()));
        logger.registerHook("onLog", r -> seen.add("second:" + ((LogRecord) r).message()));

        logger.warn("disk low", Map.of("free", 3));

        assertEquals(List.of("first:disk low", "second:disk low"), seen);
    }

    @Test
    void log_recordCarriesLevelFieldsTimestampAndSource() {
        List<LogRecord> seen = new ArrayList<>();
        logger.registerHook("onLog", r -> seen.add((LogRecord) r));

        logger.log(LogLevel.DEBUG, "hello", Map.of("k", "v"));

        LogRecord record = seen.get(0);
        assertEquals(LogLevel.DEBUG, record.level());
        assertEquals(Map.of("k", "v"), record.fields());
        assertEquals(42L, record.timestamp());
        assertEquals("adapters.test", record.source());
    }

    @Test
    void log_failingListenerDoesNotStopOthers() {
        List<LogRecord> seen = new ArrayList<>();
        logger.registerHook("onLog", r -> {
            throw new IllegalStateException("boom");
        });
        logger.registerHook("onLog", r -> seen.add((LogRecord) r));

        logger.error("failed", null);

        assertEquals(1, seen.size());
    }

    @Test
    void registerHook_unknownHookIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> logger.registerHook("onFlush", r -> { }));
        assertEquals(0, logger.listenerCount());
    }

    @Test
    void ringBuffer_keepsMostRecentRecords() {
        LogRingBuffer buffer = new LogRingBuffer(2);
        logger.registerHook("onLog", buffer.extensionMethod(LogRingBuffer.APPEND).orElseThrow());

        logger.info("one", null);
        logger.info("two", null);
        logger.info("three", null);

        List<LogRecord> snapshot = buffer.snapshot();
        assertEquals(2, snapshot.size());
        assertEquals("two", snapshot.get(0).message());
        assertEquals("three", snapshot.get(1).message());
        assertTrue(buffer.extensionMethod("flush").isEmpty());
    }

    @Test
    void persistence_insertsRecordsAtOrAboveMinLevel() {
        InMemoryDocumentDatabase db = new InMemoryDocumentDatabase(() -> 1L);
        LogPersistence persistence = new LogPersistence(db, "logs", LogLevel.INFO);
        logger.registerHook("onLog", persistence.extensionMethod(LogPersistence.WRITE).orElseThrow());

        logger.debug("noise", null);
        logger.info("started", Map.of("port", 8080));

        assertEquals(1, db.count("logs", null));
        assertEquals("started", db.find("logs", Map.of("level", "info")).get(0).get("message"));
    }
}
