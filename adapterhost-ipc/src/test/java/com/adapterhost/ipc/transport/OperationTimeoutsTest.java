package com.adapterhost.ipc.transport;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class OperationTimeoutsTest {

    private final OperationTimeouts timeouts = OperationTimeouts.defaults();

    @Test
    void lookup_prefersExactEntry() {
        assertEquals(Duration.ofSeconds(5), timeouts.lookup("cache", "get"));
        assertEquals(Duration.ofSeconds(120), timeouts.lookup("embeddings", "embedBatch"));
        assertEquals(Duration.ofSeconds(90), timeouts.lookup("llm", "complete"));
        assertEquals(Duration.ofSeconds(10), timeouts.lookup("database.sql", "close"));
    }

    @Test
    void lookup_fallsBackToAdapterWildcard() {
        assertEquals(Duration.ofSeconds(10), timeouts.lookup("cache", "ttl"));
        assertEquals(Duration.ofSeconds(30), timeouts.lookup("database.document", "find"));
        assertEquals(Duration.ofSeconds(30), timeouts.lookup("database.sql", "transaction.commit"));
        assertEquals(Duration.ofSeconds(5), timeouts.lookup("config", "getRawConfig"));
    }

    @Test
    void lookup_fallsBackToGlobalDefault() {
        assertEquals(Duration.ofSeconds(30), timeouts.lookup("unknownAdapter", "anything"));
    }

    @Test
    void resolve_explicitBeatsConfiguredBeatsTable() {
        Duration explicit = Duration.ofMillis(250);
        Duration configured = Duration.ofSeconds(2);

        assertEquals(explicit, timeouts.resolve("cache", "get", explicit, configured));
        assertEquals(configured, timeouts.resolve("cache", "get", null, configured));
        assertEquals(Duration.ofSeconds(5), timeouts.resolve("cache", "get", null, null));
    }

    @Test
    void with_overridesSingleEntry() {
        OperationTimeouts custom = timeouts.with("storage.read", Duration.ofSeconds(1));

        assertEquals(Duration.ofSeconds(1), custom.lookup("storage", "read"));
        assertEquals(Duration.ofSeconds(15), timeouts.lookup("storage", "read"));
    }

    @Test
    void of_withoutGlobalEntryUsesThirtySeconds() {
        OperationTimeouts custom = OperationTimeouts.of(Map.of("cache.*", Duration.ofSeconds(1)));

        assertEquals(Duration.ofSeconds(1), custom.lookup("cache", "get"));
        assertEquals(OperationTimeouts.GLOBAL_DEFAULT, custom.lookup("storage", "read"));
    }
}
