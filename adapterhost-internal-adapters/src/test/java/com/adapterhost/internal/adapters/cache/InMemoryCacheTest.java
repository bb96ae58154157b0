package com.adapterhost.internal.adapters.cache;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryCacheTest {

    private final AtomicLong now = new AtomicLong(1_000);
    private final InMemoryCache cache = new InMemoryCache(null, now::get);

    @Test
    void get_returnsStoredValueUntilTtlElapses() {
        cache.set("k", "v", 100L);
        now.addAndGet(99);
        assertEquals("v", cache.get("k"));
        now.addAndGet(1);
        assertNull(cache.get("k"));
    }

    @Test
    void set_withoutTtlUsesDefault() {
        InMemoryCache withDefault = new InMemoryCache(50L, now::get);
        withDefault.set("k", 1);
        now.addAndGet(50);
        assertNull(withDefault.get("k"));
    }

    @Test
    void set_withoutAnyTtlNeverExpires() {
        cache.set("k", "v");
        now.addAndGet(Long.MAX_VALUE / 2);
        assertEquals("v", cache.get("k"));
    }

    @Test
    void clear_removesOnlyKeysMatchingGlob() {
        cache.set("user:1", 1);
        cache.set("user:2", 2);
        cache.set("session:1", 3);
        cache.set("user.x", 4);

        cache.clear("user:*");

        assertNull(cache.get("user:1"));
        assertNull(cache.get("user:2"));
        assertEquals(3, cache.get("session:1"));
        assertEquals(4, cache.get("user.x"));
    }

    @Test
    void clear_questionMarkMatchesOneCharacter() {
        cache.set("a1", 1);
        cache.set("a12", 2);
        cache.clear("a?");
        assertNull(cache.get("a1"));
        assertEquals(2, cache.get("a12"));
    }

    @Test
    void clear_nullClearsEverything() {
        cache.set("a", 1);
        cache.set("b", 2);
        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test
    void globToRegex_quotesRegexCharacters() {
        assertTrue(InMemoryCache.globToRegex("a.b*").matcher("a.bcd").matches());
        assertTrue(!InMemoryCache.globToRegex("a.b*").matcher("axbcd").matches());
    }

    @Test
    void onExit_dropsEntries() {
        cache.set("a", 1);
        cache.onExit();
        assertNull(cache.get("a"));
    }
}
