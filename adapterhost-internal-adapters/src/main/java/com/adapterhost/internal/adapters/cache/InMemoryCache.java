package com.adapterhost.internal.adapters.cache;

import com.adapterhost.adapters.ResourceCleanup;
import com.adapterhost.adapters.cache.Cache;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;
import java.util.regex.Pattern;

/**
 * Process-local cache. Entries expire lazily on read; {@link #clear(String)} takes a glob where
 * {@code *} matches any run of characters and {@code ?} one character.
 */
public final class InMemoryCache implements Cache, ResourceCleanup {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Long defaultTtlMillis;
    private final LongSupplier clock;

    public InMemoryCache() {
        this(null, System::currentTimeMillis);
    }

    /** @param defaultTtlMillis applied when {@code set} passes no TTL; null for no expiry */
    public InMemoryCache(Long defaultTtlMillis, LongSupplier clock) {
        this.defaultTtlMillis = defaultTtlMillis;
        this.clock = clock;
    }

    @Override
    public Object get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) return null;
        if (entry.isExpired(clock.getAsLong())) {
            entries.remove(key, entry);
            return null;
        }
        return entry.value;
    }

    @Override
    public void set(String key, Object value, Long ttlMillis) {
        Long ttl = ttlMillis != null ? ttlMillis : defaultTtlMillis;
        long expiresAt = ttl != null && ttl > 0 ? clock.getAsLong() + ttl : Long.MAX_VALUE;
        entries.put(key, new Entry(value, expiresAt));
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    @Override
    public void clear(String pattern) {
        if (pattern == null || pattern.equals("*")) {
            entries.clear();
            return;
        }
        Pattern glob = globToRegex(pattern);
        entries.keySet().removeIf(key -> glob.matcher(key).matches());
    }

    public int size() {
        long now = clock.getAsLong();
        entries.values().removeIf(e -> e.isExpired(now));
        return entries.size();
    }

    @Override
    public void onExit() {
        entries.clear();
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static final class Entry {
        final Object value;
        final long expiresAt;

        Entry(Object value, long expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        boolean isExpired(long now) {
            return now >= expiresAt;
        }
    }
}
