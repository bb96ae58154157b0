package com.adapterhost.adapters.cache;

/**
 * Key/value cache. Values are any wire-serializable object.
 */
public interface Cache {

    /** Returns the cached value, or null when absent or expired. */
    Object get(String key);

    /**
     * Stores a value.
     *
     * @param ttlMillis time to live in milliseconds, or null for no expiry
     */
    void set(String key, Object value, Long ttlMillis);

    default void set(String key, Object value) {
        set(key, value, null);
    }

    void delete(String key);

    /**
     * Removes entries whose key matches a glob pattern ({@code *} matches any run of characters),
     * or every entry when {@code pattern} is null.
     */
    void clear(String pattern);

    default void clear() {
        clear(null);
    }
}
