package com.adapterhost.adapters.storage;

import java.util.List;

/**
 * Blob storage addressed by relative, slash-separated paths.
 */
public interface Storage {

    /** Returns the content, or null when nothing is stored at {@code path}. */
    byte[] read(String path);

    void write(String path, byte[] data);

    void delete(String path);

    boolean exists(String path);

    /** Paths starting with {@code prefix} (all paths when null), sorted. */
    List<String> list(String prefix);
}
