package com.adapterhost.adapters.vector;

import java.util.List;

/**
 * Vector index with metadata filtering.
 */
public interface VectorStore {

    /**
     * Nearest neighbours of {@code query}, best first.
     *
     * @param filter metadata filter, or null
     */
    List<VectorSearchResult> search(float[] query, int limit, VectorFilter filter);

    /** Inserts or replaces records by id. */
    void upsert(List<VectorRecord> records);

    void delete(List<String> ids);

    long count();

    /** Records for the ids that exist, in request order. */
    List<VectorRecord> get(List<String> ids);

    /** Removes every record. */
    void clear();
}
