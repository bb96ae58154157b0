package com.adapterhost.adapters.vector;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** One search hit; {@code score} is higher for closer matches. */
public record VectorSearchResult(String id, double score, Map<String, Object> metadata) {

    public VectorSearchResult {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }
}
