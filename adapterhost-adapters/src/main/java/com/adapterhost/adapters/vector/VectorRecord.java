package com.adapterhost.adapters.vector;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record VectorRecord(String id, float[] vector, Map<String, Object> metadata) {

    public VectorRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(vector, "vector");
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VectorRecord)) return false;
        VectorRecord that = (VectorRecord) o;
        return id.equals(that.id) && Arrays.equals(vector, that.vector) && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(id, metadata) + Arrays.hashCode(vector);
    }

    @Override
    public String toString() {
        return "VectorRecord{id=" + id + ", dims=" + vector.length + ", metadata=" + metadata + "}";
    }
}
