package com.adapterhost.internal.adapters.vector;

import com.adapterhost.adapters.ResourceCleanup;
import com.adapterhost.adapters.vector.VectorFilter;
import com.adapterhost.adapters.vector.VectorRecord;
import com.adapterhost.adapters.vector.VectorSearchResult;
import com.adapterhost.adapters.vector.VectorStore;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * Brute-force vector index scored by cosine similarity. All vectors in one store share the dimension
 * of the first record upserted (or the configured one).
 */
public final class InMemoryVectorStore implements VectorStore, ResourceCleanup {

    private final Map<String, VectorRecord> records = new LinkedHashMap<>();
    private int dimensions;

    public InMemoryVectorStore() {
        this(0);
    }

    /** @param dimensions fixed dimension, or 0 to take it from the first upsert */
    public InMemoryVectorStore(int dimensions) {
        this.dimensions = dimensions;
    }

    @Override
    public synchronized List<VectorSearchResult> search(float[] query, int limit, VectorFilter filter) {
        Objects.requireNonNull(query, "query");
        if (limit <= 0) return List.of();
        checkDimensions(query);
        List<VectorSearchResult> hits = new ArrayList<>();
        for (VectorRecord record : records.values()) {
            if (filter != null && !accepts(filter, record.metadata())) continue;
            hits.add(new VectorSearchResult(record.id(), cosine(query, record.vector()), record.metadata()));
        }
        hits.sort(Comparator.comparingDouble(VectorSearchResult::score).reversed()
                .thenComparing(VectorSearchResult::id));
        return hits.size() > limit ? new ArrayList<>(hits.subList(0, limit)) : hits;
    }

    @Override
    public synchronized void upsert(List<VectorRecord> batch) {
        for (VectorRecord record : batch) {
            checkDimensions(record.vector());
        }
        for (VectorRecord record : batch) {
            records.put(record.id(), record);
        }
    }

    @Override
    public synchronized void delete(List<String> ids) {
        ids.forEach(records::remove);
    }

    @Override
    public synchronized long count() {
        return records.size();
    }

    @Override
    public synchronized List<VectorRecord> get(List<String> ids) {
        List<VectorRecord> out = new ArrayList<>();
        for (String id : ids) {
            VectorRecord record = records.get(id);
            if (record != null) out.add(record);
        }
        return out;
    }

    @Override
    public synchronized void clear() {
        records.clear();
    }

    @Override
    public void onExit() {
        clear();
    }

    private void checkDimensions(float[] vector) {
        if (dimensions == 0) {
            dimensions = vector.length;
        } else if (vector.length != dimensions) {
            throw new IllegalArgumentException("Vector has " + vector.length + " dimensions, store expects " + dimensions);
        }
    }

    static double cosine(float[] a, float[] b) {
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) return 0;
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static boolean accepts(VectorFilter filter, Map<String, Object> metadata) {
        Object actual = metadata.get(filter.field());
        Object expected = filter.value();
        switch (filter.op()) {
            case EQ:
                return same(actual, expected);
            case NE:
                return !same(actual, expected);
            case GT:
                return ordered(actual, expected, c -> c > 0);
            case GTE:
                return ordered(actual, expected, c -> c >= 0);
            case LT:
                return ordered(actual, expected, c -> c < 0);
            case LTE:
                return ordered(actual, expected, c -> c <= 0);
            case IN:
                return inCollection(actual, expected);
            case NIN:
                return !inCollection(actual, expected);
            default:
                return false;
        }
    }

    private static boolean inCollection(Object actual, Object expected) {
        if (!(expected instanceof Collection)) {
            throw new IllegalArgumentException("in/nin filter expects a list, got " + expected);
        }
        for (Object candidate : (Collection<?>) expected) {
            if (same(actual, candidate)) return true;
        }
        return false;
    }

    private static boolean same(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return decimal((Number) a).compareTo(decimal((Number) b)) == 0;
        }
        return Objects.equals(a, b);
    }

    /** Numbers and strings are ordered; any other pair satisfies no range condition. */
    private static boolean ordered(Object a, Object b, IntPredicate test) {
        if (a instanceof Number && b instanceof Number) {
            return test.test(decimal((Number) a).compareTo(decimal((Number) b)));
        }
        if (a instanceof String && b instanceof String) {
            return test.test(((String) a).compareTo((String) b));
        }
        return false;
    }

    private static BigDecimal decimal(Number n) {
        if (n instanceof Double || n instanceof Float) return BigDecimal.valueOf(n.doubleValue());
        return new BigDecimal(n.toString());
    }
}
