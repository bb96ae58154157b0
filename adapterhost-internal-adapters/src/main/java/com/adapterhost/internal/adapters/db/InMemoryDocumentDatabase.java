package com.adapterhost.internal.adapters.db;

import com.adapterhost.adapters.ResourceCleanup;
import com.adapterhost.adapters.db.Document;
import com.adapterhost.adapters.db.DocumentDatabase;
import com.adapterhost.adapters.db.FindOptions;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.LongSupplier;

/**
 * Document store kept in memory. Collections are created on first insert.
 * <p>
 * Updates are either operator objects ({@code $set}, {@code $unset}, {@code $inc}) or a plain map of
 * fields to overwrite. {@code id} and {@code createdAt} never change; {@code updatedAt} is set on every
 * update.
 */
public final class InMemoryDocumentDatabase implements DocumentDatabase, ResourceCleanup {

    private final Map<String, Map<String, Document>> collections = new LinkedHashMap<>();
    private final LongSupplier clock;

    public InMemoryDocumentDatabase() {
        this(System::currentTimeMillis);
    }

    public InMemoryDocumentDatabase(LongSupplier clock) {
        this.clock = clock;
    }

    @Override
    public synchronized List<Document> find(String collection, Map<String, Object> filter, FindOptions options) {
        List<Document> matches = new ArrayList<>();
        for (Document doc : docs(collection).values()) {
            if (DocumentFilters.matches(doc, filter)) matches.add(doc);
        }
        FindOptions opts = options != null ? options : FindOptions.defaults();
        if (opts.sort() != null && !opts.sort().isEmpty()) {
            matches.sort(comparator(opts.sort()));
        }
        int from = Math.min(opts.skip() != null ? Math.max(0, opts.skip()) : 0, matches.size());
        int to = opts.limit() != null && opts.limit() >= 0 ? Math.min(matches.size(), from + opts.limit()) : matches.size();
        return new ArrayList<>(matches.subList(from, to));
    }

    @Override
    public synchronized Document findById(String collection, String id) {
        return docs(collection).get(id);
    }

    @Override
    public synchronized Document insertOne(String collection, Map<String, Object> fields) {
        Map<String, Object> values = fields != null ? new LinkedHashMap<>(fields) : new LinkedHashMap<>();
        Object requestedId = values.remove(Document.ID);
        values.remove(Document.CREATED_AT);
        values.remove(Document.UPDATED_AT);
        String id = requestedId != null ? requestedId.toString() : UUID.randomUUID().toString();
        Map<String, Document> docs = collections.computeIfAbsent(collection, c -> new LinkedHashMap<>());
        if (docs.containsKey(id)) {
            throw new IllegalArgumentException("Duplicate id " + id + " in collection " + collection);
        }
        long now = clock.getAsLong();
        Document doc = new Document(id, now, now, values);
        docs.put(id, doc);
        return doc;
    }

    @Override
    public synchronized long updateMany(String collection, Map<String, Object> filter, Map<String, Object> update) {
        Map<String, Document> docs = docs(collection);
        long updated = 0;
        for (Document doc : new ArrayList<>(docs.values())) {
            if (DocumentFilters.matches(doc, filter)) {
                docs.put(doc.getId(), applyUpdate(doc, update));
                updated++;
            }
        }
        return updated;
    }

    @Override
    public synchronized Document updateById(String collection, String id, Map<String, Object> update) {
        Map<String, Document> docs = docs(collection);
        Document doc = docs.get(id);
        if (doc == null) return null;
        Document next = applyUpdate(doc, update);
        docs.put(id, next);
        return next;
    }

    @Override
    public synchronized long deleteMany(String collection, Map<String, Object> filter) {
        Map<String, Document> docs = docs(collection);
        int before = docs.size();
        docs.values().removeIf(doc -> DocumentFilters.matches(doc, filter));
        return before - docs.size();
    }

    @Override
    public synchronized boolean deleteById(String collection, String id) {
        return docs(collection).remove(id) != null;
    }

    @Override
    public synchronized long count(String collection, Map<String, Object> filter) {
        long n = 0;
        for (Document doc : docs(collection).values()) {
            if (DocumentFilters.matches(doc, filter)) n++;
        }
        return n;
    }

    @Override
    public synchronized void onExit() {
        collections.clear();
    }

    private Map<String, Document> docs(String collection) {
        Map<String, Document> docs = collections.get(collection);
        return docs != null ? docs : new LinkedHashMap<>();
    }

    @SuppressWarnings("unchecked")
    private Document applyUpdate(Document doc, Map<String, Object> update) {
        Map<String, Object> fields = new LinkedHashMap<>(doc.getFields());
        if (update != null && DocumentFilters.isOperatorObject(update)) {
            for (Map.Entry<String, Object> op : update.entrySet()) {
                if (!(op.getValue() instanceof Map)) {
                    throw new IllegalArgumentException(op.getKey() + " expects an object");
                }
                Map<String, Object> args = (Map<String, Object>) op.getValue();
                switch (op.getKey()) {
                    case "$set":
                        fields.putAll(withoutReserved(args));
                        break;
                    case "$unset":
                        withoutReserved(args).keySet().forEach(fields::remove);
                        break;
                    case "$inc":
                        for (Map.Entry<String, Object> inc : withoutReserved(args).entrySet()) {
                            fields.put(inc.getKey(), increment(fields.get(inc.getKey()), inc.getValue()));
                        }
                        break;
                    default:
                        throw new IllegalArgumentException("Unsupported update operator: " + op.getKey());
                }
            }
        } else if (update != null) {
            fields.putAll(withoutReserved(update));
        }
        long now = Math.max(clock.getAsLong(), doc.getUpdatedAt());
        return new Document(doc.getId(), doc.getCreatedAt(), now, fields);
    }

    private static Map<String, Object> withoutReserved(Map<String, Object> values) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.remove(Document.ID);
        copy.remove(Document.CREATED_AT);
        copy.remove(Document.UPDATED_AT);
        return copy;
    }

    private static Number increment(Object current, Object by) {
        if (!(by instanceof Number)) {
            throw new IllegalArgumentException("$inc expects a number, got " + by);
        }
        if (current != null && !(current instanceof Number)) {
            throw new IllegalArgumentException("$inc on non-numeric field value " + current);
        }
        Number base = current != null ? (Number) current : 0;
        if (isIntegral(base) && isIntegral((Number) by)) {
            return base.longValue() + ((Number) by).longValue();
        }
        BigDecimal sum = DocumentFilters.toDecimal(base).add(DocumentFilters.toDecimal((Number) by));
        return sum.doubleValue();
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
    }

    private static Comparator<Document> comparator(Map<String, Integer> sort) {
        Comparator<Document> result = null;
        for (Map.Entry<String, Integer> key : sort.entrySet()) {
            String field = key.getKey();
            Comparator<Document> next = (a, b) -> DocumentFilters.sortOrder(a.get(field), b.get(field));
            if (key.getValue() != null && key.getValue() < 0) next = next.reversed();
            result = result == null ? next : result.thenComparing(next);
        }
        return result;
    }
}
