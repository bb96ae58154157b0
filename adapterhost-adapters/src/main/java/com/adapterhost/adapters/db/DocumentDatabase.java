package com.adapterhost.adapters.db;

import java.util.List;
import java.util.Map;

/**
 * Document database with Mongo-style filters.
 * <p>
 * Filters map a field name to either a plain value (equality) or an operator object such as
 * {@code {"$gt": 5}}. Supported operators: {@code $eq $ne $gt $gte $lt $lte $in $nin}.
 * Updates are either operator objects ({@code $set $unset $inc}) or plain field maps merged into
 * the document.
 */
public interface DocumentDatabase {

    List<Document> find(String collection, Map<String, Object> filter, FindOptions options);

    default List<Document> find(String collection, Map<String, Object> filter) {
        return find(collection, filter, null);
    }

    /** Returns the document, or null when no document has that id. */
    Document findById(String collection, String id);

    /** Inserts a document. An {@code id} field is used as the document id, otherwise one is generated. */
    Document insertOne(String collection, Map<String, Object> fields);

    /** @return number of documents updated */
    long updateMany(String collection, Map<String, Object> filter, Map<String, Object> update);

    /** Returns the updated document, or null when no document has that id. */
    Document updateById(String collection, String id, Map<String, Object> update);

    /** @return number of documents deleted */
    long deleteMany(String collection, Map<String, Object> filter);

    boolean deleteById(String collection, String id);

    long count(String collection, Map<String, Object> filter);
}
