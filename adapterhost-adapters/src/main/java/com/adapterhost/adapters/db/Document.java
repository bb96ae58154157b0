package com.adapterhost.adapters.db;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Stored document: id, creation and update timestamps (epoch millis) and user fields.
 */
public final class Document {

    public static final String ID = "id";
    public static final String CREATED_AT = "createdAt";
    public static final String UPDATED_AT = "updatedAt";

    private final String id;
    private final long createdAt;
    private final long updatedAt;
    private final Map<String, Object> fields;

    @JsonCreator
    public Document(@JsonProperty("id") String id,
                    @JsonProperty("createdAt") long createdAt,
                    @JsonProperty("updatedAt") long updatedAt,
                    @JsonProperty("fields") Map<String, Object> fields) {
        this.id = Objects.requireNonNull(id, "id");
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
    }

    public String getId() {
        return id;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    /** Value of a user field or of {@code id}, {@code createdAt}, {@code updatedAt}. */
    public Object get(String name) {
        switch (name) {
            case ID:
                return id;
            case CREATED_AT:
                return createdAt;
            case UPDATED_AT:
                return updatedAt;
            default:
                return fields.get(name);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Document)) return false;
        Document that = (Document) o;
        return createdAt == that.createdAt && updatedAt == that.updatedAt
                && id.equals(that.id) && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, createdAt, updatedAt, fields);
    }

    @Override
    public String toString() {
        return "Document{id=" + id + ", fields=" + fields + "}";
    }
}
