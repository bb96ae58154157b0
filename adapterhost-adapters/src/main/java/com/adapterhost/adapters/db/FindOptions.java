package com.adapterhost.adapters.db;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Paging and ordering for {@link DocumentDatabase#find}. {@code sort} maps field name to
 * {@code 1} (ascending) or {@code -1} (descending), applied in map order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FindOptions(Integer limit, Integer skip, Map<String, Integer> sort) {

    public FindOptions {
        sort = sort != null ? new LinkedHashMap<>(sort) : null;
    }

    public static FindOptions defaults() {
        return new FindOptions(null, null, null);
    }

    public FindOptions withLimit(int limit) {
        return new FindOptions(limit, skip, sort);
    }

    public FindOptions withSkip(int skip) {
        return new FindOptions(limit, skip, sort);
    }

    public FindOptions sortedBy(String field, int direction) {
        Map<String, Integer> next = sort != null ? new LinkedHashMap<>(sort) : new LinkedHashMap<>();
        next.put(field, direction < 0 ? -1 : 1);
        return new FindOptions(limit, skip, next);
    }
}
