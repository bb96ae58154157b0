package com.adapterhost.adapters.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one statement. Queries fill {@code rows} (column label to value, in select order) and
 * {@code fields}; updates leave both empty and report the affected row count.
 */
public record SqlQueryResult(List<Map<String, Object>> rows, long rowCount, List<SqlField> fields) {

    public SqlQueryResult {
        List<Map<String, Object>> copy = new ArrayList<>();
        if (rows != null) {
            for (Map<String, Object> row : rows) {
                copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
            }
        }
        rows = Collections.unmodifiableList(copy);
        fields = fields != null ? List.copyOf(fields) : List.of();
    }

    public static SqlQueryResult updated(long rowCount) {
        return new SqlQueryResult(List.of(), rowCount, List.of());
    }
}
