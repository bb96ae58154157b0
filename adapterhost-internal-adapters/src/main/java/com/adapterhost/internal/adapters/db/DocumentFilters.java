package com.adapterhost.internal.adapters.db;

import com.adapterhost.adapters.db.Document;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * Filter evaluation. A filter maps field names to either a plain value (equality) or an operator
 * object such as {@code {"$gte": 3, "$lt": 10}}. All entries must match.
 */
final class DocumentFilters {

    private DocumentFilters() {
    }

    static boolean matches(Document doc, Map<String, Object> filter) {
        if (filter == null || filter.isEmpty()) return true;
        for (Map.Entry<String, Object> entry : filter.entrySet()) {
            Object actual = doc.get(entry.getKey());
            Object condition = entry.getValue();
            if (isOperatorObject(condition)) {
                @SuppressWarnings("unchecked")
                Map<String, Object> ops = (Map<String, Object>) condition;
                for (Map.Entry<String, Object> op : ops.entrySet()) {
                    if (!apply(op.getKey(), actual, op.getValue())) return false;
                }
            } else if (!valueEquals(actual, condition)) {
                return false;
            }
        }
        return true;
    }

    static boolean isOperatorObject(Object value) {
        if (!(value instanceof Map) || ((Map<?, ?>) value).isEmpty()) return false;
        for (Object key : ((Map<?, ?>) value).keySet()) {
            if (!(key instanceof String) || !((String) key).startsWith("$")) return false;
        }
        return true;
    }

    private static boolean apply(String op, Object actual, Object operand) {
        switch (op) {
            case "$eq":
                return valueEquals(actual, operand);
            case "$ne":
                return !valueEquals(actual, operand);
            case "$gt":
                return ordered(actual, operand, c -> c > 0);
            case "$gte":
                return ordered(actual, operand, c -> c >= 0);
            case "$lt":
                return ordered(actual, operand, c -> c < 0);
            case "$lte":
                return ordered(actual, operand, c -> c <= 0);
            case "$in":
                return contains(operand, actual);
            case "$nin":
                return !contains(operand, actual);
            default:
                throw new IllegalArgumentException("Unsupported filter operator: " + op);
        }
    }

    private static boolean contains(Object operand, Object actual) {
        if (!(operand instanceof Collection)) {
            throw new IllegalArgumentException("$in/$nin expects an array, got " + operand);
        }
        for (Object candidate : (Collection<?>) operand) {
            if (valueEquals(actual, candidate)) return true;
        }
        return false;
    }

    static boolean valueEquals(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return toDecimal((Number) a).compareTo(toDecimal((Number) b)) == 0;
        }
        return Objects.equals(a, b);
    }

    /**
     * Numbers compare numerically and same-typed comparables (strings) naturally. A missing value or
     * a pair of different kinds satisfies no range condition.
     */
    private static boolean ordered(Object actual, Object operand, IntPredicate test) {
        if (actual instanceof Number && operand instanceof Number) {
            return test.test(toDecimal((Number) actual).compareTo(toDecimal((Number) operand)));
        }
        if (actual instanceof Comparable && operand != null && actual.getClass() == operand.getClass()) {
            return test.test(compareSameType(actual, operand));
        }
        return false;
    }

    /** Total order for sorting: nulls first, then numbers, then same-typed comparables, then text. */
    static int sortOrder(Object a, Object b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : -1) : 1;
        }
        if (a instanceof Number && b instanceof Number) {
            return toDecimal((Number) a).compareTo(toDecimal((Number) b));
        }
        if (a instanceof Comparable && a.getClass() == b.getClass()) {
            return compareSameType(a, b);
        }
        return a.toString().compareTo(b.toString());
    }

    /** Caller guarantees {@code a} is Comparable and both share one class. */
    @SuppressWarnings("unchecked")
    private static int compareSameType(Object a, Object b) {
        return ((Comparable<Object>) a).compareTo(b);
    }

    static BigDecimal toDecimal(Number n) {
        if (n instanceof BigDecimal) return (BigDecimal) n;
        if (n instanceof Double || n instanceof Float) return BigDecimal.valueOf(n.doubleValue());
        return new BigDecimal(n.toString());
    }
}
