package com.adapterhost.adapters.vector;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Single-field metadata predicate, e.g. {@code {"field":"lang","op":"eq","value":"en"}}.
 */
public record VectorFilter(String field, Operator op, Object value) {

    public VectorFilter {
        Objects.requireNonNull(field, "field");
        op = op != null ? op : Operator.EQ;
    }

    public static VectorFilter eq(String field, Object value) {
        return new VectorFilter(field, Operator.EQ, value);
    }

    public enum Operator {
        @JsonProperty("eq") EQ,
        @JsonProperty("ne") NE,
        @JsonProperty("gt") GT,
        @JsonProperty("gte") GTE,
        @JsonProperty("lt") LT,
        @JsonProperty("lte") LTE,
        @JsonProperty("in") IN,
        @JsonProperty("nin") NIN
    }
}
