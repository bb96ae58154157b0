package com.adapterhost.adapters.logging;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum LogLevel {
    @JsonProperty("trace") TRACE,
    @JsonProperty("debug") DEBUG,
    @JsonProperty("info") INFO,
    @JsonProperty("warn") WARN,
    @JsonProperty("error") ERROR;

    public boolean isAtLeast(LogLevel other) {
        return compareTo(other) >= 0;
    }
}
