package com.adapterhost.adapters.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Informational capability flags; the loader does not act on them. */
public final class AdapterCapabilities {

    public static final AdapterCapabilities NONE = new AdapterCapabilities(false, false, false, false, null);

    private final boolean streaming;
    private final boolean batch;
    private final boolean search;
    private final boolean transactions;
    private final Map<String, Object> custom;

    @JsonCreator
    public AdapterCapabilities(@JsonProperty("streaming") boolean streaming,
                               @JsonProperty("batch") boolean batch,
                               @JsonProperty("search") boolean search,
                               @JsonProperty("transactions") boolean transactions,
                               @JsonProperty("custom") Map<String, Object> custom) {
        this.streaming = streaming;
        this.batch = batch;
        this.search = search;
        this.transactions = transactions;
        this.custom = custom != null ? Collections.unmodifiableMap(new LinkedHashMap<>(custom)) : Map.of();
    }

    public boolean isStreaming() {
        return streaming;
    }

    public boolean isBatch() {
        return batch;
    }

    public boolean isSearch() {
        return search;
    }

    public boolean isTransactions() {
        return transactions;
    }

    public Map<String, Object> getCustom() {
        return custom;
    }
}
