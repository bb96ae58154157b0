package com.adapterhost.ipc.dispatch;

import com.adapterhost.codec.WireCodec;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Positional arguments of a call, decoded on demand. An index past the end reads as JSON null, so
 * trailing optional arguments may be omitted by the caller.
 */
public final class CallArguments {

    private final List<JsonNode> args;
    private final WireCodec codec;

    public CallArguments(List<JsonNode> args, WireCodec codec) {
        this.args = args != null ? args : List.of();
        this.codec = codec;
    }

    public int size() {
        return args.size();
    }

    public JsonNode raw(int index) {
        return index < args.size() ? args.get(index) : null;
    }

    /** Generic decode (maps, lists, byte[], Instant). */
    public Object value(int index) {
        return codec.deserialize(raw(index));
    }

    public <T> T get(int index, Class<T> type) {
        return codec.deserialize(raw(index), type);
    }

    public <T> T get(int index, TypeReference<T> type) {
        return codec.deserialize(raw(index), type);
    }

    public String string(int index) {
        return get(index, String.class);
    }

    /**
     * @throws IllegalArgumentException if the argument is absent or null
     */
    public String requireString(int index) {
        String value = string(index);
        if (value == null) {
            throw new IllegalArgumentException("Argument " + index + " is required");
        }
        return value;
    }

    public Long optionalLong(int index) {
        return get(index, Long.class);
    }

    public int intOr(int index, int fallback) {
        Integer value = get(index, Integer.class);
        return value != null ? value : fallback;
    }
}
