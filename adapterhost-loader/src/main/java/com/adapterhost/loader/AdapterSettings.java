package com.adapterhost.loader;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * Free-form settings of one configuration entry, opaque to the loader and interpreted by the module.
 */
public final class AdapterSettings {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final AdapterSettings EMPTY = new AdapterSettings(MAPPER.createObjectNode());

    private final ObjectNode values;

    private AdapterSettings(ObjectNode values) {
        this.values = values;
    }

    public static AdapterSettings empty() {
        return EMPTY;
    }

    public static AdapterSettings of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) return EMPTY;
        return new AdapterSettings(MAPPER.valueToTree(values));
    }

    /** @throws IllegalArgumentException if {@code node} is neither null nor a JSON object */
    public static AdapterSettings of(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return EMPTY;
        if (!node.isObject()) {
            throw new IllegalArgumentException("Adapter settings must be a JSON object, got " + node.getNodeType());
        }
        return new AdapterSettings(((ObjectNode) node).deepCopy());
    }

    public boolean has(String key) {
        JsonNode v = values.get(key);
        return v != null && !v.isNull();
    }

    /** Raw value, or a missing node. */
    public JsonNode get(String key) {
        return values.path(key);
    }

    public String getString(String key, String defaultValue) {
        JsonNode v = values.get(key);
        return v != null && !v.isNull() ? v.asText() : defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        JsonNode v = values.get(key);
        return v != null && !v.isNull() ? v.asInt(defaultValue) : defaultValue;
    }

    public long getLong(String key, long defaultValue) {
        JsonNode v = values.get(key);
        return v != null && !v.isNull() ? v.asLong(defaultValue) : defaultValue;
    }

    public double getDouble(String key, double defaultValue) {
        JsonNode v = values.get(key);
        return v != null && !v.isNull() ? v.asDouble(defaultValue) : defaultValue;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        JsonNode v = values.get(key);
        return v != null && !v.isNull() ? v.asBoolean(defaultValue) : defaultValue;
    }

    /** Binds the settings object to a settings bean or record. */
    public <T> T as(Class<T> type) {
        return MAPPER.convertValue(values, type);
    }

    public Map<String, Object> toMap() {
        return MAPPER.convertValue(values, new TypeReference<Map<String, Object>>() { });
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
