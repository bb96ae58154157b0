package com.adapterhost.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses an already-resolved configuration set document:
 * <pre>
 * {"adapters": {
 *   "db":     {"module": "document-db-memory"},
 *   "logger": {"module": "logger-slf4j", "config": {"name": "adapters"}}
 * }}
 * </pre>
 * The {@code adapters} wrapper is optional; {@code settings} is accepted in place of {@code config}.
 */
public final class AdapterConfigs {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AdapterConfigs() {
    }

    public static Map<String, AdapterConfig> fromJson(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new AdapterConfigurationException(null, "Invalid adapter configuration JSON: " + e.getMessage(), e);
        }
        if (root != null && root.has("adapters")) {
            root = root.get("adapters");
        }
        if (root == null || !root.isObject()) {
            throw new AdapterConfigurationException(null, "Adapter configuration must be a JSON object of token → entry");
        }
        Map<String, AdapterConfig> configs = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = root.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String token = entry.getKey();
            JsonNode node = entry.getValue();
            JsonNode module = node.get("module");
            if (module == null || !module.isTextual() || module.asText().isBlank()) {
                throw new AdapterConfigurationException(token, "Adapter '" + token + "' has no module reference");
            }
            JsonNode settings = node.has("config") ? node.get("config") : node.get("settings");
            try {
                configs.put(token, AdapterConfig.of(module.asText().trim(), AdapterSettings.of(settings)));
            } catch (IllegalArgumentException e) {
                throw new AdapterConfigurationException(token, "Adapter '" + token + "': " + e.getMessage(), e);
            }
        }
        return Collections.unmodifiableMap(configs);
    }
}
