package com.adapterhost.internal.adapters.config;

import com.adapterhost.adapters.config.ConfigProvider;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration document held in memory. Product sections are looked up in the selected profile
 * first and then at the top level:
 * <pre>
 * {
 *   "profiles": [
 *     {"id": "default", "products": {"search": {"limit": 10}}},
 *     {"id": "prod",    "products": {"search": {"limit": 50}}}
 *   ],
 *   "search": {"limit": 5}
 * }
 * </pre>
 * An unknown profile falls back to the first one listed.
 */
public final class JsonConfigProvider implements ConfigProvider {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() { };

    private final Map<String, Object> document;
    private final String defaultProfile;

    /** @param document configuration document, or null when none is loaded */
    public JsonConfigProvider(Map<String, Object> document, String defaultProfile) {
        this.document = document != null ? Collections.unmodifiableMap(document) : null;
        this.defaultProfile = Objects.requireNonNull(defaultProfile, "defaultProfile");
    }

    public static JsonConfigProvider fromFile(Path file, String defaultProfile) {
        try {
            return new JsonConfigProvider(MAPPER.readValue(Files.readAllBytes(file), DOCUMENT), defaultProfile);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read config " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Object getConfig(String productId, String profileId) {
        Objects.requireNonNull(productId, "productId");
        if (document == null) return null;
        Map<?, ?> profile = selectProfile(profileId != null ? profileId : defaultProfile);
        if (profile != null && profile.get("products") instanceof Map) {
            Object section = ((Map<?, ?>) profile.get("products")).get(productId);
            if (section != null) return section;
        }
        return document.get(productId);
    }

    @Override
    public Map<String, Object> getRawConfig() {
        return document;
    }

    private Map<?, ?> selectProfile(String profileId) {
        if (!(document.get("profiles") instanceof List)) return null;
        Map<?, ?> first = null;
        for (Object entry : (List<?>) document.get("profiles")) {
            if (!(entry instanceof Map)) continue;
            Map<?, ?> profile = (Map<?, ?>) entry;
            if (profileId.equals(profile.get("id"))) return profile;
            if (first == null) first = profile;
        }
        return first;
    }
}
