package com.adapterhost.internal.adapters.config;

import com.adapterhost.adapters.AdapterTokens;
import com.adapterhost.adapters.manifest.AdapterManifest;
import com.adapterhost.loader.AdapterDependencies;
import com.adapterhost.loader.AdapterModule;
import com.adapterhost.loader.AdapterSettings;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Paths;
import java.util.Map;

/**
 * Settings: {@code config} (inline document) or {@code path} (JSON file), and
 * {@code defaultProfile} (default {@code default}). With neither source the provider has no document.
 */
public final class JsonConfigProviderModule implements AdapterModule {

    public static final String ID = "json-config";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final AdapterManifest MANIFEST = AdapterManifest.builder(ID, AdapterTokens.CONFIG)
            .name("JSON configuration")
            .version("1.0.0")
            .description("Platform configuration read from a JSON document with profiles")
            .build();

    @Override
    public AdapterManifest manifest() {
        return MANIFEST;
    }

    @Override
    public Object create(AdapterSettings settings, AdapterDependencies dependencies) {
        String profile = settings.getString("defaultProfile", "default");
        JsonNode inline = settings.get("config");
        if (inline.isObject()) {
            return new JsonConfigProvider(MAPPER.convertValue(inline, new TypeReference<Map<String, Object>>() { }), profile);
        }
        String path = settings.getString("path", null);
        if (path != null) {
            return JsonConfigProvider.fromFile(Paths.get(path), profile);
        }
        return new JsonConfigProvider(null, profile);
    }
}
