package com.adapterhost.loader;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdapterConfigsTest {

    @Test
    void fromJson_readsWrappedDocument() {
        Map<String, AdapterConfig> configs = AdapterConfigs.fromJson("""
                {
                  "adapters": {
                    "db": {"module": "document-db-memory"},
                    "logger": {"module": "logger-slf4j", "config": {"name": "adapters", "minLevel": "debug", "buffer": 16}}
                  }
                }
                """);

        assertEquals(List.of("db", "logger"), List.copyOf(configs.keySet()));
        assertEquals("document-db-memory", configs.get("db").getModuleRef());
        AdapterSettings settings = configs.get("logger").getSettings();
        assertEquals("adapters", settings.getString("name", null));
        assertEquals(16, settings.getInt("buffer", 0));
        assertEquals(7, settings.getInt("missing", 7));
    }

    @Test
    void fromJson_acceptsBareTokenMapAndSettingsKey() {
        Map<String, AdapterConfig> configs = AdapterConfigs.fromJson("{\"cache\":{\"module\":\"cache-memory\",\"settings\":{\"maxEntries\":10}}}");

        assertEquals(10, configs.get("cache").getSettings().getInt("maxEntries", 0));
    }

    @Test
    void fromJson_missingModuleNamesToken() {
        AdapterConfigurationException e = assertThrows(AdapterConfigurationException.class,
                () -> AdapterConfigs.fromJson("{\"cache\":{\"config\":{}}}"));

        assertEquals("cache", e.getToken());
    }

    @Test
    void fromJson_settingsMustBeAnObject() {
        assertThrows(AdapterConfigurationException.class,
                () -> AdapterConfigs.fromJson("{\"cache\":{\"module\":\"m\",\"config\":[1,2]}}"));
    }

    @Test
    void fromJson_invalidJsonFails() {
        AdapterConfigurationException e = assertThrows(AdapterConfigurationException.class, () -> AdapterConfigs.fromJson("{nope"));
        assertTrue(e.getMessage().startsWith("Invalid adapter configuration JSON"));
    }
}
