package com.adapterhost.internal.adapters.config;

import com.adapterhost.loader.AdapterSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JsonConfigProviderTest {

    private static final String DOCUMENT = "{"
            + "\"profiles\": ["
            + "  {\"id\": \"default\", \"products\": {\"search\": {\"limit\": 10}}},"
            + "  {\"id\": \"prod\", \"products\": {\"search\": {\"limit\": 50}}}"
            + "],"
            + "\"search\": {\"limit\": 5},"
            + "\"workflow\": {\"retries\": 3}"
            + "}";

    @TempDir
    Path dir;

    private JsonConfigProvider provider() throws Exception {
        Path file = dir.resolve("platform.json");
        Files.write(file, DOCUMENT.getBytes(StandardCharsets.UTF_8));
        return JsonConfigProvider.fromFile(file, "default");
    }

    @Test
    void getConfig_readsSectionFromRequestedProfile() throws Exception {
        JsonConfigProvider config = provider();

        assertEquals(Map.of("limit", 50), config.getConfig("search", "prod"));
        assertEquals(Map.of("limit", 10), config.getConfig("search", null));
    }

    @Test
    void getConfig_unknownProfileFallsBackToFirst() throws Exception {
        assertEquals(Map.of("limit", 10), provider().getConfig("search", "staging"));
    }

    @Test
    void getConfig_productMissingFromProfileFallsBackToTopLevel() throws Exception {
        JsonConfigProvider config = provider();

        assertEquals(Map.of("retries", 3), config.getConfig("workflow", "prod"));
        assertNull(config.getConfig("mind", null));
    }

    @Test
    void getRawConfig_returnsWholeDocument() throws Exception {
        Map<String, Object> raw = provider().getRawConfig();

        assertEquals(2, ((List<?>) raw.get("profiles")).size());
        assertThrows(UnsupportedOperationException.class, () -> raw.put("x", 1));
    }

    @Test
    void withoutDocument_everythingIsNull() {
        JsonConfigProvider config = new JsonConfigProvider(null, "default");

        assertNull(config.getConfig("search", null));
        assertNull(config.getRawConfig());
    }

    @Test
    void fromFile_missingFileFails() {
        assertThrows(UncheckedIOException.class, () -> JsonConfigProvider.fromFile(dir.resolve("none.json"), "default"));
    }

    @Test
    void module_acceptsInlineDocumentAndDefaultProfile() {
        Map<String, Object> settings = Map.of(
                "defaultProfile", "prod",
                "config", Map.of("profiles", List.of(
                        Map.of("id", "dev", "products", Map.of("search", Map.of("limit", 1))),
                        Map.of("id", "prod", "products", Map.of("search", Map.of("limit", 2))))));

        JsonConfigProvider config = (JsonConfigProvider) new JsonConfigProviderModule().create(AdapterSettings.of(settings), null);

        assertEquals(Map.of("limit", 2), config.getConfig("search", null));
        assertEquals(Map.of("limit", 1), config.getConfig("search", "dev"));
    }
}
