package com.adapterhost.internal.adapters;

import com.adapterhost.adapters.AdapterTokens;
import com.adapterhost.adapters.db.DocumentDatabase;
import com.adapterhost.adapters.logging.AdapterLogger;
import com.adapterhost.internal.adapters.logging.LogRingBuffer;
import com.adapterhost.loader.AdapterConfig;
import com.adapterhost.loader.AdapterConfigs;
import com.adapterhost.loader.AdapterLoader;
import com.adapterhost.loader.AdapterModule;
import com.adapterhost.loader.ExtensionConnection;
import com.adapterhost.loader.LoadedAdapters;
import com.adapterhost.loader.ServiceLoaderModuleResolver;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InternalAdaptersTest {

    @Test
    void resolver_registersEveryModuleById() {
        List<String> ids = InternalAdapters.modules().stream().map(AdapterModule::moduleRef).collect(Collectors.toList());
        assertEquals(ids, List.copyOf(InternalAdapters.resolver().available()));
        assertEquals(11, ids.size());
    }

    @Test
    void serviceLoader_discoversTheSameModules() {
        ServiceLoaderModuleResolver resolver = new ServiceLoaderModuleResolver(InternalAdaptersTest.class.getClassLoader());
        for (AdapterModule module : InternalAdapters.modules()) {
            assertTrue(resolver.available().contains(module.moduleRef()), module.moduleRef());
        }
    }

    @Test
    void load_wiresLogExtensionsByPriorityAndPersistsThroughDatabase() {
        Map<String, AdapterConfig> configs = AdapterConfigs.fromJson("{\"adapters\": {"
                + "\"logPersistence\": {\"module\": \"log-persistence\", \"config\": {\"collection\": \"audit\"}},"
                + "\"logRingBuffer\": {\"module\": \"log-ring-buffer\", \"config\": {\"capacity\": 5}},"
                + "\"logger\": {\"module\": \"slf4j-logger\"},"
                + "\"database.document\": {\"module\": \"memory-document-db\"}"
                + "}}");

        LoadedAdapters loaded = new AdapterLoader(InternalAdapters.resolver()).load(configs);

        assertTrue(loaded.getLoadOrder().indexOf(AdapterTokens.DOCUMENT_DATABASE)
                < loaded.getLoadOrder().indexOf(AdapterTokens.LOG_PERSISTENCE));
        assertEquals(List.of(AdapterTokens.LOG_BUFFER, AdapterTokens.LOG_PERSISTENCE),
                loaded.getConnections().stream().map(ExtensionConnection::extensionToken).collect(Collectors.toList()));

        loaded.get(AdapterTokens.LOGGER, AdapterLogger.class).info("hello", Map.of("a", 1));

        assertEquals(1, loaded.get(AdapterTokens.LOG_BUFFER, LogRingBuffer.class).snapshot().size());
        assertEquals(5, loaded.get(AdapterTokens.LOG_BUFFER, LogRingBuffer.class).getCapacity());
        assertEquals(1, loaded.get(AdapterTokens.DOCUMENT_DATABASE, DocumentDatabase.class).count("audit", null));
    }
}
