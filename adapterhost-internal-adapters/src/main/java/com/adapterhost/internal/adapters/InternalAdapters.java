package com.adapterhost.internal.adapters;

import com.adapterhost.internal.adapters.cache.InMemoryCacheModule;
import com.adapterhost.internal.adapters.config.JsonConfigProviderModule;
import com.adapterhost.internal.adapters.db.InMemoryDocumentDatabaseModule;
import com.adapterhost.internal.adapters.embeddings.HashingEmbeddingsModule;
import com.adapterhost.internal.adapters.llm.EchoLlmModule;
import com.adapterhost.internal.adapters.logging.LogPersistenceModule;
import com.adapterhost.internal.adapters.logging.LogRingBufferModule;
import com.adapterhost.internal.adapters.logging.Slf4jAdapterLoggerModule;
import com.adapterhost.internal.adapters.sql.JdbcSqlDatabaseModule;
import com.adapterhost.internal.adapters.storage.LocalFileStorageModule;
import com.adapterhost.internal.adapters.vector.InMemoryVectorStoreModule;
import com.adapterhost.loader.AdapterModule;
import com.adapterhost.loader.MapModuleResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Host-side bootstrap of the built-in adapter modules. The same modules are also listed in
 * {@code META-INF/services/com.adapterhost.loader.AdapterModule}, so a
 * {@link com.adapterhost.loader.ServiceLoaderModuleResolver} finds them too; {@link #resolver()} is for
 * hosts that want exactly these modules and nothing else from the classpath.
 */
public final class InternalAdapters {

    private static final Logger log = LoggerFactory.getLogger(InternalAdapters.class);

    private InternalAdapters() {
    }

    /** A new instance of every built-in module. */
    public static List<AdapterModule> modules() {
        return List.of(
                new InMemoryCacheModule(),
                new InMemoryDocumentDatabaseModule(),
                new InMemoryVectorStoreModule(),
                new HashingEmbeddingsModule(),
                new LocalFileStorageModule(),
                new Slf4jAdapterLoggerModule(),
                new LogRingBufferModule(),
                new LogPersistenceModule(),
                new EchoLlmModule(),
                new JdbcSqlDatabaseModule(),
                new JsonConfigProviderModule());
    }

    /** Resolver with every built-in module registered under its id. */
    public static MapModuleResolver resolver() {
        MapModuleResolver resolver = new MapModuleResolver();
        for (AdapterModule module : modules()) {
            resolver.register(module);
        }
        log.info("Adapter modules: {} internal ({})", resolver.available().size(), resolver.available());
        return resolver;
    }
}
