package com.adapterhost.internal.adapters.logging;

import com.adapterhost.adapters.AdapterTokens;
import com.adapterhost.adapters.manifest.AdapterManifest;
import com.adapterhost.loader.AdapterDependencies;
import com.adapterhost.loader.AdapterModule;
import com.adapterhost.loader.AdapterSettings;

/** Settings: {@code name}, the SLF4J logger name (default {@code adapters}). */
public final class Slf4jAdapterLoggerModule implements AdapterModule {

    public static final String ID = "slf4j-logger";

    private static final AdapterManifest MANIFEST = AdapterManifest.builder(ID, AdapterTokens.LOGGER)
            .name("SLF4J logger")
            .version("1.0.0")
            .description("Structured logger backed by SLF4J, exposing the onLog hook")
            .build();

    @Override
    public AdapterManifest manifest() {
        return MANIFEST;
    }

    @Override
    public Object create(AdapterSettings settings, AdapterDependencies dependencies) {
        return new Slf4jAdapterLogger(settings.getString("name", "adapters"));
    }
}
