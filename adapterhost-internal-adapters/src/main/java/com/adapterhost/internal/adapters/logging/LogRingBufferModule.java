package com.adapterhost.internal.adapters.logging;

import com.adapterhost.adapters.AdapterTokens;
import com.adapterhost.adapters.logging.AdapterLogger;
import com.adapterhost.adapters.manifest.AdapterManifest;
import com.adapterhost.loader.AdapterDependencies;
import com.adapterhost.loader.AdapterModule;
import com.adapterhost.loader.AdapterSettings;

/** Settings: {@code capacity} (default 1000). */
public final class LogRingBufferModule implements AdapterModule {

    public static final String ID = "log-ring-buffer";
    public static final int DEFAULT_CAPACITY = 1000;

    private static final AdapterManifest MANIFEST = AdapterManifest.builder(ID, AdapterTokens.LOG_BUFFER)
            .name("Log ring buffer")
            .version("1.0.0")
            .description("Keeps recent log records in memory")
            .extendsHook(AdapterTokens.LOGGER, AdapterLogger.ON_LOG, LogRingBuffer.APPEND, 10)
            .build();

    @Override
    public AdapterManifest manifest() {
        return MANIFEST;
    }

    @Override
    public Object create(AdapterSettings settings, AdapterDependencies dependencies) {
        return new LogRingBuffer(settings.getInt("capacity", DEFAULT_CAPACITY));
    }
}
