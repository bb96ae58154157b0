package com.adapterhost.internal.adapters.cache;

import com.adapterhost.adapters.AdapterTokens;
import com.adapterhost.adapters.manifest.AdapterManifest;
import com.adapterhost.loader.AdapterDependencies;
import com.adapterhost.loader.AdapterModule;
import com.adapterhost.loader.AdapterSettings;

/** Settings: {@code defaultTtlMs} (optional). */
public final class InMemoryCacheModule implements AdapterModule {

    public static final String ID = "memory-cache";

    private static final AdapterManifest MANIFEST = AdapterManifest.builder(ID, AdapterTokens.CACHE)
            .name("In-memory cache")
            .version("1.0.0")
            .description("Process-local key/value cache with TTL and glob clear")
            .build();

    @Override
    public AdapterManifest manifest() {
        return MANIFEST;
    }

    @Override
    public Object create(AdapterSettings settings, AdapterDependencies dependencies) {
        long ttl = settings.getLong("defaultTtlMs", 0L);
        return new InMemoryCache(ttl > 0 ? ttl : null, System::currentTimeMillis);
    }
}
