package com.adapterhost.internal.adapters.vector;

import com.adapterhost.adapters.AdapterTokens;
import com.adapterhost.adapters.manifest.AdapterCapabilities;
import com.adapterhost.adapters.manifest.AdapterManifest;
import com.adapterhost.loader.AdapterDependencies;
import com.adapterhost.loader.AdapterModule;
import com.adapterhost.loader.AdapterSettings;

/** Settings: {@code dimensions} (optional; taken from the first upsert when absent). */
public final class InMemoryVectorStoreModule implements AdapterModule {

    public static final String ID = "memory-vector-store";

    private static final AdapterManifest MANIFEST = AdapterManifest.builder(ID, AdapterTokens.VECTOR_STORE)
            .name("In-memory vector store")
            .version("1.0.0")
            .description("Cosine-similarity search over vectors held in memory")
            .capabilities(new AdapterCapabilities(false, true, true, false, null))
            .build();

    @Override
    public AdapterManifest manifest() {
        return MANIFEST;
    }

    @Override
    public Object create(AdapterSettings settings, AdapterDependencies dependencies) {
        return new InMemoryVectorStore(settings.getInt("dimensions", 0));
    }
}
