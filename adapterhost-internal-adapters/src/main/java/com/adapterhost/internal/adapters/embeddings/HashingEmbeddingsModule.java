package com.adapterhost.internal.adapters.embeddings;

import com.adapterhost.adapters.AdapterTokens;
import com.adapterhost.adapters.manifest.AdapterCapabilities;
import com.adapterhost.adapters.manifest.AdapterManifest;
import com.adapterhost.loader.AdapterDependencies;
import com.adapterhost.loader.AdapterModule;
import com.adapterhost.loader.AdapterSettings;

/** Settings: {@code dimensions} (default 64). */
public final class HashingEmbeddingsModule implements AdapterModule {

    public static final String ID = "hashing-embeddings";

    private static final AdapterManifest MANIFEST = AdapterManifest.builder(ID, AdapterTokens.EMBEDDINGS)
            .name("Hashing embeddings")
            .version("1.0.0")
            .description("Deterministic feature-hashing text embeddings")
            .capabilities(new AdapterCapabilities(false, true, false, false, null))
            .build();

    @Override
    public AdapterManifest manifest() {
        return MANIFEST;
    }

    @Override
    public Object create(AdapterSettings settings, AdapterDependencies dependencies) {
        return new HashingEmbeddings(settings.getInt("dimensions", HashingEmbeddings.DEFAULT_DIMENSIONS));
    }
}
