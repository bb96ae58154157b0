package com.adapterhost.internal.adapters.db;

import com.adapterhost.adapters.AdapterTokens;
import com.adapterhost.adapters.manifest.AdapterCapabilities;
import com.adapterhost.adapters.manifest.AdapterManifest;
import com.adapterhost.loader.AdapterDependencies;
import com.adapterhost.loader.AdapterModule;
import com.adapterhost.loader.AdapterSettings;

public final class InMemoryDocumentDatabaseModule implements AdapterModule {

    public static final String ID = "memory-document-db";

    private static final AdapterManifest MANIFEST = AdapterManifest.builder(ID, AdapterTokens.DOCUMENT_DATABASE)
            .name("In-memory document database")
            .version("1.0.0")
            .description("Collections of JSON documents with Mongo-style filters and updates")
            .capabilities(new AdapterCapabilities(false, true, true, false, null))
            .build();

    @Override
    public AdapterManifest manifest() {
        return MANIFEST;
    }

    @Override
    public Object create(AdapterSettings settings, AdapterDependencies dependencies) {
        return new InMemoryDocumentDatabase();
    }
}
