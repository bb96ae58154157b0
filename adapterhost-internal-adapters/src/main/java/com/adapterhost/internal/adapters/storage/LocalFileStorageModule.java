package com.adapterhost.internal.adapters.storage;

import com.adapterhost.adapters.AdapterTokens;
import com.adapterhost.adapters.manifest.AdapterManifest;
import com.adapterhost.loader.AdapterDependencies;
import com.adapterhost.loader.AdapterModule;
import com.adapterhost.loader.AdapterSettings;

import java.nio.file.Paths;

/** Settings: {@code baseDir} (default {@code <java.io.tmpdir>/adapterhost-storage}). */
public final class LocalFileStorageModule implements AdapterModule {

    public static final String ID = "local-storage";

    private static final AdapterManifest MANIFEST = AdapterManifest.builder(ID, AdapterTokens.STORAGE)
            .name("Local file storage")
            .version("1.0.0")
            .description("Blob storage confined to a base directory")
            .build();

    @Override
    public AdapterManifest manifest() {
        return MANIFEST;
    }

    @Override
    public Object create(AdapterSettings settings, AdapterDependencies dependencies) {
        String fallback = Paths.get(System.getProperty("java.io.tmpdir"), "adapterhost-storage").toString();
        return new LocalFileStorage(Paths.get(settings.getString("baseDir", fallback)));
    }
}
