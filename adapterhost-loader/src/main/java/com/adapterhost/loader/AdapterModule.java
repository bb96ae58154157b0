package com.adapterhost.loader;

import com.adapterhost.adapters.manifest.AdapterManifest;

/**
 * SPI for adapter implementations. Modules are discovered with {@link java.util.ServiceLoader}
 * (register in {@code META-INF/services/com.adapterhost.loader.AdapterModule}) or registered directly
 * with a {@link MapModuleResolver}.
 */
public interface AdapterModule {

    AdapterManifest manifest();

    /**
     * Creates the adapter instance. Called once per configured token, after every dependency has
     * been created.
     *
     * @param settings     free-form settings from the configuration entry
     * @param dependencies declared dependencies keyed by alias
     */
    Object create(AdapterSettings settings, AdapterDependencies dependencies) throws Exception;

    /** Reference used in configuration to select this module. Defaults to the manifest id. */
    default String moduleRef() {
        return manifest().getId();
    }
}
