package com.adapterhost.loader;

import java.util.Map;
import java.util.Objects;

/**
 * One entry of the configuration set: which module provides the adapter, and its settings.
 * The module is either named by reference (resolved through an {@link AdapterModuleResolver}) or given
 * directly.
 */
public final class AdapterConfig {

    private final String moduleRef;
    private final AdapterModule module;
    private final AdapterSettings settings;

    private AdapterConfig(String moduleRef, AdapterModule module, AdapterSettings settings) {
        this.moduleRef = moduleRef;
        this.module = module;
        this.settings = settings != null ? settings : AdapterSettings.empty();
    }

    public static AdapterConfig of(String moduleRef) {
        return of(moduleRef, AdapterSettings.empty());
    }

    public static AdapterConfig of(String moduleRef, AdapterSettings settings) {
        return new AdapterConfig(Objects.requireNonNull(moduleRef, "moduleRef"), null, settings);
    }

    public static AdapterConfig of(String moduleRef, Map<String, ?> settings) {
        return of(moduleRef, AdapterSettings.of(settings));
    }

    public static AdapterConfig of(AdapterModule module) {
        return of(module, AdapterSettings.empty());
    }

    public static AdapterConfig of(AdapterModule module, AdapterSettings settings) {
        Objects.requireNonNull(module, "module");
        return new AdapterConfig(module.moduleRef(), module, settings);
    }

    public String getModuleRef() {
        return moduleRef;
    }

    /** Module given directly, or null when it is resolved by reference. */
    public AdapterModule getModule() {
        return module;
    }

    public AdapterSettings getSettings() {
        return settings;
    }

    @Override
    public String toString() {
        return "AdapterConfig{module=" + moduleRef + ", settings=" + settings + "}";
    }
}
