package com.adapterhost.loader;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resolver over explicitly registered modules. Duplicate references are rejected.
 */
public final class MapModuleResolver implements AdapterModuleResolver {

    private final Map<String, AdapterModule> modules = new LinkedHashMap<>();

    public static MapModuleResolver of(AdapterModule... modules) {
        MapModuleResolver resolver = new MapModuleResolver();
        for (AdapterModule module : modules) {
            resolver.register(module);
        }
        return resolver;
    }

    public MapModuleResolver register(AdapterModule module) {
        return register(module.moduleRef(), module);
    }

    public synchronized MapModuleResolver register(String moduleRef, AdapterModule module) {
        Objects.requireNonNull(moduleRef, "moduleRef");
        Objects.requireNonNull(module, "module");
        if (modules.putIfAbsent(moduleRef, module) != null) {
            throw new IllegalArgumentException("Module already registered: " + moduleRef);
        }
        return this;
    }

    @Override
    public synchronized AdapterModule resolve(String moduleRef) {
        AdapterModule module = modules.get(moduleRef);
        if (module == null) {
            throw new AdapterModuleNotFoundException(moduleRef, modules.keySet());
        }
        return module;
    }

    @Override
    public synchronized Set<String> available() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(modules.keySet()));
    }
}
