package com.adapterhost.loader;

import java.util.Set;
import java.util.TreeSet;

/** Thrown when a configuration entry names a module reference no resolver knows. */
public final class AdapterModuleNotFoundException extends AdapterConfigurationException {

    private final String moduleRef;

    public AdapterModuleNotFoundException(String moduleRef, Set<String> available) {
        super(null, "Adapter module '" + moduleRef + "' not found. Available modules: " + new TreeSet<>(available));
        this.moduleRef = moduleRef;
    }

    public String getModuleRef() {
        return moduleRef;
    }
}
