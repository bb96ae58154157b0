package com.adapterhost.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Resolves modules registered through {@link ServiceLoader}. Each module is reachable by its
 * {@link AdapterModule#moduleRef()} and by its class name. Providers that fail to load are logged
 * and skipped; the first module registered under a reference wins.
 */
public final class ServiceLoaderModuleResolver implements AdapterModuleResolver {

    private static final Logger log = LoggerFactory.getLogger(ServiceLoaderModuleResolver.class);

    private final Map<String, AdapterModule> modules;

    public ServiceLoaderModuleResolver() {
        this(Thread.currentThread().getContextClassLoader());
    }

    public ServiceLoaderModuleResolver(ClassLoader classLoader) {
        this.modules = Collections.unmodifiableMap(discover(classLoader));
    }

    private static Map<String, AdapterModule> discover(ClassLoader classLoader) {
        Map<String, AdapterModule> found = new LinkedHashMap<>();
        Iterator<AdapterModule> it = ServiceLoader.load(AdapterModule.class, classLoader).iterator();
        while (true) {
            AdapterModule module;
            try {
                if (!it.hasNext()) break;
                module = it.next();
            } catch (ServiceConfigurationError e) {
                log.warn("Skipping adapter module that failed to load: {}", e.getMessage());
                continue;
            }
            index(found, module.moduleRef(), module);
            index(found, module.getClass().getName(), module);
            log.debug("Discovered adapter module {} ({})", module.moduleRef(), module.getClass().getName());
        }
        log.info("Discovered {} adapter module(s)", found.values().stream().distinct().count());
        return found;
    }

    private static void index(Map<String, AdapterModule> found, String ref, AdapterModule module) {
        AdapterModule existing = found.putIfAbsent(ref, module);
        if (existing != null && existing != module) {
            log.warn("Adapter module reference {} is provided by both {} and {}; keeping the first",
                    ref, existing.getClass().getName(), module.getClass().getName());
        }
    }

    @Override
    public AdapterModule resolve(String moduleRef) {
        AdapterModule module = modules.get(moduleRef);
        if (module == null) {
            throw new AdapterModuleNotFoundException(moduleRef, modules.keySet());
        }
        return module;
    }

    @Override
    public Set<String> available() {
        return new LinkedHashSet<>(modules.keySet());
    }
}
