package com.adapterhost.loader;

import java.util.Set;

/** Resolves the module reference of a configuration entry to an {@link AdapterModule}. */
public interface AdapterModuleResolver {

    /**
     * @throws AdapterModuleNotFoundException if no module is known under {@code moduleRef}
     */
    AdapterModule resolve(String moduleRef);

    /** References this resolver can resolve, for diagnostics. */
    Set<String> available();
}
