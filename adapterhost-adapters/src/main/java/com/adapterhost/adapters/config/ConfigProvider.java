package com.adapterhost.adapters.config;

import java.util.Map;

/**
 * Read access to the host's platform configuration.
 */
public interface ConfigProvider {

    /**
     * Configuration section of one product.
     *
     * @param profileId profile to read, or null for the provider's default profile
     * @return the section (map, list or scalar), or null when the product has none
     */
    Object getConfig(String productId, String profileId);

    /** The whole configuration document, or null when none is loaded. */
    Map<String, Object> getRawConfig();
}
