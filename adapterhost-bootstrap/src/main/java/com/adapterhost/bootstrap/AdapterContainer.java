package com.adapterhost.bootstrap;

import com.adapterhost.adapters.manifest.AdapterManifest;
import com.adapterhost.loader.LoadedAdapters;

import java.util.List;
import java.util.Set;

/**
 * Host-side lookup of loaded adapter instances by token.
 */
public final class AdapterContainer {

    private final LoadedAdapters loaded;

    AdapterContainer(LoadedAdapters loaded) {
        this.loaded = loaded;
    }

    /** @throws java.util.NoSuchElementException if no adapter is loaded under {@code token} */
    public Object getAdapter(String token) {
        return loaded.get(token);
    }

    /**
     * @throws java.util.NoSuchElementException if no adapter is loaded under {@code token}
     * @throws ClassCastException               if the adapter does not implement {@code type}
     */
    public <T> T getAdapter(String token, Class<T> type) {
        return loaded.get(token, type);
    }

    public boolean hasAdapter(String token) {
        return loaded.contains(token);
    }

    public Set<String> getTokens() {
        return loaded.getTokens();
    }

    public List<String> getLoadOrder() {
        return loaded.getLoadOrder();
    }

    public AdapterManifest getManifest(String token) {
        return loaded.getManifest(token);
    }

    LoadedAdapters loaded() {
        return loaded;
    }
}
