package com.adapterhost.loader;

import com.adapterhost.adapters.manifest.AdapterManifest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Result of a successful load: instances by token in load order, their manifests and the extension
 * connections that were made. Immutable.
 */
public final class LoadedAdapters {

    private final Map<String, Object> instances;
    private final Map<String, AdapterManifest> manifests;
    private final List<String> loadOrder;
    private final List<ExtensionConnection> connections;

    LoadedAdapters(Map<String, Object> instances, Map<String, AdapterManifest> manifests,
                   List<String> loadOrder, List<ExtensionConnection> connections) {
        this.instances = Collections.unmodifiableMap(new LinkedHashMap<>(instances));
        this.manifests = Collections.unmodifiableMap(new LinkedHashMap<>(manifests));
        this.loadOrder = List.copyOf(loadOrder);
        this.connections = List.copyOf(connections);
    }

    /** Token → instance, iterating in load order. */
    public Map<String, Object> getInstances() {
        return instances;
    }

    public List<String> getLoadOrder() {
        return loadOrder;
    }

    /** Load order reversed: dependents before their dependencies. */
    public List<String> getShutdownOrder() {
        List<String> reversed = new ArrayList<>(loadOrder);
        Collections.reverse(reversed);
        return reversed;
    }

    public Set<String> getTokens() {
        return instances.keySet();
    }

    public boolean contains(String token) {
        return instances.containsKey(token);
    }

    /** @throws NoSuchElementException if the token is not loaded */
    public Object get(String token) {
        Object instance = instances.get(token);
        if (instance == null) {
            throw new NoSuchElementException("Adapter not loaded: " + token + ". Loaded: " + instances.keySet());
        }
        return instance;
    }

    /** @throws ClassCastException if the adapter does not implement {@code type} */
    public <T> T get(String token, Class<T> type) {
        Object instance = get(token);
        if (!type.isInstance(instance)) {
            throw new ClassCastException("Adapter '" + token + "' is " + instance.getClass().getName() + ", not " + type.getName());
        }
        return type.cast(instance);
    }

    public AdapterManifest getManifest(String token) {
        return manifests.get(token);
    }

    public List<ExtensionConnection> getConnections() {
        return connections;
    }
}
