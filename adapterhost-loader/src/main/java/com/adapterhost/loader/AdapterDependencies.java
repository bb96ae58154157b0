package com.adapterhost.loader;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

/**
 * Dependency bundle handed to an adapter factory: alias → already-created adapter instance. Holds the
 * declared required dependencies and those declared optional dependencies that are configured.
 */
public final class AdapterDependencies {

    private static final AdapterDependencies EMPTY = new AdapterDependencies(Map.of());

    private final Map<String, Object> byAlias;

    private AdapterDependencies(Map<String, Object> byAlias) {
        this.byAlias = byAlias;
    }

    public static AdapterDependencies empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @throws NoSuchElementException if nothing is bound under {@code alias} */
    public Object get(String alias) {
        Object instance = byAlias.get(alias);
        if (instance == null) {
            throw new NoSuchElementException("No dependency bound under alias '" + alias + "'. Bound: " + byAlias.keySet());
        }
        return instance;
    }

    /**
     * @throws NoSuchElementException if nothing is bound under {@code alias}
     * @throws ClassCastException     if the bound adapter does not implement {@code type}
     */
    public <T> T get(String alias, Class<T> type) {
        Object instance = get(alias);
        if (!type.isInstance(instance)) {
            throw new ClassCastException("Dependency '" + alias + "' is " + instance.getClass().getName()
                    + ", not " + type.getName());
        }
        return type.cast(instance);
    }

    /** For optional dependencies: empty when not bound or not of the requested type. */
    public <T> Optional<T> find(String alias, Class<T> type) {
        Object instance = byAlias.get(alias);
        return type.isInstance(instance) ? Optional.of(type.cast(instance)) : Optional.empty();
    }

    public boolean has(String alias) {
        return byAlias.containsKey(alias);
    }

    public Set<String> aliases() {
        return byAlias.keySet();
    }

    public Map<String, Object> asMap() {
        return byAlias;
    }

    @Override
    public String toString() {
        return "AdapterDependencies" + byAlias.keySet();
    }

    public static final class Builder {
        private final Map<String, Object> byAlias = new LinkedHashMap<>();

        private Builder() {
        }

        /** @throws IllegalArgumentException if the alias is already bound */
        public Builder put(String alias, Object instance) {
            if (instance == null) {
                throw new IllegalArgumentException("Dependency '" + alias + "' has no instance");
            }
            if (byAlias.putIfAbsent(alias, instance) != null) {
                throw new IllegalArgumentException("Duplicate dependency alias: " + alias);
            }
            return this;
        }

        public AdapterDependencies build() {
            return byAlias.isEmpty() ? EMPTY : new AdapterDependencies(Collections.unmodifiableMap(new LinkedHashMap<>(byAlias)));
        }
    }
}
