package com.adapterhost.loader;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * The dependency graph has at least one cycle. {@link #getCycleTokens()} holds exactly the tokens that
 * lie on a cycle; adapters that merely depend on a cycle are not included.
 */
public final class CircularDependencyException extends AdapterConfigurationException {

    private final Set<String> cycleTokens;
    private final List<Set<String>> components;

    public CircularDependencyException(Set<String> cycleTokens, List<Set<String>> components) {
        super(null, "Circular dependency detected among adapters: " + String.join(", ", new TreeSet<>(cycleTokens)));
        this.cycleTokens = Collections.unmodifiableSet(new TreeSet<>(cycleTokens));
        this.components = List.copyOf(components);
    }

    public Set<String> getCycleTokens() {
        return cycleTokens;
    }

    /** Strongly connected components that form the cycles, one set per independent cycle. */
    public List<Set<String>> getComponents() {
        return components;
    }
}
