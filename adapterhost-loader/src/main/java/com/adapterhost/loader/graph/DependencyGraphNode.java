package com.adapterhost.loader.graph;

import com.adapterhost.adapters.manifest.AdapterManifest;
import com.adapterhost.loader.AdapterModule;
import com.adapterhost.loader.AdapterSettings;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One configured adapter in the graph. {@code dependencies} are the tokens this node needs created
 * first; {@code dependents} are the tokens that need this node.
 */
public final class DependencyGraphNode {

    private final String token;
    private final AdapterModule module;
    private final AdapterManifest manifest;
    private final AdapterSettings settings;
    private final Set<String> dependencies = new LinkedHashSet<>();
    private final Set<String> dependents = new LinkedHashSet<>();

    public DependencyGraphNode(String token, AdapterModule module, AdapterManifest manifest, AdapterSettings settings) {
        this.token = Objects.requireNonNull(token, "token");
        this.module = Objects.requireNonNull(module, "module");
        this.manifest = Objects.requireNonNull(manifest, "manifest");
        this.settings = settings != null ? settings : AdapterSettings.empty();
    }

    public String getToken() {
        return token;
    }

    public AdapterModule getModule() {
        return module;
    }

    public AdapterManifest getManifest() {
        return manifest;
    }

    public AdapterSettings getSettings() {
        return settings;
    }

    public Set<String> getDependencies() {
        return Collections.unmodifiableSet(dependencies);
    }

    public Set<String> getDependents() {
        return Collections.unmodifiableSet(dependents);
    }

    boolean addDependency(String dependency) {
        return dependencies.add(dependency);
    }

    boolean addDependent(String dependent) {
        return dependents.add(dependent);
    }

    @Override
    public String toString() {
        return token + " -> " + dependencies;
    }
}
