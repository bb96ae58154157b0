package com.adapterhost.loader;

import com.adapterhost.adapters.extension.ExtensionAdapter;
import com.adapterhost.adapters.extension.Hookable;
import com.adapterhost.adapters.manifest.AdapterDependency;
import com.adapterhost.adapters.manifest.AdapterManifest;
import com.adapterhost.adapters.manifest.ExtensionPoint;
import com.adapterhost.loader.graph.DependencyGraph;
import com.adapterhost.loader.graph.DependencyGraphNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Loads a configuration set into adapter instances:
 * <ol>
 *   <li>resolve each entry's module and build the dependency graph from the manifests,</li>
 *   <li>sort it topologically (Kahn),</li>
 *   <li>create each adapter in that order with its dependency bundle,</li>
 *   <li>attach extensions to their target hooks, highest priority first.</li>
 * </ol>
 * Steps 1 to 3 fail fast with an {@link AdapterConfigurationException}. Wiring problems in step 4 are
 * reported to the {@link ExtensionWiringObserver} and the extension is skipped.
 * <p>
 * Not thread-safe: run one load at a time, before any adapter is in use.
 */
public final class AdapterLoader {

    private static final Logger log = LoggerFactory.getLogger(AdapterLoader.class);

    private static final Comparator<DependencyGraphNode> EXTENSION_ORDER =
            Comparator.<DependencyGraphNode>comparingInt(n -> n.getManifest().getExtends().getPriority()).reversed()
                    .thenComparing(DependencyGraphNode::getToken);

    private final AdapterModuleResolver resolver;
    private final ExtensionWiringObserver observer;

    public AdapterLoader(AdapterModuleResolver resolver) {
        this(resolver, new LoggingExtensionWiringObserver());
    }

    public AdapterLoader(AdapterModuleResolver resolver, ExtensionWiringObserver observer) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.observer = Objects.requireNonNull(observer, "observer");
    }

    public LoadedAdapters load(Map<String, AdapterConfig> configs) {
        DependencyGraph graph = buildDependencyGraph(configs);
        List<String> order = graph.topologicalSort();
        log.info("Adapter load order: {}", order);
        Map<String, Object> instances = instantiate(graph, order);
        List<ExtensionConnection> connections = connectExtensions(graph, order, instances);
        Map<String, AdapterManifest> manifests = new LinkedHashMap<>();
        for (String token : order) {
            manifests.put(token, graph.getNode(token).getManifest());
        }
        log.info("Loaded {} adapter(s), {} extension connection(s)", instances.size(), connections.size());
        return new LoadedAdapters(instances, manifests, order, connections);
    }

    /**
     * Resolves modules and adds one node per configured token, then one edge per required dependency
     * and per optional dependency that is configured.
     *
     * @throws MissingDependencyException   if a required dependency is not configured
     * @throws AdapterConfigurationException for unresolvable modules, invalid manifests or duplicate aliases
     */
    public DependencyGraph buildDependencyGraph(Map<String, AdapterConfig> configs) {
        DependencyGraph graph = new DependencyGraph();
        for (Map.Entry<String, AdapterConfig> entry : configs.entrySet()) {
            String token = entry.getKey();
            AdapterConfig config = entry.getValue();
            AdapterModule module = config.getModule() != null ? config.getModule() : resolver.resolve(config.getModuleRef());
            AdapterManifest manifest;
            try {
                manifest = module.manifest().validate();
            } catch (IllegalArgumentException e) {
                throw new AdapterConfigurationException(token, "Adapter '" + token + "': " + e.getMessage(), e);
            }
            graph.addNode(new DependencyGraphNode(token, module, manifest, config.getSettings()));
        }

        for (DependencyGraphNode node : graph.getNodes()) {
            AdapterManifest manifest = node.getManifest();
            checkAliases(node.getToken(), manifest);
            for (AdapterDependency dep : manifest.getRequires()) {
                if (!graph.contains(dep.getId())) {
                    throw new MissingDependencyException(node.getToken(), dep.getId(), graph.getTokens(),
                            tokensWithManifestId(graph, dep.getId()));
                }
                graph.addEdge(dep.getId(), node.getToken());
            }
            for (AdapterDependency dep : manifest.getOptional()) {
                if (graph.contains(dep.getId())) {
                    graph.addEdge(dep.getId(), node.getToken());
                } else {
                    log.debug("Optional dependency {} of {} is not configured", dep.getId(), node.getToken());
                }
            }
        }
        return graph;
    }

    private static void checkAliases(String token, AdapterManifest manifest) {
        Set<String> seen = new HashSet<>();
        List<AdapterDependency> all = new ArrayList<>(manifest.getRequires());
        all.addAll(manifest.getOptional());
        for (AdapterDependency dep : all) {
            if (!seen.add(dep.getEffectiveAlias())) {
                throw new AdapterConfigurationException(token,
                        "Adapter '" + token + "' binds two dependencies to alias '" + dep.getEffectiveAlias() + "'");
            }
        }
    }

    private static List<String> tokensWithManifestId(DependencyGraph graph, String manifestId) {
        List<String> matches = new ArrayList<>();
        for (DependencyGraphNode node : graph.getNodes()) {
            if (manifestId.equals(node.getManifest().getId())) {
                matches.add(node.getToken());
            }
        }
        return matches;
    }

    private Map<String, Object> instantiate(DependencyGraph graph, List<String> order) {
        Map<String, Object> instances = new LinkedHashMap<>();
        for (String token : order) {
            DependencyGraphNode node = graph.getNode(token);
            AdapterDependencies dependencies = bundleFor(node, instances);
            Object instance;
            try {
                instance = node.getModule().create(node.getSettings(), dependencies);
            } catch (AdapterConfigurationException e) {
                throw e;
            } catch (Exception e) {
                throw new AdapterInstantiationException(token, String.valueOf(e.getMessage()), e);
            }
            if (instance == null) {
                throw new AdapterInstantiationException(token, "module " + node.getModule().moduleRef() + " returned null", null);
            }
            instances.put(token, instance);
            log.debug("Created adapter {} ({}) with dependencies {}", token, node.getManifest().getId(), dependencies.aliases());
        }
        return instances;
    }

    private static AdapterDependencies bundleFor(DependencyGraphNode node, Map<String, Object> instances) {
        AdapterDependencies.Builder bundle = AdapterDependencies.builder();
        for (AdapterDependency dep : node.getManifest().getRequires()) {
            bundle.put(dep.getEffectiveAlias(), instances.get(dep.getId()));
        }
        for (AdapterDependency dep : node.getManifest().getOptional()) {
            Object instance = instances.get(dep.getId());
            if (instance != null) {
                bundle.put(dep.getEffectiveAlias(), instance);
            }
        }
        return bundle.build();
    }

    private List<ExtensionConnection> connectExtensions(DependencyGraph graph, List<String> order, Map<String, Object> instances) {
        List<DependencyGraphNode> extensions = new ArrayList<>();
        for (String token : order) {
            DependencyGraphNode node = graph.getNode(token);
            if (node.getManifest().getExtends() != null) {
                extensions.add(node);
            }
        }
        extensions.sort(EXTENSION_ORDER);

        List<ExtensionConnection> connections = new ArrayList<>();
        for (DependencyGraphNode node : extensions) {
            String token = node.getToken();
            ExtensionPoint point = node.getManifest().getExtends();
            Object target = instances.get(point.getAdapter());
            if (target == null) {
                skipped(token, point, "target adapter '" + point.getAdapter() + "' is not configured");
                continue;
            }
            if (!(target instanceof Hookable) || !((Hookable) target).hookNames().contains(point.getHook())) {
                skipped(token, point, "target adapter '" + point.getAdapter() + "' has no hook '" + point.getHook() + "'");
                continue;
            }
            Object extension = instances.get(token);
            Optional<Consumer<Object>> method = extension instanceof ExtensionAdapter
                    ? ((ExtensionAdapter) extension).extensionMethod(point.getMethod())
                    : Optional.empty();
            if (method.isEmpty()) {
                skipped(token, point, "extension has no method '" + point.getMethod() + "'");
                continue;
            }
            try {
                ((Hookable) target).registerHook(point.getHook(), method.get());
            } catch (RuntimeException e) {
                skipped(token, point, "hook registration failed: " + e.getMessage());
                continue;
            }
            ExtensionConnection connection = new ExtensionConnection(token, point.getAdapter(), point.getHook(),
                    point.getMethod(), point.getPriority());
            connections.add(connection);
            try {
                observer.onConnected(connection);
            } catch (RuntimeException e) {
                log.debug("Extension wiring observer failed on connect of {}", token, e);
            }
        }
        return connections;
    }

    private void skipped(String token, ExtensionPoint point, String reason) {
        try {
            observer.onSkipped(token, point, reason);
        } catch (RuntimeException e) {
            log.debug("Extension wiring observer failed on skip of {}", token, e);
        }
    }
}
