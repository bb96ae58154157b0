package com.adapterhost.loader.graph;

import com.adapterhost.loader.CircularDependencyException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph of configured adapters. An edge runs from a dependency to its dependent, so a
 * topological order creates dependencies first. Node insertion order breaks ties, which keeps the
 * load order stable for the same configuration.
 * <p>
 * Not thread-safe; built and sorted once per load.
 */
public final class DependencyGraph {

    private final Map<String, DependencyGraphNode> nodes = new LinkedHashMap<>();

    /** @throws IllegalArgumentException if a node with the same token exists */
    public void addNode(DependencyGraphNode node) {
        if (nodes.putIfAbsent(node.getToken(), node) != null) {
            throw new IllegalArgumentException("Duplicate adapter token: " + node.getToken());
        }
    }

    /**
     * Records that {@code dependent} needs {@code dependency}. Repeated edges are ignored.
     *
     * @throws IllegalArgumentException if either token has no node
     */
    public void addEdge(String dependency, String dependent) {
        DependencyGraphNode from = requireNode(dependency);
        DependencyGraphNode to = requireNode(dependent);
        from.addDependent(dependent);
        to.addDependency(dependency);
    }

    public boolean contains(String token) {
        return nodes.containsKey(token);
    }

    /** Node for {@code token}, or null. */
    public DependencyGraphNode getNode(String token) {
        return nodes.get(token);
    }

    public Collection<DependencyGraphNode> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public Set<String> getTokens() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Kahn's algorithm. Every token appears once, after all of its dependencies.
     *
     * @throws CircularDependencyException naming exactly the tokens that lie on a cycle
     */
    public List<String> topologicalSort() {
        Map<String, Integer> inDegree = new HashMap<>();
        Deque<String> ready = new ArrayDeque<>();
        for (DependencyGraphNode node : nodes.values()) {
            int degree = node.getDependencies().size();
            inDegree.put(node.getToken(), degree);
            if (degree == 0) {
                ready.add(node.getToken());
            }
        }
        List<String> order = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            String token = ready.poll();
            order.add(token);
            for (String dependent : nodes.get(token).getDependents()) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (order.size() < nodes.size()) {
            Set<String> unresolved = new LinkedHashSet<>(nodes.keySet());
            unresolved.removeAll(order);
            List<Set<String>> cycles = new CycleFinder(unresolved).find();
            Set<String> cycleTokens = new LinkedHashSet<>();
            cycles.forEach(cycleTokens::addAll);
            throw new CircularDependencyException(cycleTokens, cycles);
        }
        return Collections.unmodifiableList(order);
    }

    private DependencyGraphNode requireNode(String token) {
        DependencyGraphNode node = nodes.get(token);
        if (node == null) {
            throw new IllegalArgumentException("Unknown adapter token: " + token);
        }
        return node;
    }

    /**
     * Tarjan's strongly connected components over the nodes Kahn's pass could not emit. Those also
     * include adapters that only depend on a cycle; keeping components of size &gt; 1 (or with a
     * self-edge) leaves the cycles themselves.
     */
    private final class CycleFinder {
        private final Set<String> scope;
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private final List<Set<String>> cycles = new ArrayList<>();
        private int counter;

        CycleFinder(Set<String> scope) {
            this.scope = scope;
        }

        List<Set<String>> find() {
            for (String token : scope) {
                if (!index.containsKey(token)) {
                    visit(token);
                }
            }
            return cycles;
        }

        private void visit(String token) {
            index.put(token, counter);
            lowLink.put(token, counter);
            counter++;
            stack.push(token);
            onStack.add(token);
            for (String next : nodes.get(token).getDependents()) {
                if (!scope.contains(next)) continue;
                if (!index.containsKey(next)) {
                    visit(next);
                    lowLink.put(token, Math.min(lowLink.get(token), lowLink.get(next)));
                } else if (onStack.contains(next)) {
                    lowLink.put(token, Math.min(lowLink.get(token), index.get(next)));
                }
            }
            if (lowLink.get(token).equals(index.get(token))) {
                Set<String> component = new LinkedHashSet<>();
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    component.add(member);
                } while (!member.equals(token));
                if (component.size() > 1 || nodes.get(token).getDependencies().contains(token)) {
                    cycles.add(Collections.unmodifiableSet(component));
                }
            }
        }
    }
}
