package io.flowscan.scc;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Labelled dependency graph (modules, classes) that owns its edge set and keeps an
 * {@link IncrementalSccCache} in step with it.
 * <p>
 * Edits are staged with {@link #addDependency} and {@link #removeDependency} and applied
 * with {@link #commit()}. New labels get the next free node index; when a commit brings
 * new nodes the cache is initialized again. Single-writer, like the cache.
 */
public class DependencyGraph {

    private final Map<String, Integer> index = new HashMap<>();
    private final List<String> labels = new ArrayList<>();
    private final Set<Edge> edges = new LinkedHashSet<>();
    private final Set<Edge> pendingAdded = new LinkedHashSet<>();
    private final Set<Edge> pendingRemoved = new LinkedHashSet<>();
    private final IncrementalSccCache cache;

    public DependencyGraph() {
        this(new IncrementalSccCache());
    }

    public DependencyGraph(IncrementalSccCache cache) {
        this.cache = cache;
    }

    /**
     * Builds and commits a graph from an adjacency map.
     */
    public static DependencyGraph of(Map<String, ? extends Collection<String>> dependencies) {
        DependencyGraph graph = new DependencyGraph();
        dependencies.forEach((from, targets) -> {
            graph.addNode(from);
            targets.forEach(to -> graph.addDependency(from, to));
        });
        graph.commit();
        return graph;
    }

    /**
     * Registers a node without edges. Returns its index.
     */
    public int addNode(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Node label cannot be null or blank");
        }
        return index.computeIfAbsent(label, l -> {
            labels.add(l);
            return labels.size() - 1;
        });
    }

    /**
     * Stages an edge. Adding an existing edge is a no-op.
     */
    public void addDependency(String from, String to) {
        Edge edge = new Edge(addNode(from), addNode(to));
        if (edges.add(edge) && !pendingRemoved.remove(edge)) {
            pendingAdded.add(edge);
        }
    }

    /**
     * Stages the removal of an edge. Removing an unknown edge is a no-op.
     */
    public void removeDependency(String from, String to) {
        Integer f = index.get(from);
        Integer t = index.get(to);
        if (f == null || t == null) {
            return;
        }
        Edge edge = new Edge(f, t);
        if (edges.remove(edge) && !pendingAdded.remove(edge)) {
            pendingRemoved.add(edge);
        }
    }

    /**
     * Applies the staged edits to the cache.
     */
    public UpdateResult commit() {
        if (!cache.isInitialized() || cache.nodeCount() != labels.size()) {
            pendingAdded.clear();
            pendingRemoved.clear();
            cache.initialize(edges, labels.size());
            return UpdateResult.FULL_RECOMPUTE;
        }
        if (pendingAdded.isEmpty() && pendingRemoved.isEmpty()) {
            return UpdateResult.NO_CHANGE;
        }
        UpdateResult result = cache.update(List.copyOf(pendingAdded), List.copyOf(pendingRemoved), List.copyOf(edges));
        pendingAdded.clear();
        pendingRemoved.clear();
        return result;
    }

    /**
     * Checks if edits are staged but not committed. A graph that was never committed
     * always has pending changes.
     */
    public boolean hasPendingChanges() {
        return !cache.isInitialized() || !pendingAdded.isEmpty() || !pendingRemoved.isEmpty()
                || cache.nodeCount() != labels.size();
    }

    /**
     * Committed cycles as labels, each sorted by node index. Empty before the first commit.
     */
    public List<List<String>> cycles(int minSize) {
        if (!cache.isInitialized()) {
            return List.of();
        }
        return cache.getCycles(minSize).stream()
                .map(cycle -> cycle.stream().map(labels::get).toList())
                .toList();
    }

    public boolean isInCycle(String label) {
        Integer node = index.get(label);
        return node != null && cache.isInitialized() && node < cache.nodeCount() && cache.isInCycle(node);
    }

    public Optional<Integer> nodeIndex(String label) {
        return Optional.ofNullable(index.get(label));
    }

    public String label(int node) {
        return labels.get(node);
    }

    public int nodeCount() {
        return labels.size();
    }

    public Set<Edge> edges() {
        return Set.copyOf(edges);
    }

    /**
     * Checks the cache against a from-scratch computation over the current edges.
     */
    public boolean verify() {
        return cache.verify(edges, labels.size());
    }

    public IncrementalSccCache cache() {
        return cache;
    }
}
