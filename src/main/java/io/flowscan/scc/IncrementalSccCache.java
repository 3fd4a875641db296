package io.flowscan.scc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Strongly-connected components of a caller-owned directed graph, kept current across
 * edits without recomputing from scratch when an edit cannot change them.
 * <p>
 * After {@link #initialize} the component ids are Tarjan completion numbers, a reverse
 * topological order of the condensation. While that order holds, an added edge from a
 * higher to a lower id cannot close a cycle and costs O(1). An edge against the order is
 * checked with a reachability probe from its target back to its source; with a single
 * such edge the probe only visits components whose ids lie between the two endpoints.
 * Removing an edge between two components never changes the partition, and removing one
 * inside a component re-runs Tarjan over that component's members only. A merge falls
 * back to a full recompute.
 * <p>
 * The cache holds derived indices only; the edge set stays with the caller, who passes
 * the full post-edit list on every update. Not thread-safe: one writer at a time, and
 * readers only between updates. Use {@link #version()} to detect changes.
 */
public class IncrementalSccCache {

    private static final Logger log = LoggerFactory.getLogger(IncrementalSccCache.class);

    private int nodeCount;
    private int[] sccId;
    private final Map<Integer, SortedSet<Integer>> members = new LinkedHashMap<>();
    private int nextId;
    private long version;
    private boolean initialized;
    private boolean orderValid;

    /**
     * Computes the components from scratch and sets the version to 1.
     *
     * @throws IndexOutOfBoundsException if an edge references a node outside {@code [0, nodeCount)}
     */
    public void initialize(Collection<Edge> edges, int nodeCount) {
        TarjanScc.Components components = TarjanScc.compute(edges, nodeCount);
        this.nodeCount = nodeCount;
        load(components);
        this.version = 1;
        this.initialized = true;
    }

    /**
     * Applies an edit.
     *
     * @param added            Edges added by the edit
     * @param removed          Edges removed by the edit
     * @param edgesAfterChange The complete edge list after the edit
     * @return how the partition was affected
     * @throws IllegalStateException     if the cache was never initialized
     * @throws IndexOutOfBoundsException if an edge references a node outside the graph
     */
    public UpdateResult update(Collection<Edge> added, Collection<Edge> removed, Collection<Edge> edgesAfterChange) {
        requireInitialized();
        added.forEach(e -> e.checkBounds(nodeCount));
        removed.forEach(e -> e.checkBounds(nodeCount));

        EditView view = new EditView(edgesAfterChange);
        boolean split = false;

        for (Edge edge : removed) {
            if (edge.isSelfLoop() || sccId[edge.from()] != sccId[edge.to()]) {
                continue;
            }
            if (view.contains(edge)) {
                // A duplicate of the edge is still there
                continue;
            }
            split |= splitIfDisconnected(sccId[edge.from()], view);
        }

        List<Edge> againstOrder = new ArrayList<>();
        for (Edge edge : added) {
            int from = sccId[edge.from()];
            int to = sccId[edge.to()];
            if (from == to || (orderValid && from > to)) {
                continue;
            }
            againstOrder.add(edge);
        }

        boolean bounded = orderValid && againstOrder.size() == 1;
        for (Edge edge : againstOrder) {
            if (closesCycle(edge, view, bounded)) {
                log.debug("Edge {} merges components, recomputing", edge);
                initializeOrder(edgesAfterChange);
                version++;
                return UpdateResult.FULL_RECOMPUTE;
            }
        }
        if (!againstOrder.isEmpty()) {
            // The condensation now has an edge from a lower to a higher id
            orderValid = false;
        }

        if (split) {
            version++;
            return UpdateResult.UPDATED;
        }
        return UpdateResult.NO_CHANGE;
    }

    /**
     * Recomputes the components from scratch and compares them with the cached ones.
     */
    public boolean verify(Collection<Edge> edges, int nodeCount) {
        requireInitialized();
        if (nodeCount != this.nodeCount) {
            return false;
        }
        TarjanScc.Components fresh = TarjanScc.compute(edges, nodeCount);
        Set<Set<Integer>> expected = new HashSet<>();
        for (List<Integer> component : fresh.components()) {
            expected.add(new HashSet<>(component));
        }
        Set<Set<Integer>> actual = new HashSet<>();
        for (SortedSet<Integer> component : members.values()) {
            actual.add(new HashSet<>(component));
        }
        return expected.equals(actual);
    }

    /**
     * Members of the component containing {@code node}, sorted.
     */
    public SortedSet<Integer> getScc(int node) {
        return Collections.unmodifiableSortedSet(members.get(sccId(node)));
    }

    public int sccId(int node) {
        requireInitialized();
        if (node < 0 || node >= nodeCount) {
            throw new IndexOutOfBoundsException("Node " + node + " outside [0, " + nodeCount + ")");
        }
        return sccId[node];
    }

    /**
     * Checks if the node belongs to a component of two or more nodes.
     */
    public boolean isInCycle(int node) {
        return getScc(node).size() >= 2;
    }

    /**
     * Components with at least {@code minSize} members (never fewer than two), each sorted,
     * ordered by smallest member.
     */
    public List<List<Integer>> getCycles(int minSize) {
        requireInitialized();
        int threshold = Math.max(minSize, 2);
        return members.values().stream()
                .filter(component -> component.size() >= threshold)
                .<List<Integer>>map(List::copyOf)
                .sorted(Comparator.comparing((List<Integer> component) -> component.get(0)))
                .toList();
    }

    public int componentCount() {
        requireInitialized();
        return members.size();
    }

    public int nodeCount() {
        return nodeCount;
    }

    /**
     * 0 before initialization, 1 after it, and one more for every update that changed the
     * partition.
     */
    public long version() {
        return version;
    }

    public boolean isInitialized() {
        return initialized;
    }

    private void requireInitialized() {
        if (!initialized) {
            throw new IllegalStateException("SCC cache used before initialize()");
        }
    }

    private void initializeOrder(Collection<Edge> edges) {
        load(TarjanScc.compute(edges, nodeCount));
    }

    private void load(TarjanScc.Components components) {
        sccId = components.componentOf();
        members.clear();
        for (int id = 0; id < components.count(); id++) {
            members.put(id, new TreeSet<>(components.components().get(id)));
        }
        nextId = components.count();
        orderValid = true;
    }

    /**
     * Re-runs Tarjan over one component's members in the post-edit graph and replaces it
     * with the pieces if it fell apart.
     */
    private boolean splitIfDisconnected(int id, EditView view) {
        SortedSet<Integer> component = members.get(id);
        BitSet allowed = new BitSet(nodeCount);
        component.forEach(allowed::set);
        int[] roots = component.stream().mapToInt(Integer::intValue).toArray();
        TarjanScc.Components pieces = TarjanScc.run(view.adjacency(), nodeCount, roots, allowed);
        if (pieces.count() == 1) {
            return false;
        }
        members.remove(id);
        for (List<Integer> piece : pieces.components()) {
            int newId = nextId++;
            members.put(newId, new TreeSet<>(piece));
            piece.forEach(node -> sccId[node] = newId);
        }
        // Fresh ids are not ordered against the rest of the condensation
        orderValid = false;
        log.debug("Component {} split into {} components", id, pieces.count());
        return true;
    }

    /**
     * Probes for a path from the edge's target back to its source in the post-edit graph.
     * When {@code bounded}, only nodes whose component id lies between the two endpoints'
     * ids are visited.
     */
    private boolean closesCycle(Edge edge, EditView view, boolean bounded) {
        int low = sccId[edge.from()];
        int high = sccId[edge.to()];
        List<List<Integer>> adjacency = view.adjacency();
        BitSet visited = new BitSet(nodeCount);
        Deque<Integer> work = new ArrayDeque<>();
        work.push(edge.to());
        visited.set(edge.to());
        while (!work.isEmpty()) {
            int node = work.pop();
            if (node == edge.from()) {
                return true;
            }
            for (int next : adjacency.get(node)) {
                if (visited.get(next)) {
                    continue;
                }
                if (bounded && (sccId[next] < low || sccId[next] > high)) {
                    continue;
                }
                visited.set(next);
                work.push(next);
            }
        }
        return false;
    }

    /**
     * Post-edit edge list with its indices built on first use, so fast-path updates never
     * touch the full list.
     */
    private final class EditView {
        private final Collection<Edge> edges;
        private List<List<Integer>> adjacency;
        private Set<Edge> edgeSet;

        EditView(Collection<Edge> edges) {
            this.edges = edges;
        }

        List<List<Integer>> adjacency() {
            if (adjacency == null) {
                adjacency = TarjanScc.adjacency(edges, nodeCount);
            }
            return adjacency;
        }

        boolean contains(Edge edge) {
            if (edgeSet == null) {
                edgeSet = new HashSet<>(edges);
            }
            return edgeSet.contains(edge);
        }
    }
}
