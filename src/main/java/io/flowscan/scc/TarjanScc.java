package io.flowscan.scc;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

/**
 * Tarjan's strongly-connected-components algorithm, iterative so deep graphs cannot
 * overflow the stack.
 * <p>
 * Components are numbered in completion order. Every component completes after all
 * components it can reach, so for an edge between two components the source always has
 * the higher number.
 */
public final class TarjanScc {

    private TarjanScc() {
    }

    /**
     * Components found by one run.
     *
     * @param componentOf Component number per node, or -1 for nodes outside the run
     * @param components  Members of each component, sorted ascending, indexed by number
     */
    public record Components(int[] componentOf, List<List<Integer>> components) {
        public Components {
            componentOf = componentOf.clone();
            components = components.stream().map(List::copyOf).toList();
        }

        public int count() {
            return components.size();
        }

        @Override
        public int[] componentOf() {
            return componentOf.clone();
        }

        public int componentOf(int node) {
            return componentOf[node];
        }
    }

    /**
     * Computes the components of a whole graph in O(V + E).
     *
     * @throws IndexOutOfBoundsException if an edge references a node outside {@code [0, nodeCount)}
     */
    public static Components compute(Collection<Edge> edges, int nodeCount) {
        List<List<Integer>> adjacency = adjacency(edges, nodeCount);
        BitSet all = new BitSet(nodeCount);
        all.set(0, nodeCount);
        int[] roots = new int[nodeCount];
        Arrays.setAll(roots, i -> i);
        return run(adjacency, nodeCount, roots, all);
    }

    /**
     * Builds an adjacency list, keeping edge order.
     */
    public static List<List<Integer>> adjacency(Collection<Edge> edges, int nodeCount) {
        if (nodeCount < 0) {
            throw new IllegalArgumentException("Node count cannot be negative: " + nodeCount);
        }
        List<List<Integer>> adjacency = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) {
            adjacency.add(new ArrayList<>());
        }
        for (Edge edge : edges) {
            edge.checkBounds(nodeCount);
            adjacency.get(edge.from()).add(edge.to());
        }
        return adjacency;
    }

    /**
     * Runs Tarjan over the subgraph induced by {@code allowed}, starting from {@code roots}
     * in order.
     */
    static Components run(List<List<Integer>> adjacency, int nodeCount, int[] roots, BitSet allowed) {
        int[] index = new int[nodeCount];
        int[] low = new int[nodeCount];
        int[] componentOf = new int[nodeCount];
        Arrays.fill(index, -1);
        Arrays.fill(componentOf, -1);
        boolean[] onStack = new boolean[nodeCount];
        Deque<Integer> stack = new ArrayDeque<>();
        Deque<int[]> frames = new ArrayDeque<>();
        List<List<Integer>> components = new ArrayList<>();
        int counter = 0;

        for (int root : roots) {
            if (!allowed.get(root) || index[root] != -1) {
                continue;
            }
            index[root] = low[root] = counter++;
            stack.push(root);
            onStack[root] = true;
            frames.push(new int[]{root, 0});

            while (!frames.isEmpty()) {
                int[] frame = frames.peek();
                int v = frame[0];
                List<Integer> successors = adjacency.get(v);
                if (frame[1] < successors.size()) {
                    int w = successors.get(frame[1]++);
                    if (!allowed.get(w)) {
                        continue;
                    }
                    if (index[w] == -1) {
                        index[w] = low[w] = counter++;
                        stack.push(w);
                        onStack[w] = true;
                        frames.push(new int[]{w, 0});
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], index[w]);
                    }
                    continue;
                }

                frames.pop();
                if (!frames.isEmpty()) {
                    int parent = frames.peek()[0];
                    low[parent] = Math.min(low[parent], low[v]);
                }
                if (low[v] == index[v]) {
                    List<Integer> members = new ArrayList<>();
                    int w;
                    do {
                        w = stack.pop();
                        onStack[w] = false;
                        componentOf[w] = components.size();
                        members.add(w);
                    } while (w != v);
                    members.sort(null);
                    components.add(members);
                }
            }
        }
        return new Components(componentOf, components);
    }
}
