package io.flowscan.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Calls between functions of one analysis scope, keyed by qualified name.
 * <p>
 * Only calls that resolve to a function of the scope are edges; library and unresolved
 * calls are never nodes. Node order and per-node edge order are insertion order, so
 * traversals are deterministic.
 */
public class CallGraph {

    private final Map<String, List<String>> callees;

    private CallGraph(Map<String, List<String>> callees) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        callees.forEach((caller, targets) -> copy.put(caller, List.copyOf(targets)));
        this.callees = Collections.unmodifiableMap(copy);
    }

    public static CallGraph empty() {
        return new CallGraph(Map.of());
    }

    /**
     * Returns the callees of the given function in edge order, or an empty list.
     */
    public List<String> callees(String caller) {
        return callees.getOrDefault(caller, List.of());
    }

    /**
     * Returns the callers of the given function, in node order.
     */
    public List<String> callers(String callee) {
        List<String> result = new ArrayList<>();
        callees.forEach((caller, targets) -> {
            if (targets.contains(callee)) {
                result.add(caller);
            }
        });
        return result;
    }

    /**
     * All functions that appear as a caller, in insertion order.
     */
    public Set<String> nodes() {
        return callees.keySet();
    }

    /**
     * Every function mentioned by the graph, as caller or callee, in order of first
     * mention: each caller in insertion order, followed by its callees.
     */
    public Set<String> allFunctions() {
        Set<String> result = new LinkedHashSet<>();
        callees.forEach((caller, targets) -> {
            result.add(caller);
            result.addAll(targets);
        });
        return result;
    }

    public Map<String, List<String>> asMap() {
        return callees;
    }

    public int edgeCount() {
        return callees.values().stream().mapToInt(List::size).sum();
    }

    public boolean hasEdge(String caller, String callee) {
        return callees(caller).contains(callee);
    }

    @Override
    public String toString() {
        return "CallGraph" + callees;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, LinkedHashSet<String>> callees = new LinkedHashMap<>();

        /**
         * Adds a function without calls. Adding an existing one is a no-op.
         */
        public Builder addNode(String function) {
            callees.computeIfAbsent(function, k -> new LinkedHashSet<>());
            return this;
        }

        /**
         * Adds a call edge. Duplicate edges are kept once, at their first position.
         */
        public Builder addEdge(String caller, String callee) {
            if (caller == null || callee == null) {
                throw new IllegalArgumentException("Call edge endpoints cannot be null");
            }
            callees.computeIfAbsent(caller, k -> new LinkedHashSet<>()).add(callee);
            return this;
        }

        public Builder addEdges(String caller, List<String> targets) {
            addNode(caller);
            targets.forEach(callee -> addEdge(caller, callee));
            return this;
        }

        public CallGraph build() {
            Map<String, List<String>> frozen = new LinkedHashMap<>();
            callees.forEach((caller, targets) -> frozen.put(caller, new ArrayList<>(targets)));
            return new CallGraph(frozen);
        }
    }
}
