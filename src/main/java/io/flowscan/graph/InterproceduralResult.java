package io.flowscan.graph;

import io.flowscan.analysis.FunctionSummary;
import io.flowscan.analysis.Termination;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Summaries of one analysis scope after the fixpoint, with the call graph used and the set
 * of functions that may diverge.
 *
 * @param summaries          Per-function summaries in source order
 * @param callGraph          Call graph the fixpoint ran over
 * @param divergingFunctions Names of functions whose status is {@code MAY_DIVERGE}, sorted
 * @param passes             Number of propagation passes, the final no-change pass included
 */
public record InterproceduralResult(
        Map<String, FunctionSummary> summaries,
        CallGraph callGraph,
        SortedSet<String> divergingFunctions,
        int passes
) {
    public InterproceduralResult {
        summaries = Collections.unmodifiableMap(new LinkedHashMap<>(summaries));
        Objects.requireNonNull(callGraph, "callGraph");
        divergingFunctions = Collections.unmodifiableSortedSet(new TreeSet<>(divergingFunctions));
    }

    /**
     * Collects the diverging set from the summaries' current status.
     */
    public static InterproceduralResult of(Map<String, FunctionSummary> summaries, CallGraph callGraph, int passes) {
        SortedSet<String> diverging = new TreeSet<>();
        summaries.forEach((name, summary) -> {
            if (summary.terminates() == Termination.MAY_DIVERGE) {
                diverging.add(name);
            }
        });
        return new InterproceduralResult(summaries, callGraph, diverging, passes);
    }

    public static InterproceduralResult empty() {
        return new InterproceduralResult(Map.of(), CallGraph.empty(), new TreeSet<>(), 0);
    }

    public Optional<FunctionSummary> summary(String qualifiedName) {
        return Optional.ofNullable(summaries.get(qualifiedName));
    }

    public boolean isDiverging(String qualifiedName) {
        return divergingFunctions.contains(qualifiedName);
    }

    public int functionCount() {
        return summaries.size();
    }
}
