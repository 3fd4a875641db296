package io.flowscan.graph;

import io.flowscan.analysis.FunctionSummary;
import io.flowscan.analysis.Termination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Propagates "may diverge" from callees to callers until nothing changes.
 * <p>
 * Each pass reads the status committed by the previous pass and buffers its own updates,
 * committing them at the end of the pass. A caller takes the first diverging callee in
 * call-graph edge order. Status only ever moves from {@code ALWAYS} to
 * {@code MAY_DIVERGE}, so the loop ends after at most one pass per function plus a final
 * pass without changes, recursive cycles included.
 */
public class InterproceduralPropagator {

    private static final Logger log = LoggerFactory.getLogger(InterproceduralPropagator.class);

    /**
     * Runs the fixpoint and mutates the given summaries in place.
     *
     * @param summaries Every function of the scope, keyed by qualified name
     * @param callGraph Calls between those functions
     * @throws IllegalStateException if the call graph mentions a function without a summary
     */
    public InterproceduralResult propagate(Map<String, FunctionSummary> summaries, CallGraph callGraph) {
        for (String function : callGraph.allFunctions()) {
            if (!summaries.containsKey(function)) {
                throw new IllegalStateException("Call graph references function without summary: " + function);
            }
        }

        int passes = 0;
        while (true) {
            passes++;
            Map<FunctionSummary, String> updates = new LinkedHashMap<>();
            for (Map.Entry<String, FunctionSummary> entry : summaries.entrySet()) {
                FunctionSummary summary = entry.getValue();
                if (summary.terminates() != Termination.ALWAYS) {
                    continue;
                }
                for (String callee : callGraph.callees(entry.getKey())) {
                    if (summaries.get(callee).terminates() == Termination.MAY_DIVERGE) {
                        updates.put(summary, callee);
                        break;
                    }
                }
            }
            if (updates.isEmpty()) {
                break;
            }
            updates.forEach(FunctionSummary::markMayDiverge);
        }

        InterproceduralResult result = InterproceduralResult.of(summaries, callGraph, passes);
        log.debug("Propagation over {} functions and {} calls finished after {} passes, {} may diverge",
                summaries.size(), callGraph.edgeCount(), passes, result.divergingFunctions().size());
        return result;
    }
}
