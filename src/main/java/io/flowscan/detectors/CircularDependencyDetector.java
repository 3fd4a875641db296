package io.flowscan.detectors;

import io.flowscan.model.Finding;
import io.flowscan.model.RiskLevel;
import io.flowscan.scc.DependencyGraph;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports each dependency cycle of the context's dependency graph. Does nothing when the
 * context carries no graph.
 */
public class CircularDependencyDetector implements Detector {

    @Override
    public String id() {
        return "circular-dependency";
    }

    @Override
    public String description() {
        return "Detects cycles in the module or class dependency graph";
    }

    @Override
    public List<Finding> detect(DetectionContext context) {
        if (context.dependencyGraph().isEmpty()) {
            return List.of();
        }
        DependencyGraph graph = context.dependencyGraph().get();
        if (graph.hasPendingChanges()) {
            graph.commit();
        }
        List<Finding> findings = new ArrayList<>();
        for (List<String> cycle : graph.cycles(context.config().getMinCycleSize())) {
            String members = String.join(", ", cycle);
            findings.add(Finding.builder()
                    .detectorId(id())
                    .riskLevel(RiskLevel.HIGH)
                    .pattern("circular_dependency")
                    .description("Circular dependency among " + cycle.size() + " nodes: " + members)
                    .details(members)
                    .recommendation("Break the cycle by extracting the shared part or inverting one dependency")
                    .build());
        }
        return findings;
    }
}
