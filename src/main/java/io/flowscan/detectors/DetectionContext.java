package io.flowscan.detectors;

import io.flowscan.ScanConfig;
import io.flowscan.analysis.FunctionSummary;
import io.flowscan.engine.BatchAnalysis;
import io.flowscan.engine.CrossFileAnalysis;
import io.flowscan.scc.DependencyGraph;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Input shared by all detectors of one run.
 *
 * @param summaries    Function summaries in report order
 * @param dependencies Module or class dependency graph, or null when none was supplied
 * @param config       Scan configuration
 */
public record DetectionContext(
        List<FunctionSummary> summaries,
        DependencyGraph dependencies,
        ScanConfig config
) {
    public DetectionContext {
        summaries = summaries == null ? List.of() : List.copyOf(summaries);
        Objects.requireNonNull(config, "config");
    }

    public static DetectionContext of(BatchAnalysis batch, ScanConfig config) {
        return new DetectionContext(batch.allSummaries(), null, config);
    }

    public static DetectionContext of(CrossFileAnalysis analysis, ScanConfig config) {
        return new DetectionContext(List.copyOf(analysis.summaries().values()), null, config);
    }

    public DetectionContext withDependencies(DependencyGraph dependencies) {
        return new DetectionContext(summaries, dependencies, config);
    }

    /**
     * Summaries of the functions not excluded by the configuration.
     */
    public List<FunctionSummary> functions() {
        return summaries.stream()
                .filter(s -> !config.isFunctionExcluded(s.qualifiedName()))
                .toList();
    }

    public Optional<DependencyGraph> dependencyGraph() {
        return Optional.ofNullable(dependencies);
    }
}
