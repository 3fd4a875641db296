package io.flowscan.engine;

import io.flowscan.analysis.FunctionSummary;
import io.flowscan.graph.InterproceduralResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;

/**
 * Result of project-wide propagation over a resolver-supplied call graph.
 *
 * @param result          Combined summaries, call graph and diverging set; names are
 *                        qualified by module ({@code pkg.mod.func})
 * @param functionsByFile Qualified function names per file, in input order
 * @param parseErrors     Error per file that could not be parsed
 * @param droppedEdges    Resolver edges dropped because an endpoint had no summary
 */
public record CrossFileAnalysis(
        InterproceduralResult result,
        Map<String, List<String>> functionsByFile,
        Map<String, String> parseErrors,
        int droppedEdges
) {
    public CrossFileAnalysis {
        Objects.requireNonNull(result, "result");
        Map<String, List<String>> byFile = new LinkedHashMap<>();
        functionsByFile.forEach((path, names) -> byFile.put(path, List.copyOf(names)));
        functionsByFile = Collections.unmodifiableMap(byFile);
        parseErrors = Collections.unmodifiableMap(new LinkedHashMap<>(parseErrors));
    }

    /**
     * Summaries of the functions defined in one file.
     */
    public List<FunctionSummary> fileResults(String path) {
        return functionsByFile.getOrDefault(path, List.of()).stream()
                .map(name -> result.summaries().get(name))
                .toList();
    }

    public SortedSet<String> allDiverging() {
        return result.divergingFunctions();
    }

    public Map<String, FunctionSummary> summaries() {
        return result.summaries();
    }
}
