package io.flowscan.engine;

import io.flowscan.analysis.FunctionSummary;
import io.flowscan.graph.InterproceduralResult;

import java.util.Map;
import java.util.Objects;

/**
 * Result for one file. A file that failed to parse carries the error and no functions.
 *
 * @param path   File path
 * @param result Summaries after local propagation; empty on failure
 * @param error  Parse or analysis error, or null
 */
public record FileAnalysis(String path, InterproceduralResult result, String error) {
    public FileAnalysis {
        Objects.requireNonNull(path, "path");
        if (result == null) {
            result = InterproceduralResult.empty();
        }
    }

    public static FileAnalysis success(String path, InterproceduralResult result) {
        return new FileAnalysis(path, result, null);
    }

    public static FileAnalysis failure(String path, String error) {
        return new FileAnalysis(path, InterproceduralResult.empty(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Map<String, FunctionSummary> summaries() {
        return result.summaries();
    }

    public int functionCount() {
        return result.functionCount();
    }
}
