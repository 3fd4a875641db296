package io.flowscan.engine;

import io.flowscan.analysis.FunctionSummary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-file results of a batch, in input order.
 */
public record BatchAnalysis(Map<String, FileAnalysis> files) {
    public BatchAnalysis {
        files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
    }

    public Optional<FileAnalysis> get(String path) {
        return Optional.ofNullable(files.get(path));
    }

    public List<FileAnalysis> failures() {
        return files.values().stream()
                .filter(f -> !f.isSuccess())
                .toList();
    }

    public int totalFunctions() {
        return files.values().stream().mapToInt(FileAnalysis::functionCount).sum();
    }

    /**
     * Every summary of the batch, file by file.
     */
    public List<FunctionSummary> allSummaries() {
        List<FunctionSummary> result = new ArrayList<>();
        files.values().forEach(f -> result.addAll(f.summaries().values()));
        return result;
    }
}
