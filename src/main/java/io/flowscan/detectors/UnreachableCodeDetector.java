package io.flowscan.detectors;

import io.flowscan.ScanConfig;
import io.flowscan.analysis.FunctionSummary;
import io.flowscan.model.Finding;
import io.flowscan.model.RiskLevel;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reports functions with statements control can never reach, one finding per function.
 */
public class UnreachableCodeDetector implements Detector {

    private static final int MAX_LISTED_LINES = 10;

    @Override
    public String id() {
        return "unreachable-code";
    }

    @Override
    public String description() {
        return "Detects statements that can never execute";
    }

    @Override
    public boolean isEnabled(ScanConfig config) {
        return config.isDetectUnreachable();
    }

    @Override
    public List<Finding> detect(DetectionContext context) {
        List<Finding> findings = new ArrayList<>();
        for (FunctionSummary function : context.functions()) {
            if (function.unreachableLines().isEmpty()) {
                continue;
            }
            List<Integer> lines = List.copyOf(function.unreachableLines());
            findings.add(Finding.builder()
                    .detectorId(id())
                    .riskLevel(RiskLevel.MEDIUM)
                    .pattern("unreachable_code")
                    .sourceFile(function.path())
                    .function(function.qualifiedName())
                    .lineNumber(lines.get(0))
                    .affectedLines(lines)
                    .description("Found " + lines.size() + " unreachable lines in "
                            + function.qualifiedName() + ": " + listLines(lines))
                    .recommendation("Remove unreachable code or fix the control flow logic")
                    .build());
        }
        return findings;
    }

    static String listLines(List<Integer> lines) {
        String listed = lines.stream()
                .limit(MAX_LISTED_LINES)
                .map(String::valueOf)
                .collect(Collectors.joining(", "));
        if (lines.size() > MAX_LISTED_LINES) {
            listed += " (and " + (lines.size() - MAX_LISTED_LINES) + " more)";
        }
        return listed;
    }
}
