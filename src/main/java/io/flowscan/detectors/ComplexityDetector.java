package io.flowscan.detectors;

import io.flowscan.analysis.FunctionSummary;
import io.flowscan.model.Finding;
import io.flowscan.model.RiskLevel;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports functions whose cyclomatic complexity exceeds the configured threshold.
 * Above 25 is HIGH, above 20 MEDIUM, anything else over the threshold LOW.
 */
public class ComplexityDetector implements Detector {

    @Override
    public String id() {
        return "complexity";
    }

    @Override
    public String description() {
        return "Detects functions with high cyclomatic complexity";
    }

    @Override
    public List<Finding> detect(DetectionContext context) {
        int threshold = context.config().getComplexityThreshold();
        List<Finding> findings = new ArrayList<>();
        for (FunctionSummary function : context.functions()) {
            int complexity = function.cyclomaticComplexity();
            if (complexity <= threshold) {
                continue;
            }
            findings.add(Finding.builder()
                    .detectorId(id())
                    .riskLevel(riskFor(complexity))
                    .pattern("high_complexity")
                    .sourceFile(function.path())
                    .function(function.qualifiedName())
                    .lineNumber(function.line())
                    .description("High complexity in " + function.qualifiedName() + ": " + complexity
                            + " (threshold: " + threshold + ")")
                    .recommendation("Refactor function to reduce complexity from " + complexity
                            + " to below " + threshold)
                    .details("complexity=" + complexity)
                    .build());
        }
        return findings;
    }

    static RiskLevel riskFor(int complexity) {
        if (complexity > 25) {
            return RiskLevel.HIGH;
        }
        if (complexity > 20) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }
}
