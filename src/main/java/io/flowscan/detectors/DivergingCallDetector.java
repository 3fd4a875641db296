package io.flowscan.detectors;

import io.flowscan.ScanConfig;
import io.flowscan.analysis.FunctionSummary;
import io.flowscan.model.Finding;
import io.flowscan.model.RiskLevel;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports functions that loop forever only because a callee may.
 * Functions with their own loop sites are covered by {@link InfiniteLoopDetector}.
 */
public class DivergingCallDetector implements Detector {

    @Override
    public String id() {
        return "diverging-call";
    }

    @Override
    public String description() {
        return "Detects functions that call a function which may never return";
    }

    @Override
    public boolean isEnabled(ScanConfig config) {
        return config.isDetectInfiniteLoops();
    }

    @Override
    public List<Finding> detect(DetectionContext context) {
        List<Finding> findings = new ArrayList<>();
        for (FunctionSummary function : context.functions()) {
            if (function.callsDiverging()) {
                String callee = function.divergingCallee();
                findings.add(Finding.builder()
                        .detectorId(id())
                        .riskLevel(RiskLevel.MEDIUM)
                        .pattern("diverging_callee")
                        .sourceFile(function.path())
                        .function(function.qualifiedName())
                        .lineNumber(function.line())
                        .description(function.qualifiedName() + " may never return: it calls "
                                + callee + ", which may loop forever")
                        .recommendation("Fix the loop in " + callee + " or bound the call with a timeout")
                        .details("via " + callee)
                        .build());
            }
        }
        return findings;
    }
}
