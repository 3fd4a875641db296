package io.flowscan.detectors;

import io.flowscan.ScanConfig;
import io.flowscan.analysis.FunctionSummary;
import io.flowscan.analysis.LoopSite;
import io.flowscan.model.Finding;
import io.flowscan.model.RiskLevel;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports every loop site: loops with no reachable way out.
 */
public class InfiniteLoopDetector implements Detector {

    @Override
    public String id() {
        return "infinite-loop";
    }

    @Override
    public String description() {
        return "Detects loops that can never exit";
    }

    @Override
    public boolean isEnabled(ScanConfig config) {
        return config.isDetectInfiniteLoops();
    }

    @Override
    public List<Finding> detect(DetectionContext context) {
        List<Finding> findings = new ArrayList<>();
        for (FunctionSummary function : context.functions()) {
            for (LoopSite site : function.loopSites()) {
                findings.add(createFinding(function, site));
            }
        }
        return findings;
    }

    private Finding createFinding(FunctionSummary function, LoopSite site) {
        return Finding.builder()
                .detectorId(id())
                .riskLevel(RiskLevel.HIGH)
                .pattern(site.kind().label())
                .sourceFile(function.path())
                .function(function.qualifiedName())
                .lineNumber(site.line())
                .affectedLines(List.of(site.line()))
                .description("Potential infinite loop in " + function.qualifiedName() + ": " + site.description())
                .recommendation(site.kind().fixSuggestion())
                .build();
    }
}
