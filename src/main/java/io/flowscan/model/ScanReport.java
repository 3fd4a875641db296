package io.flowscan.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one scan produced, ready for reporting.
 *
 * @param findings          Findings, most severe first
 * @param filesAnalyzed     Number of input files
 * @param functionsAnalyzed Number of functions summarized
 * @param parseErrors       Error per file that could not be parsed
 * @param scanDurationMs    Wall-clock duration of the scan
 */
public record ScanReport(
        List<Finding> findings,
        int filesAnalyzed,
        int functionsAnalyzed,
        Map<String, String> parseErrors,
        long scanDurationMs
) {
    public ScanReport {
        findings = findings == null ? List.of() : List.copyOf(findings);
        parseErrors = parseErrors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parseErrors));
    }

    public int totalFindings() {
        return findings.size();
    }

    public long countAt(RiskLevel level) {
        return findings.stream().filter(f -> f.riskLevel() == level).count();
    }

    /**
     * Checks if any finding is at least as severe as the threshold.
     */
    public boolean hasFindingsAtLeast(RiskLevel threshold) {
        return findings.stream().anyMatch(f -> f.riskLevel().isAtLeast(threshold));
    }

    /**
     * Findings at least as severe as the threshold, in order.
     */
    public List<Finding> filtered(RiskLevel threshold) {
        return findings.stream().filter(f -> f.riskLevel().isAtLeast(threshold)).toList();
    }
}
