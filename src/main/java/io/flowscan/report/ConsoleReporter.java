package io.flowscan.report;

import io.flowscan.model.Finding;
import io.flowscan.model.RiskLevel;
import io.flowscan.model.ScanReport;

import java.io.PrintWriter;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Formats scan results for console output with ANSI colors.
 * <p>
 * Layout:
 * - Summary header with compact stats
 * - Pattern breakdown showing counts
 * - Findings grouped by file (graph-wide findings last)
 * - Files that failed to parse
 */
public class ConsoleReporter {

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";

    private static final String GRAPH_WIDE = "<dependency graph>";

    private final boolean useColors;

    public ConsoleReporter() {
        this(true);
    }

    public ConsoleReporter(boolean useColors) {
        this.useColors = useColors;
    }

    public void write(ScanReport report, Writer writer) {
        PrintWriter out = new PrintWriter(writer);

        printHeader(out);
        printCompactSummary(out, report);
        if (!report.findings().isEmpty()) {
            printPatternBreakdown(out, report);
            printFindingsByFile(out, report);
        }
        if (!report.parseErrors().isEmpty()) {
            printParseErrors(out, report);
        }
        printFooter(out, report);
        out.flush();
    }

    private void printHeader(PrintWriter out) {
        out.println();
        out.println(line('=', 70));
        out.println(center("FLOW-SCAN REPORT", 70));
        out.println(line('=', 70));
        out.println();
    }

    private void printCompactSummary(PrintWriter out, ScanReport report) {
        out.println(bold("SUMMARY"));
        out.println(line('-', 70));

        out.println(String.format("Analyzed: %,d files | %,d functions | %.1fs",
                report.filesAnalyzed(),
                report.functionsAnalyzed(),
                report.scanDurationMs() / 1000.0));

        long critical = report.countAt(RiskLevel.CRITICAL);
        long high = report.countAt(RiskLevel.HIGH);
        StringBuilder findings = new StringBuilder("Findings: ");
        findings.append(critical > 0 ? color(RED, critical + " critical") : "0 critical").append(" | ");
        findings.append(high > 0 ? color(YELLOW, high + " high") : "0 high").append(" | ");
        findings.append(report.countAt(RiskLevel.MEDIUM)).append(" medium | ")
                .append(report.countAt(RiskLevel.LOW)).append(" low");
        out.println(findings);
        out.println();
    }

    private void printPatternBreakdown(PrintWriter out, ScanReport report) {
        out.println(bold("PATTERN BREAKDOWN"));
        out.println(line('-', 70));
        Map<String, Long> byPattern = report.findings().stream()
                .collect(Collectors.groupingBy(Finding::pattern, LinkedHashMap::new, Collectors.counting()));
        byPattern.forEach((pattern, count) ->
                out.println(String.format("  %-28s %5d", pattern, count)));
        out.println();
    }

    private void printFindingsByFile(PrintWriter out, ScanReport report) {
        out.println(bold("FINDINGS BY FILE"));
        out.println(line('-', 70));
        Map<String, List<Finding>> byFile = report.findings().stream()
                .collect(Collectors.groupingBy(
                        f -> f.sourceFile() != null ? f.sourceFile() : GRAPH_WIDE,
                        LinkedHashMap::new,
                        Collectors.toList()));
        List<Finding> graphWide = byFile.remove(GRAPH_WIDE);

        byFile.forEach((file, findings) -> {
            out.println(bold(file) + color(CYAN, " (" + findings.size() + ")"));
            findings.forEach(f -> printFinding(out, f));
            out.println();
        });
        if (graphWide != null) {
            out.println(bold(GRAPH_WIDE) + color(CYAN, " (" + graphWide.size() + ")"));
            graphWide.forEach(f -> printFinding(out, f));
            out.println();
        }
    }

    private void printFinding(PrintWriter out, Finding finding) {
        String where = finding.lineNumber() > 0 ? "line " + finding.lineNumber() : "";
        String function = finding.function() != null ? finding.function() + " " : "";
        out.println("  " + getRiskIndicator(finding.riskLevel()) + " " + function + where);
        if (finding.description() != null) {
            out.println("      " + finding.description());
        }
        if (finding.recommendation() != null) {
            out.println("      " + color(GREEN, "-> " + finding.recommendation()));
        }
    }

    private void printParseErrors(PrintWriter out, ScanReport report) {
        out.println(bold("PARSE ERRORS") + color(CYAN, " (" + report.parseErrors().size() + ")"));
        out.println(line('-', 70));
        report.parseErrors().forEach((path, error) -> out.println("  " + path + ": " + error));
        out.println();
    }

    private void printFooter(PrintWriter out, ScanReport report) {
        out.println(line('=', 70));

        long critical = report.countAt(RiskLevel.CRITICAL);
        long high = report.countAt(RiskLevel.HIGH);

        if (critical > 0) {
            out.println(color(RED, bold("ACTION REQUIRED: " + critical + " critical finding(s).")));
        } else if (high > 0) {
            out.println(color(YELLOW, "ATTENTION: " + high
                    + " high-risk finding(s): code that may never terminate or cyclic dependencies."));
        } else {
            out.println(color(GREEN, "No critical issues found. Review medium/low findings as needed."));
        }
        out.println();
    }

    private String getRiskIndicator(RiskLevel level) {
        return switch (level) {
            case CRITICAL -> color(RED, "[CRIT]");
            case HIGH -> color(YELLOW, "[HIGH]");
            case MEDIUM -> "[MED]";
            case LOW -> "[LOW]";
            case INFO -> color(CYAN, "[INFO]");
        };
    }

    // Formatting helpers

    private String color(String color, String text) {
        if (!useColors) return text;
        return color + text + RESET;
    }

    private String bold(String text) {
        if (!useColors) return text;
        return BOLD + text + RESET;
    }

    private String line(char c, int length) {
        return String.valueOf(c).repeat(length);
    }

    private String center(String text, int width) {
        if (text.length() >= width) return text;
        int padding = (width - text.length()) / 2;
        return " ".repeat(padding) + text;
    }
}
