package io.flowscan.report;

import io.flowscan.model.Finding;
import io.flowscan.model.RiskLevel;
import io.flowscan.model.ScanReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleReporterTest {

    private ConsoleReporter reporter;

    @BeforeEach
    void setUp() {
        reporter = new ConsoleReporter(false);
    }

    private String render(ScanReport report) {
        StringWriter out = new StringWriter();
        reporter.write(report, out);
        return out.toString();
    }

    @Test
    void write_groupsFindingsByFile() {
        Finding loop = Finding.builder()
                .detectorId("infinite-loop")
                .riskLevel(RiskLevel.HIGH)
                .pattern("while_true")
                .sourceFile("server.py")
                .function("serve")
                .lineNumber(12)
                .description("Potential infinite loop in serve")
                .recommendation("Add a break condition or use a bounded loop")
                .build();
        Finding cycle = Finding.builder()
                .detectorId("circular-dependency")
                .riskLevel(RiskLevel.HIGH)
                .pattern("circular_dependency")
                .description("Circular dependency among 2 nodes: a, b")
                .build();

        String output = render(new ScanReport(List.of(loop, cycle), 3, 7, Map.of(), 1500));

        assertThat(output).contains("FLOW-SCAN REPORT");
        assertThat(output).contains("Analyzed: 3 files | 7 functions");
        assertThat(output).contains("Findings: 0 critical | 2 high | 0 medium | 0 low");
        assertThat(output).contains("while_true", "circular_dependency");
        assertThat(output).contains("server.py (1)");
        assertThat(output).contains("[HIGH] serve line 12");
        assertThat(output).contains("<dependency graph> (1)");
        assertThat(output).contains("-> Add a break condition");
        assertThat(output).contains("ATTENTION: 2 high-risk finding(s)");
        assertThat(output).doesNotContain("\u001B[");
    }

    @Test
    void write_listsParseErrors() {
        String output = render(new ScanReport(List.of(), 2, 0, Map.of("bad.py", "bad.py: invalid YAML"), 10));

        assertThat(output).contains("PARSE ERRORS (1)");
        assertThat(output).contains("bad.py: bad.py: invalid YAML");
        assertThat(output).contains("No critical issues found.");
        assertThat(output).doesNotContain("FINDINGS BY FILE");
    }

    @Test
    void write_colorsWhenEnabled() {
        StringWriter out = new StringWriter();
        new ConsoleReporter(true).write(new ScanReport(List.of(), 0, 0, Map.of(), 0), out);

        assertThat(out.toString()).contains("\u001B[1mSUMMARY");
    }
}
