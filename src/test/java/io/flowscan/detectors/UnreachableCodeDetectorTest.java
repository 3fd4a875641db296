package io.flowscan.detectors;

import io.flowscan.ScanConfig;
import io.flowscan.analysis.FunctionSummary;
import io.flowscan.model.Finding;
import io.flowscan.model.RiskLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class UnreachableCodeDetectorTest {

    private UnreachableCodeDetector detector;

    @BeforeEach
    void setUp() {
        detector = new UnreachableCodeDetector();
    }

    @Test
    void detect_reportsOneFindingPerFunction() {
        FunctionSummary function = FunctionSummary.builder()
                .qualifiedName("f")
                .path("test.py")
                .line(1)
                .unreachableLines(List.of(4, 3))
                .build();

        List<Finding> findings = detector.detect(new DetectionContext(List.of(function), null, ScanConfig.defaults()));

        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
            assertThat(finding.pattern()).isEqualTo("unreachable_code");
            assertThat(finding.lineNumber()).isEqualTo(3);
            assertThat(finding.affectedLines()).containsExactly(3, 4);
            assertThat(finding.description()).isEqualTo("Found 2 unreachable lines in f: 3, 4");
        });
    }

    @Test
    void detect_ignoresFullyReachableFunctions() {
        FunctionSummary function = FunctionSummary.builder().qualifiedName("f").line(1).build();

        assertThat(detector.detect(new DetectionContext(List.of(function), null, ScanConfig.defaults()))).isEmpty();
    }

    @Test
    void listLines_truncatesLongLists() {
        List<Integer> lines = IntStream.rangeClosed(1, 13).boxed().collect(Collectors.toList());

        assertThat(UnreachableCodeDetector.listLines(lines))
                .isEqualTo("1, 2, 3, 4, 5, 6, 7, 8, 9, 10 (and 3 more)");
    }

    @Test
    void isEnabled_followsConfig() {
        assertThat(detector.isEnabled(ScanConfig.builder().detectUnreachable(false).build())).isFalse();
    }
}
