package io.flowscan.detectors;

import io.flowscan.ScanConfig;
import io.flowscan.model.Finding;
import io.flowscan.model.RiskLevel;
import io.flowscan.scc.DependencyGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CircularDependencyDetectorTest {

    private CircularDependencyDetector detector;
    private DependencyGraph graph;

    @BeforeEach
    void setUp() {
        detector = new CircularDependencyDetector();
        Map<String, List<String>> imports = new LinkedHashMap<>();
        imports.put("app", List.of("db", "web"));
        imports.put("db", List.of("models"));
        imports.put("models", List.of("db"));
        imports.put("web", List.of("views"));
        imports.put("views", List.of("forms"));
        imports.put("forms", List.of("web"));
        graph = DependencyGraph.of(imports);
    }

    @Test
    void detect_reportsEachCycle() {
        List<Finding> findings = detector.detect(new DetectionContext(List.of(), graph, ScanConfig.defaults()));

        assertThat(findings).hasSize(2);
        assertThat(findings).allSatisfy(f -> {
            assertThat(f.riskLevel()).isEqualTo(RiskLevel.HIGH);
            assertThat(f.pattern()).isEqualTo("circular_dependency");
            assertThat(f.sourceFile()).isNull();
        });
        assertThat(findings.get(0).description()).isEqualTo("Circular dependency among 2 nodes: db, models");
        assertThat(findings.get(1).details()).isEqualTo("web, views, forms");
    }

    @Test
    void detect_emptyGraphHasNoFindings() {
        List<Finding> findings = detector.detect(
                new DetectionContext(List.of(), new DependencyGraph(), ScanConfig.defaults()));

        assertThat(findings).isEmpty();
    }

    @Test
    void detect_respectsMinimumCycleSize() {
        ScanConfig config = ScanConfig.builder().minCycleSize(3).build();

        List<Finding> findings = detector.detect(new DetectionContext(List.of(), graph, config));

        assertThat(findings).singleElement()
                .satisfies(f -> assertThat(f.details()).isEqualTo("web, views, forms"));
    }

    @Test
    void detect_commitsPendingEdits() {
        graph.removeDependency("models", "db");

        List<Finding> findings = detector.detect(new DetectionContext(List.of(), graph, ScanConfig.defaults()));

        assertThat(findings).hasSize(1);
        assertThat(graph.hasPendingChanges()).isFalse();
    }

    @Test
    void detect_withoutGraphFindsNothing() {
        assertThat(detector.detect(new DetectionContext(List.of(), null, ScanConfig.defaults()))).isEmpty();
    }
}
