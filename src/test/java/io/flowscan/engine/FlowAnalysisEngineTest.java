package io.flowscan.engine;

import io.flowscan.Trees;
import io.flowscan.analysis.FunctionSummary;
import io.flowscan.analysis.IntraproceduralAnalyzer;
import io.flowscan.analysis.Termination;
import io.flowscan.ast.YamlTreeParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowAnalysisEngineTest {

    private static final String LOOPING_MODULE = """
            - line: 1
              def: infinite_loop
              body:
                - {line: 2, while: true, body: [{line: 3, pass: null}]}
            """;

    private static final String CALLING_MODULE = """
            - line: 1
              def: caller
              body:
                - {line: 2, expr: {call: module_a.infinite_loop}}
                - {line: 3, expr: {call: print, args: [{str: done}]}}
            - line: 4
              def: independent
              body:
                - {line: 5, return: 0}
            """;

    private FlowAnalysisEngine engine;

    @BeforeEach
    void setUp() {
        engine = new FlowAnalysisEngine(new YamlTreeParser(), new IntraproceduralAnalyzer(), 4);
    }

    @Test
    void analyzeFile_propagatesWithinFile() {
        FileAnalysis analysis = engine.analyzeFile(Trees.parse("app.py", """
                - {line: 1, def: main, body: [{line: 2, expr: {call: serve}}]}
                - {line: 3, def: serve, body: [{line: 4, while: true, body: [{line: 5, pass: null}]}]}
                """));

        assertThat(analysis.isSuccess()).isTrue();
        assertThat(analysis.summaries()).containsOnlyKeys("main", "serve");
        FunctionSummary main = analysis.summaries().get("main");
        assertThat(main.localCallees()).containsExactly("serve");
        assertThat(main.terminates()).isEqualTo(Termination.MAY_DIVERGE);
        assertThat(main.divergingCallee()).isEqualTo("serve");
        assertThat(main.path()).isEqualTo("app.py");
        assertThat(analysis.result().divergingFunctions()).containsExactly("main", "serve");
    }

    @Test
    void analyzeSource_reportsParseFailure() {
        FileAnalysis analysis = engine.analyzeSource("bad.py", "- {line: 1, pass: [oops");

        assertThat(analysis.isSuccess()).isFalse();
        assertThat(analysis.error()).startsWith("bad.py:");
        assertThat(analysis.functionCount()).isZero();
    }

    @Test
    void analyzeBatch_isolatesParseFailuresAndKeepsOrder() {
        BatchAnalysis batch = engine.analyzeBatch(List.of(
                SourceFile.of("first.py", LOOPING_MODULE),
                SourceFile.of("broken.py", "- {line: 1, def: f, body: [unclosed"),
                SourceFile.parsed(Trees.parse("third.py", CALLING_MODULE))));

        assertThat(batch.files().keySet()).containsExactly("first.py", "broken.py", "third.py");
        assertThat(batch.failures()).extracting(FileAnalysis::path).containsExactly("broken.py");
        assertThat(batch.get("broken.py")).hasValueSatisfying(f -> assertThat(f.functionCount()).isZero());
        assertThat(batch.totalFunctions()).isEqualTo(3);
        assertThat(batch.get("first.py").orElseThrow().summaries().get("infinite_loop").hasInfiniteLoop()).isTrue();
        // Files in a batch do not see each other's functions
        assertThat(batch.get("third.py").orElseThrow().summaries().get("caller").terminates())
                .isEqualTo(Termination.ALWAYS);
    }

    @Test
    void analyzeBatch_isDeterministicAcrossRuns() {
        List<SourceFile> files = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            files.add(SourceFile.of("m" + i + ".py", i % 2 == 0 ? LOOPING_MODULE : CALLING_MODULE));
        }

        String first = batchSnapshot(engine.analyzeBatch(files));
        String second = batchSnapshot(new FlowAnalysisEngine(new YamlTreeParser(), new IntraproceduralAnalyzer(), 1)
                .analyzeBatch(files));

        assertThat(first).isEqualTo(second);
    }

    private static String batchSnapshot(BatchAnalysis batch) {
        StringBuilder sb = new StringBuilder();
        batch.files().forEach((path, analysis) -> sb.append(path).append(analysis.summaries()).append('\n'));
        return sb.toString();
    }

    @Test
    void analyzeBatch_emptyInput() {
        assertThat(engine.analyzeBatch(List.of()).files()).isEmpty();
    }

    @Test
    void analyzeCrossFile_propagatesAcrossModules() {
        Map<String, List<String>> resolved = new LinkedHashMap<>();
        resolved.put("module_b.caller", List.of("module_a.infinite_loop", "external:print"));

        CrossFileAnalysis analysis = engine.analyzeCrossFile(List.of(
                SourceFile.of("module_a.py", LOOPING_MODULE),
                SourceFile.of("module_b.py", CALLING_MODULE)), resolved);

        FunctionSummary caller = analysis.summaries().get("module_b.caller");
        assertThat(caller.callsDiverging()).isTrue();
        assertThat(caller.divergingCallee()).isEqualTo("module_a.infinite_loop");
        assertThat(caller.localCallees()).containsExactly("module_a.infinite_loop");
        assertThat(analysis.allDiverging()).containsExactly("module_a.infinite_loop", "module_b.caller");
        assertThat(analysis.fileResults("module_b.py"))
                .extracting(FunctionSummary::qualifiedName)
                .containsExactly("module_b.caller", "module_b.independent");
        assertThat(analysis.parseErrors()).isEmpty();
        assertThat(analysis.droppedEdges()).isZero();
    }

    @Test
    void analyzeCrossFile_dropsEdgesOfUnparsedFiles() {
        Map<String, List<String>> resolved = new LinkedHashMap<>();
        resolved.put("module_b.caller", List.of("broken.helper"));
        resolved.put("broken.run", List.of("module_a.infinite_loop", "external:len"));

        CrossFileAnalysis analysis = engine.analyzeCrossFile(List.of(
                SourceFile.of("module_a.py", LOOPING_MODULE),
                SourceFile.of("module_b.py", CALLING_MODULE),
                SourceFile.of("broken.py", "- [not, a, statement")), resolved);

        assertThat(analysis.parseErrors()).containsOnlyKeys("broken.py");
        assertThat(analysis.droppedEdges()).isEqualTo(2);
        assertThat(analysis.fileResults("broken.py")).isEmpty();
        assertThat(analysis.summaries().get("module_b.caller").terminates()).isEqualTo(Termination.ALWAYS);
        assertThat(analysis.allDiverging()).containsExactly("module_a.infinite_loop");
    }

    @Test
    void analyzeCrossFile_qualifiesNamesByModulePath() {
        CrossFileAnalysis analysis = engine.analyzeCrossFile(List.of(
                SourceFile.of("pkg/service.py", """
                        - line: 1
                          class: Service
                          body:
                            - {line: 2, def: start, body: [{line: 3, expr: {call: self.loop}}]}
                            - {line: 4, def: loop, body: [{line: 5, while: true, body: [{line: 6, pass: null}]}]}
                        """)), Map.of());

        assertThat(analysis.functionsByFile().get("pkg/service.py"))
                .containsExactly("pkg.service.Service.start", "pkg.service.Service.loop");
        assertThat(analysis.summaries().get("pkg.service.Service.start").divergingCallee())
                .isEqualTo("pkg.service.Service.loop");
    }

    @Test
    void constructor_rejectsNonPositiveParallelism() {
        assertThatThrownBy(() -> new FlowAnalysisEngine(new YamlTreeParser(), new IntraproceduralAnalyzer(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void analyzeSource_summarizesSampleModule() throws IOException {
        String source;
        try (InputStream in = getClass().getResourceAsStream("/trees/order_service.yaml")) {
            assertThat(in).isNotNull();
            source = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }

        FileAnalysis analysis = engine.analyzeSource("shop/order_service.py", source);

        assertThat(analysis.isSuccess()).isTrue();
        assertThat(analysis.summaries()).containsOnlyKeys(
                "OrderService.__init__", "OrderService.process", "OrderService.next_order",
                "OrderService.ship", "main");
        FunctionSummary process = analysis.summaries().get("OrderService.process");
        assertThat(process.localCallees()).containsExactly("OrderService.next_order", "OrderService.ship");
        assertThat(process.loopSites()).singleElement()
                .satisfies(site -> assertThat(site.description()).contains("'attempts'"));
        assertThat(analysis.summaries().get("OrderService.ship").unreachableLines()).containsExactly(25);
        FunctionSummary main = analysis.summaries().get("main");
        assertThat(main.localCallees()).containsExactly("OrderService.__init__");
        assertThat(main.terminates()).isEqualTo(Termination.ALWAYS);
    }
}
