package io.flowscan.engine;

import io.flowscan.ScanConfig;
import io.flowscan.analysis.ComplexityCalculator;
import io.flowscan.analysis.FunctionExtractor;
import io.flowscan.analysis.FunctionSummary;
import io.flowscan.analysis.FunctionUnit;
import io.flowscan.analysis.IntraproceduralAnalyzer;
import io.flowscan.analysis.LoopDetector;
import io.flowscan.ast.ParseException;
import io.flowscan.ast.ParsedModule;
import io.flowscan.ast.SourceParser;
import io.flowscan.cfg.CfgBuilder;
import io.flowscan.graph.CallGraph;
import io.flowscan.graph.CallResolver;
import io.flowscan.graph.InterproceduralPropagator;
import io.flowscan.graph.InterproceduralResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Entry points of the analysis: one file, a batch of independent files, or a project with
 * a resolver-supplied cross-file call graph.
 * <p>
 * Files are analyzed on a fixed worker pool; per-function work shares no mutable state.
 * The propagation fixpoint runs once all summaries of its scope exist. A file that fails
 * to parse is reported on its own and never affects the others.
 */
public class FlowAnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(FlowAnalysisEngine.class);

    /**
     * Prefix the resolver uses for calls that leave the project.
     */
    public static final String EXTERNAL_PREFIX = "external:";

    private final SourceParser parser;
    private final IntraproceduralAnalyzer analyzer;
    private final FunctionExtractor extractor = new FunctionExtractor();
    private final InterproceduralPropagator propagator = new InterproceduralPropagator();
    private final int parallelism;

    public FlowAnalysisEngine(SourceParser parser) {
        this(parser, ScanConfig.defaults());
    }

    public FlowAnalysisEngine(SourceParser parser, ScanConfig config) {
        this(parser,
                new IntraproceduralAnalyzer(new CfgBuilder(),
                        new LoopDetector(config.getUnboundedIterators()),
                        new ComplexityCalculator()),
                config.getParallelism());
    }

    public FlowAnalysisEngine(SourceParser parser, IntraproceduralAnalyzer analyzer, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive");
        }
        this.parser = parser;
        this.analyzer = analyzer;
        this.parallelism = parallelism;
    }

    /**
     * Analyzes one parsed file: intraprocedural summaries, the file's local call graph and
     * propagation over it.
     */
    public FileAnalysis analyzeFile(ParsedModule module) {
        ModuleScope scope = scope(module, null);
        Map<String, FunctionSummary> summaries = summarize(scope, scope.localCallees());
        CallGraph.Builder graph = CallGraph.builder();
        scope.localCallees().forEach(graph::addEdges);
        InterproceduralResult result = propagator.propagate(summaries, graph.build());
        return FileAnalysis.success(module.path(), result);
    }

    /**
     * Parses and analyzes one file. A parse failure yields a result with the error and no
     * functions.
     */
    public FileAnalysis analyzeSource(String path, String source) {
        try {
            return analyzeFile(parser.parse(path, source));
        } catch (ParseException e) {
            log.warn("Parse failed for {}: {}", path, e.getMessage());
            return FileAnalysis.failure(path, e.getMessage());
        }
    }

    /**
     * Analyzes independent files concurrently. Results keep the input order.
     */
    public BatchAnalysis analyzeBatch(List<SourceFile> files) {
        List<Callable<FileAnalysis>> tasks = new ArrayList<>();
        for (SourceFile file : files) {
            tasks.add(() -> analyzeIsolated(file));
        }
        Map<String, FileAnalysis> results = new LinkedHashMap<>();
        for (FileAnalysis analysis : runAll(tasks)) {
            if (results.put(analysis.path(), analysis) != null) {
                log.warn("Duplicate path in batch, keeping the last result: {}", analysis.path());
            }
        }
        log.debug("Batch of {} files analyzed, {} failed", results.size(),
                results.values().stream().filter(r -> !r.isSuccess()).count());
        return new BatchAnalysis(results);
    }

    /**
     * Analyzes a project with a call graph from an external resolver.
     * <p>
     * Function names are qualified by module ({@code pkg/a.py} gives {@code pkg.a}), the form
     * the resolver's keys and targets use. Local calls found in each file are merged with
     * the resolver's edges. Targets starting with {@value #EXTERNAL_PREFIX} never propagate;
     * edges naming functions without a summary (for instance in a file that failed to
     * parse) are dropped and logged.
     *
     * @param files             Project files
     * @param resolvedCallGraph Caller to callee names, may be empty
     */
    public CrossFileAnalysis analyzeCrossFile(List<SourceFile> files, Map<String, List<String>> resolvedCallGraph) {
        List<Callable<ModuleScope>> parseTasks = new ArrayList<>();
        for (SourceFile file : files) {
            parseTasks.add(() -> scopeIsolated(file));
        }

        Map<String, String> parseErrors = new LinkedHashMap<>();
        List<ModuleScope> scopes = new ArrayList<>();
        for (ModuleScope scope : runAll(parseTasks)) {
            if (scope.error() != null) {
                parseErrors.put(scope.path(), scope.error());
            } else {
                scopes.add(scope);
            }
        }

        Set<String> known = new HashSet<>();
        scopes.forEach(s -> s.units().forEach(u -> known.add(u.qualifiedName())));

        int dropped = 0;
        List<Map<String, List<String>>> calleesPerScope = new ArrayList<>();
        for (ModuleScope scope : scopes) {
            Map<String, List<String>> callees = new LinkedHashMap<>();
            for (Map.Entry<String, List<String>> local : scope.localCallees().entrySet()) {
                Set<String> merged = new LinkedHashSet<>(local.getValue());
                for (String target : resolvedCallGraph.getOrDefault(local.getKey(), List.of())) {
                    if (target.startsWith(EXTERNAL_PREFIX)) {
                        continue;
                    }
                    if (known.contains(target)) {
                        merged.add(target);
                    } else {
                        log.warn("Dropping call {} -> {}: no summary for callee", local.getKey(), target);
                        dropped++;
                    }
                }
                callees.put(local.getKey(), new ArrayList<>(merged));
            }
            calleesPerScope.add(callees);
        }
        for (Map.Entry<String, List<String>> entry : resolvedCallGraph.entrySet()) {
            if (!known.contains(entry.getKey())) {
                long internal = entry.getValue().stream().filter(t -> !t.startsWith(EXTERNAL_PREFIX)).count();
                if (internal > 0) {
                    log.warn("Dropping {} calls from {}: no summary for caller", internal, entry.getKey());
                    dropped += (int) internal;
                }
            }
        }

        List<Callable<Map<String, FunctionSummary>>> analyzeTasks = new ArrayList<>();
        for (int i = 0; i < scopes.size(); i++) {
            ModuleScope scope = scopes.get(i);
            Map<String, List<String>> callees = calleesPerScope.get(i);
            analyzeTasks.add(() -> summarize(scope, callees));
        }
        List<Map<String, FunctionSummary>> analyzed = runAll(analyzeTasks);

        Map<String, FunctionSummary> summaries = new LinkedHashMap<>();
        Map<String, List<String>> functionsByFile = new LinkedHashMap<>();
        CallGraph.Builder graph = CallGraph.builder();
        for (int i = 0; i < scopes.size(); i++) {
            summaries.putAll(analyzed.get(i));
            functionsByFile.put(scopes.get(i).path(), new ArrayList<>(analyzed.get(i).keySet()));
            calleesPerScope.get(i).forEach(graph::addEdges);
        }

        InterproceduralResult result = propagator.propagate(summaries, graph.build());
        log.debug("Cross-file analysis: {} files, {} functions, {} parse errors, {} dropped calls",
                files.size(), summaries.size(), parseErrors.size(), dropped);
        return new CrossFileAnalysis(result, functionsByFile, parseErrors, dropped);
    }

    private FileAnalysis analyzeIsolated(SourceFile file) {
        try {
            return file.isParsed() ? analyzeFile(file.module()) : analyzeSource(file.path(), file.source());
        } catch (RuntimeException e) {
            log.warn("Analysis failed for {}", file.path(), e);
            return FileAnalysis.failure(file.path(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private ModuleScope scopeIsolated(SourceFile file) {
        try {
            ParsedModule module = file.isParsed() ? file.module() : parser.parse(file.path(), file.source());
            return scope(module, module.moduleName());
        } catch (ParseException e) {
            log.warn("Parse failed for {}: {}", file.path(), e.getMessage());
            return ModuleScope.failed(file.path(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Analysis failed for {}", file.path(), e);
            return ModuleScope.failed(file.path(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * Functions of one module with their resolved local calls, or the reason the module
     * could not be read.
     */
    private record ModuleScope(String path, List<FunctionUnit> units, Map<String, List<String>> localCallees,
                               String error) {
        static ModuleScope failed(String path, String error) {
            return new ModuleScope(path, List.of(), Map.of(), error);
        }
    }

    private ModuleScope scope(ParsedModule module, String prefix) {
        List<FunctionUnit> units = extractor.extract(module.body(), prefix);
        CallResolver resolver = new CallResolver(units, prefix);
        Map<String, List<String>> callees = new LinkedHashMap<>();
        for (FunctionUnit unit : units) {
            if (callees.put(unit.qualifiedName(), resolver.resolveCallees(unit)) != null) {
                log.debug("{} is defined more than once in {}, keeping the last definition",
                        unit.qualifiedName(), module.path());
            }
        }
        return new ModuleScope(module.path(), units, callees, null);
    }

    private Map<String, FunctionSummary> summarize(ModuleScope scope, Map<String, List<String>> callees) {
        Map<String, FunctionSummary> summaries = new LinkedHashMap<>();
        for (FunctionUnit unit : scope.units()) {
            List<String> unitCallees = callees.getOrDefault(unit.qualifiedName(), List.of());
            summaries.put(unit.qualifiedName(), analyzer.analyze(unit, scope.path(), unitCallees));
        }
        return summaries;
    }

    /**
     * Runs tasks on a fixed pool and returns their results in task order. Tasks isolate
     * their own per-file failures, so an exception escaping one is a bug and fails the run.
     */
    private <T> List<T> runAll(List<Callable<T>> tasks) {
        if (tasks.isEmpty()) {
            return List.of();
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, tasks.size()));
        try {
            List<Future<T>> futures = executor.invokeAll(tasks);
            List<T> results = new ArrayList<>(futures.size());
            for (Future<T> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Analysis task failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Analysis interrupted", e);
        } finally {
            executor.shutdown();
        }
    }
}
