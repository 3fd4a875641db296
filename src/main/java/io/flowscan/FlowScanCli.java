package io.flowscan;

import io.flowscan.ast.YamlTreeParser;
import io.flowscan.detectors.DetectionContext;
import io.flowscan.detectors.DetectorRegistry;
import io.flowscan.engine.BatchAnalysis;
import io.flowscan.engine.CrossFileAnalysis;
import io.flowscan.engine.FileAnalysis;
import io.flowscan.engine.FlowAnalysisEngine;
import io.flowscan.engine.SourceFile;
import io.flowscan.model.Finding;
import io.flowscan.model.RiskLevel;
import io.flowscan.model.ScanReport;
import io.flowscan.report.ConsoleReporter;
import io.flowscan.scc.DependencyGraph;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI entry point for the flow-scan tool.
 */
@Command(
        name = "flow-scan",
        mixinStandardHelpOptions = true,
        version = "flow-scan 1.0.0",
        description = "Finds unreachable code, loops that never exit and dependency cycles.",
        subcommands = {
                FlowScanCli.AnalyzeCommand.class,
                FlowScanCli.CyclesCommand.class
        },
        footer = {
                "",
                "Examples:",
                "  flow-scan analyze src/a.yaml src/b.yaml",
                "  flow-scan analyze src/*.yaml --call-graph resolved-calls.yaml --fail-on high",
                "  flow-scan cycles imports.yaml --min-size 3"
        }
)
public class FlowScanCli implements Callable<Integer> {

    @Override
    public Integer call() {
        new CommandLine(this).usage(System.out);
        return 0;
    }

    /**
     * Options shared by all subcommands.
     */
    static class CommonOptions {

        @Option(
                names = {"-c", "--config"},
                description = "Path to configuration YAML file (default: ./" + ScanConfig.DEFAULT_FILE_NAME + " if present)"
        )
        Path configFile;

        @Option(
                names = {"-r", "--risk-threshold"},
                description = "Minimum risk level to report: critical, high, medium, low, info"
        )
        String riskThreshold;

        @Option(
                names = {"--fail-on"},
                description = "Exit with code 2 if findings at this level or higher: critical, high, medium, low",
                defaultValue = "high"
        )
        String failOnLevel;

        @Option(
                names = {"--no-color"},
                description = "Disable ANSI colors in console output"
        )
        boolean noColor;

        @Option(
                names = {"-v", "--verbose"},
                description = "Enable verbose output"
        )
        boolean verbose;

        ScanConfig loadConfig() throws IOException {
            if (verbose) {
                // Read by logback.xml when the first logger is created
                System.setProperty("FLOWSCAN_LOG_LEVEL", "DEBUG");
            }
            Path path = configFile != null ? configFile : Path.of(ScanConfig.DEFAULT_FILE_NAME);
            if (configFile != null && !Files.exists(configFile)) {
                throw new IOException("Config file does not exist: " + configFile);
            }
            log("Loading configuration from " + path);
            return ScanConfig.loadOrDefaults(path);
        }

        void log(String message) {
            if (verbose) {
                System.err.println("[flow-scan] " + message);
            }
        }

        /**
         * Filters, prints and turns the report into an exit code.
         */
        int finish(ScanReport report, ScanConfig config) {
            RiskLevel minRisk = riskThreshold != null ? parseRiskLevel(riskThreshold, "risk-threshold")
                    : config.getRiskThreshold();
            RiskLevel failLevel = parseRiskLevel(failOnLevel, "fail-on");
            if (minRisk == null || failLevel == null) {
                return 1;
            }

            ScanReport shown = new ScanReport(report.filtered(minRisk), report.filesAnalyzed(),
                    report.functionsAnalyzed(), report.parseErrors(), report.scanDurationMs());
            PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
            new ConsoleReporter(!noColor).write(shown, out);

            return report.hasFindingsAtLeast(failLevel) ? 2 : 0;
        }
    }

    @Command(
            name = "analyze",
            mixinStandardHelpOptions = true,
            description = "Analyze statement-tree files (YAML) for unreachable code, infinite loops and complexity."
    )
    static class AnalyzeCommand implements Callable<Integer> {

        @Parameters(
                arity = "1..*",
                description = "Statement-tree YAML files to analyze"
        )
        List<Path> files;

        @Option(
                names = {"--call-graph"},
                description = "Resolved cross-file call graph (YAML map of caller to callees); enables project-wide propagation"
        )
        Path callGraphFile;

        @Option(
                names = {"--dependencies"},
                description = "Module dependency graph (YAML map of module to modules) to check for cycles"
        )
        Path dependenciesFile;

        @Mixin
        CommonOptions common;

        @Override
        public Integer call() {
            Instant startTime = Instant.now();
            try {
                ScanConfig config = common.loadConfig();
                FlowAnalysisEngine engine = new FlowAnalysisEngine(new YamlTreeParser(), config);

                List<SourceFile> sources = new ArrayList<>();
                Map<String, String> readErrors = new LinkedHashMap<>();
                for (Path file : files) {
                    try {
                        sources.add(SourceFile.of(file.toString(), Files.readString(file)));
                    } catch (IOException e) {
                        readErrors.put(file.toString(), "cannot read file: " + e.getMessage());
                    }
                }
                common.log("Analyzing " + sources.size() + " files");

                DetectionContext context;
                Map<String, String> errors = new LinkedHashMap<>(readErrors);
                int functions;
                if (callGraphFile != null) {
                    Map<String, List<String>> resolved = loadAdjacency(callGraphFile);
                    common.log("Cross-file mode with " + resolved.size() + " resolved callers");
                    CrossFileAnalysis analysis = engine.analyzeCrossFile(sources, resolved);
                    errors.putAll(analysis.parseErrors());
                    functions = analysis.summaries().size();
                    context = DetectionContext.of(analysis, config);
                    common.log(analysis.allDiverging().size() + " functions may diverge");
                } else {
                    BatchAnalysis batch = engine.analyzeBatch(sources);
                    for (FileAnalysis failure : batch.failures()) {
                        errors.put(failure.path(), failure.error());
                    }
                    functions = batch.totalFunctions();
                    context = DetectionContext.of(batch, config);
                }
                if (dependenciesFile != null) {
                    context = context.withDependencies(DependencyGraph.of(loadAdjacency(dependenciesFile)));
                }

                List<Finding> findings = DetectorRegistry.createDefault().runAll(context);
                long durationMs = Duration.between(startTime, Instant.now()).toMillis();
                ScanReport report = new ScanReport(findings, files.size(), functions, errors, durationMs);
                return common.finish(report, config);
            } catch (IOException | IllegalArgumentException e) {
                System.err.println("Error: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(
            name = "cycles",
            mixinStandardHelpOptions = true,
            description = "Report dependency cycles of a module or class graph."
    )
    static class CyclesCommand implements Callable<Integer> {

        @Parameters(
                index = "0",
                description = "Dependency graph as a YAML map of node to the nodes it depends on"
        )
        Path graphFile;

        @Option(
                names = {"--min-size"},
                description = "Smallest cycle to report (default: minCycleSize from config, 2)"
        )
        Integer minSize;

        @Mixin
        CommonOptions common;

        @Override
        public Integer call() {
            Instant startTime = Instant.now();
            try {
                ScanConfig config = common.loadConfig();
                if (minSize != null) {
                    config = config.toBuilder().minCycleSize(minSize).build();
                }
                DependencyGraph graph = DependencyGraph.of(loadAdjacency(graphFile));
                common.log("Loaded " + graph.nodeCount() + " nodes and " + graph.edges().size() + " edges");

                DetectionContext context = new DetectionContext(List.of(), graph, config);
                List<Finding> findings = DetectorRegistry.createDefault().run(context, Set.of("circular-dependency"));
                long durationMs = Duration.between(startTime, Instant.now()).toMillis();
                return common.finish(new ScanReport(findings, 1, 0, Map.of(), durationMs), config);
            } catch (IOException | IllegalArgumentException e) {
                System.err.println("Error: " + e.getMessage());
                return 1;
            }
        }
    }

    /**
     * Reads a YAML map of name to list of names.
     */
    @SuppressWarnings("unchecked")
    static Map<String, List<String>> loadAdjacency(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            Object loaded = new Yaml().load(in);
            if (loaded == null) {
                return Map.of();
            }
            if (!(loaded instanceof Map)) {
                throw new IOException(file + ": expected a map of name to list of names");
            }
            Map<String, List<String>> result = new LinkedHashMap<>();
            for (Map.Entry<Object, Object> entry : ((Map<Object, Object>) loaded).entrySet()) {
                List<String> targets = new ArrayList<>();
                if (entry.getValue() instanceof List<?> list) {
                    list.forEach(t -> targets.add(String.valueOf(t)));
                } else if (entry.getValue() != null) {
                    throw new IOException(file + ": value of '" + entry.getKey() + "' must be a list");
                }
                result.put(String.valueOf(entry.getKey()), targets);
            }
            return result;
        } catch (YAMLException e) {
            throw new IOException("Invalid YAML in " + file + ": " + e.getMessage(), e);
        }
    }

    static RiskLevel parseRiskLevel(String value, String optionName) {
        try {
            return ScanConfig.toRiskLevel(value);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: Invalid value for --" + optionName + ": " + value);
            System.err.println("Valid values: critical, high, medium, low, info");
            return null;
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new FlowScanCli()).execute(args);
        System.exit(exitCode);
    }
}
