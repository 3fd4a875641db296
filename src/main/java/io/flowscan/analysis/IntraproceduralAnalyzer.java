package io.flowscan.analysis;

import io.flowscan.cfg.CfgBuilder;
import io.flowscan.cfg.ControlFlowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds the CFG of one function and derives its summary: unreachable lines, loop sites
 * and cyclomatic complexity. Local callees are filled in by the caller, which knows the
 * analysis scope.
 * <p>
 * Each call reads only the given function, so one analyzer can serve many threads.
 */
public class IntraproceduralAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(IntraproceduralAnalyzer.class);

    private final CfgBuilder cfgBuilder;
    private final LoopDetector loopDetector;
    private final ComplexityCalculator complexityCalculator;

    public IntraproceduralAnalyzer() {
        this(new CfgBuilder(), new LoopDetector(), new ComplexityCalculator());
    }

    public IntraproceduralAnalyzer(CfgBuilder cfgBuilder, LoopDetector loopDetector,
                                   ComplexityCalculator complexityCalculator) {
        this.cfgBuilder = cfgBuilder;
        this.loopDetector = loopDetector;
        this.complexityCalculator = complexityCalculator;
    }

    /**
     * Analyzes one function.
     *
     * @param function     The function to analyze
     * @param path         File the function belongs to, may be null
     * @param localCallees Resolved callees within the analysis scope, in call order
     */
    public FunctionSummary analyze(FunctionUnit function, String path, List<String> localCallees) {
        ControlFlowGraph cfg = cfgBuilder.build(function.qualifiedName(), function.body());
        FunctionSummary.Builder summary = FunctionSummary.builder()
                .qualifiedName(function.qualifiedName())
                .path(path)
                .line(function.line())
                .localCallees(localCallees)
                .cyclomaticComplexity(complexityCalculator.calculate(function.body()))
                .blockCount(cfg.blockCount());

        if (cfg.isEmpty()) {
            log.warn("No analysis possible for {} in {}", function.qualifiedName(), path);
            return summary.analyzable(false).build();
        }

        StatementReachability reachability = new StatementReachability(cfg);
        return summary
                .unreachableLines(reachability.unreachableLines())
                .loopSites(loopDetector.detect(function.body(), reachability))
                .build();
    }

    /**
     * Builds the CFG of a function without summarizing it.
     */
    public ControlFlowGraph buildCfg(FunctionUnit function) {
        return cfgBuilder.build(function.qualifiedName(), function.body());
    }
}
