package io.flowscan.analysis;

import io.flowscan.Trees;
import io.flowscan.cfg.CfgBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IntraproceduralAnalyzerTest {

    private IntraproceduralAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new IntraproceduralAnalyzer();
    }

    private FunctionSummary analyze(String yaml) {
        return analyzer.analyze(Trees.function(yaml), "test.py", List.of());
    }

    @Test
    void analyze_flagsWhileTrueWithoutExit() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: spin
                  body:
                    - line: 2
                      while: true
                      body: [{line: 3, expr: {call: tick}}]
                """);

        assertThat(summary.loopSites()).containsExactly(new LoopSite(LoopKind.WHILE_TRUE, 2,
                "'while True' loop without break, return or raise"));
        assertThat(summary.hasInfiniteLoop()).isTrue();
        assertThat(summary.terminates()).isEqualTo(Termination.MAY_DIVERGE);
        assertThat(summary.callsDiverging()).isFalse();
    }

    @Test
    void analyze_whileTrueWithBreakTerminates() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: poll
                  body:
                    - line: 2
                      while: true
                      body:
                        - {line: 3, if: done, body: [{line: 4, break: null}]}
                """);

        assertThat(summary.loopSites()).isEmpty();
        assertThat(summary.terminates()).isEqualTo(Termination.ALWAYS);
    }

    @Test
    void analyze_conditionalReturnCountsAsExit() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: find
                  body:
                    - line: 2
                      while: true
                      body:
                        - {line: 3, if: {call: found}, body: [{line: 4, return: item}]}
                """);

        assertThat(summary.loopSites()).isEmpty();
    }

    @Test
    void analyze_raiseCountsAsExitForWhileTrue() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: guard
                  body:
                    - line: 2
                      while: true
                      body:
                        - {line: 3, if: broken, body: [{line: 4, raise: {call: RuntimeError}}]}
                """);

        assertThat(summary.loopSites()).isEmpty();
    }

    @Test
    void analyze_flagsWhileOne() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: spin
                  body:
                    - {line: 2, while: 1, body: [{line: 3, pass: null}]}
                """);

        assertThat(summary.loopSites()).singleElement().satisfies(site -> {
            assertThat(site.kind()).isEqualTo(LoopKind.WHILE_ONE);
            assertThat(site.description()).isEqualTo("'while 1' loop without break, return or raise");
        });
    }

    @Test
    void analyze_whileZeroIsNotFlagged() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: never
                  body:
                    - {line: 2, while: 0, body: [{line: 3, pass: null}]}
                """);

        assertThat(summary.loopSites()).isEmpty();
    }

    @Test
    void analyze_flagsWhileWithLargeIntegerLiteral() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: spin
                  body:
                    - {line: 2, while: 18446744073709551616, body: [{line: 3, pass: null}]}
                """);

        assertThat(summary.loopSites()).singleElement()
                .satisfies(site -> assertThat(site.kind()).isEqualTo(LoopKind.WHILE_ONE));
    }

    @Test
    void analyze_flagsWhileWithFractionalLiteral() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: spin
                  body:
                    - {line: 2, while: 0.5, body: [{line: 3, pass: null}]}
                """);

        assertThat(summary.loopSites()).singleElement().satisfies(site -> {
            assertThat(site.kind()).isEqualTo(LoopKind.WHILE_ONE);
            assertThat(site.description()).isEqualTo("'while 0.5' loop without break, return or raise");
        });
    }

    @Test
    void analyze_whileZeroPointZeroIsNotFlagged() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: never
                  body:
                    - {line: 2, while: 0.0, body: [{line: 3, pass: null}]}
                """);

        assertThat(summary.loopSites()).isEmpty();
    }

    @Test
    void analyze_breakInInnerLoopDoesNotExitOuterLoop() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: nested
                  body:
                    - line: 2
                      while: true
                      body:
                        - line: 3
                          while: true
                          body: [{line: 4, break: null}]
                """);

        assertThat(summary.loopSites()).extracting(LoopSite::line).containsExactly(2);
    }

    @Test
    void analyze_reportsBothNestedLoopsWithoutExit() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: nested
                  body:
                    - line: 2
                      while: true
                      body:
                        - {line: 3, while: true, body: [{line: 4, pass: null}]}
                """);

        assertThat(summary.loopSites()).extracting(LoopSite::line).containsExactly(2, 3);
    }

    @Test
    void analyze_returnInInnerLoopExitsOuterLoop() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: nested
                  body:
                    - line: 2
                      while: true
                      body:
                        - line: 3
                          while: true
                          body: [{line: 4, return: null}]
                """);

        assertThat(summary.loopSites()).isEmpty();
    }

    @Test
    void analyze_flagsQualifiedCycleIterator() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: rotate
                  body:
                    - line: 2
                      for: item
                      in: {call: itertools.cycle, args: [items]}
                      body: [{line: 3, expr: {call: handle, args: [item]}}]
                """);

        assertThat(summary.loopSites()).containsExactly(new LoopSite(LoopKind.CYCLE_ITERATOR, 2,
                "Loop over unbounded iterator 'itertools.cycle' without break or return"));
    }

    @Test
    void analyze_flagsUnqualifiedCycleIterator() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: rotate
                  body:
                    - line: 2
                      for: item
                      in: {call: cycle, args: [items]}
                      body: [{line: 3, pass: null}]
                """);

        assertThat(summary.loopSites()).extracting(LoopSite::kind).containsExactly(LoopKind.CYCLE_ITERATOR);
    }

    @Test
    void analyze_raiseDoesNotExitUnboundedIterator() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: counter
                  body:
                    - line: 2
                      for: i
                      in: {call: itertools.count}
                      body:
                        - line: 3
                          if: {op: ">", left: i, right: 10}
                          body: [{line: 4, raise: {call: StopIteration}}]
                """);

        assertThat(summary.loopSites()).extracting(LoopSite::kind).containsExactly(LoopKind.CYCLE_ITERATOR);
    }

    @Test
    void analyze_breakExitsUnboundedIterator() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: counter
                  body:
                    - line: 2
                      for: i
                      in: {call: itertools.count}
                      body:
                        - {line: 3, if: {op: ">", left: i, right: 10}, body: [{line: 4, break: null}]}
                """);

        assertThat(summary.loopSites()).isEmpty();
    }

    @Test
    void analyze_boundedIteratorIsNotFlagged() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: each
                  body:
                    - {line: 2, for: i, in: {call: range, args: [10]}, body: [{line: 3, pass: null}]}
                """);

        assertThat(summary.loopSites()).isEmpty();
    }

    @Test
    void analyze_configuredIteratorsReplaceDefaults() {
        IntraproceduralAnalyzer custom = new IntraproceduralAnalyzer(new CfgBuilder(),
                new LoopDetector(List.of("streams.forever")), new ComplexityCalculator());
        FunctionUnit unit = Trees.function("""
                - line: 1
                  def: consume
                  body:
                    - {line: 2, for: event, in: {call: streams.forever}, body: [{line: 3, pass: null}]}
                    - {line: 4, for: i, in: {call: itertools.count}, body: [{line: 5, pass: null}]}
                """);

        FunctionSummary summary = custom.analyze(unit, "test.py", List.of());

        assertThat(summary.loopSites()).extracting(LoopSite::line).containsExactly(2);
    }

    @Test
    void analyze_flagsUnmodifiedConditionVariable() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: wait
                  body:
                    - {line: 2, assign: x, value: 10}
                    - line: 3
                      while: {op: ">", left: x, right: 0}
                      body: [{line: 4, expr: {call: print, args: [x]}}]
                """);

        assertThat(summary.loopSites()).containsExactly(new LoopSite(LoopKind.UNMODIFIED_CONDITION, 3,
                "Loop condition variable 'x' is never modified in the loop body"));
    }

    @Test
    void analyze_modifiedConditionVariableIsNotFlagged() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: countdown
                  body:
                    - {line: 2, assign: x, value: 10}
                    - line: 3
                      while: {op: ">", left: x, right: 0}
                      body: [{line: 4, augassign: x, op: "-=", value: 1}]
                """);

        assertThat(summary.loopSites()).isEmpty();
    }

    @Test
    void analyze_methodCallOnConditionVariableCountsAsModification() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: drain
                  body:
                    - line: 2
                      while: items
                      body: [{line: 3, expr: {call: items.pop}}]
                """);

        assertThat(summary.loopSites()).isEmpty();
    }

    @Test
    void analyze_conditionCallIsNotACandidate() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: poll
                  body:
                    - line: 2
                      while: {call: queue.empty}
                      body: [{line: 3, pass: null}]
                """);

        assertThat(summary.loopSites()).isEmpty();
    }

    @Test
    void analyze_listsAllUnmodifiedConditionVariables() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: wait
                  body:
                    - line: 2
                      while: {and: [running, {op: "<", left: count, right: limit}]}
                      body: [{line: 3, pass: null}]
                """);

        assertThat(summary.loopSites()).singleElement().satisfies(site -> assertThat(site.description())
                .isEqualTo("Loop condition variables 'running', 'count', 'limit' are never modified in the loop body"));
    }

    @Test
    void analyze_unreachableLoopIsNotReported() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: early
                  body:
                    - {line: 2, return: null}
                    - {line: 3, while: true, body: [{line: 4, pass: null}]}
                """);

        assertThat(summary.loopSites()).isEmpty();
        assertThat(summary.unreachableLines()).containsExactly(3, 4);
        assertThat(summary.terminates()).isEqualTo(Termination.ALWAYS);
    }

    @Test
    void analyze_findsCodeAfterReturn() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: f
                  body:
                    - {line: 2, return: 1}
                    - {line: 3, expr: {call: print}}
                    - {line: 4, assign: y, value: 2}
                """);

        assertThat(summary.unreachableLines()).containsExactly(3, 4);
    }

    @Test
    void analyze_findsCodeAfterRaise() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: f
                  body:
                    - {line: 2, raise: {call: ValueError}}
                    - {line: 3, pass: null}
                """);

        assertThat(summary.unreachableLines()).containsExactly(3);
    }

    @Test
    void analyze_findsCodeAfterIfElseThatAlwaysReturns() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: sign
                  body:
                    - line: 2
                      if: {op: ">", left: x, right: 0}
                      body: [{line: 3, return: 1}]
                      else: [{line: 5, return: -1}]
                    - {line: 6, return: 0}
                """);

        assertThat(summary.unreachableLines()).containsExactly(6);
    }

    @Test
    void analyze_ifWithoutElseKeepsFollowingCode() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: f
                  body:
                    - {line: 2, if: flag, body: [{line: 3, return: 1}]}
                    - {line: 4, return: 0}
                """);

        assertThat(summary.unreachableLines()).isEmpty();
    }

    @Test
    void analyze_findsCodeAfterContinue() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: f
                  body:
                    - line: 2
                      for: item
                      in: items
                      body:
                        - {line: 3, continue: null}
                        - {line: 4, expr: {call: handle, args: [item]}}
                """);

        assertThat(summary.unreachableLines()).containsExactly(4);
    }

    @Test
    void analyze_exhaustiveMatchMakesFollowingCodeUnreachable() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: route
                  body:
                    - line: 2
                      match: command
                      cases:
                        - {line: 3, pattern: "'start'", body: [{line: 4, return: 1}]}
                        - {line: 5, pattern: _, body: [{line: 6, return: 0}]}
                    - {line: 7, return: -1}
                """);

        assertThat(summary.unreachableLines()).containsExactly(7);
    }

    @Test
    void analyze_matchWithoutWildcardKeepsFollowingCode() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: route
                  body:
                    - line: 2
                      match: command
                      cases:
                        - {line: 3, pattern: "'start'", body: [{line: 4, return: 1}]}
                        - {line: 5, pattern: "'stop'", body: [{line: 6, return: 0}]}
                    - {line: 7, return: -1}
                """);

        assertThat(summary.unreachableLines()).isEmpty();
    }

    @Test
    void analyze_guardedWildcardKeepsFollowingCode() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: route
                  body:
                    - line: 2
                      match: command
                      cases:
                        - {line: 3, pattern: _, guard: ready, body: [{line: 4, return: 1}]}
                    - {line: 5, return: -1}
                """);

        assertThat(summary.unreachableLines()).isEmpty();
    }

    @Test
    void analyze_returnInsideWithMakesFollowingCodeUnreachable() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: read
                  body:
                    - line: 2
                      with: [{context: {call: open, args: [path]}, as: handle}]
                      body: [{line: 3, return: {call: handle.read}}]
                    - {line: 4, return: null}
                """);

        assertThat(summary.unreachableLines()).containsExactly(4);
    }

    @Test
    void analyze_finallyRunsButCodeAfterTryIsUnreachable() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: f
                  body:
                    - line: 2
                      try:
                        - {line: 3, return: 1}
                      finally:
                        - {line: 5, expr: {call: cleanup}}
                    - {line: 6, expr: {call: never}}
                """);

        assertThat(summary.unreachableLines()).containsExactly(6);
        assertThat(summary.blockCount()).isGreaterThanOrEqualTo(4);
    }

    @Test
    void analyze_exceptHandlerKeepsFollowingCodeReachable() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: f
                  body:
                    - line: 2
                      try:
                        - {line: 3, return: {call: risky}}
                      except:
                        - {line: 4, type: ValueError, body: [{line: 5, pass: null}]}
                    - {line: 6, return: null}
                """);

        assertThat(summary.unreachableLines()).isEmpty();
        assertThat(summary.blockCount()).isGreaterThanOrEqualTo(3);
    }

    @Test
    void analyze_codeAfterWhileTrueStaysReachable() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: serve
                  body:
                    - {line: 2, while: true, body: [{line: 3, expr: {call: accept}}]}
                    - {line: 4, return: null}
                """);

        assertThat(summary.unreachableLines()).isEmpty();
        assertThat(summary.loopSites()).hasSize(1);
    }

    @Test
    void analyze_breakOutsideLoopIsNotAnalyzable() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: broken
                  body:
                    - {line: 2, break: null}
                """);

        assertThat(summary.analyzable()).isFalse();
        assertThat(summary.blockCount()).isZero();
        assertThat(summary.unreachableLines()).isEmpty();
        assertThat(summary.loopSites()).isEmpty();
        assertThat(summary.qualifiedName()).isEqualTo("broken");
    }

    @Test
    void analyze_asyncFunctionIsAnalyzed() {
        FunctionSummary summary = analyze("""
                - line: 1
                  def: fetch
                  async: true
                  body:
                    - {line: 2, return: {await: {call: client.get}}}
                    - {line: 3, pass: null}
                """);

        assertThat(summary.analyzable()).isTrue();
        assertThat(summary.unreachableLines()).containsExactly(3);
    }

    @Test
    void analyze_recordsPathLineComplexityAndCallees() {
        FunctionUnit unit = Trees.function("""
                - line: 7
                  def: handler
                  body:
                    - {line: 8, if: ok, body: [{line: 9, return: {call: helper}}]}
                """);

        FunctionSummary summary = analyzer.analyze(unit, "app.py", List.of("helper"));

        assertThat(summary.path()).isEqualTo("app.py");
        assertThat(summary.line()).isEqualTo(7);
        assertThat(summary.cyclomaticComplexity()).isEqualTo(2);
        assertThat(summary.localCallees()).containsExactly("helper");
        assertThat(summary.analyzable()).isTrue();
    }

    @Test
    void analyze_nestedFunctionBodyIsNotPartOfOuterFunction() {
        List<FunctionUnit> units = Trees.functions("""
                - line: 1
                  def: outer
                  body:
                    - line: 2
                      def: inner
                      body:
                        - {line: 3, while: true, body: [{line: 4, pass: null}]}
                    - {line: 5, return: inner}
                """);

        FunctionSummary outer = analyzer.analyze(units.get(0), "test.py", List.of());
        FunctionSummary inner = analyzer.analyze(units.get(1), "test.py", List.of());

        assertThat(outer.loopSites()).isEmpty();
        assertThat(outer.unreachableLines()).isEmpty();
        assertThat(inner.loopSites()).hasSize(1);
    }
}
