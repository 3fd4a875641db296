package io.flowscan.analysis;

import io.flowscan.ast.Expr;
import io.flowscan.ast.Stmt;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Flags loops that have no way out.
 * <p>
 * Four heuristics, each reported as its own {@link LoopSite}:
 * <ul>
 *   <li>{@code while True} without a reachable break, return or raise</li>
 *   <li>{@code while 1} (any non-zero numeric literal), same exit rule</li>
 *   <li>{@code for} over a known unbounded iterator without a reachable break or return</li>
 *   <li>{@code while cond} where no condition variable is ever updated in the body and
 *       nothing exits the loop</li>
 * </ul>
 * Nested loops are checked one by one: a {@code break} only exits its own loop, while a
 * {@code return} or {@code raise} anywhere in the body counts for every enclosing loop.
 * Unreachable loops are not reported.
 */
public class LoopDetector {

    public static final List<String> DEFAULT_UNBOUNDED_ITERATORS = List.of("itertools.cycle", "itertools.count");

    private final Set<String> unboundedIterators;
    private final Set<String> unqualifiedIterators;

    public LoopDetector() {
        this(DEFAULT_UNBOUNDED_ITERATORS);
    }

    /**
     * @param unboundedIterators Qualified names of iterator constructors that never run out
     */
    public LoopDetector(Collection<String> unboundedIterators) {
        this.unboundedIterators = Set.copyOf(unboundedIterators);
        this.unqualifiedIterators = unboundedIterators.stream()
                .map(name -> name.substring(name.lastIndexOf('.') + 1))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Detects non-terminating loops in a function body, in source order.
     */
    public List<LoopSite> detect(List<Stmt> body, StatementReachability reachability) {
        List<LoopSite> sites = new ArrayList<>();
        scan(body, reachability, sites);
        return sites;
    }

    private void scan(List<Stmt> statements, StatementReachability reachability, List<LoopSite> sites) {
        for (Stmt stmt : statements) {
            if (stmt.isDefinition()) {
                continue;
            }
            if (stmt.isLoop() && reachability.isReachable(stmt)) {
                check(stmt, reachability, sites);
            }
            for (List<Stmt> nested : stmt.nestedBodies()) {
                scan(nested, reachability, sites);
            }
        }
    }

    private void check(Stmt loop, StatementReachability reachability, List<LoopSite> sites) {
        if (loop instanceof Stmt.While w) {
            if (w.test() instanceof Expr.Constant c && isAlwaysTrue(c.value())) {
                if (!hasExit(w.body(), reachability, true, 0)) {
                    sites.add(literalSite(w, c.value()));
                }
            } else if (!(w.test() instanceof Expr.Constant)) {
                checkCondition(w, reachability, sites);
            }
        } else if (loop instanceof Stmt.For f) {
            String iterator = unboundedIterator(f.iter());
            if (iterator != null && !hasExit(f.body(), reachability, false, 0)) {
                sites.add(new LoopSite(LoopKind.CYCLE_ITERATOR, f.line(),
                        "Loop over unbounded iterator '" + iterator + "' without break or return"));
            }
        }
    }

    private static LoopSite literalSite(Stmt.While loop, Object value) {
        if (value instanceof Boolean) {
            return new LoopSite(LoopKind.WHILE_TRUE, loop.line(),
                    "'while True' loop without break, return or raise");
        }
        return new LoopSite(LoopKind.WHILE_ONE, loop.line(),
                "'while " + value + "' loop without break, return or raise");
    }

    private void checkCondition(Stmt.While loop, StatementReachability reachability, List<LoopSite> sites) {
        Set<String> conditionVars = new LinkedHashSet<>();
        collectConditionVariables(loop.test(), conditionVars);
        if (conditionVars.isEmpty()) {
            return;
        }
        Set<String> modified = new LinkedHashSet<>();
        collectModified(loop.body(), modified);
        for (String var : conditionVars) {
            if (modified.contains(var)) {
                return;
            }
        }
        if (hasExit(loop.body(), reachability, true, 0)) {
            return;
        }
        String names = conditionVars.stream().map(v -> "'" + v + "'").collect(Collectors.joining(", "));
        String description = conditionVars.size() == 1
                ? "Loop condition variable " + names + " is never modified in the loop body"
                : "Loop condition variables " + names + " are never modified in the loop body";
        sites.add(new LoopSite(LoopKind.UNMODIFIED_CONDITION, loop.line(), description));
    }

    private static boolean isAlwaysTrue(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof BigInteger big) {
            return big.signum() != 0;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.signum() != 0;
        }
        if (value instanceof Double || value instanceof Float) {
            return ((Number) value).doubleValue() != 0;
        }
        if (value instanceof Number n) {
            return n.longValue() != 0;
        }
        return false;
    }

    /**
     * Returns the configured iterator name the expression calls, or null.
     */
    private String unboundedIterator(Expr iter) {
        if (!(iter instanceof Expr.Call call)) {
            return null;
        }
        String callee = call.func().dottedName();
        if (callee == null) {
            return null;
        }
        if (unboundedIterators.contains(callee)) {
            return callee;
        }
        if (!callee.contains(".") && unqualifiedIterators.contains(callee)) {
            return callee;
        }
        return null;
    }

    /**
     * Searches a loop body for a reachable exit. {@code depth} counts loops nested inside
     * the one being checked; a break only counts at depth zero.
     */
    private static boolean hasExit(List<Stmt> statements, StatementReachability reachability,
                                   boolean raiseExits, int depth) {
        for (Stmt stmt : statements) {
            if (stmt.isDefinition()) {
                continue;
            }
            boolean exits = (stmt instanceof Stmt.Break && depth == 0)
                    || stmt instanceof Stmt.Return
                    || (stmt instanceof Stmt.Raise && raiseExits);
            if (exits && reachability.isReachable(stmt)) {
                return true;
            }
            if (stmt instanceof Stmt.While w) {
                if (hasExit(w.body(), reachability, raiseExits, depth + 1)
                        || hasExit(w.orelse(), reachability, raiseExits, depth)) {
                    return true;
                }
            } else if (stmt instanceof Stmt.For f) {
                if (hasExit(f.body(), reachability, raiseExits, depth + 1)
                        || hasExit(f.orelse(), reachability, raiseExits, depth)) {
                    return true;
                }
            } else {
                for (List<Stmt> nested : stmt.nestedBodies()) {
                    if (hasExit(nested, reachability, raiseExits, depth)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    /**
     * Names the condition reads outside of calls. Whatever a call touches may be updated
     * by the callee, so those names are not candidates.
     */
    private static void collectConditionVariables(Expr expr, Set<String> out) {
        if (expr instanceof Expr.Call || expr instanceof Expr.Lambda) {
            return;
        }
        if (expr instanceof Expr.Name n) {
            out.add(n.id());
            return;
        }
        if (expr instanceof Expr.Attribute || expr instanceof Expr.Subscript) {
            String root = expr.rootName();
            if (root != null) {
                out.add(root);
            }
            if (expr instanceof Expr.Subscript s) {
                collectConditionVariables(s.index(), out);
            }
            return;
        }
        for (Expr child : expr.children()) {
            collectConditionVariables(child, out);
        }
    }

    private static void collectModified(List<Stmt> statements, Set<String> out) {
        for (Stmt stmt : statements) {
            if (stmt.isDefinition()) {
                continue;
            }
            if (stmt instanceof Stmt.Assign a) {
                a.targets().forEach(t -> addTargetRoots(t, out));
            } else if (stmt instanceof Stmt.AugAssign a) {
                addTargetRoots(a.target(), out);
            } else if (stmt instanceof Stmt.For f) {
                addTargetRoots(f.target(), out);
            } else if (stmt instanceof Stmt.With w) {
                w.items().stream()
                        .filter(item -> item.target() != null)
                        .forEach(item -> addTargetRoots(item.target(), out));
            } else if (stmt instanceof Stmt.Try t) {
                t.handlers().stream()
                        .filter(h -> h.name() != null)
                        .forEach(h -> out.add(h.name()));
            }
            for (Expr expr : stmt.ownExpressions()) {
                collectCallReceivers(expr, out);
            }
            for (List<Stmt> nested : stmt.nestedBodies()) {
                collectModified(nested, out);
            }
        }
    }

    private static void addTargetRoots(Expr target, Set<String> out) {
        if (target instanceof Expr.Collection c) {
            c.elements().forEach(e -> addTargetRoots(e, out));
            return;
        }
        String root = target.rootName();
        if (root != null) {
            out.add(root);
        }
    }

    /**
     * Receivers of method calls such as {@code items.pop()} count as modified.
     */
    private static void collectCallReceivers(Expr expr, Set<String> out) {
        if (expr instanceof Expr.Lambda) {
            return;
        }
        if (expr instanceof Expr.Call call && call.func() instanceof Expr.Attribute attr) {
            String root = attr.value().rootName();
            if (root != null) {
                out.add(root);
            }
        }
        for (Expr child : expr.children()) {
            collectCallReceivers(child, out);
        }
    }
}
