package io.flowscan.analysis;

import io.flowscan.ast.Expr;
import io.flowscan.ast.Stmt;

import java.util.List;

/**
 * Cyclomatic complexity: 1 plus one per decision point.
 * <p>
 * Decision points are each {@code if}/{@code elif}, each loop header, each {@code except}
 * clause, each {@code case} arm and each short-circuit operator ({@code a and b and c}
 * counts two). Nested function and class definitions and lambda bodies are not part of
 * the function.
 */
public class ComplexityCalculator {

    public int calculate(List<Stmt> body) {
        return 1 + decisions(body);
    }

    private int decisions(List<Stmt> statements) {
        int count = 0;
        for (Stmt stmt : statements) {
            if (stmt.isDefinition()) {
                continue;
            }
            if (stmt instanceof Stmt.If || stmt.isLoop()) {
                count++;
            } else if (stmt instanceof Stmt.Try t) {
                count += t.handlers().size();
            } else if (stmt instanceof Stmt.Match m) {
                count += m.cases().size();
            }
            for (Expr expr : stmt.ownExpressions()) {
                count += shortCircuits(expr);
            }
            for (List<Stmt> nested : stmt.nestedBodies()) {
                count += decisions(nested);
            }
        }
        return count;
    }

    private int shortCircuits(Expr expr) {
        if (expr instanceof Expr.Lambda) {
            return 0;
        }
        int count = expr instanceof Expr.BoolOp b ? b.values().size() - 1 : 0;
        for (Expr child : expr.children()) {
            count += shortCircuits(child);
        }
        return count;
    }
}
