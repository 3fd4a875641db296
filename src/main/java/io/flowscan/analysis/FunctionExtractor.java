package io.flowscan.analysis;

import io.flowscan.ast.Stmt;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds every function definition of a module, including methods and nested functions,
 * in source order. Lambdas are expressions and never show up here.
 */
public class FunctionExtractor {

    /**
     * Extracts the functions of a module body.
     *
     * @param body   Module statements
     * @param prefix Prefix for qualified names (a module name for cross-file analysis), or null
     */
    public List<FunctionUnit> extract(List<Stmt> body, String prefix) {
        List<FunctionUnit> result = new ArrayList<>();
        String scope = prefix == null || prefix.isEmpty() ? "" : prefix;
        walk(body, scope, null, null, result);
        return result;
    }

    public List<FunctionUnit> extract(List<Stmt> body) {
        return extract(body, null);
    }

    private void walk(List<Stmt> statements, String scope, String enclosingClass, String parentFunction,
                      List<FunctionUnit> out) {
        for (Stmt stmt : statements) {
            if (stmt instanceof Stmt.FunctionDef def) {
                String qualified = qualify(scope, def.name());
                out.add(new FunctionUnit(qualified, def.name(), enclosingClass, parentFunction, def));
                walk(def.body(), qualified, null, qualified, out);
            } else if (stmt instanceof Stmt.ClassDef cls) {
                String qualified = qualify(scope, cls.name());
                walk(cls.body(), qualified, qualified, parentFunction, out);
            } else {
                // Definitions under if/try/with/loops keep the current scope
                for (List<Stmt> nested : stmt.nestedBodies()) {
                    walk(nested, scope, enclosingClass, parentFunction, out);
                }
            }
        }
    }

    private static String qualify(String scope, String name) {
        return scope.isEmpty() ? name : scope + "." + name;
    }
}
