package io.flowscan.graph;

import io.flowscan.analysis.FunctionUnit;
import io.flowscan.ast.Expr;
import io.flowscan.ast.Stmt;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the calls of a function to other functions of the same module.
 * <p>
 * Resolution rules, first match wins:
 * <ul>
 *   <li>{@code name()}: a function nested in the caller (or in a function enclosing it),
 *       then a module-level function, then the constructor of a module-level class</li>
 *   <li>{@code self.m()} / {@code cls.m()}: a method of the class enclosing the caller</li>
 *   <li>{@code Cls.m()}: a method of class {@code Cls} defined in the module</li>
 * </ul>
 * Anything else is external and dropped.
 */
public class CallResolver {

    private static final Set<String> SELF_NAMES = Set.of("self", "cls");

    private final Map<String, FunctionUnit> functions = new LinkedHashMap<>();
    private final Set<String> classes = new HashSet<>();
    private final String prefix;

    /**
     * @param units  Functions of the module
     * @param prefix Prefix their qualified names carry, or null
     */
    public CallResolver(List<FunctionUnit> units, String prefix) {
        this.prefix = prefix == null || prefix.isEmpty() ? "" : prefix + ".";
        for (FunctionUnit unit : units) {
            functions.put(unit.qualifiedName(), unit);
            if (unit.enclosingClass() != null) {
                classes.add(unit.enclosingClass());
            }
        }
    }

    /**
     * Resolved callees of a function, in the order of their first call.
     */
    public List<String> resolveCallees(FunctionUnit caller) {
        List<Expr.Call> calls = new ArrayList<>();
        collectCalls(caller.body(), calls);
        Set<String> result = new LinkedHashSet<>();
        for (Expr.Call call : calls) {
            String target = resolve(caller, call.func());
            if (target != null) {
                result.add(target);
            }
        }
        return new ArrayList<>(result);
    }

    private String resolve(FunctionUnit caller, Expr func) {
        if (func instanceof Expr.Name name) {
            return resolveName(caller, name.id());
        }
        if (func instanceof Expr.Attribute attr && attr.value() instanceof Expr.Name receiver) {
            if (SELF_NAMES.contains(receiver.id())) {
                String cls = classContext(caller);
                return cls == null ? null : existing(cls + "." + attr.attr());
            }
            String cls = prefix + receiver.id();
            if (classes.contains(cls)) {
                return existing(cls + "." + attr.attr());
            }
        }
        return null;
    }

    private String resolveName(FunctionUnit caller, String name) {
        FunctionUnit scope = caller;
        while (scope != null) {
            FunctionUnit nested = functions.get(scope.qualifiedName() + "." + name);
            if (nested != null && scope.qualifiedName().equals(nested.parentFunction())) {
                return nested.qualifiedName();
            }
            scope = scope.parentFunction() == null ? null : functions.get(scope.parentFunction());
        }
        FunctionUnit moduleLevel = functions.get(prefix + name);
        if (moduleLevel != null && moduleLevel.isModuleLevel()) {
            return moduleLevel.qualifiedName();
        }
        if (classes.contains(prefix + name)) {
            return existing(prefix + name + ".__init__");
        }
        return null;
    }

    /**
     * Class whose methods {@code self} refers to: the caller's own class, or that of the
     * method it is nested in.
     */
    private String classContext(FunctionUnit caller) {
        FunctionUnit scope = caller;
        while (scope != null) {
            if (scope.enclosingClass() != null) {
                return scope.enclosingClass();
            }
            scope = scope.parentFunction() == null ? null : functions.get(scope.parentFunction());
        }
        return null;
    }

    private String existing(String qualifiedName) {
        return functions.containsKey(qualifiedName) ? qualifiedName : null;
    }

    private static void collectCalls(List<Stmt> statements, List<Expr.Call> out) {
        for (Stmt stmt : statements) {
            if (stmt.isDefinition()) {
                continue;
            }
            for (Expr expr : stmt.ownExpressions()) {
                collectCalls(expr, out);
            }
            for (List<Stmt> nested : stmt.nestedBodies()) {
                collectCalls(nested, out);
            }
        }
    }

    private static void collectCalls(Expr expr, List<Expr.Call> out) {
        if (expr instanceof Expr.Call call) {
            out.add(call);
        }
        for (Expr child : expr.children()) {
            collectCalls(child, out);
        }
    }
}
