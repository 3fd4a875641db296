package io.flowscan.analysis;

import io.flowscan.ast.Stmt;

import java.util.List;
import java.util.Objects;

/**
 * One function definition found in a module, with the scope it was defined in.
 *
 * @param qualifiedName  Name qualified by enclosing classes and functions, e.g. {@code Outer.Inner.method}
 * @param simpleName     Name as written in the definition
 * @param enclosingClass Qualified name of the class the function is a method of, or null
 * @param parentFunction Qualified name of the function it is nested in, or null
 * @param definition     The definition statement
 */
public record FunctionUnit(
        String qualifiedName,
        String simpleName,
        String enclosingClass,
        String parentFunction,
        Stmt.FunctionDef definition
) {
    public FunctionUnit {
        if (qualifiedName == null || qualifiedName.isBlank()) {
            throw new IllegalArgumentException("Qualified name cannot be null or blank");
        }
        Objects.requireNonNull(definition, "definition");
        if (simpleName == null) {
            simpleName = definition.name();
        }
    }

    public List<Stmt> body() {
        return definition.body();
    }

    public int line() {
        return definition.line();
    }

    public boolean isMethod() {
        return enclosingClass != null;
    }

    /**
     * Checks if the function sits directly at module level.
     */
    public boolean isModuleLevel() {
        return enclosingClass == null && parentFunction == null;
    }
}
