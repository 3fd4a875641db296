package io.flowscan.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Statement node of a function's statement tree, as produced by the AST adapter.
 * Every statement carries its 1-based source line.
 */
public sealed interface Stmt {

    int line();

    record ExprStmt(int line, Expr value) implements Stmt {
        public ExprStmt {
            checkLine(line);
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * Plain assignment; chained assignments carry several targets.
     */
    record Assign(int line, List<Expr> targets, Expr value) implements Stmt {
        public Assign {
            checkLine(line);
            targets = targets == null ? List.of() : List.copyOf(targets);
            if (targets.isEmpty()) {
                throw new IllegalArgumentException("Assign needs at least one target");
            }
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * Augmented assignment such as {@code x -= 1}.
     */
    record AugAssign(int line, Expr target, String op, Expr value) implements Stmt {
        public AugAssign {
            checkLine(line);
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(value, "value");
        }
    }

    record Pass(int line) implements Stmt {
        public Pass {
            checkLine(line);
        }
    }

    /**
     * Return statement; value may be null.
     */
    record Return(int line, Expr value) implements Stmt {
        public Return {
            checkLine(line);
        }
    }

    /**
     * Raise statement; a bare re-raise has a null exception.
     */
    record Raise(int line, Expr exception) implements Stmt {
        public Raise {
            checkLine(line);
        }
    }

    record Break(int line) implements Stmt {
        public Break {
            checkLine(line);
        }
    }

    record Continue(int line) implements Stmt {
        public Continue {
            checkLine(line);
        }
    }

    /**
     * Conditional. An {@code elif} chain is an {@code If} nested as the only statement of
     * {@code orelse}.
     */
    record If(int line, Expr test, List<Stmt> body, List<Stmt> orelse) implements Stmt {
        public If {
            checkLine(line);
            Objects.requireNonNull(test, "test");
            body = copy(body);
            orelse = copy(orelse);
        }
    }

    record While(int line, Expr test, List<Stmt> body, List<Stmt> orelse) implements Stmt {
        public While {
            checkLine(line);
            Objects.requireNonNull(test, "test");
            body = copy(body);
            orelse = copy(orelse);
        }
    }

    record For(int line, Expr target, Expr iter, List<Stmt> body, List<Stmt> orelse,
               boolean async) implements Stmt {
        public For {
            checkLine(line);
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(iter, "iter");
            body = copy(body);
            orelse = copy(orelse);
        }
    }

    record Try(int line, List<Stmt> body, List<ExceptHandler> handlers, List<Stmt> orelse,
               List<Stmt> finalbody) implements Stmt {
        public Try {
            checkLine(line);
            body = copy(body);
            handlers = handlers == null ? List.of() : List.copyOf(handlers);
            orelse = copy(orelse);
            finalbody = copy(finalbody);
        }
    }

    /**
     * One {@code except} clause. The type and bound name are optional.
     */
    record ExceptHandler(int line, Expr type, String name, List<Stmt> body) {
        public ExceptHandler {
            checkLine(line);
            body = copy(body);
        }
    }

    record With(int line, List<WithItem> items, List<Stmt> body, boolean async) implements Stmt {
        public With {
            checkLine(line);
            items = items == null ? List.of() : List.copyOf(items);
            body = copy(body);
        }
    }

    /**
     * Context manager expression with its optional {@code as} target.
     */
    record WithItem(Expr context, Expr target) {
        public WithItem {
            Objects.requireNonNull(context, "context");
        }
    }

    record Match(int line, Expr subject, List<MatchCase> cases) implements Stmt {
        public Match {
            checkLine(line);
            Objects.requireNonNull(subject, "subject");
            cases = cases == null ? List.of() : List.copyOf(cases);
        }
    }

    /**
     * One {@code case} arm. {@code irrefutable} marks a pattern that always matches
     * ({@code case _:} or a bare capture).
     */
    record MatchCase(int line, String pattern, boolean irrefutable, Expr guard, List<Stmt> body) {
        public MatchCase {
            checkLine(line);
            body = copy(body);
        }
    }

    record FunctionDef(int line, String name, List<Stmt> body, boolean async) implements Stmt {
        public FunctionDef {
            checkLine(line);
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Function name cannot be null or blank");
            }
            body = copy(body);
        }
    }

    record ClassDef(int line, String name, List<Stmt> body) implements Stmt {
        public ClassDef {
            checkLine(line);
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Class name cannot be null or blank");
            }
            body = copy(body);
        }
    }

    /**
     * Nested statement lists owned by this statement, in source order.
     */
    default List<List<Stmt>> nestedBodies() {
        if (this instanceof If s) {
            return List.of(s.body(), s.orelse());
        } else if (this instanceof While s) {
            return List.of(s.body(), s.orelse());
        } else if (this instanceof For s) {
            return List.of(s.body(), s.orelse());
        } else if (this instanceof Try s) {
            List<List<Stmt>> result = new ArrayList<>();
            result.add(s.body());
            s.handlers().forEach(h -> result.add(h.body()));
            result.add(s.orelse());
            result.add(s.finalbody());
            return result;
        } else if (this instanceof With s) {
            return List.of(s.body());
        } else if (this instanceof Match s) {
            return s.cases().stream().map(MatchCase::body).toList();
        } else if (this instanceof FunctionDef s) {
            return List.of(s.body());
        } else if (this instanceof ClassDef s) {
            return List.of(s.body());
        }
        return List.of();
    }

    /**
     * Expressions evaluated by this statement itself, not by nested statements.
     */
    default List<Expr> ownExpressions() {
        List<Expr> result = new ArrayList<>();
        if (this instanceof ExprStmt s) {
            result.add(s.value());
        } else if (this instanceof Assign s) {
            result.addAll(s.targets());
            result.add(s.value());
        } else if (this instanceof AugAssign s) {
            result.add(s.target());
            result.add(s.value());
        } else if (this instanceof Return s && s.value() != null) {
            result.add(s.value());
        } else if (this instanceof Raise s && s.exception() != null) {
            result.add(s.exception());
        } else if (this instanceof If s) {
            result.add(s.test());
        } else if (this instanceof While s) {
            result.add(s.test());
        } else if (this instanceof For s) {
            result.add(s.target());
            result.add(s.iter());
        } else if (this instanceof Try s) {
            s.handlers().stream()
                    .map(ExceptHandler::type)
                    .filter(Objects::nonNull)
                    .forEach(result::add);
        } else if (this instanceof With s) {
            for (WithItem item : s.items()) {
                result.add(item.context());
                if (item.target() != null) {
                    result.add(item.target());
                }
            }
        } else if (this instanceof Match s) {
            result.add(s.subject());
            s.cases().stream()
                    .map(MatchCase::guard)
                    .filter(Objects::nonNull)
                    .forEach(result::add);
        }
        return result;
    }

    /**
     * Checks if this statement is a {@code while} or {@code for} loop.
     */
    default boolean isLoop() {
        return this instanceof While || this instanceof For;
    }

    /**
     * Checks if this statement opens a new scope (function or class definition).
     */
    default boolean isDefinition() {
        return this instanceof FunctionDef || this instanceof ClassDef;
    }

    private static void checkLine(int line) {
        if (line < 1) {
            throw new IllegalArgumentException("Statement line must be positive, got " + line);
        }
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }
}
