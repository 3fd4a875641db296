package io.flowscan.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Expression node of a statement tree.
 * Only the shapes the analyses look at are modelled; anything else reaches the engine
 * as one of these with its operands preserved.
 */
public sealed interface Expr {

    /**
     * Variable or function reference.
     */
    record Name(String id) implements Expr {
        public Name {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Name id cannot be null or blank");
            }
        }
    }

    /**
     * Literal value: Boolean, Integer/Long, String or null.
     */
    record Constant(Object value) implements Expr {}

    /**
     * Attribute access, e.g. {@code itertools.cycle} or {@code self.running}.
     */
    record Attribute(Expr value, String attr) implements Expr {
        public Attribute {
            Objects.requireNonNull(value, "value");
            if (attr == null || attr.isBlank()) {
                throw new IllegalArgumentException("Attribute name cannot be null or blank");
            }
        }
    }

    record Call(Expr func, List<Expr> args) implements Expr {
        public Call {
            Objects.requireNonNull(func, "func");
            args = args == null ? List.of() : List.copyOf(args);
        }
    }

    /**
     * Short-circuit {@code and}/{@code or} over two or more operands.
     */
    record BoolOp(BoolOperator op, List<Expr> values) implements Expr {
        public BoolOp {
            Objects.requireNonNull(op, "op");
            values = values == null ? List.of() : List.copyOf(values);
            if (values.size() < 2) {
                throw new IllegalArgumentException("BoolOp needs at least two operands");
            }
        }
    }

    record UnaryOp(String op, Expr operand) implements Expr {
        public UnaryOp {
            Objects.requireNonNull(operand, "operand");
        }
    }

    /**
     * Arithmetic, comparison or any other binary operator.
     */
    record BinaryOp(String op, Expr left, Expr right) implements Expr {
        public BinaryOp {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    /**
     * List, tuple, set or dict display.
     */
    record Collection(List<Expr> elements) implements Expr {
        public Collection {
            elements = elements == null ? List.of() : List.copyOf(elements);
        }
    }

    record Subscript(Expr value, Expr index) implements Expr {
        public Subscript {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(index, "index");
        }
    }

    /**
     * Anonymous function. Never analyzed as a function of its own.
     */
    record Lambda(Expr body) implements Expr {
        public Lambda {
            Objects.requireNonNull(body, "body");
        }
    }

    record Await(Expr value) implements Expr {
        public Await {
            Objects.requireNonNull(value, "value");
        }
    }

    enum BoolOperator {
        AND,
        OR
    }

    /**
     * Direct operands of this expression, in source order.
     */
    default List<Expr> children() {
        if (this instanceof Attribute a) {
            return List.of(a.value());
        } else if (this instanceof Call c) {
            List<Expr> result = new ArrayList<>(c.args().size() + 1);
            result.add(c.func());
            result.addAll(c.args());
            return result;
        } else if (this instanceof BoolOp b) {
            return b.values();
        } else if (this instanceof UnaryOp u) {
            return List.of(u.operand());
        } else if (this instanceof BinaryOp b) {
            return List.of(b.left(), b.right());
        } else if (this instanceof Collection c) {
            return c.elements();
        } else if (this instanceof Subscript s) {
            return List.of(s.value(), s.index());
        } else if (this instanceof Lambda l) {
            return List.of(l.body());
        } else if (this instanceof Await w) {
            return List.of(w.value());
        }
        return List.of();
    }

    /**
     * Dotted form of a name or attribute chain ({@code itertools.cycle}), or null when the
     * expression is anything else.
     */
    default String dottedName() {
        if (this instanceof Name n) {
            return n.id();
        } else if (this instanceof Attribute a) {
            String base = a.value().dottedName();
            return base == null ? null : base + "." + a.attr();
        }
        return null;
    }

    /**
     * Leftmost name of an attribute/subscript chain ({@code self} for {@code self.items[0]}),
     * or null.
     */
    default String rootName() {
        if (this instanceof Name n) {
            return n.id();
        } else if (this instanceof Attribute a) {
            return a.value().rootName();
        } else if (this instanceof Subscript s) {
            return s.value().rootName();
        }
        return null;
    }

    static Name name(String id) {
        return new Name(id);
    }

    static Constant constant(Object value) {
        return new Constant(value);
    }

    /**
     * Builds a name or attribute chain from a dotted path such as {@code itertools.cycle}.
     */
    static Expr dotted(String path) {
        String[] parts = path.split("\\.");
        Expr result = new Name(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            result = new Attribute(result, parts[i]);
        }
        return result;
    }

    static Call call(String func, Expr... args) {
        return new Call(dotted(func), List.of(args));
    }

    static BinaryOp binary(Expr left, String op, Expr right) {
        return new BinaryOp(op, left, right);
    }

    static BoolOp and(Expr... values) {
        return new BoolOp(BoolOperator.AND, List.of(values));
    }

    static BoolOp or(Expr... values) {
        return new BoolOp(BoolOperator.OR, List.of(values));
    }
}
