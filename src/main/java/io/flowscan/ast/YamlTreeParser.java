package io.flowscan.ast;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads statement trees that an external front end has serialized as YAML.
 * <p>
 * The document is either a list of statements (the module body) or a map with a
 * {@code body} list. Each statement is a map with a {@code line} and exactly one kind key:
 * <pre>
 * - {line: 2, def: foo, async: false, body: [...]}
 * - {line: 3, class: Foo, body: [...]}
 * - {line: 4, expr: {call: print, args: [x]}}
 * - {line: 5, assign: x, value: 1}            # a list under assign means several targets
 * - {line: 6, augassign: x, op: "-=", value: 1}
 * - {line: 7, pass: null}                     # also break / continue
 * - {line: 8, return: x}                      # also raise; null for a bare one
 * - {line: 9, if: x, body: [...], else: [...]}
 * - {line: 10, while: true, body: [...], else: [...]}
 * - {line: 11, for: item, in: items, body: [...], else: [...], async: false}
 * - {line: 12, try: [...], except: [{line: 13, type: ValueError, name: e, body: [...]}],
 *    else: [...], finally: [...]}
 * - {line: 14, with: [{context: {call: open, args: [path]}, as: f}], body: [...]}
 * - {line: 15, match: x, cases: [{line: 16, pattern: "1", guard: y, body: [...]}]}
 * </pre>
 * Expressions: a dotted identifier string is a name or attribute chain; booleans and
 * numbers are constants; a list is a collection; maps use one operator key:
 * {@code call} (with {@code args}), {@code and}, {@code or}, {@code not}, {@code op}
 * (with {@code left}/{@code right}), {@code str}, {@code subscript} (with {@code index}),
 * {@code lambda}, {@code await}, {@code const}.
 */
public class YamlTreeParser implements SourceParser {

    private static final Pattern DOTTED_IDENTIFIER =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    private static final List<String> STATEMENT_KINDS = List.of(
            "def", "class", "expr", "assign", "augassign", "pass", "return", "raise",
            "break", "continue", "if", "while", "for", "try", "with", "match");

    @Override
    public ParsedModule parse(String path, String source) throws ParseException {
        Object document;
        try {
            document = new Yaml().load(source);
        } catch (YAMLException e) {
            throw new ParseException(path, "invalid YAML: " + e.getMessage(), e);
        }

        Object body;
        if (document == null) {
            body = List.of();
        } else if (document instanceof List<?>) {
            body = document;
        } else if (document instanceof Map<?, ?> map && map.containsKey("body")) {
            body = map.get("body");
        } else {
            throw new ParseException(path, "expected a statement list or a map with 'body'");
        }
        return new ParsedModule(path, new Converter(path).statements(body, "module"));
    }

    /**
     * Converts one document; carries the path for error messages.
     */
    private static final class Converter {

        private final String path;

        Converter(String path) {
            this.path = path;
        }

        List<Stmt> statements(Object node, String context) throws ParseException {
            if (node == null) {
                return List.of();
            }
            if (!(node instanceof List<?> list)) {
                throw error("expected a statement list in " + context);
            }
            List<Stmt> result = new ArrayList<>(list.size());
            for (Object item : list) {
                result.add(statement(item));
            }
            return result;
        }

        private Stmt statement(Object node) throws ParseException {
            if (!(node instanceof Map<?, ?> map)) {
                throw error("statement must be a map, got: " + node);
            }
            String kind = kindOf(map);
            int line = line(map, kind);
            try {
                return switch (kind) {
                    case "def" -> new Stmt.FunctionDef(line, identifier(map.get("def"), line),
                            statements(map.get("body"), "def"), flag(map, "async"));
                    case "class" -> new Stmt.ClassDef(line, identifier(map.get("class"), line),
                            statements(map.get("body"), "class"));
                    case "expr" -> new Stmt.ExprStmt(line, expr(map.get("expr"), line));
                    case "assign" -> new Stmt.Assign(line, targets(map.get("assign"), line),
                            expr(required(map, "value", line), line));
                    case "augassign" -> new Stmt.AugAssign(line, expr(map.get("augassign"), line),
                            String.valueOf(map.get("op")), expr(required(map, "value", line), line));
                    case "pass" -> new Stmt.Pass(line);
                    case "break" -> new Stmt.Break(line);
                    case "continue" -> new Stmt.Continue(line);
                    case "return" -> new Stmt.Return(line, optionalExpr(map.get("return"), line));
                    case "raise" -> new Stmt.Raise(line, optionalExpr(map.get("raise"), line));
                    case "if" -> new Stmt.If(line, expr(map.get("if"), line),
                            statements(map.get("body"), "if"), statements(map.get("else"), "else"));
                    case "while" -> new Stmt.While(line, expr(map.get("while"), line),
                            statements(map.get("body"), "while"), statements(map.get("else"), "else"));
                    case "for" -> new Stmt.For(line, expr(map.get("for"), line),
                            expr(required(map, "in", line), line),
                            statements(map.get("body"), "for"), statements(map.get("else"), "else"),
                            flag(map, "async"));
                    case "try" -> new Stmt.Try(line, statements(map.get("try"), "try"),
                            handlers(map.get("except"), line), statements(map.get("else"), "else"),
                            statements(map.get("finally"), "finally"));
                    case "with" -> new Stmt.With(line, withItems(map.get("with"), line),
                            statements(map.get("body"), "with"), flag(map, "async"));
                    case "match" -> new Stmt.Match(line, expr(map.get("match"), line),
                            cases(map.get("cases"), line));
                    default -> throw error("unknown statement kind '" + kind + "' at line " + line);
                };
            } catch (IllegalArgumentException e) {
                throw new ParseException(path, "invalid '" + kind + "' at line " + line + ": "
                        + e.getMessage(), e);
            }
        }

        private String kindOf(Map<?, ?> map) throws ParseException {
            String found = null;
            for (String kind : STATEMENT_KINDS) {
                if (map.containsKey(kind)) {
                    if (found != null) {
                        throw error("statement has both '" + found + "' and '" + kind + "'");
                    }
                    found = kind;
                }
            }
            if (found == null) {
                throw error("statement has no kind key: " + map.keySet());
            }
            return found;
        }

        private int line(Map<?, ?> map, String kind) throws ParseException {
            Object line = map.get("line");
            if (!(line instanceof Integer value) || value < 1) {
                throw error("'" + kind + "' statement needs a positive integer 'line', got: " + line);
            }
            return value;
        }

        private List<Stmt.ExceptHandler> handlers(Object node, int tryLine) throws ParseException {
            if (node == null) {
                return List.of();
            }
            if (!(node instanceof List<?> list)) {
                throw error("'except' at line " + tryLine + " must be a list");
            }
            List<Stmt.ExceptHandler> result = new ArrayList<>();
            for (Object item : list) {
                if (!(item instanceof Map<?, ?> map)) {
                    throw error("except clause at line " + tryLine + " must be a map");
                }
                int line = map.get("line") instanceof Integer l ? l : tryLine;
                Object name = map.get("name");
                result.add(new Stmt.ExceptHandler(line, optionalExpr(map.get("type"), line),
                        name == null ? null : String.valueOf(name), statements(map.get("body"), "except")));
            }
            return result;
        }

        private List<Stmt.WithItem> withItems(Object node, int line) throws ParseException {
            List<?> list = node instanceof List<?> l ? l : List.of(node);
            List<Stmt.WithItem> result = new ArrayList<>();
            for (Object item : list) {
                if (item instanceof Map<?, ?> map && map.containsKey("context")) {
                    result.add(new Stmt.WithItem(expr(map.get("context"), line),
                            optionalExpr(map.get("as"), line)));
                } else {
                    result.add(new Stmt.WithItem(expr(item, line), null));
                }
            }
            return result;
        }

        private List<Stmt.MatchCase> cases(Object node, int matchLine) throws ParseException {
            if (!(node instanceof List<?> list)) {
                throw error("'match' at line " + matchLine + " needs a 'cases' list");
            }
            List<Stmt.MatchCase> result = new ArrayList<>();
            for (Object item : list) {
                if (!(item instanceof Map<?, ?> map)) {
                    throw error("case at line " + matchLine + " must be a map");
                }
                int line = map.get("line") instanceof Integer l ? l : matchLine;
                String pattern = String.valueOf(map.get("pattern"));
                boolean irrefutable = map.containsKey("irrefutable") ? flag(map, "irrefutable") : "_".equals(pattern);
                result.add(new Stmt.MatchCase(line, pattern, irrefutable,
                        optionalExpr(map.get("guard"), line), statements(map.get("body"), "case")));
            }
            return result;
        }

        private List<Expr> targets(Object node, int line) throws ParseException {
            if (node instanceof List<?> list) {
                List<Expr> result = new ArrayList<>();
                for (Object item : list) {
                    result.add(expr(item, line));
                }
                return result;
            }
            return List.of(expr(node, line));
        }

        private Expr optionalExpr(Object node, int line) throws ParseException {
            return node == null ? null : expr(node, line);
        }

        Expr expr(Object node, int line) throws ParseException {
            if (node == null || node instanceof Boolean || node instanceof Number) {
                return new Expr.Constant(node);
            }
            if (node instanceof String text) {
                if (!DOTTED_IDENTIFIER.matcher(text).matches()) {
                    throw error("'" + text + "' at line " + line + " is not an identifier; use {str: ...}");
                }
                return Expr.dotted(text);
            }
            if (node instanceof List<?> list) {
                List<Expr> elements = new ArrayList<>();
                for (Object item : list) {
                    elements.add(expr(item, line));
                }
                return new Expr.Collection(elements);
            }
            if (node instanceof Map<?, ?> map) {
                return operator(map, line);
            }
            throw error("unsupported expression at line " + line + ": " + node);
        }

        private Expr operator(Map<?, ?> map, int line) throws ParseException {
            if (map.containsKey("call")) {
                List<Expr> args = new ArrayList<>();
                Object rawArgs = map.get("args");
                if (rawArgs instanceof List<?> list) {
                    for (Object arg : list) {
                        args.add(expr(arg, line));
                    }
                } else if (rawArgs != null) {
                    args.add(expr(rawArgs, line));
                }
                return new Expr.Call(expr(map.get("call"), line), args);
            } else if (map.containsKey("and") || map.containsKey("or")) {
                boolean and = map.containsKey("and");
                Object operands = map.get(and ? "and" : "or");
                if (!(operands instanceof List<?> list)) {
                    throw error("boolean operator at line " + line + " needs a list of operands");
                }
                List<Expr> values = new ArrayList<>();
                for (Object operand : list) {
                    values.add(expr(operand, line));
                }
                return new Expr.BoolOp(and ? Expr.BoolOperator.AND : Expr.BoolOperator.OR, values);
            } else if (map.containsKey("not")) {
                return new Expr.UnaryOp("not", expr(map.get("not"), line));
            } else if (map.containsKey("op")) {
                return new Expr.BinaryOp(String.valueOf(map.get("op")),
                        expr(required(map, "left", line), line), expr(required(map, "right", line), line));
            } else if (map.containsKey("str")) {
                return new Expr.Constant(String.valueOf(map.get("str")));
            } else if (map.containsKey("const")) {
                return new Expr.Constant(map.get("const"));
            } else if (map.containsKey("subscript")) {
                return new Expr.Subscript(expr(map.get("subscript"), line), expr(required(map, "index", line), line));
            } else if (map.containsKey("lambda")) {
                return new Expr.Lambda(expr(map.get("lambda"), line));
            } else if (map.containsKey("await")) {
                return new Expr.Await(expr(map.get("await"), line));
            }
            throw error("unknown expression operator at line " + line + ": " + map.keySet());
        }

        private String identifier(Object node, int line) throws ParseException {
            if (!(node instanceof String text) || text.isBlank()) {
                throw error("expected a name at line " + line + ", got: " + node);
            }
            return text;
        }

        private Object required(Map<?, ?> map, String key, int line) throws ParseException {
            if (!map.containsKey(key)) {
                throw error("missing '" + key + "' at line " + line);
            }
            return map.get(key);
        }

        private boolean flag(Map<?, ?> map, String key) {
            return Boolean.TRUE.equals(map.get(key));
        }

        private ParseException error(String message) {
            return new ParseException(path, message);
        }
    }
}
