package io.flowscan.ast;

import java.util.List;

/**
 * One source file as handed over by the AST adapter.
 *
 * @param path Path of the file, as given by the caller (used for reporting and module naming)
 * @param body Top-level statements in source order
 */
public record ParsedModule(String path, List<Stmt> body) {

    public ParsedModule {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        body = body == null ? List.of() : List.copyOf(body);
    }

    /**
     * Dotted module name derived from the path: the extension is dropped and path
     * separators become dots, so {@code pkg/a.py} becomes {@code pkg.a}.
     */
    public String moduleName() {
        String normalized = path.replace('\\', '/');
        while (normalized.startsWith("./") || normalized.startsWith("/")) {
            normalized = normalized.substring(normalized.startsWith("/") ? 1 : 2);
        }
        int slash = normalized.lastIndexOf('/');
        int dot = normalized.lastIndexOf('.');
        if (dot > slash + 1) {
            normalized = normalized.substring(0, dot);
        }
        return normalized.replace('/', '.');
    }
}
