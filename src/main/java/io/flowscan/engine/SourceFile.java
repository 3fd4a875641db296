package io.flowscan.engine;

import io.flowscan.ast.ParsedModule;

/**
 * One input file of a batch: either source text for the parser, or a tree the caller
 * parsed already.
 *
 * @param path   File path, used in results and for module names
 * @param source Source text, or null when {@code module} is given
 * @param module Parsed tree, or null when {@code source} is given
 */
public record SourceFile(String path, String source, ParsedModule module) {
    public SourceFile {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        if ((source == null) == (module == null)) {
            throw new IllegalArgumentException("Exactly one of source and module must be given for " + path);
        }
    }

    public static SourceFile of(String path, String source) {
        return new SourceFile(path, source, null);
    }

    public static SourceFile parsed(ParsedModule module) {
        return new SourceFile(module.path(), null, module);
    }

    public boolean isParsed() {
        return module != null;
    }
}
