package io.flowscan.ast;

/**
 * The AST adapter: turns the text of one source file into a statement tree.
 * <p>
 * Implementations are language specific and live outside the engine. They must be
 * stateless or thread-confined, since batch analysis calls them from worker threads.
 */
@FunctionalInterface
public interface SourceParser {

    /**
     * Parses one file.
     *
     * @param path   Path of the file, carried into the result and into errors
     * @param source Full text of the file
     * @return The parsed module
     * @throws ParseException if the text cannot be parsed; the caller reports it for this
     *                        file only
     */
    ParsedModule parse(String path, String source) throws ParseException;
}
