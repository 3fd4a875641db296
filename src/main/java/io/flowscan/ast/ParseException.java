package io.flowscan.ast;

/**
 * Raised by a {@link SourceParser} when a file cannot be turned into a statement tree.
 */
public class ParseException extends Exception {

    private final String path;

    public ParseException(String path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public ParseException(String path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
