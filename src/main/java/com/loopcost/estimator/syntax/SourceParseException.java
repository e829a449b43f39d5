package com.loopcost.estimator.syntax;

/**
 * Raised when source text is not syntactically valid. Analysis never runs on a module
 * that failed to parse.
 */
public class SourceParseException extends Exception {

    private final String origin;
    private final int line;
    private final int column;

    public SourceParseException(String origin, int line, int column, String message) {
        super(format(origin, line, column, message));
        this.origin = origin;
        this.line = line;
        this.column = column;
    }

    public SourceParseException(String origin, int line, int column, String message, Throwable cause) {
        super(format(origin, line, column, message), cause);
        this.origin = origin;
        this.line = line;
        this.column = column;
    }

    public String getOrigin() {
        return origin;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    private static String format(String origin, int line, int column, String message) {
        return origin + ":" + line + ":" + column + ": " + message;
    }
}
