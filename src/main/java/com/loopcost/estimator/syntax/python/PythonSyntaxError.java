package com.loopcost.estimator.syntax.python;

/**
 * Unchecked carrier for a syntax error found while lexing, parsing or lowering.
 * {@link PythonSourceParser} turns it into a {@code SourceParseException}.
 */
final class PythonSyntaxError extends RuntimeException {

    private final int line;
    private final int column;

    PythonSyntaxError(int line, int column, String message) {
        super(message);
        this.line = line;
        this.column = column;
    }

    int getLine() {
        return line;
    }

    /** One-based. */
    int getColumn() {
        return column;
    }
}
