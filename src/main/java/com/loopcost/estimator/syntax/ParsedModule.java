package com.loopcost.estimator.syntax;

import java.util.List;
import java.util.Objects;

/**
 * The result of parsing one source file: its top-level statements.
 */
public final class ParsedModule {

    private final String origin;
    private final SourceLanguage language;
    private final List<Statement> body;
    private final int lineCount;

    public ParsedModule(String origin, SourceLanguage language, List<Statement> body, int lineCount) {
        this.origin = Objects.requireNonNull(origin, "origin");
        this.language = Objects.requireNonNull(language, "language");
        this.body = List.copyOf(body);
        this.lineCount = lineCount;
    }

    public String getOrigin() {
        return origin;
    }

    public SourceLanguage getLanguage() {
        return language;
    }

    public List<Statement> getBody() {
        return body;
    }

    public int getLineCount() {
        return lineCount;
    }

    /** Number of source lines; a trailing newline does not start a new line. */
    public static int countLines(String source) {
        if (source.isEmpty()) {
            return 0;
        }
        int lines = (int) source.chars().filter(c -> c == '\n').count();
        return source.endsWith("\n") ? lines : lines + 1;
    }
}
