package com.loopcost.estimator.syntax;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Source languages the estimator can parse.
 */
public enum SourceLanguage {
    PYTHON(".py"),
    JAVA(".java");

    private final String extension;

    SourceLanguage(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Detects the language of a file by its extension.
     */
    public static Optional<SourceLanguage> fromPath(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        for (SourceLanguage language : values()) {
            if (name.endsWith(language.extension)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    /**
     * Parses a command-line language name such as {@code python} or {@code java}.
     */
    public static SourceLanguage fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
