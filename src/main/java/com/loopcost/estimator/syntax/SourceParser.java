package com.loopcost.estimator.syntax;

/**
 * Turns raw source text into the language-neutral syntax tree.
 */
public interface SourceParser {

    SourceLanguage getLanguage();

    /**
     * Parses one module.
     *
     * @param source the full source text
     * @param origin a display name for error messages, usually the file path
     * @return the parsed module body
     * @throws SourceParseException if the text is not valid source
     */
    ParsedModule parse(String source, String origin) throws SourceParseException;
}
