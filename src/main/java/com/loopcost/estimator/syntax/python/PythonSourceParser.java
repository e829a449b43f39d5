package com.loopcost.estimator.syntax.python;

import com.loopcost.estimator.syntax.ParsedModule;
import com.loopcost.estimator.syntax.SourceLanguage;
import com.loopcost.estimator.syntax.SourceParseException;
import com.loopcost.estimator.syntax.SourceParser;
import com.loopcost.estimator.syntax.Statement;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Parses Python 3 source into the language-neutral syntax tree.
 *
 * The ANTLR-generated lexer and parser build the parse tree; {@link PythonSyntaxLowering}
 * turns it into statements. The first syntax error stops parsing.
 */
public class PythonSourceParser implements SourceParser {

    private static final Logger logger = LoggerFactory.getLogger(PythonSourceParser.class);

    @Override
    public SourceLanguage getLanguage() {
        return SourceLanguage.PYTHON;
    }

    @Override
    public ParsedModule parse(String source, String origin) throws SourceParseException {
        SyntaxErrorListener errorListener = new SyntaxErrorListener();

        PythonLexer lexer = new PythonLexer(CharStreams.fromString(source, origin));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        PythonParser parser = new PythonParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        try {
            PythonParser.FileInputContext tree = parser.fileInput();
            logger.debug("Parsed {}: {} tokens", origin, tokens.size());

            List<Statement> body = new PythonSyntaxLowering().lowerFileInput(tree);
            logger.debug("Lowered {}: {} top-level statements", origin, body.size());

            return new ParsedModule(origin, SourceLanguage.PYTHON, body, ParsedModule.countLines(source));
        } catch (PythonSyntaxError e) {
            throw new SourceParseException(origin, e.getLine(), e.getColumn(), e.getMessage(), e);
        }
    }
}
