package com.loopcost.estimator.syntax.java;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.Range;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.loopcost.estimator.syntax.ParsedModule;
import com.loopcost.estimator.syntax.SourceLanguage;
import com.loopcost.estimator.syntax.SourceParseException;
import com.loopcost.estimator.syntax.SourceParser;
import com.loopcost.estimator.syntax.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Parses Java source with JavaParser and lowers it into the language-neutral syntax tree.
 */
public class JavaSourceParser implements SourceParser {

    private static final Logger logger = LoggerFactory.getLogger(JavaSourceParser.class);

    private final JavaParser javaParser;

    public JavaSourceParser() {
        ParserConfiguration parserConfig = new ParserConfiguration();
        parserConfig.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.javaParser = new JavaParser(parserConfig);
    }

    @Override
    public SourceLanguage getLanguage() {
        return SourceLanguage.JAVA;
    }

    @Override
    public ParsedModule parse(String source, String origin) throws SourceParseException {
        ParseResult<CompilationUnit> result = javaParser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw toParseException(result.getProblems(), origin);
        }

        CompilationUnit cu = result.getResult().get();
        List<Statement> body = new JavaSyntaxLowering().lowerCompilationUnit(cu);
        logger.debug("Parsed {}: {} type declarations", origin, body.size());

        return new ParsedModule(origin, SourceLanguage.JAVA, body, ParsedModule.countLines(source));
    }

    private static SourceParseException toParseException(List<Problem> problems, String origin) {
        if (problems.isEmpty()) {
            return new SourceParseException(origin, 0, 0, "unparsable Java source");
        }
        Problem problem = problems.get(0);
        Optional<Range> range = problem.getLocation().flatMap(TokenRange::toRange);
        int line = range.map(r -> r.begin.line).orElse(0);
        int column = range.map(r -> r.begin.column).orElse(0);
        String message = firstLine(problem.getMessage());
        if (problems.size() > 1) {
            message += " (" + (problems.size() - 1) + " more problems)";
        }
        return new SourceParseException(origin, line, column, message, problem.getCause().orElse(null));
    }

    private static String firstLine(String message) {
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline).trim();
    }
}
