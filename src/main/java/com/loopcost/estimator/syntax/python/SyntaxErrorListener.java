package com.loopcost.estimator.syntax.python;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/**
 * Stops lexing or parsing at the first syntax error and reports it with a
 * Python-style message.
 */
final class SyntaxErrorListener extends BaseErrorListener {

    private static final String MISSING = "missing ";

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine,
                            String msg, RecognitionException e) {
        throw new PythonSyntaxError(line, charPositionInLine + 1, describe(recognizer, offendingSymbol, msg));
    }

    private static String describe(Recognizer<?, ?> recognizer, Object offendingSymbol, String msg) {
        if (offendingSymbol instanceof Token && ((Token) offendingSymbol).getType() == PythonLexer.INDENT) {
            return "unexpected indent";
        }
        if (recognizer instanceof Parser && ((Parser) recognizer).getExpectedTokens().contains(PythonLexer.INDENT)) {
            return "expected an indented block";
        }
        if (msg.startsWith(MISSING) && msg.contains(" at ")) {
            return "expected " + msg.substring(MISSING.length(), msg.lastIndexOf(" at "));
        }
        if (recognizer instanceof Parser) {
            return "invalid syntax (" + msg + ")";
        }
        return msg;
    }
}
