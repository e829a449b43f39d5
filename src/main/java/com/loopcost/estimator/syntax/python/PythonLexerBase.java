package com.loopcost.estimator.syntax.python;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Token;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Layout handling for the generated Python lexer.
 *
 * Turns the raw NEWLINE tokens of the grammar into Python's logical lines:
 * <ul>
 *   <li>line breaks inside brackets and blank or comment-only lines are dropped</li>
 *   <li>a change of indentation emits INDENT or DEDENT tokens after the NEWLINE</li>
 *   <li>end of input closes the last logical line and every open indentation level</li>
 * </ul>
 * It also leaves an f-string replacement field when its closing brace is reached,
 * and enters the format-specification mode at a top-level {@code ':'} of the field.
 */
public abstract class PythonLexerBase extends Lexer {

    private static final int TAB_SIZE = 8;

    private final Deque<Token> pending = new ArrayDeque<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    /** Bracket depth outside each open replacement field, innermost first. */
    private final Deque<Integer> fields = new ArrayDeque<>();

    private int opened = 0;
    private int lastType = Token.INVALID_TYPE;
    private Token eof;

    protected PythonLexerBase(CharStream input) {
        super(input);
    }

    @Override
    public Token nextToken() {
        while (pending.isEmpty()) {
            if (eof != null) {
                return eof;
            }
            int mode = _mode;
            Token token = super.nextToken();
            switch (token.getType()) {
                case PythonLexer.NEWLINE -> onNewLine(token);
                case PythonLexer.LPAREN, PythonLexer.LBRACK -> {
                    opened++;
                    pending.add(token);
                }
                case PythonLexer.LBRACE -> {
                    if (mode != DEFAULT_MODE) {
                        fields.push(opened);
                    }
                    opened++;
                    pending.add(token);
                }
                case PythonLexer.RPAREN, PythonLexer.RBRACK -> {
                    opened = Math.max(0, opened - 1);
                    pending.add(token);
                }
                case PythonLexer.RBRACE -> {
                    opened = Math.max(0, opened - 1);
                    if (mode == PythonLexer.FORMAT_SPEC) {
                        fields.pop();
                    } else if (!fields.isEmpty() && opened == fields.peek()) {
                        fields.pop();
                        popMode();
                    }
                    pending.add(token);
                }
                case PythonLexer.COLON -> {
                    if (atFieldTopLevel()) {
                        mode(PythonLexer.FORMAT_SPEC);
                    }
                    pending.add(token);
                }
                case Token.EOF -> onEndOfInput(token);
                default -> pending.add(token);
            }
        }
        Token token = pending.poll();
        lastType = token.getType();
        return token;
    }

    /** Used by the NEWLINE rule: leading whitespace of the first line is indentation. */
    protected boolean atStartOfInput() {
        return getCharIndex() == 0;
    }

    /** True when the two characters after the one just matched are both {@code quote}. */
    protected boolean atTripleQuote(char quote) {
        return _input.LA(1) == quote && _input.LA(2) == quote;
    }

    /** Inside the innermost replacement field and not nested in any bracket of its expression. */
    private boolean atFieldTopLevel() {
        return _mode == DEFAULT_MODE && !fields.isEmpty() && opened == fields.peek() + 1;
    }

    private void onNewLine(Token newline) {
        if (opened > 0) {
            return;
        }
        int next = _input.LA(1);
        if (next == '\r' || next == '\n' || next == '#' || next == CharStream.EOF) {
            return;
        }
        if (lastType != Token.INVALID_TYPE && lastType != PythonLexer.NEWLINE) {
            pending.add(newline);
        }
        int indent = indentation(newline.getText());
        int current = indents.isEmpty() ? 0 : indents.peek();
        if (indent > current) {
            indents.push(indent);
            pending.add(synthetic(PythonLexer.INDENT, "<INDENT>"));
            return;
        }
        while (!indents.isEmpty() && indents.peek() > indent) {
            indents.pop();
            pending.add(synthetic(PythonLexer.DEDENT, "<DEDENT>"));
        }
        int outer = indents.isEmpty() ? 0 : indents.peek();
        if (outer != indent) {
            getErrorListenerDispatch().syntaxError(this, null, getLine(), getCharPositionInLine(),
                    "unindent does not match any outer indentation level", null);
        }
    }

    private void onEndOfInput(Token token) {
        if (lastType != Token.INVALID_TYPE && lastType != PythonLexer.NEWLINE
                && lastType != PythonLexer.DEDENT) {
            pending.add(synthetic(PythonLexer.NEWLINE, "<NEWLINE>"));
        }
        while (!indents.isEmpty()) {
            indents.pop();
            pending.add(synthetic(PythonLexer.DEDENT, "<DEDENT>"));
        }
        pending.add(token);
        eof = token;
    }

    private static int indentation(String whitespace) {
        int width = 0;
        for (int i = 0; i < whitespace.length(); i++) {
            switch (whitespace.charAt(i)) {
                case ' ' -> width++;
                case '\t' -> width = (width / TAB_SIZE + 1) * TAB_SIZE;
                case '\f', '\r', '\n' -> width = 0;
                default -> {
                    // not indentation
                }
            }
        }
        return width;
    }

    private Token synthetic(int type, String text) {
        CommonToken token = new CommonToken(_tokenFactorySourcePair, type, DEFAULT_TOKEN_CHANNEL,
                _input.index(), _input.index() - 1);
        token.setText(text);
        token.setLine(getLine());
        token.setCharPositionInLine(getCharPositionInLine());
        return token;
    }
}
