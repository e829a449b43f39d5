package com.loopcost.estimator.syntax;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An expression node of the language-neutral syntax tree.
 *
 * Like {@link Statement}, expressions are a tagged union. The meaning of the generic
 * positions depends on the kind:
 * <ul>
 *   <li>{@code CONSTANT}, {@code FORMATTED}: {@code value} is the literal source text</li>
 *   <li>{@code NAME}: {@code value} is the identifier</li>
 *   <li>{@code CALL}: {@code function} is the callee, {@code operands} the positional
 *       arguments, {@code keywords} the keyword arguments</li>
 *   <li>{@code ATTRIBUTE}: {@code function} is the receiver, {@code value} the attribute name</li>
 *   <li>{@code SUBSCRIPT}: {@code function} is the receiver, {@code operands} the index</li>
 *   <li>{@code KEYWORD}: {@code value} is the keyword name (null for {@code **kwargs}),
 *       {@code operands} the single argument value</li>
 *   <li>containers, operators, comprehensions: {@code operands} are the sub-expressions,
 *       {@code value} the operator where there is one</li>
 *   <li>{@code LAMBDA}: {@code operands} hold an expression body and default values,
 *       {@code body} holds a statement body</li>
 * </ul>
 */
public final class Expression {

    public enum Kind {
        CONSTANT,
        LIST,
        TUPLE,
        SET,
        DICT,
        NAME,
        CALL,
        ATTRIBUTE,
        SUBSCRIPT,
        SLICE,
        BINARY,
        UNARY,
        BOOLEAN,
        COMPARE,
        CONDITIONAL,
        LAMBDA,
        COMPREHENSION,
        STARRED,
        KEYWORD,
        AWAIT,
        YIELD,
        NAMED,
        FORMATTED,
        OTHER
    }

    private final Kind kind;
    private final int line;
    private final String value;
    private final Expression function;
    private final List<Expression> operands;
    private final List<Expression> keywords;
    private final List<Statement> body;

    private Expression(Kind kind, int line, String value, Expression function,
                       List<Expression> operands, List<Expression> keywords, List<Statement> body) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.line = line;
        this.value = value;
        this.function = function;
        this.operands = List.copyOf(operands);
        this.keywords = List.copyOf(keywords);
        this.body = List.copyOf(body);
    }

    public static Expression constant(int line, String text) {
        return new Expression(Kind.CONSTANT, line, text, null, List.of(), List.of(), List.of());
    }

    public static Expression name(int line, String identifier) {
        Objects.requireNonNull(identifier, "identifier");
        return new Expression(Kind.NAME, line, identifier, null, List.of(), List.of(), List.of());
    }

    public static Expression call(int line, Expression callee, List<Expression> arguments,
                                  List<Expression> keywords) {
        Objects.requireNonNull(callee, "callee");
        return new Expression(Kind.CALL, line, null, callee, arguments, keywords, List.of());
    }

    public static Expression call(int line, Expression callee, List<Expression> arguments) {
        return call(line, callee, arguments, List.of());
    }

    public static Expression attribute(int line, Expression receiver, String attributeName) {
        return new Expression(Kind.ATTRIBUTE, line, attributeName, receiver, List.of(), List.of(), List.of());
    }

    public static Expression subscript(int line, Expression receiver, Expression index) {
        return new Expression(Kind.SUBSCRIPT, line, null, receiver, List.of(index), List.of(), List.of());
    }

    public static Expression keyword(int line, String keywordName, Expression argument) {
        return new Expression(Kind.KEYWORD, line, keywordName, null, List.of(argument), List.of(), List.of());
    }

    /**
     * Any kind whose shape is just an optional operator and a list of sub-expressions.
     */
    public static Expression of(Kind kind, int line, String operator, List<Expression> operands) {
        return new Expression(kind, line, operator, null, operands, List.of(), List.of());
    }

    public static Expression of(Kind kind, int line, List<Expression> operands) {
        return of(kind, line, null, operands);
    }

    /**
     * An expression that carries a statement body, e.g. a block lambda or an anonymous class.
     */
    public static Expression withBody(Kind kind, int line, List<Expression> operands, List<Statement> body) {
        return new Expression(kind, line, null, null, operands, List.of(), body);
    }

    public Kind getKind() {
        return kind;
    }

    public int getLine() {
        return line;
    }

    public String getValue() {
        return value;
    }

    public Expression getFunction() {
        return function;
    }

    public List<Expression> getOperands() {
        return operands;
    }

    public List<Expression> getKeywords() {
        return keywords;
    }

    public List<Statement> getBody() {
        return body;
    }

    /** A single literal value: number, string, boolean, None/null, ellipsis. */
    public boolean isLiteral() {
        return kind == Kind.CONSTANT;
    }

    /** A literal value or a list/tuple/set/dict display. */
    public boolean isLiteralOrContainer() {
        return switch (kind) {
            case CONSTANT, LIST, TUPLE, SET, DICT -> true;
            default -> false;
        };
    }

    public boolean isName() {
        return kind == Kind.NAME;
    }

    /**
     * True for a call whose callee is the bare identifier {@code functionName}.
     */
    public boolean isCallTo(String functionName) {
        return kind == Kind.CALL && function.isName() && function.getValue().equals(functionName);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case CONSTANT, NAME, FORMATTED -> value;
            case CALL -> function + "(" + joined(operands) + ")";
            case ATTRIBUTE -> function + "." + value;
            case SUBSCRIPT -> function + "[" + joined(operands) + "]";
            default -> kind + (value != null ? " " + value : "") + "(" + joined(operands) + ")";
        };
    }

    private static String joined(List<Expression> expressions) {
        return expressions.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }
}
