package com.loopcost.estimator.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A statement node of the language-neutral syntax tree.
 *
 * Statements are a tagged union: the {@link Kind} says what the statement is, and the
 * generic {@code expressions} and {@code blocks} positions hold whatever the kind needs.
 * Every nested statement list (loop bodies, else clauses, handlers, cases, function
 * bodies) lives in {@code blocks}, in source order.
 */
public final class Statement {

    public enum Kind {
        FOR,
        WHILE,
        IF,
        WITH,
        TRY,
        MATCH,
        FUNCTION_DEF,
        CLASS_DEF,
        BLOCK,
        EXPRESSION,
        ASSIGN,
        RETURN,
        RAISE,
        DELETE,
        ASSERT,
        IMPORT,
        GLOBAL,
        PASS,
        BREAK,
        CONTINUE
    }

    private final Kind kind;
    private final int line;
    private final String name;
    private final Expression target;
    private final Expression iterable;
    private final List<Expression> expressions;
    private final List<List<Statement>> blocks;

    private Statement(Kind kind, int line, String name, Expression target, Expression iterable,
                      List<Expression> expressions, List<List<Statement>> blocks) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.line = line;
        this.name = name;
        this.target = target;
        this.iterable = iterable;
        this.expressions = List.copyOf(expressions);
        List<List<Statement>> copied = new ArrayList<>(blocks.size());
        for (List<Statement> block : blocks) {
            copied.add(List.copyOf(block));
        }
        this.blocks = List.copyOf(copied);
    }

    /**
     * Creates a bounded-iteration loop: {@code for target in iterable: body else: orElse}.
     */
    public static Statement forLoop(int line, Expression target, Expression iterable,
                                    List<Statement> body, List<Statement> orElse) {
        Objects.requireNonNull(iterable, "iterable");
        return new Statement(Kind.FOR, line, null, target, iterable, List.of(), List.of(body, orElse));
    }

    /**
     * Creates a condition-controlled loop: {@code while condition: body else: orElse}.
     */
    public static Statement whileLoop(int line, Expression condition, List<Statement> body,
                                      List<Statement> orElse) {
        List<Expression> condExprs = condition != null ? List.of(condition) : List.of();
        return new Statement(Kind.WHILE, line, null, null, null, condExprs, List.of(body, orElse));
    }

    /**
     * Creates a function or class definition whose body is the single block.
     */
    public static Statement definition(Kind kind, int line, String name, List<Expression> expressions,
                                       List<Statement> body) {
        if (kind != Kind.FUNCTION_DEF && kind != Kind.CLASS_DEF) {
            throw new IllegalArgumentException("Not a definition kind: " + kind);
        }
        return new Statement(kind, line, Objects.requireNonNull(name, "name"), null, null,
                expressions, List.of(body));
    }

    /**
     * Creates a statement with nested blocks (if, with, try, match, plain blocks).
     */
    public static Statement compound(Kind kind, int line, List<Expression> expressions,
                                     List<List<Statement>> blocks) {
        return new Statement(kind, line, null, null, null, expressions, blocks);
    }

    /**
     * Creates a statement without nested blocks.
     */
    public static Statement simple(Kind kind, int line, List<Expression> expressions) {
        return new Statement(kind, line, null, null, null, expressions, List.of());
    }

    public static Statement simple(Kind kind, int line) {
        return simple(kind, line, List.of());
    }

    public Kind getKind() {
        return kind;
    }

    public int getLine() {
        return line;
    }

    /** Name of a function or class definition, null otherwise. */
    public String getName() {
        return name;
    }

    /** Loop variable of a FOR statement, may be null. */
    public Expression getTarget() {
        return target;
    }

    /** Iteration source of a FOR statement, null for every other kind. */
    public Expression getIterable() {
        return iterable;
    }

    public List<Expression> getExpressions() {
        return expressions;
    }

    public List<List<Statement>> getBlocks() {
        return blocks;
    }

    /**
     * First block: the loop body, the then-branch, the definition body.
     */
    public List<Statement> getBody() {
        return blocks.isEmpty() ? List.of() : blocks.get(0);
    }

    /**
     * The else clause of a loop or conditional, empty when absent.
     */
    public List<Statement> getOrElse() {
        return blocks.size() > 1 ? blocks.get(1) : List.of();
    }

    public boolean isLoop() {
        return kind == Kind.FOR || kind == Kind.WHILE;
    }

    @Override
    public String toString() {
        return name != null ? kind + " " + name + " @" + line : kind + " @" + line;
    }
}
