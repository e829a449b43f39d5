package com.loopcost.estimator.model;

import java.util.Objects;

/**
 * How many times a bounded-iteration loop is expected to run: a constant number of
 * times, once per element of a named collection, or an unresolved amount.
 *
 * A factor naming an identifier that happens to be called {@code other} is not equal
 * to {@link #unresolved()}, even though both render as {@code len(other)}.
 */
public final class IterationFactor {

    public enum Kind {
        CONSTANT,
        LENGTH,
        UNRESOLVED
    }

    private static final IterationFactor CONSTANT = new IterationFactor(Kind.CONSTANT, null);
    private static final IterationFactor UNRESOLVED = new IterationFactor(Kind.UNRESOLVED, null);

    private final Kind kind;
    private final String name;

    private IterationFactor(Kind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    public static IterationFactor constant() {
        return CONSTANT;
    }

    public static IterationFactor lengthOf(String name) {
        return new IterationFactor(Kind.LENGTH, Objects.requireNonNull(name, "name"));
    }

    public static IterationFactor unresolved() {
        return UNRESOLVED;
    }

    public Kind getKind() {
        return kind;
    }

    /** The identifier whose length bounds the loop; null unless the kind is LENGTH. */
    public String getName() {
        return name;
    }

    /** Display tag: {@code c}, {@code len(name)} or {@code len(other)}. */
    public String getTag() {
        return switch (kind) {
            case CONSTANT -> "c";
            case LENGTH -> "len(" + name + ")";
            case UNRESOLVED -> "len(other)";
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IterationFactor)) {
            return false;
        }
        IterationFactor that = (IterationFactor) o;
        return kind == that.kind && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name);
    }

    @Override
    public String toString() {
        return getTag();
    }
}
