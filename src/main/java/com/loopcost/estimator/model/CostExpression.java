package com.loopcost.estimator.model;

import java.util.List;
import java.util.Objects;

/**
 * Symbolic cost of a loop tree. Values compare structurally; turning them into text
 * is the job of {@code CostExpressionFormatter}.
 */
public final class CostExpression {

    public enum Kind {
        /** The multiplicative identity, "1". */
        IDENTITY,
        /** Proportional to the length of a named collection. */
        LENGTH,
        /** Proportional to the length of something the classifier could not name. */
        UNRESOLVED_LENGTH,
        /** Iteration count of a condition-controlled loop, "?". */
        UNKNOWN,
        SUM,
        PRODUCT
    }

    private static final CostExpression IDENTITY = new CostExpression(Kind.IDENTITY, null, List.of());
    private static final CostExpression UNRESOLVED_LENGTH = new CostExpression(Kind.UNRESOLVED_LENGTH, null, List.of());
    private static final CostExpression UNKNOWN = new CostExpression(Kind.UNKNOWN, null, List.of());

    private final Kind kind;
    private final String name;
    private final List<CostExpression> operands;

    private CostExpression(Kind kind, String name, List<CostExpression> operands) {
        this.kind = kind;
        this.name = name;
        this.operands = List.copyOf(operands);
    }

    public static CostExpression identity() {
        return IDENTITY;
    }

    public static CostExpression lengthOf(String name) {
        return new CostExpression(Kind.LENGTH, Objects.requireNonNull(name, "name"), List.of());
    }

    public static CostExpression unresolvedLength() {
        return UNRESOLVED_LENGTH;
    }

    public static CostExpression unknown() {
        return UNKNOWN;
    }

    /**
     * Sum of the given terms in order. A single term is returned as itself and an
     * empty list yields {@link #identity()}.
     */
    public static CostExpression sum(List<CostExpression> terms) {
        if (terms.isEmpty()) {
            return identity();
        }
        if (terms.size() == 1) {
            return terms.get(0);
        }
        return new CostExpression(Kind.SUM, null, terms);
    }

    public static CostExpression product(CostExpression left, CostExpression right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        return new CostExpression(Kind.PRODUCT, null, List.of(left, right));
    }

    public Kind getKind() {
        return kind;
    }

    /** The collection name; null unless the kind is LENGTH. */
    public String getName() {
        return name;
    }

    /** Terms of a SUM, or the left and right factors of a PRODUCT; empty otherwise. */
    public List<CostExpression> getOperands() {
        return operands;
    }

    public CostExpression getLeft() {
        requireProduct();
        return operands.get(0);
    }

    public CostExpression getRight() {
        requireProduct();
        return operands.get(1);
    }

    public boolean isIdentity() {
        return kind == Kind.IDENTITY;
    }

    private void requireProduct() {
        if (kind != Kind.PRODUCT) {
            throw new IllegalStateException("Not a product: " + kind);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CostExpression)) {
            return false;
        }
        CostExpression that = (CostExpression) o;
        return kind == that.kind && Objects.equals(name, that.name) && operands.equals(that.operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, operands);
    }

    @Override
    public String toString() {
        return kind + (name != null ? "(" + name + ")" : "") + (operands.isEmpty() ? "" : operands.toString());
    }
}
