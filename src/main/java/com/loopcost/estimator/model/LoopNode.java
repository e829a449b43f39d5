package com.loopcost.estimator.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A node of the loop-nesting tree: the synthetic root, a bounded-iteration loop or a
 * condition-controlled loop. Children are the loops directly nested inside, in source order.
 */
public final class LoopNode {

    public enum Kind {
        ROOT("Global Root"),
        FOR("For"),
        WHILE("While");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    private final Kind kind;
    private final IterationFactor iterationFactor;
    private final List<LoopNode> children;
    private final int line;

    private LoopNode(Kind kind, IterationFactor iterationFactor, List<LoopNode> children, int line) {
        this.kind = kind;
        this.iterationFactor = iterationFactor;
        this.children = List.copyOf(children);
        this.line = line;
    }

    public static LoopNode root(List<LoopNode> children) {
        return new LoopNode(Kind.ROOT, null, children, 0);
    }

    public static LoopNode forLoop(IterationFactor factor, List<LoopNode> children, int line) {
        return new LoopNode(Kind.FOR, Objects.requireNonNull(factor, "factor"), children, line);
    }

    public static LoopNode whileLoop(List<LoopNode> children, int line) {
        return new LoopNode(Kind.WHILE, null, children, line);
    }

    public Kind getKind() {
        return kind;
    }

    /** Present only for FOR nodes. */
    public Optional<IterationFactor> getIterationFactor() {
        return Optional.ofNullable(iterationFactor);
    }

    public List<LoopNode> getChildren() {
        return children;
    }

    public int getLine() {
        return line;
    }

    /**
     * Number of loop levels below and including this node. The root does not count,
     * so a root without children has depth 0.
     */
    public int depth() {
        int deepest = 0;
        for (LoopNode child : children) {
            deepest = Math.max(deepest, child.depth());
        }
        return kind == Kind.ROOT ? deepest : deepest + 1;
    }

    /** Total number of loop nodes of the given kind in this subtree. */
    public int count(Kind countedKind) {
        int total = kind == countedKind ? 1 : 0;
        for (LoopNode child : children) {
            total += child.count(countedKind);
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LoopNode)) {
            return false;
        }
        LoopNode that = (LoopNode) o;
        return kind == that.kind && line == that.line
                && Objects.equals(iterationFactor, that.iterationFactor)
                && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, iterationFactor, children, line);
    }

    @Override
    public String toString() {
        return kind.getLabel() + (iterationFactor != null ? "(" + iterationFactor + ")" : "") + children;
    }
}
