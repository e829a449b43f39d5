package com.loopcost.estimator.model;

import java.util.Objects;

/**
 * The two outputs of one analysis: the loop-nesting tree and the cost derived from it.
 */
public final class ComplexityReport {

    private final LoopNode loopTree;
    private final CostExpression cost;

    public ComplexityReport(LoopNode loopTree, CostExpression cost) {
        this.loopTree = Objects.requireNonNull(loopTree, "loopTree");
        this.cost = Objects.requireNonNull(cost, "cost");
    }

    public LoopNode getLoopTree() {
        return loopTree;
    }

    public CostExpression getCost() {
        return cost;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ComplexityReport)) {
            return false;
        }
        ComplexityReport that = (ComplexityReport) o;
        return loopTree.equals(that.loopTree) && cost.equals(that.cost);
    }

    @Override
    public int hashCode() {
        return Objects.hash(loopTree, cost);
    }
}
