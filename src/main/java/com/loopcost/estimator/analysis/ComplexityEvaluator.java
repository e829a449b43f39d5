package com.loopcost.estimator.analysis;

import com.loopcost.estimator.model.CostExpression;
import com.loopcost.estimator.model.IterationFactor;
import com.loopcost.estimator.model.LoopNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reduces a loop tree bottom-up to a symbolic cost.
 *
 * Siblings add, nesting multiplies, and the identity "1" is dropped wherever it would
 * only pad the result. A condition-controlled loop contributes an unknown factor "?".
 * Repeated terms and separate "?" markers are kept as they are.
 */
public class ComplexityEvaluator {

    public CostExpression evaluate(LoopNode node) {
        Objects.requireNonNull(node, "node");
        return switch (node.getKind()) {
            case ROOT -> sumOfChildren(node);
            case FOR -> evaluateFor(node);
            case WHILE -> evaluateWhile(node);
        };
    }

    private CostExpression evaluateFor(LoopNode node) {
        CostExpression factor = factorOf(node.getIterationFactor().orElseThrow());
        CostExpression inner = sumOfChildren(node);
        if (inner.isIdentity()) {
            return factor;
        }
        if (factor.isIdentity()) {
            return inner;
        }
        return CostExpression.product(factor, inner);
    }

    private CostExpression evaluateWhile(LoopNode node) {
        CostExpression inner = sumOfChildren(node);
        if (inner.isIdentity()) {
            return CostExpression.unknown();
        }
        return CostExpression.product(CostExpression.unknown(), inner);
    }

    /**
     * Sum of the children's costs with identity terms removed; identity if nothing remains.
     */
    private CostExpression sumOfChildren(LoopNode node) {
        List<CostExpression> terms = new ArrayList<>();
        for (LoopNode child : node.getChildren()) {
            CostExpression cost = evaluate(child);
            if (!cost.isIdentity()) {
                terms.add(cost);
            }
        }
        return CostExpression.sum(terms);
    }

    private static CostExpression factorOf(IterationFactor factor) {
        return switch (factor.getKind()) {
            case CONSTANT -> CostExpression.identity();
            case LENGTH -> CostExpression.lengthOf(factor.getName());
            case UNRESOLVED -> CostExpression.unresolvedLength();
        };
    }
}
