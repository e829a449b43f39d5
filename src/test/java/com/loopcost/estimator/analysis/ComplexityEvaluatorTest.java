package com.loopcost.estimator.analysis;

import com.loopcost.estimator.model.CostExpression;
import com.loopcost.estimator.model.IterationFactor;
import com.loopcost.estimator.model.LoopNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityEvaluatorTest {

    private final ComplexityEvaluator evaluator = new ComplexityEvaluator();

    private static LoopNode forLoop(IterationFactor factor, LoopNode... children) {
        return LoopNode.forLoop(factor, List.of(children), 1);
    }

    private static LoopNode whileLoop(LoopNode... children) {
        return LoopNode.whileLoop(List.of(children), 1);
    }

    private static LoopNode root(LoopNode... children) {
        return LoopNode.root(List.of(children));
    }

    @Test
    void emptyRootIsIdentity() {
        assertEquals(CostExpression.identity(), evaluator.evaluate(root()));
    }

    @Test
    void constantLoopsCollapseToIdentity() {
        LoopNode tree = root(forLoop(IterationFactor.constant(), forLoop(IterationFactor.constant())),
                forLoop(IterationFactor.constant()));
        assertEquals(CostExpression.identity(), evaluator.evaluate(tree));
    }

    @Test
    void singleLengthLoop() {
        assertEquals(CostExpression.lengthOf("n"), evaluator.evaluate(root(forLoop(IterationFactor.lengthOf("n")))));
    }

    @Test
    void nestedLoopsMultiply() {
        LoopNode tree = root(forLoop(IterationFactor.lengthOf("n"), forLoop(IterationFactor.lengthOf("m"))));
        assertEquals(CostExpression.product(CostExpression.lengthOf("n"), CostExpression.lengthOf("m")),
                evaluator.evaluate(tree));
    }

    @Test
    void constantOuterLoopPassesInnerCostThrough() {
        LoopNode tree = root(forLoop(IterationFactor.constant(), forLoop(IterationFactor.unresolved())));
        assertEquals(CostExpression.unresolvedLength(), evaluator.evaluate(tree));
    }

    @Test
    void siblingsAddInSourceOrderWithoutIdentityTerms() {
        LoopNode tree = root(
                forLoop(IterationFactor.lengthOf("n"), forLoop(IterationFactor.constant())),
                forLoop(IterationFactor.constant()),
                forLoop(IterationFactor.lengthOf("num")));
        assertEquals(CostExpression.sum(List.of(CostExpression.lengthOf("n"), CostExpression.lengthOf("num"))),
                evaluator.evaluate(tree));
    }

    @Test
    void repeatedTermsAreNotDeduplicated() {
        LoopNode tree = root(forLoop(IterationFactor.lengthOf("n")), forLoop(IterationFactor.lengthOf("n")));
        CostExpression cost = evaluator.evaluate(tree);
        assertEquals(CostExpression.sum(List.of(CostExpression.lengthOf("n"), CostExpression.lengthOf("n"))),
                cost);
    }

    @Test
    void innerSumOfALoopDropsIdentityTerms() {
        LoopNode tree = root(forLoop(IterationFactor.lengthOf("n"),
                forLoop(IterationFactor.constant()),
                forLoop(IterationFactor.lengthOf("m"))));
        assertEquals(CostExpression.product(CostExpression.lengthOf("n"), CostExpression.lengthOf("m")),
                evaluator.evaluate(tree));
    }

    @Test
    void whileLoopIsUnknown() {
        assertEquals(CostExpression.unknown(), evaluator.evaluate(root(whileLoop())));
    }

    @Test
    void whileAroundConstantLoopStaysUnknown() {
        assertEquals(CostExpression.unknown(),
                evaluator.evaluate(root(whileLoop(forLoop(IterationFactor.constant())))));
    }

    @Test
    void whileAroundLengthLoopMultiplies() {
        assertEquals(CostExpression.product(CostExpression.unknown(), CostExpression.lengthOf("xs")),
                evaluator.evaluate(root(whileLoop(forLoop(IterationFactor.lengthOf("xs"))))));
    }

    @Test
    void unknownMarkersAreNotUnified() {
        CostExpression cost = evaluator.evaluate(root(whileLoop(), whileLoop()));
        assertEquals(CostExpression.sum(List.of(CostExpression.unknown(), CostExpression.unknown())), cost);
    }

    @Test
    void rejectsNull() {
        assertThrows(NullPointerException.class, () -> evaluator.evaluate(null));
    }
}
