package com.loopcost.estimator.visitor;

import com.loopcost.estimator.analysis.IterableClassifier;
import com.loopcost.estimator.model.IterationFactor;
import com.loopcost.estimator.model.LoopNode;
import com.loopcost.estimator.syntax.Expression;
import com.loopcost.estimator.syntax.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Walks a statement list and builds the tree of loops nested in it.
 *
 * Every statement position is visited: loop bodies and else clauses, branches,
 * handlers, cases, nested function and class bodies, and statement bodies carried by
 * expressions. Only loops become nodes. A loop lexically inside another loop becomes
 * its descendant no matter how many non-loop statements lie between them.
 */
public class LoopTreeBuilder {

    private static final Logger logger = LoggerFactory.getLogger(LoopTreeBuilder.class);

    private final IterableClassifier classifier;

    public LoopTreeBuilder() {
        this(new IterableClassifier());
    }

    public LoopTreeBuilder(IterableClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    /**
     * Builds the loop tree of a module or function body.
     *
     * @return the root node; its children are the outermost loops in source order
     */
    public LoopNode build(List<Statement> body) {
        Objects.requireNonNull(body, "body");
        Deque<Frame> parents = new ArrayDeque<>();
        Frame root = new Frame(LoopNode.Kind.ROOT, null, 0);
        parents.push(root);
        visitStatements(body, parents);
        return root.freeze();
    }

    private void visitStatements(List<Statement> statements, Deque<Frame> parents) {
        for (Statement statement : statements) {
            visitStatement(statement, parents);
        }
    }

    private void visitStatement(Statement statement, Deque<Frame> parents) {
        switch (statement.getKind()) {
            case FOR -> {
                IterationFactor factor = classifier.classify(statement.getIterable());
                logger.debug("For loop at line {} iterates {}", statement.getLine(), factor);
                visitLoop(new Frame(LoopNode.Kind.FOR, factor, statement.getLine()), statement, parents);
            }
            case WHILE -> {
                logger.debug("While loop at line {}", statement.getLine());
                visitLoop(new Frame(LoopNode.Kind.WHILE, null, statement.getLine()), statement, parents);
            }
            default -> {
                for (Expression expression : statement.getExpressions()) {
                    visitExpression(expression, parents);
                }
                for (List<Statement> block : statement.getBlocks()) {
                    visitStatements(block, parents);
                }
            }
        }
    }

    /**
     * The loop header (iteration source, condition) is not searched for nested loops;
     * the body and the else clause are.
     */
    private void visitLoop(Frame frame, Statement loop, Deque<Frame> parents) {
        parents.push(frame);
        visitStatements(loop.getBody(), parents);
        visitStatements(loop.getOrElse(), parents);
        parents.pop();
        parents.peek().children.add(frame.freeze());
    }

    private void visitExpression(Expression expression, Deque<Frame> parents) {
        if (expression == null) {
            return;
        }
        visitExpression(expression.getFunction(), parents);
        for (Expression operand : expression.getOperands()) {
            visitExpression(operand, parents);
        }
        for (Expression keyword : expression.getKeywords()) {
            visitExpression(keyword, parents);
        }
        visitStatements(expression.getBody(), parents);
    }

    /** A node under construction; its children list grows until the node is frozen. */
    private static final class Frame {
        private final LoopNode.Kind kind;
        private final IterationFactor factor;
        private final int line;
        private final List<LoopNode> children = new ArrayList<>();

        Frame(LoopNode.Kind kind, IterationFactor factor, int line) {
            this.kind = kind;
            this.factor = factor;
            this.line = line;
        }

        LoopNode freeze() {
            return switch (kind) {
                case ROOT -> LoopNode.root(children);
                case FOR -> LoopNode.forLoop(factor, children, line);
                case WHILE -> LoopNode.whileLoop(children, line);
            };
        }
    }
}
