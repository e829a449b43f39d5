package com.loopcost.estimator.analysis;

import com.loopcost.estimator.model.ComplexityReport;
import com.loopcost.estimator.model.CostExpression;
import com.loopcost.estimator.model.FunctionReport;
import com.loopcost.estimator.model.LoopNode;
import com.loopcost.estimator.syntax.Statement;
import com.loopcost.estimator.visitor.FunctionCollector;
import com.loopcost.estimator.visitor.LoopTreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the loop tree builder and the complexity evaluator over a body of code.
 */
public class ComplexityAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ComplexityAnalyzer.class);

    private final LoopTreeBuilder treeBuilder;
    private final ComplexityEvaluator evaluator;
    private final FunctionCollector functionCollector;

    public ComplexityAnalyzer() {
        this(new LoopTreeBuilder(), new ComplexityEvaluator());
    }

    public ComplexityAnalyzer(LoopTreeBuilder treeBuilder, ComplexityEvaluator evaluator) {
        this.treeBuilder = Objects.requireNonNull(treeBuilder, "treeBuilder");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.functionCollector = new FunctionCollector();
    }

    /**
     * Analyzes a module or function body as a whole.
     */
    public ComplexityReport analyze(List<Statement> body) {
        LoopNode tree = treeBuilder.build(body);
        CostExpression cost = evaluator.evaluate(tree);
        return new ComplexityReport(tree, cost);
    }

    /**
     * Analyzes each function defined in the module separately, nested functions
     * and methods included.
     */
    public List<FunctionReport> analyzeFunctions(List<Statement> module) {
        List<FunctionReport> reports = new ArrayList<>();
        for (FunctionCollector.FunctionDefinition function : functionCollector.collect(module)) {
            ComplexityReport report = analyze(function.getStatement().getBody());
            logger.debug("Function {} at line {}: {} loops, depth {}", function.getQualifiedName(),
                    function.getStatement().getLine(),
                    report.getLoopTree().count(LoopNode.Kind.FOR) + report.getLoopTree().count(LoopNode.Kind.WHILE),
                    report.getLoopTree().depth());
            reports.add(new FunctionReport(function.getQualifiedName(), function.getStatement().getLine(), report));
        }
        return reports;
    }
}
