package com.loopcost.estimator.visitor;

import com.loopcost.estimator.syntax.Expression;
import com.loopcost.estimator.syntax.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds every function definition in a module, nested ones included, depth-first in
 * source order. Names are qualified by the enclosing classes and functions.
 */
public class FunctionCollector {

    /** A function definition together with its dotted name. */
    public static final class FunctionDefinition {
        private final String qualifiedName;
        private final Statement statement;

        FunctionDefinition(String qualifiedName, Statement statement) {
            this.qualifiedName = qualifiedName;
            this.statement = statement;
        }

        public String getQualifiedName() {
            return qualifiedName;
        }

        public Statement getStatement() {
            return statement;
        }
    }

    public List<FunctionDefinition> collect(List<Statement> module) {
        Objects.requireNonNull(module, "module");
        List<FunctionDefinition> found = new ArrayList<>();
        collectStatements(module, "", found);
        return found;
    }

    private void collectStatements(List<Statement> statements, String prefix, List<FunctionDefinition> found) {
        for (Statement statement : statements) {
            String scope = prefix;
            if (statement.getKind() == Statement.Kind.FUNCTION_DEF || statement.getKind() == Statement.Kind.CLASS_DEF) {
                scope = prefix + statement.getName() + ".";
                if (statement.getKind() == Statement.Kind.FUNCTION_DEF) {
                    found.add(new FunctionDefinition(prefix + statement.getName(), statement));
                }
            }
            if (statement.getTarget() != null) {
                collectExpression(statement.getTarget(), prefix, found);
            }
            if (statement.getIterable() != null) {
                collectExpression(statement.getIterable(), prefix, found);
            }
            for (Expression expression : statement.getExpressions()) {
                collectExpression(expression, prefix, found);
            }
            for (List<Statement> block : statement.getBlocks()) {
                collectStatements(block, scope, found);
            }
        }
    }

    private void collectExpression(Expression expression, String prefix, List<FunctionDefinition> found) {
        if (expression == null) {
            return;
        }
        collectExpression(expression.getFunction(), prefix, found);
        for (Expression operand : expression.getOperands()) {
            collectExpression(operand, prefix, found);
        }
        for (Expression keyword : expression.getKeywords()) {
            collectExpression(keyword, prefix, found);
        }
        collectStatements(expression.getBody(), prefix, found);
    }
}
