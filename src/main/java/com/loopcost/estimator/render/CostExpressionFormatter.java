package com.loopcost.estimator.render;

import com.loopcost.estimator.model.CostExpression;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders a cost expression as text: {@code 1}, {@code len(n)}, {@code len(other)}, {@code ?},
 * sums joined by {@code " + "}, and products as {@code left*(right)}.
 */
public class CostExpressionFormatter {

    public String format(CostExpression expression) {
        Objects.requireNonNull(expression, "expression");
        return switch (expression.getKind()) {
            case IDENTITY -> "1";
            case LENGTH -> "len(" + expression.getName() + ")";
            case UNRESOLVED_LENGTH -> "len(other)";
            case UNKNOWN -> "?";
            case SUM -> expression.getOperands().stream()
                    .map(this::format)
                    .collect(Collectors.joining(" + "));
            case PRODUCT -> format(expression.getLeft()) + "*(" + format(expression.getRight()) + ")";
        };
    }
}
