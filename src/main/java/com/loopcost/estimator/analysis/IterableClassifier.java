package com.loopcost.estimator.analysis;

import com.loopcost.estimator.model.IterationFactor;
import com.loopcost.estimator.syntax.Expression;

import java.util.List;
import java.util.Objects;

/**
 * Classifies the iteration source of a bounded-iteration loop.
 *
 * Rules, first match wins:
 * <ol>
 *   <li>a literal or literal container is iterated a constant number of times</li>
 *   <li>a bare name {@code xs} is iterated {@code len(xs)} times</li>
 *   <li>{@code range(...)} is constant when all positional arguments are literals,
 *       otherwise it is classified by its first non-literal argument;
 *       {@code len(xs)} is {@code len(xs)}</li>
 *   <li>everything else is unresolved</li>
 * </ol>
 * Keyword arguments are never consulted.
 */
public class IterableClassifier {

    private static final String RANGE = "range";
    private static final String LEN = "len";

    public IterationFactor classify(Expression source) {
        Objects.requireNonNull(source, "source");

        if (source.isLiteralOrContainer()) {
            return IterationFactor.constant();
        }
        if (source.isName()) {
            return IterationFactor.lengthOf(source.getValue());
        }
        if (source.getKind() == Expression.Kind.CALL) {
            return classifyCall(source);
        }
        return IterationFactor.unresolved();
    }

    private IterationFactor classifyCall(Expression call) {
        if (call.isCallTo(RANGE)) {
            return classifyRange(call.getOperands());
        }
        if (call.isCallTo(LEN)) {
            return lengthOfFirstArgument(call.getOperands());
        }
        return IterationFactor.unresolved();
    }

    private IterationFactor classifyRange(List<Expression> arguments) {
        for (Expression argument : arguments) {
            if (argument.isLiteral()) {
                continue;
            }
            if (argument.isName()) {
                return IterationFactor.lengthOf(argument.getValue());
            }
            if (argument.isCallTo(LEN)) {
                return lengthOfFirstArgument(argument.getOperands());
            }
            return IterationFactor.unresolved();
        }
        return IterationFactor.constant();
    }

    private static IterationFactor lengthOfFirstArgument(List<Expression> arguments) {
        if (!arguments.isEmpty() && arguments.get(0).isName()) {
            return IterationFactor.lengthOf(arguments.get(0).getValue());
        }
        return IterationFactor.unresolved();
    }
}
