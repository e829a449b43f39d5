package com.loopcost.estimator.analysis;

import com.loopcost.estimator.model.IterationFactor;
import com.loopcost.estimator.syntax.Expression;
import com.loopcost.estimator.syntax.python.PythonSourceParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IterableClassifierTest {

    private final IterableClassifier classifier = new IterableClassifier();

    /** Parses {@code for _ in <source>: pass} and classifies the iteration source. */
    private IterationFactor classify(String source) throws Exception {
        Expression iterable = new PythonSourceParser()
                .parse("for _ in " + source + ":\n    pass\n", "test.py")
                .getBody().get(0).getIterable();
        return classifier.classify(iterable);
    }

    @ParameterizedTest
    @ValueSource(strings = {"range(5)", "range(1, 10, 2)", "range()", "'abc'", "[1, 2]", "['a', 'b', 'c']",
            "(1, 2)", "{1, 2}", "{'a': 1}", "[]", "None", "True", "3.5", "[x, y]"})
    void constantSources(String source) throws Exception {
        assertEquals(IterationFactor.constant(), classify(source));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "num              | num",
            "range(n)         | n",
            "range(1, n)      | n",
            "range(n, len(x)) | n",
            "range(len(x))    | x",
            "range(0, len(x)) | x",
            "range(1, m, n)   | m",
            "len(items)       | items",
            "range(n, step=2) | n"
    })
    void lengthSources(String source, String name) throws Exception {
        assertEquals(IterationFactor.lengthOf(name), classify(source));
    }

    @ParameterizedTest
    @ValueSource(strings = {"obj.items", "xs[1:]", "a + b", "-1", "range(-1)", "range(n - 1)",
            "range(len(self.items))", "range(len())", "len()", "len(x.y)", "enumerate(xs)",
            "sorted(xs)", "obj.range(n)", "[x for x in xs]", "range(f(n))", "range([1, 2])"})
    void unresolvedSources(String source) throws Exception {
        assertEquals(IterationFactor.unresolved(), classify(source));
    }

    @Test
    void onlyTheFirstNonLiteralRangeArgumentMatters() throws Exception {
        assertEquals(IterationFactor.lengthOf("a"), classify("range(1, a, b)"));
        assertEquals(IterationFactor.lengthOf("a"), classify("range(1, a, len(b))"));
        assertEquals(IterationFactor.unresolved(), classify("range(1, a.b, c)"));
        assertEquals(IterationFactor.lengthOf("c"), classify("range(1, c, a.b)"));
    }

    @Test
    void keywordArgumentsAreIgnored() throws Exception {
        assertEquals(IterationFactor.constant(), classify("range(5, step=n)"));
        assertEquals(IterationFactor.unresolved(), classify("len(obj=x)"));
    }

    @Test
    void identifierNamedOtherIsNotTheUnresolvedTag() throws Exception {
        IterationFactor factor = classify("other");
        assertEquals(IterationFactor.lengthOf("other"), factor);
        assertNotEquals(IterationFactor.unresolved(), factor);
        assertEquals(IterationFactor.unresolved().getTag(), factor.getTag());
    }

    @Test
    void classifiesHandBuiltExpressions() {
        Expression range = Expression.call(1, Expression.name(1, "range"),
                List.of(Expression.constant(1, "0"), Expression.name(1, "n")));
        assertEquals(IterationFactor.lengthOf("n"), classifier.classify(range));
        assertEquals(IterationFactor.unresolved(),
                classifier.classify(Expression.of(Expression.Kind.OTHER, 1, List.of())));
    }

    @Test
    void rejectsNull() {
        assertThrows(NullPointerException.class, () -> classifier.classify(null));
    }
}
