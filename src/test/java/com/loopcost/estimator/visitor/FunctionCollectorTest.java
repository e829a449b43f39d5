package com.loopcost.estimator.visitor;

import com.loopcost.estimator.syntax.java.JavaSourceParser;
import com.loopcost.estimator.syntax.python.PythonSourceParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FunctionCollectorTest {

    private final FunctionCollector collector = new FunctionCollector();

    @Test
    void pythonFunctionsAreQualifiedByEnclosingScopes() throws Exception {
        String source = String.join("\n",
                "def outer():",
                "    def inner():",
                "        pass",
                "class A:",
                "    def m(self):",
                "        pass",
                "    class B:",
                "        def n(self):",
                "            pass",
                "if flag:",
                "    def conditional():",
                "        pass",
                "");
        List<String> names = collector.collect(new PythonSourceParser().parse(source, "m.py").getBody()).stream()
                .map(FunctionCollector.FunctionDefinition::getQualifiedName)
                .collect(Collectors.toList());
        assertEquals(List.of("outer", "outer.inner", "A.m", "A.B.n", "conditional"), names);
    }

    @Test
    void javaMethodsConstructorsAndAnonymousClassMethods() throws Exception {
        String source = String.join("\n",
                "class Outer {",
                "    Outer() { }",
                "    void run() {",
                "        Runnable r = new Runnable() { public void run() { } };",
                "    }",
                "    interface Callback { void done(); }",
                "}");
        List<String> names = collector.collect(new JavaSourceParser().parse(source, "Outer.java").getBody()).stream()
                .map(FunctionCollector.FunctionDefinition::getQualifiedName)
                .collect(Collectors.toList());
        assertEquals(List.of("Outer.Outer", "Outer.run", "Outer.run.run", "Outer.Callback.done"), names);
    }

    @Test
    void moduleWithoutFunctions() throws Exception {
        assertTrue(collector.collect(new PythonSourceParser().parse("x = 1\n", "m.py").getBody()).isEmpty());
    }
}
