package com.loopcost.estimator.syntax.java;

import com.loopcost.estimator.syntax.Expression;
import com.loopcost.estimator.syntax.ParsedModule;
import com.loopcost.estimator.syntax.SourceLanguage;
import com.loopcost.estimator.syntax.SourceParseException;
import com.loopcost.estimator.syntax.Statement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JavaSourceParserTest {

    private final JavaSourceParser parser = new JavaSourceParser();

    /** Parses a class with a single method and returns the method body. */
    private List<Statement> methodBody(String... lines) throws SourceParseException {
        String source = "class T {\n    void m() {\n" + String.join("\n", lines) + "\n    }\n}\n";
        Statement type = parser.parse(source, "T.java").getBody().get(0);
        return type.getBody().get(0).getBody();
    }

    @Test
    void typesAndMethodsBecomeDefinitions() throws Exception {
        ParsedModule module = parser.parse(String.join("\n",
                "package p;",
                "class Outer {",
                "    Outer() { }",
                "    int size() { return 0; }",
                "    static class Inner { void run() { } }",
                "}",
                ""), "Outer.java");
        assertEquals(SourceLanguage.JAVA, module.getLanguage());
        assertEquals(6, module.getLineCount());

        Statement outer = module.getBody().get(0);
        assertEquals(Statement.Kind.CLASS_DEF, outer.getKind());
        assertEquals("Outer", outer.getName());
        assertEquals(2, outer.getLine());

        List<Statement> members = outer.getBody();
        assertEquals(Statement.Kind.FUNCTION_DEF, members.get(0).getKind());
        assertEquals("Outer", members.get(0).getName());
        assertEquals("size", members.get(1).getName());
        assertEquals(Statement.Kind.CLASS_DEF, members.get(2).getKind());
        assertEquals("run", members.get(2).getBody().get(0).getName());
    }

    @Test
    void countedLoopBecomesRangeFromStartToBound() throws Exception {
        Statement loop = methodBody("for (int i = 0; i < n; i++) { }").get(0);
        assertEquals(Statement.Kind.FOR, loop.getKind());
        assertEquals(3, loop.getLine());
        assertEquals("i", loop.getTarget().getValue());
        Expression range = loop.getIterable();
        assertTrue(range.isCallTo("range"));
        assertEquals(Expression.Kind.CONSTANT, range.getOperands().get(0).getKind());
        assertEquals("n", range.getOperands().get(1).getValue());
    }

    @Test
    void descendingLoopCountsFromBoundToStart() throws Exception {
        Expression range = methodBody("for (int i = n; i > 0; i--) { }").get(0).getIterable();
        assertTrue(range.isCallTo("range"));
        assertEquals("0", range.getOperands().get(0).getValue());
        assertEquals("n", range.getOperands().get(1).getValue());
    }

    @Test
    void boundOnTheLeftOfTheComparison() throws Exception {
        Expression range = methodBody("for (int i = 0; n >= i; i++) { }").get(0).getIterable();
        assertEquals("0", range.getOperands().get(0).getValue());
        assertEquals("n", range.getOperands().get(1).getValue());
    }

    @Test
    void arrayLengthAndSizeBecomeLenCalls() throws Exception {
        List<Statement> body = methodBody(
                "for (int i = 0; i < items.length; i++) { }",
                "for (int i = 0; i < list.size(); i++) { }",
                "for (int i = 0; i < text.length(); i++) { }");
        for (Statement loop : body) {
            Expression bound = loop.getIterable().getOperands().get(1);
            assertTrue(bound.isCallTo("len"), bound.toString());
            assertEquals(Expression.Kind.NAME, bound.getOperands().get(0).getKind());
        }
    }

    @Test
    void unrecognizedCountedLoopHasOpaqueSource() throws Exception {
        List<Statement> body = methodBody(
                "for (;;) { break; }",
                "for (int i = 0, j = 0; i < j; i++) { }",
                "for (int i = 0; i != n; i++) { }");
        for (Statement loop : body) {
            assertEquals(Statement.Kind.FOR, loop.getKind());
            assertEquals(Expression.Kind.OTHER, loop.getIterable().getKind());
        }
    }

    @Test
    void enhancedForIteratesItsSource() throws Exception {
        Statement loop = methodBody("for (String name : names) { }").get(0);
        assertEquals(Statement.Kind.FOR, loop.getKind());
        assertEquals("name", loop.getTarget().getValue());
        assertEquals(Expression.Kind.NAME, loop.getIterable().getKind());
        assertEquals("names", loop.getIterable().getValue());
    }

    @Test
    void literalCollectionsBecomeContainers() throws Exception {
        List<Statement> body = methodBody(
                "for (int x : new int[] {1, 2, 3}) { }",
                "for (String s : List.of(\"a\", \"b\")) { }",
                "for (int x : Set.of(1, 2)) { }",
                "for (String s : List.of(a, b)) { }");
        assertEquals(Expression.Kind.LIST, body.get(0).getIterable().getKind());
        assertEquals(Expression.Kind.LIST, body.get(1).getIterable().getKind());
        assertEquals(Expression.Kind.SET, body.get(2).getIterable().getKind());
        assertEquals(Expression.Kind.CALL, body.get(3).getIterable().getKind());
    }

    @Test
    void whileAndDoWhileAreConditionLoops() throws Exception {
        List<Statement> body = methodBody(
                "while (it.hasNext()) { it.next(); }",
                "do { x--; } while (x > 0);");
        assertEquals(Statement.Kind.WHILE, body.get(0).getKind());
        assertEquals(Statement.Kind.WHILE, body.get(1).getKind());
        assertEquals(1, body.get(1).getBody().size());
    }

    @Test
    void nestedLoopsStayInsideBranchesAndHandlers() throws Exception {
        List<Statement> body = methodBody(
                "if (ready) {",
                "    for (String s : names) { }",
                "} else {",
                "    try {",
                "        while (running) { }",
                "    } catch (Exception e) {",
                "    } finally {",
                "    }",
                "}");
        Statement branch = body.get(0);
        assertEquals(Statement.Kind.IF, branch.getKind());
        assertEquals(Statement.Kind.FOR, branch.getBody().get(0).getKind());
        Statement tryStatement = branch.getOrElse().get(0);
        assertEquals(Statement.Kind.TRY, tryStatement.getKind());
        assertEquals(3, tryStatement.getBlocks().size());
        assertEquals(Statement.Kind.WHILE, tryStatement.getBody().get(0).getKind());
    }

    @Test
    void switchLabeledAndSynchronizedStatements() throws Exception {
        List<Statement> body = methodBody(
                "switch (mode) {",
                "    case 1: for (String s : a) { } break;",
                "    default: break;",
                "}",
                "outer: for (String s : b) { }",
                "synchronized (lock) { while (waiting) { } }");
        assertEquals(Statement.Kind.MATCH, body.get(0).getKind());
        assertEquals(2, body.get(0).getBlocks().size());
        assertEquals(Statement.Kind.FOR, body.get(0).getBlocks().get(0).get(0).getKind());
        assertEquals(Statement.Kind.FOR, body.get(1).getKind());
        assertEquals(Statement.Kind.WITH, body.get(2).getKind());
    }

    @Test
    void blockLambdaCarriesItsStatements() throws Exception {
        Statement statement = methodBody("items.forEach(x -> { for (String s : x) { } });").get(0);
        assertEquals(Statement.Kind.EXPRESSION, statement.getKind());
        Expression call = statement.getExpressions().get(0);
        assertEquals(Expression.Kind.CALL, call.getKind());
        Expression lambda = call.getOperands().get(0);
        assertEquals(Expression.Kind.LAMBDA, lambda.getKind());
        assertEquals(Statement.Kind.FOR, lambda.getBody().get(0).getKind());
    }

    @Test
    void anonymousClassCarriesItsMethods() throws Exception {
        Statement statement = methodBody(
                "Runnable r = new Runnable() {",
                "    public void run() { while (true) { } }",
                "};").get(0);
        assertEquals(Statement.Kind.ASSIGN, statement.getKind());
        Expression creation = statement.getExpressions().get(0);
        Statement run = creation.getBody().get(0);
        assertEquals(Statement.Kind.FUNCTION_DEF, run.getKind());
        assertEquals("run", run.getName());
        assertEquals(Statement.Kind.WHILE, run.getBody().get(0).getKind());
    }

    @Test
    void enumConstantBodiesAreKept() throws Exception {
        Statement type = parser.parse(String.join("\n",
                "enum Op {",
                "    ADD { int apply(int[] xs) { int s = 0; for (int x : xs) { s += x; } return s; } };",
                "    abstract int apply(int[] xs);",
                "}"), "Op.java").getBody().get(0);
        Statement constant = type.getBody().get(0);
        assertEquals(Statement.Kind.CLASS_DEF, constant.getKind());
        assertEquals("ADD", constant.getName());
        assertEquals("apply", constant.getBody().get(0).getName());
        assertEquals("apply", type.getBody().get(1).getName());
        assertTrue(type.getBody().get(1).getBody().isEmpty());
    }

    @Test
    void syntaxErrorCarriesPosition() {
        SourceParseException e = assertThrows(SourceParseException.class,
                () -> parser.parse("class A {\n    void f( {\n}\n", "A.java"));
        assertEquals("A.java", e.getOrigin());
        assertTrue(e.getLine() > 0);
        assertTrue(e.getMessage().startsWith("A.java:" + e.getLine() + ":"));
    }
}
