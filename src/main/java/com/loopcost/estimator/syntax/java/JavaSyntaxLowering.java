package com.loopcost.estimator.syntax.java;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.ArrayCreationExpr;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.LiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.AssertStmt;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.EmptyStmt;
import com.github.javaparser.ast.stmt.ExplicitConstructorInvocationStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.stmt.YieldStmt;
import com.loopcost.estimator.syntax.Expression;
import com.loopcost.estimator.syntax.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lowers a JavaParser compilation unit into the language-neutral syntax tree.
 *
 * Loop-relevant Java idioms are rewritten into the shapes the iterable classifier
 * understands:
 * <ul>
 *   <li>{@code for (int i = a; i < b; i++)} iterates over {@code range(a, b)}</li>
 *   <li>{@code xs.length}, {@code xs.size()} and {@code xs.length()} become {@code len(xs)}</li>
 *   <li>array initializers and {@code List.of(...)}-style factories over literals become
 *       literal containers</li>
 * </ul>
 * Everything else keeps its structure so nested loops are still discovered.
 */
final class JavaSyntaxLowering {

    private static final Set<String> LENGTH_METHODS = Set.of("size", "length");

    private static final Map<String, Expression.Kind> COLLECTION_FACTORIES = Map.of(
            "List.of", Expression.Kind.LIST,
            "Arrays.asList", Expression.Kind.LIST,
            "Stream.of", Expression.Kind.LIST,
            "Set.of", Expression.Kind.SET,
            "Map.of", Expression.Kind.DICT);

    /** The variable a counted for loop steps, and the expression it starts from. */
    private static final class LoopVariable {
        private final String name;
        private final com.github.javaparser.ast.expr.Expression start;

        LoopVariable(String name, com.github.javaparser.ast.expr.Expression start) {
            this.name = name;
            this.start = start;
        }

        String getName() {
            return name;
        }

        com.github.javaparser.ast.expr.Expression getStart() {
            return start;
        }
    }

    List<Statement> lowerCompilationUnit(CompilationUnit unit) {
        List<Statement> body = new ArrayList<>();
        for (TypeDeclaration<?> type : unit.getTypes()) {
            body.add(lowerType(type));
        }
        return body;
    }

    private Statement lowerType(TypeDeclaration<?> type) {
        List<Expression> expressions = new ArrayList<>();
        List<Statement> members = new ArrayList<>();
        if (type instanceof EnumDeclaration) {
            for (EnumConstantDeclaration constant : ((EnumDeclaration) type).getEntries()) {
                expressions.addAll(lowerAll(constant.getArguments()));
                if (!constant.getClassBody().isEmpty()) {
                    members.add(Statement.definition(Statement.Kind.CLASS_DEF, line(constant),
                            constant.getNameAsString(), List.of(), lowerMembers(constant.getClassBody())));
                }
            }
        }
        members.addAll(lowerMembers(type.getMembers()));
        return Statement.definition(Statement.Kind.CLASS_DEF, line(type), type.getNameAsString(),
                expressions, members);
    }

    private List<Statement> lowerMembers(NodeList<BodyDeclaration<?>> members) {
        List<Statement> lowered = new ArrayList<>();
        for (BodyDeclaration<?> member : members) {
            if (member instanceof MethodDeclaration) {
                MethodDeclaration method = (MethodDeclaration) member;
                List<Statement> body = method.getBody().map(this::lowerBlock).orElse(List.of());
                lowered.add(Statement.definition(Statement.Kind.FUNCTION_DEF, line(method),
                        method.getNameAsString(), List.of(), body));
            } else if (member instanceof ConstructorDeclaration) {
                ConstructorDeclaration constructor = (ConstructorDeclaration) member;
                lowered.add(Statement.definition(Statement.Kind.FUNCTION_DEF, line(constructor),
                        constructor.getNameAsString(), List.of(), lowerBlock(constructor.getBody())));
            } else if (member instanceof CompactConstructorDeclaration) {
                CompactConstructorDeclaration constructor = (CompactConstructorDeclaration) member;
                lowered.add(Statement.definition(Statement.Kind.FUNCTION_DEF, line(constructor),
                        constructor.getNameAsString(), List.of(), lowerBlock(constructor.getBody())));
            } else if (member instanceof InitializerDeclaration) {
                InitializerDeclaration initializer = (InitializerDeclaration) member;
                lowered.add(Statement.compound(Statement.Kind.BLOCK, line(initializer), List.of(),
                        List.of(lowerBlock(initializer.getBody()))));
            } else if (member instanceof FieldDeclaration) {
                FieldDeclaration field = (FieldDeclaration) member;
                List<Expression> initializers = lowerInitializers(field.getVariables());
                if (!initializers.isEmpty()) {
                    lowered.add(Statement.simple(Statement.Kind.ASSIGN, line(field), initializers));
                }
            } else if (member instanceof TypeDeclaration) {
                lowered.add(lowerType((TypeDeclaration<?>) member));
            }
        }
        return lowered;
    }

    private List<Statement> lowerBlock(BlockStmt block) {
        List<Statement> lowered = new ArrayList<>();
        for (com.github.javaparser.ast.stmt.Statement statement : block.getStatements()) {
            lowered.add(lowerStatement(statement));
        }
        return lowered;
    }

    /**
     * Lowers a statement used as a body; a braced block contributes its statements directly.
     */
    private List<Statement> lowerBody(com.github.javaparser.ast.stmt.Statement statement) {
        if (statement instanceof BlockStmt) {
            return lowerBlock((BlockStmt) statement);
        }
        return List.of(lowerStatement(statement));
    }

    private Statement lowerStatement(com.github.javaparser.ast.stmt.Statement statement) {
        int line = line(statement);

        if (statement instanceof BlockStmt) {
            return Statement.compound(Statement.Kind.BLOCK, line, List.of(),
                    List.of(lowerBlock((BlockStmt) statement)));
        }
        if (statement instanceof ForEachStmt) {
            ForEachStmt forEach = (ForEachStmt) statement;
            String variable = forEach.getVariable().getVariables().get(0).getNameAsString();
            return Statement.forLoop(line, Expression.name(line, variable),
                    lowerExpression(forEach.getIterable()), lowerBody(forEach.getBody()), List.of());
        }
        if (statement instanceof ForStmt) {
            ForStmt forStmt = (ForStmt) statement;
            Optional<LoopVariable> variable = loopVariable(forStmt.getInitialization());
            Expression target = variable.map(v -> Expression.name(line, v.getName())).orElse(null);
            return Statement.forLoop(line, target, countedLoopSource(forStmt, variable),
                    lowerBody(forStmt.getBody()), List.of());
        }
        if (statement instanceof WhileStmt) {
            WhileStmt whileStmt = (WhileStmt) statement;
            return Statement.whileLoop(line, lowerExpression(whileStmt.getCondition()),
                    lowerBody(whileStmt.getBody()), List.of());
        }
        if (statement instanceof DoStmt) {
            DoStmt doStmt = (DoStmt) statement;
            return Statement.whileLoop(line, lowerExpression(doStmt.getCondition()),
                    lowerBody(doStmt.getBody()), List.of());
        }
        if (statement instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) statement;
            List<Statement> orElse = ifStmt.getElseStmt().map(this::lowerBody).orElse(List.of());
            return Statement.compound(Statement.Kind.IF, line, List.of(lowerExpression(ifStmt.getCondition())),
                    List.of(lowerBody(ifStmt.getThenStmt()), orElse));
        }
        if (statement instanceof TryStmt) {
            TryStmt tryStmt = (TryStmt) statement;
            List<List<Statement>> blocks = new ArrayList<>();
            blocks.add(lowerBlock(tryStmt.getTryBlock()));
            for (CatchClause catchClause : tryStmt.getCatchClauses()) {
                blocks.add(lowerBlock(catchClause.getBody()));
            }
            tryStmt.getFinallyBlock().ifPresent(finallyBlock -> blocks.add(lowerBlock(finallyBlock)));
            return Statement.compound(Statement.Kind.TRY, line, lowerAll(tryStmt.getResources()), blocks);
        }
        if (statement instanceof SwitchStmt) {
            SwitchStmt switchStmt = (SwitchStmt) statement;
            return Statement.compound(Statement.Kind.MATCH, line, List.of(lowerExpression(switchStmt.getSelector())),
                    lowerSwitchEntries(switchStmt.getEntries()));
        }
        if (statement instanceof SynchronizedStmt) {
            SynchronizedStmt synchronizedStmt = (SynchronizedStmt) statement;
            return Statement.compound(Statement.Kind.WITH, line,
                    List.of(lowerExpression(synchronizedStmt.getExpression())),
                    List.of(lowerBlock(synchronizedStmt.getBody())));
        }
        if (statement instanceof LabeledStmt) {
            return lowerStatement(((LabeledStmt) statement).getStatement());
        }
        if (statement instanceof ExpressionStmt) {
            return lowerExpressionStatement((ExpressionStmt) statement);
        }
        if (statement instanceof ReturnStmt) {
            List<Expression> value = ((ReturnStmt) statement).getExpression()
                    .map(e -> List.of(lowerExpression(e))).orElse(List.of());
            return Statement.simple(Statement.Kind.RETURN, line, value);
        }
        if (statement instanceof ThrowStmt) {
            return Statement.simple(Statement.Kind.RAISE, line,
                    List.of(lowerExpression(((ThrowStmt) statement).getExpression())));
        }
        if (statement instanceof AssertStmt) {
            AssertStmt assertStmt = (AssertStmt) statement;
            List<Expression> expressions = new ArrayList<>();
            expressions.add(lowerExpression(assertStmt.getCheck()));
            assertStmt.getMessage().ifPresent(message -> expressions.add(lowerExpression(message)));
            return Statement.simple(Statement.Kind.ASSERT, line, expressions);
        }
        if (statement instanceof BreakStmt) {
            return Statement.simple(Statement.Kind.BREAK, line);
        }
        if (statement instanceof ContinueStmt) {
            return Statement.simple(Statement.Kind.CONTINUE, line);
        }
        if (statement instanceof EmptyStmt) {
            return Statement.simple(Statement.Kind.PASS, line);
        }
        if (statement instanceof LocalClassDeclarationStmt) {
            return lowerType(((LocalClassDeclarationStmt) statement).getClassDeclaration());
        }
        if (statement instanceof LocalRecordDeclarationStmt) {
            return lowerType(((LocalRecordDeclarationStmt) statement).getRecordDeclaration());
        }
        if (statement instanceof YieldStmt) {
            Expression value = lowerExpression(((YieldStmt) statement).getExpression());
            return Statement.simple(Statement.Kind.EXPRESSION, line,
                    List.of(Expression.of(Expression.Kind.YIELD, line, List.of(value))));
        }
        if (statement instanceof ExplicitConstructorInvocationStmt) {
            ExplicitConstructorInvocationStmt invocation = (ExplicitConstructorInvocationStmt) statement;
            Expression callee = Expression.name(line, invocation.isThis() ? "this" : "super");
            return Statement.simple(Statement.Kind.EXPRESSION, line,
                    List.of(Expression.call(line, callee, lowerAll(invocation.getArguments()))));
        }

        // Unknown statement shape: keep whatever it contains so nested loops stay visible.
        return Statement.compound(Statement.Kind.BLOCK, line, lowerChildExpressions(statement),
                List.of(lowerChildStatements(statement)));
    }

    private Statement lowerExpressionStatement(ExpressionStmt statement) {
        int line = line(statement);
        com.github.javaparser.ast.expr.Expression expression = statement.getExpression();
        if (expression instanceof AssignExpr) {
            AssignExpr assign = (AssignExpr) expression;
            return Statement.simple(Statement.Kind.ASSIGN, line,
                    List.of(lowerExpression(assign.getTarget()), lowerExpression(assign.getValue())));
        }
        if (expression instanceof VariableDeclarationExpr) {
            return Statement.simple(Statement.Kind.ASSIGN, line,
                    lowerInitializers(((VariableDeclarationExpr) expression).getVariables()));
        }
        return Statement.simple(Statement.Kind.EXPRESSION, line, List.of(lowerExpression(expression)));
    }

    private List<List<Statement>> lowerSwitchEntries(NodeList<SwitchEntry> entries) {
        List<List<Statement>> blocks = new ArrayList<>();
        for (SwitchEntry entry : entries) {
            List<Statement> block = new ArrayList<>();
            for (com.github.javaparser.ast.stmt.Statement statement : entry.getStatements()) {
                block.add(lowerStatement(statement));
            }
            blocks.add(block);
        }
        return blocks;
    }

    private Optional<LoopVariable> loopVariable(NodeList<com.github.javaparser.ast.expr.Expression> initialization) {
        if (initialization.size() != 1) {
            return Optional.empty();
        }
        com.github.javaparser.ast.expr.Expression init = initialization.get(0);
        if (init instanceof VariableDeclarationExpr) {
            NodeList<VariableDeclarator> variables = ((VariableDeclarationExpr) init).getVariables();
            if (variables.size() == 1 && variables.get(0).getInitializer().isPresent()) {
                VariableDeclarator variable = variables.get(0);
                return Optional.of(new LoopVariable(variable.getNameAsString(), variable.getInitializer().get()));
            }
        } else if (init instanceof AssignExpr) {
            AssignExpr assign = (AssignExpr) init;
            if (assign.getOperator() == AssignExpr.Operator.ASSIGN && assign.getTarget() instanceof NameExpr) {
                return Optional.of(new LoopVariable(((NameExpr) assign.getTarget()).getNameAsString(), assign.getValue()));
            }
        }
        return Optional.empty();
    }

    /**
     * Describes what a classic for loop counts over as a {@code range(low, high)} call.
     * Ascending loops ({@code i < n}) count from the start to the bound, descending loops
     * ({@code i > n}) from the bound to the start. Other shapes get an opaque source.
     */
    private Expression countedLoopSource(ForStmt forStmt, Optional<LoopVariable> variable) {
        int line = line(forStmt);
        Optional<com.github.javaparser.ast.expr.Expression> compare = forStmt.getCompare();
        if (variable.isPresent() && compare.isPresent() && compare.get() instanceof BinaryExpr) {
            BinaryExpr comparison = (BinaryExpr) compare.get();
            String name = variable.get().getName();
            com.github.javaparser.ast.expr.Expression start = variable.get().getStart();
            boolean upward = comparison.getOperator() == BinaryExpr.Operator.LESS
                    || comparison.getOperator() == BinaryExpr.Operator.LESS_EQUALS;
            boolean downward = comparison.getOperator() == BinaryExpr.Operator.GREATER
                    || comparison.getOperator() == BinaryExpr.Operator.GREATER_EQUALS;

            if (isVariable(comparison.getLeft(), name) && upward) {
                return range(line, start, comparison.getRight());
            }
            if (isVariable(comparison.getLeft(), name) && downward) {
                return range(line, comparison.getRight(), start);
            }
            if (isVariable(comparison.getRight(), name) && downward) {
                return range(line, start, comparison.getLeft());
            }
            if (isVariable(comparison.getRight(), name) && upward) {
                return range(line, comparison.getLeft(), start);
            }
        }
        return Expression.of(Expression.Kind.OTHER, line,
                compare.map(c -> List.of(lowerExpression(c))).orElse(List.of()));
    }

    private Expression range(int line, com.github.javaparser.ast.expr.Expression low,
                             com.github.javaparser.ast.expr.Expression high) {
        return Expression.call(line, Expression.name(line, "range"),
                List.of(lowerExpression(low), lowerExpression(high)));
    }

    private static boolean isVariable(com.github.javaparser.ast.expr.Expression expression, String name) {
        return expression instanceof NameExpr && ((NameExpr) expression).getNameAsString().equals(name);
    }

    Expression lowerExpression(com.github.javaparser.ast.expr.Expression expression) {
        int line = line(expression);

        if (expression instanceof EnclosedExpr) {
            return lowerExpression(((EnclosedExpr) expression).getInner());
        }
        if (expression instanceof CastExpr) {
            return lowerExpression(((CastExpr) expression).getExpression());
        }
        if (expression instanceof LiteralExpr) {
            return Expression.constant(line, expression.toString());
        }
        if (expression instanceof NameExpr) {
            return Expression.name(line, ((NameExpr) expression).getNameAsString());
        }
        if (expression instanceof FieldAccessExpr) {
            FieldAccessExpr fieldAccess = (FieldAccessExpr) expression;
            if (fieldAccess.getNameAsString().equals("length") && fieldAccess.getScope() instanceof NameExpr) {
                return lengthOf(line, (NameExpr) fieldAccess.getScope());
            }
            return Expression.attribute(line, lowerExpression(fieldAccess.getScope()), fieldAccess.getNameAsString());
        }
        if (expression instanceof MethodCallExpr) {
            return lowerMethodCall((MethodCallExpr) expression);
        }
        if (expression instanceof ArrayCreationExpr) {
            ArrayCreationExpr creation = (ArrayCreationExpr) expression;
            if (creation.getInitializer().isPresent()) {
                return lowerExpression(creation.getInitializer().get());
            }
            return Expression.of(Expression.Kind.OTHER, line, lowerChildExpressions(creation));
        }
        if (expression instanceof ArrayInitializerExpr) {
            return Expression.of(Expression.Kind.LIST, line, lowerAll(((ArrayInitializerExpr) expression).getValues()));
        }
        if (expression instanceof ObjectCreationExpr) {
            return lowerObjectCreation((ObjectCreationExpr) expression);
        }
        if (expression instanceof LambdaExpr) {
            return lowerLambda((LambdaExpr) expression);
        }
        if (expression instanceof BinaryExpr) {
            BinaryExpr binary = (BinaryExpr) expression;
            return Expression.of(binaryKind(binary.getOperator()), line, binary.getOperator().asString(),
                    List.of(lowerExpression(binary.getLeft()), lowerExpression(binary.getRight())));
        }
        if (expression instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) expression;
            return Expression.of(Expression.Kind.UNARY, line, unary.getOperator().asString(),
                    List.of(lowerExpression(unary.getExpression())));
        }
        if (expression instanceof AssignExpr) {
            AssignExpr assign = (AssignExpr) expression;
            return Expression.of(Expression.Kind.NAMED, line, assign.getOperator().asString(),
                    List.of(lowerExpression(assign.getTarget()), lowerExpression(assign.getValue())));
        }
        if (expression instanceof ConditionalExpr) {
            ConditionalExpr conditional = (ConditionalExpr) expression;
            return Expression.of(Expression.Kind.CONDITIONAL, line, List.of(
                    lowerExpression(conditional.getCondition()),
                    lowerExpression(conditional.getThenExpr()),
                    lowerExpression(conditional.getElseExpr())));
        }
        if (expression instanceof ArrayAccessExpr) {
            ArrayAccessExpr access = (ArrayAccessExpr) expression;
            return Expression.subscript(line, lowerExpression(access.getName()), lowerExpression(access.getIndex()));
        }
        if (expression instanceof SwitchExpr) {
            SwitchExpr switchExpr = (SwitchExpr) expression;
            List<Statement> cases = new ArrayList<>();
            for (List<Statement> block : lowerSwitchEntries(switchExpr.getEntries())) {
                cases.add(Statement.compound(Statement.Kind.BLOCK, line, List.of(), List.of(block)));
            }
            return Expression.withBody(Expression.Kind.OTHER, line,
                    List.of(lowerExpression(switchExpr.getSelector())), cases);
        }
        if (expression instanceof VariableDeclarationExpr) {
            return Expression.of(Expression.Kind.OTHER, line,
                    lowerInitializers(((VariableDeclarationExpr) expression).getVariables()));
        }
        return Expression.of(Expression.Kind.OTHER, line, lowerChildExpressions(expression));
    }

    private Expression lowerMethodCall(MethodCallExpr call) {
        int line = line(call);
        String name = call.getNameAsString();
        Optional<com.github.javaparser.ast.expr.Expression> scope = call.getScope();

        if (call.getArguments().isEmpty() && LENGTH_METHODS.contains(name)
                && scope.isPresent() && scope.get() instanceof NameExpr) {
            return lengthOf(line, (NameExpr) scope.get());
        }
        if (scope.isPresent() && scope.get() instanceof NameExpr) {
            String qualified = ((NameExpr) scope.get()).getNameAsString() + "." + name;
            Expression.Kind container = COLLECTION_FACTORIES.get(qualified);
            if (container != null
                    && call.getArguments().stream().allMatch(com.github.javaparser.ast.expr.Expression::isLiteralExpr)) {
                return Expression.of(container, line, lowerAll(call.getArguments()));
            }
        }
        Expression callee = scope
                .map(receiver -> Expression.attribute(line, lowerExpression(receiver), name))
                .orElseGet(() -> Expression.name(line, name));
        return Expression.call(line, callee, lowerAll(call.getArguments()));
    }

    private Expression lowerObjectCreation(ObjectCreationExpr creation) {
        int line = line(creation);
        Expression call = Expression.call(line, Expression.name(line, creation.getType().getNameAsString()),
                lowerAll(creation.getArguments()));
        if (creation.getAnonymousClassBody().isPresent()) {
            return Expression.withBody(Expression.Kind.OTHER, line, List.of(call),
                    lowerMembers(creation.getAnonymousClassBody().get()));
        }
        return call;
    }

    private Expression lowerLambda(LambdaExpr lambda) {
        int line = line(lambda);
        com.github.javaparser.ast.stmt.Statement body = lambda.getBody();
        if (body instanceof BlockStmt) {
            return Expression.withBody(Expression.Kind.LAMBDA, line, List.of(), lowerBlock((BlockStmt) body));
        }
        List<Expression> operands = lambda.getExpressionBody()
                .map(e -> List.of(lowerExpression(e)))
                .orElse(List.of());
        return Expression.withBody(Expression.Kind.LAMBDA, line, operands, List.of());
    }

    private static Expression.Kind binaryKind(BinaryExpr.Operator operator) {
        return switch (operator) {
            case AND, OR -> Expression.Kind.BOOLEAN;
            case EQUALS, NOT_EQUALS, LESS, GREATER, LESS_EQUALS, GREATER_EQUALS -> Expression.Kind.COMPARE;
            default -> Expression.Kind.BINARY;
        };
    }

    private static Expression lengthOf(int line, NameExpr collection) {
        return Expression.call(line, Expression.name(line, "len"),
                List.of(Expression.name(line, collection.getNameAsString())));
    }

    private List<Expression> lowerInitializers(NodeList<VariableDeclarator> variables) {
        List<Expression> lowered = new ArrayList<>();
        for (VariableDeclarator variable : variables) {
            variable.getInitializer().ifPresent(initializer -> lowered.add(lowerExpression(initializer)));
        }
        return lowered;
    }

    private List<Expression> lowerAll(NodeList<com.github.javaparser.ast.expr.Expression> expressions) {
        List<Expression> lowered = new ArrayList<>(expressions.size());
        for (com.github.javaparser.ast.expr.Expression expression : expressions) {
            lowered.add(lowerExpression(expression));
        }
        return lowered;
    }

    private List<Expression> lowerChildExpressions(Node node) {
        List<Expression> lowered = new ArrayList<>();
        for (Node child : node.getChildNodes()) {
            if (child instanceof com.github.javaparser.ast.expr.Expression) {
                lowered.add(lowerExpression((com.github.javaparser.ast.expr.Expression) child));
            }
        }
        return lowered;
    }

    private List<Statement> lowerChildStatements(Node node) {
        List<Statement> lowered = new ArrayList<>();
        for (Node child : node.getChildNodes()) {
            if (child instanceof com.github.javaparser.ast.stmt.Statement) {
                lowered.add(lowerStatement((com.github.javaparser.ast.stmt.Statement) child));
            }
        }
        return lowered;
    }

    private static int line(Node node) {
        return node.getBegin().map(position -> position.line).orElse(0);
    }
}
