package com.loopcost.estimator.syntax.python;

import com.loopcost.estimator.syntax.Expression;
import com.loopcost.estimator.syntax.Statement;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lowers the ANTLR parse tree of a Python module into the language-neutral syntax tree.
 *
 * Statements are lowered by the {@code lower*} methods; expressions through the
 * visitor methods. Constructs that never affect loop structure (import lists, match
 * patterns, parameter names, type parameters) are dropped. Targets of assignments,
 * deletions, loops and {@code with} items are checked here, as are the call-argument
 * ordering rules and f-string conversions, since the grammar accepts any expression there.
 */
final class PythonSyntaxLowering extends PythonParserBaseVisitor<Expression> {

    private static final Set<String> CONVERSIONS = Set.of("s", "r", "a");

    List<Statement> lowerFileInput(PythonParser.FileInputContext fileInput) {
        return lowerStatements(fileInput.statement());
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    private List<Statement> lowerStatements(List<PythonParser.StatementContext> statements) {
        List<Statement> lowered = new ArrayList<>();
        for (PythonParser.StatementContext statement : statements) {
            if (statement.compoundStatement() != null) {
                lowered.add(lowerCompound(statement.compoundStatement()));
            } else {
                lowerSimpleStatements(statement.simpleStatements(), lowered);
            }
        }
        return lowered;
    }

    private List<Statement> lowerBlock(PythonParser.BlockContext block) {
        if (block == null) {
            return List.of();
        }
        if (block.simpleStatements() != null) {
            List<Statement> lowered = new ArrayList<>();
            lowerSimpleStatements(block.simpleStatements(), lowered);
            return lowered;
        }
        return lowerStatements(block.statement());
    }

    private List<Statement> lowerElse(PythonParser.ElseBlockContext elseBlock) {
        return elseBlock == null ? List.of() : lowerBlock(elseBlock.block());
    }

    private void lowerSimpleStatements(PythonParser.SimpleStatementsContext statements, List<Statement> out) {
        for (PythonParser.SimpleStatementContext statement : statements.simpleStatement()) {
            out.add(lowerSimpleStatement(statement));
        }
    }

    private Statement lowerSimpleStatement(PythonParser.SimpleStatementContext statement) {
        int line = line(statement);
        if (statement instanceof PythonParser.AssignmentStatementContext) {
            return lowerAssignment(((PythonParser.AssignmentStatementContext) statement).assignment());
        }
        if (statement instanceof PythonParser.TypeAliasStatementContext) {
            PythonParser.TypeAliasStatementContext alias = (PythonParser.TypeAliasStatementContext) statement;
            Expression name = Expression.name(line(alias.name()), alias.name().getText());
            return Statement.simple(Statement.Kind.ASSIGN, line, List.of(name, visit(alias.expression())));
        }
        if (statement instanceof PythonParser.ExpressionStatementContext) {
            Expression value = visit(((PythonParser.ExpressionStatementContext) statement).starExpressions());
            return Statement.simple(Statement.Kind.EXPRESSION, line, List.of(value));
        }
        if (statement instanceof PythonParser.YieldStatementContext) {
            Expression value = visit(((PythonParser.YieldStatementContext) statement).yieldExpression());
            return Statement.simple(Statement.Kind.EXPRESSION, line, List.of(value));
        }
        if (statement instanceof PythonParser.ReturnStatementContext) {
            PythonParser.StarExpressionsContext value = ((PythonParser.ReturnStatementContext) statement).starExpressions();
            return Statement.simple(Statement.Kind.RETURN, line, value == null ? List.of() : List.of(visit(value)));
        }
        if (statement instanceof PythonParser.RaiseStatementContext) {
            return Statement.simple(Statement.Kind.RAISE, line,
                    visitAll(((PythonParser.RaiseStatementContext) statement).expression()));
        }
        if (statement instanceof PythonParser.AssertStatementContext) {
            return Statement.simple(Statement.Kind.ASSERT, line,
                    visitAll(((PythonParser.AssertStatementContext) statement).expression()));
        }
        if (statement instanceof PythonParser.DeleteStatementContext) {
            return lowerDelete((PythonParser.DeleteStatementContext) statement);
        }
        if (statement instanceof PythonParser.ImportStatementContext
                || statement instanceof PythonParser.ImportFromStatementContext) {
            return Statement.simple(Statement.Kind.IMPORT, line);
        }
        if (statement instanceof PythonParser.GlobalStatementContext) {
            return Statement.simple(Statement.Kind.GLOBAL, line);
        }
        if (statement instanceof PythonParser.BreakStatementContext) {
            return Statement.simple(Statement.Kind.BREAK, line);
        }
        if (statement instanceof PythonParser.ContinueStatementContext) {
            return Statement.simple(Statement.Kind.CONTINUE, line);
        }
        return Statement.simple(Statement.Kind.PASS, line);
    }

    private Statement lowerAssignment(PythonParser.AssignmentContext assignment) {
        int line = line(assignment);
        List<Expression> parts = new ArrayList<>();
        if (assignment instanceof PythonParser.AnnotatedAssignmentContext) {
            PythonParser.AnnotatedAssignmentContext annotated = (PythonParser.AnnotatedAssignmentContext) assignment;
            parts.add(singleTarget(annotated.expression(0), "annotated"));
            parts.add(visit(annotated.expression(1)));
            if (annotated.assignedValue() != null) {
                parts.add(visit(annotated.assignedValue()));
            }
        } else if (assignment instanceof PythonParser.ChainedAssignmentContext) {
            PythonParser.ChainedAssignmentContext chained = (PythonParser.ChainedAssignmentContext) assignment;
            for (PythonParser.StarExpressionsContext target : chained.starExpressions()) {
                Expression lowered = visit(target);
                requireTarget(lowered, target, true);
                parts.add(lowered);
            }
            parts.add(visit(chained.assignedValue()));
        } else {
            PythonParser.AugmentedAssignmentContext augmented = (PythonParser.AugmentedAssignmentContext) assignment;
            parts.add(singleTarget(augmented.expression(), "augmented"));
            parts.add(visit(augmented.assignedValue()));
        }
        return Statement.simple(Statement.Kind.ASSIGN, line, parts);
    }

    /** Annotated and augmented assignments take a name, attribute or subscript only. */
    private Expression singleTarget(PythonParser.ExpressionContext context, String assignmentKind) {
        Expression target = visit(context);
        if (!isSingleTarget(target)) {
            throw error(context, "'" + describe(target) + "' is an illegal expression for "
                    + assignmentKind + " assignment");
        }
        return target;
    }

    private Statement lowerDelete(PythonParser.DeleteStatementContext delete) {
        List<Expression> targets = new ArrayList<>();
        for (PythonParser.PrimaryContext primary : delete.primary()) {
            Expression target = visit(primary);
            requireDeletable(target, primary);
            targets.add(target);
        }
        Expression deleted = delete.COMMA().isEmpty()
                ? targets.get(0)
                : Expression.of(Expression.Kind.TUPLE, line(delete.primary(0)), targets);
        return Statement.simple(Statement.Kind.DELETE, line(delete), List.of(deleted));
    }

    private Statement lowerCompound(PythonParser.CompoundStatementContext compound) {
        if (compound.functionDefinition() != null) {
            return lowerFunction(compound.functionDefinition());
        }
        if (compound.classDefinition() != null) {
            return lowerClass(compound.classDefinition());
        }
        if (compound.ifStatement() != null) {
            return lowerIf(compound.ifStatement());
        }
        if (compound.whileStatement() != null) {
            PythonParser.WhileStatementContext loop = compound.whileStatement();
            return Statement.whileLoop(line(loop), visit(loop.namedExpression()),
                    lowerBlock(loop.block()), lowerElse(loop.elseBlock()));
        }
        if (compound.forStatement() != null) {
            PythonParser.ForStatementContext loop = compound.forStatement();
            return Statement.forLoop(line(loop), lowerTargets(loop.starTargets()), visit(loop.starExpressions()),
                    lowerBlock(loop.block()), lowerElse(loop.elseBlock()));
        }
        if (compound.withStatement() != null) {
            return lowerWith(compound.withStatement());
        }
        if (compound.tryStatement() != null) {
            return lowerTry(compound.tryStatement());
        }
        return lowerMatch(compound.matchStatement());
    }

    private Statement lowerFunction(PythonParser.FunctionDefinitionContext function) {
        List<Expression> expressions = lowerDecorators(function.decorators());
        if (function.parameters() != null) {
            expressions.addAll(lowerParameters(function.parameters()));
        }
        if (function.expression() != null) {
            expressions.add(visit(function.expression()));
        }
        Token start = function.ASYNC() != null ? function.ASYNC().getSymbol() : function.DEF().getSymbol();
        return Statement.definition(Statement.Kind.FUNCTION_DEF, start.getLine(), function.name().getText(),
                expressions, lowerBlock(function.block()));
    }

    private List<Expression> lowerDecorators(PythonParser.DecoratorsContext decorators) {
        List<Expression> lowered = new ArrayList<>();
        if (decorators != null) {
            lowered.addAll(visitAll(decorators.namedExpression()));
        }
        return lowered;
    }

    /**
     * Annotations and default values in source order. A parameter without a default
     * may not follow one with a default before the keyword-only marker.
     */
    private List<Expression> lowerParameters(PythonParser.ParametersContext parameters) {
        List<Expression> expressions = new ArrayList<>();
        boolean sawDefault = false;
        boolean keywordOnly = false;
        for (PythonParser.ParameterContext parameter : parameters.parameter()) {
            if (parameter.STAR() != null || parameter.POWER() != null) {
                keywordOnly = true;
            } else if (parameter.name() != null) {
                boolean hasDefault = parameter.ASSIGN() != null;
                if (!hasDefault && sawDefault && !keywordOnly) {
                    throw error(parameter, "non-default argument follows default argument");
                }
                sawDefault |= hasDefault;
            }
            for (ParseTree child : parameter.children) {
                if (child instanceof PythonParser.ExpressionContext || child instanceof PythonParser.StarExpressionContext) {
                    expressions.add(visit(child));
                }
            }
        }
        return expressions;
    }

    private Statement lowerClass(PythonParser.ClassDefinitionContext definition) {
        List<Expression> expressions = lowerDecorators(definition.decorators());
        if (definition.arguments() != null) {
            List<Expression> keywords = new ArrayList<>();
            expressions.addAll(lowerArguments(definition.arguments(), keywords));
            expressions.addAll(keywords);
        }
        return Statement.definition(Statement.Kind.CLASS_DEF, line(definition.CLASS()), definition.name().getText(),
                expressions, lowerBlock(definition.block()));
    }

    /** An elif chain becomes an if nested in the else branch of the previous one. */
    private Statement lowerIf(PythonParser.IfStatementContext statement) {
        List<Statement> orElse = lowerElse(statement.elseBlock());
        List<PythonParser.ElifClauseContext> clauses = statement.elifClause();
        for (int i = clauses.size() - 1; i >= 0; i--) {
            PythonParser.ElifClauseContext clause = clauses.get(i);
            Statement nested = Statement.compound(Statement.Kind.IF, line(clause),
                    List.of(visit(clause.namedExpression())), List.of(lowerBlock(clause.block()), orElse));
            orElse = List.of(nested);
        }
        return Statement.compound(Statement.Kind.IF, line(statement), List.of(visit(statement.namedExpression())),
                List.of(lowerBlock(statement.block()), orElse));
    }

    private Statement lowerWith(PythonParser.WithStatementContext statement) {
        List<Expression> items = new ArrayList<>();
        for (PythonParser.WithItemContext item : statement.withItem()) {
            items.add(visit(item.expression()));
            if (item.starTarget() != null) {
                Expression target = visit(item.starTarget());
                requireTarget(target, item.starTarget(), true);
                items.add(target);
            }
        }
        return Statement.compound(Statement.Kind.WITH, line(statement), items, List.of(lowerBlock(statement.block())));
    }

    /** Blocks in source order: body, handlers, else, finally. Handler types become expressions. */
    private Statement lowerTry(PythonParser.TryStatementContext statement) {
        List<Expression> handlerTypes = new ArrayList<>();
        List<List<Statement>> blocks = new ArrayList<>();
        for (ParseTree child : statement.children) {
            if (child instanceof PythonParser.BlockContext) {
                blocks.add(lowerBlock((PythonParser.BlockContext) child));
            } else if (child instanceof PythonParser.ExceptBlockContext) {
                PythonParser.ExceptBlockContext handler = (PythonParser.ExceptBlockContext) child;
                if (handler.expression() != null) {
                    handlerTypes.add(visit(handler.expression()));
                }
                blocks.add(lowerBlock(handler.block()));
            } else if (child instanceof PythonParser.ExceptStarBlockContext) {
                PythonParser.ExceptStarBlockContext handler = (PythonParser.ExceptStarBlockContext) child;
                handlerTypes.add(visit(handler.expression()));
                blocks.add(lowerBlock(handler.block()));
            } else if (child instanceof PythonParser.ElseBlockContext) {
                blocks.add(lowerBlock(((PythonParser.ElseBlockContext) child).block()));
            } else if (child instanceof PythonParser.FinallyBlockContext) {
                blocks.add(lowerBlock(((PythonParser.FinallyBlockContext) child).block()));
            }
        }
        return Statement.compound(Statement.Kind.TRY, line(statement), handlerTypes, blocks);
    }

    /** Patterns and guards are not represented; each case contributes its body. */
    private Statement lowerMatch(PythonParser.MatchStatementContext statement) {
        List<List<Statement>> cases = new ArrayList<>();
        for (PythonParser.CaseBlockContext caseBlock : statement.caseBlock()) {
            cases.add(lowerBlock(caseBlock.block()));
        }
        return Statement.compound(Statement.Kind.MATCH, line(statement), List.of(visit(statement.subject())), cases);
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    @Override
    public Expression visitAssignedValue(PythonParser.AssignedValueContext context) {
        return context.yieldExpression() != null ? visit(context.yieldExpression()) : visit(context.starExpressions());
    }

    @Override
    public Expression visitSubject(PythonParser.SubjectContext context) {
        if (context.namedExpression() != null) {
            return visit(context.namedExpression());
        }
        List<Expression> items = new ArrayList<>();
        items.add(visit(context.starNamedExpression()));
        items.addAll(lowerStarNamedExpressions(context.starNamedExpressions()));
        return Expression.of(Expression.Kind.TUPLE, line(context), items);
    }

    @Override
    public Expression visitStarExpressions(PythonParser.StarExpressionsContext context) {
        if (context.COMMA().isEmpty()) {
            return visit(context.starExpression(0));
        }
        return Expression.of(Expression.Kind.TUPLE, line(context), visitAll(context.starExpression()));
    }

    @Override
    public Expression visitStarExpression(PythonParser.StarExpressionContext context) {
        if (context.STAR() != null) {
            return Expression.of(Expression.Kind.STARRED, line(context), List.of(visit(context.bitwiseOr())));
        }
        return visit(context.expression());
    }

    @Override
    public Expression visitStarNamedExpression(PythonParser.StarNamedExpressionContext context) {
        if (context.STAR() != null) {
            return Expression.of(Expression.Kind.STARRED, line(context), List.of(visit(context.bitwiseOr())));
        }
        return visit(context.namedExpression());
    }

    @Override
    public Expression visitNamedExpression(PythonParser.NamedExpressionContext context) {
        if (context.WALRUS() == null) {
            return visit(context.expression());
        }
        Expression name = Expression.name(line(context.name()), context.name().getText());
        return Expression.of(Expression.Kind.NAMED, line(context), List.of(name, visit(context.expression())));
    }

    @Override
    public Expression visitExpression(PythonParser.ExpressionContext context) {
        if (context.lambdef() != null) {
            return visit(context.lambdef());
        }
        Expression body = visit(context.disjunction(0));
        if (context.IF() == null) {
            return body;
        }
        Expression test = visit(context.disjunction(1));
        return Expression.of(Expression.Kind.CONDITIONAL, line(context), List.of(test, body, visit(context.expression())));
    }

    /** Operands are the default values followed by the body. */
    @Override
    public Expression visitLambdef(PythonParser.LambdefContext context) {
        List<Expression> operands = new ArrayList<>();
        if (context.lambdaParameters() != null) {
            for (PythonParser.LambdaParameterContext parameter : context.lambdaParameters().lambdaParameter()) {
                if (parameter.expression() != null) {
                    operands.add(visit(parameter.expression()));
                }
            }
        }
        operands.add(visit(context.expression()));
        return Expression.withBody(Expression.Kind.LAMBDA, line(context), operands, List.of());
    }

    @Override
    public Expression visitYieldExpression(PythonParser.YieldExpressionContext context) {
        int line = line(context);
        if (context.FROM() != null) {
            return Expression.of(Expression.Kind.YIELD, line, "from", List.of(visit(context.expression())));
        }
        if (context.starExpressions() == null) {
            return Expression.of(Expression.Kind.YIELD, line, List.of());
        }
        return Expression.of(Expression.Kind.YIELD, line, List.of(visit(context.starExpressions())));
    }

    @Override
    public Expression visitDisjunction(PythonParser.DisjunctionContext context) {
        return booleanChain("or", context, context.conjunction());
    }

    @Override
    public Expression visitConjunction(PythonParser.ConjunctionContext context) {
        return booleanChain("and", context, context.inversion());
    }

    private Expression booleanChain(String operator, ParserRuleContext context,
                                    List<? extends ParserRuleContext> operands) {
        if (operands.size() == 1) {
            return visit(operands.get(0));
        }
        return Expression.of(Expression.Kind.BOOLEAN, line(context), operator, visitAll(operands));
    }

    @Override
    public Expression visitInversion(PythonParser.InversionContext context) {
        if (context.NOT() != null) {
            return Expression.of(Expression.Kind.UNARY, line(context), "not", List.of(visit(context.inversion())));
        }
        return visit(context.comparison());
    }

    /** A chain {@code a < b <= c} is one comparison; its value lists the operators. */
    @Override
    public Expression visitComparison(PythonParser.ComparisonContext context) {
        if (context.comparisonOperator().isEmpty()) {
            return visit(context.bitwiseOr(0));
        }
        List<String> operators = new ArrayList<>();
        for (PythonParser.ComparisonOperatorContext operator : context.comparisonOperator()) {
            List<String> words = new ArrayList<>();
            for (ParseTree child : operator.children) {
                words.add(child.getText());
            }
            operators.add(String.join(" ", words));
        }
        return Expression.of(Expression.Kind.COMPARE, line(context), String.join(" ", operators),
                visitAll(context.bitwiseOr()));
    }

    @Override
    public Expression visitBitwiseOr(PythonParser.BitwiseOrContext context) {
        return leftAssociative(context);
    }

    @Override
    public Expression visitBitwiseXor(PythonParser.BitwiseXorContext context) {
        return leftAssociative(context);
    }

    @Override
    public Expression visitBitwiseAnd(PythonParser.BitwiseAndContext context) {
        return leftAssociative(context);
    }

    @Override
    public Expression visitShiftExpression(PythonParser.ShiftExpressionContext context) {
        return leftAssociative(context);
    }

    @Override
    public Expression visitSum(PythonParser.SumContext context) {
        return leftAssociative(context);
    }

    @Override
    public Expression visitTerm(PythonParser.TermContext context) {
        return leftAssociative(context);
    }

    /** Children alternate operand, operator, operand; the result nests to the left. */
    private Expression leftAssociative(ParserRuleContext context) {
        Expression left = visit(context.getChild(0));
        for (int i = 1; i + 1 < context.getChildCount(); i += 2) {
            TerminalNode operator = (TerminalNode) context.getChild(i);
            Expression right = visit(context.getChild(i + 1));
            left = Expression.of(Expression.Kind.BINARY, line(operator), operator.getText(), List.of(left, right));
        }
        return left;
    }

    @Override
    public Expression visitFactor(PythonParser.FactorContext context) {
        if (context.power() != null) {
            return visit(context.power());
        }
        return Expression.of(Expression.Kind.UNARY, line(context), context.getChild(0).getText(),
                List.of(visit(context.factor())));
    }

    @Override
    public Expression visitPower(PythonParser.PowerContext context) {
        Expression base = visit(context.awaitPrimary());
        if (context.POWER() == null) {
            return base;
        }
        return Expression.of(Expression.Kind.BINARY, line(context.POWER()), "**", List.of(base, visit(context.factor())));
    }

    @Override
    public Expression visitAwaitPrimary(PythonParser.AwaitPrimaryContext context) {
        Expression primary = visit(context.primary());
        if (context.AWAIT() == null) {
            return primary;
        }
        return Expression.of(Expression.Kind.AWAIT, line(context), List.of(primary));
    }

    @Override
    public Expression visitPrimary(PythonParser.PrimaryContext context) {
        Expression expression = visit(context.atom());
        for (PythonParser.TrailerContext trailer : context.trailer()) {
            int line = line(trailer);
            if (trailer.DOT() != null) {
                expression = Expression.attribute(line, expression, trailer.name().getText());
            } else if (trailer.LPAREN() != null) {
                List<Expression> keywords = new ArrayList<>();
                List<Expression> arguments = trailer.arguments() == null
                        ? new ArrayList<>()
                        : lowerArguments(trailer.arguments(), keywords);
                expression = Expression.call(line, expression, arguments, keywords);
            } else {
                expression = Expression.subscript(line, expression, visit(trailer.slices()));
            }
        }
        return expression;
    }

    /**
     * Lowers call arguments in order.
     *
     * @param keywords receives keyword and {@code **} arguments
     * @return the positional and {@code *} arguments
     */
    private List<Expression> lowerArguments(PythonParser.ArgumentsContext arguments, List<Expression> keywords) {
        List<Expression> positional = new ArrayList<>();
        boolean sawKeyword = false;
        boolean sawKeywordUnpacking = false;
        for (PythonParser.ArgumentContext argument : arguments.argument()) {
            int line = line(argument);
            if (argument instanceof PythonParser.KeywordArgumentContext) {
                PythonParser.KeywordArgumentContext keyword = (PythonParser.KeywordArgumentContext) argument;
                keywords.add(Expression.keyword(line, keyword.name().getText(), visit(keyword.expression())));
                sawKeyword = true;
            } else if (argument instanceof PythonParser.DoubleStarredArgumentContext) {
                PythonParser.DoubleStarredArgumentContext unpacked = (PythonParser.DoubleStarredArgumentContext) argument;
                keywords.add(Expression.keyword(line, null, visit(unpacked.expression())));
                sawKeywordUnpacking = true;
            } else if (argument instanceof PythonParser.StarredArgumentContext) {
                if (sawKeywordUnpacking) {
                    throw error(argument, "iterable argument unpacking follows keyword argument unpacking");
                }
                PythonParser.StarredArgumentContext unpacked = (PythonParser.StarredArgumentContext) argument;
                positional.add(Expression.of(Expression.Kind.STARRED, line, List.of(visit(unpacked.expression()))));
            } else {
                PythonParser.PositionalArgumentContext plain = (PythonParser.PositionalArgumentContext) argument;
                if (sawKeyword || sawKeywordUnpacking) {
                    throw error(argument, sawKeywordUnpacking
                            ? "positional argument follows keyword argument unpacking"
                            : "positional argument follows keyword argument");
                }
                Expression value = visit(plain.namedExpression());
                if (plain.comprehensionClauses() != null) {
                    if (arguments.argument().size() > 1) {
                        throw error(argument, "Generator expression must be parenthesized");
                    }
                    value = comprehension("generator", line, List.of(value), plain.comprehensionClauses());
                }
                positional.add(value);
            }
        }
        return positional;
    }

    @Override
    public Expression visitSlices(PythonParser.SlicesContext context) {
        if (context.COMMA().isEmpty()) {
            return visit(context.slice(0));
        }
        return Expression.of(Expression.Kind.TUPLE, line(context), visitAll(context.slice()));
    }

    /** The bounds and step that are present, in order. */
    @Override
    public Expression visitSlice(PythonParser.SliceContext context) {
        if (context.starNamedExpression() != null) {
            return visit(context.starNamedExpression());
        }
        return Expression.of(Expression.Kind.SLICE, line(context), visitAll(context.expression()));
    }

    // ------------------------------------------------------------------
    // Atoms
    // ------------------------------------------------------------------

    @Override
    public Expression visitNameAtom(PythonParser.NameAtomContext context) {
        return Expression.name(line(context), context.getText());
    }

    @Override
    public Expression visitConstantAtom(PythonParser.ConstantAtomContext context) {
        return Expression.constant(line(context), context.getText());
    }

    /**
     * Adjacent literals concatenate. Any f-string part makes the whole literal formatted;
     * its operands are the replacement-field expressions.
     */
    @Override
    public Expression visitStringAtom(PythonParser.StringAtomContext context) {
        List<String> parts = new ArrayList<>();
        List<Expression> fields = new ArrayList<>();
        boolean formatted = false;
        for (PythonParser.StringLiteralContext literal : context.stringLiteral()) {
            parts.add(literal.getText());
            if (literal.fstring() != null) {
                formatted = true;
                lowerFormattedParts(literal.fstring().fstringPart(), fields);
            }
        }
        String text = String.join(" ", parts);
        return formatted
                ? Expression.of(Expression.Kind.FORMATTED, line(context), text, fields)
                : Expression.constant(line(context), text);
    }

    private void lowerFormattedParts(List<PythonParser.FstringPartContext> parts, List<Expression> fields) {
        for (PythonParser.FstringPartContext part : parts) {
            PythonParser.ReplacementFieldContext field = part.replacementField();
            if (field == null) {
                continue;
            }
            if (field.name() != null && !CONVERSIONS.contains(field.name().getText())) {
                throw error(field.name(), "f-string: invalid conversion character '" + field.name().getText()
                        + "': expected 's', 'r', or 'a'");
            }
            fields.add(field.yieldExpression() != null
                    ? visit(field.yieldExpression())
                    : visit(field.starExpressions()));
            lowerFormattedParts(field.fstringPart(), fields);
        }
    }

    @Override
    public Expression visitEmptyTupleAtom(PythonParser.EmptyTupleAtomContext context) {
        return Expression.of(Expression.Kind.TUPLE, line(context), List.of());
    }

    @Override
    public Expression visitYieldAtom(PythonParser.YieldAtomContext context) {
        return visit(context.yieldExpression());
    }

    @Override
    public Expression visitGroupAtom(PythonParser.GroupAtomContext context) {
        return visit(context.namedExpression());
    }

    @Override
    public Expression visitTupleAtom(PythonParser.TupleAtomContext context) {
        List<Expression> items = new ArrayList<>();
        items.add(visit(context.starNamedExpression()));
        items.addAll(lowerStarNamedExpressions(context.starNamedExpressions()));
        return Expression.of(Expression.Kind.TUPLE, line(context), items);
    }

    @Override
    public Expression visitListAtom(PythonParser.ListAtomContext context) {
        return Expression.of(Expression.Kind.LIST, line(context), lowerStarNamedExpressions(context.starNamedExpressions()));
    }

    @Override
    public Expression visitSetAtom(PythonParser.SetAtomContext context) {
        return Expression.of(Expression.Kind.SET, line(context), lowerStarNamedExpressions(context.starNamedExpressions()));
    }

    /** Keys and values alternate; {@code **mapping} is a starred item with operator {@code **}. */
    @Override
    public Expression visitDictAtom(PythonParser.DictAtomContext context) {
        List<Expression> items = new ArrayList<>();
        if (context.dictItems() != null) {
            for (PythonParser.DictItemContext item : context.dictItems().dictItem()) {
                if (item.POWER() != null) {
                    items.add(Expression.of(Expression.Kind.STARRED, line(item), "**", List.of(visit(item.bitwiseOr()))));
                } else {
                    items.addAll(visitAll(item.expression()));
                }
            }
        }
        return Expression.of(Expression.Kind.DICT, line(context), items);
    }

    @Override
    public Expression visitGeneratorAtom(PythonParser.GeneratorAtomContext context) {
        return comprehension("generator", line(context), List.of(visit(context.namedExpression())),
                context.comprehensionClauses());
    }

    @Override
    public Expression visitListComprehensionAtom(PythonParser.ListComprehensionAtomContext context) {
        return comprehension("list", line(context), List.of(visit(context.namedExpression())),
                context.comprehensionClauses());
    }

    @Override
    public Expression visitSetComprehensionAtom(PythonParser.SetComprehensionAtomContext context) {
        return comprehension("set", line(context), List.of(visit(context.namedExpression())),
                context.comprehensionClauses());
    }

    @Override
    public Expression visitDictComprehensionAtom(PythonParser.DictComprehensionAtomContext context) {
        return comprehension("dict", line(context), visitAll(context.expression()), context.comprehensionClauses());
    }

    /** Operands: the element(s), then target, iterable and conditions of each clause. */
    private Expression comprehension(String flavor, int line, List<Expression> elements,
                                     PythonParser.ComprehensionClausesContext clauses) {
        List<Expression> operands = new ArrayList<>(elements);
        for (PythonParser.ComprehensionForContext clause : clauses.comprehensionFor()) {
            operands.add(lowerTargets(clause.starTargets()));
            operands.addAll(visitAll(clause.disjunction()));
        }
        return Expression.of(Expression.Kind.COMPREHENSION, line, flavor, operands);
    }

    @Override
    public Expression visitStarTarget(PythonParser.StarTargetContext context) {
        Expression target = visit(context.bitwiseOr());
        if (context.STAR() == null) {
            return target;
        }
        return Expression.of(Expression.Kind.STARRED, line(context), List.of(target));
    }

    private Expression lowerTargets(PythonParser.StarTargetsContext targets) {
        Expression lowered = targets.COMMA().isEmpty()
                ? visit(targets.starTarget(0))
                : Expression.of(Expression.Kind.TUPLE, line(targets), visitAll(targets.starTarget()));
        requireTarget(lowered, targets, true);
        return lowered;
    }

    private List<Expression> lowerStarNamedExpressions(PythonParser.StarNamedExpressionsContext context) {
        return context == null ? new ArrayList<>() : visitAll(context.starNamedExpression());
    }

    // ------------------------------------------------------------------
    // Target checks
    // ------------------------------------------------------------------

    private static boolean isSingleTarget(Expression target) {
        return switch (target.getKind()) {
            case NAME, ATTRIBUTE, SUBSCRIPT -> true;
            default -> false;
        };
    }

    /**
     * Assignment targets: names, attributes, subscripts, and tuples or lists of targets
     * in which at most one element is starred. A starred target stands only inside a sequence.
     */
    private void requireTarget(Expression target, ParserRuleContext context, boolean topLevel) {
        if (isSingleTarget(target)) {
            return;
        }
        if (target.getKind() == Expression.Kind.TUPLE || target.getKind() == Expression.Kind.LIST) {
            int starred = 0;
            for (Expression element : target.getOperands()) {
                if (element.getKind() == Expression.Kind.STARRED) {
                    starred++;
                    requireTarget(element.getOperands().get(0), context, false);
                } else {
                    requireTarget(element, context, false);
                }
            }
            if (starred > 1) {
                throw error(context, "multiple starred expressions in assignment");
            }
            return;
        }
        if (target.getKind() == Expression.Kind.STARRED && topLevel) {
            throw error(context, "starred assignment target must be in a list or tuple");
        }
        throw error(context, "cannot assign to " + describe(target));
    }

    private void requireDeletable(Expression target, ParserRuleContext context) {
        if (isSingleTarget(target)) {
            return;
        }
        if (target.getKind() == Expression.Kind.TUPLE || target.getKind() == Expression.Kind.LIST) {
            for (Expression element : target.getOperands()) {
                requireDeletable(element, context);
            }
            return;
        }
        throw error(context, "cannot delete " + describe(target));
    }

    private static String describe(Expression expression) {
        return switch (expression.getKind()) {
            case CONSTANT, FORMATTED -> "literal";
            case CALL -> "function call";
            case COMPARE -> "comparison";
            case BINARY, UNARY, BOOLEAN -> "expression";
            case CONDITIONAL -> "conditional expression";
            case COMPREHENSION -> expression.getValue() + " comprehension";
            case STARRED -> "starred";
            default -> expression.getKind().name().toLowerCase();
        };
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private List<Expression> visitAll(List<? extends ParseTree> trees) {
        List<Expression> lowered = new ArrayList<>(trees.size());
        for (ParseTree tree : trees) {
            lowered.add(visit(tree));
        }
        return lowered;
    }

    private static int line(ParserRuleContext context) {
        return context.getStart().getLine();
    }

    private static int line(TerminalNode node) {
        return node.getSymbol().getLine();
    }

    private static PythonSyntaxError error(ParserRuleContext context, String message) {
        Token start = context.getStart();
        return new PythonSyntaxError(start.getLine(), start.getCharPositionInLine() + 1, message);
    }
}
