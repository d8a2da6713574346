package org.axion.math.dsl.antlr;

import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.axion.math.dsl.Application;
import org.axion.math.dsl.BinaryOp;
import org.axion.math.dsl.Constant;
import org.axion.math.dsl.Expression;
import org.axion.math.dsl.Quantified;
import org.axion.math.dsl.UnaryOp;
import org.axion.math.dsl.Variable;

import java.util.ArrayList;
import java.util.List;

/**
 * ANTLR visitor that converts the parse tree into the Expression tree.
 *
 * Two pieces of syntax are desugared here rather than kept in the tree:
 * - a minus sign written directly before a numeric literal yields a negative
 * Constant instead of a negation node;
 * - bounded binders become guarded bodies: {@code ∀n ∈ ℕ: φ} is
 * {@code ∀n: n ∈ ℕ ⟹ φ} and {@code ∃n ∈ ℕ: φ} is {@code ∃n: n ∈ ℕ ∧ φ}.
 */
public class AxionAstBuilder extends AxionBaseVisitor<Expression> {

    // ========================================
    // ENTRY POINT
    // ========================================

    @Override
    public Expression visitStatement(AxionParser.StatementContext ctx) {
        return visit(ctx.expression());
    }

    // ========================================
    // OPERATORS
    // ========================================

    @Override
    public Expression visitPrimaryExpression(AxionParser.PrimaryExpressionContext ctx) {
        return visit(ctx.primary());
    }

    @Override
    public Expression visitPowerExpression(AxionParser.PowerExpressionContext ctx) {
        return BinaryOp.power(visit(ctx.expression(0)), visit(ctx.expression(1)));
    }

    @Override
    public Expression visitNegateExpression(AxionParser.NegateExpressionContext ctx) {
        if (ctx.expression() instanceof AxionParser.PrimaryExpressionContext primary
                && primary.primary() instanceof AxionParser.NumberLiteralContext number) {
            return Constant.parse(number.NUMBER().getText()).negate();
        }
        return UnaryOp.negate(visit(ctx.expression()));
    }

    @Override
    public Expression visitMultiplicativeExpression(AxionParser.MultiplicativeExpressionContext ctx) {
        BinaryOp.Operator op = ctx.op.getType() == AxionParser.TIMES
                ? BinaryOp.Operator.MULTIPLY
                : BinaryOp.Operator.DIVIDE;
        return binary(op, ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Expression visitAdditiveExpression(AxionParser.AdditiveExpressionContext ctx) {
        BinaryOp.Operator op = ctx.op.getType() == AxionParser.PLUS
                ? BinaryOp.Operator.ADD
                : BinaryOp.Operator.SUBTRACT;
        return binary(op, ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Expression visitRelationalExpression(AxionParser.RelationalExpressionContext ctx) {
        return binary(relation(ctx.op), ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Expression visitNotExpression(AxionParser.NotExpressionContext ctx) {
        return UnaryOp.not(visit(ctx.expression()));
    }

    @Override
    public Expression visitAndExpression(AxionParser.AndExpressionContext ctx) {
        return binary(BinaryOp.Operator.AND, ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Expression visitOrExpression(AxionParser.OrExpressionContext ctx) {
        return binary(BinaryOp.Operator.OR, ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Expression visitImpliesExpression(AxionParser.ImpliesExpressionContext ctx) {
        return binary(BinaryOp.Operator.IMPLIES, ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Expression visitIffExpression(AxionParser.IffExpressionContext ctx) {
        return binary(BinaryOp.Operator.IFF, ctx.expression(0), ctx.expression(1));
    }

    // ========================================
    // QUANTIFIERS
    // ========================================

    @Override
    public Expression visitQuantifiedExpression(AxionParser.QuantifiedExpressionContext ctx) {
        Quantified.Kind kind = ctx.quantifier.getType() == AxionParser.FORALL
                ? Quantified.Kind.FORALL
                : Quantified.Kind.EXISTS;

        List<Binder> binders = new ArrayList<>();
        for (AxionParser.BinderGroupContext group : ctx.binderGroup()) {
            Expression domain = group.primary() != null ? visit(group.primary()) : null;
            BinaryOp.Operator bound = group.bound != null && group.bound.getType() == AxionParser.SUBSET_OF
                    ? BinaryOp.Operator.SUBSET_OF
                    : BinaryOp.Operator.ELEMENT_OF;
            for (TerminalNode identifier : group.IDENTIFIER()) {
                binders.add(new Binder(Variable.of(identifier.getText()), bound, domain));
            }
        }

        // Innermost binder first so the left-most variable ends up outermost
        Expression body = visit(ctx.expression());
        for (int i = binders.size() - 1; i >= 0; i--) {
            Binder binder = binders.get(i);
            if (binder.domain() != null) {
                Expression guard = new BinaryOp(binder.bound(), binder.variable(), binder.domain());
                body = kind == Quantified.Kind.FORALL
                        ? BinaryOp.implies(guard, body)
                        : BinaryOp.and(guard, body);
            }
            body = new Quantified(kind, binder.variable(), body);
        }
        return body;
    }

    private record Binder(Variable variable, BinaryOp.Operator bound, Expression domain) {
    }

    // ========================================
    // PRIMARIES
    // ========================================

    @Override
    public Expression visitNumberLiteral(AxionParser.NumberLiteralContext ctx) {
        return Constant.parse(ctx.NUMBER().getText());
    }

    @Override
    public Expression visitApplicationPrimary(AxionParser.ApplicationPrimaryContext ctx) {
        List<Expression> arguments = new ArrayList<>();
        for (AxionParser.ExpressionContext argument : ctx.expression()) {
            arguments.add(visit(argument));
        }
        return new Application(ctx.IDENTIFIER().getText(), arguments);
    }

    @Override
    public Expression visitVariablePrimary(AxionParser.VariablePrimaryContext ctx) {
        return Variable.of(ctx.IDENTIFIER().getText());
    }

    @Override
    public Expression visitSymbolPrimary(AxionParser.SymbolPrimaryContext ctx) {
        return Constant.symbol(ctx.SYMBOL().getText());
    }

    @Override
    public Expression visitParenthesizedPrimary(AxionParser.ParenthesizedPrimaryContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public Expression visitBracketedPrimary(AxionParser.BracketedPrimaryContext ctx) {
        return visit(ctx.expression());
    }

    // ========================================
    // HELPERS
    // ========================================

    private Expression binary(BinaryOp.Operator op, AxionParser.ExpressionContext left,
            AxionParser.ExpressionContext right) {
        return new BinaryOp(op, visit(left), visit(right));
    }

    private static BinaryOp.Operator relation(Token op) {
        return switch (op.getType()) {
            case AxionParser.EQUALS -> BinaryOp.Operator.EQUALS;
            case AxionParser.NOT_EQUALS -> BinaryOp.Operator.NOT_EQUALS;
            case AxionParser.LESS -> BinaryOp.Operator.LESS;
            case AxionParser.LESS_EQUAL -> BinaryOp.Operator.LESS_EQUAL;
            case AxionParser.GREATER -> BinaryOp.Operator.GREATER;
            case AxionParser.GREATER_EQUAL -> BinaryOp.Operator.GREATER_EQUAL;
            case AxionParser.ELEMENT_OF -> BinaryOp.Operator.ELEMENT_OF;
            case AxionParser.NOT_ELEMENT_OF -> BinaryOp.Operator.NOT_ELEMENT_OF;
            case AxionParser.SUBSET_OF -> BinaryOp.Operator.SUBSET_OF;
            default -> throw new IllegalStateException("Unexpected relational token: " + op.getText());
        };
    }
}
