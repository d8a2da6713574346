package org.axion.engine.cas;

import org.axion.math.dsl.Application;
import org.axion.math.dsl.BinaryOp;
import org.axion.math.dsl.Constant;
import org.axion.math.dsl.Expression;
import org.axion.math.dsl.ExpressionVisitor;
import org.axion.math.dsl.Expressions;
import org.axion.math.dsl.Quantified;
import org.axion.math.dsl.UnaryOp;
import org.axion.math.dsl.Variable;

import java.math.BigDecimal;

import static org.axion.math.dsl.BinaryOp.add;
import static org.axion.math.dsl.BinaryOp.divide;
import static org.axion.math.dsl.BinaryOp.multiply;
import static org.axion.math.dsl.BinaryOp.subtract;

/**
 * Symbolic derivative with respect to one variable.
 *
 * Produces the raw result of the derivative identities; the caller is
 * expected to simplify it. Sub-expressions in which the variable does not
 * occur free are constants and differentiate to 0.
 */
final class Differentiator implements ExpressionVisitor<Expression> {

    private final Variable variable;

    Differentiator(Variable variable) {
        this.variable = variable;
    }

    Expression differentiate(Expression expression) {
        if (Expressions.isFreeOf(expression, variable)) {
            return Constant.ZERO;
        }
        return expression.accept(this);
    }

    @Override
    public Expression visitVariable(Variable v) {
        return v.equals(variable) ? Constant.ONE : Constant.ZERO;
    }

    @Override
    public Expression visitConstant(Constant constant) {
        return Constant.ZERO;
    }

    @Override
    public Expression visitUnary(UnaryOp unary) {
        if (unary.operator() != UnaryOp.Operator.NEGATE) {
            throw unsupported(unary, "not an arithmetic term");
        }
        return UnaryOp.negate(differentiate(unary.operand()));
    }

    @Override
    public Expression visitBinary(BinaryOp binary) {
        Expression u = binary.left();
        Expression v = binary.right();
        return switch (binary.operator()) {
            case ADD -> add(differentiate(u), differentiate(v));
            case SUBTRACT -> subtract(differentiate(u), differentiate(v));
            case MULTIPLY -> product(u, v);
            case DIVIDE -> quotient(u, v);
            case POWER -> powerRule(binary);
            default -> throw unsupported(binary, "not an arithmetic term");
        };
    }

    private Expression product(Expression u, Expression v) {
        if (Expressions.isFreeOf(u, variable)) {
            return multiply(u, differentiate(v));
        }
        if (Expressions.isFreeOf(v, variable)) {
            return multiply(differentiate(u), v);
        }
        return add(multiply(differentiate(u), v), multiply(u, differentiate(v)));
    }

    private Expression quotient(Expression u, Expression v) {
        if (Expressions.isFreeOf(v, variable)) {
            return divide(differentiate(u), v);
        }
        return divide(
                subtract(multiply(differentiate(u), v), multiply(u, differentiate(v))),
                BinaryOp.power(v, Constant.of(2)));
    }

    // d(u^n) = n * u^(n-1) * u'
    private Expression powerRule(BinaryOp binary) {
        Expression base = binary.left();
        Expression exponent = binary.right();
        if (!Expressions.isFreeOf(exponent, variable)) {
            throw unsupported(binary, "exponent depends on " + variable);
        }
        Expression reduced = exponent instanceof Constant c && c.isNumeric()
                ? Constant.of(c.value().subtract(BigDecimal.ONE))
                : subtract(exponent, Constant.ONE);
        return multiply(multiply(exponent, BinaryOp.power(base, reduced)), differentiate(base));
    }

    @Override
    public Expression visitApplication(Application application) {
        if (application.arity() != 1) {
            throw unsupported(application, "unknown function " + application.functor());
        }
        Expression u = application.arguments().get(0);
        Expression outer = switch (application.functor()) {
            case "sin" -> Application.of("cos", u);
            case "cos" -> UnaryOp.negate(Application.of("sin", u));
            case "exp" -> Application.of("exp", u);
            case "ln" -> divide(Constant.ONE, u);
            default -> throw unsupported(application, "unknown function " + application.functor());
        };
        return multiply(outer, differentiate(u));
    }

    @Override
    public Expression visitQuantified(Quantified quantified) {
        throw unsupported(quantified, "not an arithmetic term");
    }

    private UnsupportedRewriteException unsupported(Expression expression, String reason) {
        return new UnsupportedRewriteException(CasRule.DIFFERENTIATE, expression, reason);
    }
}
