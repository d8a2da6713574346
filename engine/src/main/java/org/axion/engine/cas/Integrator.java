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
 * Antiderivative with respect to one variable, limited to the direct inverses
 * of the differentiation identities: constants, sums, constant factors,
 * {@code x^n} for integer {@code n ≠ -1}, and sin, cos and exp of the bare
 * variable. Anything else is rejected; no constant of integration is added.
 */
final class Integrator implements ExpressionVisitor<Expression> {

    private final Variable variable;

    Integrator(Variable variable) {
        this.variable = variable;
    }

    Expression integrate(Expression expression) {
        if (Expressions.isFreeOf(expression, variable)) {
            return multiply(expression, variable);
        }
        return expression.accept(this);
    }

    @Override
    public Expression visitVariable(Variable v) {
        // only reached for the integration variable itself
        return divide(BinaryOp.power(variable, Constant.of(2)), Constant.of(2));
    }

    @Override
    public Expression visitConstant(Constant constant) {
        return multiply(constant, variable);
    }

    @Override
    public Expression visitUnary(UnaryOp unary) {
        if (unary.operator() != UnaryOp.Operator.NEGATE) {
            throw unsupported(unary, "not an arithmetic term");
        }
        return UnaryOp.negate(integrate(unary.operand()));
    }

    @Override
    public Expression visitBinary(BinaryOp binary) {
        Expression u = binary.left();
        Expression v = binary.right();
        switch (binary.operator()) {
            case ADD:
                return add(integrate(u), integrate(v));
            case SUBTRACT:
                return subtract(integrate(u), integrate(v));
            case MULTIPLY:
                if (Expressions.isFreeOf(u, variable)) {
                    return multiply(u, integrate(v));
                }
                if (Expressions.isFreeOf(v, variable)) {
                    return multiply(integrate(u), v);
                }
                throw unsupported(binary, "product of two factors depending on " + variable);
            case DIVIDE:
                if (Expressions.isFreeOf(v, variable)) {
                    return divide(integrate(u), v);
                }
                throw unsupported(binary, "denominator depends on " + variable);
            case POWER:
                return powerRule(binary);
            default:
                throw unsupported(binary, "not an arithmetic term");
        }
    }

    // ∫x^n = x^(n+1)/(n+1), n ≠ -1
    private Expression powerRule(BinaryOp binary) {
        if (!binary.left().equals(variable)) {
            throw unsupported(binary, "base is not the bare variable " + variable);
        }
        if (!(binary.right() instanceof Constant exponent) || !exponent.isInteger()) {
            throw unsupported(binary, "exponent is not an integer constant");
        }
        Constant raised = Constant.of(exponent.value().add(BigDecimal.ONE));
        if (raised.isZero()) {
            throw unsupported(binary, "power rule does not apply to exponent -1");
        }
        return divide(BinaryOp.power(variable, raised), raised);
    }

    @Override
    public Expression visitApplication(Application application) {
        if (application.arity() != 1 || !application.arguments().get(0).equals(variable)) {
            throw unsupported(application, "no closed-form antiderivative");
        }
        return switch (application.functor()) {
            case "sin" -> UnaryOp.negate(Application.of("cos", variable));
            case "cos" -> Application.of("sin", variable);
            case "exp" -> Application.of("exp", variable);
            default -> throw unsupported(application, "no closed-form antiderivative");
        };
    }

    @Override
    public Expression visitQuantified(Quantified quantified) {
        throw unsupported(quantified, "not an arithmetic term");
    }

    private UnsupportedRewriteException unsupported(Expression expression, String reason) {
        return new UnsupportedRewriteException(CasRule.INTEGRATE, expression, reason);
    }
}
