package org.axion.engine.cas;

import org.axion.math.dsl.BinaryOp;
import org.axion.math.dsl.Constant;
import org.axion.math.dsl.Expression;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

/**
 * Exact rational value of a numeric literal or of a quotient of two integer
 * literals. Always reduced, with a positive denominator.
 */
record Rational(BigInteger numerator, BigInteger denominator) {

    Rational {
        if (denominator.signum() == 0) {
            throw new ArithmeticException("Zero denominator");
        }
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger gcd = numerator.gcd(denominator);
        if (!gcd.equals(BigInteger.ONE)) {
            numerator = numerator.divide(gcd);
            denominator = denominator.divide(gcd);
        }
    }

    static Rational of(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            return new Rational(stripped.toBigIntegerExact(), BigInteger.ONE);
        }
        return new Rational(stripped.unscaledValue(), BigInteger.TEN.pow(stripped.scale()));
    }

    static Optional<Rational> of(Expression expression) {
        Constant c = StandardSimplifications.numeric(expression);
        if (c != null) {
            return Optional.of(of(c.value()));
        }
        if (isQuotient(expression)) {
            BinaryOp quotient = (BinaryOp) expression;
            return Optional.of(new Rational(((Constant) quotient.left()).integerValue(),
                    ((Constant) quotient.right()).integerValue()));
        }
        return Optional.empty();
    }

    /**
     * True for {@code a/b} with integer literals {@code a} and {@code b}, {@code b} non-zero.
     */
    static boolean isQuotient(Expression expression) {
        return expression instanceof BinaryOp b && b.is(BinaryOp.Operator.DIVIDE)
                && isIntegerLiteral(b.left()) && isIntegerLiteral(b.right())
                && !((Constant) b.right()).isZero();
    }

    private static boolean isIntegerLiteral(Expression expression) {
        Constant c = StandardSimplifications.numeric(expression);
        return c != null && c.isInteger();
    }

    boolean isInteger() {
        return denominator.equals(BigInteger.ONE);
    }

    boolean isZero() {
        return numerator.signum() == 0;
    }

    Rational add(Rational other) {
        return new Rational(numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
                denominator.multiply(other.denominator));
    }

    Rational subtract(Rational other) {
        return add(other.negate());
    }

    Rational multiply(Rational other) {
        return new Rational(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    Rational divide(Rational other) {
        return new Rational(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
    }

    Rational negate() {
        return new Rational(numerator.negate(), denominator);
    }

    Rational pow(int exponent) {
        return new Rational(numerator.pow(exponent), denominator.pow(exponent));
    }

    /**
     * An integer literal, or {@code p/q} as a quotient of integer literals.
     */
    Expression toExpression() {
        if (isInteger()) {
            return Constant.of(numerator);
        }
        return BinaryOp.divide(Constant.of(numerator), Constant.of(denominator));
    }
}
