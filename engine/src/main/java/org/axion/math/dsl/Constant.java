package org.axion.math.dsl;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Set;

/**
 * A literal: either an exact number or one of the symbolic constants
 * (ℕ, ℤ, ℚ, ℝ, ℂ, ∅).
 *
 * Numeric values are normalized on construction so that {@code 2}, {@code 2.0}
 * and {@code 2.00} are the same constant.
 *
 * @param value  The numeric value, or null for a symbolic constant
 * @param symbol The symbol, or null for a numeric constant
 */
public record Constant(BigDecimal value, String symbol) implements Expression {

    public static final Set<String> SYMBOLS = Set.of("ℕ", "ℤ", "ℚ", "ℝ", "ℂ", "∅");

    public static final Constant ZERO = of(0);
    public static final Constant ONE = of(1);

    public Constant {
        if ((value == null) == (symbol == null)) {
            throw new IllegalArgumentException("Constant must be either numeric or symbolic");
        }
        if (value != null) {
            value = normalize(value);
        } else if (!SYMBOLS.contains(symbol)) {
            throw new IllegalArgumentException("Unknown symbolic constant: " + symbol);
        }
    }

    public static Constant of(long value) {
        return new Constant(BigDecimal.valueOf(value), null);
    }

    public static Constant of(BigInteger value) {
        return new Constant(new BigDecimal(value), null);
    }

    public static Constant of(BigDecimal value) {
        return new Constant(value, null);
    }

    public static Constant symbol(String symbol) {
        return new Constant(null, symbol);
    }

    /**
     * Parses a numeric literal as written in source text (e.g. "42", "3.50").
     */
    public static Constant parse(String literal) {
        return of(new BigDecimal(literal));
    }

    private static BigDecimal normalize(BigDecimal raw) {
        BigDecimal stripped = raw.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    public boolean isNumeric() {
        return value != null;
    }

    public boolean isInteger() {
        return value != null && value.scale() <= 0;
    }

    public boolean isZero() {
        return value != null && value.signum() == 0;
    }

    public boolean isOne() {
        return value != null && value.compareTo(BigDecimal.ONE) == 0;
    }

    public boolean isNegative() {
        return value != null && value.signum() < 0;
    }

    /**
     * @return The value as an exact integer
     * @throws ArithmeticException if this constant is not an integer
     */
    public BigInteger integerValue() {
        if (!isInteger()) {
            throw new ArithmeticException("Not an integer constant: " + this);
        }
        return value.toBigIntegerExact();
    }

    public Constant negate() {
        if (value == null) {
            throw new ArithmeticException("Cannot negate symbolic constant " + symbol);
        }
        return of(value.negate());
    }

    /**
     * @return The literal text: the plain decimal form or the symbol
     */
    public String text() {
        return value != null ? value.toPlainString() : symbol;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public String toString() {
        return text();
    }
}
