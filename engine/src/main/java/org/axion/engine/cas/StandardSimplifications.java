package org.axion.engine.cas;

import org.axion.math.dsl.BinaryOp;
import org.axion.math.dsl.Constant;
import org.axion.math.dsl.Expression;
import org.axion.math.dsl.UnaryOp;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * The default simplification rule set, in the order the simplifier tries
 * them at each node.
 *
 * Numbers are kept exact: non-integer literals become reduced fractions of
 * integer literals, and a rational coefficient {@code p/q * t} is written
 * {@code (p*t)/q}.
 *
 * Only these identities are applied. In particular like terms are not
 * collected: {@code x + x} stays as it is.
 */
public enum StandardSimplifications implements Simplification {

    /** {@code 2 + 3 -> 5}, {@code 2*3 -> 6}, {@code 2^3 -> 8}, {@code -(2) -> -2} */
    CONSTANT_FOLDING {
        @Override
        public Optional<Expression> apply(Expression node) {
            if (node instanceof UnaryOp u && u.operator() == UnaryOp.Operator.NEGATE) {
                Constant c = numeric(u.operand());
                return c != null ? Optional.of(c.negate()) : Optional.empty();
            }
            if (!(node instanceof BinaryOp b)) {
                return Optional.empty();
            }
            Constant left = numeric(b.left());
            Constant right = numeric(b.right());
            if (left == null || right == null) {
                return Optional.empty();
            }
            return switch (b.operator()) {
                case ADD -> Optional.of(Constant.of(left.value().add(right.value())));
                case SUBTRACT -> Optional.of(Constant.of(left.value().subtract(right.value())));
                case MULTIPLY -> Optional.of(Constant.of(left.value().multiply(right.value())));
                case POWER -> foldPower(left, right);
                default -> Optional.empty();
            };
        }

        private Optional<Expression> foldPower(Constant base, Constant exponent) {
            if (!exponent.isInteger() || exponent.isNegative()
                    || exponent.value().compareTo(MAX_FOLDED_EXPONENT) > 0) {
                return Optional.empty();
            }
            return Optional.of(Constant.of(base.value().pow(exponent.value().intValueExact())));
        }
    },

    /** {@code 0.25 -> 1/4}; non-integer literals are kept as exact fractions */
    DECIMAL_TO_FRACTION {
        @Override
        public Optional<Expression> apply(Expression node) {
            Constant c = numeric(node);
            if (c == null || c.isInteger()) {
                return Optional.empty();
            }
            return Optional.of(Rational.of(c.value()).toExpression());
        }
    },

    /** {@code 6/4 -> 3/2}, {@code 6/3 -> 2}, {@code (6*t)/3 -> 2*t} */
    FRACTION_REDUCTION {
        @Override
        public Optional<Expression> apply(Expression node) {
            if (!(node instanceof BinaryOp b) || !b.is(BinaryOp.Operator.DIVIDE)) {
                return Optional.empty();
            }
            Constant denominator = numeric(b.right());
            if (denominator == null || !denominator.isInteger() || denominator.isZero()) {
                return Optional.empty();
            }
            Constant numerator = numeric(b.left());
            if (numerator != null && numerator.isInteger()) {
                return reduce(numerator.integerValue(), denominator.integerValue(), null);
            }
            if (b.left() instanceof BinaryOp product && product.is(BinaryOp.Operator.MULTIPLY)) {
                Constant coefficient = numeric(product.left());
                if (coefficient != null && coefficient.isInteger()) {
                    return reduce(coefficient.integerValue(), denominator.integerValue(), product.right());
                }
            }
            return Optional.empty();
        }

        private Optional<Expression> reduce(BigInteger numerator, BigInteger denominator, Expression factor) {
            BigInteger gcd = numerator.gcd(denominator);
            if (denominator.signum() < 0) {
                gcd = gcd.negate();
            }
            if (gcd.equals(BigInteger.ONE)) {
                return Optional.empty();
            }
            Expression top = factor == null
                    ? Constant.of(numerator.divide(gcd))
                    : BinaryOp.multiply(Constant.of(numerator.divide(gcd)), factor);
            BigInteger bottom = denominator.divide(gcd);
            return Optional.of(bottom.equals(BigInteger.ONE) ? top : BinaryOp.divide(top, Constant.of(bottom)));
        }
    },

    /** {@code 1/2 + 1/3 -> 5/6}, {@code (1/2)^2 -> 1/4}, {@code -(1/2) -> -1/2} */
    RATIONAL_ARITHMETIC {
        @Override
        public Optional<Expression> apply(Expression node) {
            if (node instanceof UnaryOp u && u.operator() == UnaryOp.Operator.NEGATE
                    && Rational.isQuotient(u.operand())) {
                return Rational.of(u.operand()).map(r -> r.negate().toExpression());
            }
            if (!(node instanceof BinaryOp b)
                    || !(Rational.isQuotient(b.left()) || Rational.isQuotient(b.right()))) {
                return Optional.empty();
            }
            Optional<Rational> left = Rational.of(b.left());
            Optional<Rational> right = Rational.of(b.right());
            if (left.isEmpty() || right.isEmpty()) {
                return Optional.empty();
            }
            Rational l = left.get();
            Rational r = right.get();
            return switch (b.operator()) {
                case ADD -> Optional.of(l.add(r).toExpression());
                case SUBTRACT -> Optional.of(l.subtract(r).toExpression());
                case MULTIPLY -> Optional.of(l.multiply(r).toExpression());
                case DIVIDE -> r.isZero() ? Optional.empty() : Optional.of(l.divide(r).toExpression());
                case POWER -> r.isInteger() && r.numerator().signum() >= 0
                        && r.numerator().compareTo(MAX_FOLDED_EXPONENT.toBigInteger()) <= 0
                        ? Optional.of(l.pow(r.numerator().intValueExact()).toExpression())
                        : Optional.empty();
                default -> Optional.empty();
            };
        }
    },

    /** {@code (t/2)/3 -> t/6} */
    NESTED_QUOTIENT {
        @Override
        public Optional<Expression> apply(Expression node) {
            if (node instanceof BinaryOp outer && outer.is(BinaryOp.Operator.DIVIDE)
                    && outer.left() instanceof BinaryOp inner && inner.is(BinaryOp.Operator.DIVIDE)) {
                Constant first = numeric(inner.right());
                Constant second = numeric(outer.right());
                if (first != null && second != null && !first.isZero() && !second.isZero()) {
                    return Optional.of(BinaryOp.divide(inner.left(),
                            Constant.of(first.value().multiply(second.value()))));
                }
            }
            return Optional.empty();
        }
    },

    /** {@code x + 0 -> x}, {@code 0 + x -> x} */
    ADD_ZERO {
        @Override
        public Optional<Expression> apply(Expression node) {
            if (node instanceof BinaryOp b && b.is(BinaryOp.Operator.ADD)) {
                if (isZero(b.right())) {
                    return Optional.of(b.left());
                }
                if (isZero(b.left())) {
                    return Optional.of(b.right());
                }
            }
            return Optional.empty();
        }
    },

    /** {@code x - 0 -> x}, {@code 0 - x -> -x} */
    SUBTRACT_ZERO {
        @Override
        public Optional<Expression> apply(Expression node) {
            if (node instanceof BinaryOp b && b.is(BinaryOp.Operator.SUBTRACT)) {
                if (isZero(b.right())) {
                    return Optional.of(b.left());
                }
                if (isZero(b.left())) {
                    return Optional.of(UnaryOp.negate(b.right()));
                }
            }
            return Optional.empty();
        }
    },

    /** {@code x - x -> 0} */
    SUBTRACT_SELF {
        @Override
        public Optional<Expression> apply(Expression node) {
            if (node instanceof BinaryOp b && b.is(BinaryOp.Operator.SUBTRACT) && b.left().equals(b.right())) {
                return Optional.of(Constant.ZERO);
            }
            return Optional.empty();
        }
    },

    /** {@code x*0 -> 0}, {@code 0*x -> 0} */
    MULTIPLY_ZERO {
        @Override
        public Optional<Expression> apply(Expression node) {
            if (node instanceof BinaryOp b && b.is(BinaryOp.Operator.MULTIPLY)
                    && (isZero(b.left()) || isZero(b.right()))) {
                return Optional.of(Constant.ZERO);
            }
            return Optional.empty();
        }
    },

    /** {@code x*1 -> x}, {@code 1*x -> x} */
    MULTIPLY_ONE {
        @Override
        public Optional<Expression> apply(Expression node) {
            if (node instanceof BinaryOp b && b.is(BinaryOp.Operator.MULTIPLY)) {
                if (isOne(b.right())) {
                    return Optional.of(b.left());
                }
                if (isOne(b.left())) {
                    return Optional.of(b.right());
                }
            }
            return Optional.empty();
        }
    },

    /** {@code x/1 -> x} */
    DIVIDE_ONE {
        @Override
        public Optional<Expression> apply(Expression node) {
            if (node instanceof BinaryOp b && b.is(BinaryOp.Operator.DIVIDE) && isOne(b.right())) {
                return Optional.of(b.left());
            }
            return Optional.empty();
        }
    },

    /** {@code x/x -> 1} unless x is the literal 0 */
    DIVIDE_SELF {
        @Override
        public Optional<Expression> apply(Expression node) {
            if (node instanceof BinaryOp b && b.is(BinaryOp.Operator.DIVIDE)
                    && b.left().equals(b.right()) && !isZero(b.left())) {
                return Optional.of(Constant.ONE);
            }
            return Optional.empty();
        }
    },

    /** {@code x^0 -> 1} */
    POWER_ZERO {
        @Override
        public Optional<Expression> apply(Expression node) {
            if (node instanceof BinaryOp b && b.is(BinaryOp.Operator.POWER) && isZero(b.right())) {
                return Optional.of(Constant.ONE);
            }
            return Optional.empty();
        }
    },

    /** {@code x^1 -> x} */
    POWER_ONE {
        @Override
        public Optional<Expression> apply(Expression node) {
            if (node instanceof BinaryOp b && b.is(BinaryOp.Operator.POWER) && isOne(b.right())) {
                return Optional.of(b.left());
            }
            return Optional.empty();
        }
    },

    /** {@code --x -> x} */
    DOUBLE_NEGATION {
        @Override
        public Optional<Expression> apply(Expression node) {
            return unwrapTwice(node, UnaryOp.Operator.NEGATE);
        }
    },

    /** {@code ¬¬P -> P} */
    DOUBLE_NOT {
        @Override
        public Optional<Expression> apply(Expression node) {
            return unwrapTwice(node, UnaryOp.Operator.NOT);
        }
    },

    /** {@code t*2 -> 2*t} */
    CONSTANT_FIRST {
        @Override
        public Optional<Expression> apply(Expression node) {
            if (node instanceof BinaryOp b && b.is(BinaryOp.Operator.MULTIPLY)
                    && Rational.of(b.right()).isPresent() && Rational.of(b.left()).isEmpty()) {
                return Optional.of(BinaryOp.multiply(b.right(), b.left()));
            }
            return Optional.empty();
        }
    },

    /** {@code 3*(4*t) -> 12*t} */
    MERGE_COEFFICIENTS {
        @Override
        public Optional<Expression> apply(Expression node) {
            if (node instanceof BinaryOp b && b.is(BinaryOp.Operator.MULTIPLY)
                    && b.right() instanceof BinaryOp inner && inner.is(BinaryOp.Operator.MULTIPLY)) {
                Constant outer = numeric(b.left());
                Constant nested = numeric(inner.left());
                if (outer != null && nested != null) {
                    return Optional.of(BinaryOp.multiply(
                            Constant.of(outer.value().multiply(nested.value())), inner.right()));
                }
            }
            return Optional.empty();
        }
    },

    /** {@code 2*(t/3) -> (2*t)/3} */
    COEFFICIENT_OVER_QUOTIENT {
        @Override
        public Optional<Expression> apply(Expression node) {
            if (node instanceof BinaryOp b && b.is(BinaryOp.Operator.MULTIPLY) && numeric(b.left()) != null
                    && b.right() instanceof BinaryOp quotient && quotient.is(BinaryOp.Operator.DIVIDE)) {
                return Optional.of(BinaryOp.divide(
                        BinaryOp.multiply(b.left(), quotient.left()), quotient.right()));
            }
            return Optional.empty();
        }
    },

    /** {@code -(2*t) -> -2*t} */
    NEGATED_COEFFICIENT {
        @Override
        public Optional<Expression> apply(Expression node) {
            if (node instanceof UnaryOp u && u.operator() == UnaryOp.Operator.NEGATE
                    && u.operand() instanceof BinaryOp b && b.is(BinaryOp.Operator.MULTIPLY)) {
                Constant coefficient = numeric(b.left());
                if (coefficient != null) {
                    return Optional.of(BinaryOp.multiply(coefficient.negate(), b.right()));
                }
            }
            return Optional.empty();
        }
    },

    /** {@code (1/2)*t -> (1*t)/2} */
    RATIONAL_COEFFICIENT {
        @Override
        public Optional<Expression> apply(Expression node) {
            if (node instanceof BinaryOp b && b.is(BinaryOp.Operator.MULTIPLY)
                    && Rational.isQuotient(b.left()) && Rational.of(b.right()).isEmpty()) {
                BinaryOp quotient = (BinaryOp) b.left();
                return Optional.of(BinaryOp.divide(
                        BinaryOp.multiply(quotient.left(), b.right()), quotient.right()));
            }
            return Optional.empty();
        }
    },

    /** {@code t/(1/2) -> (2*t)/1} */
    RATIONAL_DIVISOR {
        @Override
        public Optional<Expression> apply(Expression node) {
            if (!(node instanceof BinaryOp b) || !b.is(BinaryOp.Operator.DIVIDE)
                    || !Rational.isQuotient(b.right()) || Rational.of(b.left()).isPresent()) {
                return Optional.empty();
            }
            Rational divisor = Rational.of(b.right()).orElseThrow();
            if (divisor.isZero()) {
                return Optional.empty();
            }
            BigInteger top = divisor.denominator();
            BigInteger bottom = divisor.numerator();
            if (bottom.signum() < 0) {
                top = top.negate();
                bottom = bottom.negate();
            }
            return Optional.of(BinaryOp.divide(
                    BinaryOp.multiply(Constant.of(top), b.left()), Constant.of(bottom)));
        }
    };

    private static final BigDecimal MAX_FOLDED_EXPONENT = BigDecimal.valueOf(64);

    /**
     * All rules in declaration order.
     */
    public static List<Simplification> all() {
        return List.of(values());
    }

    static Constant numeric(Expression expression) {
        return expression instanceof Constant c && c.isNumeric() ? c : null;
    }

    private static boolean isZero(Expression expression) {
        return expression instanceof Constant c && c.isZero();
    }

    private static boolean isOne(Expression expression) {
        return expression instanceof Constant c && c.isOne();
    }

    private static Optional<Expression> unwrapTwice(Expression node, UnaryOp.Operator operator) {
        if (node instanceof UnaryOp outer && outer.operator() == operator
                && outer.operand() instanceof UnaryOp inner && inner.operator() == operator) {
            return Optional.of(inner.operand());
        }
        return Optional.empty();
    }
}
