package org.axion.math.dsl;

import java.util.Objects;

/**
 * Prefix operator applied to a single operand: arithmetic negation (-x) or
 * logical negation (¬P).
 *
 * @param operator The operator
 * @param operand  The operand
 */
public record UnaryOp(Operator operator, Expression operand) implements Expression {

    public enum Operator {
        NEGATE("-", 9),
        NOT("¬", 5);

        private final String symbol;
        private final int precedence;

        Operator(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public String symbol() {
            return symbol;
        }

        public int precedence() {
            return precedence;
        }
    }

    public UnaryOp {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    public static UnaryOp negate(Expression operand) {
        return new UnaryOp(Operator.NEGATE, operand);
    }

    public static UnaryOp not(Expression operand) {
        return new UnaryOp(Operator.NOT, operand);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public String toString() {
        return ExpressionPrinter.print(this);
    }
}
