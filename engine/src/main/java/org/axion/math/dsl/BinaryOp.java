package org.axion.math.dsl;

import java.util.Objects;

/**
 * Infix operator applied to two operands.
 *
 * Covers arithmetic (+, -, *, /, ^), relations (=, ≠, <, ≤, >, ≥, ∈, ∉, ⊆)
 * and connectives (∧, ∨, ⟹, ⟺).
 *
 * @param operator The operator
 * @param left     The left operand
 * @param right    The right operand
 */
public record BinaryOp(Operator operator, Expression left, Expression right) implements Expression {

    public enum Category {
        ARITHMETIC,
        RELATIONAL,
        LOGICAL
    }

    /**
     * Operators with their canonical symbol and binding strength. A higher
     * precedence binds tighter.
     */
    public enum Operator {
        POWER("^", 10, true, Category.ARITHMETIC),
        MULTIPLY("*", 8, false, Category.ARITHMETIC),
        DIVIDE("/", 8, false, Category.ARITHMETIC),
        ADD("+", 7, false, Category.ARITHMETIC),
        SUBTRACT("-", 7, false, Category.ARITHMETIC),
        EQUALS("=", 6, false, Category.RELATIONAL),
        NOT_EQUALS("≠", 6, false, Category.RELATIONAL),
        LESS("<", 6, false, Category.RELATIONAL),
        LESS_EQUAL("≤", 6, false, Category.RELATIONAL),
        GREATER(">", 6, false, Category.RELATIONAL),
        GREATER_EQUAL("≥", 6, false, Category.RELATIONAL),
        ELEMENT_OF("∈", 6, false, Category.RELATIONAL),
        NOT_ELEMENT_OF("∉", 6, false, Category.RELATIONAL),
        SUBSET_OF("⊆", 6, false, Category.RELATIONAL),
        AND("∧", 4, false, Category.LOGICAL),
        OR("∨", 3, false, Category.LOGICAL),
        IMPLIES("⟹", 2, true, Category.LOGICAL),
        IFF("⟺", 1, false, Category.LOGICAL);

        private final String symbol;
        private final int precedence;
        private final boolean rightAssociative;
        private final Category category;

        Operator(String symbol, int precedence, boolean rightAssociative, Category category) {
            this.symbol = symbol;
            this.precedence = precedence;
            this.rightAssociative = rightAssociative;
            this.category = category;
        }

        public String symbol() {
            return symbol;
        }

        public int precedence() {
            return precedence;
        }

        public boolean isRightAssociative() {
            return rightAssociative;
        }

        public Category category() {
            return category;
        }

        public boolean isArithmetic() {
            return category == Category.ARITHMETIC;
        }
    }

    public BinaryOp {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    public static BinaryOp add(Expression left, Expression right) {
        return new BinaryOp(Operator.ADD, left, right);
    }

    public static BinaryOp subtract(Expression left, Expression right) {
        return new BinaryOp(Operator.SUBTRACT, left, right);
    }

    public static BinaryOp multiply(Expression left, Expression right) {
        return new BinaryOp(Operator.MULTIPLY, left, right);
    }

    public static BinaryOp divide(Expression left, Expression right) {
        return new BinaryOp(Operator.DIVIDE, left, right);
    }

    public static BinaryOp power(Expression base, Expression exponent) {
        return new BinaryOp(Operator.POWER, base, exponent);
    }

    public static BinaryOp equalTo(Expression left, Expression right) {
        return new BinaryOp(Operator.EQUALS, left, right);
    }

    public static BinaryOp and(Expression left, Expression right) {
        return new BinaryOp(Operator.AND, left, right);
    }

    public static BinaryOp or(Expression left, Expression right) {
        return new BinaryOp(Operator.OR, left, right);
    }

    public static BinaryOp implies(Expression antecedent, Expression consequent) {
        return new BinaryOp(Operator.IMPLIES, antecedent, consequent);
    }

    public boolean is(Operator candidate) {
        return operator == candidate;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public String toString() {
        return ExpressionPrinter.print(this);
    }
}
