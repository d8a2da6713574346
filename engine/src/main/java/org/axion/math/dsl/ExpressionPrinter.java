package org.axion.math.dsl;

import java.util.stream.Collectors;

/**
 * Canonical printer for expressions.
 *
 * Emits the minimal parenthesization implied by the operator precedence
 * table, so that {@code ExpressionParser.parse(print(e))} is structurally
 * equal to {@code e} for every parsed expression. Products, quotients and
 * powers are printed without spaces ({@code 12*x^2}, {@code x^3/3}); every
 * other infix operator is surrounded by single spaces.
 */
public final class ExpressionPrinter implements ExpressionVisitor<String> {

    private static final ExpressionPrinter INSTANCE = new ExpressionPrinter();

    private static final int ATOM = 11;
    private static final int QUANTIFIER = 0;

    private ExpressionPrinter() {
    }

    public static String print(Expression expression) {
        return expression.accept(INSTANCE);
    }

    @Override
    public String visitVariable(Variable variable) {
        return variable.name();
    }

    @Override
    public String visitConstant(Constant constant) {
        return constant.text();
    }

    @Override
    public String visitUnary(UnaryOp unary) {
        Expression operand = unary.operand();
        String inner = operand.accept(this);
        // -(2) keeps the negation node; a bare -2 would read back as a negative literal
        if (unary.operator() == UnaryOp.Operator.NEGATE
                && operand instanceof Constant c && c.isNumeric() && !c.isNegative()) {
            return "-(" + inner + ")";
        }
        if (precedence(operand) < unary.operator().precedence()) {
            inner = "(" + inner + ")";
        }
        return unary.operator().symbol() + inner;
    }

    @Override
    public String visitBinary(BinaryOp binary) {
        BinaryOp.Operator op = binary.operator();
        String left = operand(binary.left(), op, true);
        String right = operand(binary.right(), op, false);
        return switch (op) {
            case MULTIPLY, DIVIDE, POWER -> left + op.symbol() + right;
            default -> left + " " + op.symbol() + " " + right;
        };
    }

    @Override
    public String visitApplication(Application application) {
        return application.functor() + application.arguments().stream()
                .map(arg -> arg.accept(this))
                .collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String visitQuantified(Quantified quantified) {
        return quantified.kind().symbol() + quantified.variable().name() + ": "
                + quantified.body().accept(this);
    }

    private String operand(Expression child, BinaryOp.Operator parent, boolean leftSide) {
        String text = child.accept(this);
        int childPrecedence = precedence(child);
        boolean parens = childPrecedence < parent.precedence()
                || (childPrecedence == parent.precedence() && child instanceof BinaryOp
                        && leftSide == parent.isRightAssociative());
        return parens ? "(" + text + ")" : text;
    }

    static int precedence(Expression expression) {
        if (expression instanceof BinaryOp b) {
            return b.operator().precedence();
        }
        if (expression instanceof UnaryOp u) {
            return u.operator().precedence();
        }
        if (expression instanceof Quantified) {
            return QUANTIFIER;
        }
        if (expression instanceof Constant c && c.isNegative()) {
            return UnaryOp.Operator.NEGATE.precedence();
        }
        return ATOM;
    }
}
