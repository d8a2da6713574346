package org.axion.engine.serialization;

import org.axion.math.dsl.Application;
import org.axion.math.dsl.BinaryOp;
import org.axion.math.dsl.Constant;
import org.axion.math.dsl.Expression;
import org.axion.math.dsl.ExpressionVisitor;
import org.axion.math.dsl.Quantified;
import org.axion.math.dsl.UnaryOp;
import org.axion.math.dsl.Variable;

/**
 * Fixed textual encoding of expression trees used inside hash payloads.
 *
 * Every node becomes a prefix S-expression tagged with its kind, and every
 * name or literal is quoted, so the encoding depends only on the tree shape
 * and never on printer precedence rules or operator spellings:
 * <pre>
 * ∀x: x + 1 = S(x)   →   (FORALL "x" (EQUALS (ADD (var "x") (num "1")) (app "S" (var "x"))))
 * </pre>
 */
public final class CanonicalEncoder implements ExpressionVisitor<String> {

    private static final CanonicalEncoder INSTANCE = new CanonicalEncoder();

    private CanonicalEncoder() {
    }

    public static String encode(Expression expression) {
        return expression.accept(INSTANCE);
    }

    @Override
    public String visitVariable(Variable variable) {
        return "(var " + quote(variable.name()) + ")";
    }

    @Override
    public String visitConstant(Constant constant) {
        return constant.isNumeric()
                ? "(num " + quote(constant.value().toPlainString()) + ")"
                : "(sym " + quote(constant.symbol()) + ")";
    }

    @Override
    public String visitUnary(UnaryOp unary) {
        return "(" + unary.operator().name() + " " + unary.operand().accept(this) + ")";
    }

    @Override
    public String visitBinary(BinaryOp binary) {
        return "(" + binary.operator().name() + " " + binary.left().accept(this)
                + " " + binary.right().accept(this) + ")";
    }

    @Override
    public String visitApplication(Application application) {
        StringBuilder sb = new StringBuilder("(app ").append(quote(application.functor()));
        for (Expression argument : application.arguments()) {
            sb.append(' ').append(argument.accept(this));
        }
        return sb.append(')').toString();
    }

    @Override
    public String visitQuantified(Quantified quantified) {
        return "(" + quantified.kind().name() + " " + quote(quantified.variable().name())
                + " " + quantified.body().accept(this) + ")";
    }

    private static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
