package org.axion.math.dsl;

/**
 * Visitor interface for traversing Expression trees.
 *
 * @param <T> The return type of the visitor methods
 */
public interface ExpressionVisitor<T> {

    T visitVariable(Variable variable);

    T visitConstant(Constant constant);

    T visitUnary(UnaryOp unary);

    T visitBinary(BinaryOp binary);

    T visitApplication(Application application);

    T visitQuantified(Quantified quantified);
}
