package org.axion.math.dsl;

/**
 * Sealed interface representing a mathematical statement or term.
 *
 * Type hierarchy:
 * Expression
 * ├── Variable (x, P, n)
 * ├── Constant (2, 3.5, ℕ, ∅)
 * ├── UnaryOp (-x, ¬P)
 * ├── BinaryOp (x + 1, P ⟹ Q, n ∈ ℕ)
 * ├── Application (S(n), deg(v), sin(x))
 * └── Quantified (∀x: φ, ∃y: φ)
 *
 * Expressions are values: equality is structural and no node is ever
 * mutated. Every transformation builds a new tree.
 */
public sealed interface Expression
        permits Variable, Constant, UnaryOp, BinaryOp, Application, Quantified {

    /**
     * Accept method for the expression visitor pattern.
     *
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this expression
     */
    <T> T accept(ExpressionVisitor<T> visitor);
}
