package org.axion.math.dsl;

import java.util.Objects;

/**
 * A named variable: a term variable (x, n) or a propositional one (P, Q).
 *
 * @param name The identifier as written in the source text
 */
public record Variable(String name) implements Expression {

    public Variable {
        Objects.requireNonNull(name, "Variable name cannot be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Variable name cannot be empty");
        }
    }

    public static Variable of(String name) {
        return new Variable(name);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
