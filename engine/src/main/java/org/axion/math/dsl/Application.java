package org.axion.math.dsl;

import java.util.List;
import java.util.Objects;

/**
 * Function or predicate application: S(n), deg(v), gcd(a, b), P(x).
 *
 * @param functor   The function or predicate name
 * @param arguments The ordered arguments
 */
public record Application(String functor, List<Expression> arguments) implements Expression {

    public Application {
        Objects.requireNonNull(functor, "Functor cannot be null");
        Objects.requireNonNull(arguments, "Arguments cannot be null");
        arguments = List.copyOf(arguments);
    }

    public static Application of(String functor, Expression... arguments) {
        return new Application(functor, List.of(arguments));
    }

    public int arity() {
        return arguments.size();
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitApplication(this);
    }

    @Override
    public String toString() {
        return ExpressionPrinter.print(this);
    }
}
