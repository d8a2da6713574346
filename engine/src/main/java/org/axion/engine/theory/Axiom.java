package org.axion.engine.theory;

import org.axion.math.dsl.Expression;
import org.axion.math.dsl.ExpressionPrinter;

import java.util.Objects;

/**
 * A named axiom together with the theory that declares it.
 *
 * @param theory    The declaring theory
 * @param name      The axiom name, unique within its theory
 * @param statement The parsed statement
 */
public record Axiom(String theory, String name, Expression statement) {

    public Axiom {
        Objects.requireNonNull(theory, "Theory cannot be null");
        Objects.requireNonNull(name, "Axiom name cannot be null");
        Objects.requireNonNull(statement, "Statement cannot be null");
    }

    /**
     * @return {@code Theory.name}, the form recorded in a proof's axioms used
     */
    public String qualifiedName() {
        return theory + "." + name;
    }

    public String text() {
        return ExpressionPrinter.print(statement);
    }
}
