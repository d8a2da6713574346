package org.axion.math.dsl;

import java.util.Objects;

/**
 * A quantifier binding one variable over a body: ∀x: φ or ∃x: φ.
 *
 * Multi-variable binders such as {@code ∀x, y: φ} are represented as nested
 * Quantified nodes with the left-most variable outermost.
 *
 * @param kind     Universal or existential
 * @param variable The bound variable
 * @param body     The quantified formula
 */
public record Quantified(Kind kind, Variable variable, Expression body) implements Expression {

    public enum Kind {
        FORALL("∀"),
        EXISTS("∃");

        private final String symbol;

        Kind(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    public Quantified {
        Objects.requireNonNull(kind, "Quantifier kind cannot be null");
        Objects.requireNonNull(variable, "Bound variable cannot be null");
        Objects.requireNonNull(body, "Body cannot be null");
    }

    public static Quantified forAll(Variable variable, Expression body) {
        return new Quantified(Kind.FORALL, variable, body);
    }

    public static Quantified exists(Variable variable, Expression body) {
        return new Quantified(Kind.EXISTS, variable, body);
    }

    public boolean isUniversal() {
        return kind == Kind.FORALL;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitQuantified(this);
    }

    @Override
    public String toString() {
        return ExpressionPrinter.print(this);
    }
}
