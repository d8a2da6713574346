package org.axion.engine.theory;

import org.axion.AxionException;
import org.axion.math.dsl.Expression;
import org.axion.math.dsl.ExpressionParseException;
import org.axion.math.dsl.ExpressionParser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable collection of theories.
 *
 * Axioms are written as text and parsed once when the library is built.
 * Adding a theory or an axiom returns a new library, so a library handed to
 * an inference kernel never changes underneath it.
 *
 * Example:
 * <pre>
 * AxiomLibrary library = AxiomLibrary.standard()
 *         .withAxiom("Graphs", "handshake", "∀G: sum_degrees(G) = 2*edges(G)");
 * </pre>
 */
public final class AxiomLibrary implements TheoryRegistry {

    private final Map<String, Theory> theories;

    private AxiomLibrary(Map<String, Theory> theories) {
        this.theories = Collections.unmodifiableMap(new LinkedHashMap<>(theories));
    }

    /**
     * Create a library preloaded with the standard theories.
     */
    public static AxiomLibrary standard() {
        Builder builder = builder();
        StandardTheories.registerAll(builder);
        return builder.build();
    }

    public static AxiomLibrary empty() {
        return new AxiomLibrary(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.theories.putAll(theories);
        return builder;
    }

    @Override
    public Optional<Theory> getTheory(String name) {
        return Optional.ofNullable(theories.get(name));
    }

    @Override
    public List<String> listTheories() {
        return List.copyOf(theories.keySet());
    }

    public boolean hasTheory(String name) {
        return theories.containsKey(name);
    }

    /**
     * Returns a library with the axiom added to the theory, creating the
     * theory if it does not exist yet.
     */
    public AxiomLibrary withAxiom(String theory, String axiomName, String statement) {
        return toBuilder().axiom(theory, axiomName, statement).build();
    }

    /**
     * Returns a library with the theory added, replacing any theory with the
     * same name.
     */
    public AxiomLibrary withTheory(Theory theory) {
        return toBuilder().theory(theory).build();
    }

    public static final class Builder {

        private final Map<String, Theory> theories = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder theory(Theory theory) {
            Objects.requireNonNull(theory, "Theory cannot be null");
            theories.put(theory.name(), theory);
            return this;
        }

        /**
         * Declares a theory without axioms. Axioms are added with
         * {@link #axiom(String, String, String)}.
         */
        public Builder theory(String name, String description, String reference, String... dependencies) {
            Set<String> deps = new LinkedHashSet<>(List.of(dependencies));
            return theory(new Theory(name, description, Map.of(), deps, reference));
        }

        /**
         * Parses and adds an axiom. An unknown theory is created with a
         * generic description.
         */
        public Builder axiom(String theoryName, String axiomName, String statement) {
            Expression parsed;
            try {
                parsed = ExpressionParser.parse(statement);
            } catch (ExpressionParseException e) {
                throw new AxionException("Invalid axiom " + theoryName + "." + axiomName + ": " + e.getMessage(), e);
            }
            Theory theory = theories.get(theoryName);
            if (theory == null) {
                theory = Theory.empty(theoryName, "Custom theory: " + theoryName);
            }
            theories.put(theoryName, theory.withAxiom(axiomName, parsed));
            return this;
        }

        public AxiomLibrary build() {
            return new AxiomLibrary(theories);
        }
    }
}
