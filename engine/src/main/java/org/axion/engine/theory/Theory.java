package org.axion.engine.theory;

import org.axion.math.dsl.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A named, read-only set of axioms plus the theories it builds on.
 * Axioms and dependencies keep their declaration order.
 *
 * @param name         Theory name, e.g. "Peano"
 * @param description  Short human-readable description
 * @param axioms       Axiom name to statement, in declaration order
 * @param dependencies Names of theories whose axioms are also available
 * @param reference    Literature reference, may be empty
 */
public record Theory(
        String name,
        String description,
        Map<String, Expression> axioms,
        Set<String> dependencies,
        String reference) {

    public Theory {
        Objects.requireNonNull(name, "Theory name cannot be null");
        description = description == null ? "" : description;
        axioms = Collections.unmodifiableMap(new LinkedHashMap<>(axioms));
        dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        reference = reference == null ? "" : reference;
    }

    public static Theory empty(String name, String description) {
        return new Theory(name, description, Map.of(), Set.of(), "");
    }

    public Optional<Expression> axiom(String axiomName) {
        return Optional.ofNullable(axioms.get(axiomName));
    }

    public List<Axiom> axiomList() {
        List<Axiom> result = new ArrayList<>(axioms.size());
        axioms.forEach((axiomName, statement) -> result.add(new Axiom(name, axiomName, statement)));
        return result;
    }

    /**
     * Returns a copy with the axiom added, or replaced if the name exists.
     */
    public Theory withAxiom(String axiomName, Expression statement) {
        Map<String, Expression> copy = new LinkedHashMap<>(axioms);
        copy.put(Objects.requireNonNull(axiomName), Objects.requireNonNull(statement));
        return new Theory(name, description, copy, dependencies, reference);
    }
}
