package org.axion.engine.theory;

import org.axion.math.dsl.Expression;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only access to the theories a proof may draw axioms from.
 *
 * Lookups that resolve axioms consult the named theory first and then its
 * dependencies, transitively, breadth first in declaration order. Missing
 * dependency names and cycles are ignored.
 */
public interface TheoryRegistry {

    Optional<Theory> getTheory(String name);

    /**
     * @return All registered theory names in registration order
     */
    List<String> listTheories();

    /**
     * The theory and everything it depends on, nearest first.
     */
    default List<Theory> closure(String theoryName) {
        List<Theory> result = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(theoryName);
        while (!queue.isEmpty()) {
            String next = queue.poll();
            if (!seen.add(next)) {
                continue;
            }
            Optional<Theory> theory = getTheory(next);
            if (theory.isPresent()) {
                result.add(theory.get());
                queue.addAll(theory.get().dependencies());
            }
        }
        return result;
    }

    /**
     * Finds an axiom by name in the theory or one of its dependencies.
     */
    default Optional<Axiom> lookup(String theoryName, String axiomName) {
        for (Theory theory : closure(theoryName)) {
            Optional<Expression> statement = theory.axiom(axiomName);
            if (statement.isPresent()) {
                return Optional.of(new Axiom(theory.name(), axiomName, statement.get()));
            }
        }
        return Optional.empty();
    }

    /**
     * Finds the first axiom, in lookup order, structurally equal to the
     * statement.
     */
    default Optional<Axiom> findAxiom(String theoryName, Expression statement) {
        for (Theory theory : closure(theoryName)) {
            for (Axiom axiom : theory.axiomList()) {
                if (axiom.statement().equals(statement)) {
                    return Optional.of(axiom);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Axioms declared by the theory itself, in declaration order.
     *
     * @throws UnknownTheoryException if the theory is not registered
     */
    default List<Axiom> listAxioms(String theoryName) {
        return getTheory(theoryName)
                .orElseThrow(() -> new UnknownTheoryException(theoryName))
                .axiomList();
    }
}
