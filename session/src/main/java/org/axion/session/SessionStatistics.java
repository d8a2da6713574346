package org.axion.session;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Aggregate figures over the proofs in a session.
 *
 * @param totalProofs    Number of proofs held
 * @param validProofs    Number of those that validated
 * @param theoriesUsed   Theories with at least one proof, sorted
 * @param uniqueTheorems Number of distinct theorems
 * @param mostUsedAxioms Up to five axioms with the most citing proofs, most used first
 */
public record SessionStatistics(
        int totalProofs,
        int validProofs,
        Set<String> theoriesUsed,
        int uniqueTheorems,
        List<AxiomUsage> mostUsedAxioms) {

    public SessionStatistics {
        theoriesUsed = Collections.unmodifiableSet(new TreeSet<>(theoriesUsed));
        mostUsedAxioms = List.copyOf(mostUsedAxioms);
    }

    /**
     * @param axiom Qualified axiom name
     * @param count Number of proofs citing it
     */
    public record AxiomUsage(String axiom, long count) {
    }
}
