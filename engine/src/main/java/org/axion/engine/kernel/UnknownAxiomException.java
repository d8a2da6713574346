package org.axion.engine.kernel;

/**
 * An axiom application that matches no axiom of the theory or its
 * dependencies, or an axiom name that is not defined.
 */
public class UnknownAxiomException extends ProofConstructionException {

    public UnknownAxiomException(int stepIndex, String message) {
        super(stepIndex, message);
    }
}
