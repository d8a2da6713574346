package org.axion.engine.kernel;

/**
 * A step cites a premise index that is negative or not smaller than its own.
 */
public class InvalidPremiseReferenceException extends ProofConstructionException {

    private final int premise;

    public InvalidPremiseReferenceException(int stepIndex, int premise) {
        super(stepIndex, "premise " + premise + " does not refer to an earlier step");
        this.premise = premise;
    }

    public int getPremise() {
        return premise;
    }
}
