package org.axion.engine.kernel;

import org.axion.AxionException;

/**
 * Base class for rejections raised while appending a step to a proof. Each
 * names the index the rejected step would have had.
 */
public class ProofConstructionException extends AxionException {

    private final int stepIndex;

    public ProofConstructionException(int stepIndex, String message) {
        super("Step " + stepIndex + ": " + message);
        this.stepIndex = stepIndex;
    }

    public ProofConstructionException(int stepIndex, String message, Throwable cause) {
        super("Step " + stepIndex + ": " + message, cause);
        this.stepIndex = stepIndex;
    }

    public int getStepIndex() {
        return stepIndex;
    }
}
