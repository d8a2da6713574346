package org.axion.engine.cas;

import org.axion.AxionException;

/**
 * Raised when simplification has not reached a fixed point within the
 * configured number of passes.
 */
public class EngineLimitExceededException extends AxionException {

    private final int iterations;

    public EngineLimitExceededException(int iterations) {
        super("Simplification did not converge within " + iterations + " iterations");
        this.iterations = iterations;
    }

    public int getIterations() {
        return iterations;
    }
}
