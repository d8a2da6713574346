package org.axion.engine.theory;

import org.axion.AxionException;

/**
 * Raised when a theory name is not registered.
 */
public class UnknownTheoryException extends AxionException {

    private final String theory;

    public UnknownTheoryException(String theory) {
        super("Unknown theory: " + theory);
        this.theory = theory;
    }

    public String getTheory() {
        return theory;
    }
}
