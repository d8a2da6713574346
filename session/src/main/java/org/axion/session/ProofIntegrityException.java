package org.axion.session;

import org.axion.AxionException;

/**
 * A stored proof no longer matches its recorded hash or validity.
 */
public class ProofIntegrityException extends AxionException {

    private final String expectedHash;
    private final String actualHash;

    public ProofIntegrityException(String message, String expectedHash, String actualHash) {
        super(message + " (recorded " + expectedHash + ", recomputed " + actualHash + ")");
        this.expectedHash = expectedHash;
        this.actualHash = actualHash;
    }

    public String getExpectedHash() {
        return expectedHash;
    }

    public String getActualHash() {
        return actualHash;
    }
}
