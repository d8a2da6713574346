package org.axion;

/**
 * Base class for every error raised by the parser, the rewrite engine and the
 * inference kernel.
 */
public class AxionException extends RuntimeException {

    public AxionException(String message) {
        super(message);
    }

    public AxionException(String message, Throwable cause) {
        super(message, cause);
    }
}
