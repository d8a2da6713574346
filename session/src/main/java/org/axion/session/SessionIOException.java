package org.axion.session;

import org.axion.AxionException;

/**
 * A session export could not be written, read or understood.
 */
public class SessionIOException extends AxionException {

    public SessionIOException(String message, Throwable cause) {
        super(message, cause);
    }

    public SessionIOException(String message) {
        super(message);
    }
}
