package org.axion.engine.serialization;

import org.axion.AxionException;

/**
 * Raised for malformed JSON input.
 */
public class JsonParseException extends AxionException {

    private final int position;

    public JsonParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
