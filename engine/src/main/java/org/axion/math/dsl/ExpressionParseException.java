package org.axion.math.dsl;

import org.axion.AxionException;

/**
 * Exception thrown when expression text cannot be parsed.
 * Carries the character offset of the offending token, what the grammar
 * expected there and what was actually found.
 */
public class ExpressionParseException extends AxionException {

    private final int position;
    private final String expected;
    private final String found;

    public ExpressionParseException(int position, String expected, String found) {
        super("Parse error at position " + position + ": expected " + expected + ", found " + found);
        this.position = position;
        this.expected = expected;
        this.found = found;
    }

    public int getPosition() {
        return position;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }
}
