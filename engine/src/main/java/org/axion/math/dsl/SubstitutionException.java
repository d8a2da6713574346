package org.axion.math.dsl;

import org.axion.AxionException;

/**
 * Raised when a substitution cannot be carried out, e.g. when a variable used
 * as a functor would be replaced by something other than a name.
 */
public class SubstitutionException extends AxionException {

    public SubstitutionException(String message) {
        super(message);
    }
}
