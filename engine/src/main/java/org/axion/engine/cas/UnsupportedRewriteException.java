package org.axion.engine.cas;

import org.axion.AxionException;
import org.axion.math.dsl.Expression;

/**
 * Raised when a rewrite rule has no case for the expression it was given.
 * Carries the rule and the sub-expression that could not be handled.
 */
public class UnsupportedRewriteException extends AxionException {

    private final CasRule rule;
    private final Expression offending;

    public UnsupportedRewriteException(CasRule rule, Expression offending, String reason) {
        super("Cannot " + rule.ruleName() + " " + offending + ": " + reason);
        this.rule = rule;
        this.offending = offending;
    }

    public CasRule getRule() {
        return rule;
    }

    public Expression getOffending() {
        return offending;
    }
}
