package org.axion.engine.kernel;

/**
 * The claimed statement is not what the rule produces from the cited premises.
 */
public class RuleShapeMismatchException extends ProofConstructionException {

    private final InferenceRule rule;

    public RuleShapeMismatchException(int stepIndex, InferenceRule rule, String reason) {
        super(stepIndex, rule + " does not apply: " + reason);
        this.rule = rule;
    }

    public InferenceRule getRule() {
        return rule;
    }
}
