package org.axion.engine.kernel;

import org.axion.math.dsl.Expression;

import java.util.List;
import java.util.Objects;

/**
 * One justified line of a proof.
 *
 * @param index         Position of the step in its proof, starting at 0
 * @param statement     The statement this step establishes
 * @param rule          The rule that justifies it
 * @param premises      Indices of the earlier steps the rule is applied to, in rule order
 * @param justification Free text for the reader, part of the proof hash
 */
public record ProofStep(
        int index,
        Expression statement,
        InferenceRule rule,
        List<Integer> premises,
        String justification) {

    public ProofStep {
        Objects.requireNonNull(statement, "Statement cannot be null");
        Objects.requireNonNull(rule, "Rule cannot be null");
        premises = List.copyOf(premises);
        justification = justification == null ? "" : justification;
    }
}
