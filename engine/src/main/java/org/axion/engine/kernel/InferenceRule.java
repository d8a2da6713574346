package org.axion.engine.kernel;

/**
 * The closed set of inference rules the kernel accepts. Every proof step
 * names exactly one of them, and {@link StepVerifier} holds one
 * reconstruction check per constant.
 */
public enum InferenceRule {
    /** Restates an axiom of the proof's theory or one of its dependencies. */
    AXIOM_APPLICATION(0),
    /** From P and P ⟹ Q infer Q. */
    MODUS_PONENS(2),
    /** From P ⟹ Q and ¬Q infer ¬P. */
    MODUS_TOLLENS(2),
    /** From ∀x1…∀xn: φ infer φ with every leading bound variable replaced. */
    SUBSTITUTION(1),
    /** From ∀x: φ infer φ[x:=t]. */
    UNIVERSAL_INSTANTIATION(1),
    /** From φ infer ∀x: φ, provided no cited axiom mentions x free. */
    UNIVERSAL_GENERALIZATION(1),
    /** From φ[x:=t] infer ∃x: φ. */
    EXISTENTIAL_GENERALIZATION(1),
    /** From P and Q infer P ∧ Q. */
    CONJUNCTION_INTRODUCTION(2),
    /** From P ∧ Q infer P, or Q. */
    CONJUNCTION_ELIMINATION(1),
    /** From P infer P ∨ Q, or Q ∨ P. */
    DISJUNCTION_INTRODUCTION(1),
    /** From P ∨ Q, P ⟹ R and Q ⟹ R infer R. */
    DISJUNCTION_ELIMINATION(3),
    /** Infer t = t. */
    REFLEXIVITY(0),
    /** From a = b infer b = a. */
    SYMMETRY(1),
    /** From a = b and b = c infer a = c. */
    TRANSITIVITY(2);

    private final int premiseCount;

    InferenceRule(int premiseCount) {
        this.premiseCount = premiseCount;
    }

    /**
     * @return The exact number of premises a step using this rule must cite
     */
    public int premiseCount() {
        return premiseCount;
    }
}
