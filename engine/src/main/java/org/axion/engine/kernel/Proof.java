package org.axion.engine.kernel;

import org.axion.math.dsl.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A proof of one theorem within one theory.
 *
 * A proof starts empty and grows one step at a time through
 * {@link InferenceKernel}; steps are never edited or removed. Finalizing
 * records validity, the axioms cited and the proof hash, after which the
 * proof is immutable and safe to share.
 */
public final class Proof {

    private final Expression theorem;
    private final String theory;
    private final List<ProofStep> steps = new ArrayList<>();

    private boolean finalized;
    private boolean valid;
    private SortedSet<String> axiomsUsed = Collections.emptySortedSet();
    private String proofHash;
    private ValidationFailure failure;

    Proof(Expression theorem, String theory) {
        this.theorem = Objects.requireNonNull(theorem, "Theorem cannot be null");
        this.theory = Objects.requireNonNull(theory, "Theory cannot be null");
    }

    public Expression theorem() {
        return theorem;
    }

    public String theory() {
        return theory;
    }

    public List<ProofStep> steps() {
        return Collections.unmodifiableList(steps);
    }

    public ProofStep step(int index) {
        return steps.get(index);
    }

    public int size() {
        return steps.size();
    }

    public boolean isFinalized() {
        return finalized;
    }

    /**
     * @return True if the proof was finalized and every step checked out
     */
    public boolean isValid() {
        return valid;
    }

    /**
     * @return Qualified names ({@code Theory.axiom}) of the axioms cited,
     *         sorted; empty until the proof is finalized
     */
    public SortedSet<String> axiomsUsed() {
        return axiomsUsed;
    }

    /**
     * @return Lower-case hex digest, or empty until the proof is finalized
     */
    public Optional<String> proofHash() {
        return Optional.ofNullable(proofHash);
    }

    /**
     * @return The first failing step recorded at finalization, if any
     */
    public Optional<ValidationFailure> validationFailure() {
        return Optional.ofNullable(failure);
    }

    void append(ProofStep step) {
        if (finalized) {
            throw new IllegalStateException("Proof of " + theorem + " is finalized and cannot be extended");
        }
        steps.add(step);
    }

    void seal(ValidationResult result, SortedSet<String> axioms, String hash) {
        if (finalized) {
            throw new IllegalStateException("Proof of " + theorem + " is already finalized");
        }
        this.valid = result.isValid();
        this.failure = result.failure().orElse(null);
        this.axiomsUsed = Collections.unmodifiableSortedSet(new TreeSet<>(axioms));
        this.proofHash = hash;
        this.finalized = true;
    }

    @Override
    public String toString() {
        return "Proof{theorem=" + theorem + ", theory=" + theory + ", steps=" + steps.size()
                + (finalized ? ", valid=" + valid + ", hash=" + proofHash : ", draft") + "}";
    }
}
