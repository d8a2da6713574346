package org.axion.engine.kernel;

import java.util.Optional;

/**
 * Outcome of {@link InferenceKernel#validateProof(Proof)}. An invalid proof is
 * an expected outcome, reported here rather than thrown.
 */
public final class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(null);

    private final ValidationFailure failure;

    private ValidationResult(ValidationFailure failure) {
        this.failure = failure;
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult invalid(int stepIndex, String reason) {
        return new ValidationResult(new ValidationFailure(stepIndex, reason));
    }

    public boolean isValid() {
        return failure == null;
    }

    public Optional<ValidationFailure> failure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return failure == null
                ? "valid"
                : "invalid at step " + failure.stepIndex() + ": " + failure.reason();
    }
}
