package org.axion.engine.kernel;

/**
 * The first step of a proof that could not be re-derived.
 *
 * @param stepIndex Index of the failing step, or -1 when the proof has no steps
 * @param reason    Why the step was rejected
 */
public record ValidationFailure(int stepIndex, String reason) {
}
