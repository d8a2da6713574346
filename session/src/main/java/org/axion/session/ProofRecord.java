package org.axion.session;

import org.axion.engine.kernel.Proof;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Summary of a proof held by a {@link ProofSession}.
 *
 * @param theorem    The theorem in canonical text form
 * @param theory     The theory the proof was carried out in
 * @param proofHash  The proof's hash, its identity within the session
 * @param recordedAt When the proof was added to the session
 * @param axiomsUsed Qualified names of the axioms cited, sorted
 * @param stepCount  Number of steps
 * @param valid      Whether the proof validated when finalized
 */
public record ProofRecord(
        String theorem,
        String theory,
        String proofHash,
        Instant recordedAt,
        List<String> axiomsUsed,
        int stepCount,
        boolean valid) {

    public ProofRecord {
        Objects.requireNonNull(proofHash, "Proof hash cannot be null");
        Objects.requireNonNull(recordedAt, "Timestamp cannot be null");
        axiomsUsed = List.copyOf(axiomsUsed);
    }

    static ProofRecord of(Proof proof, Instant recordedAt) {
        return new ProofRecord(
                proof.theorem().toString(),
                proof.theory(),
                proof.proofHash().orElseThrow(),
                recordedAt,
                List.copyOf(proof.axiomsUsed()),
                proof.size(),
                proof.isValid());
    }
}
