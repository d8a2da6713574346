package org.axion.session;

import org.axion.engine.kernel.InferenceKernel;
import org.axion.engine.kernel.Proof;
import org.axion.engine.serialization.Json;
import org.axion.engine.serialization.JsonParseException;
import org.axion.math.dsl.ExpressionParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Collection of finalized proofs, keyed by proof hash, with export to and
 * import from a JSON file.
 *
 * The session never trusts what it reads: every imported proof is rebuilt
 * through the inference kernel, re-finalized, and rejected unless the
 * recomputed hash equals the stored one.
 *
 * A session is a mutable store meant for one thread; the proofs in it are
 * immutable.
 */
public final class ProofSession {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProofSession.class);

    static final String FORMAT = "axion-proof-session";
    static final int VERSION = 1;

    private final InferenceKernel kernel;
    private final Clock clock;
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    private record Entry(ProofRecord record, Proof proof) {
    }

    public ProofSession(InferenceKernel kernel) {
        this(kernel, Clock.systemUTC());
    }

    public ProofSession(InferenceKernel kernel, Clock clock) {
        this.kernel = Objects.requireNonNull(kernel, "Kernel cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    // ==================== Storage ====================

    /**
     * Adds a finalized proof. Adding a proof whose hash is already present
     * returns the existing record.
     *
     * @throws IllegalArgumentException if the proof is not finalized
     */
    public ProofRecord add(Proof proof) {
        Objects.requireNonNull(proof, "Proof cannot be null");
        if (!proof.isFinalized()) {
            throw new IllegalArgumentException("Only finalized proofs can be added to a session");
        }
        return store(proof, clock.instant());
    }

    private ProofRecord store(Proof proof, Instant recordedAt) {
        String hash = proof.proofHash().orElseThrow();
        Entry existing = entries.get(hash);
        if (existing != null) {
            return existing.record();
        }
        ProofRecord record = ProofRecord.of(proof, recordedAt);
        entries.put(hash, new Entry(record, proof));
        LOGGER.debug("Recorded proof {} of {}", hash, record.theorem());
        return record;
    }

    public Optional<Proof> findByHash(String proofHash) {
        Entry entry = entries.get(proofHash);
        return entry == null ? Optional.empty() : Optional.of(entry.proof());
    }

    public Optional<ProofRecord> record(String proofHash) {
        Entry entry = entries.get(proofHash);
        return entry == null ? Optional.empty() : Optional.of(entry.record());
    }

    /**
     * @return All records in the order the proofs were added
     */
    public List<ProofRecord> list() {
        List<ProofRecord> result = new ArrayList<>(entries.size());
        for (Entry entry : entries.values()) {
            result.add(entry.record());
        }
        return result;
    }

    public List<ProofRecord> list(String theory) {
        List<ProofRecord> result = new ArrayList<>();
        for (Entry entry : entries.values()) {
            if (entry.record().theory().equals(theory)) {
                result.add(entry.record());
            }
        }
        return result;
    }

    /**
     * @return Distinct theorems with a valid proof in the theory, in insertion order
     */
    public List<String> theorems(String theory) {
        Set<String> result = new LinkedHashSet<>();
        for (Entry entry : entries.values()) {
            ProofRecord record = entry.record();
            if (record.valid() && record.theory().equals(theory)) {
                result.add(record.theorem());
            }
        }
        return List.copyOf(result);
    }

    /**
     * Re-validates a stored proof and recomputes its hash.
     *
     * @return False if the hash is unknown, the proof no longer validates,
     *         or its content no longer hashes to its identity
     */
    public boolean verify(String proofHash) {
        Entry entry = entries.get(proofHash);
        if (entry == null) {
            return false;
        }
        Proof proof = entry.proof();
        Proof rebuilt = kernel.finalizeProof(kernel.assemble(proof.theorem(), proof.theory(), proof.steps()));
        return rebuilt.isValid() && rebuilt.proofHash().orElseThrow().equals(proofHash);
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    public SessionStatistics statistics() {
        int valid = 0;
        Set<String> theories = new LinkedHashSet<>();
        Set<String> theorems = new LinkedHashSet<>();
        Map<String, Long> axiomCounts = new HashMap<>();
        for (Entry entry : entries.values()) {
            ProofRecord record = entry.record();
            if (record.valid()) {
                valid++;
            }
            theories.add(record.theory());
            theorems.add(record.theorem());
            for (String axiom : record.axiomsUsed()) {
                axiomCounts.merge(axiom, 1L, Long::sum);
            }
        }
        List<SessionStatistics.AxiomUsage> mostUsed = axiomCounts.entrySet().stream()
                .map(e -> new SessionStatistics.AxiomUsage(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingLong(SessionStatistics.AxiomUsage::count).reversed()
                        .thenComparing(SessionStatistics.AxiomUsage::axiom))
                .limit(5)
                .toList();
        return new SessionStatistics(entries.size(), valid, theories, theorems.size(), mostUsed);
    }

    // ==================== Export ====================

    public void exportTo(Path file) {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            exportTo(writer);
        } catch (IOException e) {
            throw new SessionIOException("Failed to write session to " + file, e);
        }
        LOGGER.info("Exported {} proofs to {}", entries.size(), file);
    }

    public void exportTo(Writer writer) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("format", FORMAT);
        document.put("version", VERSION);
        List<Object> proofs = new ArrayList<>();
        for (Entry entry : entries.values()) {
            proofs.add(SessionCodec.encode(entry.record(), entry.proof()));
        }
        document.put("proofs", proofs);
        try {
            writer.write(Json.toPrettyJson(document));
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            throw new SessionIOException("Failed to write session", e);
        }
    }

    public String exportToString() {
        StringWriter writer = new StringWriter();
        exportTo(writer);
        return writer.toString();
    }

    // ==================== Import ====================

    /**
     * Imports every proof in the file. Nothing is added unless all of them
     * pass the integrity check.
     *
     * @return Number of proofs read from the file
     * @throws ProofIntegrityException if a proof does not reproduce its recorded hash or validity
     * @throws SessionIOException      if the file cannot be read or is not a session export
     */
    public int importFrom(Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SessionIOException("Failed to read session from " + file, e);
        }
        int imported = importFrom(content);
        LOGGER.info("Imported {} proofs from {}", imported, file);
        return imported;
    }

    public int importFrom(Reader reader) {
        StringWriter buffer = new StringWriter();
        try {
            reader.transferTo(buffer);
        } catch (IOException e) {
            throw new SessionIOException("Failed to read session", e);
        }
        return importFrom(buffer.toString());
    }

    private int importFrom(String content) {
        List<SessionCodec.StoredProof> stored;
        try {
            stored = SessionCodec.decode(Json.parseObject(content));
        } catch (JsonParseException | ExpressionParseException | IllegalArgumentException | DateTimeParseException e) {
            throw new SessionIOException("Not a valid session export: " + e.getMessage(), e);
        }

        List<Proof> rebuilt = new ArrayList<>(stored.size());
        for (SessionCodec.StoredProof candidate : stored) {
            rebuilt.add(rebuild(candidate));
        }
        for (int i = 0; i < rebuilt.size(); i++) {
            store(rebuilt.get(i), stored.get(i).recordedAt());
        }
        return rebuilt.size();
    }

    private Proof rebuild(SessionCodec.StoredProof stored) {
        Proof proof = kernel.finalizeProof(kernel.assemble(stored.theorem(), stored.theory(), stored.steps()));
        String recomputed = proof.proofHash().orElseThrow();
        if (!recomputed.equals(stored.proofHash())) {
            throw new ProofIntegrityException("Proof of " + stored.theorem() + " does not match its recorded hash",
                    stored.proofHash(), recomputed);
        }
        if (proof.isValid() != stored.valid()) {
            throw new ProofIntegrityException("Proof of " + stored.theorem() + " is recorded as "
                    + (stored.valid() ? "valid" : "invalid") + " but re-validates as "
                    + (proof.isValid() ? "valid" : "invalid"), stored.proofHash(), recomputed);
        }
        return proof;
    }
}
