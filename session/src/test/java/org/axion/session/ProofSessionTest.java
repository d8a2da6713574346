package org.axion.session;

import org.axion.engine.kernel.InferenceKernel;
import org.axion.engine.kernel.InferenceRule;
import org.axion.engine.kernel.Proof;
import org.axion.engine.kernel.ProofStep;
import org.axion.engine.serialization.ProofHasher;
import org.axion.engine.theory.AxiomLibrary;
import org.axion.math.dsl.ExpressionParser;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for storing, querying, exporting and re-importing proofs.
 */
@DisplayName("Proof Session Tests")
class ProofSessionTest {

    private static final Instant RECORDED = Instant.parse("2026-01-15T10:00:00Z");

    private InferenceKernel kernel;
    private ProofSession session;

    @BeforeEach
    void setUp() {
        kernel = new InferenceKernel(AxiomLibrary.standard(), new ProofHasher());
        session = new ProofSession(kernel, Clock.fixed(RECORDED, ZoneOffset.UTC));
    }

    private Proof identityProof() {
        Proof proof = kernel.createProof(ExpressionParser.parse("∀x: x = x"), "Logic");
        kernel.citeAxiom(proof, "identity");
        return kernel.finalizeProof(proof);
    }

    private Proof instanceProof() {
        Proof proof = kernel.createProof(ExpressionParser.parse("S(0) = S(0)"), "Logic");
        kernel.citeAxiom(proof, "identity");
        kernel.addStep(proof, ExpressionParser.parse("S(0) = S(0)"), InferenceRule.UNIVERSAL_INSTANTIATION,
                List.of(0), "x := S(0)");
        return kernel.finalizeProof(proof);
    }

    private Proof zeroProof() {
        Proof proof = kernel.createProof(ExpressionParser.parse("0 ∈ ℕ"), "NumberTheory");
        kernel.citeAxiom(proof, "zero_natural");
        return kernel.finalizeProof(proof);
    }

    private Proof invalidProof() {
        Proof proof = kernel.createProof(ExpressionParser.parse("P"), "Logic");
        kernel.citeAxiom(proof, "identity");
        return kernel.finalizeProof(proof);
    }

    @Nested
    @DisplayName("Storage")
    class Storage {

        @Test
        @DisplayName("Only finalized proofs are accepted")
        void rejectsDrafts() {
            Proof draft = kernel.createProof(ExpressionParser.parse("∀x: x = x"), "Logic");
            kernel.citeAxiom(draft, "identity");
            assertThrows(IllegalArgumentException.class, () -> session.add(draft));
            assertEquals(0, session.size());
        }

        @Test
        @DisplayName("A proof is recorded under its hash")
        void recordsProof() {
            // GIVEN: A finalized proof
            Proof proof = identityProof();

            // WHEN: It is added
            ProofRecord record = session.add(proof);

            // THEN: The record summarizes it and the proof is found by hash
            String hash = proof.proofHash().orElseThrow();
            assertEquals("∀x: x = x", record.theorem());
            assertEquals("Logic", record.theory());
            assertEquals(hash, record.proofHash());
            assertEquals(RECORDED, record.recordedAt());
            assertEquals(List.of("Logic.identity"), record.axiomsUsed());
            assertEquals(1, record.stepCount());
            assertTrue(record.valid());
            assertSame(proof, session.findByHash(hash).orElseThrow());
            assertEquals(record, session.record(hash).orElseThrow());
            assertTrue(session.findByHash("0000").isEmpty());
        }

        @Test
        @DisplayName("Adding the same proof twice keeps one entry")
        void duplicate() {
            ProofRecord first = session.add(identityProof());
            ProofRecord second = session.add(identityProof());
            assertEquals(first, second);
            assertEquals(1, session.size());
        }

        @Test
        @DisplayName("Listing by theory and theorems with valid proofs")
        void queries() {
            session.add(identityProof());
            session.add(zeroProof());
            session.add(invalidProof());

            assertEquals(3, session.list().size());
            assertEquals(2, session.list("Logic").size());
            assertEquals(List.of("∀x: x = x"), session.theorems("Logic"));
            assertEquals(List.of("0 ∈ ℕ"), session.theorems("NumberTheory"));
            assertTrue(session.theorems("ZFC").isEmpty());
        }

        @Test
        @DisplayName("Stored proofs re-verify")
        void verify() {
            Proof valid = identityProof();
            Proof invalid = invalidProof();
            session.add(valid);
            session.add(invalid);

            assertTrue(session.verify(valid.proofHash().orElseThrow()));
            assertFalse(session.verify(invalid.proofHash().orElseThrow()));
            assertFalse(session.verify("unknown"));
        }

        @Test
        @DisplayName("Statistics count proofs, theories and axiom usage")
        void statistics() {
            session.add(identityProof());
            session.add(instanceProof());
            session.add(zeroProof());
            session.add(invalidProof());

            SessionStatistics stats = session.statistics();

            assertEquals(4, stats.totalProofs());
            assertEquals(3, stats.validProofs());
            assertEquals(Set.of("Logic", "NumberTheory"), stats.theoriesUsed());
            assertEquals(4, stats.uniqueTheorems());
            assertEquals(List.of(
                    new SessionStatistics.AxiomUsage("Logic.identity", 3),
                    new SessionStatistics.AxiomUsage("Peano.zero_natural", 1)), stats.mostUsedAxioms());
        }

        @Test
        @DisplayName("Clearing empties the session")
        void clear() {
            session.add(identityProof());
            session.clear();
            assertEquals(0, session.size());
            assertEquals(0, session.statistics().totalProofs());
        }
    }

    @Nested
    @DisplayName("Export and import")
    class ExportImport {

        @Test
        @DisplayName("A session survives a round trip through a file")
        void roundTrip(@TempDir Path dir) {
            // GIVEN: A session with valid and invalid proofs, exported to a file
            session.add(identityProof());
            ProofRecord instance = session.add(instanceProof());
            session.add(invalidProof());
            Path file = dir.resolve("session.json");
            session.exportTo(file);

            // WHEN: A fresh session with a different clock imports it
            ProofSession restored = new ProofSession(kernel,
                    Clock.fixed(Instant.parse("2030-01-01T00:00:00Z"), ZoneOffset.UTC));
            int imported = restored.importFrom(file);

            // THEN: Every record comes back unchanged, timestamps included
            assertEquals(3, imported);
            assertEquals(session.list(), restored.list());
            for (ProofRecord record : restored.list()) {
                assertTrue(restored.findByHash(record.proofHash()).isPresent());
            }
            ProofStep step = restored.findByHash(instance.proofHash()).orElseThrow().step(1);
            assertEquals(List.of(0), step.premises());
            assertEquals("x := S(0)", step.justification());
            assertTrue(restored.verify(instance.proofHash()));
        }

        @Test
        @DisplayName("Export is a pretty-printed JSON document")
        void exportLayout() {
            session.add(identityProof());
            String exported = session.exportToString();

            assertTrue(exported.startsWith("{\n  \"format\": \"axion-proof-session\",\n  \"version\": 1,"), exported);
            assertTrue(exported.endsWith("}\n"));
            assertTrue(exported.contains("\"justification\": \"Axiom Logic.identity\""), exported);
        }

        @Test
        @DisplayName("A tampered justification fails the hash check")
        void tamperedJustification() {
            Proof proof = identityProof();
            session.add(proof);
            String tampered = session.exportToString().replace("Axiom Logic.identity", "Axiom Logic.tampered");

            ProofSession restored = new ProofSession(kernel);
            ProofIntegrityException exception = assertThrows(ProofIntegrityException.class,
                    () -> restored.importFrom(new StringReader(tampered)));
            assertEquals(proof.proofHash().orElseThrow(), exception.getExpectedHash());
            assertNotEquals(exception.getExpectedHash(), exception.getActualHash());
            assertEquals(0, restored.size());
        }

        @Test
        @DisplayName("A flipped validity flag is detected")
        void tamperedValidity() {
            session.add(identityProof());
            String tampered = session.exportToString().replace("\"isValid\": true", "\"isValid\": false");

            ProofSession restored = new ProofSession(kernel);
            assertThrows(ProofIntegrityException.class, () -> restored.importFrom(new StringReader(tampered)));
        }

        @Test
        @DisplayName("One bad proof stops the whole import")
        void importIsAllOrNothing() {
            session.add(zeroProof());
            session.add(identityProof());
            String tampered = session.exportToString().replace("Axiom Logic.identity", "forged");

            ProofSession restored = new ProofSession(kernel);
            assertThrows(ProofIntegrityException.class, () -> restored.importFrom(new StringReader(tampered)));
            assertEquals(0, restored.size());
        }

        @Test
        @DisplayName("Malformed documents are reported as session I/O errors")
        void malformed() {
            String valid = exportOne();
            List<String> broken = List.of(
                    "not json",
                    "{\"format\": \"other\", \"version\": 1, \"proofs\": []}",
                    "{\"format\": \"axion-proof-session\", \"version\": 2, \"proofs\": []}",
                    valid.replace("\"rule\": \"AXIOM_APPLICATION\"", "\"rule\": \"GUESSWORK\""),
                    valid.replace("\"recordedAt\": \"2026-01-15T10:00:00Z\"", "\"recordedAt\": \"yesterday\""),
                    valid.replace("\"theorem\": \"∀x: x = x\"", "\"theorem\": \"∀x: x =\""));

            for (String content : broken) {
                ProofSession restored = new ProofSession(kernel);
                assertThrows(SessionIOException.class, () -> restored.importFrom(new StringReader(content)),
                        "Expected rejection of: " + content);
                assertEquals(0, restored.size());
            }
        }

        @Test
        @DisplayName("Missing files are reported as session I/O errors")
        void missingFile(@TempDir Path dir) {
            Path missing = dir.resolve("absent.json");
            assertFalse(Files.exists(missing));
            assertThrows(SessionIOException.class, () -> session.importFrom(missing));
        }

        private String exportOne() {
            session.add(identityProof());
            return session.exportToString();
        }
    }
}
