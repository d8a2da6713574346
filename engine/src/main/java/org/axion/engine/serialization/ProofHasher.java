package org.axion.engine.serialization;

import org.axion.engine.kernel.Proof;
import org.axion.engine.kernel.ProofStep;
import org.axion.math.dsl.Expression;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the tamper-evident identity of a proof.
 *
 * The digest covers the compact JSON document
 * <pre>
 * {"theory":…,"theorem":…,"steps":[{"index":…,"statement":…,"rule":…,"premises":[…],"justification":…},…]}
 * </pre>
 * with fields in exactly this order and expressions in
 * {@link CanonicalEncoder} form, encoded as UTF-8. Changing any statement,
 * rule, premise, premise order, justification or the order of the steps
 * changes the hash.
 */
public final class ProofHasher {

    public static final String DEFAULT_ALGORITHM = "SHA-256";

    private final String algorithm;

    public ProofHasher() {
        this(DEFAULT_ALGORITHM);
    }

    /**
     * @param algorithm A {@link MessageDigest} algorithm name
     * @throws IllegalArgumentException if the JVM does not provide the algorithm
     */
    public ProofHasher(String algorithm) {
        this.algorithm = Objects.requireNonNull(algorithm, "Algorithm cannot be null");
        newDigest();
    }

    public String algorithm() {
        return algorithm;
    }

    /**
     * @return Lower-case hex digest of the proof's canonical payload
     */
    public String hash(Proof proof) {
        return digest(canonicalJson(proof));
    }

    public String hash(Expression theorem, String theory, List<ProofStep> steps) {
        return digest(canonicalJson(theorem, theory, steps));
    }

    public static String canonicalJson(Proof proof) {
        return canonicalJson(proof.theorem(), proof.theory(), proof.steps());
    }

    public static String canonicalJson(Expression theorem, String theory, List<ProofStep> steps) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("theory", theory);
        payload.put("theorem", CanonicalEncoder.encode(theorem));
        List<Object> encodedSteps = new ArrayList<>(steps.size());
        for (ProofStep step : steps) {
            Map<String, Object> encoded = new LinkedHashMap<>();
            encoded.put("index", step.index());
            encoded.put("statement", CanonicalEncoder.encode(step.statement()));
            encoded.put("rule", step.rule().name());
            encoded.put("premises", step.premises());
            encoded.put("justification", step.justification());
            encodedSteps.add(encoded);
        }
        payload.put("steps", encodedSteps);
        return Json.toJson(payload);
    }

    private String digest(String payload) {
        return HexFormat.of().formatHex(newDigest().digest(payload.getBytes(StandardCharsets.UTF_8)));
    }

    private MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Unsupported digest algorithm: " + algorithm, e);
        }
    }
}
