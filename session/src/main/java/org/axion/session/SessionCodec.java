package org.axion.session;

import org.axion.engine.kernel.InferenceRule;
import org.axion.engine.kernel.Proof;
import org.axion.engine.kernel.ProofStep;
import org.axion.engine.serialization.Json;
import org.axion.math.dsl.Expression;
import org.axion.math.dsl.ExpressionParser;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps proofs to and from the JSON structures of a session export.
 * Expressions are stored as canonical printed text.
 */
final class SessionCodec {

    /**
     * A proof as read from an export, before it is rebuilt and checked.
     */
    record StoredProof(
            Expression theorem,
            String theory,
            String proofHash,
            boolean valid,
            Instant recordedAt,
            List<ProofStep> steps) {
    }

    private SessionCodec() {
    }

    static Map<String, Object> encode(ProofRecord record, Proof proof) {
        Map<String, Object> encoded = new LinkedHashMap<>();
        encoded.put("theorem", proof.theorem().toString());
        encoded.put("theory", proof.theory());
        encoded.put("proofHash", record.proofHash());
        encoded.put("isValid", record.valid());
        encoded.put("recordedAt", record.recordedAt().toString());
        encoded.put("axiomsUsed", new ArrayList<Object>(record.axiomsUsed()));
        List<Object> steps = new ArrayList<>(proof.size());
        for (ProofStep step : proof.steps()) {
            Map<String, Object> encodedStep = new LinkedHashMap<>();
            encodedStep.put("index", step.index());
            encodedStep.put("statement", step.statement().toString());
            encodedStep.put("rule", step.rule().name());
            encodedStep.put("premises", new ArrayList<Object>(step.premises()));
            encodedStep.put("justification", step.justification());
            steps.add(encodedStep);
        }
        encoded.put("steps", steps);
        return encoded;
    }

    static List<StoredProof> decode(Map<String, Object> document) {
        String format = Json.getString(document, "format");
        if (!ProofSession.FORMAT.equals(format)) {
            throw new IllegalArgumentException("unexpected format '" + format + "'");
        }
        int version = Json.getInt(document, "version");
        if (version != ProofSession.VERSION) {
            throw new IllegalArgumentException("unsupported version " + version);
        }
        List<StoredProof> result = new ArrayList<>();
        for (Object item : Json.getList(document, "proofs")) {
            result.add(decodeProof(asObject(item, "proof")));
        }
        return result;
    }

    private static StoredProof decodeProof(Map<String, Object> encoded) {
        List<ProofStep> steps = new ArrayList<>();
        for (Object item : Json.getList(encoded, "steps")) {
            Map<String, Object> step = asObject(item, "step");
            List<Integer> premises = new ArrayList<>();
            for (Object premise : Json.getList(step, "premises")) {
                if (!(premise instanceof Long index) || index < 0 || index > Integer.MAX_VALUE) {
                    throw new IllegalArgumentException("premise " + premise + " is not a step index");
                }
                premises.add(index.intValue());
            }
            steps.add(new ProofStep(
                    Json.getInt(step, "index"),
                    ExpressionParser.parse(Json.getString(step, "statement")),
                    InferenceRule.valueOf(Json.getString(step, "rule")),
                    premises,
                    Json.getString(step, "justification")));
        }
        return new StoredProof(
                ExpressionParser.parse(Json.getString(encoded, "theorem")),
                Json.getString(encoded, "theory"),
                Json.getString(encoded, "proofHash"),
                Json.getBoolean(encoded, "isValid"),
                Instant.parse(Json.getString(encoded, "recordedAt")),
                steps);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asObject(Object item, String what) {
        if (!(item instanceof Map)) {
            throw new IllegalArgumentException(what + " entry is not an object");
        }
        return (Map<String, Object>) item;
    }
}
