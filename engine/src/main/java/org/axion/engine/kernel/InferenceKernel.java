package org.axion.engine.kernel;

import org.axion.engine.config.AxionConfig;
import org.axion.engine.serialization.ProofHasher;
import org.axion.engine.theory.Axiom;
import org.axion.engine.theory.TheoryRegistry;
import org.axion.engine.theory.UnknownTheoryException;
import org.axion.math.dsl.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Builds, checks and seals proofs.
 *
 * Every step is checked when it is added, and the whole proof is checked
 * again from scratch when it is validated or finalized. Checking reads only
 * the proof itself, the theory registry given at construction and the fixed
 * rule table, so the kernel holds no mutable state and can serve many
 * independent proofs concurrently.
 *
 * Example:
 * <pre>
 * InferenceKernel kernel = new InferenceKernel(AxiomLibrary.standard());
 * Proof proof = kernel.createProof(ExpressionParser.parse("∀x: x = x"), "Logic");
 * kernel.citeAxiom(proof, "identity");
 * kernel.finalizeProof(proof).proofHash();
 * </pre>
 */
public final class InferenceKernel {

    private static final Logger LOGGER = LoggerFactory.getLogger(InferenceKernel.class);

    private final TheoryRegistry registry;
    private final StepVerifier verifier;
    private final ProofHasher hasher;

    public InferenceKernel(TheoryRegistry registry) {
        this(registry, new ProofHasher(AxionConfig.load().hashAlgorithm()));
    }

    public InferenceKernel(TheoryRegistry registry, ProofHasher hasher) {
        this.registry = Objects.requireNonNull(registry, "Theory registry cannot be null");
        this.hasher = Objects.requireNonNull(hasher, "Hasher cannot be null");
        this.verifier = new StepVerifier(registry);
    }

    public TheoryRegistry registry() {
        return registry;
    }

    // ==================== Construction ====================

    /**
     * Starts an empty proof of the theorem.
     *
     * @throws UnknownTheoryException if the theory is not registered
     */
    public Proof createProof(Expression theorem, String theory) {
        requireTheory(theory);
        return new Proof(theorem, theory);
    }

    public ProofStep addStep(Proof proof, Expression statement, InferenceRule rule) {
        return addStep(proof, statement, rule, List.of(), "");
    }

    public ProofStep addStep(Proof proof, Expression statement, InferenceRule rule, List<Integer> premises) {
        return addStep(proof, statement, rule, premises, "");
    }

    /**
     * Checks the step against the steps already in the proof and appends it.
     *
     * @throws InvalidPremiseReferenceException if a premise index is negative or not smaller than the new index
     * @throws RuleShapeMismatchException       if the rule does not produce the statement from the premises
     * @throws UnknownAxiomException            if an axiom application matches no available axiom
     * @throws IllegalStateException            if the proof is already finalized
     */
    public ProofStep addStep(Proof proof, Expression statement, InferenceRule rule,
            List<Integer> premises, String justification) {
        Objects.requireNonNull(proof, "Proof cannot be null");
        Objects.requireNonNull(premises, "Premises cannot be null");
        if (proof.isFinalized()) {
            throw new IllegalStateException("Proof of " + proof.theorem() + " is finalized and cannot be extended");
        }
        int index = proof.size();
        for (Integer premise : premises) {
            if (premise == null || premise < 0 || premise >= index) {
                throw new InvalidPremiseReferenceException(index, premise == null ? -1 : premise);
            }
        }

        ProofStep step = new ProofStep(index, statement, rule, premises, justification);
        Optional<StepVerifier.Rejection> rejection = verifier.verify(proof.theory(), proof.steps(), step);
        if (rejection.isPresent()) {
            StepVerifier.Rejection r = rejection.get();
            throw switch (r.kind()) {
                case INVALID_PREMISE -> new ProofConstructionException(index, r.reason());
                case RULE_SHAPE -> new RuleShapeMismatchException(index, rule, r.reason());
                case UNKNOWN_AXIOM -> new UnknownAxiomException(index, r.reason());
            };
        }

        proof.append(step);
        LOGGER.debug("Step {} of {}: {} by {} {}", index, proof.theorem(), statement, rule, premises);
        return step;
    }

    /**
     * Appends an axiom application for the named axiom, looked up in the
     * proof's theory first and then in its dependencies.
     *
     * @throws UnknownAxiomException if no such axiom exists
     */
    public ProofStep citeAxiom(Proof proof, String axiomName) {
        Objects.requireNonNull(proof, "Proof cannot be null");
        Axiom axiom = registry.lookup(proof.theory(), axiomName)
                .orElseThrow(() -> new UnknownAxiomException(proof.size(),
                        "no axiom named " + axiomName + " in " + proof.theory() + " or its dependencies"));
        return addStep(proof, axiom.statement(), InferenceRule.AXIOM_APPLICATION, List.of(),
                "Axiom " + axiom.qualifiedName());
    }

    /**
     * Builds an unchecked draft from previously recorded steps, e.g. when
     * importing a stored proof. Only {@link #validateProof} and
     * {@link #finalizeProof} pass judgement on it.
     *
     * @throws UnknownTheoryException if the theory is not registered
     */
    public Proof assemble(Expression theorem, String theory, List<ProofStep> steps) {
        Proof proof = createProof(theorem, theory);
        for (ProofStep step : steps) {
            proof.append(step);
        }
        return proof;
    }

    // ==================== Checking ====================

    /**
     * Re-derives every step from its premises and checks that the last step
     * states the theorem. Reports the first failure.
     */
    public ValidationResult validateProof(Proof proof) {
        Objects.requireNonNull(proof, "Proof cannot be null");
        List<ProofStep> steps = proof.steps();
        if (steps.isEmpty()) {
            return ValidationResult.invalid(-1, "proof has no steps");
        }
        for (int i = 0; i < steps.size(); i++) {
            ProofStep step = steps.get(i);
            if (step.index() != i) {
                return ValidationResult.invalid(i, "step at position " + i + " is numbered " + step.index());
            }
            Optional<StepVerifier.Rejection> rejection = verifier.verify(proof.theory(), steps.subList(0, i), step);
            if (rejection.isPresent()) {
                return ValidationResult.invalid(i, rejection.get().reason());
            }
        }
        ProofStep last = steps.get(steps.size() - 1);
        if (!last.statement().equals(proof.theorem())) {
            return ValidationResult.invalid(last.index(),
                    "last step states " + last.statement() + " instead of the theorem " + proof.theorem());
        }
        return ValidationResult.valid();
    }

    /**
     * Validates the proof, records the axioms it cites, computes its hash and
     * makes it immutable. Invalid proofs are finalized too, with
     * {@link Proof#isValid()} false. Finalizing an already finalized proof
     * returns it unchanged.
     */
    public Proof finalizeProof(Proof proof) {
        Objects.requireNonNull(proof, "Proof cannot be null");
        if (proof.isFinalized()) {
            return proof;
        }
        ValidationResult result = validateProof(proof);
        SortedSet<String> axioms = new TreeSet<>();
        for (ProofStep step : proof.steps()) {
            if (step.rule() == InferenceRule.AXIOM_APPLICATION) {
                registry.findAxiom(proof.theory(), step.statement())
                        .ifPresent(axiom -> axioms.add(axiom.qualifiedName()));
            }
        }
        String hash = hasher.hash(proof);
        proof.seal(result, axioms, hash);
        LOGGER.info("Finalized proof of {} in {}: {} ({} steps, hash {})",
                proof.theorem(), proof.theory(), result, proof.size(), hash);
        return proof;
    }

    private void requireTheory(String theory) {
        Objects.requireNonNull(theory, "Theory cannot be null");
        if (registry.getTheory(theory).isEmpty()) {
            throw new UnknownTheoryException(theory);
        }
    }
}
