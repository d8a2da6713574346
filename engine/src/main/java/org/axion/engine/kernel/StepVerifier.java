package org.axion.engine.kernel;

import org.axion.engine.theory.TheoryRegistry;
import org.axion.math.dsl.BinaryOp;
import org.axion.math.dsl.Expression;
import org.axion.math.dsl.Expressions;
import org.axion.math.dsl.Quantified;
import org.axion.math.dsl.Substitution;
import org.axion.math.dsl.SubstitutionException;
import org.axion.math.dsl.UnaryOp;
import org.axion.math.dsl.Variable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Re-derives a single step from its cited premises.
 *
 * The check depends only on the steps before it, the theory name and the
 * registry, so adding a step and validating a finished proof give the same
 * verdict.
 */
final class StepVerifier {

    /**
     * Why a step was rejected. The kind decides which exception
     * {@link InferenceKernel#addStep} raises.
     */
    record Rejection(Kind kind, String reason) {

        enum Kind {
            INVALID_PREMISE,
            RULE_SHAPE,
            UNKNOWN_AXIOM
        }

        static Optional<Rejection> shape(String reason) {
            return Optional.of(new Rejection(Kind.RULE_SHAPE, reason));
        }
    }

    private static final Optional<Rejection> ACCEPTED = Optional.empty();

    private final TheoryRegistry registry;

    StepVerifier(TheoryRegistry registry) {
        this.registry = registry;
    }

    Optional<Rejection> verify(String theory, List<ProofStep> prior, ProofStep step) {
        InferenceRule rule = step.rule();
        List<Integer> premises = step.premises();
        for (int premise : premises) {
            if (premise < 0 || premise >= step.index() || premise >= prior.size()) {
                return Optional.of(new Rejection(Rejection.Kind.INVALID_PREMISE,
                        "premise " + premise + " does not refer to an earlier step"));
            }
        }
        if (premises.size() != rule.premiseCount()) {
            return Rejection.shape(rule + " takes " + rule.premiseCount() + " premise(s), got " + premises.size());
        }

        List<Expression> p = new ArrayList<>(premises.size());
        for (int premise : premises) {
            p.add(prior.get(premise).statement());
        }
        Expression s = step.statement();

        return switch (rule) {
            case AXIOM_APPLICATION -> registry.findAxiom(theory, s).isPresent()
                    ? ACCEPTED
                    : Optional.of(new Rejection(Rejection.Kind.UNKNOWN_AXIOM,
                            s + " is not an axiom of " + theory + " or its dependencies"));
            case MODUS_PONENS -> modusPonens(p.get(0), p.get(1), s);
            case MODUS_TOLLENS -> modusTollens(p.get(0), p.get(1), s);
            case SUBSTITUTION -> substitution(p.get(0), s);
            case UNIVERSAL_INSTANTIATION -> universalInstantiation(p.get(0), s);
            case UNIVERSAL_GENERALIZATION -> universalGeneralization(prior, premises.get(0), s);
            case EXISTENTIAL_GENERALIZATION -> existentialGeneralization(p.get(0), s);
            case CONJUNCTION_INTRODUCTION -> s.equals(BinaryOp.and(p.get(0), p.get(1)))
                    ? ACCEPTED
                    : Rejection.shape("statement is not " + BinaryOp.and(p.get(0), p.get(1)));
            case CONJUNCTION_ELIMINATION -> conjunctionElimination(p.get(0), s);
            case DISJUNCTION_INTRODUCTION -> disjunctionIntroduction(p.get(0), s);
            case DISJUNCTION_ELIMINATION -> disjunctionElimination(p.get(0), p.get(1), p.get(2), s);
            case REFLEXIVITY -> s instanceof BinaryOp eq && eq.is(BinaryOp.Operator.EQUALS)
                    && eq.left().equals(eq.right())
                    ? ACCEPTED
                    : Rejection.shape("statement is not of the form t = t");
            case SYMMETRY -> symmetry(p.get(0), s);
            case TRANSITIVITY -> transitivity(p.get(0), p.get(1), s);
        };
    }

    // ==================== Propositional ====================

    private static Optional<Rejection> modusPonens(Expression antecedent, Expression implication, Expression s) {
        if (!(implication instanceof BinaryOp imp) || !imp.is(BinaryOp.Operator.IMPLIES)) {
            return Rejection.shape("second premise " + implication + " is not an implication");
        }
        if (!imp.left().equals(antecedent)) {
            return Rejection.shape("antecedent of " + implication + " is not the first premise " + antecedent);
        }
        return imp.right().equals(s) ? ACCEPTED : Rejection.shape("statement is not " + imp.right());
    }

    private static Optional<Rejection> modusTollens(Expression implication, Expression negation, Expression s) {
        if (!(implication instanceof BinaryOp imp) || !imp.is(BinaryOp.Operator.IMPLIES)) {
            return Rejection.shape("first premise " + implication + " is not an implication");
        }
        if (!negation.equals(UnaryOp.not(imp.right()))) {
            return Rejection.shape("second premise is not " + UnaryOp.not(imp.right()));
        }
        Expression expected = UnaryOp.not(imp.left());
        return s.equals(expected) ? ACCEPTED : Rejection.shape("statement is not " + expected);
    }

    private static Optional<Rejection> conjunctionElimination(Expression conjunction, Expression s) {
        if (!(conjunction instanceof BinaryOp and) || !and.is(BinaryOp.Operator.AND)) {
            return Rejection.shape("premise " + conjunction + " is not a conjunction");
        }
        return and.left().equals(s) || and.right().equals(s)
                ? ACCEPTED
                : Rejection.shape("statement is neither conjunct of " + conjunction);
    }

    private static Optional<Rejection> disjunctionIntroduction(Expression disjunct, Expression s) {
        if (!(s instanceof BinaryOp or) || !or.is(BinaryOp.Operator.OR)) {
            return Rejection.shape("statement is not a disjunction");
        }
        return or.left().equals(disjunct) || or.right().equals(disjunct)
                ? ACCEPTED
                : Rejection.shape("neither disjunct is the premise " + disjunct);
    }

    private static Optional<Rejection> disjunctionElimination(Expression disjunction, Expression left,
            Expression right, Expression s) {
        if (!(disjunction instanceof BinaryOp or) || !or.is(BinaryOp.Operator.OR)) {
            return Rejection.shape("first premise " + disjunction + " is not a disjunction");
        }
        if (!left.equals(BinaryOp.implies(or.left(), s))) {
            return Rejection.shape("second premise is not " + BinaryOp.implies(or.left(), s));
        }
        if (!right.equals(BinaryOp.implies(or.right(), s))) {
            return Rejection.shape("third premise is not " + BinaryOp.implies(or.right(), s));
        }
        return ACCEPTED;
    }

    // ==================== Equality ====================

    private static Optional<Rejection> symmetry(Expression equation, Expression s) {
        if (!(equation instanceof BinaryOp eq) || !eq.is(BinaryOp.Operator.EQUALS)) {
            return Rejection.shape("premise " + equation + " is not an equation");
        }
        Expression expected = BinaryOp.equalTo(eq.right(), eq.left());
        return s.equals(expected) ? ACCEPTED : Rejection.shape("statement is not " + expected);
    }

    private static Optional<Rejection> transitivity(Expression first, Expression second, Expression s) {
        if (!(first instanceof BinaryOp ab) || !ab.is(BinaryOp.Operator.EQUALS)
                || !(second instanceof BinaryOp bc) || !bc.is(BinaryOp.Operator.EQUALS)) {
            return Rejection.shape("both premises must be equations");
        }
        if (!ab.right().equals(bc.left())) {
            return Rejection.shape("right side of " + first + " is not the left side of " + second);
        }
        Expression expected = BinaryOp.equalTo(ab.left(), bc.right());
        return s.equals(expected) ? ACCEPTED : Rejection.shape("statement is not " + expected);
    }

    // ==================== Quantifiers ====================

    private static Optional<Rejection> substitution(Expression premise, Expression s) {
        if (!(premise instanceof Quantified q) || !q.isUniversal()) {
            return Rejection.shape("premise " + premise + " is not universally quantified");
        }
        Set<Variable> bound = new LinkedHashSet<>();
        Expression body = premise;
        while (body instanceof Quantified inner && inner.isUniversal() && !bound.contains(inner.variable())) {
            bound.add(inner.variable());
            body = inner.body();
        }
        return instantiates(body, bound, s);
    }

    private static Optional<Rejection> universalInstantiation(Expression premise, Expression s) {
        if (!(premise instanceof Quantified q) || !q.isUniversal()) {
            return Rejection.shape("premise " + premise + " is not universally quantified");
        }
        return instantiates(q.body(), Set.of(q.variable()), s);
    }

    private static Optional<Rejection> universalGeneralization(List<ProofStep> prior, int premise, Expression s) {
        if (!(s instanceof Quantified q) || !q.isUniversal()) {
            return Rejection.shape("statement is not universally quantified");
        }
        if (!q.body().equals(prior.get(premise).statement())) {
            return Rejection.shape("body of the statement is not the premise " + prior.get(premise).statement());
        }
        Variable variable = q.variable();
        for (int index : dependencies(prior, premise)) {
            ProofStep step = prior.get(index);
            if (step.rule() == InferenceRule.AXIOM_APPLICATION && Expressions.isFreeIn(variable, step.statement())) {
                return Rejection.shape(variable + " is free in axiom " + step.statement() + " cited at step " + index);
            }
        }
        return ACCEPTED;
    }

    private static Optional<Rejection> existentialGeneralization(Expression premise, Expression s) {
        if (!(s instanceof Quantified q) || q.isUniversal()) {
            return Rejection.shape("statement is not existentially quantified");
        }
        // the premise must be the body with some witness put in for the bound variable
        return instantiates(q.body(), Set.of(q.variable()), premise);
    }

    private static Optional<Rejection> instantiates(Expression body, Set<Variable> bound, Expression s) {
        Optional<Map<Variable, Expression>> terms = PatternMatcher.match(body, s, bound);
        if (terms.isEmpty()) {
            return Rejection.shape(s + " is not an instance of " + body);
        }
        try {
            // inner binders may be named freely as long as nothing is captured
            return Expressions.alphaEquivalent(Substitution.of(terms.get()).applyTo(body), s)
                    ? ACCEPTED
                    : Rejection.shape("statement is not the capture-avoiding instance of " + body
                            + " under " + terms.get());
        } catch (SubstitutionException e) {
            return Rejection.shape(e.getMessage());
        }
    }

    /**
     * Indices of the step and every step it transitively cites.
     */
    private static List<Integer> dependencies(List<ProofStep> prior, int start) {
        BitSet seen = new BitSet(prior.size());
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(start);
        List<Integer> result = new ArrayList<>();
        while (!pending.isEmpty()) {
            int index = pending.pop();
            if (seen.get(index)) {
                continue;
            }
            seen.set(index);
            result.add(index);
            for (int premise : prior.get(index).premises()) {
                if (premise >= 0 && premise < index) {
                    pending.push(premise);
                }
            }
        }
        return result;
    }
}
