package org.axion.engine.kernel;

import org.axion.math.dsl.Application;
import org.axion.math.dsl.BinaryOp;
import org.axion.math.dsl.Constant;
import org.axion.math.dsl.Expression;
import org.axion.math.dsl.Quantified;
import org.axion.math.dsl.Substitution;
import org.axion.math.dsl.UnaryOp;
import org.axion.math.dsl.Variable;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One-way structural matching used to recover the terms a step substituted
 * for bound variables.
 *
 * Only the designated hole variables in the pattern may bind; everything else
 * must match exactly. A hole used as a functor binds to the target's functor
 * name. Bound variables of nested quantifiers are matched up to renaming.
 * The result is a candidate: callers confirm it by applying the substitution
 * and comparing.
 */
final class PatternMatcher {

    private PatternMatcher() {
    }

    static Optional<Map<Variable, Expression>> match(Expression pattern, Expression target, Set<Variable> holes) {
        Map<Variable, Expression> bindings = new LinkedHashMap<>();
        return matches(pattern, target, holes, bindings) ? Optional.of(bindings) : Optional.empty();
    }

    private static boolean matches(Expression pattern, Expression target, Set<Variable> holes,
            Map<Variable, Expression> bindings) {
        if (pattern instanceof Variable v && holes.contains(v)) {
            return bind(v, target, bindings);
        }
        if (pattern instanceof Variable || pattern instanceof Constant) {
            return pattern.equals(target);
        }
        if (pattern instanceof UnaryOp p) {
            return target instanceof UnaryOp t && p.operator() == t.operator()
                    && matches(p.operand(), t.operand(), holes, bindings);
        }
        if (pattern instanceof BinaryOp p) {
            return target instanceof BinaryOp t && p.operator() == t.operator()
                    && matches(p.left(), t.left(), holes, bindings)
                    && matches(p.right(), t.right(), holes, bindings);
        }
        if (pattern instanceof Application p) {
            return target instanceof Application t && matchApplication(p, t, holes, bindings);
        }
        Quantified p = (Quantified) pattern;
        if (!(target instanceof Quantified t) || p.kind() != t.kind()) {
            return false;
        }
        Set<Variable> inner = new HashSet<>(holes);
        inner.remove(p.variable());
        inner.remove(t.variable());
        Expression body = p.variable().equals(t.variable())
                ? p.body()
                : Substitution.replace(p.body(), p.variable(), t.variable());
        return matches(body, t.body(), inner, bindings);
    }

    private static boolean matchApplication(Application p, Application t, Set<Variable> holes,
            Map<Variable, Expression> bindings) {
        if (p.arity() != t.arity()) {
            return false;
        }
        Variable functor = new Variable(p.functor());
        if (holes.contains(functor)) {
            if (!bind(functor, new Variable(t.functor()), bindings)) {
                return false;
            }
        } else if (!p.functor().equals(t.functor())) {
            return false;
        }
        List<Expression> patternArgs = p.arguments();
        List<Expression> targetArgs = t.arguments();
        for (int i = 0; i < patternArgs.size(); i++) {
            if (!matches(patternArgs.get(i), targetArgs.get(i), holes, bindings)) {
                return false;
            }
        }
        return true;
    }

    private static boolean bind(Variable hole, Expression value, Map<Variable, Expression> bindings) {
        Expression existing = bindings.putIfAbsent(hole, value);
        return existing == null || existing.equals(value);
    }
}
