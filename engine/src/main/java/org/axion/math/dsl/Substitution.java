package org.axion.math.dsl;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Simultaneous, capture-avoiding substitution of terms for free variables.
 *
 * When a replacement term mentions a variable that a quantifier in the target
 * binds, the bound variable is renamed first to {@code name_1},
 * {@code name_2}, ... (the first suffix not already in use), so the result is
 * deterministic.
 *
 * A variable that also appears as a functor ({@code P} in {@code P(n)}) is
 * renamed in functor position when its replacement is itself a variable;
 * any other replacement for it raises {@link SubstitutionException}.
 */
public final class Substitution {

    private final Map<Variable, Expression> bindings;

    private Substitution(Map<Variable, Expression> bindings) {
        this.bindings = bindings;
    }

    public static Substitution of(Map<Variable, Expression> bindings) {
        Objects.requireNonNull(bindings, "Bindings cannot be null");
        return new Substitution(new LinkedHashMap<>(bindings));
    }

    public static Substitution of(Variable variable, Expression replacement) {
        Map<Variable, Expression> bindings = new LinkedHashMap<>();
        bindings.put(Objects.requireNonNull(variable), Objects.requireNonNull(replacement));
        return new Substitution(bindings);
    }

    /**
     * Shorthand for {@code Substitution.of(variable, replacement).applyTo(target)}.
     */
    public static Expression replace(Expression target, Variable variable, Expression replacement) {
        return of(variable, replacement).applyTo(target);
    }

    public Map<Variable, Expression> bindings() {
        return Map.copyOf(bindings);
    }

    public Expression applyTo(Expression target) {
        return apply(target, bindings);
    }

    private static Expression apply(Expression expression, Map<Variable, Expression> sigma) {
        if (sigma.isEmpty()) {
            return expression;
        }
        if (expression instanceof Variable v) {
            Expression replacement = sigma.get(v);
            return replacement != null ? replacement : v;
        }
        if (expression instanceof Constant) {
            return expression;
        }
        if (expression instanceof UnaryOp u) {
            return new UnaryOp(u.operator(), apply(u.operand(), sigma));
        }
        if (expression instanceof BinaryOp b) {
            return new BinaryOp(b.operator(), apply(b.left(), sigma), apply(b.right(), sigma));
        }
        if (expression instanceof Application a) {
            return new Application(functor(a.functor(), sigma),
                    a.arguments().stream().map(arg -> apply(arg, sigma)).toList());
        }
        return applyQuantified((Quantified) expression, sigma);
    }

    private static String functor(String functor, Map<Variable, Expression> sigma) {
        Expression replacement = sigma.get(new Variable(functor));
        if (replacement == null) {
            return functor;
        }
        if (replacement instanceof Variable renamed) {
            return renamed.name();
        }
        throw new SubstitutionException("Cannot substitute " + replacement
                + " for functor " + functor);
    }

    private static Expression applyQuantified(Quantified quantified, Map<Variable, Expression> sigma) {
        Variable bound = quantified.variable();
        Expression body = quantified.body();

        // The bound variable shadows any binding for it; bindings for
        // variables not free in the body are irrelevant.
        Set<String> bodyNames = Expressions.names(body);
        Map<Variable, Expression> inner = new LinkedHashMap<>();
        for (Map.Entry<Variable, Expression> entry : sigma.entrySet()) {
            Variable key = entry.getKey();
            if (!key.equals(bound) && bodyNames.contains(key.name())) {
                inner.put(key, entry.getValue());
            }
        }
        if (inner.isEmpty()) {
            return quantified;
        }

        Set<String> incoming = new HashSet<>();
        for (Expression replacement : inner.values()) {
            for (Variable free : Expressions.freeVariables(replacement)) {
                incoming.add(free.name());
            }
        }
        if (incoming.contains(bound.name())) {
            Set<String> taken = new HashSet<>(bodyNames);
            taken.addAll(incoming);
            for (Variable key : inner.keySet()) {
                taken.add(key.name());
            }
            Variable fresh = freshVariable(bound, taken);
            inner.put(bound, fresh);
            bound = fresh;
        }
        return new Quantified(quantified.kind(), bound, apply(body, inner));
    }

    static Variable freshVariable(Variable base, Set<String> taken) {
        int suffix = 1;
        while (taken.contains(base.name() + "_" + suffix)) {
            suffix++;
        }
        return new Variable(base.name() + "_" + suffix);
    }
}
