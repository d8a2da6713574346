package org.axion.math.dsl;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Structural queries over expression trees.
 */
public final class Expressions {

    private Expressions() {
    }

    /**
     * Collects the free variables of an expression in order of first
     * occurrence. Functor names of applications are not variables.
     */
    public static Set<Variable> freeVariables(Expression expression) {
        Set<Variable> result = new LinkedHashSet<>();
        collectFree(expression, Set.of(), result);
        return result;
    }

    public static boolean isFreeIn(Variable variable, Expression expression) {
        return freeVariables(expression).contains(variable);
    }

    /**
     * True when the expression mentions no free occurrence of the variable,
     * i.e. it is a constant with respect to that variable.
     */
    public static boolean isFreeOf(Expression expression, Variable variable) {
        return !isFreeIn(variable, expression);
    }

    /**
     * Every identifier used anywhere in the expression: free and bound
     * variables as well as functor names.
     */
    public static Set<String> names(Expression expression) {
        Set<String> result = new LinkedHashSet<>();
        collectNames(expression, result);
        return result;
    }

    /**
     * True when the two expressions differ at most in the names of their
     * bound variables, e.g. {@code ∃y: x ≠ y} and {@code ∃z: x ≠ z}.
     * Free names, functors included, must match exactly.
     */
    public static boolean alphaEquivalent(Expression left, Expression right) {
        return alphaEquivalent(left, right, Map.of(), Map.of());
    }

    private static boolean alphaEquivalent(Expression left, Expression right,
            Map<String, String> leftToRight, Map<String, String> rightToLeft) {
        if (left instanceof Variable l) {
            return right instanceof Variable r && sameName(l.name(), r.name(), leftToRight, rightToLeft);
        }
        if (left instanceof Constant) {
            return left.equals(right);
        }
        if (left instanceof UnaryOp l) {
            return right instanceof UnaryOp r && l.operator() == r.operator()
                    && alphaEquivalent(l.operand(), r.operand(), leftToRight, rightToLeft);
        }
        if (left instanceof BinaryOp l) {
            return right instanceof BinaryOp r && l.operator() == r.operator()
                    && alphaEquivalent(l.left(), r.left(), leftToRight, rightToLeft)
                    && alphaEquivalent(l.right(), r.right(), leftToRight, rightToLeft);
        }
        if (left instanceof Application l) {
            if (!(right instanceof Application r) || l.arguments().size() != r.arguments().size()
                    || !sameName(l.functor(), r.functor(), leftToRight, rightToLeft)) {
                return false;
            }
            for (int i = 0; i < l.arguments().size(); i++) {
                if (!alphaEquivalent(l.arguments().get(i), r.arguments().get(i), leftToRight, rightToLeft)) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof Quantified l) {
            if (!(right instanceof Quantified r) || l.kind() != r.kind()) {
                return false;
            }
            Map<String, String> innerLeft = new HashMap<>(leftToRight);
            Map<String, String> innerRight = new HashMap<>(rightToLeft);
            innerLeft.put(l.variable().name(), r.variable().name());
            innerRight.put(r.variable().name(), l.variable().name());
            return alphaEquivalent(l.body(), r.body(), innerLeft, innerRight);
        }
        return false;
    }

    private static boolean sameName(String left, String right,
            Map<String, String> leftToRight, Map<String, String> rightToLeft) {
        String boundLeft = leftToRight.get(left);
        String boundRight = rightToLeft.get(right);
        if (boundLeft == null && boundRight == null) {
            return left.equals(right);
        }
        return right.equals(boundLeft) && left.equals(boundRight);
    }

    private static void collectFree(Expression expression, Set<Variable> bound, Set<Variable> out) {
        if (expression instanceof Variable v) {
            if (!bound.contains(v)) {
                out.add(v);
            }
        } else if (expression instanceof UnaryOp u) {
            collectFree(u.operand(), bound, out);
        } else if (expression instanceof BinaryOp b) {
            collectFree(b.left(), bound, out);
            collectFree(b.right(), bound, out);
        } else if (expression instanceof Application a) {
            for (Expression argument : a.arguments()) {
                collectFree(argument, bound, out);
            }
        } else if (expression instanceof Quantified q) {
            Set<Variable> inner = new LinkedHashSet<>(bound);
            inner.add(q.variable());
            collectFree(q.body(), inner, out);
        }
    }

    private static void collectNames(Expression expression, Set<String> out) {
        if (expression instanceof Variable v) {
            out.add(v.name());
        } else if (expression instanceof UnaryOp u) {
            collectNames(u.operand(), out);
        } else if (expression instanceof BinaryOp b) {
            collectNames(b.left(), out);
            collectNames(b.right(), out);
        } else if (expression instanceof Application a) {
            out.add(a.functor());
            for (Expression argument : a.arguments()) {
                collectNames(argument, out);
            }
        } else if (expression instanceof Quantified q) {
            out.add(q.variable().name());
            collectNames(q.body(), out);
        }
    }
}
