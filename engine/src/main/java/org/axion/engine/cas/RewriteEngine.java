package org.axion.engine.cas;

import org.axion.engine.config.AxionConfig;
import org.axion.math.dsl.Application;
import org.axion.math.dsl.BinaryOp;
import org.axion.math.dsl.Constant;
import org.axion.math.dsl.Expression;
import org.axion.math.dsl.Expressions;
import org.axion.math.dsl.UnaryOp;
import org.axion.math.dsl.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point of the computer algebra system: applies differentiate,
 * integrate or simplify to an expression.
 *
 * Differentiation and integration work on single-variable arithmetic terms.
 * Without an explicit variable the engine uses the only free variable of the
 * expression, or the configured default when there is none; more than one
 * free variable is rejected. Results are always simplified.
 *
 * Instances are immutable and may be shared between threads.
 */
public final class RewriteEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(RewriteEngine.class);

    private final Simplifier simplifier;
    private final Variable defaultVariable;

    public RewriteEngine() {
        this(AxionConfig.load());
    }

    public RewriteEngine(AxionConfig config) {
        this(Simplifier.standard(config.maxIterations()), Variable.of(config.defaultVariable()));
    }

    public RewriteEngine(Simplifier simplifier, Variable defaultVariable) {
        this.simplifier = Objects.requireNonNull(simplifier, "Simplifier cannot be null");
        this.defaultVariable = Objects.requireNonNull(defaultVariable, "Default variable cannot be null");
    }

    /**
     * Applies a rule given by name ({@code differentiate}, {@code integrate}
     * or {@code simplify}).
     *
     * @throws IllegalArgumentException if the rule name is unknown
     */
    public Expression apply(String ruleName, Expression expression) {
        return apply(CasRule.fromName(ruleName), expression);
    }

    public Expression apply(CasRule rule, Expression expression) {
        Objects.requireNonNull(expression, "Expression cannot be null");
        if (rule == CasRule.SIMPLIFY) {
            return simplify(expression);
        }
        return apply(rule, expression, inferVariable(rule, expression));
    }

    /**
     * Applies a rule with respect to an explicit variable. Every other name
     * in the expression is treated as a constant. Simplification ignores the
     * variable.
     */
    public Expression apply(CasRule rule, Expression expression, Variable variable) {
        Objects.requireNonNull(rule, "Rule cannot be null");
        Objects.requireNonNull(expression, "Expression cannot be null");
        Objects.requireNonNull(variable, "Variable cannot be null");
        Expression result = switch (rule) {
            case DIFFERENTIATE -> simplify(new Differentiator(variable).differentiate(arithmetic(rule, expression)));
            case INTEGRATE -> simplify(new Integrator(variable).integrate(arithmetic(rule, expression)));
            case SIMPLIFY -> simplify(expression);
        };
        LOGGER.debug("{} with respect to {}: {} -> {}", rule.ruleName(), variable, expression, result);
        return result;
    }

    public Expression differentiate(Expression expression) {
        return apply(CasRule.DIFFERENTIATE, expression);
    }

    public Expression integrate(Expression expression) {
        return apply(CasRule.INTEGRATE, expression);
    }

    public Expression simplify(Expression expression) {
        return simplifier.simplify(expression);
    }

    private Variable inferVariable(CasRule rule, Expression expression) {
        Set<Variable> free = Expressions.freeVariables(expression);
        if (free.isEmpty()) {
            return defaultVariable;
        }
        if (free.size() == 1) {
            return free.iterator().next();
        }
        throw new UnsupportedRewriteException(rule, expression,
                "more than one free variable " + new ArrayList<>(free) + ", specify the variable explicitly");
    }

    private static Expression arithmetic(CasRule rule, Expression expression) {
        Optional<Expression> offending = firstNonArithmetic(expression);
        if (offending.isPresent()) {
            throw new UnsupportedRewriteException(rule, offending.get(), "not an arithmetic term");
        }
        return expression;
    }

    private static Optional<Expression> firstNonArithmetic(Expression expression) {
        if (expression instanceof Variable) {
            return Optional.empty();
        }
        if (expression instanceof Constant c) {
            return c.isNumeric() ? Optional.empty() : Optional.of(c);
        }
        if (expression instanceof UnaryOp u) {
            return u.operator() == UnaryOp.Operator.NEGATE ? firstNonArithmetic(u.operand()) : Optional.of(u);
        }
        if (expression instanceof BinaryOp b) {
            if (!b.operator().isArithmetic()) {
                return Optional.of(b);
            }
            Optional<Expression> left = firstNonArithmetic(b.left());
            return left.isPresent() ? left : firstNonArithmetic(b.right());
        }
        if (expression instanceof Application a) {
            for (Expression argument : a.arguments()) {
                Optional<Expression> found = firstNonArithmetic(argument);
                if (found.isPresent()) {
                    return found;
                }
            }
            return Optional.empty();
        }
        return Optional.of(expression);
    }
}
