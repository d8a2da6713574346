package org.axion.engine.cas;

import org.axion.math.dsl.Application;
import org.axion.math.dsl.BinaryOp;
import org.axion.math.dsl.Constant;
import org.axion.math.dsl.Expression;
import org.axion.math.dsl.ExpressionVisitor;
import org.axion.math.dsl.Quantified;
import org.axion.math.dsl.UnaryOp;
import org.axion.math.dsl.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rewrites an expression to a fixed point of an ordered list of
 * {@link Simplification}s.
 *
 * One pass walks the tree depth-first, left to right, rebuilding children
 * before their parent; at each node the first rule that applies fires once.
 * Passes repeat until one leaves the tree unchanged. A rule set that keeps
 * changing the tree past {@code maxIterations} passes is reported with
 * {@link EngineLimitExceededException}.
 */
public final class Simplifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(Simplifier.class);

    private final List<Simplification> rules;
    private final int maxIterations;

    public Simplifier(List<? extends Simplification> rules, int maxIterations) {
        Objects.requireNonNull(rules, "Rules cannot be null");
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive, got " + maxIterations);
        }
        this.rules = List.copyOf(rules);
        this.maxIterations = maxIterations;
    }

    public static Simplifier standard(int maxIterations) {
        return new Simplifier(StandardSimplifications.all(), maxIterations);
    }

    public List<Simplification> rules() {
        return rules;
    }

    public int maxIterations() {
        return maxIterations;
    }

    public Expression simplify(Expression expression) {
        Objects.requireNonNull(expression, "Expression cannot be null");
        Pass pass = new Pass();
        Expression current = expression;
        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            Expression next = current.accept(pass);
            if (next.equals(current)) {
                LOGGER.debug("Simplified {} to {} in {} passes", expression, current, iteration);
                return current;
            }
            current = next;
        }
        throw new EngineLimitExceededException(maxIterations);
    }

    private Expression rewriteNode(Expression node) {
        for (Simplification rule : rules) {
            Optional<Expression> rewritten = rule.apply(node);
            if (rewritten.isPresent()) {
                LOGGER.trace("{}: {} -> {}", rule.name(), node, rewritten.get());
                return rewritten.get();
            }
        }
        return node;
    }

    private final class Pass implements ExpressionVisitor<Expression> {

        @Override
        public Expression visitVariable(Variable variable) {
            return rewriteNode(variable);
        }

        @Override
        public Expression visitConstant(Constant constant) {
            return rewriteNode(constant);
        }

        @Override
        public Expression visitUnary(UnaryOp unary) {
            return rewriteNode(new UnaryOp(unary.operator(), unary.operand().accept(this)));
        }

        @Override
        public Expression visitBinary(BinaryOp binary) {
            Expression left = binary.left().accept(this);
            Expression right = binary.right().accept(this);
            return rewriteNode(new BinaryOp(binary.operator(), left, right));
        }

        @Override
        public Expression visitApplication(Application application) {
            return rewriteNode(new Application(application.functor(),
                    application.arguments().stream().map(arg -> arg.accept(this)).toList()));
        }

        @Override
        public Expression visitQuantified(Quantified quantified) {
            return rewriteNode(new Quantified(quantified.kind(), quantified.variable(),
                    quantified.body().accept(this)));
        }
    }
}
