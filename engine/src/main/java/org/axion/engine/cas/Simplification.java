package org.axion.engine.cas;

import org.axion.math.dsl.Expression;

import java.util.Optional;

/**
 * A local rewrite applied by {@link Simplifier} at a single node. The node's
 * children have already been simplified in the current pass.
 */
public interface Simplification {

    String name();

    /**
     * @param node The node to rewrite
     * @return The rewritten node, or empty if this rule does not apply
     */
    Optional<Expression> apply(Expression node);
}
