package org.axion.engine.cas;

import org.axion.math.dsl.BinaryOp;
import org.axion.math.dsl.Expression;
import org.axion.math.dsl.ExpressionParser;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Simplifier Tests")
class SimplifierTest {

    private final Simplifier simplifier = Simplifier.standard(100);

    private static Expression e(String text) {
        return ExpressionParser.parse(text);
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = ';', value = {
            "x + 0; x",
            "0 + x; x",
            "x - 0; x",
            "0 - x; -x",
            "x - x; 0",
            "x*0; 0",
            "1*x; x",
            "x/1; x",
            "x/x; 1",
            "x^0; 1",
            "x^1; x",
            "--x; x",
            "¬¬P; P",
            "x*3; 3*x",
            "2*(3*x); 6*x",
            "2*(x/3); 2*x/3",
            "-(2*x); -2*x",
            "-(2); -2",
            "2 + 3*4; 14",
            "2^10; 1024",
            "7 - 10; -3",
            "6/4; 3/2",
            "6/3; 2",
            "(6*x)/3; 2*x",
            "(4*x)/6; 2*x/3",
            "(x + 0)*(y^1); x*y",
            "0.5; 1/2",
            "-0.25; -1/4",
            "0.5*x; x/2",
            "x*0.5; x/2",
            "1.5/3; 1/2",
            "1.5*x^2/3; x^2/2",
            "1/2 + 1/3; 5/6",
            "1/2 - 1; -1/2",
            "(1/2)^2; 1/4",
            "-(1/2); -1/2",
            "(x/2)/3; x/6",
            "x/0.5; 2*x",
            "x/(-1/2); -2*x"
    })
    @DisplayName("Identities rewrite to their canonical form")
    void identities(String input, String expected) {
        assertEquals(e(expected), simplifier.simplify(e(input)));
    }

    @ParameterizedTest(name = "{0} is already simplified")
    @ValueSource(strings = {"x + x", "0/0", "x/0", "2^x", "x^-1", "2^100", "1/3", "x^(1/2)", "sin(x) + cos(x)", "P ∧ Q"})
    @DisplayName("Expressions outside the rule set are left unchanged")
    void fixedPoints(String input) {
        Expression expression = e(input);
        assertEquals(expression, simplifier.simplify(expression));
    }

    @ParameterizedTest(name = "idempotent: {0}")
    @ValueSource(strings = {"x^4 + 0*x", "2*(3*(x/4))", "-(-(x^1))", "(x - x)*y + 1", "(6*x)/4", "0.5*(x/3)", "1/2*x + 1/3"})
    @DisplayName("Simplifying twice gives the same result as simplifying once")
    void idempotent(String input) {
        Expression once = simplifier.simplify(e(input));
        assertEquals(once, simplifier.simplify(once));
    }

    @Test
    @DisplayName("Rules are tried in declaration order")
    void ruleOrder() {
        assertEquals(StandardSimplifications.CONSTANT_FOLDING, simplifier.rules().get(0));
        assertEquals(StandardSimplifications.values().length, simplifier.rules().size());
    }

    @Test
    @DisplayName("A rule set that never converges hits the iteration cap")
    void iterationCap() {
        // GIVEN: A rule that swaps the operands of every sum
        Simplification swap = new Simplification() {
            @Override
            public String name() {
                return "SWAP_SUM";
            }

            @Override
            public Optional<Expression> apply(Expression node) {
                if (node instanceof BinaryOp b && b.is(BinaryOp.Operator.ADD)) {
                    return Optional.of(BinaryOp.add(b.right(), b.left()));
                }
                return Optional.empty();
            }
        };
        Simplifier looping = new Simplifier(List.of(swap), 5);

        // WHEN/THEN: Simplification gives up after five passes
        EngineLimitExceededException exception = assertThrows(EngineLimitExceededException.class,
                () -> looping.simplify(e("x + y")));
        assertEquals(5, exception.getIterations());
    }

    @Test
    @DisplayName("Iteration cap must be positive")
    void invalidCap() {
        assertThrows(IllegalArgumentException.class, () -> Simplifier.standard(0));
    }
}
