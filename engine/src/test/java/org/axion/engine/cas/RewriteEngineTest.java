package org.axion.engine.cas;

import org.axion.engine.config.AxionConfig;
import org.axion.math.dsl.BinaryOp;
import org.axion.math.dsl.Constant;
import org.axion.math.dsl.Expression;
import org.axion.math.dsl.ExpressionParser;
import org.axion.math.dsl.ExpressionPrinter;
import org.axion.math.dsl.Variable;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for symbolic differentiation, integration and simplification.
 */
@DisplayName("Rewrite Engine Tests")
class RewriteEngineTest {

    private static final Variable X = Variable.of("x");

    private RewriteEngine engine;

    @BeforeEach
    void setUp() {
        engine = new RewriteEngine(AxionConfig.defaults());
    }

    private static Expression e(String text) {
        return ExpressionParser.parse(text);
    }

    @Nested
    @DisplayName("Differentiation")
    class Differentiation {

        @Test
        @DisplayName("d/dx x^2 is 2*x")
        void squareRule() {
            // GIVEN: x^2
            // WHEN: Differentiated by rule name
            Expression result = engine.apply("differentiate", e("x^2"));

            // THEN: The power rule result is simplified
            assertEquals(e("2*x"), result);
            assertEquals("2*x", ExpressionPrinter.print(result));
        }

        @Test
        @DisplayName("Repeated differentiation of x^4 reaches a constant")
        void repeatedDifferentiation() {
            Expression first = engine.differentiate(e("x^4"));
            assertEquals(e("4*x^3"), first);

            Expression second = engine.differentiate(first);
            assertEquals(e("12*x^2"), second);

            Expression third = engine.differentiate(second);
            assertEquals(e("24*x"), third);

            assertEquals(Constant.of(24), engine.differentiate(third));
        }

        @ParameterizedTest(name = "d/dx {0} = {1}")
        @CsvSource(delimiter = ';', value = {
                "x^3 + 2*x; 3*x^2 + 2",
                "5; 0",
                "x; 1",
                "-x; -1",
                "sin(x); cos(x)",
                "cos(x); -sin(x)",
                "exp(x); exp(x)",
                "ln(x); 1/x",
                "sin(x^2); cos(x^2)*(2*x)",
                "x*sin(x); sin(x) + x*cos(x)",
                "1/x; -1/x^2",
                "x^3/3; x^2",
                "x - x^2; 1 - 2*x",
                "x^(1/2); x^(-1/2)/2",
                "x^0.5; x^(-1/2)/2",
                "2.5*x^2; 5*x"
        })
        @DisplayName("Derivative identities")
        void derivatives(String input, String expected) {
            assertEquals(e(expected), engine.differentiate(e(input)));
        }

        @Test
        @DisplayName("Other names are constants when the variable is explicit")
        void explicitVariable() {
            assertEquals(e("y"), engine.apply(CasRule.DIFFERENTIATE, e("x*y"), X));
            assertEquals(e("3*y^2"), engine.apply(CasRule.DIFFERENTIATE, e("x + y^3"), Variable.of("y")));
        }

        @Test
        @DisplayName("Variable exponents are unsupported")
        void variableExponent() {
            UnsupportedRewriteException exception = assertThrows(UnsupportedRewriteException.class,
                    () -> engine.differentiate(e("2^x")));
            assertEquals(CasRule.DIFFERENTIATE, exception.getRule());
            assertEquals(e("2^x"), exception.getOffending());
        }

        @Test
        @DisplayName("Unknown functions are unsupported")
        void unknownFunction() {
            assertThrows(UnsupportedRewriteException.class, () -> engine.differentiate(e("f(x)")));
        }
    }

    @Nested
    @DisplayName("Integration")
    class Integration {

        @ParameterizedTest(name = "∫ {0} dx = {1}")
        @CsvSource(delimiter = ';', value = {
                "x^2; x^3/3",
                "x; x^2/2",
                "3*x^2 + 2; x^3 + 2*x",
                "5; 5*x",
                "sin(x); -cos(x)",
                "cos(x); sin(x)",
                "exp(x); exp(x)",
                "x^2/2; x^3/6",
                "x/2; x^2/4",
                "0.5*x; x^2/4",
                "-x; -(x^2/2)"
        })
        @DisplayName("Antiderivative identities")
        void antiderivatives(String input, String expected) {
            assertEquals(e(expected), engine.integrate(e(input)));
        }

        @Test
        @DisplayName("1/x has no power-rule antiderivative")
        void reciprocal() {
            UnsupportedRewriteException exception = assertThrows(UnsupportedRewriteException.class,
                    () -> engine.integrate(e("1/x")));
            assertEquals(CasRule.INTEGRATE, exception.getRule());
        }

        @Test
        @DisplayName("x^-1 is rejected explicitly")
        void negativeOneExponent() {
            UnsupportedRewriteException exception = assertThrows(UnsupportedRewriteException.class,
                    () -> engine.integrate(e("x^-1")));
            assertTrue(exception.getMessage().contains("-1"), exception.getMessage());
        }

        @Test
        @DisplayName("Products of two variable factors are unsupported")
        void productOfVariableFactors() {
            assertThrows(UnsupportedRewriteException.class, () -> engine.integrate(e("x*x")));
            assertThrows(UnsupportedRewriteException.class, () -> engine.integrate(e("sin(x^2)")));
        }

        @ParameterizedTest(name = "d/dx ∫ {0}*x^{1} dx")
        @CsvSource({"1, 1", "3, 2", "2, 2", "-3, 2", "5, 1", "7, 4", "4, 3", "1, 0",
                "0.5, 0", "0.5, 1", "0.5, 2", "0.5, 4", "0.5, 5", "2.5, 3", "-0.5, 2", "1.25, 3"})
        @DisplayName("Differentiating an antiderivative gives back the simplified integrand")
        void powerRoundTrip(String coefficient, long exponent) {
            Expression integrand = BinaryOp.multiply(Constant.of(new BigDecimal(coefficient)),
                    BinaryOp.power(X, Constant.of(exponent)));

            Expression roundTrip = engine.differentiate(engine.integrate(integrand));

            assertEquals(engine.simplify(integrand), roundTrip);
        }
    }

    @Nested
    @DisplayName("Rule dispatch")
    class RuleDispatch {

        @Test
        @DisplayName("Several free variables need an explicit variable")
        void ambiguousVariable() {
            UnsupportedRewriteException exception = assertThrows(UnsupportedRewriteException.class,
                    () -> engine.apply(CasRule.DIFFERENTIATE, e("x*y")));
            assertTrue(exception.getMessage().contains("more than one free variable"), exception.getMessage());
        }

        @Test
        @DisplayName("Closed terms use the configured default variable")
        void defaultVariable() {
            RewriteEngine withT = new RewriteEngine(AxionConfig.defaults().withDefaultVariable("t"));
            assertEquals(e("3*t"), withT.integrate(e("3")));
        }

        @ParameterizedTest(name = "not arithmetic: {0}")
        @ValueSource(strings = {"x = 1", "¬x", "x ∈ ℕ", "∀y: y + x", "x + ℝ"})
        @DisplayName("Logical and relational input is rejected")
        void nonArithmetic(String input) {
            assertThrows(UnsupportedRewriteException.class,
                    () -> engine.apply(CasRule.DIFFERENTIATE, e(input), X));
            assertThrows(UnsupportedRewriteException.class,
                    () -> engine.apply(CasRule.INTEGRATE, e(input), X));
        }

        @Test
        @DisplayName("Simplify accepts any expression")
        void simplifyAnything() {
            assertEquals(e("P"), engine.apply("simplify", e("¬¬P")));
            assertEquals(e("x = 2"), engine.apply("SIMPLIFY", e("x = 1 + 1")));
        }

        @Test
        @DisplayName("Unknown rule names are rejected")
        void unknownRule() {
            assertThrows(IllegalArgumentException.class, () -> engine.apply("factorize", e("x")));
        }

        @Test
        @DisplayName("Results are deterministic")
        void deterministic() {
            Expression input = e("x^3*2 + sin(x)");
            assertEquals(engine.differentiate(input), new RewriteEngine(AxionConfig.defaults()).differentiate(input));
        }
    }
}
