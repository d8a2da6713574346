package org.axion.math.dsl;

import org.junit.jupiter.api.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Substitution Tests")
class SubstitutionTest {

    private static final Variable X = Variable.of("x");
    private static final Variable Y = Variable.of("y");

    private static Expression e(String text) {
        return ExpressionParser.parse(text);
    }

    @Test
    @DisplayName("Free occurrences are replaced")
    void replacesFreeOccurrences() {
        assertEquals(e("2 + y*2"), Substitution.replace(e("x + y*x"), X, Constant.of(2)));
    }

    @Test
    @DisplayName("Bound occurrences are left alone")
    void leavesBoundOccurrences() {
        Expression target = e("∀x: x = y");
        assertEquals(target, Substitution.replace(target, X, Constant.of(2)));
        assertEquals(e("∀x: x = 3"), Substitution.replace(target, Y, Constant.of(3)));
    }

    @Test
    @DisplayName("Replacement is simultaneous")
    void simultaneous() {
        Map<Variable, Expression> swap = new LinkedHashMap<>();
        swap.put(X, Y);
        swap.put(Y, X);
        assertEquals(e("y - x"), Substitution.of(swap).applyTo(e("x - y")));
    }

    @Test
    @DisplayName("A bound variable that would capture the replacement is renamed")
    void avoidsCapture() {
        // GIVEN: y is bound where x occurs free
        Expression target = e("∀y: x < y");

        // WHEN: x is replaced by a term mentioning y
        Expression result = Substitution.replace(target, X, Y);

        // THEN: The binder is renamed to the first free suffix
        assertEquals(e("∀y_1: y < y_1"), result);
    }

    @Test
    @DisplayName("Fresh names skip suffixes already in use")
    void freshNameSkipsTakenSuffixes() {
        Expression result = Substitution.replace(e("∀y: x < y + y_1"), X, Y);
        assertEquals(e("∀y_2: y < y_2 + y_1"), result);
    }

    @Test
    @DisplayName("Functor names follow variable-for-variable renaming")
    void renamesFunctors() {
        Variable p = Variable.of("P");
        assertEquals(e("Q(x) ∧ Q"), Substitution.replace(e("P(x) ∧ P"), p, Variable.of("Q")));
        SubstitutionException exception = assertThrows(SubstitutionException.class,
                () -> Substitution.replace(e("P(x)"), p, Constant.ONE));
        assertTrue(exception.getMessage().contains("functor P"), exception.getMessage());
    }

    @Test
    @DisplayName("Free variables are listed in order of first occurrence, functors excluded")
    void freeVariables() {
        Set<Variable> free = Expressions.freeVariables(e("∀x: f(x, y) = z + y"));
        assertEquals(List.of(Y, Variable.of("z")), List.copyOf(free));
        assertTrue(Expressions.isFreeOf(e("∀x: x = x"), X));
        assertTrue(Expressions.isFreeIn(X, e("x + 1")));
    }
}
