package org.axion.engine.theory;

import org.axion.AxionException;
import org.axion.math.dsl.ExpressionParser;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Axiom Library Tests")
class AxiomLibraryTest {

    private final AxiomLibrary library = AxiomLibrary.standard();

    @Test
    @DisplayName("Standard theories are registered")
    void standardTheories() {
        List<String> theories = library.listTheories();
        for (String name : List.of("Logic", "Peano", "NumberTheory", "ZFC", "Topology", "Groups", "Rings",
                "Fields", "VectorSpaces", "CategoryTheory", "RealAnalysis", "Calculus")) {
            assertTrue(theories.contains(name), "Missing theory " + name);
            assertFalse(library.listAxioms(name).isEmpty(), name + " has no axioms");
        }
    }

    @Test
    @DisplayName("Axioms are listed in declaration order")
    void declarationOrder() {
        List<String> names = library.listAxioms("Logic").stream().map(Axiom::name).collect(Collectors.toList());
        assertEquals(List.of("excluded_middle", "non_contradiction", "identity", "leibniz_equality"), names);
    }

    @Test
    @DisplayName("Lookup follows dependencies, nearest theory first")
    void lookupThroughDependencies() {
        Axiom closure = library.lookup("Fields", "closure").orElseThrow();
        assertEquals("Groups", closure.theory());
        assertEquals("Groups.closure", closure.qualifiedName());

        Axiom identity = library.lookup("Groups", "identity").orElseThrow();
        assertEquals("Groups", identity.theory());

        assertTrue(library.lookup("Logic", "closure").isEmpty());
        assertEquals(List.of("Calculus", "RealAnalysis", "Fields", "Rings", "Groups"),
                library.closure("Calculus").stream().map(Theory::name).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Axioms are found by statement")
    void findByStatement() {
        Axiom axiom = library.findAxiom("NumberTheory", ExpressionParser.parse("0 ∈ ℕ")).orElseThrow();
        assertEquals("Peano.zero_natural", axiom.qualifiedName());
        assertEquals("0 ∈ ℕ", axiom.text());
    }

    @Test
    @DisplayName("Adding an axiom creates the theory and leaves the original untouched")
    void withAxiom() {
        AxiomLibrary extended = library.withAxiom("Graphs", "loopless", "∀v: ¬E(v, v)");

        assertTrue(extended.hasTheory("Graphs"));
        assertFalse(library.hasTheory("Graphs"));
        assertEquals("Custom theory: Graphs", extended.getTheory("Graphs").orElseThrow().description());
        assertEquals(ExpressionParser.parse("∀v: ¬E(v, v)"),
                extended.lookup("Graphs", "loopless").orElseThrow().statement());
    }

    @Test
    @DisplayName("Unparseable axiom text is rejected with its name")
    void invalidAxiom() {
        AxionException exception = assertThrows(AxionException.class,
                () -> library.withAxiom("Graphs", "broken", "∀v: ("));
        assertTrue(exception.getMessage().startsWith("Invalid axiom Graphs.broken"), exception.getMessage());
    }

    @Test
    @DisplayName("Unknown theories")
    void unknownTheory() {
        assertThrows(UnknownTheoryException.class, () -> library.listAxioms("Alchemy"));
        assertTrue(library.getTheory("Alchemy").isEmpty());
        assertTrue(library.lookup("Alchemy", "identity").isEmpty());
    }

    @Test
    @DisplayName("Dependency cycles do not loop")
    void dependencyCycle() {
        AxiomLibrary cyclic = AxiomLibrary.builder()
                .theory("A", "", "", "B")
                .theory("B", "", "", "A")
                .axiom("B", "b", "Q")
                .build();
        assertEquals("B", cyclic.lookup("A", "b").orElseThrow().theory());
        assertTrue(cyclic.lookup("A", "missing").isEmpty());
        assertEquals(2, cyclic.closure("A").size());
    }
}
