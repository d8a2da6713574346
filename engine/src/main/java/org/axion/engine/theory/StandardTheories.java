package org.axion.engine.theory;

/**
 * Axioms of the theories shipped with {@link AxiomLibrary#standard()}.
 */
final class StandardTheories {

    private StandardTheories() {
    }

    static void registerAll(AxiomLibrary.Builder library) {
        registerLogic(library);
        registerPeano(library);
        registerZfc(library);
        registerAlgebra(library);
        registerAnalysis(library);
        registerTopology(library);
        registerCategoryTheory(library);
        registerNumberTheory(library);
    }

    // ==================== Logic ====================

    private static void registerLogic(AxiomLibrary.Builder library) {
        library.theory("Logic", "Classical first-order logic", "Standard logical axioms");
        library.axiom("Logic", "excluded_middle", "∀P: P ∨ ¬P");
        library.axiom("Logic", "non_contradiction", "∀P: ¬(P ∧ ¬P)");
        library.axiom("Logic", "identity", "∀x: x = x");
        library.axiom("Logic", "leibniz_equality", "∀x, y: x = y ⟹ (∀P: P(x) ⟺ P(y))");
    }

    // ==================== Arithmetic ====================

    private static void registerPeano(AxiomLibrary.Builder library) {
        library.theory("Peano", "Natural number arithmetic", "Peano (1889), Axioms for natural numbers");
        library.axiom("Peano", "zero_natural", "0 ∈ ℕ");
        library.axiom("Peano", "successor_natural", "∀n ∈ ℕ: S(n) ∈ ℕ");
        library.axiom("Peano", "zero_not_successor", "∀n ∈ ℕ: S(n) ≠ 0");
        library.axiom("Peano", "successor_injective", "∀m, n ∈ ℕ: S(m) = S(n) ⟹ m = n");
        library.axiom("Peano", "induction", "∀P: [P(0) ∧ (∀n: P(n) ⟹ P(S(n)))] ⟹ (∀n: P(n))");
        library.axiom("Peano", "addition_zero", "∀n: n + 0 = n");
        library.axiom("Peano", "addition_successor", "∀m, n: m + S(n) = S(m + n)");
        library.axiom("Peano", "multiplication_zero", "∀n: n × 0 = 0");
        library.axiom("Peano", "multiplication_successor", "∀m, n: m × S(n) = m × n + m");
    }

    private static void registerNumberTheory(AxiomLibrary.Builder library) {
        library.theory("NumberTheory", "Elementary number theory", "Standard number theory results", "Peano");
        library.axiom("NumberTheory", "division_algorithm",
                "∀a, b ∈ ℤ: b ≠ 0 ⟹ (∃q, r ∈ ℤ: a = b*q + r ∧ 0 ≤ r ∧ r < abs(b))");
        library.axiom("NumberTheory", "euclid_gcd", "∀a, b: b ≠ 0 ⟹ gcd(a, b) = gcd(b, mod(a, b))");
        library.axiom("NumberTheory", "gcd_commutative", "∀a, b: gcd(a, b) = gcd(b, a)");
    }

    // ==================== Sets ====================

    private static void registerZfc(AxiomLibrary.Builder library) {
        library.theory("ZFC", "Zermelo-Fraenkel Set Theory with Choice", "Standard ZFC axioms");
        library.axiom("ZFC", "extensionality", "∀A, B: (∀x: x ∈ A ⟺ x ∈ B) ⟹ A = B");
        library.axiom("ZFC", "empty_set", "∀x: x ∉ ∅");
        library.axiom("ZFC", "pairing", "∀a, b: ∃P: ∀x: x ∈ P ⟺ x = a ∨ x = b");
        library.axiom("ZFC", "union", "∀F: ∃U: ∀x: x ∈ U ⟺ (∃A ∈ F: x ∈ A)");
        library.axiom("ZFC", "power_set", "∀A: ∃P: ∀B: B ∈ P ⟺ B ⊆ A");
        library.axiom("ZFC", "infinity", "∃I: ∅ ∈ I ∧ (∀x ∈ I: succ(x) ∈ I)");
        library.axiom("ZFC", "replacement", "∀A: ∀F: ∃B: ∀y: y ∈ B ⟺ (∃x ∈ A: F(x) = y)");
        library.axiom("ZFC", "regularity", "∀A: A ≠ ∅ ⟹ (∃x ∈ A: intersection(x, A) = ∅)");
        library.axiom("ZFC", "choice", "∀F: (∀A ∈ F: A ≠ ∅) ⟹ (∃f: ∀A ∈ F: f(A) ∈ A)");
    }

    private static void registerTopology(AxiomLibrary.Builder library) {
        library.theory("Topology", "General topology axioms", "Standard topological space axioms", "ZFC");
        library.axiom("Topology", "empty_and_full", "∅ ∈ τ ∧ X ∈ τ");
        library.axiom("Topology", "arbitrary_union", "∀F ⊆ τ: union(F) ∈ τ");
        library.axiom("Topology", "finite_intersection", "∀U, V ∈ τ: intersection(U, V) ∈ τ");
    }

    // ==================== Algebra ====================

    private static void registerAlgebra(AxiomLibrary.Builder library) {
        library.theory("Groups", "Abstract group theory", "Standard group axioms");
        library.axiom("Groups", "closure", "∀a, b ∈ G: a · b ∈ G");
        library.axiom("Groups", "associativity", "∀a, b, c ∈ G: (a · b) · c = a · (b · c)");
        library.axiom("Groups", "identity", "∃e ∈ G: ∀a ∈ G: e · a = a ∧ a · e = a");
        library.axiom("Groups", "inverse", "∀a ∈ G: ∃b ∈ G: a · b = e ∧ b · a = e");

        library.theory("Rings", "Ring theory axioms", "Standard ring axioms", "Groups");
        library.axiom("Rings", "additive_commutativity", "∀a, b ∈ R: a + b = b + a");
        library.axiom("Rings", "multiplicative_closure", "∀a, b ∈ R: a × b ∈ R");
        library.axiom("Rings", "multiplicative_associativity", "∀a, b, c ∈ R: (a × b) × c = a × (b × c)");
        library.axiom("Rings", "distributivity_left", "∀a, b, c ∈ R: a × (b + c) = a × b + a × c");
        library.axiom("Rings", "distributivity_right", "∀a, b, c ∈ R: (a + b) × c = a × c + b × c");

        library.theory("Fields", "Field theory axioms", "Standard field axioms", "Rings");
        library.axiom("Fields", "multiplicative_commutativity", "∀a, b ∈ F: a × b = b × a");
        library.axiom("Fields", "multiplicative_identity", "1 ≠ 0 ∧ (∀a ∈ F: 1 × a = a)");
        library.axiom("Fields", "multiplicative_inverse", "∀a ∈ F: a ≠ 0 ⟹ (∃b ∈ F: a × b = 1)");

        library.theory("VectorSpaces", "Vector space axioms over a field", "Standard vector space axioms", "Fields");
        library.axiom("VectorSpaces", "scalar_multiplication", "∀c ∈ F: ∀v ∈ V: c · v ∈ V");
        library.axiom("VectorSpaces", "scalar_distributivity", "∀c ∈ F: ∀u, v ∈ V: c · (u + v) = c · u + c · v");
        library.axiom("VectorSpaces", "field_distributivity", "∀c, d ∈ F: ∀v ∈ V: (c + d) · v = c · v + d · v");
        library.axiom("VectorSpaces", "scalar_associativity", "∀c, d ∈ F: ∀v ∈ V: (c × d) · v = c · (d · v)");
        library.axiom("VectorSpaces", "scalar_identity", "∀v ∈ V: 1 · v = v");
    }

    private static void registerCategoryTheory(AxiomLibrary.Builder library) {
        library.theory("CategoryTheory", "Category theory axioms", "Standard category axioms");
        library.axiom("CategoryTheory", "associativity",
                "∀f, g, h: compose(compose(h, g), f) = compose(h, compose(g, f))");
        library.axiom("CategoryTheory", "identity",
                "∀A: ∀f: compose(f, id(A)) = f ∧ compose(id(A), f) = f");
    }

    // ==================== Analysis ====================

    private static void registerAnalysis(AxiomLibrary.Builder library) {
        library.theory("RealAnalysis", "Real number system and analysis", "Standard real analysis axioms", "Fields");
        library.axiom("RealAnalysis", "trichotomy", "∀x, y ∈ ℝ: x < y ∨ x = y ∨ x > y");
        library.axiom("RealAnalysis", "archimedean", "∀x, y ∈ ℝ: x > 0 ⟹ (∃n ∈ ℕ: n*x > y)");

        library.theory("Calculus", "Differential and integral calculus",
                "Standard calculus axioms and definitions", "RealAnalysis");
        library.axiom("Calculus", "power_rule", "∀n: deriv(x^n) = n*x^(n - 1)");
        library.axiom("Calculus", "sum_rule", "∀f, g: deriv(f + g) = deriv(f) + deriv(g)");
        library.axiom("Calculus", "product_rule", "∀f, g: deriv(f*g) = deriv(f)*g + f*deriv(g)");
        library.axiom("Calculus", "constant_factor", "∀a, f: deriv(a*f) = a*deriv(f)");
        library.axiom("Calculus", "fundamental_theorem", "∀F, a, b: integral(deriv(F), a, b) = F(b) - F(a)");
    }
}
