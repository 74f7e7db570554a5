package org.sl.derivation;

import org.junit.jupiter.api.Test;
import org.sl.support.Formula;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.sl.support.Formula.*;

public class ProofCheckerTest {

    private static final Formula A = atom('A');
    private static final Formula B = atom('B');
    private static final Formula C = atom('C');

    /**
     * Prova manuale di (A -> A): ~(A -> A), ~(~A v A), (~~A & ~A), (A & ~A), ...
     */
    private static Derivation identityProof() {
        Derivation derivation = new Derivation();
        derivation.assume(negation(implies(A, A)));                                  // 1
        derivation.exchange(negation(or(negation(A), A)), Rule.ARROW_EXCHANGE);      // 2
        derivation.exchange(and(negation(negation(A)), negation(A)), Rule.DE_MORGAN); // 3
        derivation.exchange(and(A, negation(A)), Rule.DOUBLE_NEGATION);              // 4
        derivation.discharge();
        derivation.append(implies(negation(implies(A, A)), and(A, negation(A))),
                Rule.ARROW_INTRODUCTION, List.of(1, 4));                             // 5
        derivation.exchange(implies(A, A), Rule.NEGATION_ELIMINATION);              // 6
        return derivation;
    }

    @Test
    public void testValidProof() {
        Derivation proof = identityProof();
        assertEquals(List.of(), ProofChecker.check(proof));
        assertTrue(ProofChecker.isValid(proof));
    }

    @Test
    public void testOpenAssumptionRejected() {
        Derivation derivation = new Derivation();
        derivation.assume(A);

        List<String> violations = ProofChecker.check(derivation);
        assertEquals(1, violations.size());
        assertTrue(violations.get(0).contains("Assunzioni non scaricate"));
    }

    @Test
    public void testNonEquivalentExchangeRejected() {
        Derivation derivation = new Derivation();
        derivation.assume(implies(A, B));
        derivation.exchange(implies(B, A), Rule.ARROW_EXCHANGE);
        derivation.discharge();
        derivation.append(implies(implies(A, B), implies(B, A)), Rule.ARROW_INTRODUCTION, List.of(1, 2));

        List<String> violations = ProofChecker.check(derivation);
        assertEquals(1, violations.size());
        assertTrue(violations.get(0).startsWith("Riga 2"));
    }

    @Test
    public void testCitationIntoClosedScopeRejected() {
        Derivation derivation = new Derivation();
        derivation.assume(negation(negation(and(A, B))));                               // 1
        derivation.assume(C);                                                           // 2
        derivation.append(and(A, B), Rule.DOUBLE_NEGATION, List.of(1));                 // 3
        derivation.discharge();
        derivation.append(implies(C, and(A, B)), Rule.ARROW_INTRODUCTION, List.of(2, 3)); // 4
        derivation.append(A, Rule.AND_ELIMINATION, List.of(3));                         // 5
        derivation.discharge();
        derivation.append(implies(negation(negation(and(A, B))), A), Rule.ARROW_INTRODUCTION, List.of(1, 5)); // 6

        List<String> violations = ProofChecker.check(derivation);
        assertEquals(1, violations.size());
        assertTrue(violations.get(0).contains("scope già chiuso"));
    }

    @Test
    public void testWrongConjunctRejected() {
        Derivation derivation = new Derivation();
        derivation.assume(and(A, B));
        derivation.append(C, Rule.AND_ELIMINATION, List.of(1));
        derivation.discharge();
        derivation.append(implies(and(A, B), C), Rule.ARROW_INTRODUCTION, List.of(1, 2));

        assertFalse(ProofChecker.isValid(derivation));
    }

    @Test
    public void testArrowIntroductionMustDischargeInnermost() {
        Derivation derivation = new Derivation();
        derivation.assume(A);
        derivation.assume(B);
        derivation.discharge();
        derivation.append(implies(A, B), Rule.ARROW_INTRODUCTION, List.of(1, 2));

        List<String> violations = ProofChecker.check(derivation);
        assertTrue(violations.stream().anyMatch(v -> v.contains("non è l'assunzione più interna")));
    }

    @Test
    public void testMismatchedDisjunctionBranchesRejected() {
        Formula left = and(A, negation(A));
        Formula right = and(B, negation(B));

        Derivation derivation = new Derivation();
        derivation.assume(or(left, right));                                           // 1
        derivation.assume(left);                                                      // 2
        derivation.discharge();
        derivation.append(implies(left, left), Rule.ARROW_INTRODUCTION, List.of(2, 2));  // 3
        derivation.assume(right);                                                     // 4
        derivation.discharge();
        derivation.append(implies(right, right), Rule.ARROW_INTRODUCTION, List.of(4, 4)); // 5
        derivation.append(left, Rule.OR_ELIMINATION, List.of(1, 3, 5));               // 6
        derivation.discharge();
        derivation.append(implies(or(left, right), left), Rule.ARROW_INTRODUCTION, List.of(1, 6)); // 7

        List<String> violations = ProofChecker.check(derivation);
        assertEquals(1, violations.size());
        assertTrue(violations.get(0).startsWith("Riga 6"));
    }

    @Test
    public void testExFalsoRequiresContradiction() {
        Derivation derivation = new Derivation();
        derivation.assume(A);
        derivation.exchange(B, Rule.EX_FALSO);
        derivation.discharge();
        derivation.append(implies(A, B), Rule.ARROW_INTRODUCTION, List.of(1, 2));

        List<String> violations = ProofChecker.check(derivation);
        assertEquals(1, violations.size());
        assertTrue(violations.get(0).contains("Any Contra."));
    }

    @Test
    public void testContradictionShape() {
        assertTrue(ProofChecker.isContradiction(and(A, negation(A))));
        assertTrue(ProofChecker.isContradiction(and(or(A, B), negation(or(A, B)))));
        assertFalse(ProofChecker.isContradiction(and(negation(A), A)));
        assertFalse(ProofChecker.isContradiction(or(A, negation(A))));
    }

    @Test
    public void testExchangeSchemas() {
        assertTrue(ProofChecker.isSingleRewrite(implies(A, B), or(negation(A), B), Rule.ARROW_EXCHANGE));
        assertTrue(ProofChecker.isSingleRewrite(iff(A, B),
                or(and(A, B), and(negation(A), negation(B))), Rule.BICONDITIONAL_EXCHANGE));
        assertTrue(ProofChecker.isSingleRewrite(negation(negation(A)), A, Rule.DOUBLE_NEGATION));
        assertTrue(ProofChecker.isSingleRewrite(negation(or(A, B)),
                and(negation(A), negation(B)), Rule.DE_MORGAN));
        assertTrue(ProofChecker.isSingleRewrite(and(A, or(B, C)),
                or(and(A, B), and(A, C)), Rule.DISTRIBUTION));
        assertTrue(ProofChecker.isSingleRewrite(and(or(A, B), C),
                or(and(A, C), and(B, C)), Rule.DISTRIBUTION));
    }

    @Test
    public void testExchangeInsideContext() {
        Formula source = negation(and(negation(negation(A)), implies(B, C)));
        assertTrue(ProofChecker.isSingleRewrite(source,
                negation(and(A, implies(B, C))), Rule.DOUBLE_NEGATION));
        assertTrue(ProofChecker.isSingleRewrite(source,
                negation(and(negation(negation(A)), or(negation(B), C))), Rule.ARROW_EXCHANGE));
    }

    @Test
    public void testExchangeRejections() {
        // Equivalente ma con regola sbagliata
        assertFalse(ProofChecker.isSingleRewrite(implies(A, B), or(negation(A), B), Rule.DE_MORGAN));
        // Nessuna riscrittura
        assertFalse(ProofChecker.isSingleRewrite(and(A, B), and(A, B), Rule.DOUBLE_NEGATION));
        // Due posizioni riscritte nello stesso passo
        assertFalse(ProofChecker.isSingleRewrite(and(implies(A, B), implies(B, C)),
                and(or(negation(A), B), or(negation(B), C)), Rule.ARROW_EXCHANGE));
        // Commutazione: equivalente ma non prevista da alcuno schema
        assertFalse(ProofChecker.isSingleRewrite(or(A, B), or(B, A), Rule.DISTRIBUTION));
    }
}
