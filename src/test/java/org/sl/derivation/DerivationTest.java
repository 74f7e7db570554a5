package org.sl.derivation;

import org.junit.jupiter.api.Test;
import org.sl.support.Formula;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.sl.support.Formula.*;

public class DerivationTest {

    private static final Formula A = atom('A');
    private static final Formula B = atom('B');

    @Test
    public void testRowsAreNumberedDensely() {
        Derivation derivation = new Derivation();
        derivation.assume(negation(negation(A)));
        derivation.exchange(A, Rule.DOUBLE_NEGATION);

        assertEquals(2, derivation.size());
        assertEquals(2, derivation.lastRowNumber());
        assertEquals(1, derivation.getRow(1).getNumber());
        assertEquals(List.of(1), derivation.lastRow().getCitations());
        assertEquals(A, derivation.lastRow().getFormula());
    }

    @Test
    public void testAssumptionOpensScopeOnItsOwnRow() {
        Derivation derivation = new Derivation();
        assertEquals(Derivation.NO_SCOPE, derivation.currentScopeId());
        assertFalse(derivation.hasOpenScopes());

        DerivationRow first = derivation.assume(A);
        DerivationRow second = derivation.assume(B);

        assertEquals(1, first.getOpenScopes());
        assertEquals(2, second.getOpenScopes());
        assertEquals(2, derivation.getOpenScopeCount());
    }

    @Test
    public void testScopeIdsAreNeverReused() {
        Derivation derivation = new Derivation();
        derivation.assume(A);
        int outer = derivation.currentScopeId();
        derivation.assume(B);
        int inner = derivation.currentScopeId();
        assertEquals(List.of(1, 2), derivation.getOpenScopes().stream().map(Scope::getAssumptionRow).toList());

        Scope closed = derivation.discharge();
        assertEquals(inner, closed.getId());
        assertEquals(2, closed.getAssumptionRow());
        assertEquals(outer, derivation.currentScopeId());

        derivation.assume(B);
        assertNotEquals(inner, derivation.currentScopeId());
        assertNotEquals(outer, derivation.currentScopeId());
    }

    @Test
    public void testInvalidCitationsRejected() {
        Derivation derivation = new Derivation();
        derivation.assume(and(A, B));

        assertThrows(IllegalArgumentException.class,
                () -> derivation.append(A, Rule.AND_ELIMINATION, List.of(2)));
        assertThrows(IllegalArgumentException.class,
                () -> derivation.append(A, Rule.AND_ELIMINATION, List.of(0)));
        assertEquals(1, derivation.size());
    }

    @Test
    public void testMisuseOnEmptyDerivation() {
        Derivation derivation = new Derivation();
        assertThrows(IllegalStateException.class, () -> derivation.exchange(A, Rule.DE_MORGAN));
        assertThrows(IllegalStateException.class, derivation::discharge);
        assertThrows(IllegalStateException.class, derivation::lastRow);
        assertThrows(IllegalStateException.class, () -> derivation.addIon(new Ion(1, true, 'A')));
        assertThrows(IllegalArgumentException.class, () -> derivation.getRow(1));
    }

    @Test
    public void testContradictionSearchPrefersOldestScope() {
        Derivation derivation = new Derivation();
        derivation.assume(A);
        derivation.addIon(Ion.of(A, 1));
        derivation.assume(A);
        derivation.addIon(Ion.of(A, 2));
        derivation.assume(negation(A));

        Ion negative = Ion.of(negation(A), 3);
        Ion found = derivation.findContradiction(negative);
        assertNotNull(found);
        assertEquals(1, found.getRowNumber());

        assertNull(derivation.findContradiction(Ion.of(A, 3)));
        assertNull(derivation.findContradiction(new Ion(3, false, 'B')));
    }

    @Test
    public void testIonsDisappearWithTheirScope() {
        Derivation derivation = new Derivation();
        derivation.assume(B);
        derivation.assume(A);
        derivation.addIon(Ion.of(A, 2));
        derivation.discharge();

        assertNull(derivation.findContradiction(new Ion(3, false, 'A')));
    }

    @Test
    public void testIonRequiresLiteral() {
        assertThrows(IllegalArgumentException.class, () -> Ion.of(and(A, B), 1));
        Ion positive = Ion.of(A, 4);
        Ion negative = Ion.of(negation(A), 5);
        assertTrue(positive.contradicts(negative));
        assertFalse(positive.contradicts(Ion.of(A, 6)));
        assertFalse(negative.isPositive());
        assertEquals('A', negative.getLetter());
    }

    @Test
    public void testRowRendering() {
        Derivation derivation = new Derivation();
        derivation.assume(negation(implies(A, A)));
        derivation.exchange(negation(or(negation(A), A)), Rule.ARROW_EXCHANGE);
        derivation.assume(A);

        List<String> lines = derivation.toString().lines().toList();
        assertEquals("1. | ~(A -> A)    Assume", lines.get(0));
        assertEquals("2. | ~(~A v A)    -> exch. 1", lines.get(1));
        assertEquals("3. | | A    Assume", lines.get(2));
    }

    @Test
    public void testRuleLabels() {
        assertEquals("Assume", Rule.ASSUME.getLabel());
        assertEquals("<->/v exch.", Rule.BICONDITIONAL_EXCHANGE.toString());
        assertEquals("Any Contra.", Rule.EX_FALSO.getLabel());
        assertTrue(Rule.DISTRIBUTION.isExchange());
        assertFalse(Rule.OR_ELIMINATION.isExchange());
    }
}
