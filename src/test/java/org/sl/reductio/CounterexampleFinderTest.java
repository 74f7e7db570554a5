package org.sl.reductio;

import org.junit.jupiter.api.Test;
import org.sl.support.Formula;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.sl.support.Formula.*;

public class CounterexampleFinderTest {

    private static final Formula A = atom('A');
    private static final Formula B = atom('B');
    private static final Formula C = atom('C');

    private final CounterexampleFinder finder = new CounterexampleFinder();

    @Test
    public void testFirstConsistentDisjunctWins() {
        Formula dnf = or(and(A, negation(A)), or(and(B, negation(C)), A));
        Counterexample counterexample = finder.find(dnf);

        assertTrue(counterexample.isFound());
        assertEquals(Map.of('A', false, 'B', true, 'C', false), counterexample.getValuation());
    }

    @Test
    public void testAllDisjunctsContradictory() {
        Formula dnf = or(and(A, negation(A)), and(B, and(C, negation(B))));
        Counterexample counterexample = finder.find(dnf);

        assertFalse(counterexample.isFound());
        assertTrue(counterexample.getValuation().isEmpty());
    }

    @Test
    public void testSingleLiteral() {
        assertEquals(Map.of('A', true), finder.find(A).getValuation());
        assertEquals(Map.of('A', false), finder.find(negation(A)).getValuation());
    }

    @Test
    public void testExtraLettersDefaultToFalse() {
        Counterexample counterexample = finder.find(A, List.of('C', 'A', 'B'));
        assertEquals(List.of('A', 'B', 'C'), List.copyOf(counterexample.getValuation().keySet()));
        assertEquals(Map.of('A', true, 'B', false, 'C', false), counterexample.getValuation());
    }

    @Test
    public void testNonDNFRejected() {
        assertThrows(IllegalArgumentException.class, () -> finder.find(and(A, or(B, C))));
        assertThrows(IllegalArgumentException.class, () -> finder.find(implies(A, B)));
    }

    @Test
    public void testValuationIsUnmodifiable() {
        Counterexample counterexample = finder.find(A);
        assertThrows(UnsupportedOperationException.class, () -> counterexample.getValuation().put('B', true));
    }
}
