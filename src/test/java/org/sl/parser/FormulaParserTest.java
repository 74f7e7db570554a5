package org.sl.parser;

import org.junit.jupiter.api.Test;
import org.sl.support.Formula;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.sl.support.Formula.*;

public class FormulaParserTest {

    private static final Formula A = atom('A');
    private static final Formula B = atom('B');
    private static final Formula C = atom('C');

    private static Formula parseOk(String text) {
        ParseResult result = FormulaParser.parse(text);
        assertTrue(result.isSuccess(), () -> "atteso successo per " + text + ": " + result);
        return result.getFormula();
    }

    private static ParseError parseFail(String text) {
        ParseResult result = FormulaParser.parse(text);
        assertFalse(result.isSuccess(), () -> "atteso errore per " + text + ": " + result);
        return result.getError();
    }

    @Test
    public void testAtom() {
        assertEquals(A, parseOk("A"));
        assertEquals(atom('V'), parseOk("V"));
    }

    @Test
    public void testBinaryConnectives() {
        assertEquals(and(A, B), parseOk("(A & B)"));
        assertEquals(or(A, B), parseOk("(A v B)"));
        assertEquals(implies(A, A), parseOk("(A -> A)"));
        assertEquals(iff(A, B), parseOk("(A <-> B)"));
    }

    @Test
    public void testNegations() {
        assertEquals(negation(A), parseOk("~A"));
        assertEquals(negation(negation(A)), parseOk("~~A"));
        assertEquals(negation(or(A, B)), parseOk("~(A v B)"));
    }

    @Test
    public void testNested() {
        Formula expected = implies(implies(A, B), implies(negation(B), negation(A)));
        assertEquals(expected, parseOk("((A -> B) -> (~B -> ~A))"));
        assertEquals(iff(C, negation(and(A, B))), parseOk("(C <-> ~(A & B))"));
    }

    @Test
    public void testOuterParenthesesMayBeOmitted() {
        assertEquals(implies(implies(A, B), implies(negation(B), negation(A))),
                parseOk("(A -> B) -> (~B -> ~A)"));
        assertEquals(and(negation(A), B), parseOk("~A & B"));
        assertEquals(or(A, B), parseOk("A v B"));
    }

    @Test
    public void testWhitespaceIsStripped() {
        assertEquals(and(A, B), parseOk("  ( A\t&\nB )  "));
        assertEquals(implies(A, B), parseOk("(A - > B)"));
        assertEquals(iff(A, B), parseOk("(A < - > B)"));
    }

    @Test
    public void testLowercaseLetterRejected() {
        ParseError error = parseFail("q");
        assertEquals("q", error.getInput());
        parseFail("(A & b)");
        parseFail("v");
    }

    @Test
    public void testMalformedInputRejected() {
        parseFail("");
        parseFail("   ");
        parseFail("(A)");
        parseFail("((A & B)");
        parseFail("(A & B))");
        parseFail("(A - B)");
        parseFail("(A <- B)");
        parseFail("(A &)");
        parseFail("~");
        parseFail("AB");
        parseFail("(A # B)");
    }

    @Test
    public void testOneConnectivePerParentheses() {
        parseFail("(A & B v C)");
        parseFail("A & B v C");
        parseFail("(A -> B -> C)");
        assertEquals(or(and(A, B), C), parseOk("(A & B) v C"));
    }

    @Test
    public void testNullInput() {
        assertFalse(FormulaParser.parse(null).isSuccess());
    }

    @Test
    public void testResultAccessors() {
        ParseResult ok = FormulaParser.parse("A");
        assertThrows(IllegalStateException.class, ok::getError);

        ParseResult ko = FormulaParser.parse("a");
        assertThrows(IllegalStateException.class, ko::getFormula);
        assertFalse(ko.getError().getReason().isEmpty());
    }

    @Test
    public void testRenderRoundTrip() {
        List<String> inputs = List.of(
                "A",
                "~~~B",
                "(A -> B) -> (~B -> ~A)",
                "((A <-> ~B) v ~(C & (A -> C)))",
                "~((A v B) & ~(C <-> (A & ~A)))",
                "(((P -> Q) -> P) -> P)");

        for (String input : inputs) {
            Formula parsed = parseOk(input);
            assertEquals(parsed, parseOk(parsed.toString()), () -> "round trip fallito per " + input);
        }
    }

    @Test
    public void testDeepNestingRejectedWithoutCrash() {
        ParseError negations = parseFail("~".repeat(20000) + "A");
        assertTrue(negations.getReason().contains("annidata"));

        String parentheses = "(A & ".repeat(5000) + "B" + ")".repeat(5000);
        assertTrue(parseFail(parentheses).getReason().contains("annidata"));
    }

    @Test
    public void testModerateNestingAccepted() {
        Formula formula = parseOk("~".repeat(500) + "A");
        assertEquals(501, formula.size());

        String parentheses = "(A v ".repeat(300) + "B" + ")".repeat(300);
        assertEquals(601, parseOk(parentheses).size());
    }
}
