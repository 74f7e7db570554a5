package org.sl.support;

import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * FORMULA LOGICA ENUNCIATIVA - Albero immutabile di una formula SL
 *
 * Rappresenta una formula della logica enunciativa come albero sintattico chiuso:
 * atomi (singola lettera maiuscola), negazioni e connettivi binari. Ogni nodo è
 * immutabile, quindi le trasformazioni producono sempre nuovi alberi e i nodi
 * possono essere condivisi liberamente tra formule diverse.
 *
 * TIPI DI NODO:
 * • ATOM: lettera enunciativa A..Z
 * • NOT: negazione ~X
 * • AND, OR, IMPLIES, IFF: connettivi binari (X & Y), (X v Y), (X -> Y), (X <-> Y)
 *
 * L'uguaglianza è strutturale: due formule sono uguali se hanno lo stesso albero.
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodo supportati, con il simbolo usato nella resa testuale.
     */
    public enum Type {
        ATOM(null),
        NOT("~"),
        AND("&"),
        OR("v"),
        IMPLIES("->"),
        IFF("<->");

        private final String symbol;

        Type(String symbol) {
            this.symbol = symbol;
        }

        /** Simbolo del connettivo (null per gli atomi) */
        public String getSymbol() {
            return symbol;
        }

        public boolean isBinary() {
            return this != ATOM && this != NOT;
        }
    }

    private final Type type;

    /** Lettera enunciativa (solo per ATOM, altrimenti 0) */
    private final char letter;

    /** Operando della negazione (solo per NOT) */
    private final Formula operand;

    /** Operandi sinistro e destro (solo per connettivi binari) */
    private final Formula left;
    private final Formula right;

    /** Hash precalcolato, gli alberi sono immutabili */
    private final int hash;

    //endregion

    //region COSTRUZIONE

    private Formula(Type type, char letter, Formula operand, Formula left, Formula right) {
        this.type = type;
        this.letter = letter;
        this.operand = operand;
        this.left = left;
        this.right = right;
        this.hash = Objects.hash(type, letter, operand, left, right);
    }

    /**
     * Costruisce una formula atomica.
     *
     * @param letter lettera enunciativa maiuscola A..Z
     * @return atomo
     * @throws IllegalArgumentException se la lettera non è maiuscola
     */
    public static Formula atom(char letter) {
        if (letter < 'A' || letter > 'Z') {
            throw new IllegalArgumentException("Lettera enunciativa non valida: '" + letter + "'");
        }
        return new Formula(Type.ATOM, letter, null, null, null);
    }

    /**
     * Costruisce la negazione di una formula.
     *
     * @param operand formula da negare (non null)
     * @return ~operand
     */
    public static Formula negation(Formula operand) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando per negazione non può essere null");
        }
        return new Formula(Type.NOT, (char) 0, operand, null, null);
    }

    /**
     * Costruisce una formula binaria con il connettivo indicato.
     *
     * @param type AND, OR, IMPLIES o IFF
     * @param left operando sinistro (non null)
     * @param right operando destro (non null)
     * @return (left type right)
     * @throws IllegalArgumentException se il tipo non è binario o un operando è null
     */
    public static Formula binary(Type type, Formula left, Formula right) {
        if (type == null || !type.isBinary()) {
            throw new IllegalArgumentException("Tipo deve essere un connettivo binario, ricevuto: " + type);
        }
        if (left == null || right == null) {
            throw new IllegalArgumentException("Operandi di " + type + " non possono essere null");
        }
        return new Formula(type, (char) 0, null, left, right);
    }

    public static Formula and(Formula left, Formula right) {
        return binary(Type.AND, left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return binary(Type.OR, left, right);
    }

    public static Formula implies(Formula left, Formula right) {
        return binary(Type.IMPLIES, left, right);
    }

    public static Formula iff(Formula left, Formula right) {
        return binary(Type.IFF, left, right);
    }

    //endregion

    //region ACCESSORS

    public Type getType() {
        return type;
    }

    /**
     * @return lettera dell'atomo
     * @throws IllegalStateException se il nodo non è un atomo
     */
    public char getLetter() {
        requireType(Type.ATOM);
        return letter;
    }

    /**
     * @return operando della negazione
     * @throws IllegalStateException se il nodo non è una negazione
     */
    public Formula getOperand() {
        requireType(Type.NOT);
        return operand;
    }

    public Formula getLeft() {
        requireBinary();
        return left;
    }

    public Formula getRight() {
        requireBinary();
        return right;
    }

    public boolean isAtom() {
        return type == Type.ATOM;
    }

    public boolean isNegation() {
        return type == Type.NOT;
    }

    public boolean isBinary() {
        return type.isBinary();
    }

    private void requireType(Type expected) {
        if (type != expected) {
            throw new IllegalStateException("Operazione valida solo per " + expected + ", nodo di tipo " + type);
        }
    }

    private void requireBinary() {
        if (!type.isBinary()) {
            throw new IllegalStateException("Operazione valida solo per connettivi binari, nodo di tipo " + type);
        }
    }

    //endregion

    //region LETTERALI

    /**
     * Un letterale è un atomo oppure la negazione di un atomo.
     */
    public boolean isLiteral() {
        return type == Type.ATOM || (type == Type.NOT && operand.type == Type.ATOM);
    }

    public boolean isPositiveLiteral() {
        return type == Type.ATOM;
    }

    /**
     * Restituisce la lettera governata da un letterale: A per A e per ~A.
     *
     * @throws IllegalStateException se la formula non è un letterale
     */
    public char getLiteralLetter() {
        if (!isLiteral()) {
            throw new IllegalStateException("Formula non è un letterale: " + this);
        }
        return type == Type.ATOM ? letter : operand.letter;
    }

    //endregion

    //region SEMANTICA

    /**
     * Valuta la formula sotto una valutazione delle lettere.
     *
     * @param valuation assegnamento lettera → valore di verità
     * @return valore di verità della formula
     * @throws IllegalArgumentException se la valutazione non copre una lettera della formula
     */
    public boolean evaluate(Map<Character, Boolean> valuation) {
        return switch (type) {
            case ATOM -> {
                Boolean value = valuation.get(letter);
                if (value == null) {
                    throw new IllegalArgumentException("Valutazione priva della lettera " + letter);
                }
                yield value;
            }
            case NOT -> !operand.evaluate(valuation);
            case AND -> left.evaluate(valuation) && right.evaluate(valuation);
            case OR -> left.evaluate(valuation) || right.evaluate(valuation);
            case IMPLIES -> !left.evaluate(valuation) || right.evaluate(valuation);
            case IFF -> left.evaluate(valuation) == right.evaluate(valuation);
        };
    }

    /**
     * @return lettere enunciative presenti nella formula, in ordine alfabetico
     */
    public SortedSet<Character> getLetters() {
        SortedSet<Character> letters = new TreeSet<>();
        collectLetters(letters);
        return letters;
    }

    private void collectLetters(SortedSet<Character> letters) {
        switch (type) {
            case ATOM -> letters.add(letter);
            case NOT -> operand.collectLetters(letters);
            default -> {
                left.collectLetters(letters);
                right.collectLetters(letters);
            }
        }
    }

    /**
     * Conta i nodi dell'albero, utile per log e statistiche.
     */
    public int size() {
        return switch (type) {
            case ATOM -> 1;
            case NOT -> 1 + operand.size();
            default -> 1 + left.size() + right.size();
        };
    }

    //endregion

    //region UGUAGLIANZA E RAPPRESENTAZIONE

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Formula)) return false;
        Formula other = (Formula) o;
        return hash == other.hash
                && type == other.type
                && letter == other.letter
                && Objects.equals(operand, other.operand)
                && Objects.equals(left, other.left)
                && Objects.equals(right, other.right);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    /**
     * Resa testuale rileggibile dal parser: A, ~X, (X op Y).
     */
    @Override
    public String toString() {
        return switch (type) {
            case ATOM -> String.valueOf(letter);
            case NOT -> "~" + operand;
            default -> "(" + left + " " + type.getSymbol() + " " + right + ")";
        };
    }

    //endregion
}
