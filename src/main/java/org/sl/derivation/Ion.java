package org.sl.derivation;

import org.sl.support.Formula;

import java.util.Objects;

/**
 * IONE - Letterale registrato durante la ricerca della prova
 *
 * Memorizza la riga in cui un letterale è stato derivato, la sua polarità
 * (positiva per A, negativa per ~A) e la lettera governata. Gli ioni servono
 * unicamente a rilevare contraddizioni tra letterali di scope ancora aperti.
 */
public final class Ion {

    private final int rowNumber;
    private final boolean positive;
    private final char letter;

    public Ion(int rowNumber, boolean positive, char letter) {
        if (rowNumber <= 0) {
            throw new IllegalArgumentException("Numero di riga deve essere > 0, ricevuto: " + rowNumber);
        }
        if (letter < 'A' || letter > 'Z') {
            throw new IllegalArgumentException("Lettera enunciativa non valida: '" + letter + "'");
        }
        this.rowNumber = rowNumber;
        this.positive = positive;
        this.letter = letter;
    }

    /**
     * Costruisce lo ione di un letterale derivato alla riga indicata.
     *
     * @throws IllegalArgumentException se la formula non è un letterale
     */
    public static Ion of(Formula literal, int rowNumber) {
        if (literal == null || !literal.isLiteral()) {
            throw new IllegalArgumentException("Uno ione richiede un letterale: " + literal);
        }
        return new Ion(rowNumber, literal.isPositiveLiteral(), literal.getLiteralLetter());
    }

    public int getRowNumber() {
        return rowNumber;
    }

    public boolean isPositive() {
        return positive;
    }

    public char getLetter() {
        return letter;
    }

    /**
     * Due ioni si contraddicono se governano la stessa lettera con polarità opposta.
     */
    public boolean contradicts(Ion other) {
        return letter == other.letter && positive != other.positive;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Ion)) return false;
        Ion ion = (Ion) o;
        return rowNumber == ion.rowNumber && positive == ion.positive && letter == ion.letter;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowNumber, positive, letter);
    }

    @Override
    public String toString() {
        return (positive ? "" : "~") + letter + "@" + rowNumber;
    }
}
