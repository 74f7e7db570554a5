package org.sl.parser;

import java.util.Objects;

/**
 * Errore di parsing restituito come valore: testo in ingresso e motivo del rifiuto.
 */
public final class ParseError {

    private final String input;
    private final String reason;

    public ParseError(String input, String reason) {
        this.input = Objects.requireNonNull(input, "input");
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    /** Testo originale così come fornito al parser */
    public String getInput() {
        return input;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParseError)) return false;
        ParseError that = (ParseError) o;
        return input.equals(that.input) && reason.equals(that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(input, reason);
    }

    @Override
    public String toString() {
        return "Formula non valida \"" + input + "\": " + reason;
    }
}
