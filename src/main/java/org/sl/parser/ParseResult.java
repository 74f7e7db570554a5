package org.sl.parser;

import org.sl.support.Formula;

/**
 * RISULTATO PARSING - Esito tipizzato di {@link FormulaParser#parse(String)}
 *
 * Contiene esattamente uno tra formula e errore. Il parser non lancia mai
 * eccezioni verso il chiamante: ogni rifiuto viene restituito come {@link ParseError}.
 */
public final class ParseResult {

    private final Formula formula;
    private final ParseError error;

    private ParseResult(Formula formula, ParseError error) {
        this.formula = formula;
        this.error = error;
    }

    /**
     * @param formula formula riconosciuta (non null)
     */
    public static ParseResult success(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula di un parsing riuscito non può essere null");
        }
        return new ParseResult(formula, null);
    }

    /**
     * @param error motivo del rifiuto (non null)
     */
    public static ParseResult failure(ParseError error) {
        if (error == null) {
            throw new IllegalArgumentException("Errore di un parsing fallito non può essere null");
        }
        return new ParseResult(null, error);
    }

    public boolean isSuccess() {
        return formula != null;
    }

    /**
     * @return formula riconosciuta
     * @throws IllegalStateException se il parsing è fallito
     */
    public Formula getFormula() {
        if (formula == null) {
            throw new IllegalStateException("Nessuna formula: " + error);
        }
        return formula;
    }

    /**
     * @return errore di parsing
     * @throws IllegalStateException se il parsing è riuscito
     */
    public ParseError getError() {
        if (error == null) {
            throw new IllegalStateException("Parsing riuscito, nessun errore disponibile");
        }
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "OK " + formula : error.toString();
    }
}
