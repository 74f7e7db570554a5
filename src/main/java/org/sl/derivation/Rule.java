package org.sl.derivation;

/**
 * Regole di deduzione naturale ammesse in una derivazione, con l'etichetta
 * stampata nella colonna delle giustificazioni.
 */
public enum Rule {

    ASSUME("Assume"),

    // Regole di scambio, usate dalla normalizzazione in DNF
    ARROW_EXCHANGE("-> exch."),
    BICONDITIONAL_EXCHANGE("<->/v exch."),
    DOUBLE_NEGATION("~~ elim."),
    DE_MORGAN("De Morgan's"),
    DISTRIBUTION("&/v exch."),

    // Regole di inferenza, usate dalla reductio
    AND_ELIMINATION("& elim."),
    AND_INTRODUCTION("& intro."),
    ARROW_INTRODUCTION("-> intro."),
    OR_ELIMINATION("v elim."),
    NEGATION_ELIMINATION("~ elim."),
    EX_FALSO("Any Contra.");

    private final String label;

    Rule(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Le regole di scambio sostituiscono una formula con una logicamente equivalente
     * e citano sempre la sola riga precedente.
     */
    public boolean isExchange() {
        return switch (this) {
            case ARROW_EXCHANGE, BICONDITIONAL_EXCHANGE, DOUBLE_NEGATION, DE_MORGAN, DISTRIBUTION -> true;
            default -> false;
        };
    }

    @Override
    public String toString() {
        return label;
    }
}
