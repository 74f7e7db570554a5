package org.sl.derivation;

import org.sl.support.Formula;

import java.util.List;
import java.util.stream.Collectors;

/**
 * RIGA DI DERIVAZIONE - Passo immutabile di una prova
 *
 * Ogni riga registra: numero progressivo (da 1, senza buchi), numero di scope
 * aperti in quel punto, formula derivata, regola applicata e righe citate
 * (sempre con numero strettamente minore).
 */
public final class DerivationRow {

    private final int number;
    private final int openScopes;
    private final Formula formula;
    private final Rule rule;
    private final List<Integer> citations;

    DerivationRow(int number, int openScopes, Formula formula, Rule rule, List<Integer> citations) {
        this.number = number;
        this.openScopes = openScopes;
        this.formula = formula;
        this.rule = rule;
        this.citations = List.copyOf(citations);
    }

    public int getNumber() {
        return number;
    }

    /** Numero di assunzioni aperte, una barra di scope per ciascuna */
    public int getOpenScopes() {
        return openScopes;
    }

    public Formula getFormula() {
        return formula;
    }

    public Rule getRule() {
        return rule;
    }

    public List<Integer> getCitations() {
        return citations;
    }

    /**
     * Formato: {@code 3.  | |  (A & ~A)    & intro. 1, 2}
     */
    @Override
    public String toString() {
        StringBuilder scopeLines = new StringBuilder();
        for (int i = 0; i < openScopes; i++) {
            scopeLines.append(" |");
        }
        String cited = citations.stream().map(String::valueOf).collect(Collectors.joining(", "));
        return String.format("%d.%s %s    %s %s", number, scopeLines, formula, rule.getLabel(), cited).stripTrailing();
    }
}
