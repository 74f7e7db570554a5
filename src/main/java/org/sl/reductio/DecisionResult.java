package org.sl.reductio;

import org.sl.derivation.Derivation;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * RISULTATO DECISIONE - Esito immutabile di {@link TautologyDecider#decide}
 *
 * Esattamente uno tra:
 * • Tautologia: derivazione completa della formula, verificabile riga per riga
 * • Refutabile: valutazione sotto cui la formula è falsa
 *
 * Costruibile solo tramite i factory method, che garantiscono l'esclusività dei due casi.
 */
public final class DecisionResult {

    //region ATTRIBUTI

    private final boolean tautology;

    /** Non null solo per le tautologie */
    private final Derivation proof;

    /** Non null solo per le formule refutabili */
    private final SortedMap<Character, Boolean> valuation;

    private final DecisionStatistics statistics;

    //endregion

    private DecisionResult(boolean tautology, Derivation proof, SortedMap<Character, Boolean> valuation,
                           DecisionStatistics statistics) {
        this.tautology = tautology;
        this.proof = proof;
        this.valuation = valuation;
        this.statistics = statistics != null ? statistics : new DecisionStatistics();
    }

    //region FACTORY METHODS

    /**
     * @param proof derivazione completa, senza assunzioni aperte
     */
    public static DecisionResult tautology(Derivation proof, DecisionStatistics statistics) {
        if (proof == null || proof.size() == 0) {
            throw new IllegalArgumentException("Una tautologia richiede una derivazione non vuota");
        }
        if (proof.hasOpenScopes()) {
            throw new IllegalArgumentException("Derivazione con " + proof.getOpenScopeCount() + " assunzioni aperte");
        }
        return new DecisionResult(true, proof, null, statistics);
    }

    /**
     * @param valuation valutazione che falsifica la formula (copiata)
     */
    public static DecisionResult refutable(Map<Character, Boolean> valuation, DecisionStatistics statistics) {
        if (valuation == null || valuation.isEmpty()) {
            throw new IllegalArgumentException("Una refutazione richiede una valutazione non vuota");
        }
        return new DecisionResult(false, null,
                Collections.unmodifiableSortedMap(new TreeMap<>(valuation)), statistics);
    }

    //endregion

    //region ACCESSORS

    public boolean isTautology() {
        return tautology;
    }

    public boolean isRefutable() {
        return !tautology;
    }

    /**
     * @return derivazione della formula
     * @throws IllegalStateException se la formula è refutabile
     */
    public Derivation getProof() {
        if (!tautology) {
            throw new IllegalStateException("Formula refutabile: nessuna prova disponibile");
        }
        return proof;
    }

    /**
     * @return valutazione falsificante ordinata per lettera
     * @throws IllegalStateException se la formula è una tautologia
     */
    public SortedMap<Character, Boolean> getValuation() {
        if (tautology) {
            throw new IllegalStateException("Tautologia: nessuna valutazione falsificante");
        }
        return valuation;
    }

    public DecisionStatistics getStatistics() {
        return statistics;
    }

    //endregion

    /**
     * Resa per console: derivazione numerata oppure elenco lettera: valore.
     */
    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        if (tautology) {
            output.append("Tautologia, derivazione:\n").append(proof);
        } else {
            output.append("Controesempio trovato:\n");
            for (Map.Entry<Character, Boolean> entry : valuation.entrySet()) {
                output.append("    ").append(entry.getKey()).append(": ").append(entry.getValue()).append("\n");
            }
        }
        return output.toString();
    }
}
