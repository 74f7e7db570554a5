package org.sl.reductio;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Esito della ricerca di un controesempio: una valutazione che rende vera la
 * forma normale della negazione, oppure nessuna.
 */
public final class Counterexample {

    private static final Counterexample NONE = new Counterexample(null);

    private final SortedMap<Character, Boolean> valuation;

    private Counterexample(SortedMap<Character, Boolean> valuation) {
        this.valuation = valuation;
    }

    public static Counterexample none() {
        return NONE;
    }

    /**
     * @param valuation assegnamento completo delle lettere (copiato)
     */
    public static Counterexample of(Map<Character, Boolean> valuation) {
        if (valuation == null) {
            throw new IllegalArgumentException("Valutazione del controesempio non può essere null");
        }
        return new Counterexample(Collections.unmodifiableSortedMap(new TreeMap<>(valuation)));
    }

    public boolean isFound() {
        return valuation != null;
    }

    /**
     * @return valutazione ordinata per lettera, vuota se nessun controesempio esiste
     */
    public SortedMap<Character, Boolean> getValuation() {
        return valuation != null ? valuation : Collections.emptySortedMap();
    }

    @Override
    public String toString() {
        return isFound() ? "Controesempio " + valuation : "Nessun controesempio";
    }
}
