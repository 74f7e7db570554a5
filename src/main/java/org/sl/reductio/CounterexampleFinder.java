package org.sl.reductio;

import org.sl.dnf.DNFConverter;
import org.sl.support.Formula;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * RICERCA CONTROESEMPI - Valutazione che soddisfa una formula in DNF
 *
 * Una formula in DNF è soddisfacibile se e solo se almeno un disgiunto non contiene
 * una lettera sia affermata sia negata. Il primo disgiunto coerente (da sinistra)
 * fornisce la valutazione: lettere affermate vere, tutte le altre false.
 *
 * La scomposizione avviene sull'albero, mai sulla resa testuale.
 */
public class CounterexampleFinder {

    private static final Logger LOGGER = Logger.getLogger(CounterexampleFinder.class.getName());

    /**
     * Cerca una valutazione sulle sole lettere della formula.
     */
    public Counterexample find(Formula dnf) {
        return find(dnf, dnf.getLetters());
    }

    /**
     * Cerca una valutazione che renda vera la formula in DNF.
     *
     * @param dnf formula in forma normale disgiuntiva
     * @param letters lettere da includere nella valutazione (si aggiungono quelle della formula)
     * @return controesempio trovato oppure {@link Counterexample#none()}
     * @throws IllegalArgumentException se la formula non è in DNF
     */
    public Counterexample find(Formula dnf, Collection<Character> letters) {
        if (!DNFConverter.isDNF(dnf)) {
            throw new IllegalArgumentException("Formula non in DNF: " + dnf);
        }

        List<Formula> disjuncts = new ArrayList<>();
        flatten(dnf, Formula.Type.OR, disjuncts);
        LOGGER.fine("Ricerca controesempio su " + disjuncts.size() + " disgiunti");

        for (Formula disjunct : disjuncts) {
            List<Formula> literals = new ArrayList<>();
            flatten(disjunct, Formula.Type.AND, literals);

            Set<Character> positives = new HashSet<>();
            Set<Character> negatives = new HashSet<>();
            for (Formula literal : literals) {
                (literal.isPositiveLiteral() ? positives : negatives).add(literal.getLiteralLetter());
            }

            // P & ~P: nessuna valutazione rende vero il disgiunto
            Set<Character> clash = new HashSet<>(positives);
            clash.retainAll(negatives);
            if (!clash.isEmpty()) {
                LOGGER.finest("Disgiunto contraddittorio su " + clash + ": " + disjunct);
                continue;
            }

            Map<Character, Boolean> valuation = new TreeMap<>();
            for (Character letter : letters) {
                valuation.put(letter, false);
            }
            for (Character letter : dnf.getLetters()) {
                valuation.put(letter, false);
            }
            for (Character letter : positives) {
                valuation.put(letter, true);
            }

            LOGGER.fine("Controesempio trovato dal disgiunto " + disjunct + ": " + valuation);
            return Counterexample.of(valuation);
        }

        LOGGER.fine("Tutti i disgiunti sono contraddittori, nessun controesempio");
        return Counterexample.none();
    }

    /**
     * Appiattisce gli annidamenti dello stesso connettivo, da sinistra a destra.
     */
    private static void flatten(Formula formula, Formula.Type type, List<Formula> out) {
        if (formula.getType() == type) {
            flatten(formula.getLeft(), type, out);
            flatten(formula.getRight(), type, out);
        } else {
            out.add(formula);
        }
    }
}
