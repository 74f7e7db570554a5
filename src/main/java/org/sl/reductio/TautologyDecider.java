package org.sl.reductio;

import org.sl.derivation.Derivation;
import org.sl.derivation.ProofChecker;
import org.sl.dnf.DNFConverter;
import org.sl.parser.FormulaParser;
import org.sl.parser.ParseResult;
import org.sl.support.Formula;

import java.util.List;
import java.util.SortedMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * DECISORE DI TAUTOLOGIE - Pipeline completa di decisione per una formula SL
 *
 * PIPELINE:
 * 1. Assunzione della negazione dell'obiettivo (riga 1 della derivazione)
 * 2. Riduzione della negazione in DNF, registrando ogni scambio
 * 3. Ricerca di un controesempio sulla DNF
 * 4a. Controesempio trovato: la formula è refutabile
 * 4b. Nessun controesempio: reductio fino alla conclusione dell'obiettivo
 *
 * Ogni chiamata a {@link #decide(Formula)} usa una derivazione nuova, quindi la
 * stessa istanza può essere riutilizzata per decisioni successive (non concorrenti).
 */
public class TautologyDecider {

    private static final Logger LOGGER = Logger.getLogger(TautologyDecider.class.getName());

    private final CounterexampleFinder counterexampleFinder = new CounterexampleFinder();

    /** Se attivo, prove e controesempi vengono verificati prima di essere restituiti */
    private boolean verifyResults = false;

    public void setVerifyResults(boolean verifyResults) {
        this.verifyResults = verifyResults;
    }

    public boolean isVerifyResults() {
        return verifyResults;
    }

    //region DECISIONE

    /**
     * Decide se la formula è una tautologia.
     *
     * @param target formula da decidere (non null)
     * @return derivazione della formula oppure valutazione che la falsifica
     * @throws IllegalStateException se la verifica attiva rileva un risultato scorretto
     */
    public DecisionResult decide(Formula target) {
        if (target == null) {
            throw new IllegalArgumentException("Formula da decidere non può essere null");
        }

        LOGGER.fine("Decisione per: " + target);
        DecisionStatistics statistics = new DecisionStatistics();
        Derivation derivation = new Derivation();

        // FASE 1: assunzione per assurdo
        Formula negated = Formula.negation(target);
        derivation.assume(negated);

        // FASE 2: forma normale disgiuntiva della negazione
        Formula dnf = new DNFConverter(derivation).toDNF(negated);
        statistics.setDnfSize(dnf.size());

        // FASE 3: ricerca controesempio
        Counterexample counterexample = counterexampleFinder.find(dnf, target.getLetters());
        if (counterexample.isFound()) {
            statistics.recordDerivation(derivation);
            statistics.stopTimer();
            if (verifyResults) {
                verifyRefutation(target, counterexample.getValuation());
            }
            LOGGER.fine("Formula refutabile: " + counterexample.getValuation());
            return DecisionResult.refutable(counterexample.getValuation(), statistics);
        }

        // FASE 4: completamento della derivazione
        Formula conclusion = new ReductioProver(derivation).prove(dnf);
        statistics.recordDerivation(derivation);
        statistics.stopTimer();

        if (!conclusion.equals(target)) {
            throw new IllegalStateException("La derivazione conclude " + conclusion + " invece di " + target);
        }
        if (verifyResults) {
            verifyProof(derivation);
        }

        LOGGER.fine("Tautologia dimostrata in " + derivation.size() + " righe");
        return DecisionResult.tautology(derivation, statistics);
    }

    /**
     * Analizza e decide una formula testuale.
     *
     * @throws IllegalArgumentException se il testo non è una formula valida
     */
    public DecisionResult decide(String text) {
        ParseResult parsed = FormulaParser.parse(text);
        if (!parsed.isSuccess()) {
            throw new IllegalArgumentException(parsed.getError().toString());
        }
        return decide(parsed.getFormula());
    }

    //endregion

    //region VERIFICA

    private void verifyProof(Derivation derivation) {
        List<String> violations = ProofChecker.check(derivation);
        if (!violations.isEmpty()) {
            LOGGER.log(Level.SEVERE, "Derivazione non valida:\n" + derivation);
            throw new IllegalStateException("Derivazione non valida: " + violations);
        }
    }

    private void verifyRefutation(Formula target, SortedMap<Character, Boolean> valuation) {
        if (target.evaluate(valuation)) {
            LOGGER.severe("Controesempio " + valuation + " rende vera " + target);
            throw new IllegalStateException("Controesempio non falsifica la formula: " + valuation);
        }
    }

    //endregion
}
