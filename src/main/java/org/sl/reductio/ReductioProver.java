package org.sl.reductio;

import org.sl.derivation.Derivation;
import org.sl.derivation.DerivationRow;
import org.sl.derivation.Ion;
import org.sl.derivation.Rule;
import org.sl.derivation.Scope;
import org.sl.support.Formula;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.logging.Logger;

/**
 * MOTORE DI PROVA PER ASSURDO - Completamento di una derivazione dalla DNF
 *
 * Punto di partenza: la negazione della formula obiettivo è stata assunta e ridotta
 * in DNF nell'ultima riga, e non esiste alcun controesempio. La ricerca procede
 * ricorsivamente sulla forma della formula corrente:
 *
 * • Letterale: registrato come ione; se contraddice uno ione di uno scope aperto
 *   si deriva (X & ~X), si scarica l'assunzione più interna e si prosegue
 * • Disgiunzione (P v Q): eliminazione della disgiunzione, assumendo P e poi Q e
 *   portando entrambi i rami alla stessa conclusione
 * • Congiunzione (P & Q): eliminazione della congiunzione, prima P e, se non ha
 *   chiuso uno scope, Q
 * • Condizionale: con stack vuoto è (~T -> contraddizione) e si conclude T
 *
 * Ogni chiamata ricorsiva presuppone che la formula ricevuta sia nell'ultima riga.
 * Il parametro goal, se presente, forza la conclusione da raggiungere quando si
 * trova una contraddizione, per far convergere i rami di una disgiunzione.
 */
public class ReductioProver {

    private static final Logger LOGGER = Logger.getLogger(ReductioProver.class.getName());

    private final Derivation derivation;

    public ReductioProver(Derivation derivation) {
        if (derivation == null) {
            throw new IllegalArgumentException("Derivazione non può essere null");
        }
        this.derivation = derivation;
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Completa la derivazione a partire dalla DNF nell'ultima riga.
     *
     * @param dnf forma normale della negazione assunta, priva di controesempi
     * @return formula conclusa dalla prova (l'obiettivo originale)
     * @throws IllegalStateException se la prova non si chiude: la DNF ammetteva un controesempio
     */
    public Formula prove(Formula dnf) {
        if (!derivation.hasOpenScopes()) {
            throw new IllegalStateException("La reductio richiede l'assunzione della negazione dell'obiettivo");
        }
        if (!derivation.lastRow().getFormula().equals(dnf)) {
            throw new IllegalStateException("La DNF deve trovarsi nell'ultima riga della derivazione");
        }

        LOGGER.fine("Inizio reductio su: " + dnf);
        Formula conclusion = reductio(dnf, null);

        if (derivation.hasOpenScopes() || derivation.lastRow().getRule() != Rule.NEGATION_ELIMINATION) {
            LOGGER.severe("Reductio interrotta su " + conclusion + " con " + derivation.getOpenScopeCount()
                    + " scope aperti");
            throw new IllegalStateException("Nessuna contraddizione raggiungibile da " + conclusion
                    + ": la formula non è una tautologia");
        }

        LOGGER.fine("Reductio completata in " + derivation.size() + " righe");
        return conclusion;
    }

    //endregion

    //region RICERCA RICORSIVA

    /**
     * Passo ricorsivo della reductio.
     *
     * @param formula formula dell'ultima riga
     * @param goal conclusione imposta alla prossima contraddizione, o null
     * @return formula raggiunta: un condizionale se uno scope è stato scaricato,
     *         il letterale stesso se non è emersa alcuna contraddizione
     * @throws CancellationException se il thread è stato interrotto
     */
    Formula reductio(Formula formula, Formula goal) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Reductio interrotta su " + formula);
        }
        if (formula.isLiteral()) {
            return checkContradiction(formula, goal);
        }

        return switch (formula.getType()) {
            case OR -> reductio(introduceArrow(eliminateDisjunction(formula, goal)), null);

            case AND -> eliminateConjunction(formula, goal);

            case IMPLIES -> derivation.hasOpenScopes() ? formula : eliminateNegation(formula);

            default -> throw new IllegalStateException("Formula non in DNF durante la reductio: " + formula);
        };
    }

    /**
     * Registra il letterale come ione e cerca uno ione di polarità opposta negli scope aperti.
     */
    private Formula checkContradiction(Formula literal, Formula goal) {
        int row = derivation.lastRowNumber();
        Ion ion = Ion.of(literal, row);
        derivation.addIon(ion);

        Ion opposite = derivation.findContradiction(ion);
        if (opposite == null) {
            LOGGER.finest("Nessuna contraddizione per " + ion);
            return literal;
        }

        Formula derived = introduceContradiction(ion.getLetter(), opposite.getRowNumber(), row);
        if (goal != null && !goal.equals(derived)) {
            // Da una contraddizione segue qualsiasi formula
            derivation.exchange(goal, Rule.EX_FALSO);
            derived = goal;
        }

        return reductio(introduceArrow(derived), null);
    }

    //endregion

    //region REGOLE DI INFERENZA

    /**
     * (P v Q), (P -> R), (Q -> R) ⇒ R
     *
     * Il primo ramo determina R (o lo riceve come goal), il secondo è forzato a concludere R.
     */
    private Formula eliminateDisjunction(Formula disjunction, Formula goal) {
        int disjunctionRow = derivation.lastRowNumber();

        derivation.assume(disjunction.getLeft());
        Formula firstArrow = reductio(disjunction.getLeft(), goal);
        int firstRow = derivation.lastRowNumber();
        if (firstArrow.getType() != Formula.Type.IMPLIES) {
            throw new IllegalStateException("Ramo sinistro di " + disjunction + " senza contraddizione");
        }

        Formula conclusion = firstArrow.getRight();
        derivation.assume(disjunction.getRight());
        Formula secondArrow = reductio(disjunction.getRight(), conclusion);
        int secondRow = derivation.lastRowNumber();
        if (!secondArrow.equals(Formula.implies(disjunction.getRight(), conclusion))) {
            throw new IllegalStateException("Ramo destro di " + disjunction + " non conclude " + conclusion);
        }

        derivation.append(conclusion, Rule.OR_ELIMINATION, List.of(disjunctionRow, firstRow, secondRow));
        return conclusion;
    }

    /**
     * (P & Q) ⇒ P, Q
     *
     * Se l'analisi di P ha scaricato uno scope il suo risultato è definitivo e Q non serve.
     */
    private Formula eliminateConjunction(Formula conjunction, Formula goal) {
        int conjunctionRow = derivation.lastRowNumber();

        derivation.append(conjunction.getLeft(), Rule.AND_ELIMINATION, List.of(conjunctionRow));
        int scopeId = derivation.currentScopeId();
        Formula result = reductio(conjunction.getLeft(), goal);

        if (scopeId != derivation.currentScopeId()) {
            return result;
        }

        derivation.append(conjunction.getRight(), Rule.AND_ELIMINATION, List.of(conjunctionRow));
        return reductio(conjunction.getRight(), goal);
    }

    /**
     * X, ~X ⇒ (X & ~X)
     */
    private Formula introduceContradiction(char letter, int firstRow, int secondRow) {
        Formula atom = Formula.atom(letter);
        Formula contradiction = Formula.and(atom, Formula.negation(atom));
        derivation.append(contradiction, Rule.AND_INTRODUCTION,
                List.of(Math.min(firstRow, secondRow), Math.max(firstRow, secondRow)));
        return contradiction;
    }

    /**
     * Scarica l'assunzione più interna: da | P ... | Q si conclude (P -> Q).
     */
    private Formula introduceArrow(Formula consequent) {
        int consequentRow = derivation.lastRowNumber();
        Scope scope = derivation.discharge();
        DerivationRow assumption = derivation.getRow(scope.getAssumptionRow());

        Formula conditional = Formula.implies(assumption.getFormula(), consequent);
        derivation.append(conditional, Rule.ARROW_INTRODUCTION, List.of(scope.getAssumptionRow(), consequentRow));
        return conditional;
    }

    /**
     * (~P -> (Q & ~Q)) ⇒ P
     */
    private Formula eliminateNegation(Formula conditional) {
        Formula assumption = conditional.getLeft();
        if (!assumption.isNegation()) {
            throw new IllegalStateException("Assunzione iniziale non negata: " + assumption);
        }
        Formula target = assumption.getOperand();
        derivation.exchange(target, Rule.NEGATION_ELIMINATION);
        return target;
    }

    //endregion
}
