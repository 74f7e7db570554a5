package org.sl.dnf;

import org.sl.derivation.Derivation;
import org.sl.derivation.Rule;
import org.sl.support.Formula;

import java.util.concurrent.CancellationException;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * CONVERTITORE DNF - Riscrittura a punto fisso in Forma Normale Disgiuntiva
 *
 * Trasforma una formula in una equivalente in DNF applicando una regola di scambio
 * alla volta e registrando ogni passo come riga della derivazione. La formula da
 * convertire deve trovarsi nell'ultima riga della derivazione: ogni scambio cita
 * la riga immediatamente precedente.
 *
 * PIPELINE (ordine fisso, ogni fase iterata fino al punto fisso):
 * 1. Eliminazione frecce: (P -> Q) ⇒ (~P v Q), (P <-> Q) ⇒ ((P & Q) v (~P & ~Q))
 * 2. Negazioni verso gli atomi: ~~P ⇒ P, ~(P & Q) ⇒ (~P v ~Q), ~(P v Q) ⇒ (~P & ~Q)
 * 3. Distribuzione: ((P v Q) & R) ⇒ ((P & R) v (Q & R)), (P & (Q v R)) ⇒ ((P & Q) v (P & R))
 *
 * STRATEGIA DI SELEZIONE:
 * In ogni fase si riscrive il primo nodo riducibile visitando prima il figlio
 * sinistro, poi il destro, infine il nodo stesso.
 */
public class DNFConverter {

    private static final Logger LOGGER = Logger.getLogger(DNFConverter.class.getName());

    /** Derivazione in cui vengono registrati gli scambi */
    private final Derivation derivation;

    public DNFConverter(Derivation derivation) {
        if (derivation == null) {
            throw new IllegalArgumentException("Derivazione non può essere null");
        }
        this.derivation = derivation;
    }

    //region INTERFACCIA PUBBLICA CONVERSIONE DNF

    /**
     * METODO PRINCIPALE - Converte la formula in DNF registrando ogni passo.
     *
     * @param formula formula presente nell'ultima riga della derivazione
     * @return formula equivalente in DNF (coincide con l'ultima riga al termine)
     */
    public Formula toDNF(Formula formula) {
        int firstRow = derivation.lastRowNumber();
        LOGGER.fine("Inizio conversione DNF per: " + formula);

        Formula result = removeArrows(formula);
        LOGGER.finest("Dopo eliminazione frecce: " + result);

        result = pushNegations(result);
        LOGGER.finest("Dopo spinta negazioni: " + result);

        result = distributeConjunctions(result);
        LOGGER.fine("Conversione DNF completata in " + (derivation.lastRowNumber() - firstRow)
                + " scambi: " + result);

        return result;
    }

    /**
     * Fase 1: elimina condizionali e bicondizionali.
     */
    public Formula removeArrows(Formula formula) {
        return rewriteUntilStable(formula, this::removeFirstArrow);
    }

    /**
     * Fase 2: spinge le negazioni fino agli atomi. Richiede una formula senza frecce.
     *
     * @throws IllegalStateException se incontra la negazione di un condizionale o bicondizionale
     */
    public Formula pushNegations(Formula formula) {
        return rewriteUntilStable(formula, this::pushFirstNegation);
    }

    /**
     * Fase 3: distribuisce le congiunzioni sulle disgiunzioni. Richiede negazioni solo su atomi.
     */
    public Formula distributeConjunctions(Formula formula) {
        return rewriteUntilStable(formula, this::distributeFirstConjunction);
    }

    //endregion

    //region MOTORE A PUNTO FISSO

    /**
     * Applica ripetutamente un passo di riscrittura finché la formula non cambia,
     * registrando ogni formula intermedia come scambio dell'ultima riga.
     */
    private Formula rewriteUntilStable(Formula formula, Function<Formula, RewriteStep> step) {
        Formula current = formula;
        checkForInterruption();
        RewriteStep next = step.apply(current);

        while (!next.formula.equals(current)) {
            derivation.exchange(next.formula, next.rule);
            current = next.formula;
            checkForInterruption();
            next = step.apply(current);
        }
        return current;
    }

    /**
     * Interrompe la conversione se il thread è stato interrotto (timeout del chiamante).
     *
     * @throws CancellationException se interruzione rilevata
     */
    private static void checkForInterruption() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Conversione DNF interrotta");
        }
    }

    /**
     * Prova il passo sul sottoalbero sinistro, poi sul destro. Restituisce il
     * nodo ricostruito con il primo operando riscritto, oppure nessuna modifica.
     */
    private static RewriteStep rewriteOperands(Formula formula, Function<Formula, RewriteStep> step) {
        RewriteStep left = step.apply(formula.getLeft());
        if (left.isRewrite()) {
            return new RewriteStep(Formula.binary(formula.getType(), left.formula, formula.getRight()), left.rule);
        }

        RewriteStep right = step.apply(formula.getRight());
        if (right.isRewrite()) {
            return new RewriteStep(Formula.binary(formula.getType(), formula.getLeft(), right.formula), right.rule);
        }

        return RewriteStep.unchanged(formula);
    }

    //endregion

    //region FASE 1: ELIMINAZIONE FRECCE

    private RewriteStep removeFirstArrow(Formula formula) {
        return switch (formula.getType()) {
            case ATOM -> RewriteStep.unchanged(formula);

            case NOT -> {
                RewriteStep inner = removeFirstArrow(formula.getOperand());
                yield inner.isRewrite()
                        ? new RewriteStep(Formula.negation(inner.formula), inner.rule)
                        : RewriteStep.unchanged(formula);
            }

            case AND, OR -> rewriteOperands(formula, this::removeFirstArrow);

            case IMPLIES -> {
                RewriteStep operands = rewriteOperands(formula, this::removeFirstArrow);
                if (operands.isRewrite()) yield operands;

                // (P -> Q) ⇒ (~P v Q)
                Formula p = formula.getLeft();
                Formula q = formula.getRight();
                yield new RewriteStep(Formula.or(Formula.negation(p), q), Rule.ARROW_EXCHANGE);
            }

            case IFF -> {
                RewriteStep operands = rewriteOperands(formula, this::removeFirstArrow);
                if (operands.isRewrite()) yield operands;

                // (P <-> Q) ⇒ ((P & Q) v (~P & ~Q))
                Formula p = formula.getLeft();
                Formula q = formula.getRight();
                yield new RewriteStep(
                        Formula.or(Formula.and(p, q), Formula.and(Formula.negation(p), Formula.negation(q))),
                        Rule.BICONDITIONAL_EXCHANGE);
            }
        };
    }

    //endregion

    //region FASE 2: NEGAZIONI VERSO GLI ATOMI

    private RewriteStep pushFirstNegation(Formula formula) {
        if (formula.isAtom()) {
            return RewriteStep.unchanged(formula);
        }
        if (formula.isBinary()) {
            return rewriteOperands(formula, this::pushFirstNegation);
        }

        Formula body = formula.getOperand();
        return switch (body.getType()) {
            case ATOM -> RewriteStep.unchanged(formula);

            case NOT -> {
                // ~~P: si stabilizza prima P, poi si elimina la doppia negazione
                Formula inner = body.getOperand();
                RewriteStep innerStep = pushFirstNegation(inner);
                yield innerStep.isRewrite()
                        ? new RewriteStep(Formula.negation(Formula.negation(innerStep.formula)), innerStep.rule)
                        : new RewriteStep(inner, Rule.DOUBLE_NEGATION);
            }

            case AND, OR -> {
                RewriteStep operands = rewriteOperands(body, this::pushFirstNegation);
                if (operands.isRewrite()) {
                    yield new RewriteStep(Formula.negation(operands.formula), operands.rule);
                }

                // De Morgan: ~(P & Q) ⇒ (~P v ~Q), ~(P v Q) ⇒ (~P & ~Q)
                Formula.Type dual = body.getType() == Formula.Type.AND ? Formula.Type.OR : Formula.Type.AND;
                yield new RewriteStep(
                        Formula.binary(dual, Formula.negation(body.getLeft()), Formula.negation(body.getRight())),
                        Rule.DE_MORGAN);
            }

            case IMPLIES, IFF -> throw new IllegalStateException(
                    "Negazione di " + body.getType() + " non ammessa: eliminare prima le frecce in " + formula);
        };
    }

    //endregion

    //region FASE 3: DISTRIBUZIONE CONGIUNZIONI

    private RewriteStep distributeFirstConjunction(Formula formula) {
        if (!formula.isBinary()) {
            return RewriteStep.unchanged(formula);
        }

        RewriteStep operands = rewriteOperands(formula, this::distributeFirstConjunction);
        if (operands.isRewrite() || formula.getType() != Formula.Type.AND) {
            return operands;
        }

        Formula left = formula.getLeft();
        Formula right = formula.getRight();

        if (left.getType() == Formula.Type.OR) {
            // ((P v Q) & R) ⇒ ((P & R) v (Q & R))
            return new RewriteStep(
                    Formula.or(Formula.and(left.getLeft(), right), Formula.and(left.getRight(), right)),
                    Rule.DISTRIBUTION);
        }

        if (right.getType() == Formula.Type.OR) {
            // (P & (Q v R)) ⇒ ((P & Q) v (P & R))
            return new RewriteStep(
                    Formula.or(Formula.and(left, right.getLeft()), Formula.and(left, right.getRight())),
                    Rule.DISTRIBUTION);
        }

        return RewriteStep.unchanged(formula);
    }

    //endregion

    //region VERIFICA FORMA NORMALE

    /**
     * Verifica che la formula sia una disgiunzione di congiunzioni di letterali.
     * Sono ammessi annidamenti arbitrari di OR sopra AND e di AND sopra letterali.
     */
    public static boolean isDNF(Formula formula) {
        return switch (formula.getType()) {
            case OR -> isDNF(formula.getLeft()) && isDNF(formula.getRight());
            default -> isConjunctionOfLiterals(formula);
        };
    }

    private static boolean isConjunctionOfLiterals(Formula formula) {
        if (formula.getType() == Formula.Type.AND) {
            return isConjunctionOfLiterals(formula.getLeft()) && isConjunctionOfLiterals(formula.getRight());
        }
        return formula.isLiteral();
    }

    //endregion

    /**
     * Esito di un singolo passo: formula risultante e regola applicata (null se invariata).
     */
    private record RewriteStep(Formula formula, Rule rule) {

        static RewriteStep unchanged(Formula formula) {
            return new RewriteStep(formula, null);
        }

        boolean isRewrite() {
            return rule != null;
        }
    }
}
