package org.sl.derivation;

import org.sl.support.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Stack;
import java.util.concurrent.CancellationException;
import java.util.logging.Logger;

/**
 * VERIFICATORE DI PROVE - Controllo meccanico di una derivazione completa
 *
 * Ripercorre le righe ricostruendo lo stack delle assunzioni e verifica per ognuna:
 * • numerazione densa e citazioni strettamente precedenti
 * • accessibilità delle righe citate (non chiuse in uno scope già scaricato)
 * • coerenza tra numero di scope aperti registrato e stack ricostruito
 * • correttezza della formula rispetto alla regola e alle righe citate
 * • scarico di tutte le assunzioni al termine della prova
 *
 * Una riga di scambio deve differire dalla riga citata per una sola riscrittura, nella
 * posizione in cui le due formule divergono, conforme allo schema della regola. Il
 * controllo è sintattico: il costo è lineare nella dimensione delle formule.
 */
public final class ProofChecker {

    private static final Logger LOGGER = Logger.getLogger(ProofChecker.class.getName());

    private ProofChecker() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region INTERFACCIA PUBBLICA

    /**
     * @return true se la derivazione non presenta violazioni
     */
    public static boolean isValid(Derivation derivation) {
        return check(derivation).isEmpty();
    }

    /**
     * Verifica la derivazione riga per riga.
     *
     * @param derivation derivazione da controllare
     * @return elenco delle violazioni trovate, vuoto se la prova è corretta
     */
    public static List<String> check(Derivation derivation) {
        List<String> violations = new ArrayList<>();
        List<DerivationRow> rows = derivation.getRows();

        // Catena delle assunzioni aperte in corrispondenza di ogni riga
        List<List<Integer>> chains = new ArrayList<>();
        Stack<Integer> open = new Stack<>();

        for (int i = 0; i < rows.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Verifica interrotta alla riga " + (i + 1));
            }
            DerivationRow row = rows.get(i);
            int number = row.getNumber();

            if (number != i + 1) {
                violations.add("Riga " + number + ": numerazione non densa, attesa " + (i + 1));
            }

            boolean citationsInRange = true;
            for (Integer cited : row.getCitations()) {
                if (cited < 1 || cited >= number) {
                    violations.add("Riga " + number + ": citazione " + cited + " non precedente");
                    citationsInRange = false;
                }
            }

            List<Integer> before = new ArrayList<>(open);
            if (citationsInRange) {
                checkRow(row, rows, chains, before, violations);
            }

            // Effetto della riga sullo stack delle assunzioni
            if (row.getRule() == Rule.ASSUME) {
                open.push(number);
            } else if (row.getRule() == Rule.ARROW_INTRODUCTION && !open.isEmpty()) {
                open.pop();
            }

            chains.add(new ArrayList<>(open));
            if (row.getOpenScopes() != open.size()) {
                violations.add("Riga " + number + ": " + row.getOpenScopes()
                        + " scope registrati, " + open.size() + " attesi");
            }
        }

        if (!open.isEmpty()) {
            violations.add("Assunzioni non scaricate alle righe " + open);
        }

        if (!violations.isEmpty()) {
            LOGGER.fine("Prova non valida: " + violations.size() + " violazioni");
        }
        return violations;
    }

    //endregion

    //region CONTROLLI PER REGOLA

    private static void checkRow(DerivationRow row, List<DerivationRow> rows, List<List<Integer>> chains,
                                 List<Integer> before, List<String> violations) {
        int number = row.getNumber();
        List<Integer> citations = row.getCitations();
        Formula formula = row.getFormula();
        Rule rule = row.getRule();

        for (Integer cited : citations) {
            if (!isPrefix(chains.get(cited - 1), before)) {
                violations.add("Riga " + number + ": riga " + cited + " appartiene a uno scope già chiuso");
            }
        }

        String problem = switch (rule) {
            case ASSUME -> citations.isEmpty() ? null : "un'assunzione non cita righe";

            case ARROW_EXCHANGE, BICONDITIONAL_EXCHANGE, DOUBLE_NEGATION, DE_MORGAN, DISTRIBUTION -> {
                if (citations.size() != 1) yield "uno scambio cita una sola riga";
                Formula source = formulaAt(rows, citations.get(0));
                yield isSingleRewrite(source, formula, rule) ? null
                        : formula + " non si ottiene da " + source + " con " + rule.getLabel();
            }

            case AND_ELIMINATION -> {
                if (citations.size() != 1) yield "& elim. cita una sola riga";
                Formula source = formulaAt(rows, citations.get(0));
                if (source.getType() != Formula.Type.AND) yield "riga citata non è una congiunzione";
                yield formula.equals(source.getLeft()) || formula.equals(source.getRight()) ? null
                        : formula + " non è un congiunto di " + source;
            }

            case AND_INTRODUCTION -> {
                if (citations.size() != 2) yield "& intro. cita due righe";
                if (!isContradiction(formula)) yield formula + " non è una contraddizione";
                Formula first = formulaAt(rows, citations.get(0));
                Formula second = formulaAt(rows, citations.get(1));
                boolean matches = (first.equals(formula.getLeft()) && second.equals(formula.getRight()))
                        || (first.equals(formula.getRight()) && second.equals(formula.getLeft()));
                yield matches ? null : "righe citate non giustificano " + formula;
            }

            case ARROW_INTRODUCTION -> checkArrowIntroduction(row, rows, before);

            case OR_ELIMINATION -> {
                if (citations.size() != 3) yield "v elim. cita tre righe";
                Formula disjunction = formulaAt(rows, citations.get(0));
                if (disjunction.getType() != Formula.Type.OR) yield "prima riga citata non è una disgiunzione";
                Formula leftBranch = Formula.implies(disjunction.getLeft(), formula);
                Formula rightBranch = Formula.implies(disjunction.getRight(), formula);
                boolean matches = formulaAt(rows, citations.get(1)).equals(leftBranch)
                        && formulaAt(rows, citations.get(2)).equals(rightBranch);
                yield matches ? null : "i rami non concludono entrambi " + formula;
            }

            case NEGATION_ELIMINATION -> {
                if (citations.size() != 1) yield "~ elim. cita una sola riga";
                Formula source = formulaAt(rows, citations.get(0));
                boolean matches = source.getType() == Formula.Type.IMPLIES
                        && source.getLeft().equals(Formula.negation(formula))
                        && isContradiction(source.getRight());
                yield matches ? null : formula + " non segue da " + source;
            }

            case EX_FALSO -> {
                if (citations.size() != 1) yield "Any Contra. cita una sola riga";
                Formula source = formulaAt(rows, citations.get(0));
                yield isContradiction(source) ? null : source + " non è una contraddizione";
            }
        };

        if (problem != null) {
            violations.add("Riga " + number + " (" + rule.getLabel() + "): " + problem);
        }
    }

    /**
     * L'introduzione del condizionale deve scaricare l'assunzione più interna e
     * concludere (assunzione -> formula della riga citata).
     */
    private static String checkArrowIntroduction(DerivationRow row, List<DerivationRow> rows, List<Integer> before) {
        List<Integer> citations = row.getCitations();
        if (citations.size() != 2) {
            return "-> intro. cita due righe";
        }
        if (before.isEmpty()) {
            return "nessuna assunzione aperta da scaricare";
        }

        int assumption = citations.get(0);
        if (assumption != before.get(before.size() - 1)) {
            return "la riga " + assumption + " non è l'assunzione più interna";
        }

        Formula expected = Formula.implies(formulaAt(rows, assumption), formulaAt(rows, citations.get(1)));
        return row.getFormula().equals(expected) ? null : "atteso " + expected;
    }

    //endregion

    //region SCHEMI DI SCAMBIO

    /**
     * Discende lungo la parte comune delle due formule fino al punto in cui divergono
     * e verifica che lì sia stato applicato lo schema della regola.
     */
    static boolean isSingleRewrite(Formula source, Formula result, Rule rule) {
        if (matchesSchema(source, result, rule)) {
            return true;
        }
        if (source.getType() != result.getType() || source.isAtom()) {
            return false;
        }
        if (source.isNegation()) {
            return isSingleRewrite(source.getOperand(), result.getOperand(), rule);
        }
        if (source.getLeft().equals(result.getLeft())) {
            return isSingleRewrite(source.getRight(), result.getRight(), rule);
        }
        if (source.getRight().equals(result.getRight())) {
            return isSingleRewrite(source.getLeft(), result.getLeft(), rule);
        }
        return false;
    }

    private static boolean matchesSchema(Formula source, Formula result, Rule rule) {
        return switch (rule) {
            // (P -> Q) ⇒ (~P v Q)
            case ARROW_EXCHANGE -> source.getType() == Formula.Type.IMPLIES
                    && result.equals(Formula.or(Formula.negation(source.getLeft()), source.getRight()));

            // (P <-> Q) ⇒ ((P & Q) v (~P & ~Q))
            case BICONDITIONAL_EXCHANGE -> {
                if (source.getType() != Formula.Type.IFF) yield false;
                Formula p = source.getLeft();
                Formula q = source.getRight();
                yield result.equals(Formula.or(Formula.and(p, q),
                        Formula.and(Formula.negation(p), Formula.negation(q))));
            }

            // ~~P ⇒ P
            case DOUBLE_NEGATION -> source.isNegation() && source.getOperand().isNegation()
                    && source.getOperand().getOperand().equals(result);

            // ~(P & Q) ⇒ (~P v ~Q), ~(P v Q) ⇒ (~P & ~Q)
            case DE_MORGAN -> {
                if (!source.isNegation()) yield false;
                Formula body = source.getOperand();
                Formula.Type type = body.getType();
                if (type != Formula.Type.AND && type != Formula.Type.OR) yield false;
                Formula.Type dual = type == Formula.Type.AND ? Formula.Type.OR : Formula.Type.AND;
                yield result.equals(Formula.binary(dual,
                        Formula.negation(body.getLeft()), Formula.negation(body.getRight())));
            }

            // ((P v Q) & R) ⇒ ((P & R) v (Q & R)), (P & (Q v R)) ⇒ ((P & Q) v (P & R))
            case DISTRIBUTION -> {
                if (source.getType() != Formula.Type.AND) yield false;
                Formula left = source.getLeft();
                Formula right = source.getRight();
                boolean leftDistributed = left.getType() == Formula.Type.OR
                        && result.equals(Formula.or(Formula.and(left.getLeft(), right),
                                                    Formula.and(left.getRight(), right)));
                boolean rightDistributed = right.getType() == Formula.Type.OR
                        && result.equals(Formula.or(Formula.and(left, right.getLeft()),
                                                    Formula.and(left, right.getRight())));
                yield leftDistributed || rightDistributed;
            }

            default -> false;
        };
    }

    //endregion

    //region UTILITY

    private static Formula formulaAt(List<DerivationRow> rows, int number) {
        return rows.get(number - 1).getFormula();
    }

    /**
     * (X &amp; ~X) per qualunque formula X.
     */
    static boolean isContradiction(Formula formula) {
        return formula.getType() == Formula.Type.AND
                && formula.getRight().equals(Formula.negation(formula.getLeft()));
    }

    private static boolean isPrefix(List<Integer> prefix, List<Integer> chain) {
        if (prefix.size() > chain.size()) {
            return false;
        }
        return chain.subList(0, prefix.size()).equals(prefix);
    }

    //endregion
}
