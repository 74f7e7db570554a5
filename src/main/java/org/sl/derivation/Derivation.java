package org.sl.derivation;

import org.sl.support.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Stack;
import java.util.logging.Logger;

/**
 * DERIVAZIONE - Registro append-only di una prova in deduzione naturale
 *
 * Mantiene la sequenza delle righe della prova e lo stack degli scope aperti
 * (uno per ogni assunzione non ancora scaricata). Ogni tentativo di decisione
 * possiede la propria istanza, modificata sequenzialmente dal normalizzatore
 * e dal motore di prova.
 *
 * INVARIANTI MANTENUTE:
 * • Numeri di riga densi 1..N, assegnati in ordine
 * • Ogni citazione riferisce una riga strettamente precedente
 * • Scope rimossi solo in ordine LIFO tramite {@link #discharge()}
 * • Identificativi di scope univoci e crescenti, mai riutilizzati
 *
 * Non thread-safe: una derivazione non va mai condivisa tra decisioni concorrenti.
 */
public class Derivation {

    private static final Logger LOGGER = Logger.getLogger(Derivation.class.getName());

    /**
     * Identificativo restituito da {@link #currentScopeId()} quando nessuno scope è aperto.
     */
    public static final int NO_SCOPE = 0;

    //region STRUTTURA DATI

    private final List<DerivationRow> rows = new ArrayList<>();

    /** Stack degli scope aperti: l'ultimo elemento è il più interno */
    private final Stack<Scope> scopes = new Stack<>();

    private int nextScopeId = 1;

    //endregion

    //region REGISTRAZIONE RIGHE

    /**
     * Aggiunge una riga in coda alla derivazione.
     *
     * Se la regola è {@link Rule#ASSUME} apre un nuovo scope prima di calcolare
     * il numero di scope aperti, così la riga dell'assunzione ne riflette l'apertura.
     *
     * @param formula formula derivata (non null)
     * @param rule regola applicata (non null)
     * @param citations righe citate, ciascuna in 1..numero della nuova riga - 1
     * @return riga registrata
     * @throws IllegalArgumentException se una citazione non riferisce una riga precedente
     */
    public DerivationRow append(Formula formula, Rule rule, List<Integer> citations) {
        if (formula == null || rule == null || citations == null) {
            throw new IllegalArgumentException("Formula, regola e citazioni non possono essere null");
        }

        int number = lastRowNumber() + 1;
        for (Integer cited : citations) {
            if (cited == null || cited < 1 || cited >= number) {
                throw new IllegalArgumentException("Citazione non valida " + cited + " per la riga " + number);
            }
        }

        if (rule == Rule.ASSUME) {
            scopes.push(new Scope(number, nextScopeId++));
        }

        DerivationRow row = new DerivationRow(number, scopes.size(), formula, rule, citations);
        rows.add(row);

        LOGGER.finest("Riga registrata: " + row);
        return row;
    }

    /**
     * Assume una formula aprendo un nuovo scope.
     */
    public DerivationRow assume(Formula formula) {
        return append(formula, Rule.ASSUME, List.of());
    }

    /**
     * Applica una regola di scambio all'ultima riga: la nuova riga cita solo la precedente.
     *
     * @throws IllegalStateException se la derivazione è vuota
     */
    public DerivationRow exchange(Formula formula, Rule rule) {
        if (rows.isEmpty()) {
            throw new IllegalStateException("Nessuna riga su cui applicare " + rule);
        }
        return append(formula, rule, List.of(lastRowNumber()));
    }

    //endregion

    //region GESTIONE SCOPE E IONI

    /**
     * Registra uno ione nello scope più interno.
     *
     * @throws IllegalStateException se nessuno scope è aperto
     */
    public void addIon(Ion ion) {
        if (scopes.isEmpty()) {
            throw new IllegalStateException("Nessuno scope aperto per lo ione " + ion);
        }
        scopes.peek().addIon(ion);
    }

    /**
     * Cerca uno ione che contraddice quello dato, scorrendo gli scope aperti dal più
     * esterno al più interno e, in ciascuno, gli ioni in ordine di registrazione.
     *
     * @return primo ione contraddittorio, null se non esiste
     */
    public Ion findContradiction(Ion ion) {
        for (Scope scope : scopes) {
            for (Ion candidate : scope.getIons()) {
                if (candidate.contradicts(ion)) {
                    return candidate;
                }
            }
        }
        return null;
    }

    /**
     * Chiude lo scope più interno. Usato esclusivamente dall'introduzione del condizionale.
     *
     * @return scope rimosso
     * @throws IllegalStateException se nessuno scope è aperto
     */
    public Scope discharge() {
        if (scopes.isEmpty()) {
            throw new IllegalStateException("Nessuna assunzione da scaricare");
        }
        Scope scope = scopes.pop();
        LOGGER.finest("Scope " + scope.getId() + " chiuso (assunzione alla riga " + scope.getAssumptionRow() + ")");
        return scope;
    }

    /**
     * @return id dello scope più interno, {@link #NO_SCOPE} se lo stack è vuoto
     */
    public int currentScopeId() {
        return scopes.isEmpty() ? NO_SCOPE : scopes.peek().getId();
    }

    public int getOpenScopeCount() {
        return scopes.size();
    }

    public boolean hasOpenScopes() {
        return !scopes.isEmpty();
    }

    /**
     * @return scope aperti dal più esterno al più interno (vista non modificabile)
     */
    public List<Scope> getOpenScopes() {
        return Collections.unmodifiableList(scopes);
    }

    //endregion

    //region INTERROGAZIONE

    /**
     * @return numero dell'ultima riga, 0 se la derivazione è vuota
     */
    public int lastRowNumber() {
        return rows.size();
    }

    /**
     * @param number numero di riga in 1..N
     * @throws IllegalArgumentException se la riga non esiste
     */
    public DerivationRow getRow(int number) {
        if (number < 1 || number > rows.size()) {
            throw new IllegalArgumentException("Riga inesistente: " + number + " (righe: " + rows.size() + ")");
        }
        return rows.get(number - 1);
    }

    /**
     * @return ultima riga
     * @throws IllegalStateException se la derivazione è vuota
     */
    public DerivationRow lastRow() {
        if (rows.isEmpty()) {
            throw new IllegalStateException("Derivazione vuota");
        }
        return rows.get(rows.size() - 1);
    }

    public List<DerivationRow> getRows() {
        return Collections.unmodifiableList(rows);
    }

    public int size() {
        return rows.size();
    }

    //endregion

    /**
     * Una riga per passo, con barre di scope, regola e citazioni.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (DerivationRow row : rows) {
            sb.append(row).append('\n');
        }
        return sb.toString();
    }
}
