package org.sl.reductio;

import org.sl.derivation.Derivation;
import org.sl.derivation.DerivationRow;
import org.sl.derivation.Rule;

/**
 * STATISTICHE DECISIONE - Metriche raccolte durante un tentativo di decisione
 *
 * Il timer parte alla costruzione. I contatori relativi alla prova vengono
 * ricavati dalla derivazione a fine esecuzione, così il motore di prova non
 * deve conoscere questa classe.
 */
public class DecisionStatistics {

    //region CONTATORI

    /** Righe della derivazione prodotte da regole di scambio (normalizzazione DNF) */
    private int rewriteSteps = 0;

    /** Assunzioni aperte, compresa quella della negazione dell'obiettivo */
    private int assumptions = 0;

    /** Contraddizioni (X & ~X) introdotte dalla reductio */
    private int contradictions = 0;

    /** Righe totali della derivazione */
    private int derivationRows = 0;

    /** Massimo numero di scope aperti contemporaneamente */
    private int maxScopeDepth = 0;

    /** Nodi della formula in DNF */
    private int dnfSize = 0;

    //endregion

    //region TIMING

    private final long startTime;
    private long executionTimeMs = 0;
    private boolean timerStopped = false;

    //endregion

    public DecisionStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region RACCOLTA

    /**
     * Ricava i contatori scorrendo le righe della derivazione.
     */
    public void recordDerivation(Derivation derivation) {
        rewriteSteps = 0;
        assumptions = 0;
        contradictions = 0;
        maxScopeDepth = 0;

        for (DerivationRow row : derivation.getRows()) {
            Rule rule = row.getRule();
            if (rule.isExchange()) {
                rewriteSteps++;
            } else if (rule == Rule.ASSUME) {
                assumptions++;
            } else if (rule == Rule.AND_INTRODUCTION) {
                contradictions++;
            }
            maxScopeDepth = Math.max(maxScopeDepth, row.getOpenScopes());
        }
        derivationRows = derivation.size();
    }

    public void setDnfSize(int dnfSize) {
        if (dnfSize < 0) {
            throw new IllegalArgumentException("Dimensione DNF non può essere negativa: " + dnfSize);
        }
        this.dnfSize = dnfSize;
    }

    /**
     * Ferma il timer. Chiamate successive non hanno effetto.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    //endregion

    //region ACCESSORS

    public int getRewriteSteps() {
        return rewriteSteps;
    }

    public int getAssumptions() {
        return assumptions;
    }

    public int getContradictions() {
        return contradictions;
    }

    public int getDerivationRows() {
        return derivationRows;
    }

    public int getMaxScopeDepth() {
        return maxScopeDepth;
    }

    public int getDnfSize() {
        return dnfSize;
    }

    /**
     * @return tempo finale, oppure parziale se il timer è ancora attivo
     */
    public long getExecutionTimeMs() {
        return timerStopped ? executionTimeMs : System.currentTimeMillis() - startTime;
    }

    //endregion

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append("==========================[ STATISTICHE DECISIONE ]==========================\n");
        output.append("    Scambi DNF:      ").append(rewriteSteps).append("\n");
        output.append("    Nodi DNF:        ").append(dnfSize).append("\n");
        output.append("    Assunzioni:      ").append(assumptions).append("\n");
        output.append("    Contraddizioni:  ").append(contradictions).append("\n");
        output.append("    Righe:           ").append(derivationRows).append("\n");
        output.append("    Profondità max:  ").append(maxScopeDepth).append("\n");
        output.append("    Tempo:           ").append(getExecutionTimeMs()).append("ms\n");
        output.append("=============================================================================\n");
        return output.toString();
    }
}
