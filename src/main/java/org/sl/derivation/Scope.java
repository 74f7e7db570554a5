package org.sl.derivation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Scope di un'assunzione non ancora scaricata: riga dell'assunzione,
 * identificativo univoco e ioni registrati mentre lo scope è aperto.
 */
public final class Scope {

    private final int assumptionRow;
    private final int id;
    private final List<Ion> ions = new ArrayList<>();

    Scope(int assumptionRow, int id) {
        this.assumptionRow = assumptionRow;
        this.id = id;
    }

    public int getAssumptionRow() {
        return assumptionRow;
    }

    public int getId() {
        return id;
    }

    /**
     * @return ioni in ordine di registrazione (vista non modificabile)
     */
    public List<Ion> getIons() {
        return Collections.unmodifiableList(ions);
    }

    void addIon(Ion ion) {
        ions.add(ion);
    }

    @Override
    public String toString() {
        return "Scope[id=" + id + ", assunzione=" + assumptionRow + ", ioni=" + ions + "]";
    }
}
