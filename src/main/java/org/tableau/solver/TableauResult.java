package org.tableau.solver;

import org.tableau.formula.Formula;
import org.tableau.support.Theory;

import java.util.Objects;

/**
 * RISULTATO TABLEAU - Esito immutabile di una ricerca
 *
 * COMPONENTI:
 * • Formula effettivamente cercata (la negazione, per le verifiche di validità)
 * • Esito: SATISFIABLE o UNSATISFIABLE
 * • Ramo aperto trovato, solo per esito SATISFIABLE: i suoi letterali
 *   descrivono un assegnamento che soddisfa la formula
 * • Statistiche della ricerca
 */
public class TableauResult {

    private final Formula formula;
    private final SearchState state;
    private final Theory openBranch;
    private final TableauStatistics statistics;

    private TableauResult(Formula formula, SearchState state, Theory openBranch, TableauStatistics statistics) {
        if (state == SearchState.RUNNING) {
            throw new IllegalArgumentException("Un risultato non può avere esito RUNNING");
        }
        if ((state == SearchState.SATISFIABLE) != (openBranch != null)) {
            throw new IllegalArgumentException("Il ramo aperto è richiesto solo per esito SATISFIABLE");
        }
        this.formula = formula;
        this.state = state;
        this.openBranch = openBranch;
        this.statistics = statistics != null ? statistics : new TableauStatistics();
    }

    //region FACTORY METHODS

    /**
     * @param formula formula cercata
     * @param openBranch ramo completamente espanso e non contraddittorio
     * @param statistics metriche della ricerca
     */
    public static TableauResult satisfiable(Formula formula, Theory openBranch, TableauStatistics statistics) {
        if (openBranch == null) {
            throw new IllegalArgumentException("Esito SATISFIABLE richiede un ramo aperto");
        }
        return new TableauResult(formula, SearchState.SATISFIABLE, openBranch, statistics);
    }

    public static TableauResult unsatisfiable(Formula formula, TableauStatistics statistics) {
        return new TableauResult(formula, SearchState.UNSATISFIABLE, null, statistics);
    }

    //endregion

    //region ACCESSORS

    public Formula getFormula() {
        return formula;
    }

    public SearchState getState() {
        return state;
    }

    public boolean isSatisfiable() {
        return state == SearchState.SATISFIABLE;
    }

    /**
     * @return ramo aperto per esito SATISFIABLE, null altrimenti
     */
    public Theory getOpenBranch() {
        return openBranch;
    }

    public TableauStatistics getStatistics() {
        return statistics;
    }

    //endregion

    //region OUTPUT

    @Override
    public String toString() {
        if (isSatisfiable()) {
            return "SODDISFACIBILE\nRamo aperto: " + openBranch + "\n";
        }
        return "INSODDISFACIBILE\nTutti i rami sono chiusi.\n";
    }

    public String toCompactString() {
        return String.format("TableauResult{%s, teorie=%d, time=%dms}",
                state, statistics.getTheoriesProcessed(), statistics.getExecutionTimeMs());
    }

    //endregion

    /**
     * Uguaglianza su formula, esito e ramo; le statistiche sono ignorate.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        TableauResult other = (TableauResult) obj;
        return state == other.state &&
                Objects.equals(formula, other.formula) &&
                Objects.equals(openBranch, other.openBranch);
    }

    @Override
    public int hashCode() {
        return Objects.hash(formula, state, openBranch);
    }
}
