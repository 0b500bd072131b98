package org.tableau.solver;

/**
 * Ricerca interrotta prima di raggiungere un verdetto.
 */
public class TableauAbortedException extends RuntimeException {

    public enum Reason {
        /** Superato il numero massimo di teorie elaborabili */
        BRANCH_LIMIT_EXCEEDED,
        /** Thread interrotto, tipicamente per timeout */
        INTERRUPTED
    }

    private final Reason reason;
    private final transient TableauStatistics statistics;

    public TableauAbortedException(Reason reason, String message, TableauStatistics statistics) {
        super(message);
        this.reason = reason;
        this.statistics = statistics;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * @return metriche raccolte fino all'interruzione
     */
    public TableauStatistics getStatistics() {
        return statistics;
    }
}
