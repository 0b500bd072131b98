package org.tableau.solver;

import org.tableau.formula.Formula;
import org.tableau.support.Tableau;
import org.tableau.support.Tableau.SearchOrder;
import org.tableau.support.Theory;

import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * SOLUTORE TABLEAU - Decide soddisfacibilità e validità con i tableaux analitici
 *
 * ALGORITMO:
 * 1. Il tableau parte con il solo ramo {formula}
 * 2. Si estrae un ramo; se è completamente espanso e non contraddittorio la formula
 *    è soddisfacibile
 * 3. Altrimenti si sceglie il primo non-letterale e lo si espande:
 *    • ALFA: una copia del ramo in cui la formula è sostituita dalle sue componenti
 *    • BETA: due copie, ciascuna con una sola delle due componenti
 * 4. Un ramo derivato entra in coda solo se non è già presente e non contiene
 *    una coppia a, (-a)
 * 5. Coda vuota: tutti i rami sono chiusi, la formula è insoddisfacibile
 *
 * Validità: F è valida se e solo se (-F) è insoddisfacibile.
 *
 * LIMITI OPZIONALI:
 * • maxTheories: numero massimo di teorie estratte (0 = illimitato)
 * • interruzione del thread o chiamata a interrupt(): usata dal timeout della CLI
 * In entrambi i casi la ricerca termina con TableauAbortedException.
 */
public class TableauSolver {

    private static final Logger LOGGER = Logger.getLogger(TableauSolver.class.getName());

    /** Limite teorie estratte, 0 = nessun limite */
    private final int maxTheories;

    private final SearchOrder order;

    /** Richiesta di interruzione da un altro thread */
    private volatile boolean interrupted = false;

    //region INIZIALIZZAZIONE

    /**
     * Risolutore senza limiti, visita in ampiezza.
     */
    public TableauSolver() {
        this(0, SearchOrder.BREADTH_FIRST);
    }

    /**
     * @param maxTheories numero massimo di teorie estratte, 0 per nessun limite
     * @param order ordine di visita dei rami
     * @throws IllegalArgumentException se maxTheories è negativo o order è null
     */
    public TableauSolver(int maxTheories, SearchOrder order) {
        if (maxTheories < 0) {
            throw new IllegalArgumentException("Limite rami non può essere negativo: " + maxTheories);
        }
        if (order == null) {
            throw new IllegalArgumentException("Ordine di visita non può essere null");
        }
        this.maxTheories = maxTheories;
        this.order = order;
    }

    //endregion

    //region API PUBBLICA

    /**
     * @return true se esiste un assegnamento che rende vera la formula
     */
    public boolean isSatisfiable(Formula formula) {
        return solve(formula).isSatisfiable();
    }

    /**
     * @return true se la formula è vera in ogni assegnamento
     */
    public boolean isValid(Formula formula) {
        return !checkValidity(formula).isSatisfiable();
    }

    /**
     * Verifica di validità con dettagli: cerca un ramo aperto per (-formula).
     * La formula è valida se il risultato è INSODDISFACIBILE; altrimenti il ramo
     * aperto è un controesempio.
     *
     * @param formula formula da verificare (non null)
     * @return risultato della ricerca sulla negazione
     */
    public TableauResult checkValidity(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula non può essere null");
        }
        return solve(Formula.negation(formula));
    }

    /**
     * Esegue la ricerca completa sul tableau della formula.
     *
     * @param formula formula da verificare (non null)
     * @return esito con ramo aperto (se soddisfacibile) e statistiche
     * @throws TableauAbortedException se superato il limite o interrotto
     */
    public TableauResult solve(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula non può essere null");
        }

        // La richiesta di interruzione vale solo per la ricerca in corso
        this.interrupted = false;

        LOGGER.fine(() -> "=== AVVIO RICERCA TABLEAU: " + formula + " (" + order + ", limite " + maxTheories + ") ===");

        TableauStatistics statistics = new TableauStatistics();
        Tableau tableau = Tableau.seeded(formula, order);
        statistics.recordQueueSize(tableau.size());

        SearchState state = SearchState.RUNNING;
        Theory openBranch = null;

        while (state == SearchState.RUNNING) {
            checkForInterruption(statistics);

            Optional<Theory> next = tableau.popTheory();
            if (next.isEmpty()) {
                state = SearchState.UNSATISFIABLE;
                break;
            }

            Theory theory = next.get();
            statistics.incrementTheoriesProcessed();
            checkBranchLimit(statistics);

            LOGGER.finest(() -> "Teoria estratta: " + theory);

            if (theory.isFullyExpanded()) {
                if (!theory.hasContradiction()) {
                    openBranch = theory;
                    state = SearchState.SATISFIABLE;
                } else {
                    statistics.incrementClosedBranches();
                }
                continue;
            }

            // Non vuoto: il ramo non è completamente espanso
            Formula selected = theory.selectNonLiteral().orElseThrow();
            expandTheory(tableau, theory, selected, statistics);
            statistics.recordQueueSize(tableau.size());
        }

        statistics.stopTimer();
        TableauResult result = state == SearchState.SATISFIABLE
                ? TableauResult.satisfiable(formula, openBranch, statistics)
                : TableauResult.unsatisfiable(formula, statistics);

        SearchState verdict = state;
        LOGGER.info(() -> "Verdetto " + verdict + " per " + formula + " " + statistics.toCompactString());
        return result;
    }

    /**
     * Richiede l'interruzione della ricerca in corso.
     * Il loop controlla la richiesta prima di ogni estrazione; una richiesta
     * arrivata a ricerca conclusa viene azzerata dalla successiva chiamata a {@link #solve}.
     */
    public void interrupt() {
        this.interrupted = true;
    }

    //endregion

    //region ESPANSIONE

    /**
     * Applica la regola della formula selezionata e accoda i rami derivati.
     */
    private void expandTheory(Tableau tableau, Theory theory, Formula selected, TableauStatistics statistics) {
        Expansion expansion = ExpansionRules.expand(selected);

        LOGGER.finest(() -> "Espansione " + expansion.getKind() + " di " + selected + " -> " + expansion.getFormulas());

        switch (expansion.getKind()) {
            case ALPHA -> {
                statistics.incrementAlphaExpansions();
                Theory derived = new Theory(theory);
                derived.replace(selected, expansion.getFormulas());
                enqueueIfOpen(tableau, derived, statistics);
            }
            case BETA -> {
                statistics.incrementBetaExpansions();
                for (Formula branchHead : expansion.getFormulas()) {
                    Theory derived = new Theory(theory);
                    derived.replace(selected, List.of(branchHead));
                    enqueueIfOpen(tableau, derived, statistics);
                }
            }
            case NONE -> throw new IllegalStateException(
                    "Nessuna regola applicabile al non-letterale " + selected);
        }
    }

    /**
     * Accoda il ramo se non è duplicato e non è chiuso.
     */
    private void enqueueIfOpen(Tableau tableau, Theory derived, TableauStatistics statistics) {
        if (tableau.contains(derived)) {
            statistics.incrementDuplicateBranches();
            LOGGER.finest(() -> "Ramo duplicato scartato: " + derived);
            return;
        }
        if (derived.hasContradiction()) {
            statistics.incrementClosedBranches();
            LOGGER.finest(() -> "Ramo chiuso: " + derived);
            return;
        }
        tableau.pushTheory(derived);
    }

    //endregion

    //region CONTROLLI DI TERMINAZIONE

    private void checkForInterruption(TableauStatistics statistics) {
        if (interrupted || Thread.currentThread().isInterrupted()) {
            statistics.stopTimer();
            LOGGER.warning("Ricerca interrotta dopo " + statistics.getTheoriesProcessed() + " teorie");
            throw new TableauAbortedException(TableauAbortedException.Reason.INTERRUPTED,
                    "Ricerca tableau interrotta", statistics);
        }
    }

    private void checkBranchLimit(TableauStatistics statistics) {
        if (maxTheories > 0 && statistics.getTheoriesProcessed() > maxTheories) {
            statistics.stopTimer();
            LOGGER.log(Level.WARNING, "Limite di {0} teorie superato", maxTheories);
            throw new TableauAbortedException(TableauAbortedException.Reason.BRANCH_LIMIT_EXCEEDED,
                    "Superato il limite di " + maxTheories + " teorie", statistics);
        }
    }

    //endregion
}
