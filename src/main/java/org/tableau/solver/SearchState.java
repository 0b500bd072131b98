package org.tableau.solver;

/**
 * Stato di una ricerca sul tableau.
 */
public enum SearchState {
    RUNNING,
    SATISFIABLE,
    UNSATISFIABLE
}
