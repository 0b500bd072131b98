package org.tableau.solver;

/**
 * STATISTICHE TABLEAU - Metriche raccolte durante una singola ricerca
 *
 * Contatori aggiornati dal risolutore ad ogni passo del loop principale,
 * più un cronometro avviato alla costruzione e fermato a fine ricerca.
 */
public class TableauStatistics {

    //region CONTATORI

    /** Teorie estratte dalla coda */
    private int theoriesProcessed = 0;

    /** Espansioni alfa applicate */
    private int alphaExpansions = 0;

    /** Espansioni beta applicate */
    private int betaExpansions = 0;

    /** Rami scartati perché contraddittori */
    private int closedBranches = 0;

    /** Rami scartati perché già presenti in coda */
    private int duplicateBranches = 0;

    /** Massima lunghezza raggiunta dalla coda del tableau */
    private int maxQueueSize = 0;

    //endregion

    //region TIMING

    private final long startTime;
    private long executionTimeMs = 0;
    private boolean timerStopped = false;

    //endregion

    public TableauStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region INCREMENTO CONTATORI

    public void incrementTheoriesProcessed() {
        theoriesProcessed++;
    }

    public void incrementAlphaExpansions() {
        alphaExpansions++;
    }

    public void incrementBetaExpansions() {
        betaExpansions++;
    }

    public void incrementClosedBranches() {
        closedBranches++;
    }

    public void incrementDuplicateBranches() {
        duplicateBranches++;
    }

    /**
     * Aggiorna il massimo della coda con la dimensione corrente.
     *
     * @param queueSize numero di teorie in coda
     */
    public void recordQueueSize(int queueSize) {
        if (queueSize > maxQueueSize) {
            maxQueueSize = queueSize;
        }
    }

    //endregion

    //region GESTIONE TIMING

    /**
     * Ferma il cronometro. Chiamate successive non hanno effetto.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    /**
     * @return tempo finale se il cronometro è fermo, altrimenti quello parziale
     */
    public long getExecutionTimeMs() {
        if (!timerStopped) {
            return System.currentTimeMillis() - startTime;
        }
        return executionTimeMs;
    }

    public boolean isTimerStopped() {
        return timerStopped;
    }

    //endregion

    //region ACCESSORS

    public int getTheoriesProcessed() {
        return theoriesProcessed;
    }

    public int getAlphaExpansions() {
        return alphaExpansions;
    }

    public int getBetaExpansions() {
        return betaExpansions;
    }

    public int getClosedBranches() {
        return closedBranches;
    }

    public int getDuplicateBranches() {
        return duplicateBranches;
    }

    public int getMaxQueueSize() {
        return maxQueueSize;
    }

    //endregion

    //region OUTPUT

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();

        output.append("======================================[ SEARCH STATS ]=======================================\n");
        output.append("    Teorie elaborate: ").append(theoriesProcessed).append("\n");
        output.append("    Espansioni alfa:  ").append(alphaExpansions).append("\n");
        output.append("    Espansioni beta:  ").append(betaExpansions).append("\n");
        output.append("    Rami chiusi:      ").append(closedBranches).append("\n");

        if (duplicateBranches > 0) {
            output.append("    Rami duplicati:   ").append(duplicateBranches).append("\n");
        }

        output.append("    Coda massima:     ").append(maxQueueSize).append("\n");
        output.append("    Tempo:            ").append(getExecutionTimeMs()).append("ms\n");
        output.append("=============================================================================================\n");

        return output.toString();
    }

    /**
     * Formato su singola linea per i log.
     */
    public String toCompactString() {
        return String.format("Stats[Teorie:%d, Alfa:%d, Beta:%d, Chiusi:%d, Dup:%d, Coda:%d, Time:%dms]",
                theoriesProcessed, alphaExpansions, betaExpansions, closedBranches,
                duplicateBranches, maxQueueSize, getExecutionTimeMs());
    }

    //endregion
}
