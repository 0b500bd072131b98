package org.tableau;

import org.tableau.support.Tableau.SearchOrder;

import java.io.File;

/**
 * Configurazione validata dell'applicazione.
 *
 * Contiene tutti i parametri di esecuzione in forma immutabile
 * per garantire consistenza durante l'elaborazione.
 */
final class SolverConfiguration {

    /** Configurazioni timeout di default e limiti */
    static final int DEFAULT_TIMEOUT_SECONDS = 10;
    static final int MIN_TIMEOUT_SECONDS = 1;

    /** Nessun limite sul numero di teorie elaborate */
    static final int DEFAULT_BRANCH_LIMIT = 0;

    /** Sorgente delle formule */
    enum InputMode {
        FILE,
        DIRECTORY,
        INLINE,
        STDIN
    }

    /** Proprietà da decidere per ogni formula */
    enum CheckMode {
        SATISFIABILITY,
        VALIDITY,
        ALL;

        boolean checksSatisfiability() {
            return this != VALIDITY;
        }

        boolean checksValidity() {
            return this != SATISFIABILITY;
        }
    }

    final InputMode inputMode;
    final String inputPath;
    final String inlineFormula;
    final String outputPath;
    final CheckMode checkMode;
    final SearchOrder searchOrder;
    final int timeoutSeconds;
    final int branchLimit;
    final boolean verbose;

    SolverConfiguration(InputMode inputMode, String inputPath, String inlineFormula, String outputPath,
                        CheckMode checkMode, SearchOrder searchOrder, int timeoutSeconds, int branchLimit,
                        boolean verbose) {
        this.inputMode = inputMode;
        this.inputPath = inputPath;
        this.inlineFormula = inlineFormula;
        this.outputPath = outputPath;
        this.checkMode = checkMode;
        this.searchOrder = searchOrder;
        this.timeoutSeconds = timeoutSeconds;
        this.branchLimit = branchLimit;
        this.verbose = verbose;
    }

    /**
     * Configurazione specifica per un file di un batch: stesse opzioni, modalità file.
     *
     * @param file file da elaborare
     * @return configurazione del singolo file
     */
    SolverConfiguration forFile(File file) {
        return new SolverConfiguration(InputMode.FILE, file.getAbsolutePath(), null, outputPath,
                checkMode, searchOrder, timeoutSeconds, branchLimit, verbose);
    }
}
