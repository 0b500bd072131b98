package org.tableau;

import org.tableau.SolverConfiguration.CheckMode;
import org.tableau.SolverConfiguration.InputMode;
import org.tableau.support.Tableau.SearchOrder;

import java.io.File;
import java.util.Locale;

/**
 * Parser per parametri linea di comando.
 *
 * Gestisce validazione completa di tutti i parametri con
 * messaggi di errore informativi per l'utente.
 */
final class ArgumentParser {

    /** Parametri linea di comando supportati */
    static final String HELP_PARAM = "-h";
    static final String FILE_PARAM = "-f";
    static final String DIR_PARAM = "-d";
    static final String EXPR_PARAM = "-e";
    static final String MODE_PARAM = "-m";
    static final String SEARCH_PARAM = "-s";
    static final String TIMEOUT_PARAM = "-t";
    static final String LIMIT_PARAM = "-l";
    static final String OUTPUT_PARAM = "-o";
    static final String VERBOSE_PARAM = "-v";

    /**
     * Processa sequenzialmente tutti i parametri e costruisce la configurazione.
     *
     * PARAMETRI SUPPORTATI:
     * -h: Mostra help e termina
     * -f <file>, -d <dir>, -e <formula>: sorgente delle formule (mutualmente esclusive,
     *   nessuna delle tre = standard input)
     * -m <sat|valid|all>: proprietà da decidere
     * -s <bfs|dfs>: ordine di visita dei rami
     * -t <sec>: timeout per formula
     * -l <n>: limite teorie elaborate (0 = illimitato)
     * -o <dir>: directory output personalizzata
     * -v: log dettagliato
     *
     * @param args parametri da linea comando forniti dall'utente
     * @return configurazione validata, null se è stato richiesto l'help
     * @throws IllegalArgumentException se parametri sintatticamente o semanticamente invalidi
     */
    SolverConfiguration parse(String[] args) {
        InputMode inputMode = InputMode.STDIN;
        String inputPath = null;
        String inlineFormula = null;
        String outputPath = null;
        CheckMode checkMode = CheckMode.ALL;
        SearchOrder searchOrder = SearchOrder.BREADTH_FIRST;
        int timeoutSeconds = SolverConfiguration.DEFAULT_TIMEOUT_SECONDS;
        int branchLimit = SolverConfiguration.DEFAULT_BRANCH_LIMIT;
        boolean verbose = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case HELP_PARAM -> {
                    return null;
                }

                case FILE_PARAM -> {
                    validateExclusiveMode(inputMode, "file");
                    inputPath = getNextArgument(args, ++i, "file");
                    validateFileExists(inputPath);
                    inputMode = InputMode.FILE;
                }

                case DIR_PARAM -> {
                    validateExclusiveMode(inputMode, "directory");
                    inputPath = getNextArgument(args, ++i, "directory");
                    validateDirectoryExists(inputPath);
                    inputMode = InputMode.DIRECTORY;
                }

                case EXPR_PARAM -> {
                    validateExclusiveMode(inputMode, "formula");
                    inlineFormula = getNextArgument(args, ++i, "formula");
                    inputMode = InputMode.INLINE;
                }

                case MODE_PARAM -> checkMode = parseCheckMode(getNextArgument(args, ++i, "sat, valid o all"));

                case SEARCH_PARAM -> searchOrder = parseSearchOrder(getNextArgument(args, ++i, "bfs o dfs"));

                case TIMEOUT_PARAM -> timeoutSeconds = parseAndValidateTimeout(args, ++i);

                case LIMIT_PARAM -> branchLimit = parseAndValidateBranchLimit(args, ++i);

                case OUTPUT_PARAM -> {
                    outputPath = getNextArgument(args, ++i, "directory output");
                    validateOrCreateOutputDirectory(outputPath);
                }

                case VERBOSE_PARAM -> verbose = true;

                default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
            }
        }

        return new SolverConfiguration(inputMode, inputPath, inlineFormula, outputPath,
                checkMode, searchOrder, timeoutSeconds, branchLimit, verbose);
    }

    /**
     * Valida che le modalità di input siano mutualmente esclusive.
     */
    private void validateExclusiveMode(InputMode current, String requestedMode) {
        if (current != InputMode.STDIN) {
            throw new IllegalArgumentException("Modalità " + requestedMode +
                    " non può essere combinata con altre modalità (file/directory/formula sono mutualmente esclusive)");
        }
    }

    /**
     * Verifica che esista un argomento successivo prima di restituirlo.
     */
    private String getNextArgument(String[] args, int currentIndex, String argumentType) {
        if (currentIndex >= args.length) {
            throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                    " richiede " + argumentType);
        }
        return args[currentIndex];
    }

    private CheckMode parseCheckMode(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "sat" -> CheckMode.SATISFIABILITY;
            case "valid" -> CheckMode.VALIDITY;
            case "all" -> CheckMode.ALL;
            default -> throw new IllegalArgumentException("Modalità di verifica non valida: " + value +
                    ". Supportate: sat, valid, all");
        };
    }

    private SearchOrder parseSearchOrder(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "bfs" -> SearchOrder.BREADTH_FIRST;
            case "dfs" -> SearchOrder.DEPTH_FIRST;
            default -> throw new IllegalArgumentException("Ordine di visita non valido: " + value +
                    ". Supportati: bfs, dfs");
        };
    }

    private int parseAndValidateTimeout(String[] args, int currentIndex) {
        String timeoutStr = getNextArgument(args, currentIndex, "numero secondi");

        int timeout = parseInteger(timeoutStr, "Valore timeout non valido: ");
        if (timeout < SolverConfiguration.MIN_TIMEOUT_SECONDS) {
            throw new IllegalArgumentException("Timeout minimo: " + SolverConfiguration.MIN_TIMEOUT_SECONDS + " secondi");
        }
        return timeout;
    }

    private int parseAndValidateBranchLimit(String[] args, int currentIndex) {
        String limitStr = getNextArgument(args, currentIndex, "numero massimo di teorie");

        int limit = parseInteger(limitStr, "Limite rami non valido: ");
        if (limit < 0) {
            throw new IllegalArgumentException("Limite rami non può essere negativo: " + limit);
        }
        return limit;
    }

    private int parseInteger(String value, String errorPrefix) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(errorPrefix + value, e);
        }
    }

    private void validateFileExists(String filePath) {
        File file = new File(filePath);
        if (!file.exists()) {
            throw new IllegalArgumentException("File non esistente: " + filePath);
        }
        if (!file.isFile()) {
            throw new IllegalArgumentException("Non è un file: " + filePath);
        }
        if (!file.canRead()) {
            throw new IllegalArgumentException("File non leggibile: " + filePath);
        }
    }

    private void validateDirectoryExists(String dirPath) {
        File dir = new File(dirPath);
        if (!dir.exists()) {
            throw new IllegalArgumentException("Directory non esistente: " + dirPath);
        }
        if (!dir.isDirectory()) {
            throw new IllegalArgumentException("Non è una directory: " + dirPath);
        }
        if (!dir.canRead()) {
            throw new IllegalArgumentException("Directory non leggibile: " + dirPath);
        }
    }

    private void validateOrCreateOutputDirectory(String dirPath) {
        File dir = new File(dirPath);
        if (!dir.exists()) {
            System.out.println("Creazione directory output: " + dirPath);
            if (!dir.mkdirs()) {
                throw new IllegalArgumentException("Impossibile creare directory: " + dirPath);
            }
        } else if (!dir.isDirectory()) {
            throw new IllegalArgumentException("Percorso non è una directory: " + dirPath);
        }
        if (!dir.canWrite()) {
            throw new IllegalArgumentException("Directory non scrivibile: " + dirPath);
        }
    }
}
