package org.tableau;

import org.tableau.SolverConfiguration.InputMode;
import org.tableau.formula.Formula;
import org.tableau.formula.FormulaParseException;
import org.tableau.formula.FormulaParser;
import org.tableau.solver.TableauAbortedException;
import org.tableau.solver.TableauResult;
import org.tableau.solver.TableauSolver;
import org.tableau.solver.TableauStatistics;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * SOLUTORE TABLEAUX - Soddisfacibilità e validità di formule proposizionali
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: una formula per riga da file, directory, linea di comando o standard input
 * 2. PARSING: notazione completamente parentesizzata -> albero Formula (ANTLR)
 * 3. RISOLUZIONE: tableau analitico sulla formula e/o sulla sua negazione
 * 4. OUTPUT: esito per riga su console e report strutturato in RESULT/
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - File singolo (-f): ogni riga non vuota è una formula, le righe che iniziano con # sono commenti
 * - Directory batch (-d): tutti i file .txt della cartella, in ordine di nome
 * - Formula singola (-e): formula passata direttamente come argomento
 * - Standard input: nessuna delle precedenti
 * - Timeout (-t secondi) e limite rami (-l) per formula
 *
 * ORGANIZZAZIONE DEGLI OUTPUT:
 * - RESULT/: esiti per riga con statistiche della ricerca
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    /** Logger radice del progetto; riferimento forte per mantenere il livello impostato con -v */
    private static final Logger PROJECT_LOGGER = Logger.getLogger("org.tableau");

    private static final String LOGGING_CONFIGURATION = "/logging.properties";
    private static final String COMMENT_PREFIX = "#";
    private static final String RESULT_DIR = "RESULT";

    /**
     * Previene istanziazione - classe utility
     */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region PUNTO PRINCIPALE

    /**
     * FLUSSO ESECUZIONE:
     * 1. Parsing e validazione parametri linea di comando
     * 2. Configurazione del logging
     * 3. Elaborazione nella modalità richiesta
     * 4. Gestione errori globali
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        SolverConfiguration config;
        try {
            config = new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help.");
            System.exit(1);
            return;
        }

        if (config == null) {
            printApplicationHelp();
            return;
        }

        configureLogging(config.verbose);
        System.out.println("---> AVVIO SOLUTORE TABLEAUX <---");

        try {
            executeMainPipeline(config);
        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE SOLUTORE TABLEAUX <---");
        }
    }

    private static void executeMainPipeline(SolverConfiguration config) throws IOException {
        switch (config.inputMode) {
            case FILE -> {
                System.out.println("[I] Modalità: Elaborazione file singolo");
                processSingleFile(config);
            }
            case DIRECTORY -> {
                System.out.println("[I] Modalità: Elaborazione della directory");
                processDirectoryBatch(config);
            }
            case INLINE -> {
                System.out.println("[I] Modalità: Formula da linea di comando");
                processFormulaLines(List.of(config.inlineFormula), config, "inline");
            }
            case STDIN -> {
                System.out.println("[I] Modalità: Lettura da standard input (una formula per riga)");
                List<String> lines = readFormulaLines(
                        new InputStreamReader(System.in, StandardCharsets.UTF_8));
                processFormulaLines(lines, config, "stdin");
            }
        }
    }

    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.exit(1);
    }

    /**
     * Carica logging.properties dal classpath; con verbose abbassa a FINE il logger
     * del progetto e gli handler della radice.
     */
    static void configureLogging(boolean verbose) {
        try (InputStream config = Main.class.getResourceAsStream(LOGGING_CONFIGURATION)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.out.println("[W] Configurazione logging non caricata: " + e.getMessage());
        }

        if (verbose) {
            PROJECT_LOGGER.setLevel(Level.FINE);
            for (Handler handler : Logger.getLogger("").getHandlers()) {
                handler.setLevel(Level.FINE);
            }
        }
    }

    //endregion

    //region ELABORAZIONE DEL SINGOLO FILE

    private static void processSingleFile(SolverConfiguration config) throws IOException {
        System.out.println("-->> ELABORAZIONE FILE <<--");
        System.out.println("File: " + Paths.get(config.inputPath).getFileName());
        System.out.println("=========================\n");

        List<String> lines;
        try (Reader reader = Files.newBufferedReader(Paths.get(config.inputPath), StandardCharsets.UTF_8)) {
            lines = readFormulaLines(reader);
        }

        if (lines.isEmpty()) {
            System.out.println("[W] Nessuna formula trovata nel file.");
        }

        List<FormulaReport> reports = evaluateAll(lines, config);
        saveCompleteResults(reports, config, getBaseFileName(config.inputPath));
    }

    /**
     * Elabora formule che non provengono da un file: il report viene salvato
     * solo se è stata indicata una directory di output.
     */
    private static void processFormulaLines(List<String> lines, SolverConfiguration config, String reportName)
            throws IOException {
        List<FormulaReport> reports = evaluateAll(lines, config);
        if (config.outputPath != null) {
            saveCompleteResults(reports, config, reportName);
        }
    }

    private static List<FormulaReport> evaluateAll(List<String> lines, SolverConfiguration config) {
        List<FormulaReport> reports = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            FormulaReport report = evaluateFormula(i + 1, lines.get(i), config);
            System.out.println(report.toConsoleLine());
            reports.add(report);
        }
        return reports;
    }

    /**
     * Legge le righe da elaborare, saltando righe vuote e commenti.
     *
     * @param source sorgente testuale, chiusa dal chiamante
     * @return formule nell'ordine di lettura, senza spazi iniziali e finali
     * @throws IOException se errori di lettura
     */
    static List<String> readFormulaLines(Reader source) throws IOException {
        List<String> lines = new ArrayList<>();
        BufferedReader reader = new BufferedReader(source);
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith(COMMENT_PREFIX)) {
                continue;
            }
            lines.add(trimmed);
        }
        return lines;
    }

    //endregion

    //region RISOLUZIONE CON TIMEOUT

    /**
     * Esegue parsing e ricerca per una formula, convertendo ogni esito in un report.
     * Gli errori su una formula non interrompono l'elaborazione delle successive.
     *
     * @param lineNumber posizione della formula nell'input
     * @param text formula in forma testuale
     * @param config configurazione con modalità, timeout e limiti
     * @return report della formula
     */
    static FormulaReport evaluateFormula(int lineNumber, String text, SolverConfiguration config) {
        Formula formula;
        try {
            formula = FormulaParser.parse(text);
        } catch (FormulaParseException e) {
            return FormulaReport.failure(lineNumber, text, ReportCategory.valueOf(e.getKind().name()), e.getMessage());
        }
        return solveWithTimeout(lineNumber, text, formula, config);
    }

    /**
     * Utilizza ExecutorService per il controllo del tempo: allo scadere del timeout
     * il thread della ricerca viene interrotto con shutdownNow().
     */
    private static FormulaReport solveWithTimeout(int lineNumber, String text, Formula formula,
                                                  SolverConfiguration config) {
        TableauSolver solver = new TableauSolver(config.branchLimit, config.searchOrder);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            Callable<Verdicts> task = () -> new Verdicts(
                    config.checkMode.checksSatisfiability() ? solver.solve(formula) : null,
                    config.checkMode.checksValidity() ? solver.checkValidity(formula) : null);
            Future<Verdicts> future = executor.submit(task);
            Verdicts verdicts = future.get(config.timeoutSeconds, TimeUnit.SECONDS);
            if (verdicts.satisfiability != null) {
                LOGGER.fine(() -> "Formula n. " + lineNumber + ": " + verdicts.satisfiability.toCompactString());
            }
            if (verdicts.validity != null) {
                LOGGER.fine(() -> "Negazione n. " + lineNumber + ": " + verdicts.validity.toCompactString());
            }
            return FormulaReport.success(lineNumber, text, formula, verdicts.satisfiability, verdicts.validity);

        } catch (TimeoutException e) {
            solver.interrupt();
            LOGGER.warning("Timeout sulla formula n. " + lineNumber);
            return FormulaReport.failure(lineNumber, text, ReportCategory.TIMEOUT,
                    "Superato il timeout di " + config.timeoutSeconds + " secondi");

        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TableauAbortedException
                    && ((TableauAbortedException) cause).getReason() == TableauAbortedException.Reason.BRANCH_LIMIT_EXCEEDED) {
                return FormulaReport.failure(lineNumber, text, ReportCategory.BRANCH_LIMIT, cause.getMessage());
            }
            LOGGER.log(Level.SEVERE, "Errore durante la risoluzione della formula n. " + lineNumber, cause);
            return FormulaReport.failure(lineNumber, text, ReportCategory.UNKNOWN_ERROR, String.valueOf(cause));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FormulaReport.failure(lineNumber, text, ReportCategory.UNKNOWN_ERROR, "Elaborazione interrotta");

        } finally {
            executor.shutdownNow();
        }
    }

    //endregion

    //region ELABORAZIONE DELLA DIRECTORY

    private static void processDirectoryBatch(SolverConfiguration config) throws IOException {
        System.out.println("[I] Inizio elaborazione directory: " + config.inputPath);

        List<File> txtFiles = findAllTxtFiles(config.inputPath);
        if (txtFiles.isEmpty()) {
            System.out.println("[W] Nessun file .txt trovato nella directory specificata.");
            return;
        }

        BatchResult batchResult = executeBatchProcessing(txtFiles, config);
        displayBatchSummary(batchResult);
    }

    private static List<File> findAllTxtFiles(String dirPath) throws IOException {
        try (Stream<Path> entries = Files.list(Paths.get(dirPath))) {
            List<File> txtFiles = entries
                    .filter(path -> path.toString().toLowerCase().endsWith(".txt"))
                    .filter(Files::isRegularFile)
                    .map(Path::toFile)
                    .sorted(Comparator.comparing(File::getName))
                    .toList();

            System.out.println("Trovati " + txtFiles.size() + " file .txt da elaborare.");
            return txtFiles;
        }
    }

    /**
     * Ogni file viene elaborato indipendentemente: gli errori su un file
     * non interrompono l'elaborazione degli altri.
     */
    private static BatchResult executeBatchProcessing(List<File> files, SolverConfiguration config) {
        BatchResult result = new BatchResult(files.size());

        System.out.println("Configurazione batch:");
        System.out.println("- Timeout per formula: " + config.timeoutSeconds + " secondi");
        System.out.println("- Verifica: " + config.checkMode + ", visita: " + config.searchOrder);
        System.out.println();

        for (File file : files) {
            try {
                System.out.println("Elaborazione: " + file.getName());
                processSingleFile(config.forFile(file));
                result.incrementSuccess();
            } catch (IOException e) {
                System.out.println("[E] Errore nel file " + file.getName() + ": " + e.getMessage());
                result.incrementError();
            }
            System.out.println();
        }

        return result;
    }

    private static void displayBatchSummary(BatchResult result) {
        System.out.println("\n-->> RIEPILOGO ELABORAZIONE DIRECTORY <<--");
        System.out.println("File elaborati trovati: " + result.totalFiles);
        System.out.println("File elaborati con successo: " + result.successCount);
        System.out.println("File con errori: " + result.errorCount);

        if (result.totalFiles > 0) {
            double successRate = (double) result.successCount / result.totalFiles * 100;
            System.out.printf("Tasso di successo: %.1f%%%n", successRate);
        }
        System.out.println("=========================================\n");
    }

    //endregion

    //region SALVATAGGIO DEI RISULTATI

    private static void saveCompleteResults(List<FormulaReport> reports, SolverConfiguration config,
                                            String baseFileName) throws IOException {
        Path resultDir = getOutputDirectory(config, RESULT_DIR);
        Files.createDirectories(resultDir);

        Path resultFilePath = resultDir.resolve(baseFileName + ".result");
        try (FileWriter writer = new FileWriter(resultFilePath.toFile(), StandardCharsets.UTF_8)) {
            writeStructuredResult(writer, reports, config);
        }

        System.out.println("[I] Risultati salvati: " + resultFilePath);
    }

    private static void writeStructuredResult(FileWriter writer, List<FormulaReport> reports,
                                              SolverConfiguration config) throws IOException {
        writer.write("=== RISOLUZIONE TABLEAUX ===\n");
        if (config.inputMode == InputMode.FILE) {
            writer.write("File originale: " + Paths.get(config.inputPath).getFileName() + "\n");
        }
        writer.write("Verifica: " + config.checkMode + "\n");
        writer.write("Visita: " + config.searchOrder + "\n");
        writer.write("Timeout: " + config.timeoutSeconds + "s\n");
        if (config.branchLimit > 0) {
            writer.write("Limite teorie: " + config.branchLimit + "\n");
        }
        writer.write("Formule: " + reports.size() + "\n");

        for (FormulaReport report : reports) {
            writer.write("\n" + "=".repeat(50) + "\n\n");
            writer.write(report.toReportBlock());
        }
    }

    //endregion

    //region GESTIONE DEI PERCORSI

    /**
     * @param subdirName nome sottodirectory (RESULT)
     * @return directory di output indicata con -o, altrimenti quella dell'input
     */
    private static Path getOutputDirectory(SolverConfiguration config, String subdirName) {
        if (config.outputPath != null) {
            return Paths.get(config.outputPath).resolve(subdirName);
        }
        Path parentDir = config.inputPath != null ? Paths.get(config.inputPath).getParent() : null;
        return parentDir != null ? parentDir.resolve(subdirName) : Paths.get(subdirName);
    }

    private static String getBaseFileName(String filePath) {
        String fileName = Paths.get(filePath).getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> SOLUTORE TABLEAUX <<::");
        System.out.println("Soddisfacibilità e validità di formule proposizionali con i tableaux analitici\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar solutore_tableaux.jar [opzioni]\n");

        System.out.println("INPUT (mutualmente esclusivi, default: standard input):");
        System.out.println("  -f <file>        Una formula per riga (righe vuote e righe con # ignorate)");
        System.out.println("  -d <directory>   Tutti i file .txt nella directory");
        System.out.println("  -e <formula>     Singola formula da linea di comando\n");

        System.out.println("OPZIONI:");
        System.out.println("  -m <sat|valid|all>  Proprietà da verificare (default: all)");
        System.out.println("  -s <bfs|dfs>        Ordine di visita dei rami (default: bfs)");
        System.out.println("  -t <secondi>        Timeout per formula (min: " + SolverConfiguration.MIN_TIMEOUT_SECONDS
                + ", default: " + SolverConfiguration.DEFAULT_TIMEOUT_SECONDS + ")");
        System.out.println("  -l <n>              Limite teorie elaborate (0 = illimitato)");
        System.out.println("  -o <directory>      Directory di output per RESULT/ (default: stessa di input)");
        System.out.println("  -v                  Log dettagliato della ricerca");
        System.out.println("  -h                  Mostra questo messaggio\n");

        System.out.println("SINTASSI FORMULE (completamente parentesizzate):");
        System.out.println("  variabile   a, p1, x_2");
        System.out.println("  negazione   (-A)      oppure (~A)");
        System.out.println("  and         (A ^ B)   oppure (A & B)");
        System.out.println("  or          (A | B)");
        System.out.println("  implica     (A -> B)  oppure (A => B)");
        System.out.println("  sse         (A <-> B) oppure (A <=> B)\n");

        System.out.println("ESEMPI:");
        System.out.println("  java -jar solutore_tableaux.jar -e \"((a ^ b) -> a)\"");
        System.out.println("  java -jar solutore_tableaux.jar -f formule.txt -m valid -t 5");
        System.out.println("  java -jar solutore_tableaux.jar -d formule/ -o risultati/ -s dfs");
    }

    //endregion

    //region CLASSI DI SUPPORTO

    /** Categoria dell'esito di una riga */
    enum ReportCategory {
        OK,
        EMPTY_FORMULA,
        ILL_FORMED_FORMULA,
        TIMEOUT,
        BRANCH_LIMIT,
        UNKNOWN_ERROR
    }

    /**
     * Esiti delle due ricerche; null per quella non richiesta.
     */
    private record Verdicts(TableauResult satisfiability, TableauResult validity) {}

    /**
     * Esito dell'elaborazione di una riga.
     */
    record FormulaReport(int lineNumber, String text, ReportCategory category, String message,
                         Formula formula, TableauResult satisfiability, TableauResult validity) {

        static FormulaReport success(int lineNumber, String text, Formula formula,
                                     TableauResult satisfiability, TableauResult validity) {
            return new FormulaReport(lineNumber, text, ReportCategory.OK, null, formula, satisfiability, validity);
        }

        static FormulaReport failure(int lineNumber, String text, ReportCategory category, String message) {
            return new FormulaReport(lineNumber, text, category, message, null, null, null);
        }

        /**
         * @return esito sintetico: verdetti separati da virgola, oppure categoria dell'errore
         */
        String verdict() {
            return switch (category) {
                case OK -> {
                    List<String> parts = new ArrayList<>();
                    if (satisfiability != null) {
                        parts.add(satisfiability.isSatisfiable() ? "SODDISFACIBILE" : "INSODDISFACIBILE");
                    }
                    if (validity != null) {
                        // Valida sse la negazione è insoddisfacibile
                        parts.add(validity.isSatisfiable() ? "NON VALIDA" : "VALIDA");
                    }
                    yield String.join(", ", parts);
                }
                case TIMEOUT -> "TIMEOUT";
                case BRANCH_LIMIT -> "LIMITE RAMI";
                case EMPTY_FORMULA, ILL_FORMED_FORMULA, UNKNOWN_ERROR -> "ERRORE: " + message;
            };
        }

        String toConsoleLine() {
            return text + "  =>  " + verdict();
        }

        String toReportBlock() {
            StringBuilder block = new StringBuilder();
            block.append("Formula ").append(lineNumber).append(": ").append(text).append("\n");
            block.append("Esito: ").append(verdict()).append("\n");
            block.append("Categoria: ").append(category).append("\n");
            if (formula != null) {
                block.append("Struttura: ").append(formula.size()).append(" nodi, profondità ")
                        .append(formula.depth()).append(", variabili ").append(formula.variables()).append("\n");
            }

            if (satisfiability != null) {
                appendSearch(block, "Ricerca sulla formula", satisfiability);
            }
            if (validity != null) {
                appendSearch(block, "Ricerca sulla negazione", validity);
            }
            return block.toString();
        }

        private static void appendSearch(StringBuilder block, String title, TableauResult result) {
            TableauStatistics statistics = result.getStatistics();
            block.append("\n").append(title).append(": ").append(result.getState()).append("\n");
            if (result.getOpenBranch() != null) {
                block.append("Ramo aperto: ").append(result.getOpenBranch()).append("\n");
            }
            block.append(statistics);
        }
    }

    /**
     * Risultato elaborazione batch con statistiche.
     */
    private static class BatchResult {
        final int totalFiles;
        int successCount = 0;
        int errorCount = 0;

        BatchResult(int totalFiles) {
            this.totalFiles = totalFiles;
        }

        void incrementSuccess() { successCount++; }
        void incrementError() { errorCount++; }
    }

    //endregion
}
