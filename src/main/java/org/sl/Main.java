package org.sl;

import org.sl.parser.FormulaParser;
import org.sl.parser.ParseResult;
import org.sl.reductio.DecisionResult;
import org.sl.reductio.TautologyDecider;
import org.sl.support.Formula;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * DIMOSTRATORE SL - Decisore di tautologie per la logica enunciativa
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: formula da linea di comando, da file di testo o da tutti i .txt di una cartella
 * 2. PARSING: notazione testuale -> albero della formula (ANTLR)
 * 3. ASSUNZIONE: negazione della formula come prima riga della derivazione
 * 4. DNF: riduzione della negazione in forma normale disgiuntiva, passo per passo
 * 5. CONTROESEMPIO: se la DNF è soddisfacibile la formula è refutabile
 * 6. REDUCTIO: altrimenti si completa la derivazione della formula
 * 7. OUTPUT: valutazione falsificante oppure derivazione numerata, con statistiche
 *
 * MODALITÀ OPERATIVE:
 * - Formula diretta (-e), file singolo (-f), directory (-d)
 * - Senza parametri si decide la formula dimostrativa (A -> B) -> (~B -> ~A)
 * - Timeout configurabile (-t secondi), verifica delle prove (-check)
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    private static final String HELP_PARAM = "-h";
    private static final String EXPRESSION_PARAM = "-e";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String CHECK_PARAM = "-check";

    /** Formula decisa quando non viene fornito alcun input */
    private static final String DEFAULT_FORMULA = "(A -> B) -> (~B -> ~A)";

    private static final int DEFAULT_TIMEOUT_SECONDS = 10;
    private static final int MIN_TIMEOUT_SECONDS = 1;

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        System.out.println("---> AVVIO DIMOSTRATORE SL <---");

        try {
            DeciderConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            executeMainPipeline(config);

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE DIMOSTRATORE SL <---");
        }
    }

    private static void executeMainPipeline(DeciderConfiguration config) throws IOException {
        switch (config.mode) {
            case EXPRESSION -> processFormula(config.input, config);
            case FILE -> processFile(Paths.get(config.input), config);
            case DIRECTORY -> processDirectory(Paths.get(config.input), config);
        }
    }

    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.exit(1);
    }

    private static DeciderConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    //endregion

    //region ELABORAZIONE INPUT

    private static void processDirectory(Path directory, DeciderConfiguration config) throws IOException {
        List<Path> files;
        try (Stream<Path> entries = Files.list(directory)) {
            files = entries
                    .filter(path -> path.toString().toLowerCase().endsWith(".txt"))
                    .sorted(Comparator.comparing(Path::toString))
                    .toList();
        }

        if (files.isEmpty()) {
            System.out.println("[W] Nessun file .txt trovato nella directory specificata.");
            return;
        }

        System.out.println("Trovati " + files.size() + " file .txt da elaborare.\n");
        int failures = 0;
        for (Path file : files) {
            try {
                processFile(file, config);
            } catch (IOException e) {
                System.out.println("[E] Errore nel file " + file.getFileName() + ": " + e.getMessage());
                failures++;
            }
            System.out.println();
        }
        System.out.println("[I] File elaborati: " + (files.size() - failures) + "/" + files.size());
    }

    private static void processFile(Path file, DeciderConfiguration config) throws IOException {
        System.out.println("-->> ELABORAZIONE FILE " + file.getFileName() + " <<--");
        String content = Files.readString(file).trim();
        processFormula(content, config);
    }

    /**
     * Analizza, decide e stampa l'esito di una singola formula.
     */
    private static void processFormula(String text, DeciderConfiguration config) {
        ParseResult parsed = FormulaParser.parse(text);
        if (!parsed.isSuccess()) {
            System.out.println("[E] " + parsed.getError());
            return;
        }

        Formula formula = parsed.getFormula();
        System.out.println("[I] Formula: " + formula);

        DecisionResult result = decideWithTimeout(formula, config);
        if (result == null) {
            System.out.println("[W] Superato il timeout di " + config.timeoutSeconds + " secondi");
            return;
        }

        System.out.println(result.isTautology() ? "[I] Tautologia dimostrata!" : "[I] Formula refutabile");
        System.out.print(result);
        System.out.print(result.getStatistics());
    }

    /**
     * Esegue la decisione su un thread dedicato con limite di tempo.
     *
     * @return esito, oppure null se il timeout è scaduto
     */
    private static DecisionResult decideWithTimeout(Formula formula, DeciderConfiguration config) {
        // Thread daemon: un timeout non deve tenere in vita la JVM
        ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "DeciderThread");
            thread.setDaemon(true);
            return thread;
        });
        TautologyDecider decider = new TautologyDecider();
        decider.setVerifyResults(config.verifyResults);

        try {
            Callable<DecisionResult> task = () -> decider.decide(formula);
            Future<DecisionResult> future = executor.submit(task);
            return future.get(config.timeoutSeconds, TimeUnit.SECONDS);

        } catch (TimeoutException e) {
            LOGGER.warning("Timeout durante la decisione di " + formula);
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Decisione interrotta", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Errore durante la decisione di " + formula, e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    //endregion

    //region HELP

    private static void printApplicationHelp() {
        System.out.println("\n===============================================");
        System.out.println("USO: java -jar dimostratore-sl.jar [opzioni]");
        System.out.println();
        System.out.println("INPUT (mutuamente esclusivi):");
        System.out.println("  -e <formula>   Formula fornita direttamente");
        System.out.println("  -f <file>      File di testo contenente una formula");
        System.out.println("  -d <dir>       Tutti i file .txt della directory");
        System.out.println();
        System.out.println("OPZIONI:");
        System.out.println("  -t <secondi>   Timeout per formula (default " + DEFAULT_TIMEOUT_SECONDS
                + ", minimo " + MIN_TIMEOUT_SECONDS + ")");
        System.out.println("  -check         Verifica ogni prova e controesempio prodotto");
        System.out.println("  -h             Mostra questo messaggio");
        System.out.println();
        System.out.println("SINTASSI FORMULE:");
        System.out.println("  Atomi A..Z, NOT(~), AND(&), OR(v), IMPLIES(->), IFF(<->)");
        System.out.println("  Ogni connettivo binario tra parentesi: ((A & B) -> A)");
        System.out.println("  Le parentesi più esterne possono essere omesse");
        System.out.println();
        System.out.println("Senza input viene decisa la formula " + DEFAULT_FORMULA);
        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    private enum InputMode { EXPRESSION, FILE, DIRECTORY }

    /**
     * Configurazione validata dell'applicazione.
     */
    private static class DeciderConfiguration {
        final InputMode mode;
        final String input;
        final int timeoutSeconds;
        final boolean verifyResults;

        DeciderConfiguration(InputMode mode, String input, int timeoutSeconds, boolean verifyResults) {
            this.mode = mode;
            this.input = input;
            this.timeoutSeconds = timeoutSeconds;
            this.verifyResults = verifyResults;
        }
    }

    /**
     * Parser dei parametri della linea di comando.
     */
    private static class ArgumentParser {

        /**
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri sono invalidi o in conflitto
         */
        DeciderConfiguration parse(String[] args) {
            InputMode mode = null;
            String input = null;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            boolean verifyResults = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }

                    case EXPRESSION_PARAM -> {
                        validateExclusiveMode(mode);
                        input = getNextArgument(args, ++i, "formula");
                        mode = InputMode.EXPRESSION;
                    }

                    case FILE_PARAM -> {
                        validateExclusiveMode(mode);
                        input = getNextArgument(args, ++i, "file");
                        validateFileExists(input);
                        mode = InputMode.FILE;
                    }

                    case DIR_PARAM -> {
                        validateExclusiveMode(mode);
                        input = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(input);
                        mode = InputMode.DIRECTORY;
                    }

                    case TIMEOUT_PARAM -> timeoutSeconds = parseAndValidateTimeout(args, ++i);

                    case CHECK_PARAM -> verifyResults = true;

                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (mode == null) {
                mode = InputMode.EXPRESSION;
                input = DEFAULT_FORMULA;
            }
            return new DeciderConfiguration(mode, input, timeoutSeconds, verifyResults);
        }

        private void validateExclusiveMode(InputMode current) {
            if (current != null) {
                throw new IllegalArgumentException("Le modalità -e, -f e -d sono mutuamente esclusive");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] + " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parseAndValidateTimeout(String[] args, int currentIndex) {
            String timeoutStr = getNextArgument(args, currentIndex, "numero secondi");
            int timeout;
            try {
                timeout = Integer.parseInt(timeoutStr);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore timeout non valido: " + timeoutStr);
            }
            if (timeout < MIN_TIMEOUT_SECONDS) {
                throw new IllegalArgumentException("Timeout minimo: " + MIN_TIMEOUT_SECONDS + " secondi");
            }
            return timeout;
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.isFile()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }

        private void validateDirectoryExists(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Directory non esistente: " + dirPath);
            }
            if (!dir.canRead()) {
                throw new IllegalArgumentException("Directory non leggibile: " + dirPath);
            }
        }
    }

    //endregion
}
