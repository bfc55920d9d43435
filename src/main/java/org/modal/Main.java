package org.modal;

import guru.nidi.graphviz.model.MutableGraph;
import org.modal.formula.Formula;
import org.modal.formula.FormulaParser;
import org.modal.formula.FormulaSyntaxException;
import org.modal.optionalfeatures.GraphvizExporter;
import org.modal.optionalfeatures.ModalChainProblem;
import org.modal.tableau.InternalLoopFault;
import org.modal.tableau.TableauPrinter;
import org.modal.verdict.CheckResult;
import org.modal.verdict.SolutionReport;
import org.modal.verdict.VerdictAssembler;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
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
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * SOLUTORE TABLEAUX MODALE (logica K)
 *
 * PIPELINE DI ELABORAZIONE COMPLETA:
 * 1. INPUT: Formula modale da file di testo, da directory o da linea di comando
 * 2. PARSING: Conversione notazione infissa -> albero sintattico (ANTLR)
 * 3. VALIDITÀ: Tableau con radice (φ, F, w0), contromodello se un ramo resta aperto
 * 4. SODDISFACIBILITÀ: Tableau con radice (φ, T, w0), modello testimone se un ramo resta aperto
 * 5. CLASSIFICAZIONE: Tautologia, contingente o contraddizione, con analisi della formula
 * 6. OUTPUT: Rapporto, tableau testuali ed eventuali grafi Graphviz
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - File singolo (-f): Elaborazione di un singolo file .txt
 * - Directory batch (-d): Elaborazione di tutti i file .txt in una cartella
 * - Formula diretta (-e): Elaborazione di una formula passata come argomento
 * - Generazione istanze catena modale (-gen=catena <numero>)
 * - Timeout configurabile (-t secondi) e directory di output (-o directory)
 * - Esportazione Graphviz dei tableaux e dei modelli (-opt=g)
 *
 * ORGANIZZAZIONE DEGLI OUTPUT STRUTTURATI:
 * - RESULT/: Rapporti con esiti, modelli, analisi e statistiche
 * - TABLEAU/: Alberi tableau testuali per validità e soddisfacibilità
 * - DOT/: Grafi DOT (e PNG se è disponibile un motore Graphviz), con -opt=g
 * - CATENA/: Istanze generate (con -gen=catena)
 */
public final class Main {
    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String EXPR_PARAM = "-e";
    private static final String OUTPUT_PARAM = "-o";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String OPT_PARAM = "-opt=";
    private static final String GEN_PARAM = "-gen=";

    /**
     * Flag opzioni disponibili
     * */
    private static final String OPT_GRAPHVIZ = "g";
    private static final String OPT_ALL = "all";

    /**
     * Flag generazione problemi disponibili
     * */
    private static final String GEN_CHAIN = "catena";

    /**
     * Configurazioni timeout di default e limiti
     * */
    private static final int DEFAULT_TIMEOUT_SECONDS = 10;
    private static final int MIN_TIMEOUT_SECONDS = 1;

    /** Nome base dei file di output in modalità -e */
    private static final String EXPRESSION_BASE_NAME = "formula";

    /** Prefisso delle righe di commento nei file di input */
    private static final String COMMENT_PREFIX = "#";

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * FLUSSO ESECUZIONE:
     * 1. Parsing e validazione parametri linea di comando
     * 2. Utilizzo della modalità appropriata (file, directory, formula diretta, generazione)
     * 3. Gestione errori globali
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        System.out.println("---> AVVIO SOLUTORE TABLEAUX MODALE <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            SolverConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            displayConfigurationSummary(config);
            executeMainPipeline(config);

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE SOLUTORE TABLEAUX <---");
        }
    }

    private static void executeMainPipeline(SolverConfiguration config) {
        if (config.isGenerationMode) {
            System.out.println("[I] Modalità: Generazione istanze " + config.generationType);
            processInstanceGeneration(config);
        } else if (config.expression != null) {
            System.out.println("[I] Modalità: Formula diretta");
            processFormula(config.expression, EXPRESSION_BASE_NAME, config);
        } else if (config.isFileMode) {
            System.out.println("[I] Modalità: Elaborazione file singolo");
            processSingleFile(config);
        } else {
            System.out.println("[I] Modalità: Elaborazione della directory");
            processDirectoryBatch(config);
        }
    }

    private static void handleGlobalError(Exception e) {
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    private static SolverConfiguration parseAndValidateArguments(String[] args) {
        try {
            ArgumentParser parser = new ArgumentParser();
            return parser.parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(SolverConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE SOLUTORE TABLEAUX <<--");

        if (config.isGenerationMode) {
            System.out.println("Modalità: Generazione istanze " + config.generationType);
            System.out.println("Numero istanze: " + config.generationCount);
        } else {
            String mode = config.expression != null ? "Formula diretta" : config.isFileMode ? "File singolo" : "Directory";
            System.out.println("Modalità: " + mode);
            System.out.println("Input: " + (config.expression != null ? config.expression : config.inputPath));
            System.out.println("Timeout: " + config.timeoutSeconds + " secondi");
            System.out.println("Esportazione Graphviz: " + (config.useGraphviz ? "Sì" : "No"));
        }

        System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "Directory input"));
        System.out.println("====================================\n");
    }

    //endregion

    //region GENERAZIONE ISTANZE

    private static void processInstanceGeneration(SolverConfiguration config) {
        System.out.println("-->> GENERAZIONE ISTANZE <<--");
        System.out.println("Tipo: " + config.generationType);
        System.out.println("Numero istanze: " + config.generationCount);
        System.out.println("=========================\n");

        if (GEN_CHAIN.equals(config.generationType)) {
            ModalChainProblem generator = new ModalChainProblem();
            generator.setOutputDirectory(config.outputPath != null ? config.outputPath : ".");
            generator.generateInstances(config.generationCount);

            System.out.println("\n[I] Report generazione:");
            System.out.println("Istanze create: " + generator.getGeneratedInstancesCount());
            System.out.println("Directory output: " + generator.getOutputDirectory());
        } else {
            throw new IllegalArgumentException("Tipo generazione non supportato: " + config.generationType);
        }
    }

    //endregion

    //region ELABORAZIONE DEL SINGOLO FILE

    private static void processSingleFile(SolverConfiguration config) {
        System.out.println("-->> ELABORAZIONE FILE <<--");
        System.out.println("File: " + Paths.get(config.inputPath).getFileName());
        System.out.println("=========================\n");

        try {
            String formulaText = readFormulaFromFile(config.inputPath);
            processFormula(formulaText, getBaseFileName(config.inputPath), config);
        } catch (IOException e) {
            System.out.println("[E] Errore lettura del file '" + config.inputPath + "': " + e.getMessage());
        }
    }

    /**
     * Esegue parsing, verifiche e salvataggio degli output per una formula.
     *
     * @param formulaText testo della formula
     * @param baseName nome base dei file di output
     * @param config configurazione corrente
     * @return true se è stato salvato un rapporto (esito o timeout), false se la formula non ha prodotto esito
     */
    private static boolean processFormula(String formulaText, String baseName, SolverConfiguration config) {
        try {
            // FASE 1: Parsing
            System.out.println("Parsing formula...");
            Formula formula = FormulaParser.parse(formulaText);
            System.out.println("[I] Formula riconosciuta: " + formula);

            // FASE 2: Verifiche con timeout
            SolutionReport report = executeSolvingWithTimeout(formula, formulaText, config);

            // FASE 3: Output
            if (report == null) {
                handleTimeoutResult(formulaText, baseName, config);
            } else {
                handleSuccessfulResult(report, baseName, config);
            }
            return true;

        } catch (FormulaSyntaxException e) {
            System.out.println("[E] Formula non ben formata: " + e.getMessage());
        } catch (InternalLoopFault e) {
            System.out.println("[E] Guasto interno del tableau (nessun esito): " + e.getMessage());
        } catch (IOException e) {
            System.out.println("[E] Errore salvataggio risultati per '" + baseName + "': " + e.getMessage());
        }
        return false;
    }

    private static SolutionReport executeSolvingWithTimeout(Formula formula, String formulaText, SolverConfiguration config) {
        System.out.println("Costruzione tableaux (timeout: " + config.timeoutSeconds + "s)...");

        ExecutorService executor = Executors.newSingleThreadExecutor();
        VerdictAssembler assembler = new VerdictAssembler();

        try {
            Callable<SolutionReport> solverTask = () -> assembler.solve(formula, formulaText.trim());
            Future<SolutionReport> future = executor.submit(solverTask);
            return future.get(config.timeoutSeconds, TimeUnit.SECONDS);

        } catch (TimeoutException e) {
            System.out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi");
            return null;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new IllegalStateException("Errore nella costruzione dei tableaux", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Elaborazione interrotta", e);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Legge la formula ignorando righe vuote e commenti (#).
     */
    private static String readFormulaFromFile(String filePath) throws IOException {
        System.out.println("Lettura formula modale...");
        String content;
        try (Stream<String> lines = Files.lines(Path.of(filePath))) {
            content = lines.map(String::trim)
                    .filter(line -> !line.isEmpty() && !line.startsWith(COMMENT_PREFIX))
                    .collect(Collectors.joining(" "));
        }
        System.out.println("[I] Formula letta: " + content);
        return content;
    }

    //endregion

    //region ELABORAZIONE DELLA DIRECTORY

    private static void processDirectoryBatch(SolverConfiguration config) {
        System.out.println("[I] Inizio elaborazione directory: " + config.inputPath);

        try {
            List<File> txtFiles = findAllTxtFiles(config.inputPath);
            if (txtFiles.isEmpty()) {
                System.out.println("[W] Nessun file .txt trovato nella directory specificata.");
                return;
            }

            BatchResult batchResult = new BatchResult(txtFiles.size());
            for (File file : txtFiles) {
                System.out.println("Elaborazione: " + file.getName());
                try {
                    boolean processed = processFormula(readFormulaFromFile(file.getAbsolutePath()),
                            getBaseFileName(file.getName()), config.forFile(file.getAbsolutePath()));
                    if (processed) {
                        batchResult.incrementSuccess();
                    } else {
                        batchResult.incrementError();
                    }
                } catch (IOException | RuntimeException e) {
                    System.out.println("[E] Errore nel file " + file.getName() + ": " + e);
                    batchResult.incrementError();
                }
                System.out.println();
            }
            displayBatchSummary(batchResult);

        } catch (IOException e) {
            System.out.println("[E] Errore durante l'accesso alla directory: " + e.getMessage());
        }
    }

    private static List<File> findAllTxtFiles(String dirPath) throws IOException {
        System.out.println("Ricerca file .txt nella directory...");

        List<File> txtFiles;
        try (Stream<Path> paths = Files.list(Paths.get(dirPath))) {
            txtFiles = paths.filter(path -> path.toString().toLowerCase().endsWith(".txt"))
                    .map(Path::toFile)
                    .sorted(Comparator.comparing(File::getName))
                    .collect(Collectors.toList());
        }

        System.out.println("Trovati " + txtFiles.size() + " file .txt da elaborare.");
        return txtFiles;
    }

    private static void displayBatchSummary(BatchResult result) {
        System.out.println("\n-->> RIEPILOGO ELABORAZIONE DIRECTORY <<--");
        System.out.println("File elaborati trovati: " + result.totalFiles);
        System.out.println("File elaborati con successo: " + result.successCount);
        System.out.println("File con errori: " + result.errorCount);
        System.out.println("=========================================\n");
    }

    //endregion

    //region GESTIONE DELL'OUTPUT E SALVATAGGIO DEI FILE

    private static void handleSuccessfulResult(SolutionReport report, String baseName, SolverConfiguration config) throws IOException {
        System.out.println("[I] Validità: " + report.getValidity().getVerdict());
        System.out.println("[I] Soddisfacibilità: " + report.getSatisfiability().getVerdict());
        System.out.println("[I] Classificazione: " + report.getClassification());

        writeOutputFile(config, "RESULT", baseName + ".result", report.toString());

        TableauPrinter printer = new TableauPrinter();
        for (CheckResult result : List.of(report.getValidity(), report.getSatisfiability())) {
            String fileName = baseName + "_" + result.getKind().getFileSuffix() + ".tableau";
            writeOutputFile(config, "TABLEAU", fileName, printer.print(result.getTree(), result.getKind().getTitle()));
        }

        if (config.useGraphviz) {
            exportGraphviz(report, baseName, config);
        }
    }

    private static void exportGraphviz(SolutionReport report, String baseName, SolverConfiguration config) throws IOException {
        GraphvizExporter exporter = new GraphvizExporter();
        Path dotDir = getOutputDirectory(config, "DOT");

        List<NamedGraph> graphs = new ArrayList<>();
        for (CheckResult result : List.of(report.getValidity(), report.getSatisfiability())) {
            String name = baseName + "_" + result.getKind().getFileSuffix();
            graphs.add(new NamedGraph(name, exporter.tableauGraph(result.getTree(), name)));
            result.getModel().ifPresent(model ->
                    graphs.add(new NamedGraph(name + "_modello", exporter.modelGraph(model, name + "_modello"))));
        }

        int rendered = 0;
        for (NamedGraph graph : graphs) {
            exporter.writeDot(graph.graph(), dotDir.resolve(graph.name() + ".dot"));
            if (exporter.renderPng(graph.graph(), dotDir.resolve(graph.name() + ".png"))) {
                rendered++;
            }
        }

        System.out.println("[I] Grafi DOT salvati: " + graphs.size() + " in " + dotDir);
        if (rendered < graphs.size()) {
            System.out.println("[W] PNG non generati: motore Graphviz non disponibile");
        }
    }

    private static void handleTimeoutResult(String formulaText, String baseName, SolverConfiguration config) throws IOException {
        System.out.println("[W] Superato il timeout con limite di " + config.timeoutSeconds + " secondi");
        writeOutputFile(config, "RESULT", baseName + ".result",
                "=== RAPPORTO SOLUZIONE ===\n" +
                "Input: " + formulaText.trim() + "\n" +
                "Esito: TIMEOUT dopo " + config.timeoutSeconds + " secondi\n");
    }

    private static void writeOutputFile(SolverConfiguration config, String dirName, String fileName, String content) throws IOException {
        Path outputDir = getOutputDirectory(config, dirName);
        Files.createDirectories(outputDir);
        Path outputFilePath = outputDir.resolve(fileName);

        try (FileWriter writer = new FileWriter(outputFilePath.toFile())) {
            writer.write(content);
        }

        System.out.println("[I] File " + dirName + " salvato: " + outputFilePath);
    }

    private static Path getOutputDirectory(SolverConfiguration config, String subdirName) {
        if (config.outputPath != null) {
            return Paths.get(config.outputPath).resolve(subdirName);
        }
        if (config.inputPath != null) {
            Path parentDir = Paths.get(config.inputPath).toAbsolutePath().getParent();
            if (parentDir != null) {
                return parentDir.resolve(subdirName);
            }
        }
        return Paths.get(subdirName);
    }

    private static String getBaseFileName(String filePath) {
        String fileName = Paths.get(filePath).getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> SOLUTORE TABLEAUX MODALE <<::");
        System.out.println("Validità e soddisfacibilità di formule della logica modale K");
        System.out.println("con il metodo dei tableaux semantici ed estrazione di modelli di Kripke\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar solutore-modale.jar [opzioni]\n");

        System.out.println("MODALITÀ OPERATIVE:");
        System.out.println("  1. RISOLUZIONE:");
        System.out.println("     -f <file>         Elabora un singolo file .txt");
        System.out.println("     -d <directory>    Elabora tutti i file .txt in una directory");
        System.out.println("     -e \"<formula>\"    Elabora la formula passata come argomento");
        System.out.println("     -o <directory>    Directory di output (default: stessa di input)");
        System.out.println("     -t <secondi>      Timeout per formula (min: 1, default: 10)");
        System.out.println("     -opt=g            Esporta tableaux e modelli in formato Graphviz");
        System.out.println();
        System.out.println("  2. GENERAZIONE ISTANZE:");
        System.out.println("     -gen=catena <numero>  Genera istanze <>^n p & []^n ~p (1-100)");
        System.out.println("     -o <directory>        Directory output per istanze generate");
        System.out.println();
        System.out.println("  3. AIUTO:");
        System.out.println("     -h                Mostra questa guida\n");

        System.out.println("SINTASSI FORMULE:");
        System.out.println("  Atomi: identificatori minuscoli (p, q, r1, ...)");
        System.out.println("  Negazione: ~ oppure ¬");
        System.out.println("  Congiunzione: & oppure ∧");
        System.out.println("  Disgiunzione: | oppure ∨");
        System.out.println("  Implicazione: -> oppure →  (associativa a destra)");
        System.out.println("  Biimplicazione: <-> oppure ↔");
        System.out.println("  Necessità: [] oppure □");
        System.out.println("  Possibilità: <> oppure ◇\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar solutore-modale.jar -e \"[]p -> <>p\"\n");
        System.out.println("  java -jar solutore-modale.jar -d ./formule/ -o ./output/ -opt=g\n");
        System.out.println("  java -jar solutore-modale.jar -gen=catena 10 -o ./output/\n");

        System.out.println("OUTPUT GENERATO:");
        System.out.println("  RESULT/   Esiti, modelli di Kripke, analisi e statistiche");
        System.out.println("  TABLEAU/  Alberi tableau per validità e soddisfacibilità");
        System.out.println("  DOT/      Grafi Graphviz (con -opt=g)");
        System.out.println("  CATENA/   Istanze generate\n");

        System.out.println("NOTE OPERATIVE:");
        System.out.println("  - Nei file .txt le righe che iniziano con # sono commenti");
        System.out.println("  - Le modalità file, directory, formula diretta e generazione sono mutualmente esclusive");
        System.out.println("  - Semantica K: nessuna proprietà imposta alla relazione di accessibilità\n");

        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione.
     */
    private static class SolverConfiguration {
        final String inputPath;
        final String expression;
        final String outputPath;
        final boolean isFileMode;
        final int timeoutSeconds;
        final boolean useGraphviz;
        final boolean isGenerationMode;
        final String generationType;
        final int generationCount;

        SolverConfiguration(String inputPath, String expression, String outputPath, boolean isFileMode,
                            int timeoutSeconds, boolean useGraphviz,
                            boolean isGenerationMode, String generationType, int generationCount) {
            this.inputPath = inputPath;
            this.expression = expression;
            this.outputPath = outputPath;
            this.isFileMode = isFileMode;
            this.timeoutSeconds = timeoutSeconds;
            this.useGraphviz = useGraphviz;
            this.isGenerationMode = isGenerationMode;
            this.generationType = generationType;
            this.generationCount = generationCount;
        }

        /** Configurazione per un file di un batch: stesse opzioni, input diverso */
        SolverConfiguration forFile(String filePath) {
            return new SolverConfiguration(filePath, null, outputPath, true, timeoutSeconds, useGraphviz,
                    false, null, 0);
        }
    }

    /**
     * Parser dei parametri linea di comando.
     */
    private static class ArgumentParser {

        public SolverConfiguration parse(String[] args) {
            String inputPath = null;
            String expression = null;
            String outputPath = null;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;
            boolean isGenerationMode = false;
            boolean useGraphviz = false;
            String generationType = null;
            int generationCount = 0;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }

                    case FILE_PARAM -> {
                        validateExclusiveMode(isDirectoryMode || expression != null || isGenerationMode, "file");
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        isFileMode = true;
                    }

                    case DIR_PARAM -> {
                        validateExclusiveMode(isFileMode || expression != null || isGenerationMode, "directory");
                        inputPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(inputPath);
                        isDirectoryMode = true;
                    }

                    case EXPR_PARAM -> {
                        validateExclusiveMode(isFileMode || isDirectoryMode || isGenerationMode, "formula diretta");
                        expression = getNextArgument(args, ++i, "formula");
                    }

                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        validateOrCreateOutputDirectory(outputPath);
                    }

                    case TIMEOUT_PARAM -> timeoutSeconds = parseAndValidateTimeout(args, ++i);

                    default -> {
                        if (args[i].startsWith(OPT_PARAM)) {
                            useGraphviz = parseOptionalFlags(args[i].substring(OPT_PARAM.length()));
                        } else if (args[i].startsWith(GEN_PARAM)) {
                            validateExclusiveMode(isFileMode || isDirectoryMode || expression != null, "generazione");
                            GenerationConfig genConfig = parseGenerationParameters(args, i);
                            generationType = genConfig.type();
                            generationCount = genConfig.count();
                            isGenerationMode = true;
                            i = genConfig.nextIndex();
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (isGenerationMode) {
                if (outputPath == null) {
                    throw new IllegalArgumentException("Modalità generazione richiede directory output (-o)");
                }
                return new SolverConfiguration(null, null, outputPath, false, 0, false,
                        true, generationType, generationCount);
            }

            if (inputPath == null && expression == null) {
                throw new IllegalArgumentException("Specificare input con -f (file), -d (directory) o -e (formula)");
            }

            return new SolverConfiguration(inputPath, expression, outputPath, isFileMode, timeoutSeconds, useGraphviz,
                    false, null, 0);
        }

        private void validateExclusiveMode(boolean otherModeActive, String currentMode) {
            if (otherModeActive) {
                throw new IllegalArgumentException("Modalità " + currentMode +
                        " non può essere combinata con altre modalità (file/directory/formula/generazione sono mutualmente esclusive)");
            }
        }

        private GenerationConfig parseGenerationParameters(String[] args, int currentIndex) {
            String genType = args[currentIndex].substring(GEN_PARAM.length());

            if (!GEN_CHAIN.equals(genType)) {
                throw new IllegalArgumentException("Tipo generazione non supportato: " + genType +
                        ". Supportati: " + GEN_CHAIN);
            }

            if (currentIndex + 1 >= args.length) {
                throw new IllegalArgumentException("Parametro -gen=" + genType + " richiede numero istanze");
            }

            int count;
            try {
                count = Integer.parseInt(args[currentIndex + 1]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Numero istanze non valido: " + args[currentIndex + 1]);
            }

            if (count < 1 || count > ModalChainProblem.MAX_INSTANCES) {
                throw new IllegalArgumentException("Numero istanze deve essere tra 1 e " +
                        ModalChainProblem.MAX_INSTANCES + ", ricevuto: " + count);
            }

            return new GenerationConfig(genType, count, currentIndex + 1);
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parseAndValidateTimeout(String[] args, int currentIndex) {
            String timeoutStr = getNextArgument(args, currentIndex, "numero secondi");

            try {
                int timeout = Integer.parseInt(timeoutStr);
                if (timeout < MIN_TIMEOUT_SECONDS) {
                    throw new IllegalArgumentException("Timeout minimo: " + MIN_TIMEOUT_SECONDS + " secondi");
                }
                return timeout;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore timeout non valido: " + timeoutStr);
            }
        }

        /**
         * @return true se l'esportazione Graphviz è richiesta
         */
        private boolean parseOptionalFlags(String flagsStr) {
            if (flagsStr == null || flagsStr.trim().isEmpty()) {
                throw new IllegalArgumentException("Valore -opt vuoto");
            }
            if (flagsStr.equals(OPT_ALL) || flagsStr.equals(OPT_GRAPHVIZ)) {
                return true;
            }
            throw new IllegalArgumentException("Opzione sconosciuta: " + flagsStr + ". Supportate: g, all");
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

    private record GenerationConfig(String type, int count, int nextIndex) {}

    private record NamedGraph(String name, MutableGraph graph) {}

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
