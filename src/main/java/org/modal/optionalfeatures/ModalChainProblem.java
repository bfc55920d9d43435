package org.modal.optionalfeatures;

import org.modal.formula.Formula;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * GENERATORE CATENE MODALI - Istanze di test insoddisfacibili a profondità crescente
 *
 * L'istanza di dimensione n è <>^n p & []^n ~p: il diamante annidato n volte richiede
 * una catena di n mondi, mentre il box annidato n volte impone ~p all'ultimo mondo della
 * stessa catena. Ogni istanza è quindi insoddisfacibile, e il tableau deve costruire
 * esattamente n mondi prima di chiudere.
 *
 * OUTPUT:
 * <directory>/CATENA/catena_1.txt ... catena_n.txt, una formula per file
 */
public class ModalChainProblem {

    private static final Logger LOGGER = Logger.getLogger(ModalChainProblem.class.getName());

    //region CONFIGURAZIONE E COSTANTI

    private static final String CHAIN_DIR = "CATENA";
    private static final String FILE_PREFIX = "catena_";
    private static final String FILE_EXTENSION = ".txt";

    /** Dimensione massima accettata per una singola generazione */
    public static final int MAX_INSTANCES = 100;

    //endregion

    private String outputDirectory;
    private int generatedInstances;
    private StringBuilder generationLog = new StringBuilder();

    public ModalChainProblem() {
        LOGGER.fine("ModalChainProblem inizializzato per generazione istanze");
    }

    public void setOutputDirectory(String outputPath) {
        if (outputPath == null || outputPath.trim().isEmpty()) {
            throw new IllegalArgumentException("Directory output non può essere null o vuota");
        }
        this.outputDirectory = outputPath.trim();
        generationLog.append("Directory output configurata: ").append(outputDirectory).append("\n");
    }

    //region GENERAZIONE

    /**
     * Genera le istanze di dimensione 1..numberOfProblems nella sottodirectory CATENA.
     *
     * @param numberOfProblems numero di istanze (1..100)
     * @throws IllegalArgumentException se il numero è fuori intervallo
     * @throws IllegalStateException se la directory di output non è configurata
     */
    public void generateInstances(int numberOfProblems) {
        if (numberOfProblems < 1 || numberOfProblems > MAX_INSTANCES) {
            throw new IllegalArgumentException("Numero problemi deve essere tra 1 e " + MAX_INSTANCES + ", ricevuto: " + numberOfProblems);
        }
        if (outputDirectory == null) {
            throw new IllegalStateException("Directory output non configurata - chiamare setOutputDirectory() prima");
        }

        generatedInstances = 0;
        generationLog = new StringBuilder("=== INIZIO GENERAZIONE CATENE MODALI ===\n");
        LOGGER.info("Inizio generazione " + numberOfProblems + " istanze catena modale");

        Path chainPath = Paths.get(outputDirectory).resolve(CHAIN_DIR);
        try {
            Files.createDirectories(chainPath);

            for (int n = 1; n <= numberOfProblems; n++) {
                Formula instance = buildInstance(n);
                Path filePath = chainPath.resolve(FILE_PREFIX + n + FILE_EXTENSION);

                try (FileWriter writer = new FileWriter(filePath.toFile())) {
                    writer.write("# Catena modale n=" + n + " (insoddisfacibile)\n");
                    writer.write(instance + "\n");
                }

                generatedInstances++;
                generationLog.append("Istanza n=").append(n).append(": ").append(instance)
                        .append(" (profondità modale ").append(instance.modalDepth()).append(")\n");
            }
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Errore durante generazione istanze catena", e);
            System.out.println("[E] Generazione fallita dopo " + generatedInstances + "/" + numberOfProblems + " istanze");
            throw new RuntimeException("Generazione istanze catena fallita", e);
        }

        generationLog.append("\n=== GENERAZIONE COMPLETATA ===\n");
        generationLog.append("Istanze generate: ").append(generatedInstances).append("/").append(numberOfProblems).append("\n");

        LOGGER.info("Generazione completata: " + generatedInstances + " istanze create");
        System.out.println("[I] Generazione catene modali completata!");
        System.out.println("[I] Istanze create: " + generatedInstances + "/" + numberOfProblems);
        System.out.println("[I] Directory: " + chainPath);
    }

    /**
     * @param n profondità della catena (>= 1)
     * @return la formula <>^n p & []^n ~p
     */
    public static Formula buildInstance(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("Profondità catena deve essere >= 1, ricevuto: " + n);
        }

        Formula possibly = Formula.atom("p");
        Formula necessarily = Formula.not(Formula.atom("p"));
        for (int i = 0; i < n; i++) {
            possibly = Formula.diamond(possibly);
            necessarily = Formula.box(necessarily);
        }
        return Formula.and(possibly, necessarily);
    }

    //endregion

    public String getGenerationReport() {
        return generationLog.toString();
    }

    public int getGeneratedInstancesCount() {
        return generatedInstances;
    }

    public String getOutputDirectory() {
        return outputDirectory;
    }

    @Override
    public String toString() {
        return String.format("ModalChainProblem[generated=%d, output=%s]", generatedInstances, outputDirectory);
    }
}
