package org.modal.tableau;

/**
 * Limiti difensivi del costruttore di tableaux.
 *
 * Con il blocking attivo nessun ramo corretto si avvicina a questi limiti: superarli
 * segnala un difetto interno ({@link InternalLoopFault}).
 */
public final class TableauConfiguration {

    /** Applicazioni di regole massime per ramo */
    public static final int DEFAULT_MAX_ITERATIONS = 10_000;

    /** Mondi massimi per ramo */
    public static final int DEFAULT_MAX_WORLDS = 256;

    private final int maxIterations;
    private final int maxWorlds;

    public TableauConfiguration(int maxIterations, int maxWorlds) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("Limite iterazioni deve essere positivo, ricevuto: " + maxIterations);
        }
        if (maxWorlds <= 0) {
            throw new IllegalArgumentException("Limite mondi deve essere positivo, ricevuto: " + maxWorlds);
        }
        this.maxIterations = maxIterations;
        this.maxWorlds = maxWorlds;
    }

    public static TableauConfiguration defaults() {
        return new TableauConfiguration(DEFAULT_MAX_ITERATIONS, DEFAULT_MAX_WORLDS);
    }

    public TableauConfiguration withMaxIterations(int iterations) {
        return new TableauConfiguration(iterations, maxWorlds);
    }

    public TableauConfiguration withMaxWorlds(int worlds) {
        return new TableauConfiguration(maxIterations, worlds);
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public int getMaxWorlds() {
        return maxWorlds;
    }

    @Override
    public String toString() {
        return "TableauConfiguration{maxIterations=" + maxIterations + ", maxWorlds=" + maxWorlds + "}";
    }
}
