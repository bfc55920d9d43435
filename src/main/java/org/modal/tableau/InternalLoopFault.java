package org.modal.tableau;

/**
 * Superamento del limite difensivo di espansione su un ramo.
 *
 * Indica un difetto della politica di blocking e non è mai un esito logico: non va
 * riportato come "non valida" o "insoddisfacibile".
 */
public class InternalLoopFault extends RuntimeException {

    /** Passi di espansione eseguiti sul ramo al momento del guasto */
    private final int appliedSteps;

    /** Mondi presenti sul ramo al momento del guasto */
    private final int worldCount;

    public InternalLoopFault(String message, int appliedSteps, int worldCount) {
        super(message + " (passi=" + appliedSteps + ", mondi=" + worldCount + ")");
        this.appliedSteps = appliedSteps;
        this.worldCount = worldCount;
    }

    public int getAppliedSteps() {
        return appliedSteps;
    }

    public int getWorldCount() {
        return worldCount;
    }
}
