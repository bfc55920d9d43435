package org.modal.tableau;

/**
 * STATISTICHE TABLEAU - Metriche raccolte durante la costruzione di un albero
 *
 * Ogni chiamata a {@link TableauBuilder#build} possiede la propria istanza: le due
 * verifiche (validità e soddisfacibilità) non condividono contatori.
 */
public class TableauStatistics {

    //region CONTATORI REGOLE

    /** Applicazioni di regole α (non ramificanti) */
    private int alphaApplications = 0;

    /** Applicazioni di regole β (ramificanti) */
    private int betaApplications = 0;

    /** Applicazioni di regole modali esistenziali (F[] e T<>) */
    private int existentialApplications = 0;

    /** Applicazioni di regole modali universali (T[] e F<>) */
    private int universalApplications = 0;

    //endregion

    //region CONTATORI MONDI E RAMI

    /** Mondi nuovi introdotti dalle regole esistenziali */
    private int worldsCreated = 0;

    /** Regole esistenziali soddisfatte riusando un mondo esistente */
    private int worldsReused = 0;

    private int closedBranches = 0;

    private int openBranches = 0;

    //endregion

    //region TIMING

    private long startTime;
    private long executionTimeMs = 0;
    private boolean timerStopped = false;

    //endregion

    public TableauStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region INCREMENTI

    public synchronized void incrementAlphaApplications() {
        alphaApplications++;
    }

    public synchronized void incrementBetaApplications() {
        betaApplications++;
    }

    public synchronized void incrementExistentialApplications() {
        existentialApplications++;
    }

    public synchronized void incrementUniversalApplications() {
        universalApplications++;
    }

    public synchronized void incrementWorldsCreated() {
        worldsCreated++;
    }

    public synchronized void incrementWorldsReused() {
        worldsReused++;
    }

    public synchronized void incrementClosedBranches() {
        closedBranches++;
    }

    public synchronized void incrementOpenBranches() {
        openBranches++;
    }

    //endregion

    //region TIMING

    /**
     * Ferma la misurazione del tempo. Chiamate successive non hanno effetto.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    /**
     * @return tempo di esecuzione in ms (parziale se il timer è ancora attivo)
     */
    public long getExecutionTimeMs() {
        return timerStopped ? executionTimeMs : System.currentTimeMillis() - startTime;
    }

    public boolean isTimerStopped() {
        return timerStopped;
    }

    //endregion

    //region GETTERS

    public int getAlphaApplications() {
        return alphaApplications;
    }

    public int getBetaApplications() {
        return betaApplications;
    }

    public int getExistentialApplications() {
        return existentialApplications;
    }

    public int getUniversalApplications() {
        return universalApplications;
    }

    public int getWorldsCreated() {
        return worldsCreated;
    }

    public int getWorldsReused() {
        return worldsReused;
    }

    public int getClosedBranches() {
        return closedBranches;
    }

    public int getOpenBranches() {
        return openBranches;
    }

    public int getTotalApplications() {
        return alphaApplications + betaApplications + existentialApplications + universalApplications;
    }

    //endregion

    /**
     * @return riepilogo compatto su una riga, usato nei log
     */
    public String toCompactString() {
        return String.format("α=%d, β=%d, ∃=%d, ∀=%d, mondi=%d (+%d riusati), rami chiusi=%d, aperti=%d, %d ms",
                alphaApplications, betaApplications, existentialApplications, universalApplications,
                worldsCreated, worldsReused, closedBranches, openBranches, getExecutionTimeMs());
    }

    @Override
    public String toString() {
        return "=== STATISTICHE TABLEAU ===\n" +
                "Regole α applicate: " + alphaApplications + "\n" +
                "Regole β applicate: " + betaApplications + "\n" +
                "Regole ∃ applicate: " + existentialApplications + "\n" +
                "Regole ∀ applicate: " + universalApplications + "\n" +
                "Mondi creati: " + worldsCreated + "\n" +
                "Mondi riusati (blocking): " + worldsReused + "\n" +
                "Rami chiusi: " + closedBranches + "\n" +
                "Rami aperti: " + openBranches + "\n" +
                "Tempo di esecuzione: " + getExecutionTimeMs() + " ms\n";
    }
}
