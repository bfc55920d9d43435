package org.modal.formula;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Analisi strutturale di una formula, in sola lettura.
 *
 * Non partecipa alla procedura di decisione: serve alla presentazione dei risultati
 * (formula modale o proposizionale, connettivi presenti, variabili, profondità).
 */
public final class FormulaAnalysis {

    private final Set<Formula.Type> connectives;
    private final Set<String> atoms;
    private final int modalDepth;
    private final int connectiveCount;
    private final int depth;

    private FormulaAnalysis(Set<Formula.Type> connectives, Set<String> atoms,
                            int modalDepth, int connectiveCount, int depth) {
        this.connectives = Collections.unmodifiableSet(connectives);
        this.atoms = Collections.unmodifiableSet(atoms);
        this.modalDepth = modalDepth;
        this.connectiveCount = connectiveCount;
        this.depth = depth;
    }

    /**
     * Analizza la formula con un'unica visita dell'albero per i connettivi.
     *
     * @param formula formula da analizzare (non null)
     * @return analisi immutabile
     */
    public static FormulaAnalysis of(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula da analizzare non può essere null");
        }

        Set<Formula.Type> connectives = EnumSet.noneOf(Formula.Type.class);
        collectConnectives(formula, connectives);

        return new FormulaAnalysis(connectives, formula.getAtoms(), formula.modalDepth(),
                formula.connectiveCount(), formula.depth());
    }

    private static void collectConnectives(Formula formula, Set<Formula.Type> connectives) {
        switch (formula.getType()) {
            case ATOM -> { /* foglia */ }
            case NOT, BOX, DIAMOND -> {
                connectives.add(formula.getType());
                collectConnectives(formula.getOperand(), connectives);
            }
            case AND, OR, IMPLIES -> {
                connectives.add(formula.getType());
                collectConnectives(formula.getLeft(), connectives);
                collectConnectives(formula.getRight(), connectives);
            }
        }
    }

    /** @return true se la formula contiene almeno un [] o un <> */
    public boolean isModal() {
        return connectives.contains(Formula.Type.BOX) || connectives.contains(Formula.Type.DIAMOND);
    }

    public boolean contains(Formula.Type type) {
        return connectives.contains(type);
    }

    public Set<Formula.Type> getConnectives() {
        return connectives;
    }

    public Set<String> getAtoms() {
        return atoms;
    }

    public int getModalDepth() {
        return modalDepth;
    }

    public int getConnectiveCount() {
        return connectiveCount;
    }

    public int getDepth() {
        return depth;
    }

    @Override
    public String toString() {
        String connectiveNames = connectives.stream()
                .map(Enum::name)
                .collect(Collectors.joining(", "));

        return "Tipo: " + (isModal() ? "modale" : "proposizionale") + "\n" +
                "Variabili: " + String.join(", ", atoms) + "\n" +
                "Connettivi: " + (connectiveNames.isEmpty() ? "nessuno" : connectiveNames) + "\n" +
                "Numero connettivi: " + connectiveCount + "\n" +
                "Profondità: " + depth + "\n" +
                "Profondità modale: " + modalDepth + "\n";
    }
}
