package org.modal.verdict;

import org.modal.kripke.KripkeModel;
import org.modal.tableau.TableauStatistics;
import org.modal.tableau.TableauTree;

import java.util.Objects;
import java.util.Optional;

/**
 * RISULTATO VERIFICA - Contenitore immutabile per l'esito di una verifica tableau
 *
 * COMPONENTI:
 * • kind: validità o soddisfacibilità
 * • verdict: esito, coerente con kind
 * • tree: albero tableau completo
 * • model: contromodello (INVALID) o modello testimone (SATISFIABLE), assente altrimenti
 * • statistics: metriche della costruzione
 */
public class CheckResult {

    private final CheckKind kind;
    private final Verdict verdict;
    private final TableauTree tree;
    private final KripkeModel model;

    private CheckResult(CheckKind kind, Verdict verdict, TableauTree tree, KripkeModel model) {
        if (kind == null || verdict == null || tree == null) {
            throw new IllegalArgumentException("Tipo, esito e albero non possono essere null");
        }
        if (verdict != kind.closedVerdict() && verdict != kind.openVerdict()) {
            throw new IllegalArgumentException("Esito " + verdict + " incoerente con la verifica " + kind);
        }
        if ((verdict == kind.openVerdict()) != (model != null)) {
            throw new IllegalArgumentException("Il modello è richiesto se e solo se un ramo resta aperto");
        }

        this.kind = kind;
        this.verdict = verdict;
        this.tree = tree;
        this.model = model;
    }

    //region FACTORY METHODS

    /**
     * Esito con tutti i rami chiusi (VALID o UNSATISFIABLE).
     */
    public static CheckResult closed(CheckKind kind, TableauTree tree) {
        return new CheckResult(kind, kind.closedVerdict(), tree, null);
    }

    /**
     * Esito con un ramo aperto (INVALID o SATISFIABLE) e il modello estratto.
     */
    public static CheckResult open(CheckKind kind, TableauTree tree, KripkeModel model) {
        if (model == null) {
            throw new IllegalArgumentException("Un esito aperto richiede un modello");
        }
        return new CheckResult(kind, kind.openVerdict(), tree, model);
    }

    //endregion

    public CheckKind getKind() {
        return kind;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public TableauTree getTree() {
        return tree;
    }

    public Optional<KripkeModel> getModel() {
        return Optional.ofNullable(model);
    }

    public TableauStatistics getStatistics() {
        return tree.getStatistics();
    }

    public boolean isClosed() {
        return verdict == kind.closedVerdict();
    }

    public String toCompactString() {
        return kind + ": " + verdict + " (" + getStatistics().toCompactString() + ")";
    }

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append("=== ").append(kind.getTitle()).append(" ===\n");
        output.append("Esito: ").append(verdict).append(" (").append(verdict.getDescription()).append(")\n");

        if (model != null) {
            output.append(kind == CheckKind.VALIDITY ? "Contromodello:\n" : "Modello testimone:\n");
            output.append(model);
        }

        output.append(getStatistics());
        return output.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CheckResult other)) return false;
        return kind == other.kind && verdict == other.verdict && tree == other.tree;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, verdict, System.identityHashCode(tree));
    }
}
