package org.modal.tableau;

import org.modal.support.Branch;

import java.util.List;

/**
 * Esito di un passo del motore di espansione.
 *
 * Tre forme possibili:
 * • nessuna regola applicabile (ramo chiuso o saturo)
 * • regola lineare (α, ∀, ∃): il ramo è stato esteso sul posto
 * • regola β: il ramo è stato diviso in due rami figli, ciascuno con un'alternativa
 */
public final class ExpansionStep {

    private static final ExpansionStep NONE = new ExpansionStep(null, List.of());

    private final RuleApplication application;
    private final List<Branch> children;

    private ExpansionStep(RuleApplication application, List<Branch> children) {
        this.application = application;
        this.children = children;
    }

    public static ExpansionStep none() {
        return NONE;
    }

    public static ExpansionStep linear(RuleApplication application) {
        return new ExpansionStep(application, List.of());
    }

    public static ExpansionStep split(RuleApplication application, List<Branch> children) {
        if (children == null || children.size() < 2) {
            throw new IllegalArgumentException("Una regola β produce almeno due rami figli");
        }
        return new ExpansionStep(application, List.copyOf(children));
    }

    /** @return false se nessuna regola era applicabile */
    public boolean isApplied() {
        return application != null;
    }

    public boolean isSplit() {
        return !children.isEmpty();
    }

    public RuleApplication getApplication() {
        return application;
    }

    public List<Branch> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        return isApplied() ? application.toString() : "nessuna regola applicabile";
    }
}
