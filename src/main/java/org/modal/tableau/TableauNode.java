package org.modal.tableau;

import org.modal.support.Branch;
import org.modal.support.SignedFormula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Nodo dell'albero tableau: un segmento di ramo sviluppato senza divisioni.
 *
 * Registra le formule di testa (la radice o l'alternativa β che ha generato il nodo) e le
 * regole applicate mentre il segmento veniva sviluppato. I figli nascono solo da regole β.
 * Le foglie terminano CLOSED (con la coppia di chiusura) o SATURATED_OPEN (con il ramo finale).
 */
public class TableauNode {

    public enum Status {
        BUILDING,
        SPLIT,
        CLOSED,
        SATURATED_OPEN
    }

    private final int id;
    private final TableauNode parent;
    private final int depth;
    private final List<SignedFormula> entries = new ArrayList<>();
    private final List<RuleApplication> applications = new ArrayList<>();
    private final List<TableauNode> children = new ArrayList<>();

    private Status status = Status.BUILDING;
    private RuleApplication splitApplication;
    private Branch finalBranch;

    TableauNode(int id, TableauNode parent, SignedFormula head) {
        this.id = id;
        this.parent = parent;
        this.depth = parent == null ? 0 : parent.depth + 1;
        this.entries.add(head);
    }

    //region COSTRUZIONE (package-private, usata dal builder)

    void recordApplication(RuleApplication application) {
        requireBuilding();
        applications.add(application);
    }

    TableauNode addChild(int childId, SignedFormula alternative) {
        TableauNode child = new TableauNode(childId, this, alternative);
        children.add(child);
        return child;
    }

    void markSplit(RuleApplication application) {
        requireBuilding();
        this.splitApplication = application;
        this.status = Status.SPLIT;
    }

    void close(Branch branch) {
        requireBuilding();
        this.finalBranch = branch;
        this.status = Status.CLOSED;
    }

    void saturate(Branch branch) {
        requireBuilding();
        this.finalBranch = branch;
        this.status = Status.SATURATED_OPEN;
    }

    private void requireBuilding() {
        if (status != Status.BUILDING) {
            throw new IllegalStateException("Nodo n" + id + " già terminato con stato " + status);
        }
    }

    //endregion

    //region INTERROGAZIONE

    public int getId() {
        return id;
    }

    public Optional<TableauNode> getParent() {
        return Optional.ofNullable(parent);
    }

    public int getDepth() {
        return depth;
    }

    public List<SignedFormula> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<RuleApplication> getApplications() {
        return Collections.unmodifiableList(applications);
    }

    public List<TableauNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public Status getStatus() {
        return status;
    }

    /** @return regola β che ha diviso il nodo, vuota per le foglie */
    public Optional<RuleApplication> getSplitApplication() {
        return Optional.ofNullable(splitApplication);
    }

    /** @return ramo completo alla foglia, vuoto per i nodi interni */
    public Optional<Branch> getFinalBranch() {
        return Optional.ofNullable(finalBranch);
    }

    public Optional<List<SignedFormula>> getClosingPair() {
        return status == Status.CLOSED ? finalBranch.getClosingPair() : Optional.empty();
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean isTerminal() {
        return status == Status.CLOSED || status == Status.SATURATED_OPEN;
    }

    public boolean isClosed() {
        return status == Status.CLOSED;
    }

    public boolean isOpen() {
        return status == Status.SATURATED_OPEN;
    }

    //endregion

    @Override
    public String toString() {
        return "n" + id + "[" + status + ", " + entries.size() + " formule, " + applications.size() + " regole]";
    }
}
