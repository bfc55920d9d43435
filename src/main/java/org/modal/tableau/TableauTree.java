package org.modal.tableau;

import org.modal.support.Branch;
import org.modal.support.SignedFormula;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Albero tableau completo per una formula segnata radice.
 *
 * L'albero è chiuso se tutte le foglie sono chiuse; è completo se tutte le foglie sono
 * terminali. Le foglie sono restituite nell'ordine di esplorazione (prima alternativa prima).
 */
public class TableauTree {

    private final SignedFormula rootFormula;
    private final TableauNode root;
    private final TableauStatistics statistics;

    TableauTree(SignedFormula rootFormula, TableauNode root, TableauStatistics statistics) {
        this.rootFormula = rootFormula;
        this.root = root;
        this.statistics = statistics;
    }

    public SignedFormula getRootFormula() {
        return rootFormula;
    }

    public TableauNode getRoot() {
        return root;
    }

    public TableauStatistics getStatistics() {
        return statistics;
    }

    /**
     * @return tutti i nodi in pre-ordine
     */
    public List<TableauNode> getNodes() {
        List<TableauNode> nodes = new ArrayList<>();
        Deque<TableauNode> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            TableauNode node = stack.pop();
            nodes.add(node);
            List<TableauNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return nodes;
    }

    public List<TableauNode> getLeaves() {
        return getNodes().stream().filter(TableauNode::isLeaf).collect(Collectors.toList());
    }

    public List<TableauNode> getOpenLeaves() {
        return getLeaves().stream().filter(TableauNode::isOpen).collect(Collectors.toList());
    }

    public boolean isClosed() {
        return getLeaves().stream().allMatch(TableauNode::isClosed);
    }

    public boolean isComplete() {
        return getLeaves().stream().allMatch(TableauNode::isTerminal);
    }

    /**
     * @return ramo saturo della prima foglia aperta in ordine di esplorazione
     */
    public Optional<Branch> firstOpenBranch() {
        return getOpenLeaves().stream()
                .findFirst()
                .flatMap(TableauNode::getFinalBranch);
    }

    public int nodeCount() {
        return getNodes().size();
    }

    @Override
    public String toString() {
        return "TableauTree{radice=" + rootFormula + ", nodi=" + nodeCount() +
                ", foglie=" + getLeaves().size() + ", " + (isClosed() ? "chiuso" : "aperto") + "}";
    }
}
