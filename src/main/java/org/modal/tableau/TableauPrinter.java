package org.modal.tableau;

import org.modal.support.SignedFormula;

import java.util.List;
import java.util.stream.Collectors;

/**
 * STAMPA TABLEAU - Rappresentazione testuale indentata di un {@link TableauTree}
 *
 * FORMATO OUTPUT:
 * [n0] w0 F ([]p -> <>p)
 *      [α] w0 F ([]p -> <>p)  =>  w0 T []p, w0 F <>p
 *      ...
 *      ○ APERTO (saturo)
 *
 * Ogni divisione β apre un livello di indentazione per ciascun ramo figlio; le foglie
 * chiuse riportano la coppia complementare che le chiude.
 */
public class TableauPrinter {

    private static final String INDENT = "    ";

    /**
     * @param tree albero da stampare
     * @param title intestazione (es. "VERIFICA DI VALIDITÀ")
     * @return testo completo con intestazione, albero ed esito
     */
    public String print(TableauTree tree, String title) {
        if (tree == null) {
            throw new IllegalArgumentException("Albero non può essere null");
        }

        StringBuilder output = new StringBuilder();
        output.append("=== ").append(title == null ? "TABLEAU" : title).append(" ===\n");
        output.append("Radice: ").append(tree.getRootFormula()).append("\n\n");

        printNode(tree.getRoot(), "", output);

        output.append("\n");
        output.append("Esito: ").append(tree.isClosed() ? "tutti i rami chiusi" : "almeno un ramo aperto").append("\n");
        output.append("Nodi: ").append(tree.nodeCount())
                .append(", foglie: ").append(tree.getLeaves().size())
                .append(", aperte: ").append(tree.getOpenLeaves().size()).append("\n");
        return output.toString();
    }

    private void printNode(TableauNode node, String indent, StringBuilder output) {
        String heads = node.getEntries().stream()
                .map(SignedFormula::toString)
                .collect(Collectors.joining(", "));
        output.append(indent).append("[n").append(node.getId()).append("] ").append(heads).append("\n");

        String body = indent + INDENT;
        for (RuleApplication application : node.getApplications()) {
            output.append(body).append(application).append("\n");
        }

        switch (node.getStatus()) {
            case SPLIT -> {
                output.append(body).append(node.getSplitApplication().orElseThrow()).append("\n");
                for (TableauNode child : node.getChildren()) {
                    printNode(child, body, output);
                }
            }
            case CLOSED -> {
                List<SignedFormula> pair = node.getClosingPair().orElseThrow();
                output.append(body).append("✗ CHIUSO: ").append(pair.get(0)).append("  /  ").append(pair.get(1)).append("\n");
            }
            case SATURATED_OPEN -> {
                int worlds = node.getFinalBranch().orElseThrow().worldCount();
                output.append(body).append("○ APERTO (saturo, ").append(worlds).append(worlds == 1 ? " mondo" : " mondi").append(")\n");
            }
            case BUILDING -> output.append(body).append("… in costruzione\n");
        }
    }
}
