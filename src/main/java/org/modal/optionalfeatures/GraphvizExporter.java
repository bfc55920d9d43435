package org.modal.optionalfeatures;

import guru.nidi.graphviz.attribute.Attributes;
import guru.nidi.graphviz.attribute.Label;
import guru.nidi.graphviz.engine.Format;
import guru.nidi.graphviz.engine.Graphviz;
import guru.nidi.graphviz.engine.GraphvizException;
import guru.nidi.graphviz.model.MutableGraph;
import guru.nidi.graphviz.model.MutableNode;
import org.modal.kripke.KripkeModel;
import org.modal.support.AccessibilityEdge;
import org.modal.support.SignedFormula;
import org.modal.tableau.RuleApplication;
import org.modal.tableau.TableauNode;
import org.modal.tableau.TableauTree;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import static guru.nidi.graphviz.model.Factory.mutGraph;
import static guru.nidi.graphviz.model.Factory.mutNode;
import static guru.nidi.graphviz.model.Factory.to;

/**
 * ESPORTAZIONE GRAPHVIZ - Grafi DOT/PNG di alberi tableau e modelli di Kripke
 *
 * • Tableau: un nodo rettangolare per segmento di ramo, archi etichettati con
 *   l'alternativa β; foglie chiuse in rosso, foglie aperte in verde
 * • Modello: un nodo per mondo con gli atomi veri, un arco per coppia accessibile
 *
 * Il testo DOT non richiede alcun motore esterno. Il PNG richiede un motore Graphviz
 * disponibile: in sua assenza il rendering viene saltato con un avviso.
 */
public class GraphvizExporter {

    private static final Logger LOGGER = Logger.getLogger(GraphvizExporter.class.getName());

    //region COSTRUZIONE GRAFI

    public MutableGraph tableauGraph(TableauTree tree, String name) {
        if (tree == null) {
            throw new IllegalArgumentException("Albero non può essere null");
        }

        MutableGraph graph = mutGraph(name == null ? "tableau" : name).setDirected(true);
        addTableauNode(graph, tree.getRoot());
        return graph;
    }

    private MutableNode addTableauNode(MutableGraph graph, TableauNode node) {
        List<String> lines = new ArrayList<>();
        node.getEntries().forEach(entry -> lines.add(entry.toString()));
        for (RuleApplication application : node.getApplications()) {
            application.produced().forEach(produced -> lines.add(produced.toString()));
            if (application.reusedWorld()) {
                lines.add("w" + application.source().world() + " -> w" + application.targetWorld() + " (blocking)");
            }
        }

        switch (node.getStatus()) {
            case CLOSED -> {
                List<SignedFormula> pair = node.getClosingPair().orElseThrow();
                lines.add("✗ " + pair.get(0) + " / " + pair.get(1));
            }
            case SATURATED_OPEN -> lines.add("○ aperto");
            default -> { /* nodo interno */ }
        }

        MutableNode graphNode = mutNode("n" + node.getId())
                .add(Label.lines(lines.toArray(new String[0])))
                .add(Attributes.attr("shape", "rectangle"));
        if (node.isClosed()) {
            graphNode.add(Attributes.attr("color", "red"));
        } else if (node.isOpen()) {
            graphNode.add(Attributes.attr("color", "darkgreen"));
        }
        graph.add(graphNode);

        List<TableauNode> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            MutableNode child = addTableauNode(graph, children.get(i));
            graphNode.addLink(to(child).with(Label.of("β" + (i + 1))));
        }
        return graphNode;
    }

    public MutableGraph modelGraph(KripkeModel model, String name) {
        if (model == null) {
            throw new IllegalArgumentException("Modello non può essere null");
        }

        MutableGraph graph = mutGraph(name == null ? "modello" : name).setDirected(true);
        graph.graphAttrs().add(Attributes.attr("rankdir", "LR"));

        Map<Integer, MutableNode> nodes = new TreeMap<>();
        for (int world : model.getWorlds()) {
            String trueAtoms = String.join(", ", model.trueAtomsAt(world));
            MutableNode worldNode = mutNode("w" + world)
                    .add(Label.lines("w" + world, trueAtoms.isEmpty() ? "∅" : trueAtoms))
                    .add(Attributes.attr("shape", "circle"));
            nodes.put(world, worldNode);
            graph.add(worldNode);
        }

        for (AccessibilityEdge edge : model.getEdges()) {
            nodes.get(edge.from()).addLink(to(nodes.get(edge.to())));
        }
        return graph;
    }

    //endregion

    //region SCRITTURA

    public String toDot(MutableGraph graph) {
        return graph.toString();
    }

    public void writeDot(MutableGraph graph, Path file) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        try (FileWriter writer = new FileWriter(file.toFile())) {
            writer.write(toDot(graph));
        }
        LOGGER.fine("File DOT salvato: " + file);
    }

    /**
     * Renderizza il grafo in PNG.
     *
     * @return true se il file è stato scritto, false se nessun motore Graphviz è disponibile
     */
    public boolean renderPng(MutableGraph graph, Path file) {
        try {
            Graphviz.fromGraph(graph).render(Format.PNG).toFile(file.toFile());
            LOGGER.fine("File PNG salvato: " + file);
            return true;
        } catch (GraphvizException | IOException e) {
            LOGGER.log(Level.WARNING, "Rendering PNG non disponibile per " + file.getFileName(), e);
            return false;
        }
    }

    //endregion
}
