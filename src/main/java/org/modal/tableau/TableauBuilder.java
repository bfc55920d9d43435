package org.modal.tableau;

import org.modal.support.Branch;
import org.modal.support.SignedFormula;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * COSTRUTTORE TABLEAU - Sviluppo completo dell'albero a partire da una formula segnata
 *
 * PROCEDURA:
 * 1. Crea il ramo radice con la sola formula segnata iniziale
 * 2. Sviluppa i rami in profondità, prima alternativa β per prima
 * 3. Ogni ramo termina chiuso (coppia complementare) o aperto e saturo
 * 4. Il limite di iterazioni per ramo interrompe la costruzione con {@link InternalLoopFault}
 *
 * Il costruttore non ha stato proprio tra una chiamata e l'altra: ogni {@link #build}
 * crea motore, statistiche e rami nuovi.
 */
public class TableauBuilder {

    private static final Logger LOGGER = Logger.getLogger(TableauBuilder.class.getName());

    private final TableauConfiguration configuration;

    public TableauBuilder() {
        this(TableauConfiguration.defaults());
    }

    public TableauBuilder(TableauConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("Configurazione non può essere null");
        }
        this.configuration = configuration;
    }

    /**
     * Costruisce l'albero completo per la formula segnata radice.
     *
     * @param rootFormula formula radice, tipicamente (φ, F, 0) o (φ, T, 0)
     * @return albero completo (tutte le foglie terminali)
     * @throws InternalLoopFault se un ramo supera i limiti di sicurezza
     */
    public TableauTree build(SignedFormula rootFormula) {
        if (rootFormula == null) {
            throw new IllegalArgumentException("Formula radice non può essere null");
        }

        LOGGER.fine("Costruzione tableau per " + rootFormula);

        TableauStatistics statistics = new TableauStatistics();
        ExpansionEngine engine = new ExpansionEngine(configuration, statistics);

        TableauNode rootNode = new TableauNode(0, null, rootFormula);
        Deque<PendingBranch> pending = new ArrayDeque<>();
        pending.push(new PendingBranch(rootNode, new Branch(rootFormula)));
        int nextNodeId = 1;

        try {
            while (!pending.isEmpty()) {
                PendingBranch current = pending.pop();
                List<Branch> children = develop(current, engine, statistics);
                if (children.isEmpty()) {
                    continue;
                }

                // Push in ordine inverso: la prima alternativa viene sviluppata per prima
                PendingBranch[] childBranches = new PendingBranch[children.size()];
                for (int i = 0; i < children.size(); i++) {
                    Branch childBranch = children.get(i);
                    SignedFormula alternative = current.node().getSplitApplication()
                            .orElseThrow(IllegalStateException::new)
                            .produced().get(i);
                    childBranches[i] = new PendingBranch(current.node().addChild(nextNodeId++, alternative), childBranch);
                }
                for (int i = childBranches.length - 1; i >= 0; i--) {
                    pending.push(childBranches[i]);
                }
            }
        } catch (InternalLoopFault fault) {
            LOGGER.severe("Guasto interno durante la costruzione del tableau per " + rootFormula + ": " + fault.getMessage());
            throw fault;
        } finally {
            statistics.stopTimer();
        }

        TableauTree tree = new TableauTree(rootFormula, rootNode, statistics);
        LOGGER.fine(() -> "Tableau completato: " + tree + " - " + statistics.toCompactString());
        return tree;
    }

    /**
     * Sviluppa un ramo fino alla chiusura, alla saturazione o a una divisione β.
     *
     * @return rami figli se il ramo è stato diviso, lista vuota se il ramo è terminato
     */
    private List<Branch> develop(PendingBranch pendingBranch, ExpansionEngine engine, TableauStatistics statistics) {
        TableauNode node = pendingBranch.node();
        Branch branch = pendingBranch.branch();

        while (true) {
            if (branch.isClosed()) {
                node.close(branch);
                statistics.incrementClosedBranches();
                LOGGER.finer(() -> "Ramo chiuso al nodo n" + node.getId() + ": " + branch.getClosingPair().orElseThrow());
                return List.of();
            }

            if (branch.getAppliedSteps() >= configuration.getMaxIterations()) {
                throw new InternalLoopFault("Superato il limite di " + configuration.getMaxIterations() + " iterazioni per ramo",
                        branch.getAppliedSteps(), branch.worldCount());
            }

            ExpansionStep step = engine.expand(branch);
            if (!step.isApplied()) {
                node.saturate(branch);
                statistics.incrementOpenBranches();
                LOGGER.finer(() -> "Ramo aperto e saturo al nodo n" + node.getId());
                return List.of();
            }

            if (step.isSplit()) {
                node.markSplit(step.getApplication());
                return step.getChildren();
            }

            node.recordApplication(step.getApplication());
        }
    }

    public TableauConfiguration getConfiguration() {
        return configuration;
    }

    private record PendingBranch(TableauNode node, Branch branch) {
    }
}
