package org.modal.tableau;

import org.junit.Test;
import org.modal.formula.Formula;
import org.modal.formula.FormulaParser;
import org.modal.optionalfeatures.ModalChainProblem;
import org.modal.support.Branch;
import org.modal.support.SignedFormula;

import java.util.List;

import static org.junit.Assert.*;

public class TableauBuilderTest {

    private final TableauBuilder builder = new TableauBuilder();

    private TableauTree build(String text, boolean positive) {
        Formula formula = FormulaParser.parse(text);
        return builder.build(positive ? SignedFormula.trueAt(formula, 0) : SignedFormula.falseAt(formula, 0));
    }

    @Test
    public void contradictionClosesOnSingleNode() {
        TableauTree tree = build("p & ~p", true);

        assertTrue(tree.isClosed());
        assertTrue(tree.isComplete());
        assertEquals(1, tree.nodeCount());

        TableauNode root = tree.getRoot();
        assertEquals(TableauNode.Status.CLOSED, root.getStatus());
        assertEquals(List.of(SignedFormula.trueAt(Formula.atom("p"), 0), SignedFormula.falseAt(Formula.atom("p"), 0)),
                root.getClosingPair().orElseThrow());
        assertEquals(1, tree.getStatistics().getClosedBranches());
        assertFalse(tree.firstOpenBranch().isPresent());
    }

    @Test
    public void disjunctionProducesTwoOpenLeavesInOrder() {
        TableauTree tree = build("p | q", true);

        assertFalse(tree.isClosed());
        assertEquals(TableauNode.Status.SPLIT, tree.getRoot().getStatus());
        assertEquals(3, tree.nodeCount());

        List<TableauNode> leaves = tree.getLeaves();
        assertEquals(2, leaves.size());
        assertEquals(List.of(SignedFormula.trueAt(Formula.atom("p"), 0)), leaves.get(0).getEntries());
        assertEquals(List.of(SignedFormula.trueAt(Formula.atom("q"), 0)), leaves.get(1).getEntries());
        assertTrue(leaves.get(0).isOpen());
        assertEquals(1, leaves.get(0).getDepth());

        Branch first = tree.firstOpenBranch().orElseThrow();
        assertTrue(first.contains(SignedFormula.trueAt(Formula.atom("p"), 0)));
    }

    @Test
    public void mixedLeavesAreReportedSeparately() {
        TableauTree tree = build("(p | q) & ~p", true);

        assertEquals(2, tree.getLeaves().size());
        assertTrue(tree.getLeaves().get(0).isClosed());
        assertTrue(tree.getLeaves().get(1).isOpen());
        assertEquals(1, tree.getOpenLeaves().size());
        assertEquals(1, tree.getStatistics().getOpenBranches());
        assertEquals(1, tree.getStatistics().getClosedBranches());
    }

    @Test
    public void blockingKeepsRecursiveDemandsFinite() {
        TableauTree tree = build("[]<>p & <>p", true);

        assertTrue(tree.isComplete());
        assertFalse(tree.isClosed());
        assertEquals(1, tree.getStatistics().getWorldsCreated());
        assertEquals(1, tree.getStatistics().getWorldsReused());
    }

    @Test
    public void terminatesOnBoundedCorpus() {
        String[] corpus = {
                "p", "~p", "p & ~p", "p -> p", "[]p -> <>p", "<>p & []~p",
                "[](p -> q) -> ([]p -> []q)", "[]p -> p", "[]p -> [][]p", "p -> []<>p",
                "<>(p | q) -> (<>p | <>q)", "[]<>p & <>[]~p", "[]<>p & []<>~p & <>p",
                "[](p <-> <>p) & <>p", "<><>p & [][]~p | []<>q", "~[]p -> <>~p",
                "([]p | []q) -> [](p | q)", "<>p & <>q & [](~p | ~q)"
        };

        for (String text : corpus) {
            for (boolean positive : new boolean[]{true, false}) {
                TableauTree tree = build(text, positive);
                assertTrue(text, tree.isComplete());
                for (TableauNode leaf : tree.getLeaves()) {
                    assertTrue(text, leaf.isTerminal());
                }
            }
        }
    }

    @Test
    public void chainInstancesCloseWithOneWorldPerLevel() {
        for (int n = 1; n <= 6; n++) {
            TableauTree tree = builder.build(SignedFormula.trueAt(ModalChainProblem.buildInstance(n), 0));

            assertTrue("n=" + n, tree.isClosed());
            assertEquals("n=" + n, n, tree.getStatistics().getWorldsCreated());
        }
    }

    @Test(expected = InternalLoopFault.class)
    public void iterationCeilingRaisesFault() {
        TableauBuilder bounded = new TableauBuilder(TableauConfiguration.defaults().withMaxIterations(1));
        bounded.build(SignedFormula.trueAt(FormulaParser.parse("p & q"), 0));
    }

    @Test
    public void faultCarriesBranchCounters() {
        TableauBuilder bounded = new TableauBuilder(TableauConfiguration.defaults().withMaxWorlds(2));
        try {
            bounded.build(SignedFormula.trueAt(FormulaParser.parse("<>p & <>q"), 0));
            fail("Atteso InternalLoopFault");
        } catch (InternalLoopFault fault) {
            assertEquals(2, fault.getWorldCount());
        }
    }

    @Test
    public void statisticsTimerIsStopped() {
        TableauTree tree = build("[]p -> <>p", false);
        assertTrue(tree.getStatistics().isTimerStopped());
        assertTrue(tree.getStatistics().getTotalApplications() > 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidConfigurationIsRejected() {
        new TableauConfiguration(0, 10);
    }
}
