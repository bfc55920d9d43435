package org.modal.support;

import org.junit.Test;
import org.modal.formula.Formula;

import java.util.List;
import java.util.Optional;

import static org.junit.Assert.*;

public class BranchTest {

    private static final Formula P = Formula.atom("p");
    private static final Formula Q = Formula.atom("q");

    @Test
    public void newBranchContainsOnlyTheRoot() {
        Branch branch = new Branch(SignedFormula.trueAt(P, 0));

        assertEquals(1, branch.size());
        assertEquals(1, branch.worldCount());
        assertTrue(branch.contains(SignedFormula.trueAt(P, 0)));
        assertFalse(branch.isClosed());
        assertTrue(branch.getEdges().isEmpty());
    }

    @Test
    public void duplicatesAreNotAdded() {
        Branch branch = new Branch(SignedFormula.trueAt(P, 0));

        assertFalse(branch.add(SignedFormula.trueAt(P, 0)));
        assertTrue(branch.add(SignedFormula.trueAt(Q, 0)));
        assertEquals(2, branch.size());
        assertEquals(List.of(SignedFormula.trueAt(P, 0), SignedFormula.trueAt(Q, 0)), branch.getFormulas());
    }

    @Test
    public void complementaryPairClosesTheBranch() {
        Branch branch = new Branch(SignedFormula.falseAt(P, 0));
        branch.add(SignedFormula.trueAt(P, 0));

        assertTrue(branch.isClosed());
        Optional<List<SignedFormula>> pair = branch.getClosingPair();
        assertTrue(pair.isPresent());
        assertEquals(List.of(SignedFormula.trueAt(P, 0), SignedFormula.falseAt(P, 0)), pair.get());
    }

    @Test
    public void nearMatchesDoNotClose() {
        Branch branch = new Branch(SignedFormula.trueAt(P, 0));
        int world = branch.createWorld(0);

        branch.add(SignedFormula.falseAt(P, world));           // stesso atomo, mondo diverso
        branch.add(SignedFormula.falseAt(Q, 0));               // atomo diverso
        branch.add(SignedFormula.trueAt(Formula.not(P), 0));   // chiusura solo sintattica

        assertFalse(branch.isClosed());
        assertFalse(branch.getClosingPair().isPresent());
    }

    @Test(expected = IllegalArgumentException.class)
    public void formulaInUnknownWorldIsRejected() {
        Branch branch = new Branch(SignedFormula.trueAt(P, 0));
        branch.add(SignedFormula.trueAt(Q, 3));
    }

    @Test
    public void worldsAndEdges() {
        Branch branch = new Branch(SignedFormula.trueAt(P, 0));

        assertEquals(1, branch.createWorld(0));
        assertEquals(2, branch.createWorld(0));
        assertFalse(branch.addEdge(0, 1));
        assertTrue(branch.addEdge(2, 2));

        assertEquals(List.of(1, 2), List.copyOf(branch.successorsOf(0)));
        assertTrue(branch.successorsOf(1).isEmpty());
        assertEquals(List.of(new AccessibilityEdge(0, 1), new AccessibilityEdge(0, 2), new AccessibilityEdge(2, 2)),
                branch.getEdges());
    }

    @Test
    public void copyIsIndependentOfOriginal() {
        Branch original = new Branch(SignedFormula.trueAt(P, 0));
        original.markExpanded(SignedFormula.trueAt(P, 0));
        original.incrementAppliedSteps();

        Branch copy = new Branch(original);
        int world = copy.createWorld(0);
        copy.add(SignedFormula.trueAt(Q, world));
        copy.add(SignedFormula.falseAt(P, 0));

        assertTrue(copy.isClosed());
        assertTrue(copy.isExpanded(SignedFormula.trueAt(P, 0)));
        assertEquals(1, copy.getAppliedSteps());

        assertFalse(original.isClosed());
        assertEquals(1, original.size());
        assertEquals(1, original.worldCount());
        assertTrue(original.getEdges().isEmpty());
    }

    @Test
    public void blockingMarksExistentialFulfilled() {
        Branch branch = new Branch(SignedFormula.trueAt(Formula.diamond(P), 0));
        SignedFormula existential = SignedFormula.trueAt(Formula.diamond(P), 0);

        branch.recordBlocking(existential, 0);

        assertTrue(branch.isFulfilled(existential));
        assertEquals(Integer.valueOf(0), branch.getLoopGuardRecord().get(existential));
    }

    @Test
    public void signedFormulaHelpers() {
        SignedFormula signedFormula = SignedFormula.trueAt(P, 2);

        assertEquals(SignedFormula.falseAt(P, 2), signedFormula.conjugate());
        assertEquals(SignedFormula.trueAt(P, 5), signedFormula.atWorld(5));
        assertEquals("w2 T p", signedFormula.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeWorldIsRejected() {
        SignedFormula.trueAt(P, -1);
    }
}
