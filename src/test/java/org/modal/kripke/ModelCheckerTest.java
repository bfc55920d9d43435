package org.modal.kripke;

import org.junit.Before;
import org.junit.Test;
import org.modal.formula.FormulaParser;
import org.modal.support.AccessibilityEdge;
import org.modal.support.SignedFormula;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ModelCheckerTest {

    private KripkeModel model;

    /**
     * w0 -> w1, w0 -> w2, w2 -> w2; p vera in w1 e w2, q vera solo in w2.
     */
    @Before
    public void setUp() {
        model = new KripkeModel(
                List.of(0, 1, 2),
                List.of(new AccessibilityEdge(0, 1), new AccessibilityEdge(0, 2), new AccessibilityEdge(2, 2)),
                Map.of(1, Map.of("p", true, "q", false), 2, Map.of("p", true, "q", true)),
                List.of("p", "q"));
    }

    private boolean holds(String text, int world) {
        return ModelChecker.isTrue(model, FormulaParser.parse(text), world);
    }

    @Test
    public void atomsFollowValuation() {
        assertFalse(holds("p", 0));
        assertTrue(holds("p", 1));
        assertTrue(holds("p & q", 2));
        assertTrue(holds("p -> q", 0));
        assertFalse(holds("p -> q", 1));
    }

    @Test
    public void boxQuantifiesOverAllSuccessors() {
        assertTrue(holds("[]p", 0));
        assertFalse(holds("[]q", 0));
        assertTrue(holds("[]q", 2));
    }

    @Test
    public void boxIsVacuouslyTrueWithoutSuccessors() {
        assertTrue(holds("[]p", 1));
        assertTrue(holds("[](p & ~p)", 1));
        assertFalse(holds("<>p", 1));
    }

    @Test
    public void diamondNeedsOneSuccessor() {
        assertTrue(holds("<>q", 0));
        assertTrue(holds("<>~q", 0));
        assertTrue(holds("<><>q", 0));
        assertTrue(holds("[]<>q", 2));
        assertFalse(holds("[]<>q", 0));
    }

    @Test
    public void signedFormulasCompareWithSign() {
        SignedFormula positive = SignedFormula.trueAt(FormulaParser.parse("[]p"), 0);
        SignedFormula negative = SignedFormula.falseAt(FormulaParser.parse("[]q"), 0);

        assertTrue(ModelChecker.satisfies(model, positive));
        assertTrue(ModelChecker.satisfies(model, negative));
        assertFalse(ModelChecker.satisfies(model, positive.conjugate()));
        assertTrue(ModelChecker.satisfiesAll(model, List.of(positive, negative)));
        assertFalse(ModelChecker.satisfiesAll(model, List.of(positive, negative.conjugate())));
    }

    @Test
    public void modelExposesStructure() {
        assertTrue(model.isAccessible(0, 2));
        assertFalse(model.isAccessible(1, 0));
        assertEquals(3, model.getEdges().size());
        assertTrue(model.isConstrained(1, "q"));
        assertFalse(model.isConstrained(0, "p"));
        assertEquals(List.of("p", "q"), List.copyOf(model.trueAtomsAt(2)));
        assertTrue(model.toString().contains("(libera)"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void edgeToUnknownWorldIsRejected() {
        new KripkeModel(List.of(0), List.of(new AccessibilityEdge(0, 1)), Map.of(), List.of());
    }

    @Test(expected = IllegalArgumentException.class)
    public void undeclaredAtomIsRejected() {
        new KripkeModel(List.of(0), List.of(), Map.of(0, Map.of("r", true)), List.of("p"));
    }
}
