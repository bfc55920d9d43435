package org.modal.formula;

import org.junit.Test;

import java.util.Set;

import static org.junit.Assert.*;

public class FormulaTest {

    @Test
    public void structuralEquality() {
        Formula first = Formula.box(Formula.and(Formula.atom("p"), Formula.atom("q")));
        Formula second = Formula.box(Formula.and(Formula.atom("p"), Formula.atom("q")));
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, Formula.diamond(Formula.and(Formula.atom("p"), Formula.atom("q"))));
    }

    @Test
    public void metrics() {
        Formula formula = FormulaParser.parse("[](p -> <>q) & r");
        assertEquals(Set.of("p", "q", "r"), formula.getAtoms());
        assertEquals(2, formula.modalDepth());
        assertEquals(4, formula.connectiveCount());
        assertEquals(7, formula.size());
        assertEquals(4, formula.depth());
    }

    @Test
    public void printing() {
        assertEquals("([]p -> <>p)", FormulaParser.parse("[]p -> <>p").toString());
        assertEquals("~(p | q)", FormulaParser.parse("~(p | q)").toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidAtomNameIsRejected() {
        Formula.atom("Pq");
    }

    @Test(expected = IllegalStateException.class)
    public void operandOfBinaryNodeIsUnavailable() {
        Formula.and(Formula.atom("p"), Formula.atom("q")).getOperand();
    }
}
