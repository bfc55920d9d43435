package org.modal.tableau;

import org.junit.Test;
import org.modal.formula.FormulaParser;
import org.modal.support.SignedFormula;

import static org.junit.Assert.*;

public class TableauPrinterTest {

    private final TableauPrinter printer = new TableauPrinter();
    private final TableauBuilder builder = new TableauBuilder();

    @Test
    public void closedTreeShowsClosingPair() {
        TableauTree tree = builder.build(SignedFormula.trueAt(FormulaParser.parse("p & ~p"), 0));
        String text = printer.print(tree, "VERIFICA");

        assertTrue(text.startsWith("=== VERIFICA ==="));
        assertTrue(text.contains("[n0] w0 T (p & ~p)"));
        assertTrue(text.contains("✗ CHIUSO: w0 T p  /  w0 F p"));
        assertTrue(text.contains("tutti i rami chiusi"));
    }

    @Test
    public void splitTreeShowsBothBranches() {
        TableauTree tree = builder.build(SignedFormula.trueAt(FormulaParser.parse("p | q"), 0));
        String text = printer.print(tree, null);

        assertTrue(text.contains("[β] w0 T (p | q)"));
        assertTrue(text.contains("[n1] w0 T p"));
        assertTrue(text.contains("[n2] w0 T q"));
        assertTrue(text.contains("○ APERTO"));
        assertTrue(text.contains("almeno un ramo aperto"));
    }

    @Test
    public void modalRulesShowWorlds() {
        TableauTree tree = builder.build(SignedFormula.trueAt(FormulaParser.parse("[]<>p & <>p"), 0));
        String text = printer.print(tree, "MODALE");

        assertTrue(text.contains("nuovo mondo w1"));
        assertTrue(text.contains("riusato (blocking)"));
    }
}
