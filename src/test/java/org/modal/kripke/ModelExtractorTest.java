package org.modal.kripke;

import org.junit.Test;
import org.modal.formula.Formula;
import org.modal.formula.FormulaParser;
import org.modal.support.Branch;
import org.modal.support.SignedFormula;
import org.modal.tableau.TableauBuilder;
import org.modal.tableau.TableauNode;
import org.modal.tableau.TableauTree;

import static org.junit.Assert.*;

public class ModelExtractorTest {

    private final TableauBuilder builder = new TableauBuilder();
    private final ModelExtractor extractor = new ModelExtractor();

    private Branch openBranch(String text, boolean positive) {
        Formula formula = FormulaParser.parse(text);
        TableauTree tree = builder.build(positive ? SignedFormula.trueAt(formula, 0) : SignedFormula.falseAt(formula, 0));
        return tree.firstOpenBranch().orElseThrow();
    }

    @Test
    public void countermodelOfSeriality() {
        Branch branch = openBranch("[]p -> <>p", false);
        KripkeModel model = extractor.extract(branch);

        assertEquals(1, model.getWorlds().size());
        assertTrue(model.getEdges().isEmpty());
        assertTrue(model.getAtoms().contains("p"));
        assertFalse(model.isConstrained(0, "p"));
        assertFalse(ModelChecker.isTrue(model, FormulaParser.parse("[]p -> <>p"), 0));
    }

    @Test
    public void witnessForDiamondHasSuccessor() {
        Branch branch = openBranch("<>p & []q", true);
        KripkeModel model = extractor.extract(branch);

        assertEquals(2, model.getWorlds().size());
        assertTrue(model.isAccessible(0, 1));
        assertTrue(model.valueOf(1, "p"));
        assertTrue(model.valueOf(1, "q"));
        assertTrue(ModelChecker.satisfiesAll(model, branch.getFormulas()));
    }

    @Test
    public void blockingEdgeIsKept() {
        Branch branch = openBranch("[]<>p & <>p", true);
        KripkeModel model = extractor.extract(branch);

        assertTrue(model.isAccessible(1, 1));
        assertTrue(ModelChecker.satisfiesAll(model, branch.getFormulas()));
    }

    @Test
    public void everyOpenLeafYieldsAModel() {
        String[] corpus = {"p | q", "<>p & <>~p", "[](p | q) & <>~p", "~([]p -> [][]p)", "<>(p & <>q) & []~q"};
        for (String text : corpus) {
            Formula formula = FormulaParser.parse(text);
            TableauTree tree = builder.build(SignedFormula.trueAt(formula, 0));
            for (TableauNode leaf : tree.getOpenLeaves()) {
                Branch branch = leaf.getFinalBranch().orElseThrow();
                KripkeModel model = extractor.extract(branch);
                assertTrue(text, ModelChecker.satisfiesAll(model, branch.getFormulas()));
                assertTrue(text, ModelChecker.isTrue(model, formula, 0));
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void closedBranchIsRejected() {
        Branch branch = new Branch(SignedFormula.trueAt(Formula.atom("p"), 0));
        branch.add(SignedFormula.falseAt(Formula.atom("p"), 0));
        extractor.extract(branch);
    }

    @Test(expected = IllegalArgumentException.class)
    public void nullBranchIsRejected() {
        extractor.extract(null);
    }
}
