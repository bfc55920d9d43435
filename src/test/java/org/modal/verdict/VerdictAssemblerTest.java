package org.modal.verdict;

import org.junit.Test;
import org.modal.formula.Formula;
import org.modal.formula.FormulaParser;
import org.modal.formula.FormulaSyntaxException;
import org.modal.kripke.KripkeModel;
import org.modal.kripke.ModelChecker;
import org.modal.support.AccessibilityEdge;
import org.modal.support.SignedFormula;
import org.modal.tableau.TableauBuilder;
import org.modal.tableau.TableauTree;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.junit.Assert.*;

public class VerdictAssemblerTest {

    private final VerdictAssembler assembler = new VerdictAssembler();

    //region CLASSIFICAZIONE

    @Test
    public void contradiction() {
        SolutionReport report = assembler.solve("p & ~p");

        assertEquals(Verdict.INVALID, report.getValidity().getVerdict());
        assertEquals(Verdict.UNSATISFIABLE, report.getSatisfiability().getVerdict());
        assertEquals(SolutionReport.Classification.CONTRADICTION, report.getClassification());
        assertTrue(report.getValidity().getModel().isPresent());
        assertFalse(report.getSatisfiability().getModel().isPresent());
        assertTrue(report.getExplanation().contains("contraddizione modale"));
    }

    @Test
    public void propositionalTautology() {
        SolutionReport report = assembler.solve("p -> p");

        assertTrue(report.isValid());
        assertTrue(report.isSatisfiable());
        assertEquals(SolutionReport.Classification.TAUTOLOGY, report.getClassification());
        assertFalse(report.getValidity().getModel().isPresent());
        assertTrue(report.getExplanation().contains("tautologia modale"));
    }

    @Test
    public void serialityIsNotValidInK() {
        SolutionReport report = assembler.solve("[]p -> <>p");

        assertEquals(Verdict.INVALID, report.getValidity().getVerdict());
        assertEquals(SolutionReport.Classification.CONTINGENT, report.getClassification());

        KripkeModel countermodel = report.getValidity().getModel().orElseThrow();
        assertEquals(1, countermodel.getWorlds().size());
        assertTrue(countermodel.getEdges().isEmpty());
        assertFalse(ModelChecker.isTrue(countermodel, report.getFormula(), 0));
        assertTrue(report.getExplanation().contains("contingente"));
    }

    @Test
    public void disjunctionIsContingent() {
        SolutionReport report = assembler.solve("p | q");

        assertEquals(SolutionReport.Classification.CONTINGENT, report.getClassification());
        KripkeModel witness = report.getSatisfiability().getModel().orElseThrow();
        assertTrue(witness.valueOf(0, "p"));
    }

    @Test
    public void diamondAgainstBoxNegationIsUnsatisfiable() {
        SolutionReport report = assembler.solve("<>p & []~p");

        assertEquals(Verdict.UNSATISFIABLE, report.getSatisfiability().getVerdict());
        assertEquals(SolutionReport.Classification.CONTRADICTION, report.getClassification());
        assertTrue(report.getSatisfiability().getTree().isClosed());
    }

    @Test
    public void validPrinciplesOfK() {
        String[] valid = {
                "[](p -> q) -> ([]p -> []q)",
                "<>(p | q) -> (<>p | <>q)",
                "[]p & []q -> [](p & q)",
                "~<>p <-> []~p",
                "[]p -> [](q -> p)"
        };
        for (String text : valid) {
            assertEquals(text, Verdict.VALID, assembler.checkValidity(FormulaParser.parse(text)).getVerdict());
        }
    }

    @Test
    public void frameSpecificPrinciplesAreInvalid() {
        String[] invalid = {"[]p -> p", "<>p -> []p", "[]p -> [][]p", "p -> []<>p", "[](p | q) -> []p | []q"};
        for (String text : invalid) {
            Formula formula = FormulaParser.parse(text);
            CheckResult result = assembler.checkValidity(formula);

            assertEquals(text, Verdict.INVALID, result.getVerdict());
            assertFalse(text, ModelChecker.isTrue(result.getModel().orElseThrow(), formula, VerdictAssembler.ROOT_WORLD));
        }
    }

    //endregion

    //region CORRETTEZZA

    /**
     * Confronta gli esiti con l'enumerazione di tutti i modelli fino a tre mondi su {p, q}.
     * Un esito VALID deve valere ovunque, UNSATISFIABLE non deve valere in nessun mondo.
     */
    @Test
    public void closedVerdictsAgreeWithSmallModels() {
        String[] corpus = {
                "p & ~p", "p -> p", "[]p -> <>p", "<>p & []~p", "[](p -> q) -> ([]p -> []q)",
                "[]p -> p", "<>(p & q) -> <>p & <>q", "<>p & <>q -> <>(p & q)", "[]<>p & <>[]~p",
                "[](p & ~p) | <>q", "<>p & [](p -> q) & []~q", "~[]p <-> <>~p"
        };
        assertAgreementWithModels(corpus, 3, List.of("p", "q"));
    }

    /**
     * Stesso confronto su tutti i modelli fino a quattro mondi, con la sola variabile p
     * (con due variabili i modelli a quattro mondi sono oltre sedici milioni).
     */
    @Test
    public void closedVerdictsAgreeWithFourWorldModels() {
        String[] corpus = {
                "[]p -> <>p", "[]p -> p", "[]p -> [][]p", "p -> []<>p", "<>p & []~p",
                "[]<>p & <>[]~p", "<><>p -> <>p", "<><><>p & [][][]~p", "<>p & <>~p & [](p | ~p)"
        };
        assertAgreementWithModels(corpus, 4, List.of("p"));
    }

    private void assertAgreementWithModels(String[] corpus, int maxWorlds, List<String> atoms) {
        Formula[] formulas = new Formula[corpus.length];
        boolean[] trueSomewhere = new boolean[corpus.length];
        boolean[] falseSomewhere = new boolean[corpus.length];
        for (int i = 0; i < corpus.length; i++) {
            formulas[i] = FormulaParser.parse(corpus[i]);
        }

        forEachModel(maxWorlds, atoms, model -> {
            for (int i = 0; i < formulas.length; i++) {
                if (trueSomewhere[i] && falseSomewhere[i]) {
                    continue;
                }
                for (int world : model.getWorlds()) {
                    if (ModelChecker.isTrue(model, formulas[i], world)) {
                        trueSomewhere[i] = true;
                    } else {
                        falseSomewhere[i] = true;
                    }
                }
            }
        });

        for (int i = 0; i < corpus.length; i++) {
            SolutionReport report = assembler.solve(formulas[i], corpus[i]);
            assertEquals(corpus[i], !falseSomewhere[i], report.isValid());
            assertEquals(corpus[i], trueSomewhere[i], report.isSatisfiable());
        }
    }

    /**
     * Visita ogni modello con 1..maxWorlds mondi: tutte le relazioni di accessibilità
     * e tutte le valutazioni delle variabili indicate.
     */
    private static void forEachModel(int maxWorlds, List<String> atoms, Consumer<KripkeModel> visitor) {
        for (int size = 1; size <= maxWorlds; size++) {
            List<Integer> worlds = new ArrayList<>();
            for (int w = 0; w < size; w++) {
                worlds.add(w);
            }
            int edgeBits = size * size;
            int valueBits = atoms.size() * size;
            for (int relation = 0; relation < (1 << edgeBits); relation++) {
                List<AccessibilityEdge> edges = new ArrayList<>();
                for (int bit = 0; bit < edgeBits; bit++) {
                    if ((relation & (1 << bit)) != 0) {
                        edges.add(new AccessibilityEdge(bit / size, bit % size));
                    }
                }
                for (int values = 0; values < (1 << valueBits); values++) {
                    Map<Integer, Map<String, Boolean>> valuation = new HashMap<>();
                    for (int w = 0; w < size; w++) {
                        Map<String, Boolean> atWorld = new HashMap<>();
                        for (int a = 0; a < atoms.size(); a++) {
                            atWorld.put(atoms.get(a), (values & (1 << (atoms.size() * w + a))) != 0);
                        }
                        valuation.put(w, atWorld);
                    }
                    visitor.accept(new KripkeModel(worlds, edges, valuation, atoms));
                }
            }
        }
    }

    //endregion

    //region CASI LIMITE

    @Test
    public void checksBuildIndependentTrees() {
        SolutionReport report = assembler.solve("[]p -> <>p");

        TableauTree validityTree = report.getValidity().getTree();
        TableauTree satisfiabilityTree = report.getSatisfiability().getTree();

        assertNotSame(validityTree, satisfiabilityTree);
        assertEquals(SignedFormula.falseAt(report.getFormula(), 0), validityTree.getRootFormula());
        assertEquals(SignedFormula.trueAt(report.getFormula(), 0), satisfiabilityTree.getRootFormula());
        assertNotSame(validityTree.getStatistics(), satisfiabilityTree.getStatistics());
    }

    @Test(expected = IllegalStateException.class)
    public void validAndUnsatisfiableIsImpossible() {
        Formula formula = FormulaParser.parse("p & ~p");
        TableauTree closedTree = new TableauBuilder().build(SignedFormula.trueAt(formula, 0));

        new SolutionReport("p & ~p", formula,
                CheckResult.closed(CheckKind.VALIDITY, closedTree),
                CheckResult.closed(CheckKind.SATISFIABILITY, closedTree));
    }

    @Test(expected = IllegalArgumentException.class)
    public void swappedResultsAreRejected() {
        Formula formula = FormulaParser.parse("p");
        TableauTree tree = new TableauBuilder().build(SignedFormula.trueAt(formula, 0));
        CheckResult result = assembler.checkSatisfiability(formula);

        new SolutionReport("p", formula, result, CheckResult.closed(CheckKind.VALIDITY, tree));
    }

    @Test(expected = FormulaSyntaxException.class)
    public void malformedInputIsReported() {
        assembler.solve("p &");
    }

    @Test
    public void reportKeepsSourceText() {
        SolutionReport report = assembler.solve("  []p   ->  <>p ");

        assertEquals("[]p   ->  <>p", report.getSourceText());
        assertTrue(report.getAnalysis().isModal());
        assertTrue(report.toCompactString().contains("CONTINGENT"));
    }

    //endregion
}
