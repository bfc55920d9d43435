package org.modal.verdict;

import org.modal.formula.Formula;
import org.modal.formula.FormulaParser;
import org.modal.kripke.KripkeModel;
import org.modal.kripke.ModelChecker;
import org.modal.kripke.ModelExtractor;
import org.modal.support.Branch;
import org.modal.support.SignedFormula;
import org.modal.tableau.TableauBuilder;
import org.modal.tableau.TableauConfiguration;
import org.modal.tableau.TableauTree;

import java.util.logging.Logger;

/**
 * ASSEMBLATORE ESITI - Punto di ingresso della procedura di decisione
 *
 * PIPELINE:
 * 1. Parsing del testo in {@link Formula} (opzionale, per {@link #solve(String)})
 * 2. Verifica di validità: tableau con radice (φ, F, 0)
 * 3. Verifica di soddisfacibilità: tableau con radice (φ, T, 0), indipendente dal primo
 * 4. Estrazione del modello dalla prima foglia aperta di ciascun albero
 * 5. Controllo del modello estratto contro la formula radice
 *
 * Un modello che non soddisfa la radice indica un difetto interno e solleva
 * {@link IllegalStateException}: non viene mai restituito come esito.
 */
public class VerdictAssembler {

    private static final Logger LOGGER = Logger.getLogger(VerdictAssembler.class.getName());

    /** Mondo radice di ogni tableau */
    public static final int ROOT_WORLD = 0;

    private final TableauBuilder builder;
    private final ModelExtractor extractor;

    public VerdictAssembler() {
        this(TableauConfiguration.defaults());
    }

    public VerdictAssembler(TableauConfiguration configuration) {
        this.builder = new TableauBuilder(configuration);
        this.extractor = new ModelExtractor();
    }

    //region VERIFICHE

    /**
     * Verifica la validità: φ è valida se il tableau di (φ, F, 0) chiude.
     *
     * @return VALID, oppure INVALID con contromodello
     */
    public CheckResult checkValidity(Formula formula) {
        return check(CheckKind.VALIDITY, formula);
    }

    /**
     * Verifica la soddisfacibilità: φ è insoddisfacibile se il tableau di (φ, T, 0) chiude.
     *
     * @return UNSATISFIABLE, oppure SATISFIABLE con modello testimone
     */
    public CheckResult checkSatisfiability(Formula formula) {
        return check(CheckKind.SATISFIABILITY, formula);
    }

    private CheckResult check(CheckKind kind, Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula non può essere null");
        }

        SignedFormula root = new SignedFormula(formula, kind.getRootSign(), ROOT_WORLD);
        TableauTree tree = builder.build(root);

        if (tree.isClosed()) {
            LOGGER.fine(() -> kind + " " + formula + ": " + kind.closedVerdict());
            return CheckResult.closed(kind, tree);
        }

        Branch openBranch = tree.firstOpenBranch()
                .orElseThrow(() -> new IllegalStateException("Albero aperto senza foglie aperte"));
        KripkeModel model = extractor.extract(openBranch);

        if (!ModelChecker.satisfies(model, root)) {
            LOGGER.severe("Il modello estratto non soddisfa la radice " + root + ":\n" + model);
            throw new IllegalStateException("Modello estratto incoerente con la formula radice " + root);
        }

        LOGGER.fine(() -> kind + " " + formula + ": " + kind.openVerdict());
        return CheckResult.open(kind, tree, model);
    }

    //endregion

    //region RISOLUZIONE COMPLETA

    /**
     * Esegue parsing, entrambe le verifiche e l'analisi della formula.
     *
     * @param text formula in notazione infissa
     * @return rapporto completo
     * @throws org.modal.formula.FormulaSyntaxException se il testo non è ben formato
     */
    public SolutionReport solve(String text) {
        Formula formula = FormulaParser.parse(text);
        return solve(formula, text.trim());
    }

    /**
     * @param formula formula già analizzata
     * @param sourceText testo originale, usato solo per la presentazione
     */
    public SolutionReport solve(Formula formula, String sourceText) {
        LOGGER.info("Risoluzione formula: " + formula);

        CheckResult validity = checkValidity(formula);
        CheckResult satisfiability = checkSatisfiability(formula);

        return new SolutionReport(sourceText == null ? formula.toString() : sourceText, formula, validity, satisfiability);
    }

    //endregion
}
