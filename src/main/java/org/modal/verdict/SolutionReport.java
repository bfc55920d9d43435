package org.modal.verdict;

import org.modal.formula.Formula;
import org.modal.formula.FormulaAnalysis;

/**
 * RAPPORTO SOLUZIONE - Esiti combinati di validità e soddisfacibilità
 *
 * CLASSIFICAZIONE:
 * • TAUTOLOGY: valida (quindi anche soddisfacibile)
 * • CONTINGENT: soddisfacibile ma non valida
 * • CONTRADICTION: insoddisfacibile (quindi non valida)
 *
 * La combinazione valida e insoddisfacibile è impossibile: se si presenta indica un
 * difetto interno e la costruzione del rapporto fallisce.
 */
public class SolutionReport {

    public enum Classification {
        TAUTOLOGY("tautologia"),
        CONTINGENT("contingente"),
        CONTRADICTION("contraddizione");

        private final String description;

        Classification(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final String sourceText;
    private final Formula formula;
    private final FormulaAnalysis analysis;
    private final CheckResult validity;
    private final CheckResult satisfiability;
    private final Classification classification;

    public SolutionReport(String sourceText, Formula formula, CheckResult validity, CheckResult satisfiability) {
        if (formula == null || validity == null || satisfiability == null) {
            throw new IllegalArgumentException("Formula ed esiti non possono essere null");
        }
        if (validity.getKind() != CheckKind.VALIDITY || satisfiability.getKind() != CheckKind.SATISFIABILITY) {
            throw new IllegalArgumentException("Esiti scambiati: attesi validità e soddisfacibilità");
        }

        this.sourceText = sourceText;
        this.formula = formula;
        this.analysis = FormulaAnalysis.of(formula);
        this.validity = validity;
        this.satisfiability = satisfiability;
        this.classification = classify(validity.getVerdict(), satisfiability.getVerdict());
    }

    private static Classification classify(Verdict validity, Verdict satisfiability) {
        boolean valid = validity == Verdict.VALID;
        boolean satisfiable = satisfiability == Verdict.SATISFIABLE;

        if (valid && !satisfiable) {
            throw new IllegalStateException("Combinazione di esiti impossibile: formula valida e insoddisfacibile");
        }
        if (valid) {
            return Classification.TAUTOLOGY;
        }
        return satisfiable ? Classification.CONTINGENT : Classification.CONTRADICTION;
    }

    //region GETTERS

    public String getSourceText() {
        return sourceText;
    }

    public Formula getFormula() {
        return formula;
    }

    public FormulaAnalysis getAnalysis() {
        return analysis;
    }

    public CheckResult getValidity() {
        return validity;
    }

    public CheckResult getSatisfiability() {
        return satisfiability;
    }

    public Classification getClassification() {
        return classification;
    }

    public boolean isValid() {
        return validity.getVerdict() == Verdict.VALID;
    }

    public boolean isSatisfiable() {
        return satisfiability.getVerdict() == Verdict.SATISFIABLE;
    }

    //endregion

    /**
     * @return spiegazione in linguaggio naturale della classificazione
     */
    public String getExplanation() {
        String quoted = "'" + formula + "'";

        return switch (classification) {
            case TAUTOLOGY -> "La formula " + quoted + " è valida e soddisfacibile.\n" +
                    "1. Validità: la formula è vera in ogni mondo di ogni modello di Kripke; è una tautologia modale.\n" +
                    "2. Soddisfacibilità: esiste almeno un modello in cui la formula è vera, come per ogni formula valida.\n" +
                    "Si tratta di una verità necessaria.\n";
            case CONTINGENT -> "La formula " + quoted + " è soddisfacibile ma non valida.\n" +
                    "1. Non valida: esiste un mondo di un modello in cui la formula è falsa (vedi contromodello).\n" +
                    "2. Soddisfacibile: esiste un mondo di un modello in cui la formula è vera (vedi modello testimone).\n" +
                    "Si tratta di una verità contingente: possibile ma non necessaria.\n";
            case CONTRADICTION -> "La formula " + quoted + " non è né valida né soddisfacibile.\n" +
                    "1. Non valida: la formula è falsa in ogni mondo di ogni modello.\n" +
                    "2. Insoddisfacibile: nessun modello rende vera la formula; è una contraddizione modale.\n" +
                    "Si tratta di un'impossibilità.\n";
        };
    }

    public String toCompactString() {
        return formula + " -> " + classification + " (validità: " + validity.getVerdict() +
                ", soddisfacibilità: " + satisfiability.getVerdict() + ")";
    }

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append("=== RAPPORTO SOLUZIONE ===\n");
        if (sourceText != null && !sourceText.equals(formula.toString())) {
            output.append("Input: ").append(sourceText).append("\n");
        }
        output.append("Formula: ").append(formula).append("\n");
        output.append("Classificazione: ").append(classification).append(" (").append(classification.getDescription()).append(")\n\n");

        output.append("=== ANALISI ===\n").append(analysis).append("\n");
        output.append("=== SPIEGAZIONE ===\n").append(getExplanation()).append("\n");
        output.append(validity).append("\n");
        output.append(satisfiability);
        return output.toString();
    }
}
