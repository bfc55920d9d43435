package org.modal.kripke;

import org.modal.formula.Formula;
import org.modal.support.Branch;
import org.modal.support.SignedFormula;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * ESTRATTORE MODELLI - Da ramo aperto e saturo a {@link KripkeModel}
 *
 * COSTRUZIONE:
 * • Mondi: tutti i mondi introdotti sul ramo
 * • Accessibilità: gli archi del ramo, inclusi quelli aggiunti dal blocking
 * • Valutazione: p vera in w se (p, T, w) è sul ramo, falsa se (p, F, w) è sul ramo
 * • Atomi non vincolati in un mondo: falsi, segnalati come liberi dal modello
 */
public class ModelExtractor {

    private static final Logger LOGGER = Logger.getLogger(ModelExtractor.class.getName());

    /**
     * @param branch ramo aperto e saturo
     * @return modello che soddisfa ogni formula segnata del ramo
     * @throws IllegalArgumentException se il ramo è null o chiuso
     */
    public KripkeModel extract(Branch branch) {
        if (branch == null) {
            throw new IllegalArgumentException("Ramo non può essere null");
        }
        if (branch.isClosed()) {
            throw new IllegalArgumentException("Impossibile estrarre un modello da un ramo chiuso");
        }

        Set<String> atoms = new TreeSet<>();
        Map<Integer, Map<String, Boolean>> valuation = new TreeMap<>();

        for (SignedFormula signedFormula : branch.getFormulas()) {
            Formula formula = signedFormula.formula();
            atoms.addAll(formula.getAtoms());
            if (formula.isAtom()) {
                valuation.computeIfAbsent(signedFormula.world(), key -> new TreeMap<>())
                        .put(formula.getName(), signedFormula.isTrue());
            }
        }

        KripkeModel model = new KripkeModel(branch.getWorlds(), branch.getEdges(), valuation, atoms);
        LOGGER.fine(() -> "Modello estratto: " + model.getWorlds().size() + " mondi, " + model.getEdges().size() + " archi");
        return model;
    }
}
