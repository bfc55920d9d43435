package org.modal.tableau;

import org.modal.formula.Formula;
import org.modal.support.Branch;
import org.modal.support.SignedFormula;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * MOTORE DI ESPANSIONE - Applica una regola del tableau a un ramo aperto
 *
 * Ogni chiamata a {@link #expand(Branch)} esegue al più un'applicazione di regola,
 * scelta secondo un ordine fisso:
 * 1. Prima regola α non ancora espansa (ordine di accumulazione)
 * 2. Propagazione ∀ (T[] e F<>) verso i successori che non hanno ancora il corpo
 * 3. Prima regola β non ancora espansa: divide il ramo in due copie
 * 4. Prima regola ∃ (F[] e T<>) non ancora soddisfatta
 *
 * Le regole ∃ scattano solo quando nessuna regola α, ∀ o β è applicabile sull'intero
 * ramo: quando un mondo viene riusato dal blocking la sua etichetta è già definitiva.
 *
 * BLOCKING:
 * Prima di creare un mondo per (F[]φ, w) o (T<>φ, w) si calcola l'insieme di richieste
 * che il nuovo mondo riceverebbe: il corpo φ con il suo segno, più (ψ, T) per ogni
 * (T[]ψ, w) e (ψ, F) per ogni (F<>ψ, w). Se un mondo esistente v contiene già tutte le
 * richieste si aggiunge solo l'arco w -> v.
 */
public class ExpansionEngine {

    private static final Logger LOGGER = Logger.getLogger(ExpansionEngine.class.getName());

    private final TableauConfiguration configuration;
    private final TableauStatistics statistics;

    public ExpansionEngine(TableauConfiguration configuration, TableauStatistics statistics) {
        if (configuration == null || statistics == null) {
            throw new IllegalArgumentException("Configurazione e statistiche non possono essere null");
        }
        this.configuration = configuration;
        this.statistics = statistics;
    }

    //region ESPANSIONE

    /**
     * Applica la prossima regola al ramo secondo l'ordine fisso.
     *
     * @param branch ramo da espandere (modificato sul posto, salvo per le regole β)
     * @return passo eseguito, {@link ExpansionStep#none()} se il ramo è chiuso o saturo
     * @throws InternalLoopFault se una regola ∃ supererebbe il limite di mondi
     */
    public ExpansionStep expand(Branch branch) {
        if (branch == null) {
            throw new IllegalArgumentException("Ramo non può essere null");
        }
        if (branch.isClosed()) {
            return ExpansionStep.none();
        }

        ExpansionStep step = applyAlphaRule(branch);
        if (step == null) {
            step = applyUniversalRule(branch);
        }
        if (step == null) {
            step = applyBetaRule(branch);
        }
        if (step == null) {
            step = applyExistentialRule(branch);
        }

        if (step == null) {
            LOGGER.finest("Nessuna regola applicabile: ramo saturo");
            return ExpansionStep.none();
        }

        LOGGER.finest(step::toString);
        return step;
    }

    //endregion

    //region REGOLE PROPOSIZIONALI

    private ExpansionStep applyAlphaRule(Branch branch) {
        List<SignedFormula> formulas = branch.getFormulas();

        for (int i = 0; i < formulas.size(); i++) {
            SignedFormula candidate = formulas.get(i);
            if (RuleKind.of(candidate) != RuleKind.ALPHA || branch.isExpanded(candidate)) {
                continue;
            }

            branch.incrementAppliedSteps();
            branch.markExpanded(candidate);

            List<SignedFormula> produced = new ArrayList<>();
            for (SignedFormula component : alphaComponents(candidate)) {
                if (branch.add(component)) {
                    produced.add(component);
                }
            }

            statistics.incrementAlphaApplications();
            return ExpansionStep.linear(new RuleApplication(RuleKind.ALPHA, candidate, produced, -1, false));
        }
        return null;
    }

    private ExpansionStep applyBetaRule(Branch branch) {
        List<SignedFormula> formulas = branch.getFormulas();

        for (int i = 0; i < formulas.size(); i++) {
            SignedFormula candidate = formulas.get(i);
            if (RuleKind.of(candidate) != RuleKind.BETA || branch.isExpanded(candidate)) {
                continue;
            }

            List<SignedFormula> alternatives = betaAlternatives(candidate);

            // Alternativa già presente: il ramo è già un'istanza di quel figlio
            if (alternatives.stream().anyMatch(branch::contains)) {
                branch.markExpanded(candidate);
                LOGGER.finest(() -> "β ridondante, nessuna divisione: " + candidate);
                continue;
            }

            branch.incrementAppliedSteps();
            branch.markExpanded(candidate);

            List<Branch> children = new ArrayList<>();
            for (SignedFormula alternative : alternatives) {
                Branch child = new Branch(branch);
                child.add(alternative);
                children.add(child);
            }

            statistics.incrementBetaApplications();
            return ExpansionStep.split(new RuleApplication(RuleKind.BETA, candidate, alternatives, -1, false), children);
        }
        return null;
    }

    /**
     * Componenti di una formula α, tutte aggiunte allo stesso ramo.
     */
    static List<SignedFormula> alphaComponents(SignedFormula signedFormula) {
        Formula formula = signedFormula.formula();
        int world = signedFormula.world();

        return switch (formula.getType()) {
            case NOT -> List.of(new SignedFormula(formula.getOperand(), signedFormula.sign().opposite(), world));
            case AND -> List.of(SignedFormula.trueAt(formula.getLeft(), world),
                    SignedFormula.trueAt(formula.getRight(), world));
            case OR -> List.of(SignedFormula.falseAt(formula.getLeft(), world),
                    SignedFormula.falseAt(formula.getRight(), world));
            case IMPLIES -> List.of(SignedFormula.trueAt(formula.getLeft(), world),
                    SignedFormula.falseAt(formula.getRight(), world));
            default -> throw new IllegalArgumentException("Formula non di tipo α: " + signedFormula);
        };
    }

    /**
     * Alternative di una formula β, una per ramo figlio, nell'ordine di esplorazione.
     */
    static List<SignedFormula> betaAlternatives(SignedFormula signedFormula) {
        Formula formula = signedFormula.formula();
        int world = signedFormula.world();

        return switch (formula.getType()) {
            case AND -> List.of(SignedFormula.falseAt(formula.getLeft(), world),
                    SignedFormula.falseAt(formula.getRight(), world));
            case OR -> List.of(SignedFormula.trueAt(formula.getLeft(), world),
                    SignedFormula.trueAt(formula.getRight(), world));
            case IMPLIES -> List.of(SignedFormula.falseAt(formula.getLeft(), world),
                    SignedFormula.trueAt(formula.getRight(), world));
            default -> throw new IllegalArgumentException("Formula non di tipo β: " + signedFormula);
        };
    }

    //endregion

    //region REGOLE MODALI

    /**
     * Propaga la prima formula universale che ha successori privi del suo corpo.
     * Il corpo conserva il segno: T[]φ dà (φ, T), F<>φ dà (φ, F).
     */
    private ExpansionStep applyUniversalRule(Branch branch) {
        List<SignedFormula> formulas = branch.getFormulas();

        for (int i = 0; i < formulas.size(); i++) {
            SignedFormula candidate = formulas.get(i);
            if (RuleKind.of(candidate) != RuleKind.MODAL_FORALL) {
                continue;
            }

            List<SignedFormula> missing = new ArrayList<>();
            for (int successor : branch.successorsOf(candidate.world())) {
                SignedFormula target = modalBody(candidate).atWorld(successor);
                if (!branch.contains(target)) {
                    missing.add(target);
                }
            }
            if (missing.isEmpty()) {
                continue;
            }

            branch.incrementAppliedSteps();
            missing.forEach(branch::add);

            statistics.incrementUniversalApplications();
            return ExpansionStep.linear(new RuleApplication(RuleKind.MODAL_FORALL, candidate, missing, -1, false));
        }
        return null;
    }

    private ExpansionStep applyExistentialRule(Branch branch) {
        List<SignedFormula> formulas = branch.getFormulas();

        for (int i = 0; i < formulas.size(); i++) {
            SignedFormula candidate = formulas.get(i);
            if (RuleKind.of(candidate) != RuleKind.MODAL_EXISTS || branch.isFulfilled(candidate)) {
                continue;
            }

            int origin = candidate.world();
            List<SignedFormula> demand = demandSet(branch, candidate);

            Integer reusable = findReusableWorld(branch, demand);
            if (reusable != null) {
                branch.incrementAppliedSteps();
                branch.addEdge(origin, reusable);
                branch.recordBlocking(candidate, reusable);

                statistics.incrementExistentialApplications();
                statistics.incrementWorldsReused();
                LOGGER.finer(() -> "Blocking: " + candidate + " soddisfatta dal mondo w" + reusable);
                return ExpansionStep.linear(new RuleApplication(RuleKind.MODAL_EXISTS, candidate, List.of(), reusable, true));
            }

            if (branch.worldCount() >= configuration.getMaxWorlds()) {
                throw new InternalLoopFault("Superato il limite di " + configuration.getMaxWorlds() + " mondi per ramo",
                        branch.getAppliedSteps(), branch.worldCount());
            }

            branch.incrementAppliedSteps();
            int fresh = branch.createWorld(origin);
            SignedFormula body = modalBody(candidate).atWorld(fresh);
            branch.add(body);
            branch.markFulfilled(candidate);

            statistics.incrementExistentialApplications();
            statistics.incrementWorldsCreated();
            return ExpansionStep.linear(new RuleApplication(RuleKind.MODAL_EXISTS, candidate, List.of(body), fresh, false));
        }
        return null;
    }

    /**
     * Richieste che un nuovo successore di w riceverebbe, espresse nel mondo w.
     * Il primo elemento è sempre il corpo della formula esistenziale.
     */
    static List<SignedFormula> demandSet(Branch branch, SignedFormula existential) {
        List<SignedFormula> demand = new ArrayList<>();
        demand.add(modalBody(existential));

        for (SignedFormula signedFormula : branch.formulasAt(existential.world())) {
            if (RuleKind.of(signedFormula) == RuleKind.MODAL_FORALL) {
                SignedFormula body = modalBody(signedFormula);
                if (!demand.contains(body)) {
                    demand.add(body);
                }
            }
        }
        return demand;
    }

    /**
     * @return il mondo con identificatore minimo che contiene tutte le richieste, null se nessuno
     */
    private static Integer findReusableWorld(Branch branch, List<SignedFormula> demand) {
        for (int world : branch.getWorlds()) {
            boolean satisfiesDemand = true;
            for (SignedFormula requested : demand) {
                if (!branch.contains(requested.atWorld(world))) {
                    satisfiesDemand = false;
                    break;
                }
            }
            if (satisfiesDemand) {
                return world;
            }
        }
        return null;
    }

    /**
     * Corpo di una formula modale con lo stesso segno e nello stesso mondo.
     */
    private static SignedFormula modalBody(SignedFormula modal) {
        return new SignedFormula(modal.formula().getOperand(), modal.sign(), modal.world());
    }

    //endregion

    public TableauStatistics getStatistics() {
        return statistics;
    }
}
