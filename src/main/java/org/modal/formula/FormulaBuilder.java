package org.modal.formula;

import org.modal.antlr.ModalFormulaBaseVisitor;
import org.modal.antlr.ModalFormulaParser.AndContext;
import org.modal.antlr.ModalFormulaParser.BoxContext;
import org.modal.antlr.ModalFormulaParser.DiamondContext;
import org.modal.antlr.ModalFormulaParser.FormulaContext;
import org.modal.antlr.ModalFormulaParser.IdContext;
import org.modal.antlr.ModalFormulaParser.IffContext;
import org.modal.antlr.ModalFormulaParser.ImpliesContext;
import org.modal.antlr.ModalFormulaParser.NotContext;
import org.modal.antlr.ModalFormulaParser.OrContext;
import org.modal.antlr.ModalFormulaParser.ParContext;
import org.modal.antlr.ModalFormulaParser.VarContext;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * COSTRUTTORE AST - Convertitore da albero sintattico ANTLR a {@link Formula}
 *
 * Implementa il visitor pattern sulla grammatica ModalFormula trasformando l'albero di
 * parsing in un albero {@link Formula} immutabile, con precedenze e associatività
 * già risolte dalla struttura della grammatica.
 *
 * OPERATORI SUPPORTATI (in ordine di precedenza crescente):
 * - Biimplicazione (<->): A <-> B ~ (A -> B) & (B -> A)
 * - Implicazione (->): associativa a destra
 * - Disgiunzione (|): associativa a sinistra
 * - Congiunzione (&): associativa a sinistra
 * - Unari (~, [], <>): negazione, necessità, possibilità
 * - Variabili atomiche ed espressioni tra parentesi
 *
 * La biimplicazione non ha un nodo dedicato: viene espansa in due implicazioni, così
 * che il motore tableau lavori sempre sui sette tipi di nodo di {@link Formula.Type}.
 */
public class FormulaBuilder extends ModalFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaBuilder.class.getName());

    //region PUNTO DI INGRESSO

    /**
     * Punto di ingresso: visita la regola radice ignorando il token EOF.
     *
     * @param ctx contesto della formula completa
     * @return albero della formula
     */
    @Override
    public Formula visitFormula(FormulaContext ctx) {
        Formula formula = visit(ctx.biconditional());
        LOGGER.fine("Formula costruita: " + formula);
        return formula;
    }

    //endregion

    //region BIIMPLICAZIONI E IMPLICAZIONI

    /**
     * Gestisce catene di biimplicazioni.
     *
     * GESTIONE CATENE:
     * - A <-> B <-> C ~ (A <-> B) & (B <-> C)
     * - Ogni coppia espansa in (A -> B) & (B -> A)
     *
     * Una catena senza parentesi è letta come congiunzione delle coppie adiacenti, non come
     * (A <-> B) <-> C né come A <-> (B <-> C): le due letture associative richiedono
     * parentesi esplicite.
     *
     * @param ctx contesto biimplicazione dalla grammatica
     * @return formula equivalente senza biimplicazioni
     */
    @Override
    public Formula visitIff(IffContext ctx) {
        // Caso base: nessun operatore IFF presente
        if (ctx.IFF().isEmpty()) {
            return visit(ctx.implication(0));
        }

        LOGGER.finest("Espansione catena biimplicazioni: " + ctx.IFF().size() + " operatori");

        List<Formula> operands = new ArrayList<>();
        for (var implicationCtx : ctx.implication()) {
            operands.add(visit(implicationCtx));
        }

        Formula result = null;
        for (int i = 0; i < operands.size() - 1; i++) {
            Formula equivalence = expandBiimplication(operands.get(i), operands.get(i + 1));
            result = result == null ? equivalence : Formula.and(result, equivalence);
        }
        return result;
    }

    private Formula expandBiimplication(Formula left, Formula right) {
        return Formula.and(Formula.implies(left, right), Formula.implies(right, left));
    }

    /**
     * Gestisce implicazioni, associative a destra: A -> B -> C ~ A -> (B -> C).
     */
    @Override
    public Formula visitImplies(ImpliesContext ctx) {
        if (ctx.IMPLIES() == null) {
            return visit(ctx.disjunction());
        }

        Formula antecedent = visit(ctx.disjunction());
        Formula consequent = visit(ctx.implication());   // ricorsione per associatività destra
        return Formula.implies(antecedent, consequent);
    }

    //endregion

    //region DISGIUNZIONI E CONGIUNZIONI

    /**
     * Gestisce disgiunzioni, associative a sinistra: A | B | C ~ (A | B) | C.
     */
    @Override
    public Formula visitOr(OrContext ctx) {
        Formula result = visit(ctx.conjunction(0));
        for (int i = 1; i < ctx.conjunction().size(); i++) {
            result = Formula.or(result, visit(ctx.conjunction(i)));
        }
        return result;
    }

    /**
     * Gestisce congiunzioni, associative a sinistra: A & B & C ~ (A & B) & C.
     */
    @Override
    public Formula visitAnd(AndContext ctx) {
        Formula result = visit(ctx.unary(0));
        for (int i = 1; i < ctx.unary().size(); i++) {
            result = Formula.and(result, visit(ctx.unary(i)));
        }
        return result;
    }

    //endregion

    //region OPERATORI UNARI

    @Override
    public Formula visitNot(NotContext ctx) {
        return Formula.not(visit(ctx.unary()));
    }

    @Override
    public Formula visitBox(BoxContext ctx) {
        return Formula.box(visit(ctx.unary()));
    }

    @Override
    public Formula visitDiamond(DiamondContext ctx) {
        return Formula.diamond(visit(ctx.unary()));
    }

    //endregion

    //region VARIABILI E PARENTESI

    @Override
    public Formula visitVar(VarContext ctx) {
        return visit(ctx.atom());
    }

    /**
     * Rimozione trasparente delle parentesi.
     */
    @Override
    public Formula visitPar(ParContext ctx) {
        return visit(ctx.biconditional());
    }

    @Override
    public Formula visitId(IdContext ctx) {
        String variableName = ctx.IDENTIFIER().getText();
        LOGGER.finest("Variabile atomica: " + variableName);
        return Formula.atom(variableName);
    }

    //endregion
}
