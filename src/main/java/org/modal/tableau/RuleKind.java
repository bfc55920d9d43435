package org.modal.tableau;

import org.modal.support.SignedFormula;

/**
 * Famiglie di regole del tableau, determinate dal tipo della formula e dal segno.
 *
 * TABELLA:
 * • ALPHA (non ramificanti): T~, F~, T&, F|, F->
 * • BETA (ramificanti): F&, T|, T->
 * • MODAL_EXISTS (mondo nuovo): F[], T<>
 * • MODAL_FORALL (propagazione ai successori): T[], F<>
 * • LITERAL: atomi, nessuna regola applicabile
 */
public enum RuleKind {
    ALPHA("α"),
    BETA("β"),
    MODAL_EXISTS("∃"),
    MODAL_FORALL("∀"),
    LITERAL("-");

    private final String symbol;

    RuleKind(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Classifica una formula segnata secondo la tabella delle regole.
     *
     * @param signedFormula formula segnata da classificare
     * @return famiglia di regole applicabile
     */
    public static RuleKind of(SignedFormula signedFormula) {
        boolean positive = signedFormula.isTrue();

        return switch (signedFormula.formula().getType()) {
            case ATOM -> LITERAL;
            case NOT -> ALPHA;
            case AND -> positive ? ALPHA : BETA;
            case OR, IMPLIES -> positive ? BETA : ALPHA;
            case BOX -> positive ? MODAL_FORALL : MODAL_EXISTS;
            case DIAMOND -> positive ? MODAL_EXISTS : MODAL_FORALL;
        };
    }
}
