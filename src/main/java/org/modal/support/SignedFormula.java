package org.modal.support;

import org.modal.formula.Formula;

/**
 * FORMULA SEGNATA - Assunzione (formula, segno, mondo) su cui lavora il tableau
 *
 * Una formula segnata (φ, T, w) afferma che φ è vera nel mondo w, mentre (φ, F, w)
 * afferma che φ è falsa in w. È creata come radice del tableau oppure derivata
 * dall'applicazione di una regola, ed è immutabile.
 *
 * @param formula formula (non null)
 * @param sign segno T/F (non null)
 * @param world identificatore del mondo (>= 0)
 */
public record SignedFormula(Formula formula, Sign sign, int world) {

    public SignedFormula {
        if (formula == null) {
            throw new IllegalArgumentException("Formula non può essere null");
        }
        if (sign == null) {
            throw new IllegalArgumentException("Segno non può essere null");
        }
        if (world < 0) {
            throw new IllegalArgumentException("Mondo deve essere >= 0, ricevuto: " + world);
        }
    }

    public static SignedFormula trueAt(Formula formula, int world) {
        return new SignedFormula(formula, Sign.T, world);
    }

    public static SignedFormula falseAt(Formula formula, int world) {
        return new SignedFormula(formula, Sign.F, world);
    }

    /**
     * @return la formula segnata complementare: stessa formula e mondo, segno opposto
     */
    public SignedFormula conjugate() {
        return new SignedFormula(formula, sign.opposite(), world);
    }

    /**
     * @return la stessa formula con lo stesso segno, spostata in un altro mondo
     */
    public SignedFormula atWorld(int otherWorld) {
        return new SignedFormula(formula, sign, otherWorld);
    }

    public boolean isTrue() {
        return sign == Sign.T;
    }

    @Override
    public String toString() {
        return "w" + world + " " + sign + " " + formula;
    }
}
