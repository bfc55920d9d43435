package org.modal.verdict;

import org.modal.support.Sign;

/**
 * Tipo di verifica e relativa formula radice del tableau.
 *
 * • VALIDITY: radice (φ, F, 0), tutti i rami chiusi significa φ valida
 * • SATISFIABILITY: radice (φ, T, 0), tutti i rami chiusi significa φ insoddisfacibile
 */
public enum CheckKind {
    VALIDITY(Sign.F, Verdict.VALID, Verdict.INVALID, "validita", "VERIFICA DI VALIDITÀ"),
    SATISFIABILITY(Sign.T, Verdict.UNSATISFIABLE, Verdict.SATISFIABLE, "soddisfacibilita", "VERIFICA DI SODDISFACIBILITÀ");

    private final Sign rootSign;
    private final Verdict closedVerdict;
    private final Verdict openVerdict;
    private final String fileSuffix;
    private final String title;

    CheckKind(Sign rootSign, Verdict closedVerdict, Verdict openVerdict, String fileSuffix, String title) {
        this.rootSign = rootSign;
        this.closedVerdict = closedVerdict;
        this.openVerdict = openVerdict;
        this.fileSuffix = fileSuffix;
        this.title = title;
    }

    public Sign getRootSign() {
        return rootSign;
    }

    /** @return esito quando tutti i rami del tableau sono chiusi */
    public Verdict closedVerdict() {
        return closedVerdict;
    }

    /** @return esito quando almeno un ramo resta aperto */
    public Verdict openVerdict() {
        return openVerdict;
    }

    /** Suffisso usato nei nomi dei file di output (es. formula_validita.tableau) */
    public String getFileSuffix() {
        return fileSuffix;
    }

    public String getTitle() {
        return title;
    }
}
