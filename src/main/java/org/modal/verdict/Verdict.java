package org.modal.verdict;

/**
 * Esito di una singola verifica.
 */
public enum Verdict {
    VALID("valida"),
    INVALID("non valida"),
    SATISFIABLE("soddisfacibile"),
    UNSATISFIABLE("insoddisfacibile");

    private final String description;

    Verdict(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
