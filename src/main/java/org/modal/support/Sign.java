package org.modal.support;

/**
 * Segno di una formula segnata.
 * T afferma che la formula vale nel mondo, F che vale la sua negazione.
 */
public enum Sign {
    T,
    F;

    /** @return il segno opposto */
    public Sign opposite() {
        return this == T ? F : T;
    }
}
