package org.modal.formula;

/**
 * Errore sintattico nel testo di una formula.
 *
 * Sollevato dal parser per parentesi non bilanciate, simboli sconosciuti, input vuoto,
 * operatori in posizione non valida o simboli residui dopo un'espressione completa.
 * Il parsing non produce mai risultati parziali: o restituisce l'intera formula o
 * termina con questa eccezione.
 */
public class FormulaSyntaxException extends RuntimeException {

    /** Riga dell'errore (a partire da 1) */
    private final int line;

    /** Colonna dell'errore (a partire da 0) */
    private final int column;

    /** Testo del simbolo che ha causato l'errore, null se non disponibile */
    private final String offendingText;

    public FormulaSyntaxException(String message, int line, int column, String offendingText) {
        super(String.format("Errore di sintassi (riga %d, colonna %d): %s", line, column, message));
        this.line = line;
        this.column = column;
        this.offendingText = offendingText;
    }

    public FormulaSyntaxException(String message) {
        super(message);
        this.line = -1;
        this.column = -1;
        this.offendingText = null;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getOffendingText() {
        return offendingText;
    }
}
