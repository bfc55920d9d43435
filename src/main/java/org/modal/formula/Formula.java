package org.modal.formula;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * FORMULA MODALE - Albero sintattico immutabile della logica modale proposizionale
 *
 * Rappresenta formule della logica modale K in forma ad albero. Ogni nodo ha un tipo
 * che ne determina la forma e i figli validi, e l'intero albero è immutabile: una volta
 * costruito dal parser può essere condiviso in sola lettura fra rami e tableaux diversi.
 *
 * TIPI DI NODO:
 * - ATOM: variabile proposizionale (identificatore minuscolo)
 * - NOT: negazione ~A
 * - AND, OR, IMPLIES: connettivi binari A & B, A | B, A -> B
 * - BOX, DIAMOND: operatori modali []A (necessità) e <>A (possibilità)
 *
 * UGUAGLIANZA:
 * - Strutturale: due formule sono uguali se hanno stesso tipo, nome e figli uguali
 * - Usata dal controllo di chiusura dei rami (corrispondenza sintattica)
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodo supportati, uno per ciascuna variante della formula.
     */
    public enum Type {
        ATOM,       // Variabile proposizionale: p, q, r, ...
        NOT,        // Negazione: ~A
        AND,        // Congiunzione: A & B
        OR,         // Disgiunzione: A | B
        IMPLIES,    // Implicazione: A -> B
        BOX,        // Necessità: []A
        DIAMOND;    // Possibilità: <>A

        /** @return true per i connettivi a un solo operando */
        public boolean isUnary() {
            return this == NOT || this == BOX || this == DIAMOND;
        }

        /** @return true per i connettivi a due operandi */
        public boolean isBinary() {
            return this == AND || this == OR || this == IMPLIES;
        }

        /** @return true per gli operatori modali */
        public boolean isModal() {
            return this == BOX || this == DIAMOND;
        }
    }

    /** Formato ammesso per i nomi delle variabili proposizionali */
    private static final Pattern ATOM_NAME = Pattern.compile("[a-z][a-z0-9_]*");

    /** Tipo del nodo corrente */
    private final Type type;

    /** Nome della variabile (solo per nodi ATOM) */
    private final String name;

    /** Operando unico per nodi unari, operando sinistro per nodi binari */
    private final Formula left;

    /** Operando destro (solo per nodi binari) */
    private final Formula right;

    /** Hash precalcolato: le formule sono chiavi frequenti negli indici dei rami */
    private final int hash;

    //endregion

    //region COSTRUTTORI E FACTORY METHODS

    private Formula(Type type, String name, Formula left, Formula right) {
        this.type = type;
        this.name = name;
        this.left = left;
        this.right = right;
        this.hash = Objects.hash(type, name, left, right);
    }

    /**
     * Crea una variabile proposizionale.
     *
     * @param name identificatore minuscolo (es. p, q1, stato_a)
     * @return nodo ATOM
     * @throws IllegalArgumentException se il nome è null o non è un identificatore minuscolo
     */
    public static Formula atom(String name) {
        if (name == null || !ATOM_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Nome variabile non valido: " + name);
        }
        return new Formula(Type.ATOM, name, null, null);
    }

    public static Formula not(Formula operand) {
        return unary(Type.NOT, operand);
    }

    public static Formula and(Formula left, Formula right) {
        return binary(Type.AND, left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return binary(Type.OR, left, right);
    }

    public static Formula implies(Formula left, Formula right) {
        return binary(Type.IMPLIES, left, right);
    }

    public static Formula box(Formula operand) {
        return unary(Type.BOX, operand);
    }

    public static Formula diamond(Formula operand) {
        return unary(Type.DIAMOND, operand);
    }

    private static Formula unary(Type type, Formula operand) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando per " + type + " non può essere null");
        }
        return new Formula(type, null, operand, null);
    }

    private static Formula binary(Type type, Formula left, Formula right) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("Operandi per " + type + " non possono essere null");
        }
        return new Formula(type, null, left, right);
    }

    //endregion

    //region ACCESSORS

    public Type getType() {
        return type;
    }

    public boolean isAtom() {
        return type == Type.ATOM;
    }

    /**
     * @return nome della variabile
     * @throws IllegalStateException se il nodo non è un atomo
     */
    public String getName() {
        if (type != Type.ATOM) {
            throw new IllegalStateException("Nome disponibile solo per nodi ATOM, nodo corrente: " + type);
        }
        return name;
    }

    /**
     * @return operando dei nodi unari (NOT, BOX, DIAMOND)
     * @throws IllegalStateException se il nodo non è unario
     */
    public Formula getOperand() {
        if (!type.isUnary()) {
            throw new IllegalStateException("Operando disponibile solo per nodi unari, nodo corrente: " + type);
        }
        return left;
    }

    /**
     * @return operando sinistro dei nodi binari
     * @throws IllegalStateException se il nodo non è binario
     */
    public Formula getLeft() {
        if (!type.isBinary()) {
            throw new IllegalStateException("Operando sinistro disponibile solo per nodi binari, nodo corrente: " + type);
        }
        return left;
    }

    /**
     * @return operando destro dei nodi binari
     * @throws IllegalStateException se il nodo non è binario
     */
    public Formula getRight() {
        if (!type.isBinary()) {
            throw new IllegalStateException("Operando destro disponibile solo per nodi binari, nodo corrente: " + type);
        }
        return right;
    }

    //endregion

    //region METRICHE STRUTTURALI

    /**
     * Raccoglie le variabili proposizionali che compaiono nella formula.
     *
     * @return insieme ordinato dei nomi delle variabili
     */
    public Set<String> getAtoms() {
        Set<String> atoms = new TreeSet<>();
        collectAtoms(atoms);
        return atoms;
    }

    private void collectAtoms(Set<String> atoms) {
        switch (type) {
            case ATOM -> atoms.add(name);
            case NOT, BOX, DIAMOND -> left.collectAtoms(atoms);
            case AND, OR, IMPLIES -> {
                left.collectAtoms(atoms);
                right.collectAtoms(atoms);
            }
        }
    }

    /**
     * Profondità modale: massimo numero di operatori modali annidati.
     * Limita la profondità delle catene di mondi generate dal tableau.
     */
    public int modalDepth() {
        return switch (type) {
            case ATOM -> 0;
            case NOT -> left.modalDepth();
            case BOX, DIAMOND -> 1 + left.modalDepth();
            case AND, OR, IMPLIES -> Math.max(left.modalDepth(), right.modalDepth());
        };
    }

    /**
     * Numero totale di nodi dell'albero (atomi inclusi).
     */
    public int size() {
        return switch (type) {
            case ATOM -> 1;
            case NOT, BOX, DIAMOND -> 1 + left.size();
            case AND, OR, IMPLIES -> 1 + left.size() + right.size();
        };
    }

    /**
     * Numero di connettivi (nodi non atomici).
     */
    public int connectiveCount() {
        return switch (type) {
            case ATOM -> 0;
            case NOT, BOX, DIAMOND -> 1 + left.connectiveCount();
            case AND, OR, IMPLIES -> 1 + left.connectiveCount() + right.connectiveCount();
        };
    }

    /**
     * Altezza dell'albero: 0 per un atomo.
     */
    public int depth() {
        return switch (type) {
            case ATOM -> 0;
            case NOT, BOX, DIAMOND -> 1 + left.depth();
            case AND, OR, IMPLIES -> 1 + Math.max(left.depth(), right.depth());
        };
    }

    //endregion

    //region UGUAGLIANZA E RAPPRESENTAZIONE

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Formula other = (Formula) obj;
        return hash == other.hash &&
                type == other.type &&
                Objects.equals(name, other.name) &&
                Objects.equals(left, other.left) &&
                Objects.equals(right, other.right);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    /**
     * Rappresentazione testuale rileggibile dal parser.
     * I connettivi binari sono sempre racchiusi tra parentesi.
     */
    @Override
    public String toString() {
        return switch (type) {
            case ATOM -> name;
            case NOT -> "~" + left;
            case BOX -> "[]" + left;
            case DIAMOND -> "<>" + left;
            case AND -> "(" + left + " & " + right + ")";
            case OR -> "(" + left + " | " + right + ")";
            case IMPLIES -> "(" + left + " -> " + right + ")";
        };
    }

    //endregion
}
