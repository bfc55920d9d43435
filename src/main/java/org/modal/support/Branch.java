package org.modal.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * RAMO DEL TABLEAU - Stato accumulato lungo un cammino dell'albero
 *
 * Contiene la sequenza ordinata delle formule segnate aggiunte lungo il ramo, i mondi
 * introdotti e la relazione di accessibilità costruita dalle regole modali, insieme ai
 * registri necessari per applicare ogni regola una sola volta.
 *
 * INVARIANTI:
 * • Crescita monotona: nessuna formula segnata viene mai rimossa
 * • Nessun duplicato: ogni formula segnata compare al più una volta
 * • Ogni formula segnata si riferisce a un mondo già presente sul ramo
 * • Chiusura sintattica: il ramo è chiuso se e solo se contiene (φ, T, w) e (φ, F, w)
 *
 * REGISTRI:
 * • expanded: formule α/β già decomposte
 * • fulfilled: formule modali esistenziali (F [] e T <>) già soddisfatte da un successore
 * • loopGuard: formule esistenziali soddisfatte riusando un mondo esistente (blocking)
 *
 * Ogni ramo possiede in esclusiva tutte le proprie strutture: la copia usata per le
 * regole β condivide con l'originale solo le formule, che sono immutabili.
 */
public class Branch {

    //region STRUTTURE DATI

    /** Formule segnate in ordine di accumulazione */
    private final List<SignedFormula> formulas;

    /** Indice per test di appartenenza in tempo costante */
    private final Set<SignedFormula> index;

    /** Mondi introdotti sul ramo */
    private final SortedSet<Integer> worlds;

    /** Relazione di accessibilità: mondo -> successori */
    private final Map<Integer, SortedSet<Integer>> accessibility;

    /** Formule α/β già decomposte */
    private final Set<SignedFormula> expanded;

    /** Formule esistenziali già soddisfatte */
    private final Set<SignedFormula> fulfilled;

    /** Formula esistenziale -> mondo riusato al posto di un mondo nuovo */
    private final Map<SignedFormula, Integer> loopGuard;

    /** Prossimo identificatore libero per un mondo nuovo */
    private int nextWorld;

    /** Numero di applicazioni di regole eseguite sul ramo (ereditate dalle copie) */
    private int appliedSteps;

    /** Formula la cui aggiunta ha chiuso il ramo, null se il ramo è aperto */
    private SignedFormula closingFormula;

    //endregion

    //region COSTRUZIONE

    /**
     * Crea un ramo contenente solo la formula radice, nel suo mondo.
     *
     * @param root formula segnata radice (tipicamente nel mondo 0)
     */
    public Branch(SignedFormula root) {
        if (root == null) {
            throw new IllegalArgumentException("Formula radice non può essere null");
        }

        this.formulas = new ArrayList<>();
        this.index = new HashSet<>();
        this.worlds = new TreeSet<>();
        this.accessibility = new TreeMap<>();
        this.expanded = new HashSet<>();
        this.fulfilled = new HashSet<>();
        this.loopGuard = new LinkedHashMap<>();

        this.worlds.add(root.world());
        this.nextWorld = root.world() + 1;
        add(root);
    }

    /**
     * Copia profonda delle strutture del ramo, usata per le regole β.
     *
     * @param other ramo da copiare
     */
    public Branch(Branch other) {
        this.formulas = new ArrayList<>(other.formulas);
        this.index = new HashSet<>(other.index);
        this.worlds = new TreeSet<>(other.worlds);
        this.accessibility = new TreeMap<>();
        for (Map.Entry<Integer, SortedSet<Integer>> entry : other.accessibility.entrySet()) {
            this.accessibility.put(entry.getKey(), new TreeSet<>(entry.getValue()));
        }
        this.expanded = new HashSet<>(other.expanded);
        this.fulfilled = new HashSet<>(other.fulfilled);
        this.loopGuard = new LinkedHashMap<>(other.loopGuard);
        this.nextWorld = other.nextWorld;
        this.appliedSteps = other.appliedSteps;
        this.closingFormula = other.closingFormula;
    }

    //endregion

    //region FORMULE SEGNATE

    /**
     * Aggiunge una formula segnata in coda al ramo.
     * Se la formula complementare è già presente il ramo diventa chiuso.
     *
     * @param signedFormula formula da aggiungere
     * @return true se la formula era nuova, false se già presente
     * @throws IllegalArgumentException se il mondo della formula non è sul ramo
     */
    public boolean add(SignedFormula signedFormula) {
        if (signedFormula == null) {
            throw new IllegalArgumentException("Formula segnata non può essere null");
        }
        if (!worlds.contains(signedFormula.world())) {
            throw new IllegalArgumentException("Mondo w" + signedFormula.world() + " non presente sul ramo");
        }
        if (!index.add(signedFormula)) {
            return false;
        }

        formulas.add(signedFormula);
        if (closingFormula == null && index.contains(signedFormula.conjugate())) {
            closingFormula = signedFormula;
        }
        return true;
    }

    public boolean contains(SignedFormula signedFormula) {
        return index.contains(signedFormula);
    }

    /**
     * @return vista in sola lettura delle formule in ordine di accumulazione
     */
    public List<SignedFormula> getFormulas() {
        return Collections.unmodifiableList(formulas);
    }

    public int size() {
        return formulas.size();
    }

    /**
     * @return formule segnate del mondo indicato, in ordine di accumulazione
     */
    public List<SignedFormula> formulasAt(int world) {
        List<SignedFormula> result = new ArrayList<>();
        for (SignedFormula signedFormula : formulas) {
            if (signedFormula.world() == world) {
                result.add(signedFormula);
            }
        }
        return result;
    }

    //endregion

    //region CHIUSURA

    public boolean isClosed() {
        return closingFormula != null;
    }

    /**
     * @return coppia (φ, T, w), (φ, F, w) che chiude il ramo, vuota se il ramo è aperto
     */
    public Optional<List<SignedFormula>> getClosingPair() {
        if (closingFormula == null) {
            return Optional.empty();
        }
        SignedFormula positive = closingFormula.isTrue() ? closingFormula : closingFormula.conjugate();
        return Optional.of(List.of(positive, positive.conjugate()));
    }

    //endregion

    //region MONDI E ACCESSIBILITÀ

    /**
     * Crea un mondo nuovo accessibile dal mondo indicato.
     *
     * @param from mondo di partenza (già sul ramo)
     * @return identificatore del nuovo mondo
     */
    public int createWorld(int from) {
        requireWorld(from);
        int world = nextWorld++;
        worlds.add(world);
        addEdge(from, world);
        return world;
    }

    /**
     * Aggiunge l'arco from -> to se non già presente.
     *
     * @return true se l'arco è nuovo
     */
    public boolean addEdge(int from, int to) {
        requireWorld(from);
        requireWorld(to);
        return accessibility.computeIfAbsent(from, key -> new TreeSet<>()).add(to);
    }

    /**
     * @return successori del mondo in ordine crescente (vuoto se nessuno)
     */
    public SortedSet<Integer> successorsOf(int world) {
        SortedSet<Integer> successors = accessibility.get(world);
        return successors == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(successors);
    }

    public SortedSet<Integer> getWorlds() {
        return Collections.unmodifiableSortedSet(worlds);
    }

    public int worldCount() {
        return worlds.size();
    }

    /**
     * @return archi della relazione di accessibilità in ordine (from, to)
     */
    public List<AccessibilityEdge> getEdges() {
        List<AccessibilityEdge> edges = new ArrayList<>();
        for (Map.Entry<Integer, SortedSet<Integer>> entry : accessibility.entrySet()) {
            for (Integer to : entry.getValue()) {
                edges.add(new AccessibilityEdge(entry.getKey(), to));
            }
        }
        return edges;
    }

    private void requireWorld(int world) {
        if (!worlds.contains(world)) {
            throw new IllegalArgumentException("Mondo w" + world + " non presente sul ramo");
        }
    }

    //endregion

    //region REGISTRI DI APPLICAZIONE REGOLE

    public void markExpanded(SignedFormula signedFormula) {
        expanded.add(signedFormula);
    }

    public boolean isExpanded(SignedFormula signedFormula) {
        return expanded.contains(signedFormula);
    }

    public void markFulfilled(SignedFormula signedFormula) {
        fulfilled.add(signedFormula);
    }

    public boolean isFulfilled(SignedFormula signedFormula) {
        return fulfilled.contains(signedFormula);
    }

    /**
     * Registra che la formula esistenziale è stata soddisfatta riusando un mondo esistente.
     */
    public void recordBlocking(SignedFormula existential, int reusedWorld) {
        requireWorld(reusedWorld);
        loopGuard.put(existential, reusedWorld);
        fulfilled.add(existential);
    }

    /**
     * @return registro del loop guard: formula esistenziale -> mondo riusato
     */
    public Map<SignedFormula, Integer> getLoopGuardRecord() {
        return Collections.unmodifiableMap(loopGuard);
    }

    public void incrementAppliedSteps() {
        appliedSteps++;
    }

    public int getAppliedSteps() {
        return appliedSteps;
    }

    //endregion

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append("Ramo[").append(isClosed() ? "chiuso" : "aperto")
                .append(", mondi=").append(worlds)
                .append(", archi=").append(getEdges()).append("]\n");
        for (SignedFormula signedFormula : formulas) {
            output.append("  ").append(signedFormula).append("\n");
        }
        return output.toString();
    }
}
