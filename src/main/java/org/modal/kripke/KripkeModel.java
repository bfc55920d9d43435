package org.modal.kripke;

import org.modal.support.AccessibilityEdge;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * MODELLO DI KRIPKE - Mondi, relazione di accessibilità e valutazione degli atomi
 *
 * COMPONENTI:
 * • worlds: insieme finito di mondi (identificatori interi)
 * • accessibility: relazione orientata, senza chiusure (logica K)
 * • valuation: valori degli atomi vincolati dal ramo, per mondo
 * • atoms: tutte le variabili del modello; quelle non vincolate in un mondo valgono false
 *
 * Il modello è in sola lettura una volta costruito.
 */
public class KripkeModel {

    private final SortedSet<Integer> worlds;
    private final Map<Integer, SortedSet<Integer>> accessibility;
    private final Map<Integer, Map<String, Boolean>> valuation;
    private final SortedSet<String> atoms;

    /**
     * @param worlds mondi del modello (almeno uno)
     * @param edges archi di accessibilità tra mondi del modello (duplicati ignorati)
     * @param valuation valori vincolati: mondo -> (atomo -> valore)
     * @param atoms variabili del modello, devono includere quelle della valutazione
     */
    public KripkeModel(Collection<Integer> worlds, Collection<AccessibilityEdge> edges,
                       Map<Integer, Map<String, Boolean>> valuation, Collection<String> atoms) {
        if (worlds == null || worlds.isEmpty()) {
            throw new IllegalArgumentException("Un modello di Kripke richiede almeno un mondo");
        }
        if (edges == null || valuation == null || atoms == null) {
            throw new IllegalArgumentException("Archi, valutazione e atomi non possono essere null");
        }

        this.worlds = Collections.unmodifiableSortedSet(new TreeSet<>(worlds));
        this.atoms = Collections.unmodifiableSortedSet(new TreeSet<>(atoms));

        Map<Integer, SortedSet<Integer>> relation = new TreeMap<>();
        for (AccessibilityEdge edge : edges) {
            requireWorld(edge.from());
            requireWorld(edge.to());
            relation.computeIfAbsent(edge.from(), key -> new TreeSet<>()).add(edge.to());
        }
        this.accessibility = relation;

        Map<Integer, Map<String, Boolean>> values = new TreeMap<>();
        for (Map.Entry<Integer, Map<String, Boolean>> entry : valuation.entrySet()) {
            requireWorld(entry.getKey());
            for (String atom : entry.getValue().keySet()) {
                if (!this.atoms.contains(atom)) {
                    throw new IllegalArgumentException("Atomo '" + atom + "' valutato ma non dichiarato nel modello");
                }
            }
            values.put(entry.getKey(), Collections.unmodifiableMap(new TreeMap<>(entry.getValue())));
        }
        this.valuation = values;
    }

    private void requireWorld(int world) {
        if (!worlds.contains(world)) {
            throw new IllegalArgumentException("Mondo w" + world + " non presente nel modello");
        }
    }

    //region STRUTTURA

    public SortedSet<Integer> getWorlds() {
        return worlds;
    }

    public SortedSet<String> getAtoms() {
        return atoms;
    }

    public SortedSet<Integer> successorsOf(int world) {
        requireWorld(world);
        SortedSet<Integer> successors = accessibility.get(world);
        return successors == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(successors);
    }

    public boolean isAccessible(int from, int to) {
        return successorsOf(from).contains(to);
    }

    /**
     * @return archi in ordine (from, to), ciascuno una sola volta
     */
    public List<AccessibilityEdge> getEdges() {
        List<AccessibilityEdge> edges = new ArrayList<>();
        accessibility.forEach((from, successors) -> successors.forEach(to -> edges.add(new AccessibilityEdge(from, to))));
        return edges;
    }

    //endregion

    //region VALUTAZIONE

    /**
     * @return valore dell'atomo nel mondo; false se non vincolato o sconosciuto
     */
    public boolean valueOf(int world, String atom) {
        requireWorld(world);
        Map<String, Boolean> values = valuation.get(world);
        return values != null && Boolean.TRUE.equals(values.get(atom));
    }

    /**
     * @return true se il ramo ha fissato esplicitamente il valore dell'atomo nel mondo
     */
    public boolean isConstrained(int world, String atom) {
        requireWorld(world);
        Map<String, Boolean> values = valuation.get(world);
        return values != null && values.containsKey(atom);
    }

    public SortedSet<String> trueAtomsAt(int world) {
        SortedSet<String> result = new TreeSet<>();
        for (String atom : atoms) {
            if (valueOf(world, atom)) {
                result.add(atom);
            }
        }
        return result;
    }

    //endregion

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append("Mondi: ");
        output.append(worlds.stream().map(world -> "w" + world).collect(Collectors.joining(", "))).append("\n");

        List<AccessibilityEdge> edges = getEdges();
        output.append("Accessibilità: ");
        output.append(edges.isEmpty() ? "nessun arco" : edges.stream().map(AccessibilityEdge::toString).collect(Collectors.joining(", ")));
        output.append("\n");

        output.append("Valutazione:\n");
        for (int world : worlds) {
            output.append("  w").append(world).append(": ");
            if (atoms.isEmpty()) {
                output.append("nessuna variabile");
            }
            List<String> values = new ArrayList<>();
            for (String atom : atoms) {
                String value = valueOf(world, atom) ? "vero" : "falso";
                values.add(atom + "=" + value + (isConstrained(world, atom) ? "" : " (libera)"));
            }
            output.append(String.join(", ", values)).append("\n");
        }
        return output.toString();
    }
}
