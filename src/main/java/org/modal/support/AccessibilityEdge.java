package org.modal.support;

/**
 * Arco orientato della relazione di accessibilità: from -> to.
 *
 * @param from mondo di partenza
 * @param to mondo accessibile
 */
public record AccessibilityEdge(int from, int to) implements Comparable<AccessibilityEdge> {

    public AccessibilityEdge {
        if (from < 0 || to < 0) {
            throw new IllegalArgumentException("Mondi devono essere >= 0, ricevuto: " + from + " -> " + to);
        }
    }

    @Override
    public int compareTo(AccessibilityEdge other) {
        int byFrom = Integer.compare(from, other.from);
        return byFrom != 0 ? byFrom : Integer.compare(to, other.to);
    }

    @Override
    public String toString() {
        return "w" + from + " -> w" + to;
    }
}
