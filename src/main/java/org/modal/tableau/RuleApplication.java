package org.modal.tableau;

import org.modal.support.SignedFormula;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Traccia di una singola applicazione di regola su un ramo.
 *
 * @param kind famiglia della regola applicata
 * @param source formula segnata consumata dalla regola
 * @param produced formule aggiunte (per β: le alternative, una per ramo figlio)
 * @param targetWorld mondo successore per le regole esistenziali, -1 altrimenti
 * @param reusedWorld true se la regola esistenziale ha riusato un mondo esistente (blocking)
 */
public record RuleApplication(RuleKind kind, SignedFormula source, List<SignedFormula> produced,
                              int targetWorld, boolean reusedWorld) {

    public RuleApplication {
        if (kind == null || source == null) {
            throw new IllegalArgumentException("Tipo regola e formula sorgente non possono essere null");
        }
        produced = produced == null ? List.of() : List.copyOf(produced);
    }

    @Override
    public String toString() {
        String producedText = produced.stream()
                .map(SignedFormula::toString)
                .collect(Collectors.joining(kind == RuleKind.BETA ? "  |  " : ", "));

        return switch (kind) {
            case MODAL_EXISTS -> reusedWorld
                    ? String.format("[%s] %s  =>  w%d riusato (blocking), arco w%d -> w%d",
                        kind.getSymbol(), source, targetWorld, source.world(), targetWorld)
                    : String.format("[%s] %s  =>  nuovo mondo w%d, arco w%d -> w%d: %s",
                        kind.getSymbol(), source, targetWorld, source.world(), targetWorld, producedText);
            default -> String.format("[%s] %s  =>  %s", kind.getSymbol(), source, producedText);
        };
    }
}
