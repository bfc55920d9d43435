package org.modal.kripke;

import org.modal.formula.Formula;
import org.modal.support.SignedFormula;

import java.util.Collection;

/**
 * Verifica della soddisfazione di formule su un {@link KripkeModel} (semantica K standard).
 *
 * [] φ vale in w se φ vale in ogni successore di w (vacuamente vera senza successori),
 * <> φ vale in w se φ vale in almeno un successore.
 */
public final class ModelChecker {

    private ModelChecker() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static boolean isTrue(KripkeModel model, Formula formula, int world) {
        return switch (formula.getType()) {
            case ATOM -> model.valueOf(world, formula.getName());
            case NOT -> !isTrue(model, formula.getOperand(), world);
            case AND -> isTrue(model, formula.getLeft(), world) && isTrue(model, formula.getRight(), world);
            case OR -> isTrue(model, formula.getLeft(), world) || isTrue(model, formula.getRight(), world);
            case IMPLIES -> !isTrue(model, formula.getLeft(), world) || isTrue(model, formula.getRight(), world);
            case BOX -> model.successorsOf(world).stream()
                    .allMatch(successor -> isTrue(model, formula.getOperand(), successor));
            case DIAMOND -> model.successorsOf(world).stream()
                    .anyMatch(successor -> isTrue(model, formula.getOperand(), successor));
        };
    }

    /**
     * @return true se il valore della formula nel suo mondo coincide con il segno
     */
    public static boolean satisfies(KripkeModel model, SignedFormula signedFormula) {
        return isTrue(model, signedFormula.formula(), signedFormula.world()) == signedFormula.isTrue();
    }

    public static boolean satisfiesAll(KripkeModel model, Collection<SignedFormula> signedFormulas) {
        return signedFormulas.stream().allMatch(signedFormula -> satisfies(model, signedFormula));
    }
}
