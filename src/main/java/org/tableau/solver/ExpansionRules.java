package org.tableau.solver;

import org.tableau.formula.Formula;

import static org.tableau.formula.Formula.conjunction;
import static org.tableau.formula.Formula.implication;
import static org.tableau.formula.Formula.negation;

/**
 * TABELLA DELLE REGOLE - Classificazione alfa/beta dei non-letterali
 *
 * REGOLE ALFA (un ramo):
 * • (A^B)        -> A, B
 * • (A<->B)      -> (A->B), (B->A)
 * • (-(-A))      -> A
 * • (-(A|B))     -> (-A), (-B)
 * • (-(A->B))    -> A, (-B)
 *
 * REGOLE BETA (due rami):
 * • (A|B)        -> A / B
 * • (-(A^B))     -> (-A) / (-B)
 * • (A->B)       -> (-A) / B
 * • (-(A<->B))   -> (A^(-B)) / (B^(-A))
 *
 * Ogni formula che non è un letterale ricade in esattamente una riga; i letterali
 * producono Expansion.none(). Gli switch sono esaustivi sull'enum Formula.Type.
 */
public final class ExpansionRules {

    private ExpansionRules() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Espande una formula secondo la tabella delle regole.
     *
     * @param formula formula da espandere (non null)
     * @return espansione ALPHA o BETA, oppure NONE per i letterali
     */
    public static Expansion expand(Formula formula) {
        return switch (formula.getType()) {
            case VARIABLE -> Expansion.none();
            case CONJUNCTION -> Expansion.alpha(formula.getLeft(), formula.getRight());
            case BIIMPLICATION -> Expansion.alpha(
                    implication(formula.getLeft(), formula.getRight()),
                    implication(formula.getRight(), formula.getLeft()));
            case DISJUNCTION -> Expansion.beta(formula.getLeft(), formula.getRight());
            case IMPLICATION -> Expansion.beta(negation(formula.getLeft()), formula.getRight());
            case NEGATION -> expandNegation(formula.getOperand());
        };
    }

    /**
     * Regole per (-F), in base al connettivo principale di F.
     */
    private static Expansion expandNegation(Formula negated) {
        return switch (negated.getType()) {
            // (-a) è un letterale
            case VARIABLE -> Expansion.none();
            case NEGATION -> Expansion.alpha(negated.getOperand());
            case DISJUNCTION -> Expansion.alpha(negation(negated.getLeft()), negation(negated.getRight()));
            case IMPLICATION -> Expansion.alpha(negated.getLeft(), negation(negated.getRight()));
            case CONJUNCTION -> Expansion.beta(negation(negated.getLeft()), negation(negated.getRight()));
            case BIIMPLICATION -> Expansion.beta(
                    conjunction(negated.getLeft(), negation(negated.getRight())),
                    conjunction(negated.getRight(), negation(negated.getLeft())));
        };
    }
}
