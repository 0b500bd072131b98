package org.tableau.solver;

import org.tableau.formula.Formula;

import java.util.List;

/**
 * Risultato dell'applicazione di una regola del tableau a una formula.
 *
 * • ALPHA: una o due formule aggiunte allo stesso ramo
 * • BETA: due formule, ciascuna testa di un nuovo ramo
 * • NONE: nessuna regola applicabile (la formula è un letterale)
 */
public final class Expansion {

    public enum Kind {
        ALPHA,
        BETA,
        NONE
    }

    private static final Expansion NONE = new Expansion(Kind.NONE, List.of());

    private final Kind kind;
    private final List<Formula> formulas;

    private Expansion(Kind kind, List<Formula> formulas) {
        this.kind = kind;
        this.formulas = formulas;
    }

    // Factory methods per creazione type-safe
    public static Expansion alpha(Formula single) {
        return new Expansion(Kind.ALPHA, List.of(single));
    }

    public static Expansion alpha(Formula first, Formula second) {
        return new Expansion(Kind.ALPHA, List.of(first, second));
    }

    public static Expansion beta(Formula first, Formula second) {
        return new Expansion(Kind.BETA, List.of(first, second));
    }

    public static Expansion none() {
        return NONE;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isAlpha() {
        return kind == Kind.ALPHA;
    }

    public boolean isBeta() {
        return kind == Kind.BETA;
    }

    /**
     * @return formule prodotte: 1-2 per ALPHA, esattamente 2 per BETA, nessuna per NONE
     */
    public List<Formula> getFormulas() {
        return formulas;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Expansion other = (Expansion) obj;
        return kind == other.kind && formulas.equals(other.formulas);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + formulas.hashCode();
    }

    @Override
    public String toString() {
        return kind + formulas.toString();
    }
}
