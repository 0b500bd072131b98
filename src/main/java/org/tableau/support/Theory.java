package org.tableau.support;

import org.tableau.formula.Formula;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * TEORIA - Insieme di formule che rappresenta un ramo del tableau
 *
 * Un ramo è soddisfacibile se lo è la congiunzione di tutte le sue formule.
 * Le formule sono deduplicate per uguaglianza strutturale e mantengono l'ordine
 * di inserimento, così la scelta del prossimo non-letterale è deterministica.
 *
 * STATI DEL RAMO:
 * • Completamente espanso: contiene solo letterali
 * • Chiuso: contiene un letterale e la sua negazione (a e (-a))
 * • Aperto: completamente espanso e non chiuso, quindi la formula di partenza
 *   è soddisfacibile
 *
 * Due teorie sono uguali se contengono le stesse formule, in qualunque ordine.
 * Ogni nuovo ramo nasce da una copia indipendente: i rami fratelli non
 * condividono stato modificabile.
 */
public class Theory {

    private static final Logger LOGGER = Logger.getLogger(Theory.class.getName());

    /** Formule del ramo in ordine di inserimento */
    private final LinkedHashSet<Formula> formulas;

    //region COSTRUZIONE

    private Theory() {
        this.formulas = new LinkedHashSet<>();
    }

    /**
     * Copia indipendente di un'altra teoria.
     *
     * @param other teoria da copiare (non null)
     */
    public Theory(Theory other) {
        if (other == null) {
            throw new IllegalArgumentException("Teoria da copiare non può essere null");
        }
        this.formulas = new LinkedHashSet<>(other.formulas);
    }

    /**
     * Teoria con la sola formula di partenza.
     *
     * @param formula formula radice del ramo (non null)
     * @return nuova teoria {formula}
     */
    public static Theory of(Formula formula) {
        Theory theory = new Theory();
        theory.add(formula);
        return theory;
    }

    //endregion

    //region OPERAZIONI SULLE FORMULE

    /**
     * Aggiunge una formula; nessun effetto se già presente.
     *
     * @param formula formula da aggiungere (non null)
     */
    public void add(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula null non ammessa in una teoria");
        }
        formulas.add(formula);
    }

    /**
     * Sostituisce una formula con le sue espansioni.
     * Nessun effetto se la formula da sostituire non è presente.
     *
     * @param existing formula da rimuovere
     * @param replacements una o due formule prodotte dall'espansione
     */
    public void replace(Formula existing, Collection<Formula> replacements) {
        if (!formulas.remove(existing)) {
            LOGGER.finest("Sostituzione ignorata, formula assente: " + existing);
            return;
        }
        for (Formula replacement : replacements) {
            add(replacement);
        }
    }

    public boolean contains(Formula formula) {
        return formulas.contains(formula);
    }

    public int size() {
        return formulas.size();
    }

    /**
     * @return vista non modificabile delle formule, in ordine di inserimento
     */
    public Set<Formula> getFormulas() {
        return Collections.unmodifiableSet(formulas);
    }

    //endregion

    //region INTERROGAZIONI SUL RAMO

    /**
     * Vero se ogni formula del ramo è un letterale.
     */
    public boolean isFullyExpanded() {
        for (Formula formula : formulas) {
            if (!formula.isLiteral()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Verifica se il ramo è chiuso, cioè se contiene sia a che (-a) per qualche
     * variabile a.
     *
     * Una sola scansione delle formule: per ogni variabile si registra se è comparsa
     * in forma positiva e/o negativa, fermandosi al primo conflitto. Le formule che
     * non sono letterali vengono saltate, quindi {a, (-(-a))} non è chiuso.
     *
     * Tempo O(n) sulle formule, spazio O(k) sulle variabili dei letterali.
     *
     * @return true se esiste una coppia letterale/negazione
     */
    public boolean hasContradiction() {
        // Variabile -> polarità già incontrate
        Map<String, Polarity> occurrences = new HashMap<>();

        for (Formula formula : formulas) {
            if (!formula.isLiteral()) {
                continue;
            }

            boolean positive = formula.isPositiveLiteral();
            Polarity polarity = occurrences.computeIfAbsent(formula.getLiteralName(), name -> new Polarity());

            if (positive ? polarity.negative : polarity.positive) {
                LOGGER.finest("Contraddizione su " + formula.getLiteralName());
                return true;
            }

            if (positive) {
                polarity.positive = true;
            } else {
                polarity.negative = true;
            }
        }

        return false;
    }

    /**
     * Primo non-letterale in ordine di inserimento.
     *
     * @return formula da espandere, vuoto se il ramo è completamente espanso
     */
    public Optional<Formula> selectNonLiteral() {
        for (Formula formula : formulas) {
            if (!formula.isLiteral()) {
                return Optional.of(formula);
            }
        }
        return Optional.empty();
    }

    //endregion

    //region UGUAGLIANZA E HASH

    /**
     * Uguaglianza insiemistica: l'ordine di inserimento non conta.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Theory other = (Theory) obj;
        return formulas.equals(other.formulas);
    }

    @Override
    public int hashCode() {
        return formulas.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder result = new StringBuilder("{");
        boolean first = true;
        for (Formula formula : formulas) {
            if (!first) {
                result.append(", ");
            }
            result.append(formula);
            first = false;
        }
        return result.append("}").toString();
    }

    //endregion

    /** Polarità osservate per una variabile durante la ricerca di contraddizioni */
    private static final class Polarity {
        boolean positive;
        boolean negative;
    }
}
