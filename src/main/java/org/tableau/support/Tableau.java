package org.tableau.support;

import org.tableau.formula.Formula;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * TABLEAU - Coda dei rami ancora aperti e non completamente espansi
 *
 * Ogni Theory nella coda è un ramo alternativo dell'albero del tableau.
 * Il risolutore estrae un ramo, lo espande e reinserisce i rami derivati.
 *
 * ORDINE DI VISITA:
 * • BREADTH_FIRST: coda FIFO, ogni ramo viene prima o poi elaborato
 * • DEPTH_FIRST: pila LIFO, scende subito in profondità
 * Entrambi gli ordini danno lo stesso verdetto; cambiano solo il ramo aperto
 * trovato per primo e la dimensione massima della coda.
 *
 * DEDUPLICAZIONE:
 * contains() confronta le teorie per uguaglianza insiemistica tramite un indice
 * hash, in tempo costante. Una teoria inserita non deve più essere modificata
 * finché resta nella coda.
 */
public class Tableau {

    private static final Logger LOGGER = Logger.getLogger(Tableau.class.getName());

    /**
     * Strategia di estrazione dei rami.
     */
    public enum SearchOrder {
        BREADTH_FIRST,
        DEPTH_FIRST
    }

    private final Deque<Theory> theories;

    /** Teoria -> numero di copie uguali presenti nella coda */
    private final Map<Theory, Integer> index;

    private final SearchOrder order;

    //region COSTRUZIONE

    /**
     * Tableau vuoto.
     *
     * @param order strategia di estrazione (non null)
     */
    public Tableau(SearchOrder order) {
        if (order == null) {
            throw new IllegalArgumentException("Ordine di visita non può essere null");
        }
        this.theories = new ArrayDeque<>();
        this.index = new HashMap<>();
        this.order = order;
    }

    /**
     * Tableau in ampiezza con il solo ramo {formula}.
     */
    public static Tableau seeded(Formula formula) {
        return seeded(formula, SearchOrder.BREADTH_FIRST);
    }

    /**
     * Tableau con il solo ramo {formula}.
     *
     * @param formula formula di partenza
     * @param order strategia di estrazione
     * @return tableau con una teoria
     */
    public static Tableau seeded(Formula formula, SearchOrder order) {
        Tableau tableau = new Tableau(order);
        tableau.pushTheory(Theory.of(formula));
        LOGGER.fine("Tableau inizializzato con " + formula + " (" + order + ")");
        return tableau;
    }

    //endregion

    //region OPERAZIONI SULLA CODA

    public boolean isEmpty() {
        return theories.isEmpty();
    }

    public int size() {
        return theories.size();
    }

    public SearchOrder getOrder() {
        return order;
    }

    /**
     * Estrae il prossimo ramo secondo l'ordine di visita.
     *
     * @return ramo estratto, vuoto se il tableau è vuoto
     */
    public Optional<Theory> popTheory() {
        Theory theory = order == SearchOrder.BREADTH_FIRST ? theories.pollFirst() : theories.pollLast();
        if (theory == null) {
            return Optional.empty();
        }
        index.computeIfPresent(theory, (key, count) -> count > 1 ? count - 1 : null);
        return Optional.of(theory);
    }

    /**
     * Accoda un ramo. Il chiamante verifica prima contains() se vuole evitare duplicati.
     *
     * @param theory ramo da accodare (non null)
     */
    public void pushTheory(Theory theory) {
        if (theory == null) {
            throw new IllegalArgumentException("Teoria null non ammessa nel tableau");
        }
        theories.addLast(theory);
        index.merge(theory, 1, Integer::sum);
    }

    /**
     * Verifica se un ramo uguale (stesse formule, qualunque ordine) è già in coda.
     */
    public boolean contains(Theory theory) {
        return index.containsKey(theory);
    }

    //endregion
}
