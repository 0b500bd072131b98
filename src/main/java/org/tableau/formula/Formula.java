package org.tableau.formula;

import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * FORMULA PROPOSIZIONALE - Albero sintattico immutabile
 *
 * Rappresenta una formula della logica proposizionale come albero in cui ogni nodo
 * possiede in modo esclusivo i propri figli. Nessun nodo viene modificato dopo la
 * costruzione: ogni trasformazione (ad esempio le espansioni del tableau) costruisce
 * nodi nuovi.
 *
 * TIPI DI NODO:
 * • VARIABLE: variabile proposizionale (a, p1, stato_2)
 * • NEGATION: (-A)
 * • CONJUNCTION: (A^B)
 * • DISJUNCTION: (A|B)
 * • IMPLICATION: (A->B)
 * • BIIMPLICATION: (A<->B)
 *
 * Uguaglianza e hash sono strutturali (tipo del nodo + figli), mai basati
 * sull'identità: Theory e Tableau deduplicano formule e rami su questa base.
 */
public final class Formula {

    /** Forma ammessa per i nomi delle variabili proposizionali */
    private static final Pattern VARIABLE_NAME = Pattern.compile("[a-zA-Z][a-zA-Z0-9_]*");

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodo dell'albero. L'insieme è chiuso: ogni switch su questo enum
     * è esaustivo.
     */
    public enum Type {
        VARIABLE,       // Variabile atomica: a
        NEGATION,       // Negazione: (-A)
        CONJUNCTION,    // Congiunzione: (A^B)
        DISJUNCTION,    // Disgiunzione: (A|B)
        IMPLICATION,    // Implicazione: (A->B)
        BIIMPLICATION   // Biimplicazione: (A<->B)
    }

    private final Type type;

    /** Nome della variabile (solo per VARIABLE) */
    private final String name;

    /** Figlio sinistro, oppure unico figlio per NEGATION */
    private final Formula left;

    /** Figlio destro (solo per i connettivi binari) */
    private final Formula right;

    /** Hash strutturale, calcolato una volta sola perché il nodo è immutabile */
    private final int hash;

    //endregion

    //region COSTRUZIONE

    private Formula(Type type, String name, Formula left, Formula right) {
        this.type = type;
        this.name = name;
        this.left = left;
        this.right = right;
        this.hash = computeHash();
    }

    /**
     * Costruisce una variabile proposizionale.
     *
     * @param name nome della variabile, conforme a [a-zA-Z][a-zA-Z0-9_]*
     * @return nodo VARIABLE
     * @throws IllegalArgumentException se il nome è null o non valido
     */
    public static Formula variable(String name) {
        if (name == null || !VARIABLE_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Nome variabile non valido: " + name);
        }
        return new Formula(Type.VARIABLE, name, null, null);
    }

    /**
     * Costruisce la negazione di una formula.
     *
     * @param operand formula da negare (non null)
     * @return nodo NEGATION
     */
    public static Formula negation(Formula operand) {
        requireOperand(operand, "negazione");
        return new Formula(Type.NEGATION, null, operand, null);
    }

    public static Formula conjunction(Formula left, Formula right) {
        return binary(Type.CONJUNCTION, left, right);
    }

    public static Formula disjunction(Formula left, Formula right) {
        return binary(Type.DISJUNCTION, left, right);
    }

    /**
     * Costruisce l'implicazione premise -> conclusion.
     */
    public static Formula implication(Formula premise, Formula conclusion) {
        return binary(Type.IMPLICATION, premise, conclusion);
    }

    public static Formula biimplication(Formula left, Formula right) {
        return binary(Type.BIIMPLICATION, left, right);
    }

    private static Formula binary(Type type, Formula left, Formula right) {
        requireOperand(left, type.name());
        requireOperand(right, type.name());
        return new Formula(type, null, left, right);
    }

    private static void requireOperand(Formula operand, String connective) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando null per il connettivo " + connective);
        }
    }

    //endregion

    //region ACCESSORI

    public Type getType() {
        return type;
    }

    /**
     * @return nome della variabile
     * @throws IllegalStateException se il nodo non è una variabile
     */
    public String getName() {
        if (type != Type.VARIABLE) {
            throw new IllegalStateException("Il nodo " + type + " non ha un nome di variabile");
        }
        return name;
    }

    /**
     * @return unico figlio di una negazione
     * @throws IllegalStateException se il nodo non è una negazione
     */
    public Formula getOperand() {
        if (type != Type.NEGATION) {
            throw new IllegalStateException("Il nodo " + type + " non è una negazione");
        }
        return left;
    }

    /**
     * @return figlio sinistro (premessa per le implicazioni)
     * @throws IllegalStateException se il nodo non è binario
     */
    public Formula getLeft() {
        requireBinary();
        return left;
    }

    /**
     * @return figlio destro (conclusione per le implicazioni)
     * @throws IllegalStateException se il nodo non è binario
     */
    public Formula getRight() {
        requireBinary();
        return right;
    }

    public boolean isBinary() {
        return type != Type.VARIABLE && type != Type.NEGATION;
    }

    private void requireBinary() {
        if (!isBinary()) {
            throw new IllegalStateException("Il nodo " + type + " non è un connettivo binario");
        }
    }

    //endregion

    //region LETTERALI

    /**
     * Un letterale è una variabile oppure la negazione di una variabile,
     * con un solo livello di negazione: (-(-a)) non è un letterale.
     */
    public boolean isLiteral() {
        return isPositiveLiteral() || isNegativeLiteral();
    }

    public boolean isPositiveLiteral() {
        return type == Type.VARIABLE;
    }

    public boolean isNegativeLiteral() {
        return type == Type.NEGATION && left.type == Type.VARIABLE;
    }

    /**
     * Nome della variabile sottostante a un letterale (a per a e per (-a)).
     *
     * @throws IllegalStateException se la formula non è un letterale
     */
    public String getLiteralName() {
        if (isPositiveLiteral()) {
            return name;
        }
        if (isNegativeLiteral()) {
            return left.name;
        }
        throw new IllegalStateException("La formula non è un letterale: " + this);
    }

    //endregion

    //region ANALISI STRUTTURALE

    /**
     * Numero di nodi dell'albero.
     */
    public int size() {
        return switch (type) {
            case VARIABLE -> 1;
            case NEGATION -> 1 + left.size();
            case CONJUNCTION, DISJUNCTION, IMPLICATION, BIIMPLICATION -> 1 + left.size() + right.size();
        };
    }

    /**
     * Profondità massima dell'albero (0 per una variabile).
     */
    public int depth() {
        return switch (type) {
            case VARIABLE -> 0;
            case NEGATION -> 1 + left.depth();
            case CONJUNCTION, DISJUNCTION, IMPLICATION, BIIMPLICATION ->
                    1 + Math.max(left.depth(), right.depth());
        };
    }

    /**
     * Variabili distinte che compaiono nella formula, in ordine alfabetico.
     */
    public Set<String> variables() {
        Set<String> variables = new TreeSet<>();
        collectVariables(variables);
        return variables;
    }

    private void collectVariables(Set<String> variables) {
        switch (type) {
            case VARIABLE -> variables.add(name);
            case NEGATION -> left.collectVariables(variables);
            case CONJUNCTION, DISJUNCTION, IMPLICATION, BIIMPLICATION -> {
                left.collectVariables(variables);
                right.collectVariables(variables);
            }
        }
    }

    //endregion

    //region UGUAGLIANZA E HASH

    /**
     * Uguaglianza strutturale: stessa forma e stessi nomi nelle stesse posizioni.
     * L'ordine dei figli conta: (a^b) e (b^a)
     * sono formule distinte.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Formula other = (Formula) obj;
        if (this.type != other.type || this.hash != other.hash) return false;

        return switch (type) {
            case VARIABLE -> name.equals(other.name);
            case NEGATION -> left.equals(other.left);
            case CONJUNCTION, DISJUNCTION, IMPLICATION, BIIMPLICATION ->
                    left.equals(other.left) && right.equals(other.right);
        };
    }

    @Override
    public int hashCode() {
        return hash;
    }

    private int computeHash() {
        int result = type.hashCode();

        switch (type) {
            case VARIABLE -> result = 31 * result + name.hashCode();
            case NEGATION -> result = 31 * result + left.hashCode();
            case CONJUNCTION, DISJUNCTION, IMPLICATION, BIIMPLICATION ->
                    result = 31 * (31 * result + left.hashCode()) + right.hashCode();
        }

        return result;
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Forma testuale completamente parentesizzata, rileggibile dal parser:
     * a, (-a), (a^b), (a|b), (a->b), (a<->b).
     */
    @Override
    public String toString() {
        return switch (type) {
            case VARIABLE -> name;
            case NEGATION -> "(-" + left + ")";
            case CONJUNCTION -> "(" + left + "^" + right + ")";
            case DISJUNCTION -> "(" + left + "|" + right + ")";
            case IMPLICATION -> "(" + left + "->" + right + ")";
            case BIIMPLICATION -> "(" + left + "<->" + right + ")";
        };
    }

    //endregion
}
