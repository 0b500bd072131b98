package org.tableau.formula;

/**
 * Errore di lettura di una formula testuale. Il motore del tableau non riceve mai
 * una formula che ha prodotto questo errore.
 */
public class FormulaParseException extends IllegalArgumentException {

    /**
     * Categorie di errore riconosciute dal front end testuale.
     */
    public enum ErrorKind {
        EMPTY_FORMULA,          // Input vuoto o composto solo da spazi
        ILL_FORMED_FORMULA      // Input non conforme alla grammatica
    }

    private final ErrorKind kind;

    /** Colonna (0-based) del primo errore, -1 se non applicabile */
    private final int column;

    public FormulaParseException(ErrorKind kind, String message, int column) {
        super(message);
        this.kind = kind;
        this.column = column;
    }

    public static FormulaParseException emptyFormula() {
        return new FormulaParseException(ErrorKind.EMPTY_FORMULA, "Formula vuota", -1);
    }

    public static FormulaParseException illFormed(String detail, int column) {
        return new FormulaParseException(ErrorKind.ILL_FORMED_FORMULA,
                "Formula mal formata alla colonna " + column + ": " + detail, column);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public int getColumn() {
        return column;
    }
}
