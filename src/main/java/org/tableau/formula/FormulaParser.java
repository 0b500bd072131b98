package org.tableau.formula;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;
import org.tableau.antlr.PropositionalFormulaLexer;
import org.tableau.antlr.PropositionalFormulaParser;

import java.util.logging.Logger;

/**
 * PARSER FORMULE - Da testo a Formula tramite la pipeline ANTLR
 *
 * Lexing -> Parsing -> Visitor. Accetta la grammatica completamente parentesizzata
 * con le grafie alternative degli operatori:
 * • negazione: - oppure ~
 * • congiunzione: ^ oppure &
 * • disgiunzione: |
 * • implicazione: -> oppure =>
 * • biimplicazione: <-> oppure <=>
 *
 * Gli errori di lexer e parser non vengono recuperati: il primo errore interrompe
 * la lettura con una FormulaParseException.
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    private FormulaParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Legge una formula dalla sua forma testuale.
     *
     * @param text formula in notazione completamente parentesizzata
     * @return albero Formula corrispondente
     * @throws FormulaParseException EMPTY_FORMULA per input vuoto, ILL_FORMED_FORMULA
     *                               per input non conforme alla grammatica
     */
    public static Formula parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw FormulaParseException.emptyFormula();
        }

        // Setup pipeline ANTLR
        CharStream input = CharStreams.fromString(text);
        PropositionalFormulaLexer lexer = new PropositionalFormulaLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(FailFastErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        PropositionalFormulaParser parser = new PropositionalFormulaParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(FailFastErrorListener.INSTANCE);

        // Parsing e costruzione dell'albero Formula
        ParseTree tree = parser.formula();
        Formula formula = new FormulaBuilder().visit(tree);

        LOGGER.fine("Formula letta: " + formula);
        return formula;
    }

    /**
     * Trasforma il primo errore sintattico o lessicale in FormulaParseException.
     */
    private static final class FailFastErrorListener extends BaseErrorListener {

        static final FailFastErrorListener INSTANCE = new FailFastErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            throw FormulaParseException.illFormed(msg, charPositionInLine);
        }
    }
}
