package org.tableau.formula;

import org.tableau.antlr.PropositionalFormulaBaseVisitor;
import org.tableau.antlr.PropositionalFormulaParser.BiimplicationContext;
import org.tableau.antlr.PropositionalFormulaParser.ConjunctionContext;
import org.tableau.antlr.PropositionalFormulaParser.DisjunctionContext;
import org.tableau.antlr.PropositionalFormulaParser.FormulaContext;
import org.tableau.antlr.PropositionalFormulaParser.ImplicationContext;
import org.tableau.antlr.PropositionalFormulaParser.NegationContext;
import org.tableau.antlr.PropositionalFormulaParser.VariableContext;

import java.util.logging.Logger;

/**
 * COSTRUTTORE DI FORMULE - Convertitore da albero sintattico ANTLR a Formula
 *
 * Visitor sulla grammatica PropositionalFormula: ogni alternativa etichettata
 * produce il nodo Formula corrispondente, dalle foglie verso la radice.
 *
 * Nessun connettivo viene riscritto: implicazioni e biimplicazioni restano tali
 * e vengono espanse dalle rispettive regole del tableau.
 */
public class FormulaBuilder extends PropositionalFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaBuilder.class.getName());

    //region PUNTO DI INGRESSO

    /**
     * Radice della grammatica: una sola proposizione seguita da EOF.
     *
     * @param ctx contesto della formula completa
     * @return albero Formula equivalente
     */
    @Override
    public Formula visitFormula(FormulaContext ctx) {
        Formula formula = visit(ctx.proposition());
        LOGGER.fine("Formula costruita dall'albero sintattico: " + formula);
        return formula;
    }

    //endregion

    //region FOGLIE

    @Override
    public Formula visitVariable(VariableContext ctx) {
        String variableName = ctx.VARIABLE().getText();
        LOGGER.finest("Elaborazione variabile atomica: " + variableName);
        return Formula.variable(variableName);
    }

    //endregion

    //region CONNETTIVI

    @Override
    public Formula visitNegation(NegationContext ctx) {
        LOGGER.finest("Elaborazione negazione");
        return Formula.negation(visit(ctx.proposition()));
    }

    @Override
    public Formula visitConjunction(ConjunctionContext ctx) {
        return Formula.conjunction(visit(ctx.proposition(0)), visit(ctx.proposition(1)));
    }

    @Override
    public Formula visitDisjunction(DisjunctionContext ctx) {
        return Formula.disjunction(visit(ctx.proposition(0)), visit(ctx.proposition(1)));
    }

    /**
     * (premessa -> conclusione): il primo operando è la premessa.
     */
    @Override
    public Formula visitImplication(ImplicationContext ctx) {
        return Formula.implication(visit(ctx.proposition(0)), visit(ctx.proposition(1)));
    }

    @Override
    public Formula visitBiimplication(BiimplicationContext ctx) {
        return Formula.biimplication(visit(ctx.proposition(0)), visit(ctx.proposition(1)));
    }

    //endregion
}
