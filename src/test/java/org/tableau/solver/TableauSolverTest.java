package org.tableau.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.tableau.formula.Formula;
import org.tableau.formula.FormulaParser;
import org.tableau.support.Tableau.SearchOrder;
import org.tableau.support.Theory;

import static org.junit.jupiter.api.Assertions.*;
import static org.tableau.formula.Formula.biimplication;
import static org.tableau.formula.Formula.conjunction;
import static org.tableau.formula.Formula.disjunction;
import static org.tableau.formula.Formula.implication;
import static org.tableau.formula.Formula.negation;
import static org.tableau.formula.Formula.variable;

@DisplayName("TableauSolver Tests")
class TableauSolverTest {

    private final TableauSolver solver = new TableauSolver();

    // ========== Verdicts ==========

    @ParameterizedTest(name = "{0} -> sat={1}, valid={2}")
    @CsvSource(delimiter = ';', value = {
            "a;true;false",
            "(-a);true;false",
            "(a^(-a));false;false",
            "(a|(-a));true;true",
            "(a->a);true;true",
            "(a<->a);true;true",
            "(a^b);true;false",
            "(a->b);true;false",
            "((a^b)->a);true;true",
            "(-(-a));true;false",
            "(-(a<->b));true;false",
            "((a<->b)^(a^(-b)));false;false",
            "((a|b)^((-a)^(-b)));false;false",
            "((a<->b)<->(b<->a));true;true",
            "(((a->b)^(b->c))->(a->c));true;true",
            "(((a->b)->a)->a);true;true",
            "((-(a^b))<->((-a)|(-b)));true;true",
            "((a->b)<->((-b)->(-a)));true;true",
            "((a|b)->a);true;false"
    })
    @DisplayName("Should decide satisfiability and validity")
    void testVerdicts(String text, boolean satisfiable, boolean valid) {
        Formula formula = FormulaParser.parse(text);

        assertEquals(satisfiable, solver.isSatisfiable(formula));
        assertEquals(valid, solver.isValid(formula));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "a", "(a^(-a))", "(a|(-a))", "(a->b)", "(a<->b)", "(-(a<->(-b)))",
            "((a|b)^(c->(-a)))", "(((p^q)|(-r))<->(p->(q|r)))"
    })
    @DisplayName("A formula is valid iff its negation is unsatisfiable")
    void testValidityIsUnsatisfiableNegation(String text) {
        Formula formula = FormulaParser.parse(text);
        assertEquals(!solver.isSatisfiable(negation(formula)), solver.isValid(formula));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "(a^(-a))", "(a|(-a))", "((a<->b)^(a^(-b)))", "(((a->b)^(b->c))->(a->c))",
            "((a|b)^((-a)^(-b)))", "(((p^q)|(-r))<->(p->(q|r)))"
    })
    @DisplayName("Breadth-first and depth-first search agree")
    void testSearchOrdersAgree(String text) {
        Formula formula = FormulaParser.parse(text);
        TableauSolver bfs = new TableauSolver(0, SearchOrder.BREADTH_FIRST);
        TableauSolver dfs = new TableauSolver(0, SearchOrder.DEPTH_FIRST);

        assertEquals(bfs.isSatisfiable(formula), dfs.isSatisfiable(formula));
        assertEquals(bfs.isValid(formula), dfs.isValid(formula));
    }

    // ========== Results ==========

    @Test
    @DisplayName("Open branch of a satisfiable result satisfies the formula's literals")
    void testOpenBranch() {
        Formula formula = FormulaParser.parse("((a^(-b))|c)");
        TableauResult result = solver.solve(formula);

        assertTrue(result.isSatisfiable());
        assertEquals(SearchState.SATISFIABLE, result.getState());
        Theory branch = result.getOpenBranch();
        assertTrue(branch.isFullyExpanded());
        assertFalse(branch.hasContradiction());
        assertEquals(formula, result.getFormula());
    }

    @Test
    @DisplayName("Unsatisfiable result has no open branch and counts closed branches")
    void testUnsatisfiableStatistics() {
        TableauResult result = solver.solve(FormulaParser.parse("(a^(-a))"));

        assertFalse(result.isSatisfiable());
        assertNull(result.getOpenBranch());

        TableauStatistics statistics = result.getStatistics();
        assertEquals(1, statistics.getTheoriesProcessed());
        assertEquals(1, statistics.getAlphaExpansions());
        assertEquals(0, statistics.getBetaExpansions());
        assertEquals(1, statistics.getClosedBranches());
        assertTrue(statistics.isTimerStopped());
    }

    @Test
    @DisplayName("Beta expansion closes both branches of (a^(-a))|(b^(-b))")
    void testBetaBranchesClose() {
        Formula formula = FormulaParser.parse("((a^(-a))|(b^(-b)))");
        TableauResult result = solver.solve(formula);

        assertFalse(result.isSatisfiable());
        assertEquals(1, result.getStatistics().getBetaExpansions());
        assertEquals(2, result.getStatistics().getClosedBranches());
    }

    @Test
    @DisplayName("Set-equal branches are enqueued only once")
    void testDuplicateBranchesDiscarded() {
        // (a|b) produce {a, (b|a)} e {b, (b|a)}; da (b|a) si ottiene di nuovo {b, a}
        TableauResult result = solver.solve(FormulaParser.parse("((a|b)^(b|a))"));

        assertTrue(result.isSatisfiable());
        assertEquals(1, result.getStatistics().getDuplicateBranches());
    }

    @Test
    @DisplayName("Validity check searches the negation")
    void testCheckValidity() {
        Formula formula = FormulaParser.parse("(a->b)");
        TableauResult result = solver.checkValidity(formula);

        assertEquals(negation(formula), result.getFormula());
        assertTrue(result.isSatisfiable());
        // Controesempio: a vero, b falso
        assertTrue(result.getOpenBranch().contains(variable("a")));
        assertTrue(result.getOpenBranch().contains(negation(variable("b"))));
    }

    // ========== Termination and limits ==========

    @Test
    @DisplayName("Search terminates on larger nested formulas")
    void testTerminationOnNestedFormula() {
        // (x0<->x1) ^ (x1<->x2) ^ ... ^ (x0 ^ (-x4)) : insoddisfacibile
        Formula chain = conjunction(variable("x0"), negation(variable("x4")));
        for (int i = 0; i < 4; i++) {
            chain = conjunction(biimplication(variable("x" + i), variable("x" + (i + 1))), chain);
        }

        TableauSolver bounded = new TableauSolver(1_000_000, SearchOrder.BREADTH_FIRST);
        TableauResult result = bounded.solve(chain);

        assertFalse(result.isSatisfiable());
        assertTrue(result.getStatistics().getTheoriesProcessed() > 0);
    }

    @Test
    @DisplayName("Disjunction of many variables is satisfiable in both orders")
    void testWideDisjunction() {
        Formula wide = variable("v0");
        for (int i = 1; i < 12; i++) {
            wide = disjunction(wide, implication(variable("v" + i), negation(variable("v" + i))));
        }

        assertTrue(new TableauSolver(0, SearchOrder.DEPTH_FIRST).isSatisfiable(wide));
        assertTrue(new TableauSolver(0, SearchOrder.BREADTH_FIRST).isSatisfiable(wide));
    }

    @Test
    @DisplayName("Branch limit aborts the search")
    void testBranchLimit() {
        TableauSolver limited = new TableauSolver(1, SearchOrder.BREADTH_FIRST);

        TableauAbortedException e = assertThrows(TableauAbortedException.class,
                () -> limited.solve(FormulaParser.parse("(a^b)")));
        assertEquals(TableauAbortedException.Reason.BRANCH_LIMIT_EXCEEDED, e.getReason());
        assertEquals(2, e.getStatistics().getTheoriesProcessed());
    }

    @Test
    @DisplayName("Interrupt request on an idle solver does not affect the next search")
    void testInterruptRequestOnIdleSolver() {
        TableauSolver reused = new TableauSolver();
        assertTrue(reused.isSatisfiable(variable("a")));

        reused.interrupt();

        assertTrue(reused.isSatisfiable(variable("b")));
        assertFalse(reused.isValid(variable("b")));
    }

    @Test
    @DisplayName("Thread interruption aborts the search")
    void testThreadInterruption() {
        Thread.currentThread().interrupt();
        try {
            TableauAbortedException e = assertThrows(TableauAbortedException.class,
                    () -> solver.solve(variable("a")));
            assertEquals(TableauAbortedException.Reason.INTERRUPTED, e.getReason());
        } finally {
            Thread.interrupted();
        }
    }

    // ========== Argument validation ==========

    @Test
    @DisplayName("Should reject invalid arguments")
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new TableauSolver(-1, SearchOrder.BREADTH_FIRST));
        assertThrows(IllegalArgumentException.class, () -> new TableauSolver(0, null));
        assertThrows(IllegalArgumentException.class, () -> solver.solve(null));
        assertThrows(IllegalArgumentException.class, () -> solver.isValid(null));
    }
}
