package org.tableau;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.tableau.Main.FormulaReport;
import org.tableau.Main.ReportCategory;
import org.tableau.SolverConfiguration.CheckMode;
import org.tableau.SolverConfiguration.InputMode;
import org.tableau.support.Tableau.SearchOrder;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Main Tests")
class MainTest {

    private static SolverConfiguration configuration(CheckMode checkMode, int branchLimit) {
        return new SolverConfiguration(InputMode.INLINE, null, null, null, checkMode,
                SearchOrder.BREADTH_FIRST, SolverConfiguration.DEFAULT_TIMEOUT_SECONDS, branchLimit, false);
    }

    @Test
    @DisplayName("Should skip blank lines and comments")
    void testReadFormulaLines() throws IOException {
        String input = "# formule di prova\n(a^b)\n\n   \n  (a->b)  \n#(x|y)\n";

        List<String> lines = Main.readFormulaLines(new StringReader(input));

        assertEquals(List.of("(a^b)", "(a->b)"), lines);
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "ALL;(a|(-a));SODDISFACIBILE, VALIDA",
            "ALL;(a^(-a));INSODDISFACIBILE, NON VALIDA",
            "ALL;(a->b);SODDISFACIBILE, NON VALIDA",
            "SATISFIABILITY;((a^b)->a);SODDISFACIBILE",
            "VALIDITY;((a^b)->a);VALIDA"
    })
    @DisplayName("Should report verdicts for the requested checks")
    void testVerdicts(CheckMode mode, String text, String verdict) {
        FormulaReport report = Main.evaluateFormula(1, text, configuration(mode, 0));

        assertEquals(ReportCategory.OK, report.category());
        assertEquals(verdict, report.verdict());
    }

    @Test
    @DisplayName("Parse errors are reported by kind without stopping")
    void testParseErrors() {
        FormulaReport illFormed = Main.evaluateFormula(1, "(a ^ b", configuration(CheckMode.ALL, 0));
        assertEquals(ReportCategory.ILL_FORMED_FORMULA, illFormed.category());
        assertTrue(illFormed.verdict().startsWith("ERRORE"));

        FormulaReport empty = Main.evaluateFormula(2, "  ", configuration(CheckMode.ALL, 0));
        assertEquals(ReportCategory.EMPTY_FORMULA, empty.category());
        assertFalse(empty.toReportBlock().contains("Struttura"));
    }

    @Test
    @DisplayName("Branch limit is reported as LIMITE RAMI")
    void testBranchLimitReport() {
        FormulaReport report = Main.evaluateFormula(1, "((a|b)^(c|d))", configuration(CheckMode.SATISFIABILITY, 1));

        assertEquals(ReportCategory.BRANCH_LIMIT, report.category());
        assertEquals("LIMITE RAMI", report.verdict());
    }

    @Test
    @DisplayName("Report block lists verdict, open branch and statistics")
    void testReportBlock() {
        FormulaReport report = Main.evaluateFormula(3, "(a->b)", configuration(CheckMode.ALL, 0));

        String block = report.toReportBlock();
        assertTrue(block.startsWith("Formula 3: (a->b)"));
        assertTrue(block.contains("Ricerca sulla formula: SATISFIABLE"));
        assertTrue(block.contains("Ricerca sulla negazione: SATISFIABLE"));
        assertTrue(block.contains("Struttura: 3 nodi, profondità 1, variabili [a, b]"));
        assertTrue(block.contains("Ramo aperto: {a, (-b)}"));
        assertTrue(block.contains("Teorie elaborate"));
        assertEquals("(a->b)  =>  SODDISFACIBILE, NON VALIDA", report.toConsoleLine());
    }
}
