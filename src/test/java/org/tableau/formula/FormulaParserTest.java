package org.tableau.formula;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;
import static org.tableau.formula.Formula.biimplication;
import static org.tableau.formula.Formula.conjunction;
import static org.tableau.formula.Formula.disjunction;
import static org.tableau.formula.Formula.implication;
import static org.tableau.formula.Formula.negation;
import static org.tableau.formula.Formula.variable;

@DisplayName("FormulaParser Tests")
class FormulaParserTest {

    private final Formula a = variable("a");
    private final Formula b = variable("b");

    // ========== Valid input ==========

    @Test
    @DisplayName("Should parse every connective")
    void testParseConnectives() {
        assertEquals(a, FormulaParser.parse("a"));
        assertEquals(negation(a), FormulaParser.parse("(-a)"));
        assertEquals(conjunction(a, b), FormulaParser.parse("(a^b)"));
        assertEquals(disjunction(a, b), FormulaParser.parse("(a|b)"));
        assertEquals(implication(a, b), FormulaParser.parse("(a->b)"));
        assertEquals(biimplication(a, b), FormulaParser.parse("(a<->b)"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "(~a);(-a)",
            "(a & b);(a^b)",
            "(a => b);(a->b)",
            "(a <=> b);(a<->b)",
            "( a\t^  b );(a^b)"
    })
    @DisplayName("Should accept alternative operator spellings and whitespace")
    void testAlternativeSpellings(String input, String canonical) {
        assertEquals(FormulaParser.parse(canonical), FormulaParser.parse(input));
    }

    @Test
    @DisplayName("Should parse nested formulas and read back their rendering")
    void testNestedFormula() {
        Formula expected = implication(
                conjunction(implication(a, b), implication(b, variable("c"))),
                implication(a, variable("c")));

        Formula parsed = FormulaParser.parse("(((a -> b) ^ (b -> c)) -> (a -> c))");

        assertEquals(expected, parsed);
        assertEquals(parsed, FormulaParser.parse(parsed.toString()));
    }

    @Test
    @DisplayName("Should distinguish negation from implication arrows")
    void testNegationInsideImplication() {
        assertEquals(implication(negation(a), negation(b)), FormulaParser.parse("((-a)->(-b))"));
        assertEquals(negation(negation(a)), FormulaParser.parse("(-(-a))"));
    }

    // ========== Errors ==========

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\t"})
    @DisplayName("Should reject blank input as EMPTY_FORMULA")
    void testEmptyFormula(String input) {
        FormulaParseException e = assertThrows(FormulaParseException.class, () -> FormulaParser.parse(input));
        assertEquals(FormulaParseException.ErrorKind.EMPTY_FORMULA, e.getKind());
    }

    @Test
    @DisplayName("Should reject null input as EMPTY_FORMULA")
    void testNullFormula() {
        FormulaParseException e = assertThrows(FormulaParseException.class, () -> FormulaParser.parse(null));
        assertEquals(FormulaParseException.ErrorKind.EMPTY_FORMULA, e.getKind());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "(a ^ b",       // parentesi non chiusa
            "a ^ b",        // connettivo senza parentesi
            "(a)",          // parentesi superflue
            "((a ^ b))",
            "(a ^ b ^ c)",  // connettivo non binario
            "(a ^ b) c",    // token in eccesso
            "a $",          // carattere sconosciuto
            "1a",
            "(-)"
    })
    @DisplayName("Should reject ill-formed input as ILL_FORMED_FORMULA")
    void testIllFormedFormula(String input) {
        FormulaParseException e = assertThrows(FormulaParseException.class, () -> FormulaParser.parse(input));
        assertEquals(FormulaParseException.ErrorKind.ILL_FORMED_FORMULA, e.getKind());
        assertTrue(e.getColumn() >= 0);
    }

    @Test
    @DisplayName("Parse errors are IllegalArgumentExceptions")
    void testExceptionHierarchy() {
        assertThrows(IllegalArgumentException.class, () -> FormulaParser.parse("(a |"));
    }
}
