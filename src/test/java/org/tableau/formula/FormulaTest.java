package org.tableau.formula;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.tableau.formula.Formula.biimplication;
import static org.tableau.formula.Formula.conjunction;
import static org.tableau.formula.Formula.disjunction;
import static org.tableau.formula.Formula.implication;
import static org.tableau.formula.Formula.negation;
import static org.tableau.formula.Formula.variable;

@DisplayName("Formula Tests")
class FormulaTest {

    private final Formula a = variable("a");
    private final Formula b = variable("b");

    // ========== Construction ==========

    @ParameterizedTest
    @ValueSource(strings = {"a", "Z", "p1", "x_2", "longName_42"})
    @DisplayName("Should accept well-formed variable names")
    void testValidVariableNames(String name) {
        assertEquals(name, variable(name).getName());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "1a", "_a", "a-b", "a b"})
    @DisplayName("Should reject malformed variable names")
    void testInvalidVariableNames(String name) {
        assertThrows(IllegalArgumentException.class, () -> variable(name));
    }

    @Test
    @DisplayName("Should reject null names and operands")
    void testNullArguments() {
        assertThrows(IllegalArgumentException.class, () -> variable(null));
        assertThrows(IllegalArgumentException.class, () -> negation(null));
        assertThrows(IllegalArgumentException.class, () -> conjunction(a, null));
        assertThrows(IllegalArgumentException.class, () -> implication(null, b));
    }

    @Test
    @DisplayName("Should expose children according to the node type")
    void testAccessors() {
        Formula imp = implication(a, b);
        assertEquals(Formula.Type.IMPLICATION, imp.getType());
        assertEquals(a, imp.getLeft());
        assertEquals(b, imp.getRight());
        assertTrue(imp.isBinary());

        Formula neg = negation(a);
        assertEquals(a, neg.getOperand());
        assertFalse(neg.isBinary());

        assertThrows(IllegalStateException.class, a::getOperand);
        assertThrows(IllegalStateException.class, neg::getLeft);
        assertThrows(IllegalStateException.class, imp::getName);
    }

    // ========== Literals ==========

    @Test
    @DisplayName("Variable and negated variable are literals")
    void testLiterals() {
        assertTrue(a.isLiteral());
        assertTrue(a.isPositiveLiteral());
        assertTrue(negation(a).isLiteral());
        assertTrue(negation(a).isNegativeLiteral());
        assertEquals("a", negation(a).getLiteralName());
    }

    @Test
    @DisplayName("Double negation and compound formulas are not literals")
    void testNonLiterals() {
        assertFalse(negation(negation(a)).isLiteral());
        assertFalse(negation(conjunction(a, b)).isLiteral());
        assertFalse(disjunction(a, b).isLiteral());
        assertThrows(IllegalStateException.class, () -> disjunction(a, b).getLiteralName());
    }

    // ========== Equality ==========

    @Test
    @DisplayName("Structurally identical formulas are equal with equal hashes")
    void testStructuralEquality() {
        Formula first = biimplication(conjunction(a, negation(b)), variable("c"));
        Formula second = biimplication(conjunction(variable("a"), negation(variable("b"))), variable("c"));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    @DisplayName("Operand order and connective matter for equality")
    void testStructuralInequality() {
        assertNotEquals(conjunction(a, b), conjunction(b, a));
        assertNotEquals(conjunction(a, b), disjunction(a, b));
        assertNotEquals(a, negation(a));
    }

    // ========== Analysis and rendering ==========

    @Test
    @DisplayName("Should compute size, depth and variables")
    void testStructuralAnalysis() {
        Formula formula = implication(conjunction(a, b), negation(a));

        assertEquals(6, formula.size());
        assertEquals(2, formula.depth());
        assertEquals(Set.of("a", "b"), formula.variables());
        assertEquals(0, a.depth());
    }

    @Test
    @DisplayName("Should render the fully parenthesized grammar form")
    void testToString() {
        assertEquals("a", a.toString());
        assertEquals("(-a)", negation(a).toString());
        assertEquals("((a^b)->(-b))", implication(conjunction(a, b), negation(b)).toString());
        assertEquals("((a|b)<->a)", biimplication(disjunction(a, b), a).toString());
    }
}
