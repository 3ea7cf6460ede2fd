package com.labmuse.formula;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FormulaValidatorTest {

    private FormulaValidator validator;
    private List<String> available;

    @BeforeEach
    public void setup() {
        validator = new FormulaValidator();
        available = List.of("A", "B", "C", "D", "E", "F");
    }

    @Test
    public void testValidTableFormula() {
        ValidationResult result = validator.validate("A > 10", available, FormulaScope.TABLE);

        assertTrue(result.isValid());
        assertNull(result.getError());
        assertEquals("A", result.getTargetVariable());
        assertEquals(List.of("A"), result.getLeftVariables());
        assertTrue(result.getRightVariables().isEmpty());
        assertEquals(1, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).contains("'A'"));
    }

    @Test
    public void testBothSidesMultipleRejected() {
        ValidationResult result = validator.validate("(A + B) > (C + D)", available, FormulaScope.TABLE);

        assertFalse(result.isValid());
        assertTrue(result.getError().contains("multiple variables"));
    }

    @Test
    public void testMissingVariableReported() {
        ValidationResult result = validator.validate("A > C", List.of("A", "B"), FormulaScope.TABLE);

        assertFalse(result.isValid());
        assertEquals(List.of("C"), result.getMissingVariables());
    }

    @Test
    public void testShortReferenceResolvedBySubstring() {
        ValidationResult result = validator.validate("pH > 7", List.of("pH Değeri", "İletkenlik"), FormulaScope.TABLE);

        assertTrue(result.isValid());
        assertEquals("pH Değeri", result.getTargetVariable());
    }

    @Test
    public void testRedundantParenthesesAroundTarget() {
        ValidationResult result = validator.validate("((A)) > 5", available, FormulaScope.TABLE);

        assertTrue(result.isValid());
        assertEquals("A", result.getTargetVariable());
    }

    @Test
    public void testMalformedFormulas() {
        assertFalse(validator.validate("", available, FormulaScope.TABLE).isValid());
        assertFalse(validator.validate(null, available, FormulaScope.TABLE).isValid());

        ValidationResult result = validator.validate(">10", available, FormulaScope.TABLE);
        assertFalse(result.isValid());
        assertEquals("No valid conditions found in formula", result.getError());
    }

    @Test
    public void testTableScopeSingleCondition() {
        ValidationResult result = validator.validate("A > 1 AND B > 2", available, FormulaScope.TABLE);

        assertFalse(result.isValid());
        assertTrue(result.getError().contains("only one condition"));
        assertTrue(validator.validate("A > 1 AND B > 2", available, FormulaScope.WORKSPACE).isValid());
    }

    @Test
    public void testArithmeticOnTargetSideRejected() {
        assertFalse(validator.validate("(A * 2) > 10", available, FormulaScope.TABLE).isValid());
    }

    @Test
    public void testDryRunCatchesDivisionByZero() {
        ValidationResult result = validator.validate("A > (B / (C - D))", available, FormulaScope.TABLE);

        assertFalse(result.isValid());
        assertTrue(result.getError().startsWith("Formula cannot be evaluated"));
    }

    @Test
    public void testWorkspaceHeuristicWarnings() {
        ValidationResult conditions = validator.validate("A > 1 AND B > 1 AND C > 1 AND D > 1",
                available, FormulaScope.WORKSPACE);
        assertTrue(conditions.isValid());
        assertEquals(1, conditions.getWarnings().size());
        assertTrue(conditions.getWarnings().get(0).contains("4 conditions"));

        ValidationResult variables = validator.validate("(A + B + C) > (D + E + F)",
                available, FormulaScope.WORKSPACE);
        assertTrue(variables.isValid());
        assertNull(variables.getTargetVariable());
        assertTrue(variables.getWarnings().get(0).contains("6 variables"));
    }

    @Test
    public void testScopeConstraints() {
        List<String> tables = List.of("t1", "t2");

        assertTrue(validator.validateScopeConstraints(
                new Formula("1", "w", "A > 1", null, FormulaScope.WORKSPACE, null), tables).isValid());
        assertFalse(validator.validateScopeConstraints(
                new Formula("2", "w", "A > 1", null, FormulaScope.WORKSPACE, "t1"), tables).isValid());
        assertTrue(validator.validateScopeConstraints(
                new Formula("3", "t", "A > 1", null, FormulaScope.TABLE, "t2"), tables).isValid());
        assertFalse(validator.validateScopeConstraints(
                new Formula("4", "t", "A > 1", null, FormulaScope.TABLE, null), tables).isValid());
        assertFalse(validator.validateScopeConstraints(
                new Formula("5", "t", "A > 1", null, FormulaScope.TABLE, "t9"), tables).isValid());
    }
}
