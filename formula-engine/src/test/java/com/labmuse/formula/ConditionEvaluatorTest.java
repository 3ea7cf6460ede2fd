package com.labmuse.formula;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ConditionEvaluatorTest {

    private ConditionEvaluator evaluator;
    private Map<String, Double> bindings;

    @BeforeEach
    public void setup() {
        evaluator = new ConditionEvaluator();
        bindings = new HashMap<>();
    }

    @Test
    public void testFloatingPointEquality() {
        bindings.put("A", 0.1 + 0.2);

        FormulaEvaluation evaluation = evaluator.evaluateFormula(FormulaParser.parseFormula("A == 0.3"), bindings);

        assertTrue(evaluation.isValid());
        assertTrue(evaluation.getResult());
        assertFalse(evaluator.evaluateFormula(FormulaParser.parseFormula("A != 0.3"), bindings).getResult());
    }

    @Test
    public void testConfiguredEpsilon() {
        bindings.put("A", 1.0005);
        ConditionEvaluator loose = new ConditionEvaluator(0.001);

        assertTrue(loose.evaluateFormula(FormulaParser.parseFormula("A == 1"), bindings).getResult());
        assertFalse(evaluator.evaluateFormula(FormulaParser.parseFormula("A == 1"), bindings).getResult());
    }

    @Test
    public void testLeftToRightFoldWithoutPrecedence() {
        bindings.put("A", 2.0);
        bindings.put("B", 0.0);
        bindings.put("C", 0.0);

        // (true OR false) AND false
        assertFalse(evaluator.evaluateFormula(
                FormulaParser.parseFormula("A > 1 OR B > 1 AND C > 1"), bindings).getResult());

        bindings.put("A", 0.0);
        bindings.put("C", 2.0);
        // (false AND false) OR true
        assertTrue(evaluator.evaluateFormula(
                FormulaParser.parseFormula("A > 1 AND B > 1 OR C > 1"), bindings).getResult());
    }

    @Test
    public void testFirstConditionResultsReported() {
        bindings.put("A", 60.0);
        bindings.put("B", 5.0);

        FormulaEvaluation evaluation = evaluator.evaluateFormula(
                FormulaParser.parseFormula("A > 50 AND B < 10"), bindings);

        assertTrue(evaluation.getResult());
        assertEquals(60.0, evaluation.getLeftResult());
        assertEquals(50.0, evaluation.getRightResult());
        assertEquals(2, evaluation.getConditionResults().size());
    }

    @Test
    public void testStrictModePropagatesFailure() {
        bindings.put("A", 1.0);
        List<Condition> conditions = FormulaParser.parseFormula("A > 0 AND Missing > 0");

        assertThrows(VariableNotFoundException.class, () -> evaluator.evaluateFormula(conditions, bindings));
    }

    @Test
    public void testLenientModeCountsFailureAsFalse() {
        bindings.put("A", 1.0);
        List<Condition> conditions = FormulaParser.parseFormula("Missing > 0 OR A > 0");

        FormulaEvaluation evaluation = evaluator.evaluateFormula(conditions, bindings, true);

        assertTrue(evaluation.getResult());
        assertFalse(evaluation.getConditionResults().get(0).holds());
        assertNull(evaluation.getLeftResult());
    }

    @Test
    public void testMissingVariablesCollected() {
        bindings.put("A", 5.0);

        FormulaEvaluation evaluation = evaluator.evaluateFormula(
                FormulaParser.parseFormula("(A + Missing) > 1"), bindings);

        assertTrue(evaluation.getResult());
        assertEquals(List.of("Missing"), evaluation.getMissingVariables());
    }

    @Test
    public void testEvaluateTextRejectsMalformedFormula() {
        FormulaEvaluation evaluation = evaluator.evaluate(">10", bindings);

        assertFalse(evaluation.isValid());
        assertFalse(evaluation.getResult());
        assertEquals("No valid conditions found in formula", evaluation.getMessage());
    }

    @Test
    public void testMissingLogicalOperatorIsMisuse() {
        bindings.put("A", 1.0);
        List<Condition> conditions = List.of(
                new Condition("A", ComparisonOperator.GREATER, "0", null),
                new Condition("A", ComparisonOperator.LESS, "2", null));

        assertThrows(IllegalArgumentException.class, () -> evaluator.evaluateFormula(conditions, bindings));
    }

    @Test
    public void testEmptyConditionListIsInvalid() {
        assertFalse(evaluator.evaluateFormula(List.of(), bindings).isValid());
    }
}
