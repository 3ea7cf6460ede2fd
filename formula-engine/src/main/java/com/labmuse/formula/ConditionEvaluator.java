package com.labmuse.formula;

import com.labmuse.util.EngineConfig;
import com.labmuse.util.LoggingUtil;

import java.util.*;

/**
 * Evaluates conditions and whole formulas against one set of bindings.
 * <p>
 * Conditions are combined strictly left to right: the logical operator of
 * condition i joins the running result with condition i+1, so
 * {@code a AND b OR c} is {@code (a AND b) OR c} and
 * {@code a OR b AND c} is {@code (a OR b) AND c}.
 */
public class ConditionEvaluator {

    private final ExpressionEvaluator expressionEvaluator = new ExpressionEvaluator();
    private final double epsilon;

    public ConditionEvaluator() {
        this(ComparisonOperator.DEFAULT_EPSILON);
    }

    public ConditionEvaluator(EngineConfig config) {
        this(config.getEqualityEpsilon());
    }

    public ConditionEvaluator(double epsilon) {
        this.epsilon = epsilon;
    }

    public ConditionResult evaluateCondition(Condition condition, Map<String, Double> bindings) {
        ExpressionValue left = expressionEvaluator.evaluate(condition.getLeftExpression(), bindings);
        ExpressionValue right = expressionEvaluator.evaluate(condition.getRightExpression(), bindings);
        boolean holds = condition.getOperator().apply(left.getValue(), right.getValue(), epsilon);

        List<String> missing = new ArrayList<>(left.getMissingVariables());
        for (String name : right.getMissingVariables()) {
            if (!missing.contains(name)) missing.add(name);
        }
        return new ConditionResult(condition, left.getValue(), right.getValue(), holds, missing);
    }

    /**
     * Strict evaluation: the first failing condition propagates its {@link FormulaException}.
     */
    public FormulaEvaluation evaluateFormula(List<Condition> conditions, Map<String, Double> bindings) {
        return evaluateFormula(conditions, bindings, false);
    }

    /**
     * @param lenient when true a condition that fails to evaluate counts as false
     *                instead of aborting the formula
     */
    public FormulaEvaluation evaluateFormula(List<Condition> conditions, Map<String, Double> bindings,
                                             boolean lenient) {
        if (conditions == null || conditions.isEmpty()) {
            return FormulaEvaluation.invalid("No conditions to evaluate");
        }

        List<ConditionResult> results = new ArrayList<>(conditions.size());
        Set<String> missing = new LinkedHashSet<>();
        for (Condition condition : conditions) {
            ConditionResult result;
            try {
                result = evaluateCondition(condition, bindings);
            } catch (FormulaException e) {
                if (!lenient) {
                    throw e;
                }
                LoggingUtil.warn("Condition '" + condition + "' failed, counted as false: " + e.getMessage());
                result = ConditionResult.failed(condition);
            }
            results.add(result);
            missing.addAll(result.getMissingVariables());
        }

        boolean combined = results.get(0).holds();
        for (int i = 1; i < results.size(); i++) {
            LogicalOperator joiner = conditions.get(i - 1).getLogicalOperator();
            if (joiner == null) {
                throw new IllegalArgumentException("Missing logical operator between conditions "
                        + (i - 1) + " and " + i);
            }
            combined = joiner.combine(combined, results.get(i).holds());
        }

        ConditionResult first = results.get(0);
        Double leftResult = Double.isNaN(first.getLeft()) ? null : first.getLeft();
        Double rightResult = Double.isNaN(first.getRight()) ? null : first.getRight();
        String message = combined ? "Formula condition is satisfied" : "Formula condition is not satisfied";
        return new FormulaEvaluation(true, combined, message, results, leftResult, rightResult,
                new ArrayList<>(missing));
    }

    /**
     * Parse and evaluate formula text in one step, lenient as the interactive
     * evaluation endpoint is. Parse failures give an invalid result rather than an exception.
     */
    public FormulaEvaluation evaluate(String formula, Map<String, Double> bindings) {
        List<Condition> conditions = FormulaParser.parseFormula(formula);
        if (conditions.isEmpty()) {
            return FormulaEvaluation.invalid("No valid conditions found in formula");
        }
        return evaluateFormula(conditions, bindings, true);
    }
}
