package com.labmuse.formula;

import java.util.List;

/**
 * Combined result of a formula for one set of bindings.
 * {@code leftResult} and {@code rightResult} belong to the first condition
 * and are null when it could not be evaluated.
 */
public final class FormulaEvaluation {

    private final boolean valid;
    private final boolean result;
    private final String message;
    private final List<ConditionResult> conditionResults;
    private final Double leftResult;
    private final Double rightResult;
    private final List<String> missingVariables;

    FormulaEvaluation(boolean valid, boolean result, String message, List<ConditionResult> conditionResults,
                      Double leftResult, Double rightResult, List<String> missingVariables) {
        this.valid = valid;
        this.result = result;
        this.message = message;
        this.conditionResults = List.copyOf(conditionResults);
        this.leftResult = leftResult;
        this.rightResult = rightResult;
        this.missingVariables = List.copyOf(missingVariables);
    }

    static FormulaEvaluation invalid(String message) {
        return new FormulaEvaluation(false, false, message, List.of(), null, null, List.of());
    }

    public boolean isValid() {
        return valid;
    }

    public boolean getResult() {
        return result;
    }

    public String getMessage() {
        return message;
    }

    public List<ConditionResult> getConditionResults() {
        return conditionResults;
    }

    public Double getLeftResult() {
        return leftResult;
    }

    public Double getRightResult() {
        return rightResult;
    }

    public List<String> getMissingVariables() {
        return missingVariables;
    }

    @Override
    public String toString() {
        return "FormulaEvaluation{valid=" + valid + ", result=" + result + ", message='" + message + "'"
                + (missingVariables.isEmpty() ? "" : ", missing=" + missingVariables) + "}";
    }
}
