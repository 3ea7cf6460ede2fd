package com.labmuse.formula;

import java.util.List;

/**
 * Outcome of one condition: both side values and whether the comparison holds.
 */
public final class ConditionResult {

    private final Condition condition;
    private final double left;
    private final double right;
    private final boolean holds;
    private final List<String> missingVariables;

    public ConditionResult(Condition condition, double left, double right, boolean holds,
                           List<String> missingVariables) {
        this.condition = condition;
        this.left = left;
        this.right = right;
        this.holds = holds;
        this.missingVariables = List.copyOf(missingVariables);
    }

    static ConditionResult failed(Condition condition) {
        return new ConditionResult(condition, Double.NaN, Double.NaN, false, List.of());
    }

    public Condition getCondition() {
        return condition;
    }

    public double getLeft() {
        return left;
    }

    public double getRight() {
        return right;
    }

    public boolean holds() {
        return holds;
    }

    public List<String> getMissingVariables() {
        return missingVariables;
    }

    @Override
    public String toString() {
        return condition + " -> " + left + " " + condition.getOperator() + " " + right + " = " + holds;
    }
}
