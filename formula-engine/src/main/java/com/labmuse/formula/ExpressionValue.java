package com.labmuse.formula;

import java.util.List;

/**
 * Numeric result of one expression, plus the variables that were missing from
 * the bindings and counted as zero.
 */
public final class ExpressionValue {

    private final double value;
    private final List<String> missingVariables;

    public ExpressionValue(double value, List<String> missingVariables) {
        this.value = value;
        this.missingVariables = List.copyOf(missingVariables);
    }

    public double getValue() {
        return value;
    }

    public List<String> getMissingVariables() {
        return missingVariables;
    }

    public boolean hasMissingVariables() {
        return !missingVariables.isEmpty();
    }

    @Override
    public String toString() {
        return missingVariables.isEmpty() ? String.valueOf(value) : value + " (missing: " + missingVariables + ")";
    }
}
