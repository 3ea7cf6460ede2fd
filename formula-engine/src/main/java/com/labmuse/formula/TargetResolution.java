package com.labmuse.formula;

import java.util.List;
import java.util.Map;

/**
 * Which variable a formula highlights and how its references map onto table variable names.
 * {@code targetVariable} is null for workspace formulas without a single target.
 */
public final class TargetResolution {

    public enum Side { LEFT, RIGHT }

    private final String targetVariable;
    private final String targetReference;
    private final Side side;
    private final List<String> leftVariables;
    private final List<String> rightVariables;
    private final Map<String, String> variableMapping;

    TargetResolution(String targetVariable, String targetReference, Side side, List<String> leftVariables,
                     List<String> rightVariables, Map<String, String> variableMapping) {
        this.targetVariable = targetVariable;
        this.targetReference = targetReference;
        this.side = side;
        this.leftVariables = List.copyOf(leftVariables);
        this.rightVariables = List.copyOf(rightVariables);
        this.variableMapping = Map.copyOf(variableMapping);
    }

    /**
     * @return the table variable name to highlight, or null
     */
    public String getTargetVariable() {
        return targetVariable;
    }

    /**
     * @return the target as written in the formula, or null
     */
    public String getTargetReference() {
        return targetReference;
    }

    public Side getSide() {
        return side;
    }

    public boolean hasTarget() {
        return targetVariable != null;
    }

    public List<String> getLeftVariables() {
        return leftVariables;
    }

    public List<String> getRightVariables() {
        return rightVariables;
    }

    /**
     * Formula reference to resolved table variable name.
     */
    public Map<String, String> getVariableMapping() {
        return variableMapping;
    }

    @Override
    public String toString() {
        return "TargetResolution{target=" + targetVariable + ", side=" + side
                + ", left=" + leftVariables + ", right=" + rightVariables + "}";
    }
}
