package com.labmuse.formula;

import java.util.*;

/**
 * A single comparison {@code left op right}. The logical operator, when present,
 * joins this condition to the one that follows it in the formula.
 */
public final class Condition {

    private final Expression left;
    private final ComparisonOperator operator;
    private final Expression right;
    private final LogicalOperator logicalOperator;

    public Condition(String leftExpression, ComparisonOperator operator, String rightExpression,
                     LogicalOperator logicalOperator) {
        this(Expression.parse(leftExpression), operator, Expression.parse(rightExpression), logicalOperator);
    }

    public Condition(Expression left, ComparisonOperator operator, Expression right,
                     LogicalOperator logicalOperator) {
        if (left.getText().isEmpty() || right.getText().isEmpty()) {
            throw new IllegalArgumentException("Condition sides must not be empty");
        }
        this.left = left;
        this.operator = Objects.requireNonNull(operator, "operator");
        this.right = right;
        this.logicalOperator = logicalOperator;
    }

    public String getLeftExpression() {
        return left.getText();
    }

    public String getRightExpression() {
        return right.getText();
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    /**
     * @return the keyword joining this condition to the next one, or null for the last condition
     */
    public LogicalOperator getLogicalOperator() {
        return logicalOperator;
    }

    /**
     * Distinct variables of both sides, left first.
     */
    public List<String> getVariables() {
        Set<String> all = new LinkedHashSet<>(left.getVariables());
        all.addAll(right.getVariables());
        return new ArrayList<>(all);
    }

    public Condition renameVariables(Map<String, String> names) {
        return new Condition(left.renameVariables(names), operator, right.renameVariables(names), logicalOperator);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Condition)) return false;
        Condition other = (Condition) o;
        return left.equals(other.left) && operator == other.operator
                && right.equals(other.right) && logicalOperator == other.logicalOperator;
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right, logicalOperator);
    }

    @Override
    public String toString() {
        return left + " " + operator.getSymbol() + " " + right
                + (logicalOperator == null ? "" : " " + logicalOperator);
    }
}
