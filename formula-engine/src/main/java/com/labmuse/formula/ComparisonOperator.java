package com.labmuse.formula;

import java.util.Optional;

/**
 * Comparison between the two sides of a condition. Equality and inequality
 * tolerate floating point noise up to an epsilon, the ordering operators are exact.
 */
public enum ComparisonOperator {
    GREATER(">"),
    LESS("<"),
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<="),
    EQUAL("=="),
    NOT_EQUAL("!=");

    public static final double DEFAULT_EPSILON = 1e-10;

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean apply(double left, double right) {
        return apply(left, right, DEFAULT_EPSILON);
    }

    public boolean apply(double left, double right, double epsilon) {
        switch (this) {
            case GREATER: return left > right;
            case LESS: return left < right;
            case GREATER_OR_EQUAL: return left >= right;
            case LESS_OR_EQUAL: return left <= right;
            case EQUAL: return Math.abs(left - right) < epsilon;
            case NOT_EQUAL: return Math.abs(left - right) >= epsilon;
            default: throw new IllegalStateException("Unhandled operator: " + this);
        }
    }

    /**
     * Lookup by symbol. A single {@code =} is read as {@code ==}.
     */
    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        String trimmed = symbol.trim();
        if (trimmed.equals("=")) {
            return Optional.of(EQUAL);
        }
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(trimmed)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return symbol;
    }
}
