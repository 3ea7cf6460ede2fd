package com.labmuse.formula;

import java.util.Locale;

/**
 * Keyword joining a condition to the one that follows it.
 */
public enum LogicalOperator {
    AND,
    OR;

    public boolean combine(boolean left, boolean right) {
        return this == AND ? left && right : left || right;
    }

    public static LogicalOperator fromKeyword(String keyword) {
        return valueOf(keyword.trim().toUpperCase(Locale.ROOT));
    }
}
