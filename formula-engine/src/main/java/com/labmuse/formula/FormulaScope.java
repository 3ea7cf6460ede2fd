package com.labmuse.formula;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Where a formula applies:
 * TABLE: bound to one table, single condition, unidirectional rule enforced
 * WORKSPACE: applies to every table of the workspace, multiple conditions allowed
 */
public enum FormulaScope {
    TABLE,
    WORKSPACE;

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FormulaScope fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
