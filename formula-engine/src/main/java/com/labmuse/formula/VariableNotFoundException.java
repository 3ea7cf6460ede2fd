package com.labmuse.formula;

import java.util.List;

/**
 * One or more identifiers could not be resolved, even after fuzzy matching.
 */
public class VariableNotFoundException extends FormulaException {

    private final List<String> variables;

    public VariableNotFoundException(String variable) {
        this(List.of(variable));
    }

    public VariableNotFoundException(List<String> variables) {
        super("Variable not found: " + String.join(", ", variables));
        this.variables = List.copyOf(variables);
    }

    public List<String> getVariables() {
        return variables;
    }
}
