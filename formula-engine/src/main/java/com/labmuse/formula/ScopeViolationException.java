package com.labmuse.formula;

/**
 * A table-scoped formula breaks the unidirectional rule: more than one
 * condition, arithmetic on the single-variable side, or a self-reference.
 */
public class ScopeViolationException extends FormulaException {

    public ScopeViolationException(String message) {
        super(message);
    }
}
