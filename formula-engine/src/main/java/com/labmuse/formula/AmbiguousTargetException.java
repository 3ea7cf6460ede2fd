package com.labmuse.formula;

/**
 * No single variable can be chosen as the highlight target.
 */
public class AmbiguousTargetException extends FormulaException {

    public AmbiguousTargetException(String message) {
        super(message);
    }
}
