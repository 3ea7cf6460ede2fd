package com.labmuse.formula;

/**
 * Base type for every failure raised while parsing, resolving or evaluating a formula.
 */
public class FormulaException extends RuntimeException {

    public FormulaException(String message) {
        super(message);
    }

    public FormulaException(String message, Throwable cause) {
        super(message, cause);
    }
}
