package com.labmuse.formula;

/**
 * Raised when an expression cannot be reduced to a finite number: disallowed
 * characters after substitution, unbalanced or empty parentheses, NaN or infinity.
 */
public class EvaluationException extends FormulaException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
