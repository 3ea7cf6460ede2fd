package com.labmuse.formula;

/**
 * Malformed or empty formula text, e.g. a leading operator as in {@code ">10"}.
 */
public class FormulaParseException extends FormulaException {

    private final String formulaText;

    public FormulaParseException(String message, String formulaText) {
        super(message);
        this.formulaText = formulaText;
    }

    public String getFormulaText() {
        return formulaText;
    }
}
