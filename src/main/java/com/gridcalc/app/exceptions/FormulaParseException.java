package com.gridcalc.app.exceptions;

/**
 * Thrown when formula text is syntactically malformed.
 * Carries the zero-based offset of the offending token within the formula source
 * (the leading "=" is offset 0). Raised before any state change.
 */
public class FormulaParseException extends RuntimeException {
    private final int position;
    private final String formula;

    public FormulaParseException(String message, int position, String formula) {
        super(message + " at position " + position);
        this.position = position;
        this.formula = formula;
    }

    public int getPosition() {
        return position;
    }

    public String getFormula() {
        return formula;
    }
}
