package com.gridcalc.app.formula;

import com.gridcalc.app.models.ErrorCode;

/**
 * Signals an error value from deep inside a function implementation.
 * Converted to a {@link com.gridcalc.app.models.CellValue} error at the function-call boundary,
 * so it never escapes the evaluator.
 */
public class EvaluationException extends RuntimeException {
    private final ErrorCode errorCode;

    public EvaluationException(ErrorCode errorCode) {
        super(errorCode.getDisplay(), null, false, false);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
