package com.gridcalc.app.formula.functions;

import com.gridcalc.app.models.CellValue;

@FunctionalInterface
public interface FormulaFunction {

    /**
     * Computes the result. Implementations may throw
     * {@link com.gridcalc.app.formula.EvaluationException} to return an error value.
     */
    CellValue call(FunctionArgs args);
}
