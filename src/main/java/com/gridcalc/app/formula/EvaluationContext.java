package com.gridcalc.app.formula;

import com.gridcalc.app.models.CellRange;
import com.gridcalc.app.models.CellValue;

import java.time.Clock;

/**
 * What the evaluator can see while computing one formula.
 * A null sheet name means the sheet that holds the formula.
 */
public interface EvaluationContext {

    /**
     * Current value of a cell, or a #REF! error when the sheet does not exist.
     */
    CellValue cellValue(String sheetName, int row, int column);

    /**
     * Values of a range, or null when the sheet does not exist.
     */
    RangeValue rangeValue(String sheetName, CellRange range);

    /**
     * Spreadsheet variable by case-insensitive name, or null when undefined.
     */
    CellValue variable(String name);

    Clock clock();
}
