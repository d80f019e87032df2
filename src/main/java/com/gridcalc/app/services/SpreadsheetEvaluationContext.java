package com.gridcalc.app.services;

import com.gridcalc.app.formula.EvaluationContext;
import com.gridcalc.app.formula.RangeValue;
import com.gridcalc.app.models.Cell;
import com.gridcalc.app.models.CellRange;
import com.gridcalc.app.models.CellValue;
import com.gridcalc.app.models.ErrorCode;
import com.gridcalc.app.models.Sheet;
import com.gridcalc.app.models.Spreadsheet;

import java.time.Clock;

/**
 * Evaluation context for a formula living on 'currentSheet'.
 * Reads cached cell values, so precedents must be evaluated first.
 */
class SpreadsheetEvaluationContext implements EvaluationContext {

    private final Spreadsheet spreadsheet;
    private final Sheet currentSheet;
    private final Clock clock;

    SpreadsheetEvaluationContext(Spreadsheet spreadsheet, Sheet currentSheet, Clock clock) {
        this.spreadsheet = spreadsheet;
        this.currentSheet = currentSheet;
        this.clock = clock;
    }

    @Override
    public CellValue cellValue(String sheetName, int row, int column) {
        Sheet sheet = resolve(sheetName);
        if (sheet == null) {
            return CellValue.error(ErrorCode.REF);
        }
        Cell cell = sheet.getCell(row, column);
        return cell == null ? CellValue.empty() : cell.getValue();
    }

    @Override
    public RangeValue rangeValue(String sheetName, CellRange range) {
        Sheet sheet = resolve(sheetName);
        return sheet == null ? null : new SheetRangeValue(sheet, range);
    }

    @Override
    public CellValue variable(String name) {
        return spreadsheet.getVariable(name);
    }

    @Override
    public Clock clock() {
        return clock;
    }

    private Sheet resolve(String sheetName) {
        return sheetName == null ? currentSheet : spreadsheet.findSheetByName(sheetName);
    }
}
