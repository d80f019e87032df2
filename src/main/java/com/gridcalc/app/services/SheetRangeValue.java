package com.gridcalc.app.services;

import com.gridcalc.app.formula.RangeValue;
import com.gridcalc.app.models.Cell;
import com.gridcalc.app.models.CellRange;
import com.gridcalc.app.models.CellValue;
import com.gridcalc.app.models.Sheet;

import java.util.function.Consumer;

/**
 * Live view of a sheet range. Only valid while the caller holds the spreadsheet lock.
 */
class SheetRangeValue implements RangeValue {

    private final Sheet sheet;
    private final CellRange range;

    SheetRangeValue(Sheet sheet, CellRange range) {
        this.sheet = sheet;
        this.range = range;
    }

    @Override
    public int rows() {
        return range.rowCount();
    }

    @Override
    public int columns() {
        return range.columnCount();
    }

    @Override
    public CellValue get(int row, int column) {
        if (row < 0 || column < 0 || row >= rows() || column >= columns()) {
            return CellValue.empty();
        }
        Cell cell = sheet.getCell(range.getStartRow() + row, range.getStartColumn() + column);
        return cell == null ? CellValue.empty() : cell.getValue();
    }

    @Override
    public void forEachNonEmpty(Consumer<CellValue> action) {
        for (Cell cell : sheet.cellsInRange(range)) {
            CellValue value = cell.getValue();
            if (!value.isEmpty()) {
                action.accept(value);
            }
        }
    }
}
