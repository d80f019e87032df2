package com.gridcalc.app.models;

import jakarta.validation.constraints.Min;

/**
 * Where a participant's cursor sits: sheet index plus zero-based row/column.
 */
public class CursorPosition {
    @Min(0)
    private int sheetIndex;
    @Min(0)
    private int row;
    @Min(0)
    private int column;

    public CursorPosition() {
    }

    public CursorPosition(int sheetIndex, int row, int column) {
        this.sheetIndex = sheetIndex;
        this.row = row;
        this.column = column;
    }

    public int getSheetIndex() {
        return sheetIndex;
    }

    public void setSheetIndex(int sheetIndex) {
        this.sheetIndex = sheetIndex;
    }

    public int getRow() {
        return row;
    }

    public void setRow(int row) {
        this.row = row;
    }

    public int getColumn() {
        return column;
    }

    public void setColumn(int column) {
        this.column = column;
    }
}
