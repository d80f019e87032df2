package com.gridcalc.app.models;

import jakarta.validation.constraints.Min;

/**
 * A participant's highlighted block, inclusive on both corners.
 */
public class SelectionRange {
    @Min(0)
    private int sheetIndex;
    @Min(0)
    private int startRow;
    @Min(0)
    private int startColumn;
    @Min(0)
    private int endRow;
    @Min(0)
    private int endColumn;

    public SelectionRange() {
    }

    public SelectionRange(int sheetIndex, int startRow, int startColumn, int endRow, int endColumn) {
        this.sheetIndex = sheetIndex;
        this.startRow = startRow;
        this.startColumn = startColumn;
        this.endRow = endRow;
        this.endColumn = endColumn;
    }

    public int getSheetIndex() {
        return sheetIndex;
    }

    public void setSheetIndex(int sheetIndex) {
        this.sheetIndex = sheetIndex;
    }

    public int getStartRow() {
        return startRow;
    }

    public void setStartRow(int startRow) {
        this.startRow = startRow;
    }

    public int getStartColumn() {
        return startColumn;
    }

    public void setStartColumn(int startColumn) {
        this.startColumn = startColumn;
    }

    public int getEndRow() {
        return endRow;
    }

    public void setEndRow(int endRow) {
        this.endRow = endRow;
    }

    public int getEndColumn() {
        return endColumn;
    }

    public void setEndColumn(int endColumn) {
        this.endColumn = endColumn;
    }

    public String toA1() {
        return new CellRange(startRow, startColumn, endRow, endColumn).toA1();
    }
}
