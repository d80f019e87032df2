package com.gridcalc.app.dto;

import com.gridcalc.app.models.CellRange;

import java.util.List;

/**
 * Dense grid of cells for an inclusive range, row by row.
 */
public class RangeSnapshot {
    private final int sheetIndex;
    private final String range;
    private final int startRow;
    private final int startColumn;
    private final int endRow;
    private final int endColumn;
    private final List<List<CellSnapshot>> rows;

    public RangeSnapshot(int sheetIndex, CellRange range, List<List<CellSnapshot>> rows) {
        this.sheetIndex = sheetIndex;
        this.range = range.toA1();
        this.startRow = range.getStartRow();
        this.startColumn = range.getStartColumn();
        this.endRow = range.getEndRow();
        this.endColumn = range.getEndColumn();
        this.rows = rows;
    }

    public int getSheetIndex() {
        return sheetIndex;
    }

    public String getRange() {
        return range;
    }

    public int getStartRow() {
        return startRow;
    }

    public int getStartColumn() {
        return startColumn;
    }

    public int getEndRow() {
        return endRow;
    }

    public int getEndColumn() {
        return endColumn;
    }

    public List<List<CellSnapshot>> getRows() {
        return rows;
    }

    /**
     * Cell at a position relative to the top-left corner.
     */
    public CellSnapshot cellAt(int row, int column) {
        return rows.get(row).get(column);
    }
}
