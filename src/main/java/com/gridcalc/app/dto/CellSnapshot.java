package com.gridcalc.app.dto;

import com.gridcalc.app.models.Cell;
import com.gridcalc.app.models.CellAddress;
import com.gridcalc.app.models.CellValue;

/**
 * Read-only view of one cell: its content as written and its current value.
 * Empty positions come back with a null content and an EMPTY value.
 */
public class CellSnapshot {
    private final int sheetIndex;
    private final String address;
    private final int row;
    private final int column;
    private final String content;
    private final boolean formula;
    private final CellValue value;
    private final long revision;
    private final String lastEditor;

    public CellSnapshot(int sheetIndex, CellAddress address, String content, boolean formula, CellValue value,
                        long revision, String lastEditor) {
        this.sheetIndex = sheetIndex;
        this.address = address.toA1();
        this.row = address.getRow();
        this.column = address.getColumn();
        this.content = content;
        this.formula = formula;
        this.value = value;
        this.revision = revision;
        this.lastEditor = lastEditor;
    }

    public static CellSnapshot of(int sheetIndex, Cell cell) {
        return new CellSnapshot(sheetIndex, cell.getAddress(), cell.getContent().getSource(), cell.isFormula(),
                cell.getValue(), cell.getRevision(), cell.getLastEditor());
    }

    public static CellSnapshot empty(int sheetIndex, CellAddress address) {
        return new CellSnapshot(sheetIndex, address, null, false, CellValue.empty(), 0L, null);
    }

    public int getSheetIndex() {
        return sheetIndex;
    }

    public String getAddress() {
        return address;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    public String getContent() {
        return content;
    }

    public boolean isFormula() {
        return formula;
    }

    public CellValue getValue() {
        return value;
    }

    public long getRevision() {
        return revision;
    }

    public String getLastEditor() {
        return lastEditor;
    }
}
