package com.gridcalc.app.formula.ast;

import com.gridcalc.app.models.CellAddress;

/**
 * Reference to one cell, optionally qualified with a sheet name.
 * Absolute markers are kept for display only; they do not change evaluation.
 */
public final class CellRefExpr extends Expr {

    private final String sheetName;
    private final CellAddress address;
    private final boolean rowAbsolute;
    private final boolean columnAbsolute;

    public CellRefExpr(String sheetName, CellAddress address, boolean rowAbsolute, boolean columnAbsolute,
                       int position) {
        super(position);
        this.sheetName = sheetName;
        this.address = address;
        this.rowAbsolute = rowAbsolute;
        this.columnAbsolute = columnAbsolute;
    }

    /**
     * Sheet qualifier, or null for the sheet holding the formula.
     */
    public String getSheetName() {
        return sheetName;
    }

    public CellAddress getAddress() {
        return address;
    }

    public boolean isRowAbsolute() {
        return rowAbsolute;
    }

    public boolean isColumnAbsolute() {
        return columnAbsolute;
    }

    @Override
    public Kind getKind() {
        return Kind.CELL_REF;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCellRef(this);
    }

    @Override
    public String toString() {
        return (sheetName == null ? "" : sheetName + "!") + address.toA1();
    }
}
