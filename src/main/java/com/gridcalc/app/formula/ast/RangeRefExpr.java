package com.gridcalc.app.formula.ast;

import com.gridcalc.app.models.CellRange;

/**
 * Rectangular range reference such as A1:B3 or 'Data'!C2:C10.
 */
public final class RangeRefExpr extends Expr {

    private final String sheetName;
    private final CellRange range;

    public RangeRefExpr(String sheetName, CellRange range, int position) {
        super(position);
        this.sheetName = sheetName;
        this.range = range;
    }

    public String getSheetName() {
        return sheetName;
    }

    public CellRange getRange() {
        return range;
    }

    @Override
    public Kind getKind() {
        return Kind.RANGE_REF;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitRangeRef(this);
    }

    @Override
    public String toString() {
        return (sheetName == null ? "" : sheetName + "!") + range.toA1();
    }
}
