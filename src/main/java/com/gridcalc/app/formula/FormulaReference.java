package com.gridcalc.app.formula;

import com.gridcalc.app.models.CellRange;

import java.util.Objects;

/**
 * A reference as written in a formula: optional sheet name plus the range it covers.
 */
public final class FormulaReference {

    private final String sheetName;
    private final CellRange range;

    public FormulaReference(String sheetName, CellRange range) {
        this.sheetName = sheetName;
        this.range = Objects.requireNonNull(range);
    }

    public String getSheetName() {
        return sheetName;
    }

    public CellRange getRange() {
        return range;
    }

    public String toA1() {
        if (sheetName == null) {
            return range.toA1();
        }
        return "'" + sheetName.replace("'", "''") + "'!" + range.toA1();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FormulaReference)) {
            return false;
        }
        FormulaReference that = (FormulaReference) o;
        return Objects.equals(sheetName, that.sheetName) && range.equals(that.range);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheetName, range);
    }

    @Override
    public String toString() {
        return toA1();
    }
}
