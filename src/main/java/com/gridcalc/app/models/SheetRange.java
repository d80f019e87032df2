package com.gridcalc.app.models;

import java.util.Objects;

/**
 * A resolved reference target: a range on a specific sheet (by stable id).
 * A single-cell reference is a 1x1 range.
 */
public final class SheetRange {

    private final String sheetId;
    private final CellRange range;

    public SheetRange(String sheetId, CellRange range) {
        this.sheetId = Objects.requireNonNull(sheetId);
        this.range = Objects.requireNonNull(range);
    }

    public String getSheetId() {
        return sheetId;
    }

    public CellRange getRange() {
        return range;
    }

    public boolean contains(CellKey key) {
        return sheetId.equals(key.getSheetId()) && range.contains(key.getAddress());
    }

    public boolean isSingleCell() {
        return range.isSingleCell();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SheetRange)) {
            return false;
        }
        SheetRange that = (SheetRange) o;
        return sheetId.equals(that.sheetId) && range.equals(that.range);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheetId, range);
    }

    @Override
    public String toString() {
        return sheetId + "!" + range.toA1();
    }
}
