package com.gridcalc.app.models;

import java.util.Objects;

/**
 * Inclusive rectangular block of cells. Corners are normalized so that
 * start is always the top-left one.
 */
public final class CellRange {

    private final int startRow;
    private final int startColumn;
    private final int endRow;
    private final int endColumn;

    public CellRange(int startRow, int startColumn, int endRow, int endColumn) {
        if (startRow < 0 || startColumn < 0 || endRow < 0 || endColumn < 0) {
            throw new IllegalArgumentException("Range indices must be non-negative");
        }
        this.startRow = Math.min(startRow, endRow);
        this.startColumn = Math.min(startColumn, endColumn);
        this.endRow = Math.max(startRow, endRow);
        this.endColumn = Math.max(startColumn, endColumn);
    }

    public static CellRange of(CellAddress from, CellAddress to) {
        return new CellRange(from.getRow(), from.getColumn(), to.getRow(), to.getColumn());
    }

    public static CellRange single(CellAddress address) {
        return of(address, address);
    }

    /**
     * Parses "A1:C10" or a single address "B2". Returns null for anything else.
     */
    public static CellRange parseA1(String text) {
        if (text == null) {
            return null;
        }
        String[] parts = text.trim().split(":", -1);
        if (parts.length == 1) {
            CellAddress single = CellAddress.parseA1(parts[0]);
            return single == null ? null : single(single);
        }
        if (parts.length != 2) {
            return null;
        }
        CellAddress from = CellAddress.parseA1(parts[0]);
        CellAddress to = CellAddress.parseA1(parts[1]);
        if (from == null || to == null) {
            return null;
        }
        return of(from, to);
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

    public int rowCount() {
        return endRow - startRow + 1;
    }

    public int columnCount() {
        return endColumn - startColumn + 1;
    }

    public long cellCount() {
        return (long) rowCount() * columnCount();
    }

    public boolean isSingleCell() {
        return startRow == endRow && startColumn == endColumn;
    }

    public CellAddress start() {
        return new CellAddress(startRow, startColumn);
    }

    public CellAddress end() {
        return new CellAddress(endRow, endColumn);
    }

    public boolean contains(int row, int column) {
        return row >= startRow && row <= endRow && column >= startColumn && column <= endColumn;
    }

    public boolean contains(CellAddress address) {
        return contains(address.getRow(), address.getColumn());
    }

    public String toA1() {
        if (isSingleCell()) {
            return start().toA1();
        }
        return start().toA1() + ":" + end().toA1();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRange)) {
            return false;
        }
        CellRange that = (CellRange) o;
        return startRow == that.startRow && startColumn == that.startColumn
                && endRow == that.endRow && endColumn == that.endColumn;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startRow, startColumn, endRow, endColumn);
    }

    @Override
    public String toString() {
        return toA1();
    }
}
