package com.gridcalc.app.models;

import java.util.Objects;

/**
 * Identifies a cell across the sheets of one spreadsheet: stable sheet id plus address.
 * Used as the node type of the dependency graph.
 */
public final class CellKey {

    private final String sheetId;
    private final CellAddress address;

    public CellKey(String sheetId, CellAddress address) {
        this.sheetId = Objects.requireNonNull(sheetId);
        this.address = Objects.requireNonNull(address);
    }

    public CellKey(String sheetId, int row, int column) {
        this(sheetId, new CellAddress(row, column));
    }

    public String getSheetId() {
        return sheetId;
    }

    public CellAddress getAddress() {
        return address;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellKey)) {
            return false;
        }
        CellKey cellKey = (CellKey) o;
        return sheetId.equals(cellKey.sheetId) && address.equals(cellKey.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheetId, address);
    }

    @Override
    public String toString() {
        return sheetId + "!" + address.toA1();
    }
}
