package com.gridcalc.app.models;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.UUID;

/**
 * One sheet of a spreadsheet: a sparse, row-major map of address -> Cell.
 * Not thread-safe on its own; the owning Spreadsheet's lock guards every access.
 */
public class Sheet {

    private final String id;
    private String name;
    private int index;
    // Row-major order keeps range scans to one contiguous slice per row band
    private final NavigableMap<CellAddress, Cell> cells = new TreeMap<>();

    public Sheet(String name, int index) {
        this.id = UUID.randomUUID().toString();
        this.name = name;
        this.index = index;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getIndex() {
        return index;
    }

    public void setIndex(int index) {
        this.index = index;
    }

    /**
     * Retrieves the cell at (row, column), or null when the position is empty.
     */
    public Cell getCell(int row, int column) {
        return cells.get(new CellAddress(row, column));
    }

    public Cell getCell(CellAddress address) {
        return cells.get(address);
    }

    /**
     * Helper to insert/update a cell in this sheet's 'cells' map.
     */
    public void putCell(Cell cell) {
        cells.put(cell.getAddress(), cell);
    }

    public Cell removeCell(CellAddress address) {
        return cells.remove(address);
    }

    public int size() {
        return cells.size();
    }

    public Collection<Cell> getCells() {
        return Collections.unmodifiableCollection(cells.values());
    }

    /**
     * Non-empty cells inside the range, in row-major order.
     */
    public List<Cell> cellsInRange(CellRange range) {
        List<Cell> result = new ArrayList<>();
        NavigableMap<CellAddress, Cell> band = cells.subMap(range.start(), true, range.end(), true);
        for (Cell cell : band.values()) {
            if (range.contains(cell.getAddress())) {
                result.add(cell);
            }
        }
        return result;
    }

    public List<Cell> formulaCells() {
        List<Cell> result = new ArrayList<>();
        for (Cell cell : cells.values()) {
            if (cell.isFormula()) {
                result.add(cell);
            }
        }
        return result;
    }
}
