package com.gridcalc.app.models;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Zero-based (row, column) position inside a sheet.
 * Ordered row-major, which is also the order cells are stored in a sheet.
 */
public final class CellAddress implements Comparable<CellAddress> {

    /**
     * Largest row or column index a sheet accepts. One past it still fits in an int,
     * so inclusive loops over a range can always step beyond its last index.
     */
    public static final int MAX_INDEX = Integer.MAX_VALUE - 1;

    private static final Pattern A1_PATTERN = Pattern.compile("^\\$?([A-Za-z]+)\\$?([0-9]+)$");

    private final int row;
    private final int column;

    public CellAddress(int row, int column) {
        if (row < 0 || column < 0) {
            throw new IllegalArgumentException("Cell indices must be non-negative: " + row + "," + column);
        }
        this.row = row;
        this.column = column;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Builds a consistent key like "B3" for row=2, column=1.
     */
    public String toA1() {
        return columnName(column) + (row + 1);
    }

    /**
     * Parses "B3", "$B$3" or "b3". Returns null when the text is not a cell address
     * or its indices overflow.
     */
    public static CellAddress parseA1(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = A1_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            return null;
        }
        int column = columnIndex(matcher.group(1));
        int row;
        try {
            row = Integer.parseInt(matcher.group(2)) - 1;
        } catch (NumberFormatException e) {
            return null;
        }
        if (column < 0 || row < 0) {
            return null;
        }
        return new CellAddress(row, column);
    }

    /**
     * 0 -> "A", 25 -> "Z", 26 -> "AA".
     */
    public static String columnName(int column) {
        StringBuilder sb = new StringBuilder();
        int n = column + 1;
        while (n > 0) {
            int rem = (n - 1) % 26;
            sb.append((char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return sb.reverse().toString();
    }

    /**
     * "A" -> 0, "AA" -> 26. Returns -1 on overflow.
     */
    public static int columnIndex(String letters) {
        long result = 0;
        for (char c : letters.toUpperCase().toCharArray()) {
            if (c < 'A' || c > 'Z') {
                return -1;
            }
            result = result * 26 + (c - 'A' + 1);
            if (result > Integer.MAX_VALUE) {
                return -1;
            }
        }
        return (int) (result - 1);
    }

    @Override
    public int compareTo(CellAddress other) {
        int byRow = Integer.compare(row, other.row);
        return byRow != 0 ? byRow : Integer.compare(column, other.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress that = (CellAddress) o;
        return row == that.row && column == that.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column);
    }

    @Override
    public String toString() {
        return toA1();
    }
}
