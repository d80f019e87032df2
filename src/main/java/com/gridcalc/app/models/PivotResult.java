package com.gridcalc.app.models;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Computed pivot grid: a header row, one row per group combination
 * (first-seen order), and an optional grand-total row.
 */
public class PivotResult {
    private final List<String> headers;
    private final List<List<CellValue>> rows;
    private final List<CellValue> grandTotal;
    private final int sourceRowCount;

    public PivotResult(List<String> headers, List<List<CellValue>> rows, List<CellValue> grandTotal, int sourceRowCount) {
        this.headers = Collections.unmodifiableList(headers);
        this.rows = Collections.unmodifiableList(rows);
        this.grandTotal = grandTotal == null ? null : Collections.unmodifiableList(grandTotal);
        this.sourceRowCount = sourceRowCount;
    }

    public List<String> getHeaders() {
        return headers;
    }

    public List<List<CellValue>> getRows() {
        return rows;
    }

    public List<CellValue> getGrandTotal() {
        return grandTotal;
    }

    public int getSourceRowCount() {
        return sourceRowCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PivotResult)) {
            return false;
        }
        PivotResult that = (PivotResult) o;
        return sourceRowCount == that.sourceRowCount && headers.equals(that.headers)
                && rows.equals(that.rows) && Objects.equals(grandTotal, that.grandTotal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(headers, rows, grandTotal, sourceRowCount);
    }
}
