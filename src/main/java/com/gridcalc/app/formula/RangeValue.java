package com.gridcalc.app.formula;

import com.gridcalc.app.models.CellValue;

import java.util.function.Consumer;

/**
 * Read-only view of a rectangular block of values, addressed relative to its top-left corner.
 */
public interface RangeValue {

    int rows();

    int columns();

    /**
     * Value at the relative position; EMPTY for unset cells.
     */
    CellValue get(int row, int column);

    /**
     * Visits the non-empty values in row-major order.
     */
    void forEachNonEmpty(Consumer<CellValue> action);

    static RangeValue of(CellValue value) {
        return new RangeValue() {
            @Override
            public int rows() {
                return 1;
            }

            @Override
            public int columns() {
                return 1;
            }

            @Override
            public CellValue get(int row, int column) {
                return row == 0 && column == 0 ? value : CellValue.empty();
            }

            @Override
            public void forEachNonEmpty(Consumer<CellValue> action) {
                if (!value.isEmpty()) {
                    action.accept(value);
                }
            }
        };
    }
}
