package com.gridcalc.app.formula;

import com.gridcalc.app.models.CellAddress;
import com.gridcalc.app.models.CellRange;
import com.gridcalc.app.models.CellValue;
import com.gridcalc.app.models.ErrorCode;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Single-sheet context backed by a map; any sheet-qualified reference is a #REF!.
 */
public class MapEvaluationContext implements EvaluationContext {

    public static final Instant NOW = Instant.parse("2024-03-15T12:00:00Z");

    private final Map<CellAddress, CellValue> cells = new HashMap<>();
    private final Map<String, CellValue> variables = new HashMap<>();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    public MapEvaluationContext set(String a1, CellValue value) {
        cells.put(CellAddress.parseA1(a1), value);
        return this;
    }

    public MapEvaluationContext set(String a1, double number) {
        return set(a1, CellValue.number(number));
    }

    public MapEvaluationContext set(String a1, String text) {
        return set(a1, CellValue.string(text));
    }

    public MapEvaluationContext variable(String name, CellValue value) {
        variables.put(name.toUpperCase(Locale.ROOT), value);
        return this;
    }

    @Override
    public CellValue cellValue(String sheetName, int row, int column) {
        if (sheetName != null) {
            return CellValue.error(ErrorCode.REF);
        }
        CellValue value = cells.get(new CellAddress(row, column));
        return value == null ? CellValue.empty() : value;
    }

    @Override
    public RangeValue rangeValue(String sheetName, CellRange range) {
        if (sheetName != null) {
            return null;
        }
        return new RangeValue() {
            @Override
            public int rows() {
                return range.rowCount();
            }

            @Override
            public int columns() {
                return range.columnCount();
            }

            @Override
            public CellValue get(int row, int column) {
                return cellValue(null, range.getStartRow() + row, range.getStartColumn() + column);
            }

            @Override
            public void forEachNonEmpty(Consumer<CellValue> action) {
                for (int r = 0; r < rows(); r++) {
                    for (int c = 0; c < columns(); c++) {
                        CellValue value = get(r, c);
                        if (!value.isEmpty()) {
                            action.accept(value);
                        }
                    }
                }
            }
        };
    }

    @Override
    public CellValue variable(String name) {
        return variables.get(name.toUpperCase(Locale.ROOT));
    }

    @Override
    public Clock clock() {
        return clock;
    }
}
