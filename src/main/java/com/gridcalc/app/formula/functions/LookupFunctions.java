package com.gridcalc.app.formula.functions;

import com.gridcalc.app.formula.EvaluationException;
import com.gridcalc.app.formula.RangeValue;
import com.gridcalc.app.formula.Values;
import com.gridcalc.app.models.CellValue;
import com.gridcalc.app.models.ErrorCode;

/**
 * VLOOKUP, HLOOKUP, INDEX and MATCH over range arguments.
 */
final class LookupFunctions {

    private LookupFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register("VLOOKUP", 3, 4, args -> lookup(args, true));
        registry.register("HLOOKUP", 3, 4, args -> lookup(args, false));
        registry.register("INDEX", 2, 3, LookupFunctions::index);
        registry.register("MATCH", 2, 3, LookupFunctions::match);
    }

    /**
     * Searches the first column (vertical) or first row (horizontal) of the table and
     * returns the value 'offset' columns/rows into the matching line.
     */
    private static CellValue lookup(FunctionArgs args, boolean vertical) {
        CellValue key = Values.requireNonError(args.value(0));
        RangeValue table = args.range(1);
        int offset = args.integer(2);
        boolean approximate = !args.has(3) || args.bool(3);

        int lines = vertical ? table.rows() : table.columns();
        int width = vertical ? table.columns() : table.rows();
        if (offset < 1) {
            throw new EvaluationException(ErrorCode.VALUE);
        }
        if (offset > width) {
            throw new EvaluationException(ErrorCode.REF);
        }

        int found = -1;
        for (int i = 0; i < lines; i++) {
            CellValue candidate = vertical ? table.get(i, 0) : table.get(0, i);
            if (approximate) {
                if (candidate.isEmpty() || candidate.isError() || !sameKind(candidate, key)) {
                    continue;
                }
                if (Values.compare(candidate, key) > 0) {
                    break;
                }
                found = i;
            } else if (Values.looselyEqual(candidate, key)) {
                found = i;
                break;
            }
        }
        if (found < 0) {
            throw new EvaluationException(ErrorCode.NA);
        }
        return vertical ? table.get(found, offset - 1) : table.get(offset - 1, found);
    }

    private static CellValue index(FunctionArgs args) {
        RangeValue range = args.range(0);
        int row = args.integer(1);
        int column = args.has(2) ? args.integer(2) : 1;
        if (!args.has(2) && range.rows() == 1) {
            // INDEX(A1:E1, 3) addresses the third column of a single-row range
            column = row;
            row = 1;
        }
        if (row < 1 || column < 1) {
            throw new EvaluationException(ErrorCode.VALUE);
        }
        if (row > range.rows() || column > range.columns()) {
            throw new EvaluationException(ErrorCode.REF);
        }
        return range.get(row - 1, column - 1);
    }

    /**
     * 1-based position of the key in a one-dimensional range.
     * Type 0 is exact, 1 finds the largest value not above the key (ascending data),
     * -1 the smallest value not below it (descending data).
     */
    private static CellValue match(FunctionArgs args) {
        CellValue key = Values.requireNonError(args.value(0));
        RangeValue range = args.range(1);
        int type = args.has(2) ? (int) Math.signum(args.number(2)) : 1;
        if (range.rows() != 1 && range.columns() != 1) {
            throw new EvaluationException(ErrorCode.NA);
        }
        boolean vertical = range.columns() == 1;
        int length = vertical ? range.rows() : range.columns();

        int found = -1;
        for (int i = 0; i < length; i++) {
            CellValue candidate = vertical ? range.get(i, 0) : range.get(0, i);
            if (type == 0) {
                if (Values.looselyEqual(candidate, key)) {
                    found = i;
                    break;
                }
                continue;
            }
            if (candidate.isEmpty() || candidate.isError() || !sameKind(candidate, key)) {
                continue;
            }
            int cmp = Values.compare(candidate, key);
            if (type > 0) {
                if (cmp > 0) {
                    break;
                }
                found = i;
            } else {
                if (cmp < 0) {
                    break;
                }
                found = i;
            }
        }
        if (found < 0) {
            throw new EvaluationException(ErrorCode.NA);
        }
        return CellValue.number(found + 1);
    }

    private static boolean sameKind(CellValue a, CellValue b) {
        return a.getType() == b.getType();
    }
}
