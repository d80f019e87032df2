package com.gridcalc.app.formula.functions;

import com.gridcalc.app.formula.EvaluationException;
import com.gridcalc.app.formula.RangeValue;
import com.gridcalc.app.formula.Values;
import com.gridcalc.app.models.CellValue;
import com.gridcalc.app.models.ErrorCode;

import static com.gridcalc.app.formula.functions.FunctionDefinition.VARIADIC;

/**
 * IF, AND, OR, NOT, IFERROR and the IS* predicates.
 * IF, IFERROR, AND and OR evaluate only the arguments they need.
 */
final class LogicalFunctions {

    private LogicalFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register("IF", 2, 3, args -> {
            CellValue condition = args.value(0);
            if (condition.isError()) {
                return condition;
            }
            if (Values.toBoolean(condition)) {
                return args.value(1);
            }
            return args.has(2) ? args.value(2) : CellValue.bool(false);
        });
        registry.register("AND", 1, VARIADIC, args -> logical(args, true));
        registry.register("OR", 1, VARIADIC, args -> logical(args, false));
        registry.register("NOT", 1, 1, args -> CellValue.bool(!args.bool(0)));
        registry.register("IFERROR", 2, 2, args -> {
            CellValue value = args.value(0);
            return value.isError() ? args.value(1) : value;
        });
        registry.register("ISBLANK", 1, 1, args -> CellValue.bool(args.value(0).isEmpty()));
        registry.register("ISNUMBER", 1, 1, args -> CellValue.bool(args.value(0).isNumber()));
        registry.register("ISTEXT", 1, 1, args -> CellValue.bool(args.value(0).isString()));
        registry.register("ISERROR", 1, 1, args -> CellValue.bool(args.value(0).isError()));
        registry.register("ISNA", 1, 1, args -> {
            CellValue value = args.value(0);
            return CellValue.bool(value.isError() && value.getError() == ErrorCode.NA);
        });
    }

    /**
     * AND when 'all' is true, OR otherwise. Stops at the first deciding argument.
     * Referenced text is ignored; #VALUE! when no logical value was seen at all.
     */
    private static CellValue logical(FunctionArgs args, boolean all) {
        boolean seen = false;
        for (int i = 0; i < args.size(); i++) {
            if (args.isReference(i)) {
                RangeValue range = args.range(i);
                for (int r = 0; r < range.rows(); r++) {
                    for (int c = 0; c < range.columns(); c++) {
                        CellValue value = Values.requireNonError(range.get(r, c));
                        if (value.isBoolean() || value.isNumber()) {
                            seen = true;
                            if (Values.toBoolean(value) != all) {
                                return CellValue.bool(!all);
                            }
                        }
                    }
                }
            } else {
                seen = true;
                if (args.bool(i) != all) {
                    return CellValue.bool(!all);
                }
            }
        }
        if (!seen) {
            throw new EvaluationException(ErrorCode.VALUE);
        }
        return CellValue.bool(all);
    }
}
