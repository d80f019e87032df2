package com.gridcalc.app.formula.functions;

import com.gridcalc.app.formula.EvaluationException;
import com.gridcalc.app.formula.RangeValue;
import com.gridcalc.app.formula.Values;
import com.gridcalc.app.models.CellValue;
import com.gridcalc.app.models.ErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.gridcalc.app.formula.functions.FunctionDefinition.VARIADIC;

/**
 * AVERAGE, COUNT, COUNTA, COUNTBLANK, MAX, MIN, MEDIAN, MODE, STDEV, VAR and the
 * conditional SUMIF, COUNTIF, AVERAGEIF.
 */
final class StatisticalFunctions {

    private StatisticalFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register("AVERAGE", 1, VARIADIC, args -> {
            List<Double> numbers = args.numbers();
            if (numbers.isEmpty()) {
                throw new EvaluationException(ErrorCode.DIV_ZERO);
            }
            return CellValue.number(mean(numbers));
        });
        registry.register("COUNT", 1, VARIADIC, StatisticalFunctions::count);
        registry.register("COUNTA", 1, VARIADIC, args -> {
            int[] count = {0};
            args.forEachValue((value, fromReference) -> {
                if (!value.isEmpty()) {
                    count[0]++;
                }
            });
            return CellValue.number(count[0]);
        });
        registry.register("COUNTBLANK", 1, 1, args -> {
            RangeValue range = args.range(0);
            long blanks = 0;
            for (int r = 0; r < range.rows(); r++) {
                for (int c = 0; c < range.columns(); c++) {
                    CellValue value = range.get(r, c);
                    if (value.isEmpty() || (value.isString() && value.getText().isEmpty())) {
                        blanks++;
                    }
                }
            }
            return CellValue.number(blanks);
        });
        registry.register("MAX", 1, VARIADIC, args -> {
            List<Double> numbers = args.numbers();
            return CellValue.number(numbers.isEmpty() ? 0d : Collections.max(numbers));
        });
        registry.register("MIN", 1, VARIADIC, args -> {
            List<Double> numbers = args.numbers();
            return CellValue.number(numbers.isEmpty() ? 0d : Collections.min(numbers));
        });
        registry.register("MEDIAN", 1, VARIADIC, StatisticalFunctions::median);
        registry.register("MODE", 1, VARIADIC, StatisticalFunctions::mode);
        registry.register("VAR", 1, VARIADIC, args -> CellValue.number(sampleVariance(args.numbers())));
        registry.register("STDEV", 1, VARIADIC, args -> CellValue.number(Math.sqrt(sampleVariance(args.numbers()))));
        registry.register("SUMIF", 2, 3, args -> conditional(args, Mode.SUM));
        registry.register("COUNTIF", 2, 2, args -> conditional(args, Mode.COUNT));
        registry.register("AVERAGEIF", 2, 3, args -> conditional(args, Mode.AVERAGE));
    }

    private enum Mode {
        SUM, COUNT, AVERAGE
    }

    private static CellValue count(FunctionArgs args) {
        int[] count = {0};
        args.forEachValue((value, fromReference) -> {
            if (value.isNumber()) {
                count[0]++;
            } else if (!fromReference && (value.isBoolean()
                    || (value.isString() && Values.isNumericText(value.getText())))) {
                count[0]++;
            }
        });
        return CellValue.number(count[0]);
    }

    private static CellValue median(FunctionArgs args) {
        List<Double> numbers = new ArrayList<>(args.numbers());
        if (numbers.isEmpty()) {
            throw new EvaluationException(ErrorCode.VALUE);
        }
        Collections.sort(numbers);
        int mid = numbers.size() / 2;
        if (numbers.size() % 2 == 1) {
            return CellValue.number(numbers.get(mid));
        }
        return CellValue.number((numbers.get(mid - 1) + numbers.get(mid)) / 2d);
    }

    /**
     * Most frequent value; ties go to the value seen first. #N/A when nothing repeats.
     */
    private static CellValue mode(FunctionArgs args) {
        Map<Double, Integer> frequencies = new LinkedHashMap<>();
        for (double n : args.numbers()) {
            frequencies.merge(n, 1, Integer::sum);
        }
        Double best = null;
        int bestCount = 1;
        for (Map.Entry<Double, Integer> entry : frequencies.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        if (best == null) {
            throw new EvaluationException(ErrorCode.NA);
        }
        return CellValue.number(best);
    }

    private static double mean(List<Double> numbers) {
        double total = 0d;
        for (double n : numbers) {
            total += n;
        }
        return total / numbers.size();
    }

    private static double sampleVariance(List<Double> numbers) {
        if (numbers.size() < 2) {
            throw new EvaluationException(ErrorCode.DIV_ZERO);
        }
        double mean = mean(numbers);
        double squares = 0d;
        for (double n : numbers) {
            squares += (n - mean) * (n - mean);
        }
        return squares / (numbers.size() - 1);
    }

    private static CellValue conditional(FunctionArgs args, Mode mode) {
        RangeValue range = args.range(0);
        Criteria criteria = Criteria.parse(args.value(1));
        RangeValue target = args.has(2) ? args.range(2) : range;

        double total = 0d;
        int matched = 0;
        for (int r = 0; r < range.rows(); r++) {
            for (int c = 0; c < range.columns(); c++) {
                if (!criteria.matches(range.get(r, c))) {
                    continue;
                }
                if (mode == Mode.COUNT) {
                    matched++;
                    continue;
                }
                CellValue value = target.get(r, c);
                Values.requireNonError(value);
                if (value.isNumber()) {
                    total += value.getNumber();
                    matched++;
                }
            }
        }
        switch (mode) {
            case COUNT:
                return CellValue.number(matched);
            case AVERAGE:
                if (matched == 0) {
                    throw new EvaluationException(ErrorCode.DIV_ZERO);
                }
                return CellValue.number(total / matched);
            case SUM:
            default:
                return CellValue.number(total);
        }
    }
}
