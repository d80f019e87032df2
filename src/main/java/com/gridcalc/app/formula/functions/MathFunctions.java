package com.gridcalc.app.formula.functions;

import com.gridcalc.app.formula.EvaluationException;
import com.gridcalc.app.models.CellValue;
import com.gridcalc.app.models.ErrorCode;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

import static com.gridcalc.app.formula.functions.FunctionDefinition.VARIADIC;

/**
 * Arithmetic functions: SUM, ABS, SQRT, POWER, LOG, LN, EXP, ROUND, FLOOR, CEILING, MOD, PI, PRODUCT, INT.
 */
final class MathFunctions {

    private MathFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register("SUM", 1, VARIADIC, MathFunctions::sum);
        registry.register("PRODUCT", 1, VARIADIC, MathFunctions::product);
        registry.register("ABS", 1, 1, args -> CellValue.number(Math.abs(args.number(0))));
        registry.register("SQRT", 1, 1, args -> {
            double x = args.number(0);
            if (x < 0) {
                throw new EvaluationException(ErrorCode.VALUE);
            }
            return CellValue.number(Math.sqrt(x));
        });
        registry.register("POWER", 2, 2, args -> {
            double base = args.number(0);
            double exponent = args.number(1);
            if (base == 0d && exponent < 0d) {
                throw new EvaluationException(ErrorCode.DIV_ZERO);
            }
            return CellValue.number(Math.pow(base, exponent));
        });
        registry.register("LOG", 1, 2, MathFunctions::log);
        registry.register("LN", 1, 1, args -> {
            double x = args.number(0);
            if (x <= 0) {
                throw new EvaluationException(ErrorCode.VALUE);
            }
            return CellValue.number(Math.log(x));
        });
        registry.register("EXP", 1, 1, args -> CellValue.number(Math.exp(args.number(0))));
        registry.register("ROUND", 1, 2, MathFunctions::round);
        registry.register("FLOOR", 1, 2, args -> roundToMultiple(args, false));
        registry.register("CEILING", 1, 2, args -> roundToMultiple(args, true));
        registry.register("MOD", 2, 2, args -> {
            double n = args.number(0);
            double d = args.number(1);
            if (d == 0d) {
                throw new EvaluationException(ErrorCode.DIV_ZERO);
            }
            // result takes the sign of the divisor
            return CellValue.number(n - d * Math.floor(n / d));
        });
        registry.register("PI", 0, 0, args -> CellValue.number(Math.PI));
        registry.register("INT", 1, 1, args -> CellValue.number(Math.floor(args.number(0))));
    }

    private static CellValue sum(FunctionArgs args) {
        double total = 0d;
        for (double n : args.numbers()) {
            total += n;
        }
        return CellValue.number(total);
    }

    private static CellValue product(FunctionArgs args) {
        List<Double> numbers = args.numbers();
        if (numbers.isEmpty()) {
            return CellValue.number(0d);
        }
        double result = 1d;
        for (double n : numbers) {
            result *= n;
        }
        return CellValue.number(result);
    }

    private static CellValue log(FunctionArgs args) {
        double x = args.number(0);
        double base = args.has(1) ? args.number(1) : 10d;
        if (x <= 0 || base <= 0) {
            throw new EvaluationException(ErrorCode.VALUE);
        }
        if (base == 1d) {
            throw new EvaluationException(ErrorCode.DIV_ZERO);
        }
        return CellValue.number(Math.log(x) / Math.log(base));
    }

    private static CellValue round(FunctionArgs args) {
        double x = args.number(0);
        int digits = args.has(1) ? args.integer(1) : 0;
        if (Double.isNaN(x) || Double.isInfinite(x)) {
            throw new EvaluationException(ErrorCode.VALUE);
        }
        BigDecimal rounded = BigDecimal.valueOf(x).setScale(digits, RoundingMode.HALF_UP);
        return CellValue.number(rounded.doubleValue());
    }

    private static CellValue roundToMultiple(FunctionArgs args, boolean up) {
        double x = args.number(0);
        double significance = args.has(1) ? args.number(1) : 1d;
        if (significance == 0d) {
            if (up) {
                return CellValue.number(0d);
            }
            throw new EvaluationException(ErrorCode.DIV_ZERO);
        }
        if (x > 0 && significance < 0) {
            throw new EvaluationException(ErrorCode.VALUE);
        }
        // decimal arithmetic so that FLOOR(2.5, 0.1) stays 2.5
        BigDecimal step = BigDecimal.valueOf(significance);
        BigDecimal quotient = BigDecimal.valueOf(x).divide(step, MathContext.DECIMAL64);
        BigDecimal steps = quotient.setScale(0, up ? RoundingMode.CEILING : RoundingMode.FLOOR);
        return CellValue.number(steps.multiply(step).doubleValue());
    }
}
