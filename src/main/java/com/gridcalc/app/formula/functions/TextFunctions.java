package com.gridcalc.app.formula.functions;

import com.gridcalc.app.formula.EvaluationException;
import com.gridcalc.app.formula.Values;
import com.gridcalc.app.models.CellValue;
import com.gridcalc.app.models.ErrorCode;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

import static com.gridcalc.app.formula.functions.FunctionDefinition.VARIADIC;

/**
 * String functions. Positions are 1-based, as users write them.
 */
final class TextFunctions {

    private TextFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register("CONCATENATE", 1, VARIADIC, args -> {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < args.size(); i++) {
                sb.append(args.text(i));
            }
            return CellValue.string(sb.toString());
        });
        registry.register("CONCAT", 1, VARIADIC, args -> {
            StringBuilder sb = new StringBuilder();
            args.forEachValue((value, fromReference) -> sb.append(Values.toText(value)));
            return CellValue.string(sb.toString());
        });
        registry.register("LEFT", 1, 2, args -> {
            String text = args.text(0);
            int count = count(args, 1);
            return CellValue.string(text.substring(0, Math.min(count, text.length())));
        });
        registry.register("RIGHT", 1, 2, args -> {
            String text = args.text(0);
            int count = count(args, 1);
            return CellValue.string(text.substring(Math.max(0, text.length() - count)));
        });
        registry.register("MID", 3, 3, args -> {
            String text = args.text(0);
            int start = args.integer(1);
            int length = args.integer(2);
            if (start < 1 || length < 0) {
                throw new EvaluationException(ErrorCode.VALUE);
            }
            if (start > text.length()) {
                return CellValue.string("");
            }
            int end = (int) Math.min((long) start - 1 + length, text.length());
            return CellValue.string(text.substring(start - 1, end));
        });
        registry.register("LEN", 1, 1, args -> CellValue.number(args.text(0).length()));
        registry.register("UPPER", 1, 1, args -> CellValue.string(args.text(0).toUpperCase(Locale.ROOT)));
        registry.register("LOWER", 1, 1, args -> CellValue.string(args.text(0).toLowerCase(Locale.ROOT)));
        registry.register("PROPER", 1, 1, args -> CellValue.string(proper(args.text(0))));
        registry.register("TRIM", 1, 1, args -> CellValue.string(args.text(0).trim().replaceAll(" +", " ")));
        registry.register("SUBSTITUTE", 3, 4, TextFunctions::substitute);
        registry.register("FIND", 2, 3, args -> find(args, true));
        registry.register("SEARCH", 2, 3, args -> find(args, false));
        registry.register("TEXT", 2, 2, TextFunctions::text);
        registry.register("VALUE", 1, 1, args -> {
            CellValue value = Values.requireNonError(args.value(0));
            if (value.isBoolean()) {
                throw new EvaluationException(ErrorCode.VALUE);
            }
            return CellValue.number(Values.toNumber(value));
        });
    }

    private static int count(FunctionArgs args, int index) {
        int count = args.has(index) ? args.integer(index) : 1;
        if (count < 0) {
            throw new EvaluationException(ErrorCode.VALUE);
        }
        return count;
    }

    private static String proper(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char ch : text.toCharArray()) {
            if (Character.isLetter(ch)) {
                sb.append(startOfWord ? Character.toUpperCase(ch) : Character.toLowerCase(ch));
                startOfWord = false;
            } else {
                sb.append(ch);
                startOfWord = true;
            }
        }
        return sb.toString();
    }

    /**
     * Replaces every occurrence, or only the n-th one when an instance number is given.
     */
    private static CellValue substitute(FunctionArgs args) {
        String text = args.text(0);
        String oldText = args.text(1);
        String newText = args.text(2);
        if (oldText.isEmpty()) {
            return CellValue.string(text);
        }
        if (!args.has(3)) {
            return CellValue.string(text.replace(oldText, newText));
        }
        int instance = args.integer(3);
        if (instance < 1) {
            throw new EvaluationException(ErrorCode.VALUE);
        }
        int from = -1;
        for (int i = 0; i < instance; i++) {
            from = text.indexOf(oldText, from + 1);
            if (from < 0) {
                return CellValue.string(text);
            }
        }
        return CellValue.string(text.substring(0, from) + newText + text.substring(from + oldText.length()));
    }

    private static CellValue find(FunctionArgs args, boolean caseSensitive) {
        String needle = args.text(0);
        String haystack = args.text(1);
        int start = args.has(2) ? args.integer(2) : 1;
        if (start < 1 || start > haystack.length() + 1) {
            throw new EvaluationException(ErrorCode.VALUE);
        }
        if (!caseSensitive) {
            needle = needle.toLowerCase(Locale.ROOT);
            haystack = haystack.toLowerCase(Locale.ROOT);
        }
        int index = haystack.indexOf(needle, start - 1);
        if (index < 0) {
            throw new EvaluationException(ErrorCode.VALUE);
        }
        return CellValue.number(index + 1);
    }

    /**
     * Formats a number with a DecimalFormat pattern such as "0.00", "#,##0" or "0%".
     * Non-numeric text is returned unchanged.
     */
    private static CellValue text(FunctionArgs args) {
        CellValue value = Values.requireNonError(args.value(0));
        String pattern = args.text(1);
        if (value.isString() && !Values.isNumericText(value.getText())) {
            return value;
        }
        double number = Values.toNumber(value);
        try {
            DecimalFormat format = new DecimalFormat(pattern, DecimalFormatSymbols.getInstance(Locale.ROOT));
            return CellValue.string(format.format(number));
        } catch (IllegalArgumentException e) {
            throw new EvaluationException(ErrorCode.VALUE);
        }
    }
}
