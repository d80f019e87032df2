package com.gridcalc.app.formula;

import com.gridcalc.app.models.CellValue;
import com.gridcalc.app.models.ErrorCode;
import com.gridcalc.app.models.ValueType;

import java.util.regex.Pattern;

/**
 * Coercion and comparison rules shared by operators and functions.
 * Coercions throw {@link EvaluationException} carrying the error to return.
 */
public final class Values {

    private static final Pattern NUMERIC_TEXT =
            Pattern.compile("^\\s*[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?\\s*$");

    private Values() {
    }

    public static double toNumber(CellValue value) {
        switch (value.getType()) {
            case NUMBER:
                return value.getNumber();
            case BOOLEAN:
                return value.getBool() ? 1d : 0d;
            case EMPTY:
                return 0d;
            case STRING:
                if (NUMERIC_TEXT.matcher(value.getText()).matches()) {
                    return Double.parseDouble(value.getText().trim());
                }
                throw new EvaluationException(ErrorCode.VALUE);
            case ERROR:
            default:
                throw new EvaluationException(value.getError());
        }
    }

    public static String toText(CellValue value) {
        switch (value.getType()) {
            case NUMBER:
                return CellValue.formatNumber(value.getNumber());
            case BOOLEAN:
                return value.getBool() ? "TRUE" : "FALSE";
            case EMPTY:
                return "";
            case STRING:
                return value.getText();
            case ERROR:
            default:
                throw new EvaluationException(value.getError());
        }
    }

    public static boolean toBoolean(CellValue value) {
        switch (value.getType()) {
            case BOOLEAN:
                return value.getBool();
            case NUMBER:
                return value.getNumber() != 0d;
            case EMPTY:
                return false;
            case STRING:
                if ("TRUE".equalsIgnoreCase(value.getText())) {
                    return true;
                }
                if ("FALSE".equalsIgnoreCase(value.getText())) {
                    return false;
                }
                throw new EvaluationException(ErrorCode.VALUE);
            case ERROR:
            default:
                throw new EvaluationException(value.getError());
        }
    }

    /**
     * Throws when the value is an error, otherwise returns it unchanged.
     */
    public static CellValue requireNonError(CellValue value) {
        if (value.isError()) {
            throw new EvaluationException(value.getError());
        }
        return value;
    }

    /**
     * Orders two non-error values: numbers before text before booleans,
     * text compared case-insensitively. EMPTY takes the zero value of the other side's type.
     */
    public static int compare(CellValue left, CellValue right) {
        CellValue a = left.isEmpty() ? zeroLike(right) : left;
        CellValue b = right.isEmpty() ? zeroLike(left) : right;
        int rankA = rank(a.getType());
        int rankB = rank(b.getType());
        if (rankA != rankB) {
            return Integer.compare(rankA, rankB);
        }
        switch (a.getType()) {
            case NUMBER:
                return Double.compare(a.getNumber(), b.getNumber());
            case STRING:
                return a.getText().compareToIgnoreCase(b.getText());
            case BOOLEAN:
                return Boolean.compare(a.getBool(), b.getBool());
            default:
                return 0;
        }
    }

    /**
     * Equality as used by lookups and criteria: same type rank and compare() == 0.
     */
    public static boolean looselyEqual(CellValue left, CellValue right) {
        if (left.isError() || right.isError()) {
            return false;
        }
        return compare(left, right) == 0;
    }

    /**
     * Wraps a numeric result, turning NaN and infinities into #VALUE!.
     */
    public static CellValue number(double result) {
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            return CellValue.error(ErrorCode.VALUE);
        }
        return CellValue.number(result);
    }

    public static boolean isNumericText(String text) {
        return NUMERIC_TEXT.matcher(text).matches();
    }

    private static CellValue zeroLike(CellValue other) {
        switch (other.getType()) {
            case STRING:
                return CellValue.string("");
            case BOOLEAN:
                return CellValue.bool(false);
            default:
                return CellValue.number(0d);
        }
    }

    private static int rank(ValueType type) {
        switch (type) {
            case NUMBER:
            case EMPTY:
                return 0;
            case STRING:
                return 1;
            case BOOLEAN:
                return 2;
            default:
                return 3;
        }
    }
}
