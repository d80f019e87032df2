package com.gridcalc.app.models;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Objects;

/**
 * Immutable typed value held by (or computed for) a cell.
 * Exactly one of number / text / bool / error is meaningful, depending on the type.
 */
@JsonAutoDetect(
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        fieldVisibility = JsonAutoDetect.Visibility.NONE
)
public final class CellValue {

    private static final CellValue EMPTY = new CellValue(ValueType.EMPTY, 0d, null, false, null);
    private static final CellValue TRUE = new CellValue(ValueType.BOOLEAN, 0d, null, true, null);
    private static final CellValue FALSE = new CellValue(ValueType.BOOLEAN, 0d, null, false, null);

    private final ValueType type;
    private final double number;
    private final String text;
    private final boolean bool;
    private final ErrorCode error;

    private CellValue(ValueType type, double number, String text, boolean bool, ErrorCode error) {
        this.type = type;
        this.number = number;
        this.text = text;
        this.bool = bool;
        this.error = error;
    }

    public static CellValue empty() {
        return EMPTY;
    }

    public static CellValue number(double value) {
        return new CellValue(ValueType.NUMBER, value, null, false, null);
    }

    public static CellValue string(String value) {
        return new CellValue(ValueType.STRING, 0d, Objects.requireNonNull(value), false, null);
    }

    public static CellValue bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static CellValue error(ErrorCode code) {
        return new CellValue(ValueType.ERROR, 0d, null, false, Objects.requireNonNull(code));
    }

    @JsonProperty("type")
    public ValueType getType() {
        return type;
    }

    public boolean isEmpty() {
        return type == ValueType.EMPTY;
    }

    public boolean isNumber() {
        return type == ValueType.NUMBER;
    }

    public boolean isString() {
        return type == ValueType.STRING;
    }

    public boolean isBoolean() {
        return type == ValueType.BOOLEAN;
    }

    public boolean isError() {
        return type == ValueType.ERROR;
    }

    public double getNumber() {
        return number;
    }

    public String getText() {
        return text;
    }

    public boolean getBool() {
        return bool;
    }

    public ErrorCode getError() {
        return error;
    }

    /**
     * The plain Java value used in JSON responses:
     * Double, String, Boolean, the error display string, or null.
     */
    @JsonProperty("value")
    public Object getValue() {
        switch (type) {
            case NUMBER:
                return number;
            case STRING:
                return text;
            case BOOLEAN:
                return bool;
            case ERROR:
                return error.getDisplay();
            default:
                return null;
        }
    }

    @JsonProperty("formatted")
    public String getFormatted() {
        switch (type) {
            case NUMBER:
                return formatNumber(number);
            case STRING:
                return text;
            case BOOLEAN:
                return bool ? "TRUE" : "FALSE";
            case ERROR:
                return error.getDisplay();
            default:
                return "";
        }
    }

    /**
     * Integral values print without a fraction, everything else with at most
     * 15 significant digits and no trailing zeros.
     */
    public static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return new BigDecimal(value)
                .round(new MathContext(15))
                .stripTrailingZeros()
                .toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue other = (CellValue) o;
        if (type != other.type) {
            return false;
        }
        switch (type) {
            case NUMBER:
                return Double.compare(number, other.number) == 0;
            case STRING:
                return text.equals(other.text);
            case BOOLEAN:
                return bool == other.bool;
            case ERROR:
                return error == other.error;
            default:
                return true;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, number, text, bool, error);
    }

    @Override
    public String toString() {
        return type + "(" + getFormatted() + ")";
    }
}
