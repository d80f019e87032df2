package com.gridcalc.app.models;

import com.gridcalc.app.exceptions.InvalidCellValueException;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * What a user wrote into a cell: either a literal value or formula source text.
 * The source string is kept verbatim so that a set/get round-trips exactly.
 */
public final class CellContent {

    public static final String FORMULA_MARKER = "=";

    private static final Pattern NUMBER_PATTERN =
            Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?$");

    private static final CellContent EMPTY = new CellContent(false, "", CellValue.empty());

    private final boolean formula;
    private final String source;
    private final CellValue literal;

    private CellContent(boolean formula, String source, CellValue literal) {
        this.formula = formula;
        this.source = source;
        this.literal = literal;
    }

    public static CellContent empty() {
        return EMPTY;
    }

    public static CellContent formula(String source) {
        if (source == null || !source.startsWith(FORMULA_MARKER)) {
            throw new IllegalArgumentException("Formula source must start with " + FORMULA_MARKER);
        }
        return new CellContent(true, source, null);
    }

    public static CellContent literal(String source, CellValue value) {
        return new CellContent(false, Objects.requireNonNull(source), Objects.requireNonNull(value));
    }

    /**
     * Interprets a raw JSON input value:
     * null or "" clears the cell, numbers and booleans map directly,
     * text starting with "=" is a formula, and other text is coerced to
     * boolean / number / error marker when it looks like one. A leading
     * apostrophe forces text.
     */
    public static CellContent fromInput(Object raw) {
        if (raw == null) {
            return EMPTY;
        }
        if (raw instanceof Boolean) {
            boolean b = (Boolean) raw;
            return literal(b ? "TRUE" : "FALSE", CellValue.bool(b));
        }
        if (raw instanceof Number) {
            double d = ((Number) raw).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new InvalidCellValueException("Cell numbers must be finite, got " + raw);
            }
            return literal(CellValue.formatNumber(d), CellValue.number(d));
        }
        if (!(raw instanceof String)) {
            throw new InvalidCellValueException(
                    "Expected a string, number, boolean or null cell value, got " + raw.getClass().getSimpleName());
        }
        String text = (String) raw;
        if (text.isEmpty()) {
            return EMPTY;
        }
        if (text.startsWith(FORMULA_MARKER)) {
            return formula(text);
        }
        if (text.startsWith("'")) {
            return literal(text, CellValue.string(text.substring(1)));
        }
        String trimmed = text.trim();
        String upper = trimmed.toUpperCase(Locale.ROOT);
        if ("TRUE".equals(upper) || "FALSE".equals(upper)) {
            return literal(text, CellValue.bool("TRUE".equals(upper)));
        }
        ErrorCode error = ErrorCode.fromDisplay(trimmed);
        if (error != null) {
            return literal(text, CellValue.error(error));
        }
        if (NUMBER_PATTERN.matcher(trimmed).matches()) {
            double d = Double.parseDouble(trimmed);
            if (!Double.isInfinite(d)) {
                return literal(text, CellValue.number(d));
            }
        }
        return literal(text, CellValue.string(text));
    }

    public boolean isFormula() {
        return formula;
    }

    public boolean isEmpty() {
        return !formula && literal.isEmpty();
    }

    /**
     * The verbatim text the user supplied (formula source including the marker).
     */
    public String getSource() {
        return source;
    }

    /**
     * The literal value; null for formulas.
     */
    public CellValue getLiteral() {
        return literal;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellContent)) {
            return false;
        }
        CellContent that = (CellContent) o;
        return formula == that.formula && source.equals(that.source) && Objects.equals(literal, that.literal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(formula, source, literal);
    }

    @Override
    public String toString() {
        return source;
    }
}
