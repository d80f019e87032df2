package com.gridcalc.app.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Typed in-cell error values.
 * They are stored and returned like any other value, and contaminate
 * every formula that reads them.
 */
public enum ErrorCode {
    VALUE("#VALUE!"),
    DIV_ZERO("#DIV/0!"),
    REF("#REF!"),
    NAME("#NAME?"),
    NA("#N/A"),
    CIRCULAR("#CIRCULAR!");

    private final String display;

    ErrorCode(String display) {
        this.display = display;
    }

    @JsonValue
    public String getDisplay() {
        return display;
    }

    /**
     * Matches user text such as "#DIV/0!" (case-insensitive).
     * Returns null when the text is not an error code.
     */
    public static ErrorCode fromDisplay(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        for (ErrorCode code : values()) {
            if (code.display.equalsIgnoreCase(trimmed)) {
                return code;
            }
        }
        return null;
    }
}
