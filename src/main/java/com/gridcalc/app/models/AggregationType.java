package com.gridcalc.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Enumerates pivot measure aggregations:
 * SUM, COUNT, AVERAGE, MIN, MAX.
 */
public enum AggregationType {
    SUM("Sum"),
    COUNT("Count"),
    AVERAGE("Average"),
    MIN("Min"),
    MAX("Max");

    private final String label;

    AggregationType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Allows case-insensitive JSON input.
     * For example, "sum" -> SUM, "Average" -> AVERAGE, etc.
     */
    @JsonCreator
    public static AggregationType fromValue(String value) {
        // Convert user input to uppercase, then match
        return AggregationType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
