package com.gridcalc.app.exceptions;

/**
 * Thrown when a pivot table ID is unknown to the spreadsheet.
 */
public class PivotTableNotFoundException extends RuntimeException {
    public PivotTableNotFoundException(String message) {
        super(message);
    }
}
