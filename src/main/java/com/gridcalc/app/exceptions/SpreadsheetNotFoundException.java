package com.gridcalc.app.exceptions;

/**
 * Thrown when attempting to access a spreadsheet ID
 * that doesn't exist in the in-memory store.
 */
public class SpreadsheetNotFoundException extends RuntimeException {
    public SpreadsheetNotFoundException(String message) {
        super(message);
    }
}
