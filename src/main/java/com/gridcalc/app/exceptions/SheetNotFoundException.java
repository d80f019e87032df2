package com.gridcalc.app.exceptions;

/**
 * Thrown when a sheet index does not exist in the spreadsheet.
 */
public class SheetNotFoundException extends RuntimeException {
    public SheetNotFoundException(String message) {
        super(message);
    }
}
