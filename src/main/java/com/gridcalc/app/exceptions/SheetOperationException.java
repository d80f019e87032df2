package com.gridcalc.app.exceptions;

/**
 * Thrown when a sheet cannot be added, renamed or deleted:
 * a duplicate or blank name, or removing the last remaining sheet.
 */
public class SheetOperationException extends RuntimeException {
    public SheetOperationException(String message) {
        super(message);
    }
}
