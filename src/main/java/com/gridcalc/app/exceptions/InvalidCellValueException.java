package com.gridcalc.app.exceptions;

/**
 * Thrown when a provided cell value can't be stored in a cell
 * (e.g., a JSON object or array instead of a scalar).
 */
public class InvalidCellValueException extends RuntimeException {
    public InvalidCellValueException(String message) {
        super(message);
    }
}
