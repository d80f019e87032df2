package com.gridcalc.app.exceptions;

/**
 * Thrown for negative indices, unparseable A1 ranges, or range reads
 * larger than the configured cap.
 */
public class InvalidRangeException extends RuntimeException {
    public InvalidRangeException(String message) {
        super(message);
    }
}
