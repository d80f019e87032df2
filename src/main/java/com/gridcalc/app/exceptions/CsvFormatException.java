package com.gridcalc.app.exceptions;

/**
 * Thrown when CSV text cannot be read, or when the requested delimiter is unusable.
 */
public class CsvFormatException extends RuntimeException {
    public CsvFormatException(String message) {
        super(message);
    }

    public CsvFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
