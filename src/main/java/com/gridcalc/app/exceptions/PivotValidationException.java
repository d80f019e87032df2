package com.gridcalc.app.exceptions;

/**
 * Thrown when a pivot configuration references fields, sheets or ranges
 * that don't exist. Nothing is created or changed when this is raised.
 */
public class PivotValidationException extends RuntimeException {
    public PivotValidationException(String message) {
        super(message);
    }
}
