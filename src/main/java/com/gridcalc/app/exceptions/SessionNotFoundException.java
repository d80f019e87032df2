package com.gridcalc.app.exceptions;

/**
 * Thrown when a spreadsheet has no collaboration session to join or end.
 */
public class SessionNotFoundException extends RuntimeException {
    public SessionNotFoundException(String message) {
        super(message);
    }
}
