package com.gridcalc.app.exceptions;

/**
 * Thrown when a participant ID is unknown, has left, or has timed out.
 */
public class ParticipantNotFoundException extends RuntimeException {
    public ParticipantNotFoundException(String message) {
        super(message);
    }
}
