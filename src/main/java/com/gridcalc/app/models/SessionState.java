package com.gridcalc.app.models;

/**
 * EMPTY while nobody is connected, ACTIVE with at least one live participant.
 */
public enum SessionState {
    EMPTY,
    ACTIVE
}
