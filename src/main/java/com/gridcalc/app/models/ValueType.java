package com.gridcalc.app.models;

/**
 * Enumerates the runtime types a cell value can take:
 * EMPTY, NUMBER, STRING, BOOLEAN, ERROR.
 */
public enum ValueType {
    EMPTY,
    NUMBER,
    STRING,
    BOOLEAN,
    ERROR
}
