package com.gridcalc.app.formula.ast;

public enum UnaryOperator {
    NEGATE,
    PLUS,
    // postfix
    PERCENT
}
