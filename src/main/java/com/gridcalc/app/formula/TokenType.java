package com.gridcalc.app.formula;

/**
 * Lexical categories of formula text.
 */
public enum TokenType {
    NUMBER,
    STRING,
    ERROR_LITERAL,
    CELL_REF,
    IDENTIFIER,
    QUOTED_SHEET,
    BANG,
    COLON,
    COMMA,
    LPAREN,
    RPAREN,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    CARET,
    AMPERSAND,
    PERCENT,
    EQ,
    NEQ,
    LT,
    LTE,
    GT,
    GTE,
    EOF
}
