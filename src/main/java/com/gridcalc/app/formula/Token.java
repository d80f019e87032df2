package com.gridcalc.app.formula;

/**
 * A lexeme plus its zero-based start offset in the formula source.
 * For STRING and QUOTED_SHEET tokens the text is already unescaped.
 */
public final class Token {
    private final TokenType type;
    private final String text;
    private final int position;

    public Token(TokenType type, String text, int position) {
        this.type = type;
        this.text = text;
        this.position = position;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public int getPosition() {
        return position;
    }

    public boolean is(TokenType other) {
        return type == other;
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "end of formula" : "'" + text + "'";
    }
}
