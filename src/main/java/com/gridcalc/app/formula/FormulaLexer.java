package com.gridcalc.app.formula;

import com.gridcalc.app.exceptions.FormulaParseException;
import com.gridcalc.app.models.CellContent;
import com.gridcalc.app.models.ErrorCode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits formula source (including the leading "=") into tokens.
 * Positions are offsets into the full source string.
 */
public final class FormulaLexer {

    private static final Pattern CELL_REF = Pattern.compile("^\\$?[A-Za-z]+\\$?[0-9]+$");
    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_.]*$");

    private final String source;
    private int pos;

    private FormulaLexer(String source) {
        this.source = source;
    }

    public static List<Token> tokenize(String source) {
        if (source == null || !source.startsWith(CellContent.FORMULA_MARKER)) {
            throw new FormulaParseException("Formula must start with '" + CellContent.FORMULA_MARKER + "'", 0,
                    source);
        }
        FormulaLexer lexer = new FormulaLexer(source);
        lexer.pos = CellContent.FORMULA_MARKER.length();
        return lexer.run();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.EOF, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        char ch = source.charAt(pos);
        int start = pos;

        if (Character.isDigit(ch) || (ch == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
            return readNumber();
        }
        if (ch == '"') {
            return readString();
        }
        if (ch == '\'') {
            return readQuotedSheet();
        }
        if (ch == '#') {
            return readErrorLiteral();
        }
        if (Character.isLetter(ch) || ch == '_' || ch == '$') {
            return readWord();
        }

        pos++;
        switch (ch) {
            case '+':
                return new Token(TokenType.PLUS, "+", start);
            case '-':
                return new Token(TokenType.MINUS, "-", start);
            case '*':
                return new Token(TokenType.STAR, "*", start);
            case '/':
                return new Token(TokenType.SLASH, "/", start);
            case '^':
                return new Token(TokenType.CARET, "^", start);
            case '&':
                return new Token(TokenType.AMPERSAND, "&", start);
            case '%':
                return new Token(TokenType.PERCENT, "%", start);
            case ',':
                return new Token(TokenType.COMMA, ",", start);
            case ':':
                return new Token(TokenType.COLON, ":", start);
            case '!':
                return new Token(TokenType.BANG, "!", start);
            case '(':
                return new Token(TokenType.LPAREN, "(", start);
            case ')':
                return new Token(TokenType.RPAREN, ")", start);
            case '=':
                return new Token(TokenType.EQ, "=", start);
            case '<':
                if (peek('=')) {
                    pos++;
                    return new Token(TokenType.LTE, "<=", start);
                }
                if (peek('>')) {
                    pos++;
                    return new Token(TokenType.NEQ, "<>", start);
                }
                return new Token(TokenType.LT, "<", start);
            case '>':
                if (peek('=')) {
                    pos++;
                    return new Token(TokenType.GTE, ">=", start);
                }
                return new Token(TokenType.GT, ">", start);
            default:
                throw new FormulaParseException("Unexpected character '" + ch + "'", start, source);
        }
    }

    private Token readNumber() {
        int start = pos;
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos < source.length() && source.charAt(pos) == '.') {
            pos++;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    pos++;
                }
            } else {
                throw new FormulaParseException("Malformed number exponent", mark, source);
            }
        }
        return new Token(TokenType.NUMBER, source.substring(start, pos), start);
    }

    private Token readString() {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char ch = source.charAt(pos);
            if (ch == '"') {
                if (peekAt(pos + 1, '"')) {
                    sb.append('"');
                    pos += 2;
                    continue;
                }
                pos++;
                return new Token(TokenType.STRING, sb.toString(), start);
            }
            sb.append(ch);
            pos++;
        }
        throw new FormulaParseException("Unterminated string literal", start, source);
    }

    private Token readQuotedSheet() {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char ch = source.charAt(pos);
            if (ch == '\'') {
                if (peekAt(pos + 1, '\'')) {
                    sb.append('\'');
                    pos += 2;
                    continue;
                }
                pos++;
                if (sb.length() == 0) {
                    throw new FormulaParseException("Empty sheet name", start, source);
                }
                return new Token(TokenType.QUOTED_SHEET, sb.toString(), start);
            }
            sb.append(ch);
            pos++;
        }
        throw new FormulaParseException("Unterminated quoted sheet name", start, source);
    }

    private Token readErrorLiteral() {
        int start = pos;
        for (ErrorCode code : ErrorCode.values()) {
            String display = code.getDisplay();
            if (source.regionMatches(true, pos, display, 0, display.length())) {
                pos += display.length();
                return new Token(TokenType.ERROR_LITERAL, display, start);
            }
        }
        throw new FormulaParseException("Unknown error literal", start, source);
    }

    private Token readWord() {
        int start = pos;
        while (pos < source.length()) {
            char ch = source.charAt(pos);
            if (Character.isLetterOrDigit(ch) || ch == '_' || ch == '.' || ch == '$') {
                pos++;
            } else {
                break;
            }
        }
        String word = source.substring(start, pos);
        if (CELL_REF.matcher(word).matches()) {
            return new Token(TokenType.CELL_REF, word, start);
        }
        if (IDENTIFIER.matcher(word).matches()) {
            return new Token(TokenType.IDENTIFIER, word, start);
        }
        throw new FormulaParseException("Malformed reference or name '" + word + "'", start, source);
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private boolean peek(char expected) {
        return peekAt(pos, expected);
    }

    private boolean peekAt(int index, char expected) {
        return index < source.length() && source.charAt(index) == expected;
    }
}
