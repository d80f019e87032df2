package com.gridcalc.app.formula;

import com.gridcalc.app.exceptions.FormulaParseException;
import com.gridcalc.app.formula.ast.BinaryExpr;
import com.gridcalc.app.formula.ast.BinaryOperator;
import com.gridcalc.app.formula.ast.CellRefExpr;
import com.gridcalc.app.formula.ast.Expr;
import com.gridcalc.app.formula.ast.FunctionCallExpr;
import com.gridcalc.app.formula.ast.LiteralExpr;
import com.gridcalc.app.formula.ast.NameExpr;
import com.gridcalc.app.formula.ast.RangeRefExpr;
import com.gridcalc.app.formula.ast.UnaryExpr;
import com.gridcalc.app.formula.ast.UnaryOperator;
import com.gridcalc.app.formula.functions.FunctionRegistry;
import com.gridcalc.app.models.CellAddress;
import com.gridcalc.app.models.CellRange;
import com.gridcalc.app.models.CellValue;
import com.gridcalc.app.models.ErrorCode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser producing an {@link Expr} tree.
 *
 * Precedence, lowest first: comparison, {@code &}, {@code + -}, {@code * /}, prefix {@code - +},
 * "^" (right associative), postfix "%". Function names are resolved against the
 * registry here; unknown names are kept and evaluate to #NAME?.
 *
 * Stateless and thread-safe; every call works on its own cursor.
 */
public class FormulaParser {

    private static final Pattern CELL_REF = Pattern.compile("^(\\$?)([A-Za-z]+)(\\$?)([0-9]+)$");

    private final FunctionRegistry functions;

    public FormulaParser(FunctionRegistry functions) {
        this.functions = functions;
    }

    /**
     * Parses formula source including the leading "=".
     * @throws FormulaParseException with the offending offset when the text is malformed
     */
    public Expr parse(String formula) {
        List<Token> tokens = FormulaLexer.tokenize(formula);
        Cursor cursor = new Cursor(formula, tokens);
        if (cursor.peek().is(TokenType.EOF)) {
            throw cursor.error("Empty formula", cursor.peek());
        }
        Expr expr = cursor.expression();
        Token trailing = cursor.peek();
        if (!trailing.is(TokenType.EOF)) {
            throw cursor.error("Unexpected " + trailing, trailing);
        }
        return expr;
    }

    private final class Cursor {
        private final String source;
        private final List<Token> tokens;
        private int index;

        Cursor(String source, List<Token> tokens) {
            this.source = source;
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(index);
        }

        Token peekAhead(int offset) {
            int target = Math.min(index + offset, tokens.size() - 1);
            return tokens.get(target);
        }

        Token advance() {
            Token token = tokens.get(index);
            if (!token.is(TokenType.EOF)) {
                index++;
            }
            return token;
        }

        Token expect(TokenType type, String description) {
            Token token = peek();
            if (!token.is(type)) {
                throw error("Expected " + description + " but found " + token, token);
            }
            return advance();
        }

        FormulaParseException error(String message, Token token) {
            return new FormulaParseException(message, token.getPosition(), source);
        }

        Expr expression() {
            return comparison();
        }

        Expr comparison() {
            Expr left = concatenation();
            while (true) {
                BinaryOperator op = comparisonOperator(peek().getType());
                if (op == null) {
                    return left;
                }
                Token opToken = advance();
                Expr right = concatenation();
                left = new BinaryExpr(op, left, right, opToken.getPosition());
            }
        }

        Expr concatenation() {
            Expr left = additive();
            while (peek().is(TokenType.AMPERSAND)) {
                Token opToken = advance();
                Expr right = additive();
                left = new BinaryExpr(BinaryOperator.CONCAT, left, right, opToken.getPosition());
            }
            return left;
        }

        Expr additive() {
            Expr left = multiplicative();
            while (peek().is(TokenType.PLUS) || peek().is(TokenType.MINUS)) {
                Token opToken = advance();
                BinaryOperator op = opToken.is(TokenType.PLUS) ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
                Expr right = multiplicative();
                left = new BinaryExpr(op, left, right, opToken.getPosition());
            }
            return left;
        }

        Expr multiplicative() {
            Expr left = unary();
            while (peek().is(TokenType.STAR) || peek().is(TokenType.SLASH)) {
                Token opToken = advance();
                BinaryOperator op = opToken.is(TokenType.STAR) ? BinaryOperator.MULTIPLY : BinaryOperator.DIVIDE;
                Expr right = unary();
                left = new BinaryExpr(op, left, right, opToken.getPosition());
            }
            return left;
        }

        Expr unary() {
            Token token = peek();
            if (token.is(TokenType.MINUS)) {
                advance();
                return new UnaryExpr(UnaryOperator.NEGATE, unary(), token.getPosition());
            }
            if (token.is(TokenType.PLUS)) {
                advance();
                return new UnaryExpr(UnaryOperator.PLUS, unary(), token.getPosition());
            }
            return power();
        }

        Expr power() {
            Expr base = postfix();
            if (peek().is(TokenType.CARET)) {
                Token opToken = advance();
                // right operand re-enters unary() so 2^-1 and 2^3^2 both work
                Expr exponent = unary();
                return new BinaryExpr(BinaryOperator.POWER, base, exponent, opToken.getPosition());
            }
            return base;
        }

        Expr postfix() {
            Expr expr = primary();
            while (peek().is(TokenType.PERCENT)) {
                Token opToken = advance();
                expr = new UnaryExpr(UnaryOperator.PERCENT, expr, opToken.getPosition());
            }
            return expr;
        }

        Expr primary() {
            Token token = peek();
            switch (token.getType()) {
                case NUMBER:
                    advance();
                    return numberLiteral(token);
                case STRING:
                    advance();
                    return new LiteralExpr(CellValue.string(token.getText()), token.getPosition());
                case ERROR_LITERAL:
                    advance();
                    return new LiteralExpr(CellValue.error(ErrorCode.fromDisplay(token.getText())),
                            token.getPosition());
                case LPAREN:
                    advance();
                    Expr inner = expression();
                    expect(TokenType.RPAREN, "')'");
                    return inner;
                case QUOTED_SHEET:
                    advance();
                    expect(TokenType.BANG, "'!' after sheet name");
                    return reference(token.getText(), token.getPosition());
                case CELL_REF:
                case IDENTIFIER:
                    return wordExpression(token);
                default:
                    throw error("Unexpected " + token, token);
            }
        }

        Expr wordExpression(Token token) {
            TokenType next = peekAhead(1).getType();
            if (next == TokenType.BANG) {
                if (token.getText().indexOf('$') >= 0) {
                    throw error("Invalid sheet name '" + token.getText() + "'", token);
                }
                advance();
                advance();
                return reference(token.getText(), token.getPosition());
            }
            if (next == TokenType.LPAREN) {
                if (token.getText().indexOf('$') >= 0) {
                    throw error("Invalid function name '" + token.getText() + "'", token);
                }
                return functionCall();
            }
            if (token.is(TokenType.CELL_REF)) {
                return reference(null, token.getPosition());
            }
            advance();
            String upper = token.getText().toUpperCase(Locale.ROOT);
            if ("TRUE".equals(upper)) {
                return new LiteralExpr(CellValue.bool(true), token.getPosition());
            }
            if ("FALSE".equals(upper)) {
                return new LiteralExpr(CellValue.bool(false), token.getPosition());
            }
            return new NameExpr(token.getText(), token.getPosition());
        }

        Expr functionCall() {
            Token nameToken = advance();
            String name = nameToken.getText().toUpperCase(Locale.ROOT);
            expect(TokenType.LPAREN, "'('");
            List<Expr> arguments = new ArrayList<>();
            if (!peek().is(TokenType.RPAREN)) {
                arguments.add(expression());
                while (peek().is(TokenType.COMMA)) {
                    advance();
                    arguments.add(expression());
                }
            }
            expect(TokenType.RPAREN, "')' to close " + name);
            return new FunctionCallExpr(name, functions.lookup(name), arguments, nameToken.getPosition());
        }

        /**
         * Parses "A1" or "A1:B2" at the cursor, with an already consumed sheet qualifier.
         */
        Expr reference(String sheetName, int position) {
            Token first = expect(TokenType.CELL_REF, "cell reference");
            Matcher start = matchCell(first);
            CellAddress from = toAddress(start, first);
            if (peek().is(TokenType.COLON)) {
                advance();
                Token second = expect(TokenType.CELL_REF, "cell reference after ':'");
                CellAddress to = toAddress(matchCell(second), second);
                return new RangeRefExpr(sheetName, CellRange.of(from, to), position);
            }
            boolean columnAbsolute = !start.group(1).isEmpty();
            boolean rowAbsolute = !start.group(3).isEmpty();
            return new CellRefExpr(sheetName, from, rowAbsolute, columnAbsolute, position);
        }

        Matcher matchCell(Token token) {
            Matcher matcher = CELL_REF.matcher(token.getText());
            if (!matcher.matches()) {
                throw error("Malformed cell reference '" + token.getText() + "'", token);
            }
            return matcher;
        }

        CellAddress toAddress(Matcher matcher, Token token) {
            int column = CellAddress.columnIndex(matcher.group(2));
            if (column < 0) {
                throw error("Column out of range in '" + token.getText() + "'", token);
            }
            int row;
            try {
                row = Integer.parseInt(matcher.group(4));
            } catch (NumberFormatException e) {
                throw error("Row out of range in '" + token.getText() + "'", token);
            }
            if (row < 1) {
                throw error("Row numbers start at 1 in '" + token.getText() + "'", token);
            }
            return new CellAddress(row - 1, column);
        }

        Expr numberLiteral(Token token) {
            double value = Double.parseDouble(token.getText());
            if (Double.isInfinite(value)) {
                throw error("Number out of range", token);
            }
            return new LiteralExpr(CellValue.number(value), token.getPosition());
        }

        private BinaryOperator comparisonOperator(TokenType type) {
            switch (type) {
                case EQ:
                    return BinaryOperator.EQUAL;
                case NEQ:
                    return BinaryOperator.NOT_EQUAL;
                case LT:
                    return BinaryOperator.LESS;
                case LTE:
                    return BinaryOperator.LESS_OR_EQUAL;
                case GT:
                    return BinaryOperator.GREATER;
                case GTE:
                    return BinaryOperator.GREATER_OR_EQUAL;
                default:
                    return null;
            }
        }
    }
}
