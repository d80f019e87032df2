package com.gridcalc.app.formula.functions;

import com.gridcalc.app.formula.Values;
import com.gridcalc.app.models.CellValue;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Condition used by SUMIF, COUNTIF and AVERAGEIF, such as ">=10", "&lt;&gt;done", "apple" or 5.
 * Text comparison ignores case; "*" and "?" act as wildcards in equality tests.
 */
final class Criteria {

    private enum Operator {
        EQ, NE, LT, LE, GT, GE
    }

    private static final String[] PREFIXES = {">=", "<=", "<>", ">", "<", "="};
    private static final Operator[] OPERATORS = {Operator.GE, Operator.LE, Operator.NE, Operator.GT, Operator.LT,
            Operator.EQ};

    private final Operator operator;
    private final CellValue operand;
    private final Pattern wildcard;

    private Criteria(Operator operator, CellValue operand) {
        this.operator = operator;
        this.operand = operand;
        this.wildcard = operand.isString() ? toPattern(operand.getText()) : null;
    }

    static Criteria parse(CellValue criterion) {
        Values.requireNonError(criterion);
        if (!criterion.isString()) {
            return new Criteria(Operator.EQ, criterion.isEmpty() ? CellValue.string("") : criterion);
        }
        String text = criterion.getText();
        for (int i = 0; i < PREFIXES.length; i++) {
            if (text.startsWith(PREFIXES[i])) {
                return new Criteria(OPERATORS[i], operandOf(text.substring(PREFIXES[i].length())));
            }
        }
        return new Criteria(Operator.EQ, operandOf(text));
    }

    boolean matches(CellValue candidate) {
        if (candidate.isError()) {
            return false;
        }
        switch (operator) {
            case EQ:
                return equalsOperand(candidate);
            case NE:
                return !equalsOperand(candidate);
            default:
                return ordered(candidate);
        }
    }

    private boolean equalsOperand(CellValue candidate) {
        if (operand.isNumber()) {
            if (candidate.isNumber()) {
                return candidate.getNumber() == operand.getNumber();
            }
            return candidate.isString() && Values.isNumericText(candidate.getText())
                    && Double.parseDouble(candidate.getText().trim()) == operand.getNumber();
        }
        if (operand.isBoolean()) {
            return candidate.isBoolean() && candidate.getBool() == operand.getBool();
        }
        if (operand.getText().isEmpty()) {
            return candidate.isEmpty() || (candidate.isString() && candidate.getText().isEmpty());
        }
        return candidate.isString() && wildcard.matcher(candidate.getText()).matches();
    }

    private boolean ordered(CellValue candidate) {
        int cmp;
        if (operand.isNumber() && candidate.isNumber()) {
            cmp = Double.compare(candidate.getNumber(), operand.getNumber());
        } else if (operand.isString() && candidate.isString()) {
            cmp = candidate.getText().compareToIgnoreCase(operand.getText());
        } else {
            return false;
        }
        switch (operator) {
            case LT:
                return cmp < 0;
            case LE:
                return cmp <= 0;
            case GT:
                return cmp > 0;
            case GE:
                return cmp >= 0;
            default:
                return false;
        }
    }

    private static CellValue operandOf(String text) {
        if (Values.isNumericText(text)) {
            return CellValue.number(Double.parseDouble(text.trim()));
        }
        String upper = text.trim().toUpperCase(Locale.ROOT);
        if ("TRUE".equals(upper) || "FALSE".equals(upper)) {
            return CellValue.bool("TRUE".equals(upper));
        }
        return CellValue.string(text);
    }

    private static Pattern toPattern(String text) {
        StringBuilder regex = new StringBuilder();
        for (char ch : text.toCharArray()) {
            if (ch == '*') {
                regex.append(".*");
            } else if (ch == '?') {
                regex.append('.');
            } else {
                regex.append(Pattern.quote(String.valueOf(ch)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }
}
