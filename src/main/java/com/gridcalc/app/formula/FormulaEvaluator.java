package com.gridcalc.app.formula;

import com.gridcalc.app.formula.ast.BinaryExpr;
import com.gridcalc.app.formula.ast.CellRefExpr;
import com.gridcalc.app.formula.ast.Expr;
import com.gridcalc.app.formula.ast.ExprVisitor;
import com.gridcalc.app.formula.ast.FunctionCallExpr;
import com.gridcalc.app.formula.ast.LiteralExpr;
import com.gridcalc.app.formula.ast.NameExpr;
import com.gridcalc.app.formula.ast.RangeRefExpr;
import com.gridcalc.app.formula.ast.UnaryExpr;
import com.gridcalc.app.formula.functions.FunctionArgs;
import com.gridcalc.app.formula.functions.FunctionDefinition;
import com.gridcalc.app.models.CellRange;
import com.gridcalc.app.models.CellValue;
import com.gridcalc.app.models.ErrorCode;

/**
 * Computes the value of a parsed formula against an {@link EvaluationContext}.
 *
 * Errors are values: a referenced error propagates through operators and most functions,
 * and nothing here throws for bad data. Evaluation never mutates the context.
 */
public class FormulaEvaluator {

    /**
     * Top-level evaluation: an EMPTY result (e.g. "=A1" over an empty cell) becomes 0.
     */
    public CellValue evaluate(Expr expr, EvaluationContext context) {
        CellValue result = evaluateScalar(expr, context);
        return result.isEmpty() ? CellValue.number(0d) : result;
    }

    public CellValue evaluateScalar(Expr expr, EvaluationContext context) {
        return expr.accept(new ScalarEvaluation(context));
    }

    /**
     * Evaluates an argument that may be a range. Non-reference expressions become 1x1 ranges.
     */
    public RangeValue evaluateRange(Expr expr, EvaluationContext context) {
        if (expr instanceof RangeRefExpr) {
            RangeRefExpr ref = (RangeRefExpr) expr;
            return requireRange(context.rangeValue(ref.getSheetName(), ref.getRange()));
        }
        if (expr instanceof CellRefExpr) {
            CellRefExpr ref = (CellRefExpr) expr;
            return requireRange(context.rangeValue(ref.getSheetName(), CellRange.single(ref.getAddress())));
        }
        return RangeValue.of(evaluateScalar(expr, context));
    }

    private static RangeValue requireRange(RangeValue range) {
        if (range == null) {
            throw new EvaluationException(ErrorCode.REF);
        }
        return range;
    }

    private final class ScalarEvaluation implements ExprVisitor<CellValue> {
        private final EvaluationContext context;

        ScalarEvaluation(EvaluationContext context) {
            this.context = context;
        }

        @Override
        public CellValue visitLiteral(LiteralExpr expr) {
            return expr.getValue();
        }

        @Override
        public CellValue visitCellRef(CellRefExpr expr) {
            return context.cellValue(expr.getSheetName(), expr.getAddress().getRow(), expr.getAddress().getColumn());
        }

        @Override
        public CellValue visitRangeRef(RangeRefExpr expr) {
            RangeValue range = context.rangeValue(expr.getSheetName(), expr.getRange());
            if (range == null) {
                return CellValue.error(ErrorCode.REF);
            }
            if (range.rows() == 1 && range.columns() == 1) {
                return range.get(0, 0);
            }
            return CellValue.error(ErrorCode.VALUE);
        }

        @Override
        public CellValue visitName(NameExpr expr) {
            CellValue value = context.variable(expr.getName());
            return value == null ? CellValue.error(ErrorCode.NAME) : value;
        }

        @Override
        public CellValue visitFunctionCall(FunctionCallExpr expr) {
            FunctionDefinition definition = expr.getDefinition();
            if (definition == null) {
                return CellValue.error(ErrorCode.NAME);
            }
            if (!definition.accepts(expr.getArguments().size())) {
                return CellValue.error(ErrorCode.VALUE);
            }
            try {
                CellValue result = definition.getFunction()
                        .call(new FunctionArgs(expr.getArguments(), context, FormulaEvaluator.this));
                if (result.isNumber()) {
                    return Values.number(result.getNumber());
                }
                return result;
            } catch (EvaluationException e) {
                return CellValue.error(e.getErrorCode());
            }
        }

        @Override
        public CellValue visitUnary(UnaryExpr expr) {
            CellValue operand = expr.getOperand().accept(this);
            if (operand.isError()) {
                return operand;
            }
            try {
                switch (expr.getOperator()) {
                    case NEGATE:
                        return Values.number(-Values.toNumber(operand));
                    case PERCENT:
                        return Values.number(Values.toNumber(operand) / 100d);
                    case PLUS:
                    default:
                        return operand;
                }
            } catch (EvaluationException e) {
                return CellValue.error(e.getErrorCode());
            }
        }

        @Override
        public CellValue visitBinary(BinaryExpr expr) {
            CellValue left = expr.getLeft().accept(this);
            if (left.isError()) {
                return left;
            }
            CellValue right = expr.getRight().accept(this);
            if (right.isError()) {
                return right;
            }
            try {
                return apply(expr, left, right);
            } catch (EvaluationException e) {
                return CellValue.error(e.getErrorCode());
            }
        }

        private CellValue apply(BinaryExpr expr, CellValue left, CellValue right) {
            switch (expr.getOperator()) {
                case ADD:
                    return Values.number(Values.toNumber(left) + Values.toNumber(right));
                case SUBTRACT:
                    return Values.number(Values.toNumber(left) - Values.toNumber(right));
                case MULTIPLY:
                    return Values.number(Values.toNumber(left) * Values.toNumber(right));
                case DIVIDE: {
                    double numerator = Values.toNumber(left);
                    double divisor = Values.toNumber(right);
                    if (divisor == 0d) {
                        return CellValue.error(ErrorCode.DIV_ZERO);
                    }
                    return Values.number(numerator / divisor);
                }
                case POWER: {
                    double base = Values.toNumber(left);
                    double exponent = Values.toNumber(right);
                    if (base == 0d && exponent < 0d) {
                        return CellValue.error(ErrorCode.DIV_ZERO);
                    }
                    return Values.number(Math.pow(base, exponent));
                }
                case CONCAT:
                    return CellValue.string(Values.toText(left) + Values.toText(right));
                case EQUAL:
                    return CellValue.bool(Values.compare(left, right) == 0);
                case NOT_EQUAL:
                    return CellValue.bool(Values.compare(left, right) != 0);
                case LESS:
                    return CellValue.bool(Values.compare(left, right) < 0);
                case LESS_OR_EQUAL:
                    return CellValue.bool(Values.compare(left, right) <= 0);
                case GREATER:
                    return CellValue.bool(Values.compare(left, right) > 0);
                case GREATER_OR_EQUAL:
                    return CellValue.bool(Values.compare(left, right) >= 0);
                default:
                    throw new IllegalStateException("Unhandled operator " + expr.getOperator());
            }
        }
    }
}
