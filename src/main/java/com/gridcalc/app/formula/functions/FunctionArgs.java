package com.gridcalc.app.formula.functions;

import com.gridcalc.app.formula.EvaluationContext;
import com.gridcalc.app.formula.EvaluationException;
import com.gridcalc.app.formula.FormulaEvaluator;
import com.gridcalc.app.formula.RangeValue;
import com.gridcalc.app.formula.Values;
import com.gridcalc.app.formula.ast.Expr;
import com.gridcalc.app.models.CellValue;
import com.gridcalc.app.models.ErrorCode;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Lazily evaluated arguments of one function call.
 * Nothing is computed until a function asks for an argument, which lets
 * IF, IFERROR, AND and OR skip branches they do not need.
 */
public final class FunctionArgs {

    /**
     * Receives each value of a flattened argument list.
     */
    @FunctionalInterface
    public interface ValueVisitor {
        void accept(CellValue value, boolean fromReference);
    }

    private final List<Expr> expressions;
    private final EvaluationContext context;
    private final FormulaEvaluator evaluator;

    public FunctionArgs(List<Expr> expressions, EvaluationContext context, FormulaEvaluator evaluator) {
        this.expressions = expressions;
        this.context = context;
        this.evaluator = evaluator;
    }

    public int size() {
        return expressions.size();
    }

    public boolean has(int index) {
        return index < expressions.size();
    }

    /**
     * Scalar value of the argument; errors are returned, not thrown.
     */
    public CellValue value(int index) {
        return evaluator.evaluateScalar(expressions.get(index), context);
    }

    public double number(int index) {
        return Values.toNumber(value(index));
    }

    public String text(int index) {
        return Values.toText(value(index));
    }

    public boolean bool(int index) {
        return Values.toBoolean(value(index));
    }

    /**
     * Truncated integer value, as used for counts and positions.
     */
    public int integer(int index) {
        double number = number(index);
        if (number > Integer.MAX_VALUE || number < Integer.MIN_VALUE) {
            throw new EvaluationException(ErrorCode.VALUE);
        }
        return (int) number;
    }

    /**
     * The argument as a block of values; a scalar becomes a 1x1 block.
     */
    public RangeValue range(int index) {
        return evaluator.evaluateRange(expressions.get(index), context);
    }

    public boolean isReference(int index) {
        Expr.Kind kind = expressions.get(index).getKind();
        return kind == Expr.Kind.CELL_REF || kind == Expr.Kind.RANGE_REF;
    }

    /**
     * Visits every argument, flattening references into their non-empty values.
     * Direct scalar arguments are visited even when empty.
     */
    public void forEachValue(ValueVisitor visitor) {
        for (int i = 0; i < expressions.size(); i++) {
            if (isReference(i)) {
                range(i).forEachNonEmpty(value -> visitor.accept(value, true));
            } else {
                visitor.accept(value(i), false);
            }
        }
    }

    /**
     * Numbers for SUM-like functions: referenced text and booleans are skipped,
     * direct arguments are coerced, and any error aborts the call.
     */
    public List<Double> numbers() {
        List<Double> result = new ArrayList<>();
        forEachValue((value, fromReference) -> {
            Values.requireNonError(value);
            if (fromReference) {
                if (value.isNumber()) {
                    result.add(value.getNumber());
                }
            } else {
                result.add(Values.toNumber(value));
            }
        });
        return result;
    }

    public Clock clock() {
        return context.clock();
    }
}
