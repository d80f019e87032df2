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
import com.gridcalc.app.models.CellRange;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks an AST and gathers the distinct references and function names it contains,
 * in the order they appear.
 */
public final class ReferenceCollector implements ExprVisitor<Void> {

    private final Set<FormulaReference> references = new LinkedHashSet<>();
    private final Set<String> functionNames = new LinkedHashSet<>();

    private ReferenceCollector() {
    }

    public static List<FormulaReference> references(Expr expr) {
        ReferenceCollector collector = new ReferenceCollector();
        expr.accept(collector);
        return new ArrayList<>(collector.references);
    }

    public static List<String> functionNames(Expr expr) {
        ReferenceCollector collector = new ReferenceCollector();
        expr.accept(collector);
        return new ArrayList<>(collector.functionNames);
    }

    @Override
    public Void visitLiteral(LiteralExpr expr) {
        return null;
    }

    @Override
    public Void visitCellRef(CellRefExpr expr) {
        references.add(new FormulaReference(expr.getSheetName(), CellRange.single(expr.getAddress())));
        return null;
    }

    @Override
    public Void visitRangeRef(RangeRefExpr expr) {
        references.add(new FormulaReference(expr.getSheetName(), expr.getRange()));
        return null;
    }

    @Override
    public Void visitName(NameExpr expr) {
        return null;
    }

    @Override
    public Void visitFunctionCall(FunctionCallExpr expr) {
        functionNames.add(expr.getName());
        for (Expr argument : expr.getArguments()) {
            argument.accept(this);
        }
        return null;
    }

    @Override
    public Void visitUnary(UnaryExpr expr) {
        expr.getOperand().accept(this);
        return null;
    }

    @Override
    public Void visitBinary(BinaryExpr expr) {
        expr.getLeft().accept(this);
        expr.getRight().accept(this);
        return null;
    }
}
